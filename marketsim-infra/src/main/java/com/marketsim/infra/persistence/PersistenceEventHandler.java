package com.marketsim.infra.persistence;

import com.lmax.disruptor.EventHandler;
import com.marketsim.api.PersistenceSink;
import com.marketsim.infra.metrics.SimulationMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * The consumer of the persistence ring. Hands each slot to the sink on the
 * writer thread. A sink failure is counted and logged, never propagated, so
 * the ring keeps draining.
 */
public class PersistenceEventHandler implements EventHandler<PersistenceEvent> {

    private static final Logger log = LoggerFactory.getLogger(PersistenceEventHandler.class);

    // Log the first failure, then one in every LOG_EVERY
    private static final long LOG_EVERY = 1000;

    private final PersistenceSink sink;
    private final SimulationMetrics metrics;
    private final AtomicLong failures = new AtomicLong();
    private final AtomicLong written = new AtomicLong();

    public PersistenceEventHandler(PersistenceSink sink, SimulationMetrics metrics) {
        this.sink = sink;
        this.metrics = metrics;
    }

    @Override
    public void onEvent(PersistenceEvent event, long sequence, boolean endOfBatch) {
        try {
            switch (event.type) {
                case FILL -> sink.writeFill(event.fill);
                case MARKET_STATE -> sink.writeMarketState(event.symbol, event.marketState, event.timestamp);
                case ANALYTICS -> sink.writeAnalytics(event.symbol, event.analytics, event.timestamp);
                case SNAPSHOT -> sink.writeOrderBookSnapshot(event.symbol, event.snapshot, event.timestamp);
            }
            written.incrementAndGet();
        } catch (RuntimeException e) {
            long count = failures.incrementAndGet();
            metrics.recordSinkFailure();
            if (count == 1 || count % LOG_EVERY == 0) {
                log.warn("Persistence sink failed on {} for {} at sequence {} ({} failures so far)", event.type,
                    event.symbol, sequence, count, e);
            }
        } finally {
            event.reset();
        }
    }

    public long failures() {
        return failures.get();
    }

    public long written() {
        return written.get();
    }
}
