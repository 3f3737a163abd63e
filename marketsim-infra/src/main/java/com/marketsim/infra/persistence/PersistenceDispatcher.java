package com.marketsim.infra.persistence;

import com.lmax.disruptor.BlockingWaitStrategy;
import com.lmax.disruptor.ExceptionHandler;
import com.lmax.disruptor.InsufficientCapacityException;
import com.lmax.disruptor.RingBuffer;
import com.lmax.disruptor.TimeoutException;
import com.lmax.disruptor.dsl.Disruptor;
import com.lmax.disruptor.dsl.ProducerType;
import com.lmax.disruptor.util.DaemonThreadFactory;
import com.marketsim.api.Fill;
import com.marketsim.api.PersistenceSink;
import com.marketsim.core.TickResult;
import com.marketsim.infra.metrics.SimulationMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * <b>Asynchronous persistence.</b>
 * <p>
 * The tick thread publishes each tick's records into a bounded Disruptor
 * ring; a single daemon writer thread drains the ring into the
 * {@link PersistenceSink}. Publishing never blocks: when the ring is full the
 * record is dropped and counted.
 * </p>
 *
 * <pre>
 * [Tick thread] --tryNext--> (Ring Buffer) --> [Writer thread] --> PersistenceSink
 *                   |
 *                   +-- full: drop, count
 * </pre>
 */
public class PersistenceDispatcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(PersistenceDispatcher.class);

    private static final long SHUTDOWN_TIMEOUT_MS = 5000;

    private final PersistenceSink sink;
    private final SimulationMetrics metrics;
    private final Disruptor<PersistenceEvent> disruptor;
    private final RingBuffer<PersistenceEvent> ringBuffer;
    private final PersistenceEventHandler handler;
    private final AtomicLong dropped = new AtomicLong();
    private volatile boolean closed;

    public PersistenceDispatcher(PersistenceSink sink, int ringSize, SimulationMetrics metrics) {
        this.sink = sink;
        this.metrics = metrics;
        this.handler = new PersistenceEventHandler(sink, metrics);
        this.disruptor = new Disruptor<>(
                PersistenceEvent.FACTORY,
                ringSize,
                DaemonThreadFactory.INSTANCE,
                ProducerType.MULTI,
                new BlockingWaitStrategy());
        this.disruptor.handleEventsWith(handler);
        this.disruptor.setDefaultExceptionHandler(new ExceptionHandler<PersistenceEvent>() {
            @Override
            public void handleEventException(Throwable ex, long sequence, PersistenceEvent event) {
                log.error("Unexpected error persisting sequence {}", sequence, ex);
            }

            @Override
            public void handleOnStartException(Throwable ex) {
                log.error("Persistence writer failed to start", ex);
            }

            @Override
            public void handleOnShutdownException(Throwable ex) {
                log.error("Persistence writer failed to shut down", ex);
            }
        });
        this.ringBuffer = disruptor.start();
        log.info("Persistence ring started: size={}, sink={}", ringSize, sink.getClass().getSimpleName());
    }

    /**
     * Queues every record of one tick: fills in execution order, then the
     * market state, the analytics row and the snapshot if there is one.
     *
     * @return number of records dropped because the ring was full
     */
    public int publish(TickResult result) {
        if (closed) {
            return 0;
        }
        int drops = 0;
        for (Fill fill : result.fills()) {
            if (!tryPublish(PersistenceEvent.Type.FILL, result, fill)) {
                drops++;
            }
        }
        if (!tryPublish(PersistenceEvent.Type.MARKET_STATE, result, null)) {
            drops++;
        }
        if (!tryPublish(PersistenceEvent.Type.ANALYTICS, result, null)) {
            drops++;
        }
        if (result.hasSnapshot() && !tryPublish(PersistenceEvent.Type.SNAPSHOT, result, null)) {
            drops++;
        }
        return drops;
    }

    private boolean tryPublish(PersistenceEvent.Type type, TickResult result, Fill fill) {
        long sequence;
        try {
            sequence = ringBuffer.tryNext();
        } catch (InsufficientCapacityException e) {
            long count = dropped.incrementAndGet();
            metrics.recordDroppedWrite();
            if (count == 1) {
                log.warn("Persistence ring full, dropping records");
            }
            return false;
        }
        try {
            PersistenceEvent event = ringBuffer.get(sequence);
            event.type = type;
            event.symbol = result.symbol();
            event.timestamp = result.timestamp();
            switch (type) {
                case FILL -> event.fill = fill;
                case MARKET_STATE -> event.marketState = result.marketState();
                case ANALYTICS -> event.analytics = result.analytics();
                case SNAPSHOT -> event.snapshot = result.snapshot();
            }
        } finally {
            ringBuffer.publish(sequence);
        }
        return true;
    }

    /**
     * Records lost to a full ring.
     */
    public long droppedWrites() {
        return dropped.get();
    }

    /**
     * Records the sink threw on.
     */
    public long sinkFailures() {
        return handler.failures();
    }

    public long writtenRecords() {
        return handler.written();
    }

    public long remainingCapacity() {
        return ringBuffer.remainingCapacity();
    }

    /**
     * Drains what is queued, stops the writer thread, then closes the sink.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            disruptor.shutdown(SHUTDOWN_TIMEOUT_MS, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.warn("Persistence ring did not drain within {} ms, halting writer", SHUTDOWN_TIMEOUT_MS);
            disruptor.halt();
        }
        sink.close();
        log.info("Persistence stopped: written={}, dropped={}, sinkFailures={}", handler.written(),
            dropped.get(), handler.failures());
    }
}
