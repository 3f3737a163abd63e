package com.marketsim.infra.persistence;

import com.marketsim.api.AnalyticsRow;
import com.marketsim.api.BookLevel;
import com.marketsim.api.BookSnapshot;
import com.marketsim.api.Fill;
import com.marketsim.api.MarketState;
import com.marketsim.api.Side;
import com.marketsim.core.TickResult;
import com.marketsim.infra.RecordingSink;
import com.marketsim.infra.metrics.SimulationMetrics;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

public class PersistenceDispatcherTest {

    private static TickResult tick(long tick, List<Fill> fills, BookSnapshot snapshot) {
        long ts = 1000 + tick * 100;
        MarketState state = new MarketState("X", ts, 10.0, 10.0, 0, 10_000, Double.NaN, 0.0, 0.02);
        AnalyticsRow row = new AnalyticsRow("X", ts, 0.02, 10.0, 0.0, 100, 100, Double.NaN, Double.NaN,
                Double.NaN, Double.NaN, 0);
        return new TickResult("X", tick, ts, fills, state, row, snapshot);
    }

    private static Fill fill(long id) {
        return new Fill(id, 100 + id, 200 + id, "X", Side.BUY, 10.0, 5, 1000);
    }

    @Test
    public void testRecordsReachTheSinkInOrder() {
        RecordingSink sink = new RecordingSink();
        SimulationMetrics metrics = new SimulationMetrics(new CollectorRegistry());
        PersistenceDispatcher dispatcher = new PersistenceDispatcher(sink, 64, metrics);

        BookSnapshot snapshot = new BookSnapshot("X", 1100, List.of(new BookLevel(9.99, 10, 1)),
                List.of(new BookLevel(10.01, 12, 2)));
        assertEquals(0, dispatcher.publish(tick(1, List.of(fill(1), fill(2)), snapshot)));
        assertEquals(0, dispatcher.publish(tick(2, List.of(fill(3)), null)));
        dispatcher.close();

        assertEquals(List.of(1L, 2L, 3L), sink.fills.stream().map(Fill::fillId).toList());
        assertEquals(2, sink.marketStates.size());
        assertEquals(2, sink.analytics.size());
        assertEquals(List.of(snapshot), sink.snapshots);
        assertEquals(8, dispatcher.writtenRecords());
        assertTrue(sink.closed.get());
    }

    @Test
    public void testFullRingDropsAndCounts() throws InterruptedException {
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        RecordingSink blocking = new RecordingSink() {
            @Override
            public void writeMarketState(String symbol, MarketState state, long timestamp) {
                entered.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                super.writeMarketState(symbol, state, timestamp);
            }
        };
        SimulationMetrics metrics = new SimulationMetrics(new CollectorRegistry());
        PersistenceDispatcher dispatcher = new PersistenceDispatcher(blocking, 4, metrics);

        int published = 0;
        int dropped = dispatcher.publish(tick(1, List.of(), null));
        published += 2;
        assertTrue(entered.await(5, TimeUnit.SECONDS));
        for (int i = 2; i <= 10; i++) {
            dropped += dispatcher.publish(tick(i, List.of(), null));
            published += 2;
        }
        release.countDown();
        dispatcher.close();

        assertTrue(dropped > 0, "a blocked writer must overflow a ring of 4");
        assertEquals(dropped, dispatcher.droppedWrites());
        assertEquals(dropped, (long) metrics.droppedWrites());
        assertEquals(published, dispatcher.writtenRecords() + dispatcher.droppedWrites());
        assertEquals(0, dispatcher.sinkFailures());
    }

    @Test
    public void testSinkExceptionsAreCounted() {
        RecordingSink failing = new RecordingSink() {
            @Override
            public void writeFill(Fill fill) {
                throw new IllegalStateException("rejected by store");
            }
        };
        SimulationMetrics metrics = new SimulationMetrics(new CollectorRegistry());
        PersistenceDispatcher dispatcher = new PersistenceDispatcher(failing, 16, metrics);

        dispatcher.publish(tick(1, List.of(fill(1), fill(2), fill(3)), null));
        dispatcher.close();

        assertEquals(3, dispatcher.sinkFailures());
        assertEquals(3.0, metrics.sinkFailures());
        assertEquals(2, dispatcher.writtenRecords());
        assertEquals(1, failing.marketStates.size());
        assertEquals(1, failing.analytics.size());
    }

    @Test
    public void testPublishAfterCloseIsIgnored() {
        RecordingSink sink = new RecordingSink();
        PersistenceDispatcher dispatcher = new PersistenceDispatcher(sink, 16,
                new SimulationMetrics(new CollectorRegistry()));
        dispatcher.close();
        dispatcher.close();

        assertEquals(0, dispatcher.publish(tick(1, List.of(fill(1)), null)));
        assertTrue(sink.fills.isEmpty());
    }
}
