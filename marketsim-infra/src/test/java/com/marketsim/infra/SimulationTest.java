package com.marketsim.infra;

import com.marketsim.api.MarketState;
import com.marketsim.api.OrderKind;
import com.marketsim.api.OrderStatus;
import com.marketsim.api.OrderView;
import com.marketsim.api.RejectReason;
import com.marketsim.api.Side;
import com.marketsim.api.SimulationNotRunningException;
import com.marketsim.api.SimulationState;
import com.marketsim.api.SimulationStatus;
import com.marketsim.api.SubmitResult;
import com.marketsim.api.UnknownSymbolException;
import com.marketsim.infra.config.SimulationConfig;
import com.marketsim.infra.metrics.SimulationMetrics;
import io.prometheus.client.CollectorRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

public class SimulationTest {

    private final List<Simulation> created = new ArrayList<>();

    @AfterEach
    void tearDown() {
        created.forEach(Simulation::stop);
    }

    private static SimulationConfig.Builder smallConfig() {
        return SimulationConfig.builder()
                .symbols("AAA:100;BBB:50")
                .tickIntervalMs(10)
                .latencyMs(2)
                .startEpochMs(1_000_000L)
                .ringSize(1 << 16)
                .snapshotEveryTicks(5)
                .snapshotDepth(3);
    }

    private Simulation simulation(SimulationConfig config, RecordingSink sink) {
        Simulation simulation = new Simulation(config, sink, new SimulationMetrics(new CollectorRegistry()));
        created.add(simulation);
        return simulation;
    }

    private static void advance(Simulation simulation, int ticks) {
        for (int i = 0; i < ticks; i++) {
            simulation.advanceTick();
        }
    }

    private static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000;
        while (!condition.getAsBoolean()) {
            assertTrue(System.currentTimeMillis() < deadline, "condition not met within 5s");
            Thread.sleep(5);
        }
    }

    @Test
    public void testLifecycleTransitions() throws InterruptedException {
        Simulation simulation = simulation(smallConfig().build(), null);
        assertEquals(SimulationState.INITIALIZED, simulation.state());
        assertEquals(0, simulation.currentTick());

        simulation.start();
        assertEquals(SimulationState.RUNNING, simulation.state());
        awaitCondition(() -> simulation.currentTick() >= 3);

        simulation.pause();
        assertEquals(SimulationState.PAUSED, simulation.state());
        long pausedAt = simulation.currentTick();
        Thread.sleep(50);
        assertEquals(pausedAt, simulation.currentTick(), "no ticks while paused");

        simulation.advanceTick();
        assertEquals(pausedAt + 1, simulation.currentTick());

        simulation.resume();
        assertEquals(SimulationState.RUNNING, simulation.state());
        awaitCondition(() -> simulation.currentTick() >= pausedAt + 3);

        simulation.stop();
        assertEquals(SimulationState.STOPPED, simulation.state());
    }

    private static long liveTickLoops() {
        return Thread.getAllStackTraces().keySet().stream()
                .filter(t -> t.getName().startsWith("marketsim-tick-loop") && t.isAlive())
                .count();
    }

    @Test
    public void testConcurrentPauseAndResumeKeepOneTickLoop() throws Exception {
        Simulation simulation = simulation(smallConfig().tickIntervalMs(20).build(), null);
        simulation.start();

        ExecutorService callers = Executors.newFixedThreadPool(2);
        try {
            for (int i = 0; i < 25; i++) {
                Future<?> pausing = callers.submit(simulation::pause);
                Future<?> resuming = callers.submit(simulation::resume);
                pausing.get(5, TimeUnit.SECONDS);
                resuming.get(5, TimeUnit.SECONDS);
                simulation.resume();
            }
        } finally {
            callers.shutdownNow();
        }

        assertEquals(SimulationState.RUNNING, simulation.state());
        awaitCondition(() -> liveTickLoops() == 1);

        long before = simulation.currentTick();
        Thread.sleep(400);
        long ticked = simulation.currentTick() - before;
        assertTrue(ticked <= 400 / 20 + 3, "one loop ticks at most once per interval, got " + ticked);
        assertTrue(ticked > 0);
    }

    @Test
    public void testInvalidTransitionsAreRefused() throws InterruptedException {
        Simulation simulation = simulation(smallConfig().build(), null);

        assertThrows(IllegalStateException.class, simulation::pause);
        assertThrows(IllegalStateException.class, simulation::resume);

        simulation.start();
        assertThrows(IllegalStateException.class, simulation::start);
        assertThrows(IllegalStateException.class, simulation::advanceTick);

        simulation.pause();
        simulation.pause();
        assertEquals(SimulationState.PAUSED, simulation.state());
        assertThrows(IllegalStateException.class, simulation::start);
    }

    @Test
    public void testStepModeProcessesExactlyOneTick() {
        Simulation simulation = simulation(smallConfig().build(), null);
        advance(simulation, 3);

        assertEquals(3, simulation.currentTick());
        assertEquals(SimulationState.INITIALIZED, simulation.state());
        MarketState state = simulation.getMarketState("AAA");
        assertEquals(1_000_000L + 3 * 10, state.timestamp());
    }

    @Test
    public void testOperationsAfterStopFail() {
        Simulation simulation = simulation(smallConfig().build(), null);
        advance(simulation, 2);
        simulation.stop();

        assertThrows(SimulationNotRunningException.class,
                () -> simulation.submitOrder("AAA", Side.BUY, OrderKind.MARKET, 1, null));
        assertThrows(SimulationNotRunningException.class, () -> simulation.cancelOrder(1));
        assertThrows(SimulationNotRunningException.class, () -> simulation.getOrderBook("AAA", 5));
        assertThrows(SimulationNotRunningException.class, () -> simulation.getMarketState("AAA"));
        assertThrows(SimulationNotRunningException.class, simulation::listSymbols);
        assertThrows(SimulationNotRunningException.class, simulation::advanceTick);
        assertThrows(SimulationNotRunningException.class, simulation::start);
        assertThrows(SimulationNotRunningException.class, simulation::resume);

        // Still answered
        assertEquals(SimulationState.STOPPED, simulation.state());
        assertEquals(2, simulation.status().tick());
        simulation.stop();
        assertEquals(SimulationState.STOPPED, simulation.state());
    }

    @Test
    public void testUnknownSymbol() {
        Simulation simulation = simulation(smallConfig().build(), null);

        SubmitResult result = simulation.submitOrder("ZZZ", Side.BUY, OrderKind.LIMIT, 10, 1.0);
        assertEquals(OrderStatus.REJECTED, result.status());
        assertEquals(RejectReason.UNKNOWN_SYMBOL, result.rejectReason());
        assertEquals(0, result.orderId());

        UnknownSymbolException e = assertThrows(UnknownSymbolException.class,
                () -> simulation.getMarketState("ZZZ"));
        assertEquals("ZZZ", e.getSymbol());
        assertThrows(UnknownSymbolException.class, () -> simulation.getOrderBook("ZZZ", 5));
        assertThrows(UnknownSymbolException.class, () -> simulation.getAnalytics("ZZZ"));
        assertThrows(UnknownSymbolException.class, () -> simulation.estimateImpact("ZZZ", Side.BUY, 10));

        assertFalse(simulation.cancelOrder(123_456L));
        assertTrue(simulation.findOrder(0).isEmpty());
    }

    @Test
    public void testExternalOrderIsRoutedByItsId() {
        Simulation simulation = simulation(smallConfig().build(), null);
        advance(simulation, 20);

        SubmitResult resting = simulation.submitOrder("BBB", Side.BUY, OrderKind.LIMIT, 7, 1.0);
        assertEquals(OrderStatus.RESTING, resting.status());

        Optional<OrderView> view = simulation.findOrder(resting.orderId());
        assertTrue(view.isPresent());
        assertEquals("BBB", view.get().symbol());
        assertEquals(7, view.get().remainingQuantity());

        assertTrue(simulation.cancelOrder(resting.orderId()));
        assertFalse(simulation.cancelOrder(resting.orderId()));
        assertTrue(simulation.findOrder(resting.orderId()).isEmpty());
    }

    @Test
    public void testInvalidOrderIsRejectedWithoutTouchingTheBook() {
        Simulation simulation = simulation(smallConfig().build(), null);
        advance(simulation, 5);
        int before = simulation.symbolMarket("AAA").restingOrderCount();

        assertEquals(RejectReason.INVALID_QUANTITY,
                simulation.submitOrder("AAA", Side.BUY, OrderKind.LIMIT, 0, 99.0).rejectReason());
        assertEquals(RejectReason.MISSING_LIMIT_PRICE,
                simulation.submitOrder("AAA", Side.BUY, OrderKind.LIMIT, 5, null).rejectReason());
        assertEquals(RejectReason.INVALID_LIMIT_PRICE,
                simulation.submitOrder("AAA", Side.SELL, OrderKind.LIMIT, 5, -1.0).rejectReason());

        assertEquals(before, simulation.symbolMarket("AAA").restingOrderCount());
    }

    @Test
    public void testSameSeedReplaysSameRun() {
        RecordingSink first = new RecordingSink();
        RecordingSink second = new RecordingSink();
        Simulation a = simulation(smallConfig().seed(7).build(), first);
        Simulation b = simulation(smallConfig().seed(7).build(), second);

        advance(a, 150);
        advance(b, 150);

        for (String symbol : List.of("AAA", "BBB")) {
            assertEquals(a.getMarketState(symbol), b.getMarketState(symbol));
            assertEquals(a.getOrderBook(symbol, 10), b.getOrderBook(symbol, 10));
        }
        a.stop();
        b.stop();

        assertFalse(first.fills.isEmpty(), "agents should trade within 150 ticks");
        assertEquals(first.fills, second.fills);
    }

    @Test
    public void testParallelWorkersMatchSingleThread() {
        Simulation single = simulation(smallConfig().seed(11).build(), null);
        Simulation parallel = simulation(smallConfig().seed(11).workerThreads(2).build(), null);

        advance(single, 100);
        advance(parallel, 100);

        for (String symbol : List.of("AAA", "BBB")) {
            assertEquals(single.getMarketState(symbol), parallel.getMarketState(symbol));
        }
    }

    @Test
    public void testPersistsEveryTickRecord() {
        RecordingSink sink = new RecordingSink();
        Simulation simulation = simulation(smallConfig().build(), sink);
        advance(simulation, 20);
        SubmitResult external = simulation.submitOrder("AAA", Side.BUY, OrderKind.MARKET, 3, null);
        simulation.advanceTick();
        simulation.stop();

        SimulationStatus status = simulation.status();
        assertTrue(status.persistenceEnabled());
        assertEquals(0, status.droppedWrites());
        assertEquals(21, status.tick());
        assertEquals(2 * 21, sink.marketStates.size());
        assertEquals(2 * 21, sink.analytics.size());
        assertEquals(2 * 4, sink.snapshots.size(), "ticks 5, 10, 15 and 20");
        assertEquals(status.fillCount(), sink.fills.size());
        assertTrue(sink.closed.get());

        if (external.filledQuantity() > 0) {
            assertTrue(sink.fills.stream().anyMatch(f -> f.orderId() == external.orderId()));
        }
        for (int i = 1; i < sink.marketStates.size(); i++) {
            assertTrue(sink.marketStates.get(i).timestamp() >= sink.marketStates.get(i - 1).timestamp());
        }
    }

    @Test
    public void testSinkFailuresAreCountedNotPropagated() {
        RecordingSink failing = new RecordingSink() {
            @Override
            public void writeMarketState(String symbol, MarketState state, long timestamp) {
                throw new IllegalStateException("disk full");
            }
        };
        Simulation simulation = simulation(smallConfig().build(), failing);
        advance(simulation, 10);
        simulation.stop();

        assertEquals(2 * 10, simulation.status().droppedWrites());
        assertEquals(2 * 10, failing.analytics.size());
        assertEquals(20.0, simulation.metrics().sinkFailures());
    }

    @Test
    public void testStatusAndMetrics() {
        Simulation simulation = simulation(smallConfig().build(), null);
        advance(simulation, 4);

        SimulationStatus status = simulation.status();
        assertEquals(SimulationState.INITIALIZED, status.state());
        assertEquals(4, status.tick());
        assertEquals(List.of("AAA", "BBB"), status.symbols());
        assertEquals(2 * 40, status.agentCount());
        assertFalse(status.persistenceEnabled());
        assertEquals(4.0, simulation.metrics().ticksProcessed());
        assertEquals(List.of("AAA", "BBB"), simulation.listSymbols());
    }
}
