package com.marketsim.infra.metrics;

import com.marketsim.api.SimulationState;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;

/**
 * Prometheus metrics of a simulation instance.
 *
 * Tracks:
 * - Ticks processed
 * - Fills per symbol
 * - Persistence writes dropped on a full ring, and sink failures
 * - Lifecycle state and current tick
 */
public class SimulationMetrics {

    private final Counter ticks;
    private final Counter fills;
    private final Counter droppedWrites;
    private final Counter sinkFailures;
    private final Gauge state;
    private final Gauge currentTick;
    private final Gauge restingOrders;

    public SimulationMetrics(CollectorRegistry registry) {
        this.ticks = Counter.build()
            .name("marketsim_ticks_total")
            .help("Total number of simulation ticks processed")
            .register(registry);

        this.fills = Counter.build()
            .name("marketsim_fills_total")
            .help("Total number of fills produced")
            .labelNames("symbol")
            .register(registry);

        this.droppedWrites = Counter.build()
            .name("marketsim_persistence_dropped_total")
            .help("Persistence records dropped because the ring buffer was full")
            .register(registry);

        this.sinkFailures = Counter.build()
            .name("marketsim_persistence_sink_failures_total")
            .help("Persistence records the sink failed to write")
            .register(registry);

        this.state = Gauge.build()
            .name("marketsim_state")
            .help("Lifecycle state (0=INITIALIZED, 1=RUNNING, 2=PAUSED, 3=STOPPED)")
            .register(registry);

        this.currentTick = Gauge.build()
            .name("marketsim_tick")
            .help("Last processed tick")
            .register(registry);

        this.restingOrders = Gauge.build()
            .name("marketsim_resting_orders")
            .help("Orders resting in the book")
            .labelNames("symbol")
            .register(registry);
    }

    /**
     * Metrics registered nowhere, for simulations built without a registry.
     */
    public static SimulationMetrics unregistered() {
        return new SimulationMetrics(new CollectorRegistry());
    }

    public void recordTick(long tick) {
        ticks.inc();
        currentTick.set(tick);
    }

    public void recordFills(String symbol, int count) {
        if (count > 0) {
            fills.labels(symbol).inc(count);
        }
    }

    public void recordDroppedWrite() {
        droppedWrites.inc();
    }

    public void recordSinkFailure() {
        sinkFailures.inc();
    }

    public void setState(SimulationState value) {
        state.set(value.ordinal());
    }

    public void setRestingOrders(String symbol, int count) {
        restingOrders.labels(symbol).set(count);
    }

    public double ticksProcessed() {
        return ticks.get();
    }

    public double fillsFor(String symbol) {
        return fills.labels(symbol).get();
    }

    public double droppedWrites() {
        return droppedWrites.get();
    }

    public double sinkFailures() {
        return sinkFailures.get();
    }
}
