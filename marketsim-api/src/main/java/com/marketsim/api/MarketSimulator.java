package com.marketsim.api;

import java.util.List;
import java.util.Optional;

/**
 * <h1>The Simulation Surface</h1>
 * <p>
 * Everything an outer control layer (HTTP, CLI, tests) may ask of a running
 * simulation. All calls are synchronous. Calls that touch a symbol are
 * serialized with that symbol's tick processing, so a caller never observes a
 * half-processed tick.
 * </p>
 * <p>
 * Once the simulation is {@link SimulationState#STOPPED} every method except
 * {@link #state()}, {@link #status()} and {@link #stop()} throws
 * {@link SimulationNotRunningException}.
 * </p>
 */
public interface MarketSimulator {

    /**
     * Submits an order straight to the symbol's book (no modelled latency).
     * Parameter problems are reported as a REJECTED result, never thrown, and
     * leave the book untouched.
     *
     * @param limitPrice required for {@link OrderKind#LIMIT}, ignored for MARKET;
     *                   {@code null} or {@code NaN} means "absent"
     */
    SubmitResult submitOrder(String symbol, byte side, byte kind, long quantity, Double limitPrice);

    /**
     * @return true if the order was resting and is now removed; false for an
     *         unknown, filled or already cancelled order
     */
    boolean cancelOrder(long orderId);

    Optional<OrderView> findOrder(long orderId);

    BookSnapshot getOrderBook(String symbol, int depth);

    MarketState getMarketState(String symbol);

    AnalyticsRow getAnalytics(String symbol);

    /**
     * Pre-trade estimate of the relative price impact of trading
     * {@code quantity} lots now. Does not mutate liquidity.
     */
    double estimateImpact(String symbol, byte side, long quantity);

    List<String> listSymbols();

    /**
     * Processes exactly one tick for every symbol. Allowed while INITIALIZED or
     * PAUSED (step mode); while RUNNING the tick loop owns the clock and this
     * throws {@link IllegalStateException}.
     */
    void advanceTick();

    void start();

    void pause();

    void resume();

    void stop();

    SimulationState state();

    SimulationStatus status();
}
