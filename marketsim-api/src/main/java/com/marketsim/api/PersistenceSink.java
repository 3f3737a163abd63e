package com.marketsim.api;

/**
 * <b>The Persistence Seam.</b>
 * <p>
 * Implemented by the storage collaborator (time-series database, analytics
 * store, journal). The simulation calls these from a dedicated writer thread,
 * never from the tick loop, and a failing call only increments a counter.
 * Implementations are still expected not to throw; batching and day
 * partitioning are theirs to decide.
 * </p>
 *
 * Record shapes:
 * <pre>
 * fill         (timestamp, fill_id, order_id, symbol, side, price, quantity)
 * market state (timestamp, symbol, last_price, volume, liquidity, volatility, momentum, spread)
 * analytics    (timestamp, symbol, bid_ask_spread, mid_price, imbalance, bid_depth, ask_depth,
 *               effective_spread, price_impact, realized_volatility)
 * </pre>
 */
public interface PersistenceSink extends AutoCloseable {

    void writeFill(Fill fill);

    void writeMarketState(String symbol, MarketState state, long timestamp);

    void writeAnalytics(String symbol, AnalyticsRow metrics, long timestamp);

    /**
     * Periodic L2 snapshot. Optional for sinks that do not keep book history.
     */
    default void writeOrderBookSnapshot(String symbol, BookSnapshot snapshot, long timestamp) {
    }

    @Override
    default void close() {
    }
}
