package com.marketsim.core;

import com.marketsim.api.Fill;

/**
 * Book events, emitted synchronously from inside {@link OrderBook} on the
 * thread that owns the symbol.
 */
public interface MatchEventListener {

    /**
     * One execution. {@link Fill#orderId()} is the aggressor and
     * {@link Fill#counterOrderId()} the resting order it consumed.
     */
    void onTrade(Fill fill);

    void onOrderRested(long orderId, byte side, long price, long quantity);

    /**
     * A resting order left the book, either fully filled
     * ({@code remainingQuantity == 0}) or cancelled.
     */
    void onOrderRemoved(long orderId, byte side, long remainingQuantity, boolean cancelled);

    MatchEventListener NO_OP = new MatchEventListener() {
        @Override
        public void onTrade(Fill fill) {
        }

        @Override
        public void onOrderRested(long orderId, byte side, long price, long quantity) {
        }

        @Override
        public void onOrderRemoved(long orderId, byte side, long remainingQuantity, boolean cancelled) {
        }
    };
}
