package com.marketsim.core;

import com.marketsim.api.Fill;

import java.util.ArrayList;
import java.util.List;

/**
 * Captures every book event for assertions.
 */
class RecordingMatchListener implements MatchEventListener {

    final List<Fill> trades = new ArrayList<>();
    final List<Long> rested = new ArrayList<>();
    final List<Long> filledOut = new ArrayList<>();
    final List<Long> cancelled = new ArrayList<>();
    long restedQuantity;
    long cancelledQuantity;

    @Override
    public void onTrade(Fill fill) {
        trades.add(fill);
    }

    @Override
    public void onOrderRested(long orderId, byte side, long price, long quantity) {
        rested.add(orderId);
        restedQuantity += quantity;
    }

    @Override
    public void onOrderRemoved(long orderId, byte side, long remainingQuantity, boolean wasCancelled) {
        if (wasCancelled) {
            cancelled.add(orderId);
            cancelledQuantity += remainingQuantity;
        } else {
            filledOut.add(orderId);
        }
    }
}
