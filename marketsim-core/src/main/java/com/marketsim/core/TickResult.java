package com.marketsim.core;

import com.marketsim.api.AnalyticsRow;
import com.marketsim.api.BookSnapshot;
import com.marketsim.api.Fill;
import com.marketsim.api.MarketState;

import java.util.List;

/**
 * Everything one symbol produced in one tick, ready for persistence.
 *
 * @param fills     fills since the previous tick, external ones included, in execution order
 * @param snapshot  L2 snapshot when one was requested for this tick, otherwise null
 */
public record TickResult(
    String symbol,
    long tick,
    long timestamp,
    List<Fill> fills,
    MarketState marketState,
    AnalyticsRow analytics,
    BookSnapshot snapshot
) {
    public TickResult {
        fills = List.copyOf(fills);
    }

    public boolean hasSnapshot() {
        return snapshot != null;
    }
}
