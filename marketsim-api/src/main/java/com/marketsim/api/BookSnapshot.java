package com.marketsim.api;

import java.util.List;

/**
 * Depth-limited L2 view of a book. Bids best (highest) first, asks best
 * (lowest) first.
 */
public record BookSnapshot(String symbol, long timestamp, List<BookLevel> bids, List<BookLevel> asks) {

    public BookSnapshot {
        bids = List.copyOf(bids);
        asks = List.copyOf(asks);
    }

    public double bestBid() {
        return bids.isEmpty() ? Double.NaN : bids.get(0).price();
    }

    public double bestAsk() {
        return asks.isEmpty() ? Double.NaN : asks.get(0).price();
    }

    public double spread() {
        return bestAsk() - bestBid();
    }

    public double midPrice() {
        return (bestBid() + bestAsk()) / 2.0;
    }
}
