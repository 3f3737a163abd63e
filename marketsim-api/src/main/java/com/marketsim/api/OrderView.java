package com.marketsim.api;

/**
 * Read-only view of a resting order.
 */
public record OrderView(
    long orderId,
    String symbol,
    byte side,
    double price,
    long originalQuantity,
    long remainingQuantity,
    long submittedAt
) {
    public long filledQuantity() {
        return originalQuantity - remainingQuantity;
    }
}
