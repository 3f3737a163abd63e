package com.marketsim.api;

/**
 * Synchronous answer to {@link MarketSimulator#submitOrder}.
 *
 * @param orderId        id assigned by the symbol's book, {@code 0} when rejected before sequencing
 * @param status         outcome
 * @param filledQuantity lots executed
 * @param avgFillPrice   volume weighted execution price, {@code 0.0} when nothing filled
 * @param rejectReason   {@link RejectReason#NONE} unless {@code status} is REJECTED
 */
public record SubmitResult(
    long orderId,
    OrderStatus status,
    long filledQuantity,
    double avgFillPrice,
    RejectReason rejectReason
) {
    public static SubmitResult rejected(long orderId, RejectReason reason) {
        return new SubmitResult(orderId, OrderStatus.REJECTED, 0, 0.0, reason);
    }

    public boolean isRejected() {
        return status == OrderStatus.REJECTED;
    }
}
