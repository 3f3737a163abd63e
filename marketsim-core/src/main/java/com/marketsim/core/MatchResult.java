package com.marketsim.core;

import com.marketsim.api.Fill;
import com.marketsim.api.OrderStatus;
import com.marketsim.api.RejectReason;
import com.marketsim.api.SubmitResult;

import java.util.List;

/**
 * Outcome of one order hitting the book.
 *
 * @param orderId           order id, 0 when rejected before sequencing
 * @param side              aggressor side
 * @param requestedQuantity lots submitted
 * @param filledQuantity    lots executed against resting orders
 * @param restingQuantity   lots left resting (always 0 for market orders)
 * @param avgFillPrice      volume weighted execution price, 0 when nothing filled
 * @param fills             one fill per consumed counter-order, in execution order
 * @param midBefore         book mid just before matching, NaN for a one-sided book
 * @param midAfter          book mid just after matching and resting
 * @param status            outcome
 * @param rejectReason      why, when REJECTED
 */
public record MatchResult(
    long orderId,
    byte side,
    long requestedQuantity,
    long filledQuantity,
    long restingQuantity,
    double avgFillPrice,
    List<Fill> fills,
    double midBefore,
    double midAfter,
    OrderStatus status,
    RejectReason rejectReason
) {
    public MatchResult {
        fills = List.copyOf(fills);
    }

    public static MatchResult rejected(long orderId, byte side, long quantity, RejectReason reason) {
        return new MatchResult(orderId, side, quantity, 0, 0, 0.0, List.of(), Double.NaN, Double.NaN,
            OrderStatus.REJECTED, reason);
    }

    /**
     * Lots neither filled nor resting. Non-zero only for market orders that
     * exhausted the opposite side.
     */
    public long discardedQuantity() {
        return requestedQuantity - filledQuantity - restingQuantity;
    }

    public SubmitResult toSubmitResult() {
        return new SubmitResult(orderId, status, filledQuantity, avgFillPrice, rejectReason);
    }
}
