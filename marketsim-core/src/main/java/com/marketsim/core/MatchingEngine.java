package com.marketsim.core;

import com.marketsim.api.OrderKind;
import com.marketsim.api.Side;

/**
 * <h1>The Matching Engine: Validation, Sequencing, Matching</h1>
 *
 * <p>
 * Front door of one symbol's {@link OrderBook}. Every order, whether it comes
 * from an agent through the execution queue or straight from the
 * {@code MarketSimulator} surface, passes through {@link #submit}:
 * </p>
 * <ol>
 * <li><b>Validate:</b> {@link OrderValidator}. A failure returns a REJECTED
 * result with id 0 and leaves the book untouched.</li>
 * <li><b>Sequence:</b> assign the next per-symbol order id.</li>
 * <li><b>Convert:</b> the double limit price becomes fixed-point ticks,
 * rounded toward the passive side so an order never trades through its
 * limit.</li>
 * <li><b>Match:</b> hand the ticket to the book, which emits fills through the
 * {@link MatchEventListener} as it goes.</li>
 * </ol>
 *
 * <p>
 * Single writer: the owning symbol serializes every call, so the engine holds
 * no locks. Given the same call sequence it produces the same ids and the same
 * fills.
 * </p>
 */
public class MatchingEngine {

    private final OrderBook orderBook;
    private final OrderValidator validator;
    private final PriceScale scale;
    private final IdSequence orderIds;

    public MatchingEngine(String symbol, int symbolIndex, PriceScale scale, MatchEventListener listener) {
        this.scale = scale;
        this.validator = new OrderValidator(scale);
        this.orderIds = new IdSequence(symbolIndex);
        this.orderBook = new OrderBook(symbol, scale, new IdSequence(symbolIndex), listener);
    }

    /**
     * @param limitPrice  limit price for LIMIT orders, NaN when absent
     * @param submittedAt simulated millis the submitter sent the order, used for
     *                    time priority
     * @param now         simulated millis the order reaches the book, stamped on
     *                    its fills
     */
    public MatchResult submit(byte side, byte kind, long quantity, double limitPrice, long submittedAt, long now) {
        OrderValidator.ValidationResult validation = validator.validate(side, kind, quantity, limitPrice);
        if (!validation.isValid()) {
            return MatchResult.rejected(0, side, quantity, validation.rejectReason());
        }

        long price = kind == OrderKind.LIMIT ? scale.toLimitTicks(limitPrice, side == Side.BUY) : 0;
        OrderTicket ticket = new OrderTicket(orderIds.next(), side, kind, price, quantity, submittedAt);
        return orderBook.submit(ticket, now);
    }

    public boolean cancel(long orderId) {
        return orderBook.cancel(orderId);
    }

    /**
     * Id of the most recently sequenced order, 0 before the first.
     */
    public long lastOrderId() {
        return orderIds.last();
    }

    public OrderBook getOrderBook() {
        return orderBook;
    }

    public PriceScale scale() {
        return scale;
    }
}
