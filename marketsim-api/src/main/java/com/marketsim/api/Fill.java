package com.marketsim.api;

/**
 * One execution against one resting counter-order. Immutable once created.
 * <p>
 * {@code orderId} and {@code side} belong to the aggressor (the incoming
 * order); {@code counterOrderId} is the resting order that was consumed. Both
 * sides of the match therefore see exactly {@code quantity} lots.
 * </p>
 *
 * @param fillId         per-symbol sequence tagged with the symbol index
 * @param orderId        aggressing order
 * @param counterOrderId resting order consumed by this fill
 * @param symbol         symbol id
 * @param side           aggressor side, see {@link Side}
 * @param price          execution price (the resting level's price)
 * @param quantity       lots executed
 * @param timestamp      simulated epoch millis
 */
public record Fill(
    long fillId,
    long orderId,
    long counterOrderId,
    String symbol,
    byte side,
    double price,
    long quantity,
    long timestamp
) {
    public Fill {
        if (quantity <= 0) {
            throw new IllegalArgumentException("fill quantity must be positive: " + quantity);
        }
        if (!Side.isValid(side)) {
            throw new IllegalArgumentException("invalid side: " + side);
        }
    }

    public double notional() {
        return price * quantity;
    }
}
