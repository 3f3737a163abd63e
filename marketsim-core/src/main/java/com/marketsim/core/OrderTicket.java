package com.marketsim.core;

/**
 * A validated, sequenced order on its way into an {@link OrderBook}.
 *
 * @param id          unique order id
 * @param side        {@link com.marketsim.api.Side}
 * @param kind        {@link com.marketsim.api.OrderKind}
 * @param price       limit price in ticks, 0 for market orders
 * @param quantity    lots, strictly positive
 * @param submittedAt simulated millis at which the submitter sent it
 */
public record OrderTicket(long id, byte side, byte kind, long price, long quantity, long submittedAt) {
}
