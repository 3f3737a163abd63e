package com.marketsim.core.execution;

import com.marketsim.api.OrderKind;

/**
 * What an agent wants done, before latency. Either a new order or a cancel of
 * one of the agent's own resting orders.
 *
 * @param type          NEW or CANCEL
 * @param agentId       originating agent, -1 for none
 * @param side          {@link com.marketsim.api.Side}, NEW only
 * @param kind          {@link OrderKind}, NEW only
 * @param quantity      lots, NEW only
 * @param limitPrice    limit price, NaN for market orders and cancels
 * @param targetOrderId order to cancel, CANCEL only
 * @param submittedAt   simulated millis the agent sent it
 */
public record OrderIntent(
    Type type,
    int agentId,
    byte side,
    byte kind,
    long quantity,
    double limitPrice,
    long targetOrderId,
    long submittedAt
) {
    public enum Type {
        NEW,
        CANCEL
    }

    public static OrderIntent market(int agentId, byte side, long quantity, long submittedAt) {
        return new OrderIntent(Type.NEW, agentId, side, OrderKind.MARKET, quantity, Double.NaN, 0, submittedAt);
    }

    public static OrderIntent limit(int agentId, byte side, long quantity, double limitPrice, long submittedAt) {
        return new OrderIntent(Type.NEW, agentId, side, OrderKind.LIMIT, quantity, limitPrice, 0, submittedAt);
    }

    public static OrderIntent cancel(int agentId, long orderId, long submittedAt) {
        return new OrderIntent(Type.CANCEL, agentId, (byte) 0, (byte) 0, 0, Double.NaN, orderId, submittedAt);
    }

    public boolean isCancel() {
        return type == Type.CANCEL;
    }
}
