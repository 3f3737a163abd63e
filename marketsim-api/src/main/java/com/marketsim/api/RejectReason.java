package com.marketsim.api;

public enum RejectReason {
    NONE,
    INVALID_SIDE,
    INVALID_KIND,
    INVALID_QUANTITY,
    MISSING_LIMIT_PRICE,
    INVALID_LIMIT_PRICE,
    UNKNOWN_SYMBOL,
    /** A market order found no resting liquidity on the opposite side. */
    NO_LIQUIDITY
}
