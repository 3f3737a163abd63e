package com.marketsim.api;

/**
 * Order kind constants. Same primitive style as {@link Side}.
 * <p>
 * A MARKET order never rests: whatever the opposite side cannot fill is
 * discarded. A LIMIT order matches while it crosses and rests the remainder.
 * </p>
 */
public final class OrderKind {
    public static final byte MARKET = 0;
    public static final byte LIMIT = 1;

    private OrderKind() {
    }

    public static boolean isValid(byte kind) {
        return kind == MARKET || kind == LIMIT;
    }

    public static String name(byte kind) {
        if (kind == MARKET) {
            return "market";
        }
        if (kind == LIMIT) {
            return "limit";
        }
        throw new IllegalArgumentException("Unknown order kind: " + kind);
    }
}
