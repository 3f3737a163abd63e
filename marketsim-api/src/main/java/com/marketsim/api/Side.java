package com.marketsim.api;

/**
 * <b>Side: The Direction of the Order.</b>
 * <p>
 * BUY orders rest on the bid side and consume asks; SELL orders rest on the ask
 * side and consume bids.
 * </p>
 * <p>
 * Kept as primitive {@code byte} constants rather than an enum: the value is
 * stored on every resting order and compared on every match step, and the
 * journal writes it as a single byte.
 * </p>
 */
public final class Side {
    /** Buy Side (Bid) */
    public static final byte BUY = 0;

    /** Sell Side (Ask) */
    public static final byte SELL = 1;

    private Side() {
        // Prevent instantiation
    }

    public static byte opposite(byte side) {
        return side == BUY ? SELL : BUY;
    }

    public static boolean isValid(byte side) {
        return side == BUY || side == SELL;
    }

    /**
     * @return +1 for BUY, -1 for SELL. Used to sign impact and flow.
     */
    public static int sign(byte side) {
        return side == BUY ? 1 : -1;
    }

    /**
     * Lower-case wire name, as stored by the persistence collaborator.
     */
    public static String name(byte side) {
        if (side == BUY) {
            return "buy";
        }
        if (side == SELL) {
            return "sell";
        }
        throw new IllegalArgumentException("Unknown side: " + side);
    }
}
