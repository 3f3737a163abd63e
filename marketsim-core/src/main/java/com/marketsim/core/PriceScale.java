package com.marketsim.core;

/**
 * Fixed-point price representation. The book keys levels by {@code long}
 * ticks so that two orders at "the same price" always land on the same
 * level; doubles appear only at the API boundary.
 * <p>
 * With {@code decimals = 2}, {@code 101.25} is stored as {@code 10125}.
 * </p>
 */
public final class PriceScale {

    /**
     * Largest price in ticks the book accepts. Keeps level arithmetic and
     * quantity times price far from {@code long} overflow.
     */
    public static final long MAX_TICKS = 1L << 40;

    // Off-grid distances below this many ticks (or a few ulps of large tick counts) are rounding noise.
    private static final double GRID_TOLERANCE = 1e-6;

    private final int decimals;
    private final long factor;

    public PriceScale(int decimals) {
        if (decimals < 0 || decimals > 8) {
            throw new IllegalArgumentException("decimals must be within [0, 8]: " + decimals);
        }
        this.decimals = decimals;
        long f = 1;
        for (int i = 0; i < decimals; i++) {
            f *= 10;
        }
        this.factor = f;
    }

    public long toTicks(double price) {
        return Math.round(price * factor);
    }

    /**
     * Converts a limit price to ticks without making it more aggressive: buy
     * limits round down to the tick, sell limits round up.
     *
     * @param buy true for a buy limit
     */
    public long toLimitTicks(double price, boolean buy) {
        double raw = price * factor;
        double nearest = Math.rint(raw);
        if (Math.abs(raw - nearest) < Math.max(GRID_TOLERANCE, 4 * Math.ulp(raw))) {
            return (long) nearest;
        }
        return (long) (buy ? Math.floor(raw) : Math.ceil(raw));
    }

    /**
     * @return true if {@code price} converts to a tick count within (0, MAX_TICKS]
     */
    public boolean isValidLimit(double price, boolean buy) {
        if (Double.isNaN(price) || Double.isInfinite(price) || price <= 0) {
            return false;
        }
        long ticks = toLimitTicks(price, buy);
        return ticks > 0 && ticks <= MAX_TICKS;
    }

    public double toPrice(long ticks) {
        return ticks / (double) factor;
    }

    /**
     * Rounds a price to the nearest representable tick.
     */
    public double round(double price) {
        return toPrice(toTicks(price));
    }

    public double tickSize() {
        return 1.0 / factor;
    }

    public int decimals() {
        return decimals;
    }
}
