package com.marketsim.core.liquidity;

/**
 * Mutable depth of one symbol. Only {@link LiquidityModel} writes to it.
 */
public final class LiquidityState {

    final double baseline;
    final double floor;
    double current;
    long lastUpdateTick;

    LiquidityState(double baseline, double floor) {
        this.baseline = baseline;
        this.floor = floor;
        this.current = baseline;
    }

    public double current() {
        return current;
    }

    public double baseline() {
        return baseline;
    }

    public double floor() {
        return floor;
    }

    public long lastUpdateTick() {
        return lastUpdateTick;
    }

    /**
     * current / baseline, in [floor fraction, 1].
     */
    public double ratio() {
        return current / baseline;
    }

    @Override
    public String toString() {
        return "LiquidityState{current=" + current + ", baseline=" + baseline + ", floor=" + floor
            + ", lastUpdateTick=" + lastUpdateTick + '}';
    }
}
