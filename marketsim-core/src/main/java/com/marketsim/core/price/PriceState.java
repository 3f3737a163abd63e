package com.marketsim.core.price;

import java.util.Arrays;

/**
 * Immutable state of one symbol's reference price after a step. Carries the
 * short price history the momentum term looks back into, newest last.
 */
public final class PriceState {

    private final double price;
    private final double anchor;
    private final long step;
    private final double momentumTerm;
    private final double[] history;

    private PriceState(double price, double anchor, long step, double momentumTerm, double[] history) {
        this.price = price;
        this.anchor = anchor;
        this.step = step;
        this.momentumTerm = momentumTerm;
        this.history = history;
    }

    public static PriceState initial(double price) {
        if (!(price > 0)) {
            throw new IllegalArgumentException("initial price must be positive: " + price);
        }
        return new PriceState(price, price, 0, 0.0, new double[] {price});
    }

    /**
     * Successor state, keeping at most {@code capacity} history entries.
     */
    PriceState next(double nextPrice, double momentum, int capacity) {
        int keep = Math.min(history.length, capacity - 1);
        double[] nextHistory = new double[keep + 1];
        System.arraycopy(history, history.length - keep, nextHistory, 0, keep);
        nextHistory[keep] = nextPrice;
        return new PriceState(nextPrice, anchor, step + 1, momentum, nextHistory);
    }

    public double price() {
        return price;
    }

    /**
     * Mean-reversion anchor, the initial price.
     */
    public double anchor() {
        return anchor;
    }

    public long step() {
        return step;
    }

    /**
     * Momentum contribution of the step that produced this state.
     */
    public double momentumTerm() {
        return momentumTerm;
    }

    /**
     * Price {@code ticksAgo} steps back, or the oldest price still held when
     * the history is shorter than that.
     */
    public double priceAgo(int ticksAgo) {
        int index = history.length - 1 - ticksAgo;
        return history[Math.max(0, index)];
    }

    public int historySize() {
        return history.length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof PriceState)) {
            return false;
        }
        PriceState that = (PriceState) o;
        return Double.compare(that.price, price) == 0
            && Double.compare(that.anchor, anchor) == 0
            && step == that.step
            && Double.compare(that.momentumTerm, momentumTerm) == 0
            && Arrays.equals(history, that.history);
    }

    @Override
    public int hashCode() {
        int result = Double.hashCode(price);
        result = 31 * result + Long.hashCode(step);
        result = 31 * result + Arrays.hashCode(history);
        return result;
    }

    @Override
    public String toString() {
        return "PriceState{price=" + price + ", step=" + step + ", momentumTerm=" + momentumTerm + '}';
    }
}
