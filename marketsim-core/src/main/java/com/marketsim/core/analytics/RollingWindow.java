package com.marketsim.core.analytics;

/**
 * Fixed-size ring of doubles, oldest overwritten first.
 */
public final class RollingWindow {

    private final double[] values;
    private int head;
    private int count;

    public RollingWindow(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be at least 1: " + capacity);
        }
        this.values = new double[capacity];
    }

    public void add(double value) {
        values[head] = value;
        head = (head + 1) % values.length;
        if (count < values.length) {
            count++;
        }
    }

    public int size() {
        return count;
    }

    public int capacity() {
        return values.length;
    }

    /**
     * @param index 0 for the oldest value held
     */
    public double get(int index) {
        if (index < 0 || index >= count) {
            throw new IndexOutOfBoundsException("index " + index + " of " + count);
        }
        int start = count < values.length ? 0 : head;
        return values[(start + index) % values.length];
    }

    public double last() {
        return count == 0 ? Double.NaN : get(count - 1);
    }

    /**
     * Sample standard deviation of the log returns between consecutive values,
     * NaN with fewer than two returns.
     */
    public double logReturnStdDev() {
        int returns = count - 1;
        if (returns < 2) {
            return Double.NaN;
        }
        double sum = 0;
        double sumSq = 0;
        for (int i = 1; i < count; i++) {
            double r = Math.log(get(i) / get(i - 1));
            sum += r;
            sumSq += r * r;
        }
        double mean = sum / returns;
        double variance = (sumSq - returns * mean * mean) / (returns - 1);
        return Math.sqrt(Math.max(0.0, variance));
    }
}
