package com.marketsim.core;

import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * <h1>Object Pool: Recycling Book Nodes</h1>
 *
 * <p>
 * Resting orders and price levels churn constantly: market makers cancel and
 * re-quote every tick, and every fully consumed order or level is thrown away.
 * Recycling those nodes keeps the per-tick allocation rate of a book flat no
 * matter how many ticks the simulation runs.
 * </p>
 *
 * <h2>Sizing</h2>
 * <p>
 * A slice of {@code initialCapacity} objects is pre-allocated. A simulated
 * book has no hard bound on resting orders, so an empty pool falls back to the
 * factory instead of failing; {@link #overflowAllocations()} reports how often
 * that happened so the capacity can be tuned. Objects returned to a full pool
 * are left to the GC.
 * </p>
 *
 * <p>
 * Not thread-safe. Each pool belongs to exactly one {@link OrderBook}, which
 * belongs to exactly one symbol.
 * </p>
 *
 * @param <T> The type of object to pool.
 */
public class ObjectPool<T> {

    private final Object[] pool;
    private final Supplier<T> factory;
    private final Consumer<T> resetter;
    private int head;
    private long overflowAllocations;

    public ObjectPool(int initialCapacity, Supplier<T> factory, Consumer<T> resetter) {
        if (initialCapacity <= 0) {
            throw new IllegalArgumentException("initialCapacity must be positive: " + initialCapacity);
        }
        this.factory = factory;
        this.resetter = resetter;
        this.pool = new Object[initialCapacity];
        this.head = initialCapacity - 1;

        for (int i = 0; i < initialCapacity; i++) {
            pool[i] = factory.get();
        }
    }

    @SuppressWarnings("unchecked")
    public T borrow() {
        if (head < 0) {
            overflowAllocations++;
            return factory.get();
        }
        T object = (T) pool[head];
        pool[head--] = null;
        return object;
    }

    public void returnObject(T object) {
        if (object == null) {
            return;
        }
        resetter.accept(object);
        if (head + 1 < pool.length) {
            pool[++head] = object;
        }
    }

    public int available() {
        return head + 1;
    }

    public int capacity() {
        return pool.length;
    }

    public long overflowAllocations() {
        return overflowAllocations;
    }
}
