package com.marketsim.core.agent;

import com.marketsim.api.Side;
import org.agrona.collections.Long2LongHashMap;

import java.util.Arrays;

/**
 * One simulated participant. The {@link Archetype} tag decides which behavior
 * acts for it; the archetype-specific fields are simply unused by the others.
 * <p>
 * Only the agent's own behavior and the routing of its own fills mutate it.
 * </p>
 */
public class Agent {

    public static final double STARTING_CASH = 1_000_000.0;
    private static final long NOT_OPEN = -1L;

    private final int id;
    private final Archetype archetype;

    // Portfolio
    private long position;
    private double cash = STARTING_CASH;
    private long filledQuantity;

    // Resting orders: order id -> tick it was placed
    private final Long2LongHashMap openOrders = new Long2LongHashMap(NOT_OPEN);

    private long lastActionTick = -1;

    // MARKET_MAKER: fixed per-agent multiplier on the base half spread
    private final double spreadMultiplier;

    // MOMENTUM: ring of observed reference prices
    private final double[] priceMemory;
    private int memoryHead;
    private int memoryCount;

    public Agent(int id, Archetype archetype, double spreadMultiplier, int memoryLength) {
        this.id = id;
        this.archetype = archetype;
        this.spreadMultiplier = spreadMultiplier;
        this.priceMemory = new double[Math.max(1, memoryLength)];
    }

    public int id() {
        return id;
    }

    public Archetype archetype() {
        return archetype;
    }

    public long position() {
        return position;
    }

    public double cash() {
        return cash;
    }

    public long filledQuantity() {
        return filledQuantity;
    }

    /**
     * Mark-to-market value at {@code price}.
     */
    public double equity(double price) {
        return cash + position * price;
    }

    /**
     * Books one execution of this agent's order.
     *
     * @param side the side this agent traded on
     */
    void applyFill(byte side, long quantity, double price) {
        int sign = Side.sign(side);
        position += sign * quantity;
        cash -= sign * quantity * price;
        filledQuantity += quantity;
    }

    void orderOpened(long orderId, long tick) {
        openOrders.put(orderId, tick);
    }

    void orderClosed(long orderId) {
        openOrders.remove(orderId);
    }

    public boolean ownsOpenOrder(long orderId) {
        return openOrders.containsKey(orderId);
    }

    public int openOrderCount() {
        return openOrders.size();
    }

    /**
     * Ids of this agent's resting orders in ascending order.
     */
    public long[] openOrderIds() {
        long[] ids = new long[openOrders.size()];
        int i = 0;
        Long2LongHashMap.KeyIterator it = openOrders.keySet().iterator();
        while (it.hasNext()) {
            ids[i++] = it.nextValue();
        }
        Arrays.sort(ids);
        return ids;
    }

    /**
     * @return tick the order was placed, or -1 if it is not open
     */
    public long openedAt(long orderId) {
        return openOrders.get(orderId);
    }

    public long lastActionTick() {
        return lastActionTick;
    }

    void markActed(long tick) {
        lastActionTick = tick;
    }

    public double spreadMultiplier() {
        return spreadMultiplier;
    }

    void remember(double price) {
        priceMemory[memoryHead] = price;
        memoryHead = (memoryHead + 1) % priceMemory.length;
        if (memoryCount < priceMemory.length) {
            memoryCount++;
        }
    }

    /**
     * True once the memory holds as many prices as it can.
     */
    boolean memoryFull() {
        return memoryCount == priceMemory.length;
    }

    /**
     * Oldest remembered price, NaN when nothing is remembered.
     */
    double oldestRemembered() {
        if (memoryCount == 0) {
            return Double.NaN;
        }
        int oldest = memoryCount < priceMemory.length ? 0 : memoryHead;
        return priceMemory[oldest];
    }

    @Override
    public String toString() {
        return "Agent{id=" + id + ", archetype=" + archetype + ", position=" + position + ", cash=" + cash
            + ", openOrders=" + openOrders.size() + '}';
    }
}
