package com.marketsim.core;

/**
 * The internal resting-order node. Lives only inside an {@link OrderBook},
 * is pooled, and doubles as a node of its level's intrusive FIFO list.
 * <p>
 * Everything is fixed at acceptance except {@code quantity}, the remaining
 * lots, which only the book decrements.
 * </p>
 */
public class Order {
    public long id;
    /** Limit price in ticks. */
    public long price;
    /** Remaining lots. */
    public long quantity;
    public long originalQuantity;
    public byte side;
    public long submittedAt;

    public PriceLevel level;

    // Intrusive FIFO links within the owning level
    public Order next;
    public Order prev;

    public void reset() {
        id = 0;
        price = 0;
        quantity = 0;
        originalQuantity = 0;
        side = 0;
        submittedAt = 0;
        level = null;
        next = null;
        prev = null;
    }

    /**
     * Price-time priority inside a level: earlier submission first, then lower
     * id. Both orders are assumed to rest at the same price.
     */
    boolean queuesBefore(Order other) {
        if (submittedAt != other.submittedAt) {
            return submittedAt < other.submittedAt;
        }
        return id < other.id;
    }

    @Override
    public String toString() {
        return "Order{" +
                "id=" + id +
                ", price=" + price +
                ", quantity=" + quantity +
                "/" + originalQuantity +
                ", side=" + side +
                ", submittedAt=" + submittedAt +
                '}';
    }
}
