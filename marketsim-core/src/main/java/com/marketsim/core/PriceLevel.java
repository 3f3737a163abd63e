package com.marketsim.core;

/**
 * <b>The Price Level: A "Fat" Node</b>
 * <p>
 * All resting orders at one price, kept in a FIFO queue. The level is itself a
 * node of its side's {@link RedBlackTree} (left/right/parent/color) and the
 * queue is an intrusive doubly linked list through {@link Order#next} and
 * {@link Order#prev}, so neither structure allocates wrapper nodes.
 * </p>
 * <p>
 * Invariant: {@code totalQuantity} equals the sum of the queued orders'
 * remaining quantity and {@code orderCount} their number.
 * </p>
 */
public class PriceLevel {
    public long price;

    public Order head;
    public Order tail;
    public long totalQuantity;
    public int orderCount;

    // Red-Black Tree pointers (intrusive)
    public PriceLevel left;
    public PriceLevel right;
    public PriceLevel parent;
    public boolean color; // true = RED, false = BLACK

    public void reset() {
        price = 0;
        head = null;
        tail = null;
        totalQuantity = 0;
        orderCount = 0;

        left = null;
        right = null;
        parent = null;
        color = false;
    }

    /**
     * Queues the order behind every order with better time priority. Under
     * sequential submission that is always the tail, so the walk stops
     * immediately.
     */
    public void addOrder(Order order) {
        Order after = tail;
        while (after != null && order.queuesBefore(after)) {
            after = after.prev;
        }

        if (after == null) {
            order.prev = null;
            order.next = head;
            if (head != null) {
                head.prev = order;
            } else {
                tail = order;
            }
            head = order;
        } else {
            order.prev = after;
            order.next = after.next;
            if (after.next != null) {
                after.next.prev = order;
            } else {
                tail = order;
            }
            after.next = order;
        }

        order.level = this;
        totalQuantity += order.quantity;
        orderCount++;
    }

    /**
     * Unlinks the order. It must be queued in this level.
     */
    public void removeOrder(Order order) {
        if (order.prev != null) {
            order.prev.next = order.next;
        } else {
            head = order.next;
        }

        if (order.next != null) {
            order.next.prev = order.prev;
        } else {
            tail = order.prev;
        }

        totalQuantity -= order.quantity;
        orderCount--;
        order.next = null;
        order.prev = null;
        order.level = null;
    }

    /**
     * Records a partial or full execution of a queued order.
     */
    public void reduce(Order order, long quantity) {
        order.quantity -= quantity;
        totalQuantity -= quantity;
    }

    public boolean isEmpty() {
        return head == null;
    }
}
