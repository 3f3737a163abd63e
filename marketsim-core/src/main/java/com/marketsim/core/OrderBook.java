package com.marketsim.core;

import com.marketsim.api.BookLevel;
import com.marketsim.api.BookSnapshot;
import com.marketsim.api.Fill;
import com.marketsim.api.OrderKind;
import com.marketsim.api.OrderStatus;
import com.marketsim.api.OrderView;
import com.marketsim.api.RejectReason;
import com.marketsim.api.Side;
import org.agrona.collections.Long2ObjectHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * <h1>The Order Book: Price-Time Priority Ledger</h1>
 *
 * <p>
 * Limit order book for one symbol. Holds every resting order, matches incoming
 * orders against the opposite side and reports one {@link Fill} per consumed
 * counter-order.
 * </p>
 *
 * <h2>Data Structure</h2>
 * <table border="1">
 * <tr>
 * <th>Component</th>
 * <th>Technology</th>
 * <th>Purpose</th>
 * </tr>
 * <tr>
 * <td><b>Level lookup</b></td>
 * <td>{@link Long2ObjectHashMap} keyed by price tick</td>
 * <td>O(1) access to the level an order rests on.</td>
 * </tr>
 * <tr>
 * <td><b>Level ordering</b></td>
 * <td>{@link RedBlackTree} (intrusive)</td>
 * <td>O(log N) best price and ordered walks for depth.</td>
 * </tr>
 * <tr>
 * <td><b>Time priority</b></td>
 * <td>Intrusive FIFO list in each {@link PriceLevel}</td>
 * <td>O(1) head consumption and tail append.</td>
 * </tr>
 * <tr>
 * <td><b>Cancel</b></td>
 * <td>{@link Long2ObjectHashMap} keyed by order id</td>
 * <td>O(1) unlink of any resting order.</td>
 * </tr>
 * </table>
 *
 * <h2>Matching Rules</h2>
 * <ul>
 * <li><b>Market:</b> walk the opposite side from the best price outward, FIFO
 * within each level, until filled or the side is empty. The remainder is
 * discarded; market orders never rest.</li>
 * <li><b>Limit:</b> same walk, bounded by the limit price. The remainder rests
 * at its level behind every order with better time priority.</li>
 * </ul>
 *
 * <h2>Invariants</h2>
 * <ul>
 * <li>best bid &lt; best ask whenever both sides are non-empty</li>
 * <li>a level's total equals the sum of its orders' remaining quantities</li>
 * <li>no empty level is ever left in a side</li>
 * </ul>
 * <p>
 * A violation raises {@link MatchingStateCorruptedException}.
 * </p>
 *
 * <p>
 * <b>NOT thread-safe.</b> The owning symbol serializes every call.
 * </p>
 */
public class OrderBook {

    private static final Logger log = LoggerFactory.getLogger(OrderBook.class);

    private static final int DEFAULT_ORDER_POOL = 4096;
    private static final int DEFAULT_LEVEL_POOL = 512;

    private final String symbol;
    private final PriceScale scale;
    private final IdSequence fillIds;
    private final MatchEventListener listener;

    private final Long2ObjectHashMap<PriceLevel> bids = new Long2ObjectHashMap<>();
    private final Long2ObjectHashMap<PriceLevel> asks = new Long2ObjectHashMap<>();
    private final RedBlackTree bidTree = new RedBlackTree();
    private final RedBlackTree askTree = new RedBlackTree();

    private final Long2ObjectHashMap<Order> restingOrders = new Long2ObjectHashMap<>();

    private final ObjectPool<Order> orderPool;
    private final ObjectPool<PriceLevel> priceLevelPool;

    public OrderBook(String symbol, PriceScale scale, IdSequence fillIds, MatchEventListener listener) {
        this(symbol, scale, fillIds, listener, DEFAULT_ORDER_POOL, DEFAULT_LEVEL_POOL);
    }

    public OrderBook(String symbol, PriceScale scale, IdSequence fillIds, MatchEventListener listener,
            int orderPoolCapacity, int levelPoolCapacity) {
        this.symbol = symbol;
        this.scale = scale;
        this.fillIds = fillIds;
        this.listener = listener == null ? MatchEventListener.NO_OP : listener;
        this.orderPool = new ObjectPool<>(orderPoolCapacity, Order::new, Order::reset);
        this.priceLevelPool = new ObjectPool<>(levelPoolCapacity, PriceLevel::new, PriceLevel::reset);
    }

    /**
     * Matches the ticket against the opposite side and rests any limit
     * remainder.
     *
     * @param ticket validated order (positive quantity, positive limit price for
     *               limit orders)
     * @param now    simulated millis stamped on the fills
     */
    public MatchResult submit(OrderTicket ticket, long now) {
        if (ticket.quantity() <= 0) {
            throw new IllegalArgumentException("quantity must be positive: " + ticket);
        }
        if (restingOrders.containsKey(ticket.id())) {
            throw new IllegalArgumentException("duplicate order id: " + ticket.id());
        }

        final boolean buy = ticket.side() == Side.BUY;
        final boolean limit = ticket.kind() == OrderKind.LIMIT;
        final RedBlackTree oppositeTree = buy ? askTree : bidTree;
        final Long2ObjectHashMap<PriceLevel> oppositeMap = buy ? asks : bids;

        final double midBefore = midPrice();
        final List<Fill> fills = new ArrayList<>(4);
        long remaining = ticket.quantity();
        double notional = 0;

        while (remaining > 0) {
            // Buys consume the lowest ask, sells the highest bid.
            PriceLevel best = oppositeTree.getBestPrice(buy);
            if (best == null) {
                break;
            }
            if (limit && (buy ? best.price > ticket.price() : best.price < ticket.price())) {
                break;
            }

            // matchLevel may return an emptied level to the pool, which clears its price.
            final long levelPrice = best.price;
            long before = remaining;
            remaining = matchLevel(best, remaining, ticket, now, fills, oppositeMap, oppositeTree);
            notional += (before - remaining) * scale.toPrice(levelPrice);
        }

        long filled = ticket.quantity() - remaining;
        long resting = 0;
        if (remaining > 0 && limit) {
            rest(ticket, remaining);
            resting = remaining;
        }

        checkNotCrossed();

        double avgFillPrice = filled > 0 ? notional / filled : 0.0;
        OrderStatus status;
        RejectReason reason = RejectReason.NONE;
        if (filled == ticket.quantity()) {
            status = OrderStatus.FILLED;
        } else if (filled > 0) {
            status = OrderStatus.PARTIALLY_FILLED;
        } else if (limit) {
            status = OrderStatus.RESTING;
        } else {
            status = OrderStatus.REJECTED;
            reason = RejectReason.NO_LIQUIDITY;
        }

        if (log.isDebugEnabled()) {
            log.debug("{} {} {} {}@{} -> {} filled={} resting={} fills={}",
                symbol, Side.name(ticket.side()), OrderKind.name(ticket.kind()), ticket.quantity(),
                limit ? scale.toPrice(ticket.price()) : "MKT", status, filled, resting, fills.size());
        }

        return new MatchResult(ticket.id(), ticket.side(), ticket.quantity(), filled, resting, avgFillPrice,
            fills, midBefore, midPrice(), status, reason);
    }

    private long matchLevel(PriceLevel level, long quantity, OrderTicket aggressor, long now, List<Fill> fills,
            Long2ObjectHashMap<PriceLevel> map, RedBlackTree tree) {
        final double price = scale.toPrice(level.price);
        Order head = level.head;

        while (head != null && quantity > 0) {
            long tradeQty = Math.min(quantity, head.quantity);

            level.reduce(head, tradeQty);
            quantity -= tradeQty;

            if (head.quantity < 0 || level.totalQuantity < 0) {
                throw new MatchingStateCorruptedException(symbol,
                    "negative resting quantity after fill of " + tradeQty + " on " + head);
            }

            Fill fill = new Fill(fillIds.next(), aggressor.id(), head.id, symbol, aggressor.side(), price,
                tradeQty, now);
            fills.add(fill);
            listener.onTrade(fill);

            if (head.quantity == 0) {
                Order filled = head;
                head = head.next;
                level.removeOrder(filled);
                restingOrders.remove(filled.id);
                listener.onOrderRemoved(filled.id, filled.side, 0, false);
                orderPool.returnObject(filled);
            }
        }

        if (level.isEmpty()) {
            removeLevel(level, map, tree);
        }

        return quantity;
    }

    private void rest(OrderTicket ticket, long quantity) {
        Order order = orderPool.borrow();
        order.id = ticket.id();
        order.price = ticket.price();
        order.quantity = quantity;
        order.originalQuantity = ticket.quantity();
        order.side = ticket.side();
        order.submittedAt = ticket.submittedAt();

        Long2ObjectHashMap<PriceLevel> sideMap = ticket.side() == Side.BUY ? bids : asks;
        RedBlackTree sideTree = ticket.side() == Side.BUY ? bidTree : askTree;

        PriceLevel level = sideMap.get(order.price);
        if (level == null) {
            level = priceLevelPool.borrow();
            level.reset();
            level.price = order.price;
            sideMap.put(order.price, level);
            sideTree.insert(level);
        }

        level.addOrder(order);
        restingOrders.put(order.id, order);
        listener.onOrderRested(order.id, order.side, order.price, quantity);
    }

    /**
     * Removes a resting order.
     *
     * @return false if the id is unknown, already filled or already cancelled
     */
    public boolean cancel(long orderId) {
        Order order = restingOrders.remove(orderId);
        if (order == null) {
            return false;
        }

        PriceLevel level = order.level;
        if (level == null) {
            throw new MatchingStateCorruptedException(symbol, "resting order without a level: " + order);
        }
        long remaining = order.quantity;
        byte side = order.side;
        level.removeOrder(order);
        if (level.isEmpty()) {
            if (side == Side.BUY) {
                removeLevel(level, bids, bidTree);
            } else {
                removeLevel(level, asks, askTree);
            }
        }

        listener.onOrderRemoved(orderId, side, remaining, true);
        orderPool.returnObject(order);
        return true;
    }

    private void removeLevel(PriceLevel level, Long2ObjectHashMap<PriceLevel> map, RedBlackTree tree) {
        map.remove(level.price);
        tree.remove(level);
        priceLevelPool.returnObject(level);
    }

    public Optional<OrderView> find(long orderId) {
        Order order = restingOrders.get(orderId);
        if (order == null) {
            return Optional.empty();
        }
        return Optional.of(new OrderView(order.id, symbol, order.side, scale.toPrice(order.price),
            order.originalQuantity, order.quantity, order.submittedAt));
    }

    public boolean isResting(long orderId) {
        return restingOrders.containsKey(orderId);
    }

    /**
     * Aggregated L2 view, best levels first.
     *
     * @param depth maximum number of levels per side
     */
    public BookSnapshot snapshot(int depth, long timestamp) {
        return new BookSnapshot(symbol, timestamp, levels(bidTree, false, depth), levels(askTree, true, depth));
    }

    private List<BookLevel> levels(RedBlackTree tree, boolean ascending, int depth) {
        List<BookLevel> out = new ArrayList<>(Math.min(Math.max(depth, 0), tree.size()));
        PriceLevel level = tree.getBestPrice(ascending);
        while (level != null && out.size() < depth) {
            out.add(new BookLevel(scale.toPrice(level.price), level.totalQuantity, level.orderCount));
            level = tree.next(level, ascending);
        }
        return out;
    }

    /**
     * Total resting lots over the best {@code levels} levels of one side.
     */
    public long depth(byte side, int levels) {
        boolean ascending = side == Side.SELL;
        RedBlackTree tree = ascending ? askTree : bidTree;
        long total = 0;
        int seen = 0;
        PriceLevel level = tree.getBestPrice(ascending);
        while (level != null && seen < levels) {
            total += level.totalQuantity;
            seen++;
            level = tree.next(level, ascending);
        }
        return total;
    }

    public double bestBid() {
        PriceLevel level = bidTree.getBestPrice(false);
        return level == null ? Double.NaN : scale.toPrice(level.price);
    }

    public double bestAsk() {
        PriceLevel level = askTree.getBestPrice(true);
        return level == null ? Double.NaN : scale.toPrice(level.price);
    }

    /**
     * @return mid of best bid and ask, NaN unless both sides are populated
     */
    public double midPrice() {
        PriceLevel bid = bidTree.getBestPrice(false);
        PriceLevel ask = askTree.getBestPrice(true);
        if (bid == null || ask == null) {
            return Double.NaN;
        }
        return (scale.toPrice(bid.price) + scale.toPrice(ask.price)) / 2.0;
    }

    public double spread() {
        return bestAsk() - bestBid();
    }

    public int restingOrderCount() {
        return restingOrders.size();
    }

    public int levelCount(byte side) {
        return side == Side.BUY ? bidTree.size() : askTree.size();
    }

    public String symbol() {
        return symbol;
    }

    public PriceScale scale() {
        return scale;
    }

    private void checkNotCrossed() {
        PriceLevel bid = bidTree.getBestPrice(false);
        PriceLevel ask = askTree.getBestPrice(true);
        if (bid != null && ask != null && bid.price >= ask.price) {
            throw new MatchingStateCorruptedException(symbol,
                "crossed book: best bid " + bid.price + " >= best ask " + ask.price);
        }
    }

    /**
     * Full structural check, O(resting orders). Meant for tests and for
     * diagnostics after an unexpected failure, not for the hot path.
     */
    public void verifyInvariants() {
        checkNotCrossed();
        int counted = verifySide(bidTree, bids, Side.BUY) + verifySide(askTree, asks, Side.SELL);
        if (counted != restingOrders.size()) {
            throw new MatchingStateCorruptedException(symbol,
                "order index holds " + restingOrders.size() + " orders but levels hold " + counted);
        }
    }

    private int verifySide(RedBlackTree tree, Long2ObjectHashMap<PriceLevel> map, byte side) {
        if (tree.size() != map.size()) {
            throw new MatchingStateCorruptedException(symbol,
                Side.name(side) + " tree has " + tree.size() + " levels, map has " + map.size());
        }
        int orders = 0;
        long previousPrice = Long.MIN_VALUE;
        for (PriceLevel level = tree.getBestPrice(true); level != null; level = tree.next(level, true)) {
            if (level.price <= previousPrice) {
                throw new MatchingStateCorruptedException(symbol, "levels out of order at " + level.price);
            }
            previousPrice = level.price;
            if (map.get(level.price) != level) {
                throw new MatchingStateCorruptedException(symbol, "level " + level.price + " missing from map");
            }
            if (level.isEmpty()) {
                throw new MatchingStateCorruptedException(symbol, "empty level left at " + level.price);
            }

            long sum = 0;
            int count = 0;
            Order previous = null;
            for (Order order = level.head; order != null; order = order.next) {
                if (order.quantity <= 0 || order.side != side || order.price != level.price || order.level != level) {
                    throw new MatchingStateCorruptedException(symbol, "bad resting order " + order);
                }
                if (previous != null && order.queuesBefore(previous)) {
                    throw new MatchingStateCorruptedException(symbol, "time priority broken at " + order);
                }
                if (restingOrders.get(order.id) != order) {
                    throw new MatchingStateCorruptedException(symbol, "order not indexed " + order);
                }
                sum += order.quantity;
                count++;
                previous = order;
            }
            if (sum != level.totalQuantity || count != level.orderCount) {
                throw new MatchingStateCorruptedException(symbol, "level " + level.price + " total "
                    + level.totalQuantity + "/" + level.orderCount + " but orders sum to " + sum + "/" + count);
            }
            orders += count;
        }
        return orders;
    }
}
