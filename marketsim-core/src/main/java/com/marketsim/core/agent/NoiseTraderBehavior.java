package com.marketsim.core.agent;

import com.marketsim.api.Side;
import com.marketsim.core.execution.OrderIntent;

import java.util.List;
import java.util.random.RandomGenerator;

/**
 * Random flow. Each tick, with a small probability, sends a random-side order
 * of random size: usually a market order, otherwise a limit within a band
 * around the reference. Limit orders left resting too long are cancelled.
 */
public class NoiseTraderBehavior implements AgentBehavior {

    public static final double DEFAULT_PROBABILITY = 0.05;
    public static final long DEFAULT_MIN_SIZE = 10;
    public static final long DEFAULT_MAX_SIZE = 50;
    public static final double DEFAULT_MARKET_SHARE = 0.7;
    public static final double DEFAULT_LIMIT_BAND = 0.01;
    public static final long DEFAULT_MAX_ORDER_AGE_TICKS = 50;

    private final double probability;
    private final long minSize;
    private final long maxSize;
    private final double marketShare;
    private final double limitBand;
    private final long maxOrderAgeTicks;

    public NoiseTraderBehavior() {
        this(DEFAULT_PROBABILITY, DEFAULT_MIN_SIZE, DEFAULT_MAX_SIZE, DEFAULT_MARKET_SHARE, DEFAULT_LIMIT_BAND,
            DEFAULT_MAX_ORDER_AGE_TICKS);
    }

    public NoiseTraderBehavior(double probability, long minSize, long maxSize, double marketShare,
            double limitBand, long maxOrderAgeTicks) {
        if (minSize <= 0 || maxSize < minSize) {
            throw new IllegalArgumentException("invalid size range [" + minSize + ", " + maxSize + "]");
        }
        this.probability = probability;
        this.minSize = minSize;
        this.maxSize = maxSize;
        this.marketShare = marketShare;
        this.limitBand = limitBand;
        this.maxOrderAgeTicks = maxOrderAgeTicks;
    }

    @Override
    public Archetype archetype() {
        return Archetype.NOISE;
    }

    @Override
    public void act(Agent agent, AgentContext context, RandomGenerator random, List<OrderIntent> out) {
        long tick = context.tick();
        long now = context.now();

        for (long orderId : agent.openOrderIds()) {
            if (tick - agent.openedAt(orderId) >= maxOrderAgeTicks) {
                out.add(OrderIntent.cancel(agent.id(), orderId, now));
            }
        }

        if (random.nextDouble() >= probability) {
            return;
        }

        byte side = random.nextBoolean() ? Side.BUY : Side.SELL;
        long size = random.nextLong(minSize, maxSize + 1);

        if (random.nextDouble() < marketShare) {
            out.add(OrderIntent.market(agent.id(), side, size, now));
        } else {
            double offset = (random.nextDouble() * 2.0 - 1.0) * limitBand;
            double price = context.scale().round(context.referencePrice() * (1.0 + offset));
            if (price <= 0) {
                price = context.scale().tickSize();
            }
            out.add(OrderIntent.limit(agent.id(), side, size, price, now));
        }
        agent.markActed(tick);
    }
}
