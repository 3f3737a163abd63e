package com.marketsim.core.agent;

import com.marketsim.api.Side;
import com.marketsim.core.execution.OrderIntent;

import java.util.List;
import java.util.random.RandomGenerator;

/**
 * Follows the trend of the reference price over its own lookback. When the
 * move clears the threshold it sends a marketable limit order a few basis
 * points through the reference.
 * <p>
 * Every agent records the reference price each tick, whether or not it trades,
 * so its memory is always the last {@code lookback + 1} prices. Whatever is
 * left of its previous order is cancelled before it acts again.
 * </p>
 */
public class MomentumTraderBehavior implements AgentBehavior {

    public static final int DEFAULT_LOOKBACK = 20;
    public static final double DEFAULT_PROBABILITY = 0.08;
    public static final double DEFAULT_THRESHOLD = 0.001;
    public static final double DEFAULT_THROUGH_FRACTION = 0.0005;
    public static final long DEFAULT_SIZE = 60;

    private final int lookback;
    private final double probability;
    private final double threshold;
    private final double throughFraction;
    private final long size;

    public MomentumTraderBehavior() {
        this(DEFAULT_LOOKBACK, DEFAULT_PROBABILITY, DEFAULT_THRESHOLD, DEFAULT_THROUGH_FRACTION, DEFAULT_SIZE);
    }

    public MomentumTraderBehavior(int lookback, double probability, double threshold, double throughFraction,
            long size) {
        if (lookback < 1) {
            throw new IllegalArgumentException("lookback must be at least 1: " + lookback);
        }
        this.lookback = lookback;
        this.probability = probability;
        this.threshold = threshold;
        this.throughFraction = throughFraction;
        this.size = size;
    }

    @Override
    public Archetype archetype() {
        return Archetype.MOMENTUM;
    }

    /**
     * Length of the price memory an agent driven by this behavior needs.
     */
    public int memoryLength() {
        return lookback + 1;
    }

    @Override
    public void act(Agent agent, AgentContext context, RandomGenerator random, List<OrderIntent> out) {
        double reference = context.referencePrice();
        agent.remember(reference);

        // Leftovers of last tick's marketable order are stale by now.
        long now = context.now();
        for (long orderId : agent.openOrderIds()) {
            out.add(OrderIntent.cancel(agent.id(), orderId, now));
        }

        if (random.nextDouble() >= probability || !agent.memoryFull()) {
            return;
        }

        double past = agent.oldestRemembered();
        double trend = (reference - past) / past;
        if (Math.abs(trend) < threshold) {
            return;
        }

        if (trend > 0) {
            double price = context.ceilToTick(reference * (1.0 + throughFraction));
            out.add(OrderIntent.limit(agent.id(), Side.BUY, size, price, now));
        } else {
            double price = context.floorToTick(reference * (1.0 - throughFraction));
            out.add(OrderIntent.limit(agent.id(), Side.SELL, size, price, now));
        }
        agent.markActed(context.tick());
    }
}
