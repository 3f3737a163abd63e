package com.marketsim.core.agent;

import com.marketsim.api.Side;
import com.marketsim.core.execution.OrderIntent;

import java.util.List;
import java.util.random.RandomGenerator;

/**
 * Trades in the direction of the price process's momentum once it clears a
 * threshold, sizing up with conviction.
 * <pre>
 *   conviction = min(maxConviction, |relativeMomentum| / threshold)
 *   size       = round(baseSize * conviction)
 * </pre>
 */
public class InformedTraderBehavior implements AgentBehavior {

    public static final double DEFAULT_PROBABILITY = 0.10;
    public static final double DEFAULT_THRESHOLD = 0.002;
    public static final long DEFAULT_BASE_SIZE = 75;
    public static final double DEFAULT_MAX_CONVICTION = 3.0;

    private final double probability;
    private final double threshold;
    private final long baseSize;
    private final double maxConviction;

    public InformedTraderBehavior() {
        this(DEFAULT_PROBABILITY, DEFAULT_THRESHOLD, DEFAULT_BASE_SIZE, DEFAULT_MAX_CONVICTION);
    }

    public InformedTraderBehavior(double probability, double threshold, long baseSize, double maxConviction) {
        if (!(threshold > 0)) {
            throw new IllegalArgumentException("threshold must be positive: " + threshold);
        }
        this.probability = probability;
        this.threshold = threshold;
        this.baseSize = baseSize;
        this.maxConviction = maxConviction;
    }

    @Override
    public Archetype archetype() {
        return Archetype.INFORMED;
    }

    @Override
    public void act(Agent agent, AgentContext context, RandomGenerator random, List<OrderIntent> out) {
        if (random.nextDouble() >= probability) {
            return;
        }
        double momentum = context.relativeMomentum();
        if (Math.abs(momentum) < threshold) {
            return;
        }

        long size = sizeFor(momentum);
        byte side = momentum > 0 ? Side.BUY : Side.SELL;
        out.add(OrderIntent.market(agent.id(), side, size, context.now()));
        agent.markActed(context.tick());
    }

    public long sizeFor(double relativeMomentum) {
        double conviction = Math.min(maxConviction, Math.abs(relativeMomentum) / threshold);
        return Math.max(1, Math.round(baseSize * conviction));
    }
}
