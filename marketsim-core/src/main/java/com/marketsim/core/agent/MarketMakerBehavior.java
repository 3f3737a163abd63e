package com.marketsim.core.agent;

import com.marketsim.api.Side;
import com.marketsim.core.execution.OrderIntent;

import java.util.List;
import java.util.random.RandomGenerator;

/**
 * Cancels its previous quotes and posts a fresh bid and ask every tick.
 * <pre>
 *   halfSpread = reference * baseHalfSpread * spreadMultiplier / liquidityRatio
 *   skew       = reference * inventorySkew * position
 *   bid = floor(reference - halfSpread - skew)    ask = ceil(reference + halfSpread - skew)
 * </pre>
 * A long maker lowers both quotes to shed inventory, a short one raises them.
 */
public class MarketMakerBehavior implements AgentBehavior {

    public static final double DEFAULT_BASE_HALF_SPREAD = 0.0005;
    public static final long DEFAULT_QUOTE_SIZE = 100;
    public static final double DEFAULT_INVENTORY_SKEW = 0.000002;

    private final double baseHalfSpread;
    private final long quoteSize;
    private final double inventorySkew;

    public MarketMakerBehavior() {
        this(DEFAULT_BASE_HALF_SPREAD, DEFAULT_QUOTE_SIZE, DEFAULT_INVENTORY_SKEW);
    }

    public MarketMakerBehavior(double baseHalfSpread, long quoteSize, double inventorySkew) {
        this.baseHalfSpread = baseHalfSpread;
        this.quoteSize = quoteSize;
        this.inventorySkew = inventorySkew;
    }

    @Override
    public Archetype archetype() {
        return Archetype.MARKET_MAKER;
    }

    @Override
    public void act(Agent agent, AgentContext context, RandomGenerator random, List<OrderIntent> out) {
        long now = context.now();
        for (long orderId : agent.openOrderIds()) {
            out.add(OrderIntent.cancel(agent.id(), orderId, now));
        }

        double reference = context.referencePrice();
        double halfSpread = reference * halfSpreadFraction(agent, context.liquidityRatio());
        double skew = reference * inventorySkew * agent.position();

        double bid = context.floorToTick(reference - halfSpread - skew);
        double ask = context.ceilToTick(reference + halfSpread - skew);
        if (ask <= bid) {
            ask = context.ceilToTick(bid + context.scale().tickSize());
        }

        out.add(OrderIntent.limit(agent.id(), Side.BUY, quoteSize, bid, now));
        out.add(OrderIntent.limit(agent.id(), Side.SELL, quoteSize, ask, now));
        agent.markActed(context.tick());
    }

    /**
     * Half spread relative to price, widened as liquidity drains.
     */
    public double halfSpreadFraction(Agent agent, double liquidityRatio) {
        double ratio = liquidityRatio > 0 ? liquidityRatio : 1.0;
        return baseHalfSpread * agent.spreadMultiplier() / ratio;
    }

    public long quoteSize() {
        return quoteSize;
    }
}
