package com.marketsim.core.agent;

import com.marketsim.api.MarketState;
import com.marketsim.core.PriceScale;

/**
 * What every agent may see when it acts: the fresh reference price of this
 * tick plus the market state published at the end of the previous one.
 *
 * @param tick             tick being processed
 * @param now              simulated millis of the tick, stamped on the intents
 * @param referencePrice   reference price just produced by the price process
 * @param relativeMomentum momentum term of that step divided by the price
 * @param liquidityRatio   current / baseline liquidity, in (0, 1]
 * @param lastState        previous tick's market state
 * @param scale            the symbol's price scale, for rounding limit prices
 */
public record AgentContext(
    long tick,
    long now,
    double referencePrice,
    double relativeMomentum,
    double liquidityRatio,
    MarketState lastState,
    PriceScale scale
) {
    /**
     * Largest tick price at or below {@code price}, never below one tick.
     */
    public double floorToTick(double price) {
        long ticks = (long) Math.floor(price / scale.tickSize() + 1e-9);
        return scale.toPrice(Math.max(1, ticks));
    }

    /**
     * Smallest tick price at or above {@code price}.
     */
    public double ceilToTick(double price) {
        long ticks = (long) Math.ceil(price / scale.tickSize() - 1e-9);
        return scale.toPrice(Math.max(1, ticks));
    }
}
