package com.marketsim.core.liquidity;

import com.marketsim.api.Fill;
import com.marketsim.api.Side;

/**
 * <h1>Liquidity and Market Impact</h1>
 *
 * <p>
 * Every fill moves the price and eats depth:
 * </p>
 * <pre>
 *   impact   = sign(aggressor) * impactCoefficient * sqrt(quantity / current)
 *   current  = max(floor, current - quantity * depletionFactor)
 * </pre>
 * <p>
 * Impact is relative to price and accumulates until the price process drains
 * it on the next step. Between fills depth recovers towards baseline:
 * </p>
 * <pre>
 *   current += (baseline - current) * min(1, recoveryRate * elapsedTicks)
 * </pre>
 * <p>
 * The {@code min(1, ..)} clamp is what keeps recovery from overshooting the
 * baseline after a long quiet stretch; the floor keeps {@code sqrt(q / current)}
 * finite under a burst of fills.
 * </p>
 *
 * <p>
 * Not thread-safe; owned by one symbol.
 * </p>
 */
public class LiquidityModel {

    private final ImpactParameters parameters;
    private final LiquidityState state;
    private double pendingImpact;

    public LiquidityModel(double baseline, ImpactParameters parameters) {
        if (!(baseline > 0)) {
            throw new IllegalArgumentException("baseline must be positive: " + baseline);
        }
        this.parameters = parameters;
        this.state = new LiquidityState(baseline, baseline * parameters.floorFraction());
    }

    /**
     * Applies one fill.
     *
     * @return the signed relative impact this fill contributed
     */
    public double onFill(Fill fill) {
        return onFill(fill.side(), fill.quantity());
    }

    public double onFill(byte aggressorSide, long quantity) {
        if (quantity <= 0) {
            return 0.0;
        }
        double impact = Side.sign(aggressorSide) * rawImpact(quantity, state.current);
        pendingImpact += impact;
        state.current = Math.max(state.floor, state.current - quantity * parameters.depletionFactor());
        return impact;
    }

    /**
     * Recovers depth for the ticks elapsed since the last recovery. A tick at
     * or before the last one is a no-op.
     */
    public void recover(long tick) {
        long elapsed = tick - state.lastUpdateTick;
        if (elapsed <= 0) {
            return;
        }
        double step = Math.min(1.0, parameters.recoveryRate() * elapsed);
        state.current += (state.baseline - state.current) * step;
        if (state.current > state.baseline) {
            state.current = state.baseline;
        }
        state.lastUpdateTick = tick;
    }

    /**
     * Returns and clears the impact accumulated since the last drain.
     */
    public double drainImpact() {
        double impact = pendingImpact;
        pendingImpact = 0.0;
        return impact;
    }

    public double pendingImpact() {
        return pendingImpact;
    }

    /**
     * Relative price impact trading {@code quantity} lots right now would have.
     * Pure: depth and pending impact are left as they are.
     */
    public double estimateImpact(byte side, long quantity) {
        if (quantity <= 0) {
            return 0.0;
        }
        return Side.sign(side) * rawImpact(quantity, state.current);
    }

    private double rawImpact(long quantity, double liquidity) {
        return parameters.impactCoefficient() * Math.sqrt(quantity / liquidity);
    }

    public LiquidityState state() {
        return state;
    }

    public double current() {
        return state.current;
    }

    public ImpactParameters parameters() {
        return parameters;
    }
}
