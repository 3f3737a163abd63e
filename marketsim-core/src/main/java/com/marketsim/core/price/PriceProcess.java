package com.marketsim.core.price;

import java.util.random.RandomGenerator;

/**
 * <h1>Reference Price Process</h1>
 *
 * <pre>
 *   next = current
 *        + N(0, volatility * sqrt(dt)) * current     brownian
 *        + momentumFactor * (current - price[k ago])  momentum
 *        - meanReversionSpeed * (current - anchor)    mean reversion
 *        + current * accumulatedImpact                impact from fills
 * </pre>
 * <p>
 * The result never falls below half the previous price.
 * </p>
 * <p>
 * {@link #step} is a pure function of its arguments: the caller owns the random
 * source, so the same seed replays the same path.
 * </p>
 */
public class PriceProcess {

    private static final double FLOOR_FRACTION = 0.5;

    private final PriceParameters parameters;
    private final double sqrtDt;

    public PriceProcess(PriceParameters parameters) {
        this.parameters = parameters;
        this.sqrtDt = Math.sqrt(parameters.dt());
    }

    /**
     * @param accumulatedImpact relative price nudge accumulated from fills since
     *                          the last step
     */
    public PriceState step(PriceState previous, double accumulatedImpact, RandomGenerator random) {
        double current = previous.price();

        double brownian = random.nextGaussian() * parameters.volatility() * sqrtDt * current;
        double momentum = momentumTerm(previous);
        double meanReversion = parameters.meanReversionSpeed() * (current - previous.anchor());
        double impact = current * accumulatedImpact;

        double next = current + brownian + momentum - meanReversion + impact;
        double floor = current * FLOOR_FRACTION;
        if (!(next >= floor)) {
            next = floor;
        }

        return previous.next(next, momentum, parameters.momentumLookback() + 1);
    }

    /**
     * Momentum the next step would apply from {@code state}.
     */
    public double momentumTerm(PriceState state) {
        return parameters.momentumFactor() * (state.price() - state.priceAgo(parameters.momentumLookback()));
    }

    public PriceParameters parameters() {
        return parameters;
    }
}
