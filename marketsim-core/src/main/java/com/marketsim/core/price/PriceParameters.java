package com.marketsim.core.price;

import com.marketsim.core.SymbolSpec;

/**
 * @param volatility         per-tick volatility relative to price
 * @param momentumFactor     weight of {@code current - price lookback ticks ago}
 * @param momentumLookback   ticks back to the momentum reference price
 * @param meanReversionSpeed pull towards the anchor per tick
 * @param dt                 time step of one tick in volatility units
 */
public record PriceParameters(
    double volatility,
    double momentumFactor,
    int momentumLookback,
    double meanReversionSpeed,
    double dt
) {
    public PriceParameters {
        if (volatility < 0) {
            throw new IllegalArgumentException("volatility cannot be negative: " + volatility);
        }
        if (momentumLookback < 1) {
            throw new IllegalArgumentException("momentumLookback must be at least 1: " + momentumLookback);
        }
        if (!(dt > 0)) {
            throw new IllegalArgumentException("dt must be positive: " + dt);
        }
    }

    public static PriceParameters of(SymbolSpec spec) {
        return new PriceParameters(spec.volatility(), spec.momentumFactor(), spec.momentumLookback(),
            spec.meanReversionSpeed(), 1.0);
    }
}
