package com.marketsim.core.liquidity;

/**
 * Constants of the square-root impact law and of liquidity recovery.
 *
 * @param impactCoefficient scales {@code sqrt(quantity / liquidity)} into a relative price move
 * @param depletionFactor   lots of liquidity removed per lot traded
 * @param recoveryRate      fraction of the gap to baseline recovered per elapsed tick
 * @param floorFraction     lowest liquidity as a fraction of baseline
 */
public record ImpactParameters(
    double impactCoefficient,
    double depletionFactor,
    double recoveryRate,
    double floorFraction
) {
    public static final ImpactParameters DEFAULT = new ImpactParameters(0.1, 1.0, 0.05, 0.05);

    public ImpactParameters {
        if (impactCoefficient < 0) {
            throw new IllegalArgumentException("impactCoefficient cannot be negative: " + impactCoefficient);
        }
        if (depletionFactor < 0) {
            throw new IllegalArgumentException("depletionFactor cannot be negative: " + depletionFactor);
        }
        if (recoveryRate < 0 || recoveryRate > 1) {
            throw new IllegalArgumentException("recoveryRate must be within [0, 1]: " + recoveryRate);
        }
        if (!(floorFraction > 0) || floorFraction > 1) {
            throw new IllegalArgumentException("floorFraction must be within (0, 1]: " + floorFraction);
        }
    }
}
