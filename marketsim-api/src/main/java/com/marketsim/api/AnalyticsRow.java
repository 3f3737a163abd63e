package com.marketsim.api;

/**
 * Microstructure metrics for one symbol and one tick. Values that cannot be
 * computed (one-sided book, no fills in the tick) are {@code Double.NaN}.
 */
public record AnalyticsRow(
    String symbol,
    long timestamp,
    double bidAskSpread,
    double midPrice,
    double imbalance,
    long bidDepth,
    long askDepth,
    double effectiveSpread,
    double priceImpact,
    double realizedVolatility,
    double vwap,
    long tickVolume
) {
}
