package com.marketsim.api;

/**
 * Per-symbol snapshot rebuilt once per tick. Read-only to every consumer.
 *
 * @param symbol         symbol id
 * @param timestamp      simulated epoch millis of the tick that produced it
 * @param lastPrice      last traded price, the initial price until the first trade
 * @param referencePrice fair price produced by the price process
 * @param volume         accumulated traded lots since start
 * @param liquidity      current depth of the liquidity model
 * @param realizedVol    stdev of log returns over the rolling window
 * @param momentum       momentum term of the last price step
 * @param spread         best ask minus best bid, {@code NaN} for a one-sided book
 */
public record MarketState(
    String symbol,
    long timestamp,
    double lastPrice,
    double referencePrice,
    long volume,
    double liquidity,
    double realizedVol,
    double momentum,
    double spread
) {
    /**
     * Momentum relative to the reference price, the signal agents compare
     * against their thresholds.
     */
    public double relativeMomentum() {
        return referencePrice > 0 ? momentum / referencePrice : 0.0;
    }
}
