package com.marketsim.core;

/**
 * Static parameters of one simulated symbol.
 *
 * @param symbol             symbol id, e.g. "AAPL"
 * @param initialPrice       starting reference price, also the mean-reversion anchor
 * @param priceDecimals      decimal places of the book's fixed-point tick
 * @param baseLiquidity      baseline depth of the liquidity model, in lots
 * @param volatility         per-tick volatility relative to price
 * @param momentumFactor     weight of the momentum term
 * @param momentumLookback   ticks between the current price and the momentum reference
 * @param meanReversionSpeed pull towards the anchor per tick
 */
public record SymbolSpec(
    String symbol,
    double initialPrice,
    int priceDecimals,
    double baseLiquidity,
    double volatility,
    double momentumFactor,
    int momentumLookback,
    double meanReversionSpeed
) {
    public static final int DEFAULT_PRICE_DECIMALS = 2;
    public static final double DEFAULT_BASE_LIQUIDITY = 10_000.0;
    public static final double DEFAULT_VOLATILITY = 0.002;
    public static final double DEFAULT_MOMENTUM_FACTOR = 0.1;
    public static final int DEFAULT_MOMENTUM_LOOKBACK = 5;
    public static final double DEFAULT_MEAN_REVERSION_SPEED = 0.01;

    public SymbolSpec {
        if (symbol == null || symbol.isEmpty()) {
            throw new IllegalArgumentException("symbol cannot be null or empty");
        }
        if (!(initialPrice > 0) || Double.isInfinite(initialPrice)) {
            throw new IllegalArgumentException("initialPrice must be positive: " + initialPrice);
        }
        if (!(baseLiquidity > 0)) {
            throw new IllegalArgumentException("baseLiquidity must be positive: " + baseLiquidity);
        }
        if (volatility < 0) {
            throw new IllegalArgumentException("volatility cannot be negative: " + volatility);
        }
        if (momentumLookback < 1) {
            throw new IllegalArgumentException("momentumLookback must be at least 1: " + momentumLookback);
        }
        if (meanReversionSpeed < 0 || meanReversionSpeed > 1) {
            throw new IllegalArgumentException("meanReversionSpeed must be within [0, 1]: " + meanReversionSpeed);
        }
        // Fails fast on an out-of-range precision.
        new PriceScale(priceDecimals);
    }

    public static SymbolSpec withDefaults(String symbol, double initialPrice) {
        return new SymbolSpec(symbol, initialPrice, DEFAULT_PRICE_DECIMALS, DEFAULT_BASE_LIQUIDITY,
            DEFAULT_VOLATILITY, DEFAULT_MOMENTUM_FACTOR, DEFAULT_MOMENTUM_LOOKBACK, DEFAULT_MEAN_REVERSION_SPEED);
    }

    /**
     * Parses a symbol configuration string.
     * Format: "SYMBOL:initialPrice" or "SYMBOL:initialPrice:decimals"
     * Example: "AAPL:150.0", "BTCUSDT:60000:1"
     */
    public static SymbolSpec fromString(String value) {
        String[] parts = value.split(":");
        if (parts.length < 2 || parts.length > 3) {
            throw new IllegalArgumentException("Invalid symbol spec format: " + value);
        }
        String symbol = parts[0].trim();
        double price;
        int decimals = DEFAULT_PRICE_DECIMALS;
        try {
            price = Double.parseDouble(parts[1].trim());
            if (parts.length == 3) {
                decimals = Integer.parseInt(parts[2].trim());
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid symbol spec format: " + value, e);
        }
        return withDefaults(symbol, price).withPriceDecimals(decimals);
    }

    public SymbolSpec withPriceDecimals(int decimals) {
        return new SymbolSpec(symbol, initialPrice, decimals, baseLiquidity, volatility, momentumFactor,
            momentumLookback, meanReversionSpeed);
    }

    public SymbolSpec withBaseLiquidity(double liquidity) {
        return new SymbolSpec(symbol, initialPrice, priceDecimals, liquidity, volatility, momentumFactor,
            momentumLookback, meanReversionSpeed);
    }

    public SymbolSpec withVolatility(double vol) {
        return new SymbolSpec(symbol, initialPrice, priceDecimals, baseLiquidity, vol, momentumFactor,
            momentumLookback, meanReversionSpeed);
    }

    public PriceScale priceScale() {
        return new PriceScale(priceDecimals);
    }
}
