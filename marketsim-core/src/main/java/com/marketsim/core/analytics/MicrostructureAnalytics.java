package com.marketsim.core.analytics;

import com.marketsim.api.AnalyticsRow;
import com.marketsim.api.Fill;
import com.marketsim.api.Side;
import com.marketsim.core.MatchResult;
import com.marketsim.core.OrderBook;

import java.util.List;

/**
 * <h1>Microstructure Analytics</h1>
 *
 * <p>
 * One {@link AnalyticsRow} per symbol per tick, computed from the book after
 * the tick's matching, the tick's match results and a rolling window of
 * per-tick last prices.
 * </p>
 *
 * <table border="1">
 * <tr><th>Metric</th><th>Definition</th></tr>
 * <tr><td>bidAskSpread</td><td>best ask - best bid</td></tr>
 * <tr><td>midPrice</td><td>(best bid + best ask) / 2</td></tr>
 * <tr><td>imbalance</td><td>(bidDepth - askDepth) / (bidDepth + askDepth) over the top levels</td></tr>
 * <tr><td>effectiveSpread</td><td>mean of 2 * |fill price - mid before the order|</td></tr>
 * <tr><td>priceImpact</td><td>quantity weighted mean of sign * (mid after - mid before) / mid before</td></tr>
 * <tr><td>realizedVolatility</td><td>stdev of log returns over the window</td></tr>
 * <tr><td>vwap</td><td>sum(price * qty) / sum(qty) over the tick's fills</td></tr>
 * </table>
 * <p>
 * Anything that cannot be computed (one-sided book, no fills) is NaN.
 * </p>
 */
public class MicrostructureAnalytics {

    public static final int DEFAULT_DEPTH_LEVELS = 5;
    public static final int DEFAULT_VOLATILITY_WINDOW = 20;

    private final String symbol;
    private final int depthLevels;
    private final RollingWindow prices;

    public MicrostructureAnalytics(String symbol) {
        this(symbol, DEFAULT_DEPTH_LEVELS, DEFAULT_VOLATILITY_WINDOW);
    }

    public MicrostructureAnalytics(String symbol, int depthLevels, int volatilityWindow) {
        this.symbol = symbol;
        this.depthLevels = depthLevels;
        // n + 1 prices give n returns
        this.prices = new RollingWindow(volatilityWindow + 1);
    }

    /**
     * Records the tick's last price. Call once per tick before {@link #compute}.
     */
    public void recordPrice(double lastPrice) {
        if (lastPrice > 0) {
            prices.add(lastPrice);
        }
    }

    public double realizedVolatility() {
        return prices.logReturnStdDev();
    }

    public AnalyticsRow compute(OrderBook book, List<MatchResult> results, long timestamp) {
        double bestBid = book.bestBid();
        double bestAsk = book.bestAsk();
        double spread = bestAsk - bestBid;
        double mid = (bestBid + bestAsk) / 2.0;

        long bidDepth = book.depth(Side.BUY, depthLevels);
        long askDepth = book.depth(Side.SELL, depthLevels);
        long totalDepth = bidDepth + askDepth;
        double imbalance = totalDepth > 0 ? (bidDepth - askDepth) / (double) totalDepth : Double.NaN;

        double spreadSum = 0;
        long spreadQty = 0;
        double impactSum = 0;
        long impactQty = 0;
        double notional = 0;
        long volume = 0;

        for (MatchResult result : results) {
            if (result.filledQuantity() == 0) {
                continue;
            }
            double midBefore = result.midBefore();
            for (Fill fill : result.fills()) {
                notional += fill.notional();
                volume += fill.quantity();
                if (!Double.isNaN(midBefore)) {
                    spreadSum += 2.0 * Math.abs(fill.price() - midBefore) * fill.quantity();
                    spreadQty += fill.quantity();
                }
            }
            if (!Double.isNaN(midBefore) && !Double.isNaN(result.midAfter()) && midBefore > 0) {
                double move = Side.sign(result.side()) * (result.midAfter() - midBefore) / midBefore;
                impactSum += move * result.filledQuantity();
                impactQty += result.filledQuantity();
            }
        }

        return new AnalyticsRow(
            symbol,
            timestamp,
            spread,
            mid,
            imbalance,
            bidDepth,
            askDepth,
            spreadQty > 0 ? spreadSum / spreadQty : Double.NaN,
            impactQty > 0 ? impactSum / impactQty : Double.NaN,
            prices.logReturnStdDev(),
            volume > 0 ? notional / volume : Double.NaN,
            volume);
    }
}
