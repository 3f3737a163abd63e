package com.marketsim.core;

import com.marketsim.api.AnalyticsRow;
import com.marketsim.api.BookSnapshot;
import com.marketsim.api.Fill;
import com.marketsim.api.MarketState;
import com.marketsim.api.OrderView;
import com.marketsim.api.SubmitResult;
import com.marketsim.core.agent.AgentContext;
import com.marketsim.core.agent.AgentPopulation;
import com.marketsim.core.analytics.MicrostructureAnalytics;
import com.marketsim.core.execution.ExecutionEngine;
import com.marketsim.core.execution.ExecutionListener;
import com.marketsim.core.execution.OrderIntent;
import com.marketsim.core.execution.PendingIntent;
import com.marketsim.core.liquidity.LiquidityModel;
import com.marketsim.core.price.PriceParameters;
import com.marketsim.core.price.PriceProcess;
import com.marketsim.core.price.PriceState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.SplittableRandom;

/**
 * <h1>One Symbol's Market</h1>
 *
 * <p>
 * Owns every per-symbol component and chains them once per tick:
 * </p>
 * <pre>
 *   liquidity recovery
 *     -> price process (drains accumulated impact)
 *     -> agents act (intents)
 *     -> execution engine (latency) -> matching engine / order book
 *     -> fills feed liquidity, agent portfolios, last price and volume
 *     -> analytics and market state
 * </pre>
 *
 * <h2>Threading</h2>
 * <p>
 * Every public method is {@code synchronized} on the market. A tick is
 * processed to completion under the monitor, so an external submit or query
 * lands between two ticks, never inside one. Different symbols share nothing
 * and may tick on different threads.
 * </p>
 *
 * <h2>Determinism</h2>
 * <p>
 * The only random source is a {@link SplittableRandom} seeded from the master
 * seed and the symbol index. Agents draw from it in id order and the price
 * process once per tick, so the same seed and the same external calls replay
 * the same fills.
 * </p>
 */
public class SymbolMarket implements MatchEventListener, ExecutionListener {

    private static final Logger log = LoggerFactory.getLogger(SymbolMarket.class);

    private static final long SEED_STRIDE = 0x9E3779B97F4A7C15L;

    private final SymbolSpec spec;
    private final int symbolIndex;
    private final MarketSettings settings;
    private final SplittableRandom random;

    private final MatchingEngine matchingEngine;
    private final LiquidityModel liquidity;
    private final PriceProcess priceProcess;
    private final ExecutionEngine execution;
    private final AgentPopulation population;
    private final MicrostructureAnalytics analytics;

    private PriceState priceState;
    private MarketState marketState;
    private AnalyticsRow lastAnalytics;

    private long currentTick;
    private long currentTime;
    private double lastPrice;
    private long totalVolume;
    private long fillCount;

    // Collected between two ticks, drained by processTick
    private final List<Fill> pendingFills = new ArrayList<>();
    private final List<MatchResult> pendingResults = new ArrayList<>();

    public SymbolMarket(SymbolSpec spec, int symbolIndex, MarketSettings settings) {
        this(spec, symbolIndex, settings, null);
    }

    /**
     * @param population agents to use, or null to create the settings' mix from
     *                   the symbol's random stream
     */
    public SymbolMarket(SymbolSpec spec, int symbolIndex, MarketSettings settings, AgentPopulation population) {
        this.spec = spec;
        this.symbolIndex = symbolIndex;
        this.settings = settings;
        this.random = new SplittableRandom(settings.seed() ^ (SEED_STRIDE * (symbolIndex + 1L)));

        this.matchingEngine = new MatchingEngine(spec.symbol(), symbolIndex, spec.priceScale(), this);
        this.liquidity = new LiquidityModel(spec.baseLiquidity(), settings.impact());
        this.priceProcess = new PriceProcess(PriceParameters.of(spec));
        this.execution = new ExecutionEngine(matchingEngine, settings.latencyMs(), this);
        this.population = population != null ? population : AgentPopulation.create(settings.agentMix(), random);
        this.analytics = new MicrostructureAnalytics(spec.symbol());

        this.priceState = PriceState.initial(spec.initialPrice());
        this.currentTime = settings.timeOf(0);
        this.lastPrice = spec.initialPrice();
        this.marketState = new MarketState(spec.symbol(), currentTime, lastPrice, lastPrice, 0,
            liquidity.current(), Double.NaN, 0.0, Double.NaN);
        this.lastAnalytics = analytics.compute(matchingEngine.getOrderBook(), List.of(), currentTime);
    }

    /**
     * Runs one full tick.
     *
     * @param tick             tick number, strictly increasing from 1
     * @param snapshotDepth    levels per side to capture for a book snapshot, 0 for none
     * @throws MatchingStateCorruptedException if the book breaks an invariant
     */
    public synchronized TickResult processTick(long tick, int snapshotDepth) {
        if (tick <= currentTick) {
            throw new IllegalArgumentException("tick " + tick + " is not after " + currentTick);
        }
        long now = settings.timeOf(tick);
        currentTick = tick;
        currentTime = now;

        liquidity.recover(tick);
        priceState = priceProcess.step(priceState, liquidity.drainImpact(), random);
        double reference = priceState.price();

        AgentContext context = new AgentContext(tick, now, reference, priceState.momentumTerm() / reference,
            liquidity.state().ratio(), marketState, matchingEngine.scale());
        List<OrderIntent> intents = population.act(context, random);
        for (OrderIntent intent : intents) {
            execution.accept(intent);
        }

        // Everything due before the next tick reaches the book now.
        List<MatchResult> released = execution.advance(now + settings.tickIntervalMs() - 1);
        pendingResults.addAll(released);

        OrderBook book = matchingEngine.getOrderBook();
        analytics.recordPrice(lastPrice);
        lastAnalytics = analytics.compute(book, pendingResults, now);
        marketState = new MarketState(spec.symbol(), now, lastPrice, reference, totalVolume, liquidity.current(),
            analytics.realizedVolatility(), priceState.momentumTerm(), book.spread());

        BookSnapshot snapshot = snapshotDepth > 0 ? book.snapshot(snapshotDepth, now) : null;
        TickResult result = new TickResult(spec.symbol(), tick, now, pendingFills, marketState, lastAnalytics,
            snapshot);

        if (log.isDebugEnabled()) {
            log.debug("{} tick={} ref={} last={} intents={} fills={} resting={} liquidity={}", spec.symbol(), tick,
                reference, lastPrice, intents.size(), pendingFills.size(), book.restingOrderCount(),
                liquidity.current());
        }

        pendingFills.clear();
        pendingResults.clear();
        return result;
    }

    /**
     * Matches an order immediately, without modelled latency. Its fills are
     * reported with the next tick.
     *
     * @param limitPrice NaN when absent
     */
    public synchronized SubmitResult submitExternal(byte side, byte kind, long quantity, double limitPrice) {
        MatchResult result = matchingEngine.submit(side, kind, quantity, limitPrice, currentTime, currentTime);
        if (result.orderId() != 0) {
            pendingResults.add(result);
        }
        return result.toSubmitResult();
    }

    public synchronized boolean cancel(long orderId) {
        return matchingEngine.cancel(orderId);
    }

    public synchronized Optional<OrderView> findOrder(long orderId) {
        return matchingEngine.getOrderBook().find(orderId);
    }

    public synchronized BookSnapshot snapshot(int depth) {
        return matchingEngine.getOrderBook().snapshot(depth, currentTime);
    }

    public synchronized MarketState marketState() {
        return marketState;
    }

    public synchronized AnalyticsRow analytics() {
        return lastAnalytics;
    }

    public synchronized double estimateImpact(byte side, long quantity) {
        return liquidity.estimateImpact(side, quantity);
    }

    public synchronized void verifyInvariants() {
        matchingEngine.getOrderBook().verifyInvariants();
    }

    public synchronized int restingOrderCount() {
        return matchingEngine.getOrderBook().restingOrderCount();
    }

    public synchronized int pendingIntentCount() {
        return execution.pendingCount();
    }

    public synchronized long fillCount() {
        return fillCount;
    }

    public synchronized long currentTick() {
        return currentTick;
    }

    public synchronized double liquidity() {
        return liquidity.current();
    }

    public String symbol() {
        return spec.symbol();
    }

    public int symbolIndex() {
        return symbolIndex;
    }

    public SymbolSpec spec() {
        return spec;
    }

    public int agentCount() {
        return population.size();
    }

    /**
     * For inspection in tests. Callers must not mutate agents.
     */
    public AgentPopulation population() {
        return population;
    }

    // -------------------------------------------------------------------------
    // Book and execution callbacks, always under the market's monitor
    // -------------------------------------------------------------------------

    @Override
    public void onTrade(Fill fill) {
        liquidity.onFill(fill);
        population.onPassiveFill(fill);
        lastPrice = fill.price();
        totalVolume += fill.quantity();
        fillCount++;
        pendingFills.add(fill);
    }

    @Override
    public void onOrderRested(long orderId, byte side, long price, long quantity) {
        // Ownership is recorded from the match result once the order is released.
    }

    @Override
    public void onOrderRemoved(long orderId, byte side, long remainingQuantity, boolean cancelled) {
        population.onOrderRemoved(orderId);
    }

    @Override
    public void onOrderReleased(PendingIntent pending, MatchResult result) {
        population.onOrderReleased(pending.intent().agentId(), result, currentTick);
    }

    @Override
    public void onCancelReleased(PendingIntent pending, boolean cancelled) {
        if (!cancelled && log.isTraceEnabled()) {
            log.trace("{} agent {} cancel of {} found nothing to cancel", spec.symbol(), pending.intent().agentId(),
                pending.intent().targetOrderId());
        }
    }
}
