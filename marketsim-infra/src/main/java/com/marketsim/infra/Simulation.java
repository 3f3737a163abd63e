package com.marketsim.infra;

import com.marketsim.api.AnalyticsRow;
import com.marketsim.api.BookSnapshot;
import com.marketsim.api.MarketSimulator;
import com.marketsim.api.MarketState;
import com.marketsim.api.OrderView;
import com.marketsim.api.PersistenceSink;
import com.marketsim.api.RejectReason;
import com.marketsim.api.SimulationNotRunningException;
import com.marketsim.api.SimulationState;
import com.marketsim.api.SimulationStatus;
import com.marketsim.api.SubmitResult;
import com.marketsim.api.UnknownSymbolException;
import com.marketsim.core.IdSequence;
import com.marketsim.core.MarketSettings;
import com.marketsim.core.MatchingStateCorruptedException;
import com.marketsim.core.SymbolMarket;
import com.marketsim.core.SymbolSpec;
import com.marketsim.core.TickResult;
import com.marketsim.infra.config.SimulationConfig;
import com.marketsim.infra.metrics.SimulationMetrics;
import com.marketsim.infra.persistence.PersistenceDispatcher;
import org.agrona.collections.Int2ObjectHashMap;
import org.agrona.concurrent.IdleStrategy;
import org.agrona.concurrent.SleepingMillisIdleStrategy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;

/**
 * <b>The Simulation Orchestrator.</b>
 * <p>
 * Composition root of a simulation instance: one {@link SymbolMarket} per
 * configured symbol, an optional persistence ring in front of a
 * {@link PersistenceSink}, and the lifecycle that drives the tick loop.
 * </p>
 *
 * <h3>Threading:</h3>
 *
 * <pre>
 * [tick loop thread] --tickLock--> SymbolMarket.processTick (each symbol, optionally on workers)
 *         |
 *         +--> PersistenceDispatcher.publish (symbol order) --> [writer thread] --> sink
 *
 * [API callers] --SymbolMarket monitor--> submit / cancel / queries, between ticks
 * </pre>
 *
 * <p>
 * Lifecycle transitions happen under {@code lifecycleLock}; the loop reads the
 * volatile state before every tick, so a pause or stop is honoured at the next
 * tick boundary and a tick in progress always completes.
 * </p>
 */
public class Simulation implements MarketSimulator, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Simulation.class);

    private static final long JOIN_TIMEOUT_MS = 10_000;
    private static final long STEP = -1;

    private final SimulationConfig config;
    private final SimulationMetrics metrics;
    private final List<SymbolMarket> markets;
    private final Map<String, SymbolMarket> bySymbol;
    private final Int2ObjectHashMap<SymbolMarket> byIndex;
    private final List<String> symbols;
    private final int agentCount;
    private final PersistenceDispatcher dispatcher;
    private final ExecutorService workers;

    private final Object lifecycleLock = new Object();
    private final ReentrantLock tickLock = new ReentrantLock();
    private volatile SimulationState state = SimulationState.INITIALIZED;
    private volatile long currentTick;
    private Thread loopThread;
    // Bumped on every loop start; a loop keeps ticking only while it owns the current generation.
    private volatile long loopGeneration;
    private boolean resourcesReleased;

    public Simulation(SimulationConfig config) {
        this(config, null, SimulationMetrics.unregistered());
    }

    /**
     * @param sink    where tick records go, or null to run without persistence
     * @param metrics metrics to update
     */
    public Simulation(SimulationConfig config, PersistenceSink sink, SimulationMetrics metrics) {
        this.config = config;
        this.metrics = metrics;

        MarketSettings settings = config.marketSettings();
        List<SymbolMarket> list = new ArrayList<>(config.symbols().size());
        Map<String, SymbolMarket> map = new HashMap<>();
        this.byIndex = new Int2ObjectHashMap<>();
        int agents = 0;
        for (int i = 0; i < config.symbols().size(); i++) {
            SymbolSpec spec = config.symbols().get(i);
            SymbolMarket market = new SymbolMarket(spec, i, settings);
            list.add(market);
            map.put(spec.symbol(), market);
            byIndex.put(i, market);
            agents += market.agentCount();
        }
        this.markets = Collections.unmodifiableList(list);
        this.bySymbol = map;
        this.symbols = config.symbolNames();
        this.agentCount = agents;

        this.dispatcher = sink != null ? new PersistenceDispatcher(sink, config.ringSize(), metrics) : null;
        this.workers = config.workerThreads() > 1 ? newWorkerPool(config.workerThreads()) : null;

        metrics.setState(state);
        log.info("Simulation initialized: symbols={}, agents={}, seed={}, tickIntervalMs={}, latencyMs={}, "
                + "workers={}, persistence={}", symbols, agentCount, config.seed(), config.tickIntervalMs(),
            config.latencyMs(), config.workerThreads(), dispatcher != null);
    }

    private static ExecutorService newWorkerPool(int threads) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, r -> {
            Thread thread = new Thread(r, "marketsim-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    // -------------------------------------------------------------------------
    // Orders and queries
    // -------------------------------------------------------------------------

    @Override
    public SubmitResult submitOrder(String symbol, byte side, byte kind, long quantity, Double limitPrice) {
        ensureNotStopped();
        SymbolMarket market = symbol == null ? null : bySymbol.get(symbol);
        if (market == null) {
            return SubmitResult.rejected(0, RejectReason.UNKNOWN_SYMBOL);
        }
        double limit = limitPrice == null ? Double.NaN : limitPrice;
        return market.submitExternal(side, kind, quantity, limit);
    }

    @Override
    public boolean cancelOrder(long orderId) {
        ensureNotStopped();
        SymbolMarket market = byIndex.get(IdSequence.symbolIndexOf(orderId));
        return market != null && market.cancel(orderId);
    }

    @Override
    public Optional<OrderView> findOrder(long orderId) {
        ensureNotStopped();
        SymbolMarket market = byIndex.get(IdSequence.symbolIndexOf(orderId));
        return market == null ? Optional.empty() : market.findOrder(orderId);
    }

    @Override
    public BookSnapshot getOrderBook(String symbol, int depth) {
        ensureNotStopped();
        if (depth < 1) {
            throw new IllegalArgumentException("depth must be at least 1: " + depth);
        }
        return market(symbol).snapshot(depth);
    }

    @Override
    public MarketState getMarketState(String symbol) {
        ensureNotStopped();
        return market(symbol).marketState();
    }

    @Override
    public AnalyticsRow getAnalytics(String symbol) {
        ensureNotStopped();
        return market(symbol).analytics();
    }

    @Override
    public double estimateImpact(String symbol, byte side, long quantity) {
        ensureNotStopped();
        return market(symbol).estimateImpact(side, quantity);
    }

    @Override
    public List<String> listSymbols() {
        ensureNotStopped();
        return symbols;
    }

    private SymbolMarket market(String symbol) {
        SymbolMarket market = symbol == null ? null : bySymbol.get(symbol);
        if (market == null) {
            throw new UnknownSymbolException(symbol);
        }
        return market;
    }

    // -------------------------------------------------------------------------
    // Lifecycle
    // -------------------------------------------------------------------------

    @Override
    public void advanceTick() {
        synchronized (lifecycleLock) {
            ensureNotStopped();
            if (state == SimulationState.RUNNING) {
                throw new IllegalStateException("advanceTick is not allowed while RUNNING");
            }
            tickOnce(STEP);
        }
    }

    @Override
    public void start() {
        synchronized (lifecycleLock) {
            ensureNotStopped();
            if (state != SimulationState.INITIALIZED) {
                throw new IllegalStateException("cannot start from " + state);
            }
            transition(SimulationState.RUNNING);
            startLoop();
        }
    }

    @Override
    public void pause() {
        Thread loop;
        synchronized (lifecycleLock) {
            ensureNotStopped();
            if (state == SimulationState.PAUSED) {
                return;
            }
            if (state != SimulationState.RUNNING) {
                throw new IllegalStateException("cannot pause from " + state);
            }
            transition(SimulationState.PAUSED);
            loop = loopThread;
            loopThread = null;
        }
        awaitLoopExit(loop);
    }

    @Override
    public void resume() {
        synchronized (lifecycleLock) {
            ensureNotStopped();
            if (state == SimulationState.RUNNING) {
                return;
            }
            if (state != SimulationState.PAUSED) {
                throw new IllegalStateException("cannot resume from " + state);
            }
            transition(SimulationState.RUNNING);
            startLoop();
        }
    }

    @Override
    public void stop() {
        Thread loop;
        synchronized (lifecycleLock) {
            if (state == SimulationState.STOPPED) {
                return;
            }
            transition(SimulationState.STOPPED);
            loop = loopThread;
            loopThread = null;
        }
        awaitLoopExit(loop);
        releaseResources();
    }

    @Override
    public void close() {
        stop();
    }

    @Override
    public SimulationState state() {
        return state;
    }

    @Override
    public SimulationStatus status() {
        long fills = 0;
        for (SymbolMarket market : markets) {
            fills += market.fillCount();
        }
        long dropped = dispatcher == null ? 0 : dispatcher.droppedWrites() + dispatcher.sinkFailures();
        return new SimulationStatus(state, currentTick, symbols, agentCount, fills, dropped, dispatcher != null);
    }

    public long currentTick() {
        return currentTick;
    }

    public SimulationConfig config() {
        return config;
    }

    public SimulationMetrics metrics() {
        return metrics;
    }

    /**
     * Per-symbol market, for inspection.
     */
    public SymbolMarket symbolMarket(String symbol) {
        return market(symbol);
    }

    // -------------------------------------------------------------------------
    // Tick processing
    // -------------------------------------------------------------------------

    /**
     * Called under {@code lifecycleLock}. A loop left over from a pause that
     * has not finished joining loses its generation and exits at its next
     * tick boundary.
     */
    private void startLoop() {
        long generation = ++loopGeneration;
        Thread thread = new Thread(() -> runLoop(generation), "marketsim-tick-loop-" + generation);
        thread.setDaemon(true);
        loopThread = thread;
        thread.start();
    }

    private void runLoop(long generation) {
        IdleStrategy idle = new SleepingMillisIdleStrategy(1);
        long interval = config.tickIntervalMs();
        long nextTickAt = System.currentTimeMillis();
        log.info("Tick loop started at tick {}", currentTick);

        while (state == SimulationState.RUNNING && generation == loopGeneration) {
            long now = System.currentTimeMillis();
            if (now < nextTickAt) {
                idle.idle();
                continue;
            }
            // Fixed cadence; a late loop skips missed slots rather than bursting.
            nextTickAt += interval;
            if (nextTickAt <= now) {
                nextTickAt = now + interval;
            }
            try {
                tickOnce(generation);
            } catch (MatchingStateCorruptedException e) {
                return;
            } catch (RuntimeException e) {
                log.error("Tick {} failed", currentTick + 1, e);
            }
        }
        log.info("Tick loop exited at tick {} in state {}", currentTick, state);
    }

    /**
     * @param generation loop generation requesting the tick, or {@link #STEP}
     *                   for a manual tick
     */
    private void tickOnce(long generation) {
        tickLock.lock();
        try {
            if (state == SimulationState.STOPPED) {
                return;
            }
            if (generation != STEP && (state != SimulationState.RUNNING || generation != loopGeneration)) {
                return;
            }
            long tick = currentTick + 1;
            int depth = isSnapshotTick(tick) ? config.snapshotDepth() : 0;
            List<TickResult> results;
            try {
                results = processSymbols(tick, depth);
            } catch (MatchingStateCorruptedException e) {
                log.error("Order book corrupted at tick {}, stopping simulation", tick, e);
                haltOnCorruption();
                throw e;
            }
            currentTick = tick;
            metrics.recordTick(tick);
            for (int i = 0; i < results.size(); i++) {
                TickResult result = results.get(i);
                metrics.recordFills(result.symbol(), result.fills().size());
                metrics.setRestingOrders(result.symbol(), markets.get(i).restingOrderCount());
                if (dispatcher != null) {
                    dispatcher.publish(result);
                }
            }
        } finally {
            tickLock.unlock();
        }
    }

    private boolean isSnapshotTick(long tick) {
        return config.snapshotEveryTicks() > 0 && tick % config.snapshotEveryTicks() == 0;
    }

    private List<TickResult> processSymbols(long tick, int snapshotDepth) {
        List<TickResult> results = new ArrayList<>(markets.size());
        if (workers == null) {
            for (SymbolMarket market : markets) {
                results.add(market.processTick(tick, snapshotDepth));
            }
            return results;
        }

        List<Future<TickResult>> futures = new ArrayList<>(markets.size());
        for (SymbolMarket market : markets) {
            futures.add(workers.submit(() -> market.processTick(tick, snapshotDepth)));
        }
        for (Future<TickResult> future : futures) {
            try {
                results.add(future.get());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("interrupted while processing tick " + tick, e);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                if (cause instanceof RuntimeException) {
                    throw (RuntimeException) cause;
                }
                throw new IllegalStateException("tick " + tick + " failed", cause);
            }
        }
        return results;
    }

    /**
     * Runs on the thread that detected the corruption, which may be the loop
     * thread itself, so the loop is not joined here. The lifecycle lock is not
     * taken either: a step-mode caller may hold it while waiting for the tick
     * lock.
     */
    private void haltOnCorruption() {
        transition(SimulationState.STOPPED);
        releaseResources();
    }

    private void transition(SimulationState next) {
        log.info("Simulation {} -> {} at tick {}", state, next, currentTick);
        state = next;
        metrics.setState(next);
    }

    private void awaitLoopExit(Thread loop) {
        if (loop == null || loop == Thread.currentThread()) {
            return;
        }
        try {
            loop.join(JOIN_TIMEOUT_MS);
            if (loop.isAlive()) {
                log.warn("Tick loop did not exit within {} ms", JOIN_TIMEOUT_MS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void releaseResources() {
        tickLock.lock();
        try {
            if (resourcesReleased) {
                return;
            }
            resourcesReleased = true;
            if (workers != null) {
                workers.shutdown();
                try {
                    if (!workers.awaitTermination(JOIN_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                        workers.shutdownNow();
                    }
                } catch (InterruptedException e) {
                    workers.shutdownNow();
                    Thread.currentThread().interrupt();
                }
            }
            if (dispatcher != null) {
                dispatcher.close();
            }
            log.info("Simulation stopped at tick {}", currentTick);
        } finally {
            tickLock.unlock();
        }
    }

    private void ensureNotStopped() {
        if (state == SimulationState.STOPPED) {
            throw new SimulationNotRunningException("simulation is stopped");
        }
    }
}
