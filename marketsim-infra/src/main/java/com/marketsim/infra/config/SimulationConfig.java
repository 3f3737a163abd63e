package com.marketsim.infra.config;

import com.marketsim.core.MarketSettings;
import com.marketsim.core.SymbolSpec;
import com.marketsim.core.agent.AgentMix;
import com.marketsim.core.liquidity.ImpactParameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Configuration of a simulation instance.
 *
 * @param symbols            simulated symbols, in symbol index order
 * @param seed               master random seed
 * @param tickIntervalMs     wall-clock and simulated millis per tick
 * @param latencyMs          execution latency applied to agent intents
 * @param startEpochMs       simulated epoch millis of tick 0
 * @param agentMix           agents per symbol
 * @param impact             liquidity and impact constants
 * @param workerThreads      threads ticking symbols in parallel, 1 for the tick thread alone
 * @param ringSize           persistence ring buffer slots, a power of two
 * @param snapshotEveryTicks ticks between two persisted book snapshots, 0 to disable
 * @param snapshotDepth      levels per side in a persisted book snapshot
 * @param journalPath        Chronicle Queue directory, null or empty to run without persistence
 */
public record SimulationConfig(
    List<SymbolSpec> symbols,
    long seed,
    long tickIntervalMs,
    long latencyMs,
    long startEpochMs,
    AgentMix agentMix,
    ImpactParameters impact,
    int workerThreads,
    int ringSize,
    int snapshotEveryTicks,
    int snapshotDepth,
    String journalPath
) {
    private static final Logger log = LoggerFactory.getLogger(SimulationConfig.class);

    public static final String DEFAULT_SYMBOLS = "AAPL:150;MSFT:300;GOOGL:140;BTCUSDT:60000;ETHUSDT:3000";
    public static final int DEFAULT_RING_SIZE = 8192;
    public static final int DEFAULT_SNAPSHOT_EVERY_TICKS = 50;
    public static final int DEFAULT_SNAPSHOT_DEPTH = 10;

    public SimulationConfig {
        if (symbols == null || symbols.isEmpty()) {
            throw new IllegalArgumentException("symbols cannot be null or empty");
        }
        Set<String> seen = new HashSet<>();
        for (SymbolSpec spec : symbols) {
            if (!seen.add(spec.symbol())) {
                throw new IllegalArgumentException("duplicate symbol: " + spec.symbol());
            }
        }
        symbols = List.copyOf(symbols);
        if (tickIntervalMs <= 0) {
            throw new IllegalArgumentException("tickIntervalMs must be positive");
        }
        if (latencyMs < 0) {
            throw new IllegalArgumentException("latencyMs cannot be negative");
        }
        if (agentMix == null) {
            throw new IllegalArgumentException("agentMix cannot be null");
        }
        if (impact == null) {
            throw new IllegalArgumentException("impact cannot be null");
        }
        if (workerThreads < 1) {
            throw new IllegalArgumentException("workerThreads must be at least 1");
        }
        if (ringSize < 1 || Integer.bitCount(ringSize) != 1) {
            throw new IllegalArgumentException("ringSize must be a power of two: " + ringSize);
        }
        if (snapshotEveryTicks < 0) {
            throw new IllegalArgumentException("snapshotEveryTicks cannot be negative");
        }
        if (snapshotDepth < 1) {
            throw new IllegalArgumentException("snapshotDepth must be at least 1");
        }
    }

    public MarketSettings marketSettings() {
        return new MarketSettings(seed, tickIntervalMs, latencyMs, startEpochMs, impact, agentMix);
    }

    public boolean persistenceEnabled() {
        return journalPath != null && !journalPath.isEmpty();
    }

    public List<String> symbolNames() {
        return symbols.stream().map(SymbolSpec::symbol).collect(Collectors.toList());
    }

    /**
     * Loads configuration from environment variables.
     *
     * Environment variables:
     * - SIM_SYMBOLS: symbol specs (default: "AAPL:150;MSFT:300;GOOGL:140;BTCUSDT:60000;ETHUSDT:3000")
     * - SIM_SEED: master seed (default: 42)
     * - SIM_TICK_INTERVAL_MS: tick cadence (default: 100)
     * - SIM_LATENCY_MS: execution latency (default: 10)
     * - SIM_START_EPOCH_MS: simulated start time (default: wall clock at load)
     * - SIM_AGENT_MIX: "makers,noise,informed,momentum" (default: "5,20,10,5")
     * - SIM_WORKER_THREADS: parallel symbol workers (default: 1)
     * - SIM_RING_SIZE: persistence ring slots (default: 8192)
     * - SIM_SNAPSHOT_EVERY_TICKS: book snapshot cadence (default: 50)
     * - SIM_JOURNAL_PATH: Chronicle Queue directory (default: unset, no persistence)
     */
    public static SimulationConfig fromEnv() {
        String symbolsStr = envOrDefault("SIM_SYMBOLS", DEFAULT_SYMBOLS);
        String mixStr = envOrDefault("SIM_AGENT_MIX", null);

        return new SimulationConfig(
            parseSymbols(symbolsStr),
            parseLongEnv("SIM_SEED", MarketSettings.DEFAULT_SEED),
            parseLongEnv("SIM_TICK_INTERVAL_MS", MarketSettings.DEFAULT_TICK_INTERVAL_MS),
            parseLongEnv("SIM_LATENCY_MS", MarketSettings.DEFAULT_LATENCY_MS),
            parseLongEnv("SIM_START_EPOCH_MS", System.currentTimeMillis()),
            mixStr == null ? AgentMix.DEFAULT : AgentMix.fromString(mixStr),
            ImpactParameters.DEFAULT,
            (int) parseLongEnv("SIM_WORKER_THREADS", 1),
            (int) parseLongEnv("SIM_RING_SIZE", DEFAULT_RING_SIZE),
            (int) parseLongEnv("SIM_SNAPSHOT_EVERY_TICKS", DEFAULT_SNAPSHOT_EVERY_TICKS),
            DEFAULT_SNAPSHOT_DEPTH,
            envOrDefault("SIM_JOURNAL_PATH", null)
        );
    }

    /**
     * Parses "SYMBOL:price[:decimals];SYMBOL:price..." into specs, keeping order.
     */
    public static List<SymbolSpec> parseSymbols(String value) {
        return Arrays.stream(value.split(";"))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .map(SymbolSpec::fromString)
            .collect(Collectors.toList());
    }

    private static String envOrDefault(String key, String defaultValue) {
        String value = System.getenv(key);
        return value == null || value.isEmpty() ? defaultValue : value;
    }

    private static long parseLongEnv(String key, long defaultValue) {
        String value = System.getenv(key);
        if (value == null || value.isEmpty()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid {} value: {}, using default: {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for SimulationConfig, starting from the defaults.
     */
    public static class Builder {
        private List<SymbolSpec> symbols = new ArrayList<>(parseSymbols(DEFAULT_SYMBOLS));
        private long seed = MarketSettings.DEFAULT_SEED;
        private long tickIntervalMs = MarketSettings.DEFAULT_TICK_INTERVAL_MS;
        private long latencyMs = MarketSettings.DEFAULT_LATENCY_MS;
        private long startEpochMs = 0L;
        private AgentMix agentMix = AgentMix.DEFAULT;
        private ImpactParameters impact = ImpactParameters.DEFAULT;
        private int workerThreads = 1;
        private int ringSize = DEFAULT_RING_SIZE;
        private int snapshotEveryTicks = DEFAULT_SNAPSHOT_EVERY_TICKS;
        private int snapshotDepth = DEFAULT_SNAPSHOT_DEPTH;
        private String journalPath;

        public Builder symbols(String value) {
            this.symbols = parseSymbols(value);
            return this;
        }

        public Builder symbols(List<SymbolSpec> value) {
            this.symbols = new ArrayList<>(value);
            return this;
        }

        public Builder seed(long value) {
            this.seed = value;
            return this;
        }

        public Builder tickIntervalMs(long value) {
            this.tickIntervalMs = value;
            return this;
        }

        public Builder latencyMs(long value) {
            this.latencyMs = value;
            return this;
        }

        public Builder startEpochMs(long value) {
            this.startEpochMs = value;
            return this;
        }

        public Builder agentMix(AgentMix value) {
            this.agentMix = value;
            return this;
        }

        public Builder impact(ImpactParameters value) {
            this.impact = value;
            return this;
        }

        public Builder workerThreads(int value) {
            this.workerThreads = value;
            return this;
        }

        public Builder ringSize(int value) {
            this.ringSize = value;
            return this;
        }

        public Builder snapshotEveryTicks(int value) {
            this.snapshotEveryTicks = value;
            return this;
        }

        public Builder snapshotDepth(int value) {
            this.snapshotDepth = value;
            return this;
        }

        public Builder journalPath(String value) {
            this.journalPath = value;
            return this;
        }

        public SimulationConfig build() {
            return new SimulationConfig(symbols, seed, tickIntervalMs, latencyMs, startEpochMs, agentMix, impact,
                workerThreads, ringSize, snapshotEveryTicks, snapshotDepth, journalPath);
        }
    }
}
