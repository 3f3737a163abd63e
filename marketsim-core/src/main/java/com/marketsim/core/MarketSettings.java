package com.marketsim.core;

import com.marketsim.core.agent.AgentMix;
import com.marketsim.core.liquidity.ImpactParameters;

/**
 * Settings shared by every symbol of a simulation.
 *
 * @param seed           master seed, each symbol derives its own stream from it
 * @param tickIntervalMs simulated millis per tick
 * @param latencyMs      execution latency applied to agent intents
 * @param startEpochMs   simulated epoch millis of tick 0
 * @param impact         liquidity and impact constants
 * @param agentMix       agents per symbol
 */
public record MarketSettings(
    long seed,
    long tickIntervalMs,
    long latencyMs,
    long startEpochMs,
    ImpactParameters impact,
    AgentMix agentMix
) {
    public static final long DEFAULT_SEED = 42L;
    public static final long DEFAULT_TICK_INTERVAL_MS = 100L;
    public static final long DEFAULT_LATENCY_MS = 10L;

    public MarketSettings {
        if (tickIntervalMs <= 0) {
            throw new IllegalArgumentException("tickIntervalMs must be positive: " + tickIntervalMs);
        }
        if (latencyMs < 0) {
            throw new IllegalArgumentException("latencyMs cannot be negative: " + latencyMs);
        }
        if (impact == null) {
            throw new IllegalArgumentException("impact cannot be null");
        }
        if (agentMix == null) {
            throw new IllegalArgumentException("agentMix cannot be null");
        }
    }

    public static MarketSettings defaults(long startEpochMs) {
        return new MarketSettings(DEFAULT_SEED, DEFAULT_TICK_INTERVAL_MS, DEFAULT_LATENCY_MS, startEpochMs,
            ImpactParameters.DEFAULT, AgentMix.DEFAULT);
    }

    /**
     * Simulated epoch millis of {@code tick}.
     */
    public long timeOf(long tick) {
        return startEpochMs + tick * tickIntervalMs;
    }

    public MarketSettings withSeed(long newSeed) {
        return new MarketSettings(newSeed, tickIntervalMs, latencyMs, startEpochMs, impact, agentMix);
    }

    public MarketSettings withAgentMix(AgentMix mix) {
        return new MarketSettings(seed, tickIntervalMs, latencyMs, startEpochMs, impact, mix);
    }
}
