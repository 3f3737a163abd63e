package com.marketsim.api;

import java.util.List;

/**
 * Health summary of a simulation instance.
 *
 * @param state              lifecycle state
 * @param tick               number of ticks processed
 * @param symbols            simulated symbols
 * @param agentCount         agents across all symbols
 * @param fillCount          fills produced since start
 * @param droppedWrites      persistence writes dropped (ring full or sink failure)
 * @param persistenceEnabled whether a sink is attached
 */
public record SimulationStatus(
    SimulationState state,
    long tick,
    List<String> symbols,
    int agentCount,
    long fillCount,
    long droppedWrites,
    boolean persistenceEnabled
) {
    public SimulationStatus {
        symbols = List.copyOf(symbols);
    }
}
