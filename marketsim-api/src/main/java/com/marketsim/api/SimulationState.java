package com.marketsim.api;

/**
 * Lifecycle of a simulation.
 *
 * <pre>
 * INITIALIZED --start--> RUNNING --pause--> PAUSED
 *                           ^                  |
 *                           +-----resume-------+
 * any state --stop--> STOPPED (terminal)
 * </pre>
 */
public enum SimulationState {
    INITIALIZED,
    RUNNING,
    PAUSED,
    STOPPED
}
