package com.marketsim.api;

/**
 * Raised by every operation on a simulation that has been stopped. A stopped
 * simulation cannot be restarted; build a new one.
 */
public class SimulationNotRunningException extends RuntimeException {

    public SimulationNotRunningException(String message) {
        super(message);
    }
}
