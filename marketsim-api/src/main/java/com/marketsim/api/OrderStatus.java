package com.marketsim.api;

/**
 * Outcome of a submitted order as reported back to the submitter.
 */
public enum OrderStatus {
    /** Entire quantity executed. */
    FILLED,
    /** Some quantity executed; for a limit order the remainder rests. */
    PARTIALLY_FILLED,
    /** Nothing executed, the whole quantity rests in the book. */
    RESTING,
    /** Nothing executed and nothing rests. See {@link RejectReason}. */
    REJECTED;

    public String wireName() {
        return name().toLowerCase();
    }
}
