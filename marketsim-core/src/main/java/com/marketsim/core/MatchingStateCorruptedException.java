package com.marketsim.core;

/**
 * The book found itself in a state that correct matching can never produce
 * (negative resting quantity, level totals out of sync, a crossed book).
 * Nothing downstream can be trusted after this, so it is never caught and
 * continued: the owner of the book stops.
 */
public class MatchingStateCorruptedException extends IllegalStateException {

    public MatchingStateCorruptedException(String symbol, String detail) {
        super("Matching state corrupted for " + symbol + ": " + detail);
    }
}
