package com.marketsim.core.execution;

import com.marketsim.core.MatchResult;

/**
 * Told about every intent the {@link ExecutionEngine} releases, in release
 * order, right after the book processed it.
 */
public interface ExecutionListener {

    void onOrderReleased(PendingIntent pending, MatchResult result);

    void onCancelReleased(PendingIntent pending, boolean cancelled);

    ExecutionListener NO_OP = new ExecutionListener() {
        @Override
        public void onOrderReleased(PendingIntent pending, MatchResult result) {
        }

        @Override
        public void onCancelReleased(PendingIntent pending, boolean cancelled) {
        }
    };
}
