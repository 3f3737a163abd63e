package com.marketsim.core.execution;

import com.marketsim.api.RejectReason;
import com.marketsim.core.MatchResult;
import com.marketsim.core.MatchingEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.PriorityQueue;

/**
 * <h1>Execution Latency Gate</h1>
 *
 * <p>
 * Holds intents for a constant latency before they reach the book. Each
 * accepted intent is keyed by {@code submittedAt + latencyMs};
 * {@link #advance(long)} releases everything due, earliest release first and
 * acceptance order among equal release times, so latency never reorders two
 * intents sent at the same instant.
 * </p>
 *
 * <p>
 * Cancels travel through the same queue as new orders. An agent that cancels
 * and re-quotes in one tick therefore has its cancel reach the book before its
 * new quote.
 * </p>
 *
 * <p>
 * Not thread-safe; owned by one symbol.
 * </p>
 */
public class ExecutionEngine {

    private static final Logger log = LoggerFactory.getLogger(ExecutionEngine.class);

    private final MatchingEngine matchingEngine;
    private final long latencyMs;
    private final ExecutionListener listener;
    private final PriorityQueue<PendingIntent> queue = new PriorityQueue<>();
    private long sequence;

    public ExecutionEngine(MatchingEngine matchingEngine, long latencyMs, ExecutionListener listener) {
        if (latencyMs < 0) {
            throw new IllegalArgumentException("latencyMs cannot be negative: " + latencyMs);
        }
        this.matchingEngine = matchingEngine;
        this.latencyMs = latencyMs;
        this.listener = listener == null ? ExecutionListener.NO_OP : listener;
    }

    public PendingIntent accept(OrderIntent intent) {
        PendingIntent pending = new PendingIntent(sequence++, intent.submittedAt() + latencyMs, intent);
        queue.add(pending);
        return pending;
    }

    /**
     * Releases every intent due at or before {@code now} to the book.
     *
     * @return match results of the released NEW intents, in release order
     */
    public List<MatchResult> advance(long now) {
        List<MatchResult> results = new ArrayList<>();
        PendingIntent pending;
        while ((pending = queue.peek()) != null && pending.releaseAt() <= now) {
            queue.poll();
            OrderIntent intent = pending.intent();
            if (intent.isCancel()) {
                boolean cancelled = matchingEngine.cancel(intent.targetOrderId());
                listener.onCancelReleased(pending, cancelled);
            } else {
                MatchResult result = matchingEngine.submit(intent.side(), intent.kind(), intent.quantity(),
                    intent.limitPrice(), intent.submittedAt(), pending.releaseAt());
                if (result.rejectReason() != RejectReason.NONE && log.isDebugEnabled()) {
                    log.debug("Agent {} order rejected: {}", intent.agentId(), result.rejectReason());
                }
                listener.onOrderReleased(pending, result);
                results.add(result);
            }
        }
        return results;
    }

    public int pendingCount() {
        return queue.size();
    }

    public long latencyMs() {
        return latencyMs;
    }
}
