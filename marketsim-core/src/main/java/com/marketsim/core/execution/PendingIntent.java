package com.marketsim.core.execution;

/**
 * An intent waiting out its latency.
 *
 * @param sequence  acceptance order, breaks ties between equal release times
 * @param releaseAt simulated millis at which the intent reaches the book
 * @param intent    the intent
 */
public record PendingIntent(long sequence, long releaseAt, OrderIntent intent) implements Comparable<PendingIntent> {

    @Override
    public int compareTo(PendingIntent other) {
        int byTime = Long.compare(releaseAt, other.releaseAt);
        return byTime != 0 ? byTime : Long.compare(sequence, other.sequence);
    }
}
