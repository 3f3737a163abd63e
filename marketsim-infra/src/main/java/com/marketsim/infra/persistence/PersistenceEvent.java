package com.marketsim.infra.persistence;

import com.lmax.disruptor.EventFactory;
import com.marketsim.api.AnalyticsRow;
import com.marketsim.api.BookSnapshot;
import com.marketsim.api.Fill;
import com.marketsim.api.MarketState;

/**
 * Slot of the persistence ring buffer. Carries exactly one record, selected
 * by {@link #type}. The records are immutable, so the slot only holds
 * references to them.
 */
public class PersistenceEvent {

    public enum Type {
        FILL,
        MARKET_STATE,
        ANALYTICS,
        SNAPSHOT
    }

    public Type type;
    public String symbol;
    public long timestamp;
    public Fill fill;
    public MarketState marketState;
    public AnalyticsRow analytics;
    public BookSnapshot snapshot;

    public void reset() {
        type = null;
        symbol = null;
        timestamp = 0;
        fill = null;
        marketState = null;
        analytics = null;
        snapshot = null;
    }

    public final static EventFactory<PersistenceEvent> FACTORY = PersistenceEvent::new;
}
