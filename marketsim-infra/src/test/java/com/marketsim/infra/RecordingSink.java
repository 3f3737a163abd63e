package com.marketsim.infra;

import com.marketsim.api.AnalyticsRow;
import com.marketsim.api.BookSnapshot;
import com.marketsim.api.Fill;
import com.marketsim.api.MarketState;
import com.marketsim.api.PersistenceSink;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Keeps everything written to it. Written from the persistence writer thread,
 * read from the test thread.
 */
public class RecordingSink implements PersistenceSink {

    public final List<Fill> fills = new CopyOnWriteArrayList<>();
    public final List<MarketState> marketStates = new CopyOnWriteArrayList<>();
    public final List<AnalyticsRow> analytics = new CopyOnWriteArrayList<>();
    public final List<BookSnapshot> snapshots = new CopyOnWriteArrayList<>();
    public final AtomicBoolean closed = new AtomicBoolean();

    @Override
    public void writeFill(Fill fill) {
        fills.add(fill);
    }

    @Override
    public void writeMarketState(String symbol, MarketState state, long timestamp) {
        marketStates.add(state);
    }

    @Override
    public void writeAnalytics(String symbol, AnalyticsRow metrics, long timestamp) {
        analytics.add(metrics);
    }

    @Override
    public void writeOrderBookSnapshot(String symbol, BookSnapshot snapshot, long timestamp) {
        snapshots.add(snapshot);
    }

    @Override
    public void close() {
        closed.set(true);
    }
}
