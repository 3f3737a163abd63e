package com.marketsim.infra.persistence;

import com.marketsim.api.AnalyticsRow;
import com.marketsim.api.BookLevel;
import com.marketsim.api.BookSnapshot;
import com.marketsim.api.Fill;
import com.marketsim.api.MarketState;
import com.marketsim.api.PersistenceSink;
import com.marketsim.api.Side;
import net.openhft.chronicle.queue.ChronicleQueue;
import net.openhft.chronicle.queue.RollCycles;
import net.openhft.chronicle.queue.impl.single.SingleChronicleQueueBuilder;
import net.openhft.chronicle.wire.ValueOut;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * <b>Chronicle Queue journal.</b>
 * <p>
 * Appends every persisted record as one self-describing binary document to a
 * memory-mapped queue. The daily roll cycle partitions the journal by day.
 * Each document starts with a {@code type} field ({@code fill},
 * {@code market_state}, {@code analytics} or {@code snapshot}) followed by the
 * fields of that record shape.
 * </p>
 * <p>
 * Called from the single persistence writer thread only.
 * </p>
 */
public class ChronicleJournalSink implements PersistenceSink {

    private static final Logger log = LoggerFactory.getLogger(ChronicleJournalSink.class);

    public static final String TYPE_FILL = "fill";
    public static final String TYPE_MARKET_STATE = "market_state";
    public static final String TYPE_ANALYTICS = "analytics";
    public static final String TYPE_SNAPSHOT = "snapshot";

    private final String path;
    private final ChronicleQueue queue;

    public ChronicleJournalSink(String path) {
        this.path = path;
        this.queue = SingleChronicleQueueBuilder.binary(path)
                .rollCycle(RollCycles.DAILY)
                .build();
        log.info("Journal opened at {}", path);
    }

    @Override
    public void writeFill(Fill fill) {
        queue.acquireAppender().writeDocument(w -> w.write("type").text(TYPE_FILL)
                .write("timestamp").int64(fill.timestamp())
                .write("fill_id").int64(fill.fillId())
                .write("order_id").int64(fill.orderId())
                .write("symbol").text(fill.symbol())
                .write("side").text(Side.name(fill.side()))
                .write("price").float64(fill.price())
                .write("quantity").int64(fill.quantity()));
    }

    @Override
    public void writeMarketState(String symbol, MarketState state, long timestamp) {
        queue.acquireAppender().writeDocument(w -> w.write("type").text(TYPE_MARKET_STATE)
                .write("timestamp").int64(timestamp)
                .write("symbol").text(symbol)
                .write("last_price").float64(state.lastPrice())
                .write("volume").int64(state.volume())
                .write("liquidity").float64(state.liquidity())
                .write("volatility").float64(state.realizedVol())
                .write("momentum").float64(state.momentum())
                .write("spread").float64(state.spread()));
    }

    @Override
    public void writeAnalytics(String symbol, AnalyticsRow metrics, long timestamp) {
        queue.acquireAppender().writeDocument(w -> w.write("type").text(TYPE_ANALYTICS)
                .write("timestamp").int64(timestamp)
                .write("symbol").text(symbol)
                .write("bid_ask_spread").float64(metrics.bidAskSpread())
                .write("mid_price").float64(metrics.midPrice())
                .write("imbalance").float64(metrics.imbalance())
                .write("bid_depth").int64(metrics.bidDepth())
                .write("ask_depth").int64(metrics.askDepth())
                .write("effective_spread").float64(metrics.effectiveSpread())
                .write("price_impact").float64(metrics.priceImpact())
                .write("realized_volatility").float64(metrics.realizedVolatility()));
    }

    @Override
    public void writeOrderBookSnapshot(String symbol, BookSnapshot snapshot, long timestamp) {
        queue.acquireAppender().writeDocument(w -> w.write("type").text(TYPE_SNAPSHOT)
                .write("timestamp").int64(timestamp)
                .write("symbol").text(symbol)
                .write("bid_levels").int32(snapshot.bids().size())
                .write("ask_levels").int32(snapshot.asks().size())
                .write("bids").sequence(snapshot.bids(), ChronicleJournalSink::writeLevels)
                .write("asks").sequence(snapshot.asks(), ChronicleJournalSink::writeLevels));
    }

    private static void writeLevels(List<BookLevel> levels, ValueOut out) {
        for (BookLevel level : levels) {
            out.marshallable(m -> m.write("price").float64(level.price())
                    .write("quantity").int64(level.quantity())
                    .write("orders").int32(level.orderCount()));
        }
    }

    public String path() {
        return path;
    }

    public ChronicleQueue queue() {
        return queue;
    }

    @Override
    public void close() {
        queue.close();
        log.info("Journal closed at {}", path);
    }
}
