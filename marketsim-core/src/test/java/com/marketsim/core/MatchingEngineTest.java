package com.marketsim.core;

import com.marketsim.api.OrderKind;
import com.marketsim.api.OrderStatus;
import com.marketsim.api.RejectReason;
import com.marketsim.api.Side;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MatchingEngineTest {

    private RecordingMatchListener listener;
    private MatchingEngine engine;

    @BeforeEach
    void setup() {
        listener = new RecordingMatchListener();
        engine = new MatchingEngine("AAPL", 3, new PriceScale(2), listener);
    }

    @Test
    void shouldMatchOrderAgainstRestingLiquidity() {
        MatchResult ask = engine.submit(Side.SELL, OrderKind.LIMIT, 10, 100.00, 1, 1);
        MatchResult firstBuy = engine.submit(Side.BUY, OrderKind.LIMIT, 5, 100.00, 2, 2);
        MatchResult secondBuy = engine.submit(Side.BUY, OrderKind.LIMIT, 5, 100.00, 3, 3);
        MatchResult restingBuy = engine.submit(Side.BUY, OrderKind.LIMIT, 10, 99.00, 4, 4);

        assertEquals(OrderStatus.RESTING, ask.status());
        assertEquals(OrderStatus.FILLED, firstBuy.status());
        assertEquals(OrderStatus.FILLED, secondBuy.status());
        assertEquals(OrderStatus.RESTING, restingBuy.status());
        assertEquals(2, listener.trades.size());
        assertEquals(99.00, engine.getOrderBook().bestBid(), 1e-9);
        assertFalse(engine.getOrderBook().isResting(ask.orderId()));
    }

    @Test
    void idsAreTaggedWithSymbolIndexAndIncrease() {
        MatchResult first = engine.submit(Side.BUY, OrderKind.LIMIT, 1, 10.00, 1, 1);
        MatchResult second = engine.submit(Side.BUY, OrderKind.LIMIT, 1, 10.00, 2, 2);

        assertEquals(3, IdSequence.symbolIndexOf(first.orderId()));
        assertEquals(3, IdSequence.symbolIndexOf(second.orderId()));
        assertTrue(second.orderId() > first.orderId());
        assertEquals(second.orderId(), engine.lastOrderId());
    }

    @Test
    void invalidOrdersAreRejectedWithoutConsumingIds() {
        assertEquals(RejectReason.INVALID_QUANTITY,
            engine.submit(Side.BUY, OrderKind.MARKET, 0, Double.NaN, 1, 1).rejectReason());
        assertEquals(RejectReason.INVALID_QUANTITY,
            engine.submit(Side.BUY, OrderKind.LIMIT, -5, 10.0, 1, 1).rejectReason());
        assertEquals(RejectReason.MISSING_LIMIT_PRICE,
            engine.submit(Side.SELL, OrderKind.LIMIT, 5, Double.NaN, 1, 1).rejectReason());
        assertEquals(RejectReason.INVALID_LIMIT_PRICE,
            engine.submit(Side.SELL, OrderKind.LIMIT, 5, -1.0, 1, 1).rejectReason());
        assertEquals(RejectReason.INVALID_LIMIT_PRICE,
            engine.submit(Side.BUY, OrderKind.LIMIT, 5, 0.001, 1, 1).rejectReason());
        assertEquals(RejectReason.INVALID_LIMIT_PRICE,
            engine.submit(Side.BUY, OrderKind.LIMIT, 5, Double.POSITIVE_INFINITY, 1, 1).rejectReason());
        assertEquals(RejectReason.INVALID_LIMIT_PRICE,
            engine.submit(Side.BUY, OrderKind.LIMIT, 5, 1e15, 1, 1).rejectReason());
        assertEquals(RejectReason.INVALID_SIDE,
            engine.submit((byte) 9, OrderKind.MARKET, 5, Double.NaN, 1, 1).rejectReason());
        assertEquals(RejectReason.INVALID_KIND,
            engine.submit(Side.BUY, (byte) 9, 5, Double.NaN, 1, 1).rejectReason());

        MatchResult rejected = engine.submit(Side.BUY, OrderKind.MARKET, 0, Double.NaN, 1, 1);
        assertEquals(0, rejected.orderId());
        assertEquals(OrderStatus.REJECTED, rejected.status());
        assertEquals(0, engine.lastOrderId());
        assertEquals(0, engine.getOrderBook().restingOrderCount());
    }

    @Test
    void marketOrderIgnoresLimitPrice() {
        engine.submit(Side.SELL, OrderKind.LIMIT, 5, 100.00, 1, 1);

        MatchResult buy = engine.submit(Side.BUY, OrderKind.MARKET, 5, -3.0, 2, 2);

        assertEquals(OrderStatus.FILLED, buy.status());
    }

    @Test
    void buyLimitRoundsDownToTheTick() {
        MatchResult bid = engine.submit(Side.BUY, OrderKind.LIMIT, 5, 100.006, 1, 1);

        assertEquals(100.00, engine.getOrderBook().find(bid.orderId()).orElseThrow().price(), 1e-9);
    }

    @Test
    void sellLimitRoundsUpToTheTick() {
        MatchResult ask = engine.submit(Side.SELL, OrderKind.LIMIT, 5, 99.994, 1, 1);

        assertEquals(100.00, engine.getOrderBook().find(ask.orderId()).orElseThrow().price(), 1e-9);
    }

    @Test
    void onGridLimitsKeepTheirPrice() {
        MatchResult bid = engine.submit(Side.BUY, OrderKind.LIMIT, 5, 100.01, 1, 1);
        MatchResult ask = engine.submit(Side.SELL, OrderKind.LIMIT, 5, 100.03, 2, 2);

        assertEquals(100.01, engine.getOrderBook().find(bid.orderId()).orElseThrow().price(), 1e-9);
        assertEquals(100.03, engine.getOrderBook().find(ask.orderId()).orElseThrow().price(), 1e-9);
    }

    @Test
    void offGridBuyLimitDoesNotTradeAboveItsPrice() {
        engine.submit(Side.SELL, OrderKind.LIMIT, 5, 100.01, 1, 1);

        MatchResult buy = engine.submit(Side.BUY, OrderKind.LIMIT, 5, 100.006, 2, 2);

        assertEquals(OrderStatus.RESTING, buy.status());
        assertEquals(0, buy.filledQuantity());
        assertTrue(listener.trades.isEmpty());
        assertEquals(100.00, engine.getOrderBook().bestBid(), 1e-9);
        assertEquals(100.01, engine.getOrderBook().bestAsk(), 1e-9);
    }

    @Test
    void offGridSellLimitDoesNotTradeBelowItsPrice() {
        engine.submit(Side.BUY, OrderKind.LIMIT, 5, 100.00, 1, 1);

        MatchResult sell = engine.submit(Side.SELL, OrderKind.LIMIT, 5, 100.004, 2, 2);

        assertEquals(OrderStatus.RESTING, sell.status());
        assertEquals(0, sell.filledQuantity());
        assertEquals(100.01, engine.getOrderBook().bestAsk(), 1e-9);
    }

    @Test
    void wholeLevelFillReportsItsAveragePrice() {
        engine.submit(Side.SELL, OrderKind.LIMIT, 5, 100.01, 1, 1);

        MatchResult buy = engine.submit(Side.BUY, OrderKind.LIMIT, 5, 100.02, 2, 2);

        assertEquals(OrderStatus.FILLED, buy.status());
        assertEquals(100.01, buy.avgFillPrice(), 1e-9);
        assertEquals(100.01, buy.toSubmitResult().avgFillPrice(), 1e-9);
    }

    @Test
    void largestAcceptedPriceKeepsAverageExact() {
        double highest = new PriceScale(2).toPrice(PriceScale.MAX_TICKS);
        engine.submit(Side.BUY, OrderKind.LIMIT, 100, highest, 1, 1);

        MatchResult sell = engine.submit(Side.SELL, OrderKind.MARKET, 100, Double.NaN, 2, 2);

        assertEquals(OrderStatus.FILLED, sell.status());
        assertEquals(highest, sell.avgFillPrice(), 1e-3);
    }

    @Test
    void toSubmitResultCopiesOutcome() {
        engine.submit(Side.SELL, OrderKind.LIMIT, 4, 50.00, 1, 1);
        MatchResult buy = engine.submit(Side.BUY, OrderKind.LIMIT, 10, 50.00, 2, 2);

        var submit = buy.toSubmitResult();
        assertEquals(buy.orderId(), submit.orderId());
        assertEquals(OrderStatus.PARTIALLY_FILLED, submit.status());
        assertEquals(4, submit.filledQuantity());
        assertEquals(50.00, submit.avgFillPrice(), 1e-9);
        assertEquals(RejectReason.NONE, submit.rejectReason());
        assertFalse(submit.isRejected());
    }
}
