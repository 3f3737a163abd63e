package com.marketsim.core;

import com.marketsim.api.BookSnapshot;
import com.marketsim.api.Fill;
import com.marketsim.api.MarketState;
import com.marketsim.api.OrderKind;
import com.marketsim.api.OrderStatus;
import com.marketsim.api.RejectReason;
import com.marketsim.api.Side;
import com.marketsim.api.SubmitResult;
import com.marketsim.core.agent.Agent;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SymbolMarketTest {

    private static final long START = 1_700_000_000_000L;

    private static SymbolMarket market(long seed) {
        return new SymbolMarket(SymbolSpec.withDefaults("AAPL", 150.0), 0,
            MarketSettings.defaults(START).withSeed(seed));
    }

    private static List<Fill> run(SymbolMarket market, int ticks) {
        List<Fill> fills = new ArrayList<>();
        for (int tick = 1; tick <= ticks; tick++) {
            fills.addAll(market.processTick(tick, 0).fills());
        }
        return fills;
    }

    @Test
    void sameSeedProducesIdenticalFillsAndFinalState() {
        SymbolMarket first = market(42);
        SymbolMarket second = market(42);

        List<Fill> fillsA = run(first, 300);
        List<Fill> fillsB = run(second, 300);

        assertFalse(fillsA.isEmpty(), "agents should trade within 300 ticks");
        assertEquals(fillsA, fillsB);
        assertEquals(first.marketState(), second.marketState());
        assertEquals(first.analytics(), second.analytics());
    }

    @Test
    void differentSeedsDiverge() {
        MarketState a = market(1).processTick(1, 0).marketState();
        MarketState b = market(2).processTick(1, 0).marketState();

        assertNotEquals(a.referencePrice(), b.referencePrice());
    }

    @Test
    void bookStaysConsistentAndLiquidityBoundedOverManyTicks() {
        SymbolMarket market = market(7);
        double baseline = market.spec().baseLiquidity();

        for (int tick = 1; tick <= 500; tick++) {
            TickResult result = market.processTick(tick, tick % 50 == 0 ? 10 : 0);
            double liquidity = result.marketState().liquidity();
            assertTrue(liquidity >= 0.05 * baseline - 1e-9 && liquidity <= baseline + 1e-9,
                "liquidity out of bounds at tick " + tick + ": " + liquidity);
            assertEquals(tick % 50 == 0, result.hasSnapshot());
            if (tick % 25 == 0) {
                market.verifyInvariants();
            }
        }
        market.verifyInvariants();
        assertEquals(0, market.pendingIntentCount(), "latency is shorter than a tick");
    }

    @Test
    void agentTradesNetToExternalFlow() {
        SymbolMarket market = market(11);
        run(market, 100);

        long net = market.population().netPosition();
        assertEquals(0, net, "without external flow agent positions net to zero");

        long totalFilled = market.population().agents().stream().mapToLong(Agent::filledQuantity).sum();
        assertEquals(2 * market.marketState().volume(), totalFilled, "both sides of every fill are agents");
    }

    @Test
    void externalOrderMatchesImmediatelyAndIsReportedWithNextTick() {
        SymbolMarket market = market(3);
        run(market, 5);
        BookSnapshot book = market.snapshot(5);
        assertFalse(book.asks().isEmpty(), "market makers quote from the first tick");

        SubmitResult result = market.submitExternal(Side.BUY, OrderKind.MARKET, 10, Double.NaN);

        assertEquals(OrderStatus.FILLED, result.status());
        assertEquals(10, result.filledQuantity());
        assertTrue(result.avgFillPrice() >= book.bestAsk() - 1e-9);
        assertEquals(0, IdSequence.symbolIndexOf(result.orderId()));

        TickResult next = market.processTick(6, 0);
        assertTrue(next.fills().stream().anyMatch(f -> f.orderId() == result.orderId()));
        assertEquals(-10, market.population().netPosition());
    }

    @Test
    void externalLimitOrderCanBeFoundAndCancelled() {
        SymbolMarket market = market(3);
        run(market, 2);

        SubmitResult result = market.submitExternal(Side.BUY, OrderKind.LIMIT, 10, 1.00);

        assertEquals(OrderStatus.RESTING, result.status());
        assertEquals(1.00, market.findOrder(result.orderId()).orElseThrow().price(), 1e-9);
        assertTrue(market.cancel(result.orderId()));
        assertFalse(market.cancel(result.orderId()));
        assertTrue(market.findOrder(result.orderId()).isEmpty());
    }

    @Test
    void invalidExternalOrderLeavesBookUntouched() {
        SymbolMarket market = market(3);
        run(market, 2);
        int resting = market.restingOrderCount();

        SubmitResult result = market.submitExternal(Side.BUY, OrderKind.LIMIT, 10, Double.NaN);

        assertTrue(result.isRejected());
        assertEquals(RejectReason.MISSING_LIMIT_PRICE, result.rejectReason());
        assertEquals(resting, market.restingOrderCount());
    }

    @Test
    void ticksMustIncrease() {
        SymbolMarket market = market(1);
        market.processTick(1, 0);

        assertThrows(IllegalArgumentException.class, () -> market.processTick(1, 0));
    }

    @Test
    void marketStateCarriesSimulatedClock() {
        SymbolMarket market = market(1);

        TickResult result = market.processTick(3, 0);

        assertEquals(START + 300, result.timestamp());
        assertEquals(START + 300, result.marketState().timestamp());
        assertEquals("AAPL", result.marketState().symbol());
    }
}
