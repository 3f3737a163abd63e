package com.marketsim.core.liquidity;

import com.marketsim.api.Side;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LiquidityModelTest {

    @Test
    void fillDepletesLiquidityAndAccumulatesSignedImpact() {
        LiquidityModel model = new LiquidityModel(10_000, ImpactParameters.DEFAULT);

        double buyImpact = model.onFill(Side.BUY, 100);

        assertEquals(0.1 * Math.sqrt(100 / 10_000.0), buyImpact, 1e-12);
        assertEquals(9_900, model.current(), 1e-9);

        double sellImpact = model.onFill(Side.SELL, 100);
        assertTrue(sellImpact < 0);
        assertEquals(0.1 * Math.sqrt(100 / 9_900.0), -sellImpact, 1e-12);
        assertEquals(buyImpact + sellImpact, model.drainImpact(), 1e-12);
        assertEquals(0.0, model.drainImpact());
    }

    @Test
    void liquidityNeverFallsBelowFloor() {
        LiquidityModel model = new LiquidityModel(1_000, ImpactParameters.DEFAULT);

        for (int i = 0; i < 100; i++) {
            model.onFill(Side.BUY, 500);
            assertTrue(model.current() >= 50.0 - 1e-9);
            assertTrue(Double.isFinite(model.pendingImpact()));
        }
        assertEquals(50.0, model.current(), 1e-9);
        assertEquals(50.0, model.state().floor(), 1e-9);
    }

    @Test
    void recoveryApproachesBaselineWithoutOvershoot() {
        LiquidityModel model = new LiquidityModel(10_000, ImpactParameters.DEFAULT);
        model.onFill(Side.BUY, 5_000);
        assertEquals(5_000, model.current(), 1e-9);

        model.recover(1);
        // 5% of the 5,000 gap
        assertEquals(5_250, model.current(), 1e-9);

        double previous = model.current();
        for (long tick = 2; tick < 200; tick++) {
            model.recover(tick);
            assertTrue(model.current() >= previous);
            assertTrue(model.current() <= 10_000);
            previous = model.current();
        }
    }

    @Test
    void longQuietStretchRecoversExactlyToBaseline() {
        LiquidityModel model = new LiquidityModel(10_000, ImpactParameters.DEFAULT);
        model.onFill(Side.SELL, 9_000);

        model.recover(1_000);

        assertEquals(10_000, model.current(), 1e-9);
        assertEquals(1.0, model.state().ratio(), 1e-12);
    }

    @Test
    void recoveryIsNoOpForStaleTick() {
        LiquidityModel model = new LiquidityModel(10_000, ImpactParameters.DEFAULT);
        model.recover(5);
        model.onFill(Side.BUY, 1_000);

        model.recover(5);
        model.recover(3);

        assertEquals(9_000, model.current(), 1e-9);
        assertEquals(5, model.state().lastUpdateTick());
    }

    @Test
    void impactOfSameOrderDecaysAsLiquidityRecovers() {
        LiquidityModel model = new LiquidityModel(10_000, ImpactParameters.DEFAULT);
        model.onFill(Side.BUY, 8_000);
        double drained = model.estimateImpact(Side.BUY, 100);

        model.recover(10);
        double recovered = model.estimateImpact(Side.BUY, 100);

        assertTrue(recovered < drained, "impact should shrink as depth returns");
        assertEquals(0.0, model.estimateImpact(Side.BUY, 0));
    }

    @Test
    void estimateDoesNotMutate() {
        LiquidityModel model = new LiquidityModel(10_000, ImpactParameters.DEFAULT);

        double estimate = model.estimateImpact(Side.SELL, 400);

        assertEquals(-0.1 * Math.sqrt(400 / 10_000.0), estimate, 1e-12);
        assertEquals(10_000, model.current());
        assertEquals(0.0, model.pendingImpact());
    }

    @Test
    void parametersAreValidated() {
        assertThrows(IllegalArgumentException.class, () -> new ImpactParameters(0.1, 1.0, 0.05, 0.0));
        assertThrows(IllegalArgumentException.class, () -> new ImpactParameters(0.1, 1.0, 1.5, 0.05));
        assertThrows(IllegalArgumentException.class, () -> new LiquidityModel(0, ImpactParameters.DEFAULT));
    }
}
