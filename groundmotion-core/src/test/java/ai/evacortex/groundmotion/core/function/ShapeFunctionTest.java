/*
 * GroundMotion — Stochastic Ground-Motion Simulator
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.groundmotion.core.function;

import ai.evacortex.groundmotion.core.GroundMotionTestUtils;
import ai.evacortex.groundmotion.core.exceptions.ShapeFunctionException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ShapeFunctionTest {

    private static final double[] T = GroundMotionTestUtils.axis(1001, 0.01);

    @Test
    void linearInterpolatesBetweenEnds() {
        ShapeFunctionResult r = ShapeFunction.LINEAR.evaluate(new double[]{0.0, 5.0, 10.0}, 2.0, 0.5);
        assertArrayEquals(new double[]{2.0, 1.25, 0.5}, r.series(), 1e-12);
        assertArrayEquals(new double[]{2.0, 0.5}, r.params());
        assertEquals(List.of("pf", "pl"), r.names());
    }

    @Test
    void constantIsFlat() {
        double[] y = ShapeFunction.CONSTANT.evaluate(T, 3.5).series();
        for (double v : y) assertEquals(3.5, v);
    }

    @Test
    void exponentialHitsBothEnds() {
        double[] y = ShapeFunction.EXPONENTIAL.evaluate(T, 4.0, 1.0).series();
        assertEquals(4.0, y[0], 1e-12);
        assertEquals(1.0, y[y.length - 1], 1e-12);
        assertEquals(2.0, y[500], 1e-9);
        assertThrows(ShapeFunctionException.class, () -> ShapeFunction.EXPONENTIAL.evaluate(T, 0.0, 1.0));
    }

    @Test
    void bilinearPeaksAtBreakpoint() {
        double[] y = ShapeFunction.BILINEAR.evaluate(T, 1.0, 5.0, 2.0, 4.0).series();
        assertEquals(1.0, y[0], 1e-12);
        assertEquals(5.0, y[400], 1e-9);
        assertEquals(2.0, y[1000], 1e-9);
        assertThrows(ShapeFunctionException.class, () -> ShapeFunction.BILINEAR.evaluate(T, 1.0, 5.0, 2.0, 10.0));
    }

    @Test
    void betaEnvelopesVanishAtBothEnds() {
        double tn = T[T.length - 1];
        double[] single = ShapeFunction.BETA_SINGLE.evaluate(T, 0.3, 10.0, 1.0, tn).series();
        double[] dual = ShapeFunction.BETA_DUAL.evaluate(T, 0.2, 15.0, 0.6, 12.0, 0.5, 1.0, tn).series();
        double[] basic = ShapeFunction.BETA_BASIC.evaluate(T, 0.4, 6.0, 1.0, tn).series();
        for (double[] y : List.of(single, dual, basic)) {
            assertEquals(0.0, y[0]);
            assertEquals(0.0, y[y.length - 1]);
            for (double v : y) {
                assertTrue(Double.isFinite(v) && v >= 0.0);
            }
        }
        assertTrue(single[300] > 0.0);
    }

    @Test
    void betaEnvelopeBeyondTnIsZero() {
        double[] y = ShapeFunction.BETA_SINGLE.evaluate(T, 0.5, 4.0, 1.0, 6.0).series();
        assertEquals(0.0, y[650]);
        assertEquals(0.0, y[800]);
        assertTrue(y[300] > 0.0);
    }

    @Test
    void betaSingleCarriesTotalEnergy() {
        double tn = T[T.length - 1];
        double[] y = ShapeFunction.BETA_SINGLE.evaluate(T, 0.3, 10.0, 2.5, tn).series();
        double energy = 0.0;
        for (double v : y) energy += v * v * 0.01;
        assertEquals(2.5, energy, 0.025);
    }

    @Test
    void largeConcentrationStaysFinite() {
        double tn = T[T.length - 1];
        double[] y = ShapeFunction.BETA_SINGLE.evaluate(T, 0.4, 400.0, 1.0, tn).series();
        for (double v : y) assertTrue(Double.isFinite(v));
    }

    @Test
    void betaDualRejectsExcessWeight() {
        double tn = T[T.length - 1];
        assertThrows(ShapeFunctionException.class,
                () -> ShapeFunction.BETA_DUAL.evaluate(T, 0.2, 15.0, 0.6, 12.0, 0.96, 1.0, tn));
    }

    @Test
    void gammaAndHousnerShapes() {
        double[] g = ShapeFunction.GAMMA.evaluate(T, 2.0, 2.0, 1.0).series();
        assertEquals(0.0, g[0]);
        assertEquals(2.0 * 4.0 * Math.exp(-2.0), g[200], 1e-9);

        double[] h = ShapeFunction.HOUSNER.evaluate(T, 3.0, 0.5, 1.0, 2.0, 5.0).series();
        assertEquals(0.0, h[0]);
        assertEquals(0.75, h[100], 1e-9);
        assertEquals(3.0, h[300], 1e-12);
        assertEquals(3.0 * Math.exp(-0.5 * 2.0), h[700], 1e-9);
        assertThrows(ShapeFunctionException.class, () -> ShapeFunction.HOUSNER.evaluate(T, 3.0, 0.5, 1.0, 5.0, 2.0));
    }

    @Test
    void wrongParameterCountIsRejected() {
        assertThrows(ShapeFunctionException.class, () -> ShapeFunction.LINEAR.evaluate(T, 1.0));
        assertThrows(ShapeFunctionException.class, () -> ShapeFunction.BETA_SINGLE.evaluate(T, 0.3, 10.0, 1.0));
        assertThrows(ShapeFunctionException.class, () -> ShapeFunction.CONSTANT.evaluate(T, Double.NaN));
    }

    @Test
    void evaluateCopiesParameters() {
        double[] params = {2.0, 1.0};
        ShapeFunctionResult r = ShapeFunction.LINEAR.evaluate(T, params);
        params[0] = 99.0;
        assertEquals(2.0, r.params()[0]);
    }

    @Test
    void lookupByName() {
        assertSame(ShapeFunction.BETA_SINGLE, ShapeFunction.fromName("beta_single"));
        assertSame(ShapeFunction.LINEAR, ShapeFunction.fromName(" Linear "));
        assertSame(ShapeFunction.HOUSNER, ShapeFunction.fromName("HOUSNER"));
        assertThrows(ShapeFunctionException.class, () -> ShapeFunction.fromName("sigmoid"));
        for (ShapeFunction fn : ShapeFunction.values()) {
            assertSame(fn, ShapeFunction.fromName(fn.functionName()));
            assertEquals(fn.parameterNames().size(), fn.parameterCount());
        }
    }
}
