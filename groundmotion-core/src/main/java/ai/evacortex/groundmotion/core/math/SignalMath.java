/*
 * GroundMotion — Stochastic Ground-Motion Simulator
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.groundmotion.core.math;

import java.util.Objects;

public final class SignalMath {

    private SignalMath() {}

    /** Rectangle-rule running integral from the first sample: {@code out[i] = dt·Σ_{j≤i} x[j]}. */
    public static double[] cumulativeIntegral(double[] x, double dt) {
        Objects.requireNonNull(x, "series must not be null");
        double[] out = new double[x.length];
        double sum = 0.0;
        for (int i = 0; i < x.length; i++) {
            sum += x[i];
            out[i] = sum * dt;
        }
        return out;
    }

    /** Cumulative energy {@code dt·Σ x²}. */
    public static double[] cumulativeEnergy(double[] x, double dt) {
        Objects.requireNonNull(x, "series must not be null");
        double[] out = new double[x.length];
        double sum = 0.0;
        for (int i = 0; i < x.length; i++) {
            sum += x[i] * x[i];
            out[i] = sum * dt;
        }
        return out;
    }

    /** Largest absolute value, 0 for an empty series. */
    public static double peak(double[] x) {
        double max = 0.0;
        for (double v : x) {
            max = Math.max(max, Math.abs(v));
        }
        return max;
    }
}
