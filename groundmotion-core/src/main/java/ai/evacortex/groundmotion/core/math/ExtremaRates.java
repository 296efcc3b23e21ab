/*
 * GroundMotion — Stochastic Ground-Motion Simulator
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.groundmotion.core.math;

/**
 * Rice-type rates of a Gaussian process from ratios of its spectral moments.
 *
 * <p>Every ratio is guarded: a denominator at or below zero, or a non-finite quotient, yields a
 * zero rate at that instant.</p>
 */
public final class ExtremaRates {

    private static final double TWO_PI = 2.0 * Math.PI;
    private static final double FOUR_PI = 4.0 * Math.PI;

    private ExtremaRates() {}

    /** {@code sqrt(numerator/denominator)/(2π)} per sample. */
    public static double[] meanRate(double[] numerator, double[] denominator) {
        requireSameLength(numerator, denominator);
        double[] rate = new double[numerator.length];
        for (int i = 0; i < rate.length; i++) {
            rate[i] = sqrtRatio(numerator[i], denominator[i]) / TWO_PI;
        }
        return rate;
    }

    /**
     * Rate of positive minima and negative maxima,
     * {@code (sqrt(extremaNum/extremaDen) − sqrt(crossingNum/crossingDen))/(4π)}.
     * The result is not clamped and can be negative for near-degenerate spectra.
     */
    public static double[] positiveMinimaNegativeMaximaRate(double[] extremaNum, double[] extremaDen,
                                                             double[] crossingNum, double[] crossingDen) {
        requireSameLength(extremaNum, extremaDen);
        requireSameLength(extremaNum, crossingNum);
        requireSameLength(extremaNum, crossingDen);
        double[] rate = new double[extremaNum.length];
        for (int i = 0; i < rate.length; i++) {
            rate[i] = (sqrtRatio(extremaNum[i], extremaDen[i]) - sqrtRatio(crossingNum[i], crossingDen[i])) / FOUR_PI;
        }
        return rate;
    }

    static double sqrtRatio(double numerator, double denominator) {
        if (!(denominator > 0.0)) return 0.0;
        double ratio = numerator / denominator;
        if (!(ratio > 0.0) || Double.isInfinite(ratio)) return 0.0;
        return Math.sqrt(ratio);
    }

    private static void requireSameLength(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Mismatched lengths: " + a.length + " vs " + b.length);
        }
    }
}
