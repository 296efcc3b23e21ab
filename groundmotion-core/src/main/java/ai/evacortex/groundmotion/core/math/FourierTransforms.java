/*
 * GroundMotion — Stochastic Ground-Motion Simulator
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.groundmotion.core.math;

import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;

import java.util.Objects;

/**
 * Real inverse transforms and frequency-domain integration of one-sided spectra.
 *
 * <p>A one-sided spectrum of {@code m} bins (bin {@code k} at {@code ω_k = k·π/(m·dt)}) is read as
 * the non-negative half of a real signal of {@code 2m} samples whose Nyquist bin is zero.
 * {@code m} must be a power of two.</p>
 */
public final class FourierTransforms {

    private FourierTransforms() {}

    /**
     * Inverse-transforms a one-sided spectrum and keeps the first {@code keep} samples.
     *
     * @param real one-sided real parts
     * @param imag one-sided imaginary parts
     * @param keep number of leading samples to return
     * @return real signal of length {@code keep}
     */
    public static double[] inverseReal(double[] real, double[] imag, int keep) {
        Objects.requireNonNull(real, "real must not be null");
        Objects.requireNonNull(imag, "imag must not be null");
        int m = real.length;
        if (imag.length != m) {
            throw new IllegalArgumentException("Mismatched lengths: " + m + " vs " + imag.length);
        }
        if (m == 0 || Integer.bitCount(m) != 1) {
            throw new IllegalArgumentException("one-sided length must be a power of two, got " + m);
        }
        int size = 2 * m;
        if (keep < 0 || keep > size) {
            throw new IllegalArgumentException("keep must be in [0, " + size + "], got " + keep);
        }

        Complex[] full = new Complex[size];
        full[0] = new Complex(real[0], 0.0);
        full[m] = Complex.ZERO;
        for (int k = 1; k < m; k++) {
            full[k] = new Complex(real[k], imag[k]);
            full[size - k] = new Complex(real[k], -imag[k]);
        }

        Complex[] signal = new FastFourierTransformer(DftNormalization.STANDARD)
                .transform(full, TransformType.INVERSE);

        double[] out = new double[keep];
        for (int i = 0; i < keep; i++) {
            out[i] = signal[i].getReal();
        }
        return out;
    }

    /**
     * Divides each non-zero bin by {@code (iω)^order}: order 1 integrates once (velocity from
     * acceleration), order 2 twice. The zero-frequency bin is set to zero.
     *
     * @return {@code {real, imag}} of the integrated spectrum
     */
    public static double[][] integrate(double[] real, double[] imag, double[] omega, int order) {
        Objects.requireNonNull(omega, "omega must not be null");
        if (real.length != omega.length || imag.length != omega.length) {
            throw new IllegalArgumentException("spectrum and frequency axis must have equal length");
        }
        if (order != 1 && order != 2) {
            throw new IllegalArgumentException("integration order must be 1 or 2, got " + order);
        }
        double[] re = new double[real.length];
        double[] im = new double[imag.length];
        for (int k = 0; k < omega.length; k++) {
            double w = omega[k];
            if (w == 0.0) continue;
            if (order == 1) {
                // (a + ib) / (iω) = (b − ia) / ω
                re[k] = imag[k] / w;
                im[k] = -real[k] / w;
            } else {
                // (a + ib) / (−ω²)
                double w2 = w * w;
                re[k] = -real[k] / w2;
                im[k] = -imag[k] / w2;
            }
        }
        return new double[][]{re, im};
    }
}
