/*
 * GroundMotion — Stochastic Ground-Motion Simulator
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.groundmotion.core.engine;

import java.util.Objects;

public final class JavaFilterKernel implements FilterKernel {

    @Override
    public SpectralMoments computeStats(double[] wu, double[] zu, double[] wl, double[] zl, double[] freq) {
        requireFilter(wu, zu, wl, zl);
        Objects.requireNonNull(freq, "freq must not be null");

        int npts = wu.length;
        double dw = step(freq);
        double[] variance = new double[npts];
        double[] varianceDot = new double[npts];
        double[] variance2Dot = new double[npts];
        double[] varianceBar = new double[npts];
        double[] variance2Bar = new double[npts];

        for (int i = 0; i < npts; i++) {
            double m0 = 0.0, m2 = 0.0, m4 = 0.0, mn2 = 0.0, mn4 = 0.0;
            for (double w : freq) {
                double s = psd(wu[i], zu[i], wl[i], zl[i], w);
                if (s == 0.0) continue;
                double w2 = w * w;
                m0 += s;
                m2 += w2 * s;
                m4 += w2 * w2 * s;
                if (w > 0.0) {
                    mn2 += s / w2;
                    mn4 += s / (w2 * w2);
                }
            }
            variance[i] = m0 * dw;
            varianceDot[i] = m2 * dw;
            variance2Dot[i] = m4 * dw;
            varianceBar[i] = mn2 * dw;
            variance2Bar[i] = mn4 * dw;
        }
        return new SpectralMoments(variance, varianceDot, variance2Dot, varianceBar, variance2Bar);
    }

    @Override
    public double[] computeFas(double[] mdl, double[] wu, double[] zu, double[] wl, double[] zl, double[] freq) {
        requireFilter(wu, zu, wl, zl);
        Objects.requireNonNull(mdl, "mdl must not be null");
        Objects.requireNonNull(freq, "freq must not be null");
        if (mdl.length != wu.length) {
            throw new IllegalArgumentException("Mismatched lengths: mdl " + mdl.length + " vs filter " + wu.length);
        }

        if (freq.length < 2) {
            return new double[freq.length];
        }
        double dw = step(freq);
        double dt = Math.PI / (freq.length * dw);
        double[] energy = new double[freq.length];
        double[] s = new double[freq.length];

        for (int i = 0; i < wu.length; i++) {
            if (mdl[i] == 0.0) continue;
            double m0 = 0.0;
            for (int k = 0; k < freq.length; k++) {
                s[k] = psd(wu[i], zu[i], wl[i], zl[i], freq[k]);
                m0 += s[k];
            }
            double variance = m0 * dw;
            if (!(variance > 0.0)) continue;
            double weight = mdl[i] * mdl[i] / variance;
            for (int k = 0; k < freq.length; k++) {
                energy[k] += weight * s[k];
            }
        }

        double[] fas = new double[freq.length];
        for (int k = 0; k < freq.length; k++) {
            fas[k] = Math.sqrt(Math.PI * dt * energy[k]);
        }
        return fas;
    }

    @Override
    public ComplexSpectrum synthesizeSeries(int n, int npts, double[] t, double[] freqSim,
                                            double[] mdl, double[] wu, double[] zu, double[] wl, double[] zl,
                                            double[] variance, double[][] whiteNoise) {
        requireFilter(wu, zu, wl, zl);
        Objects.requireNonNull(t, "t must not be null");
        Objects.requireNonNull(freqSim, "freqSim must not be null");
        Objects.requireNonNull(mdl, "mdl must not be null");
        Objects.requireNonNull(variance, "variance must not be null");
        Objects.requireNonNull(whiteNoise, "whiteNoise must not be null");
        if (n <= 0) {
            throw new IllegalArgumentException("n must be positive, got " + n);
        }
        if (t.length != npts || mdl.length != npts || wu.length != npts || variance.length != npts) {
            throw new IllegalArgumentException("All time series must have npts=" + npts + " samples");
        }
        if (whiteNoise.length != n) {
            throw new IllegalArgumentException("whiteNoise must have " + n + " rows, got " + whiteNoise.length);
        }
        for (double[] row : whiteNoise) {
            if (row.length != npts) {
                throw new IllegalArgumentException("whiteNoise rows must have " + npts + " samples");
            }
        }

        int bins = freqSim.length;
        double dt = Math.PI / (bins * step(freqSim));
        double[][] re = new double[n][bins];
        double[][] im = new double[n][bins];
        double[] gRe = new double[bins];
        double[] gIm = new double[bins];

        for (int i = 0; i < npts; i++) {
            if (mdl[i] == 0.0 || !(variance[i] > 0.0)) continue;
            double scale = mdl[i] * Math.sqrt(Math.PI / (dt * variance[i]));

            // g(ω) = H_i(ω)·e^{−iω·t_i}
            for (int k = 0; k < bins; k++) {
                double w = freqSim[k];
                double w2 = w * w;
                double lRe = wl[i] * wl[i] - w2, lIm = 2.0 * zl[i] * wl[i] * w;
                double uRe = wu[i] * wu[i] - w2, uIm = 2.0 * zu[i] * wu[i] * w;
                double dRe = lRe * uRe - lIm * uIm;
                double dIm = lRe * uIm + lIm * uRe;
                double dAbs2 = dRe * dRe + dIm * dIm;
                if (w2 == 0.0 || dAbs2 == 0.0) {
                    gRe[k] = 0.0;
                    gIm[k] = 0.0;
                    continue;
                }
                double hRe = -w2 * dRe / dAbs2;
                double hIm = w2 * dIm / dAbs2;
                double c = Math.cos(w * t[i]);
                double sn = Math.sin(w * t[i]);
                gRe[k] = hRe * c + hIm * sn;
                gIm[k] = hIm * c - hRe * sn;
            }

            for (int r = 0; r < n; r++) {
                double a = scale * whiteNoise[r][i];
                double[] rowRe = re[r];
                double[] rowIm = im[r];
                for (int k = 0; k < bins; k++) {
                    rowRe[k] += a * gRe[k];
                    rowIm[k] += a * gIm[k];
                }
            }
        }
        return new ComplexSpectrum(re, im);
    }

    /** Squared magnitude of the filter pair response at one frequency. */
    static double psd(double wu, double zu, double wl, double zl, double w) {
        double w2 = w * w;
        double lower = (wl * wl - w2) * (wl * wl - w2) + (2.0 * zl * wl * w) * (2.0 * zl * wl * w);
        double upper = (wu * wu - w2) * (wu * wu - w2) + (2.0 * zu * wu * w) * (2.0 * zu * wu * w);
        double denominator = lower * upper;
        if (w2 == 0.0 || !(denominator > 0.0)) return 0.0;
        return w2 * w2 / denominator;
    }

    /** Bin width of a uniform axis; a lone zero bin has none and carries no filtered energy. */
    private static double step(double[] axis) {
        if (axis.length < 2) {
            return 0.0;
        }
        return axis[1] - axis[0];
    }

    private static void requireFilter(double[] wu, double[] zu, double[] wl, double[] zl) {
        if (wu == null || zu == null || wl == null || zl == null) {
            throw new NullPointerException("filter arrays must not be null");
        }
        int len = wu.length;
        if (zu.length != len || wl.length != len || zl.length != len) {
            throw new IllegalArgumentException("Mismatched filter lengths: " + wu.length + ", " + zu.length
                    + ", " + wl.length + ", " + zl.length);
        }
    }
}
