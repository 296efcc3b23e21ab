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

public class FilterEngine {

    private static volatile FilterKernel backend = new JavaFilterKernel();

    private FilterEngine() {}

    public static void setBackend(FilterKernel kernel) {
        backend = Objects.requireNonNull(kernel, "kernel must not be null");
    }

    public static FilterKernel backend() {
        return backend;
    }

    public static SpectralMoments computeStats(double[] wu, double[] zu, double[] wl, double[] zl, double[] freq) {
        return backend.computeStats(wu, zu, wl, zl, freq);
    }

    public static double[] computeFas(double[] mdl, double[] wu, double[] zu, double[] wl, double[] zl,
                                      double[] freq) {
        return backend.computeFas(mdl, wu, zu, wl, zl, freq);
    }

    public static ComplexSpectrum synthesizeSeries(int n, int npts, double[] t, double[] freqSim,
                                                   double[] mdl, double[] wu, double[] zu, double[] wl,
                                                   double[] zl, double[] variance, double[][] whiteNoise) {
        return backend.synthesizeSeries(n, npts, t, freqSim, mdl, wu, zu, wl, zl, variance, whiteNoise);
    }
}
