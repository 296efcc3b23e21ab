/*
 * GroundMotion — Stochastic Ground-Motion Simulator
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.groundmotion.core.engine;

/**
 * Batch of one-sided complex spectra stored as separate real and imaginary planes,
 * {@code real[row][bin]} and {@code imag[row][bin]}.
 */
public record ComplexSpectrum(double[][] real, double[][] imag) {

    public int rows() {
        return real.length;
    }

    public int bins() {
        return real.length == 0 ? 0 : real[0].length;
    }
}
