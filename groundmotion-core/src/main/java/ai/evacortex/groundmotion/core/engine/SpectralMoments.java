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
 * Evolutionary spectral moments of the filter pair, one value per time sample.
 *
 * @param variance     zeroth moment, the response variance
 * @param varianceDot  second moment, variance of the first time derivative
 * @param variance2Dot fourth moment, variance of the second time derivative
 * @param varianceBar  moment of order −2, variance of the first time integral
 * @param variance2Bar moment of order −4, variance of the second time integral
 */
public record SpectralMoments(double[] variance,
                              double[] varianceDot,
                              double[] variance2Dot,
                              double[] varianceBar,
                              double[] variance2Bar) {

    /** Deep copy; the record itself shares its arrays. */
    public SpectralMoments copy() {
        return new SpectralMoments(variance.clone(), varianceDot.clone(), variance2Dot.clone(),
                varianceBar.clone(), variance2Bar.clone());
    }
}
