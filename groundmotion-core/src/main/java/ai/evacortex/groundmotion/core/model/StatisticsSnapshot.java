/*
 * GroundMotion — Stochastic Ground-Motion Simulator
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.groundmotion.core.model;

import ai.evacortex.groundmotion.core.ExtremaFeature;
import ai.evacortex.groundmotion.core.ResponseType;
import ai.evacortex.groundmotion.core.engine.SpectralMoments;

import java.util.Map;

/**
 * Copy of the stored statistics of a {@link StatisticsEngine}, taken without recomputing.
 */
public record StatisticsSnapshot(SpectralMoments moments,
                                 double[] fas,
                                 double[] ce,
                                 Map<ResponseType, Map<ExtremaFeature, double[]>> curves) {

    public double[] curve(ResponseType type, ExtremaFeature feature) {
        return curves.get(type).get(feature);
    }
}
