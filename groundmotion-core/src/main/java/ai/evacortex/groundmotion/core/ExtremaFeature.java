/*
 * GroundMotion — Stochastic Ground-Motion Simulator
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.groundmotion.core;

/**
 * Cumulative counting statistics predicted from spectral moments.
 * - LOCAL_EXTREMA: peaks and valleys (mle)
 * - ZERO_CROSSING: up- and down-crossings of zero (mzc)
 * - POSITIVE_MINIMA_NEGATIVE_MAXIMA: minima above and maxima below zero (pmnm)
 */
public enum ExtremaFeature {
    LOCAL_EXTREMA("mle"),
    ZERO_CROSSING("mzc"),
    POSITIVE_MINIMA_NEGATIVE_MAXIMA("pmnm");

    private final String key;

    ExtremaFeature(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}
