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
 * Options for Monte Carlo synthesis.
 */
public record SimulationOptions(
        boolean parallelTransforms      // run the per-realization inverse transforms on the common pool
) {
    private static final boolean PARALLEL =
            Boolean.parseBoolean(System.getProperty("groundmotion.sim.parallel", "true"));

    public static SimulationOptions defaultOptions() {
        return new SimulationOptions(PARALLEL);
    }
}
