/*
 * GroundMotion — Stochastic Ground-Motion Simulator
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.groundmotion.core.model;

import ai.evacortex.groundmotion.core.function.ShapeFunction;

import java.util.List;

/**
 * Raw description of one assigned filter quantity, kept for persistence.
 *
 * @param function the shape function that produced the series
 * @param params   the parameter vector as given by the caller
 * @param names    ordered parameter names of {@code function}
 */
public record FilterParameters(ShapeFunction function, double[] params, List<String> names) {
}
