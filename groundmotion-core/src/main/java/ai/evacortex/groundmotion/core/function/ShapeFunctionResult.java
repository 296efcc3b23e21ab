/*
 * GroundMotion — Stochastic Ground-Motion Simulator
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.groundmotion.core.function;

import java.util.List;

/**
 * Output of a {@link ShapeFunction} evaluation: the dense series over the time axis, the parameter
 * vector it was evaluated with, and the ordered parameter names.
 */
public record ShapeFunctionResult(double[] series, double[] params, List<String> names) {
}
