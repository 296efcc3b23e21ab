/*
 * GroundMotion — Stochastic Ground-Motion Simulator
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.groundmotion.core.exceptions;

public class ParameterFileException extends RuntimeException {
    public ParameterFileException(String message) {
        super("Parameter file: " + message);
    }

    public ParameterFileException(String message, Throwable cause) {
        super("Parameter file: " + message, cause);
    }
}
