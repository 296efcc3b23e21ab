/*
 * GroundMotion — Stochastic Ground-Motion Simulator
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.groundmotion.core.exceptions;

public class InvalidGridException extends RuntimeException {
    public InvalidGridException(String message) {
        super("Invalid grid: " + message);
    }

    public InvalidGridException(String message, Throwable cause) {
        super("Invalid grid: " + message, cause);
    }
}
