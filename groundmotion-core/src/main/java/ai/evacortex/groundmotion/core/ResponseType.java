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
 * Response views of a ground motion.
 */
public enum ResponseType {
    ACCELERATION("ac"),
    VELOCITY("vel"),
    DISPLACEMENT("disp");

    private final String key;

    ResponseType(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }
}
