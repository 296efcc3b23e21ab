/*
 * GroundMotion — Stochastic Ground-Motion Simulator
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.groundmotion.core.model;

/**
 * The five time-varying quantities of the evolutionary filter model.
 */
public enum FilterQuantity {
    /** Modulating function (envelope), the instantaneous standard deviation. */
    MDL("mdl", false),
    /** Upper filter frequency, stored in rad/s. */
    WU("wu", true),
    /** Upper filter damping ratio. */
    ZU("zu", false),
    /** Lower filter frequency, stored in rad/s. */
    WL("wl", true),
    /** Lower filter damping ratio. */
    ZL("zl", false);

    private final String key;
    private final boolean angular;

    FilterQuantity(String key, boolean angular) {
        this.key = key;
        this.angular = angular;
    }

    /** Short name used in parameter files. */
    public String key() {
        return key;
    }

    /** Whether the shape function output is in Hz and is stored multiplied by 2π. */
    public boolean isAngular() {
        return angular;
    }
}
