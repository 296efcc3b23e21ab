/*
 * GroundMotion — Stochastic Ground-Motion Simulator
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.groundmotion.core;

import ai.evacortex.groundmotion.core.exceptions.UnsupportedOptionException;

import java.util.Locale;

/**
 * Ways of selecting a sub-range of a motion record.
 */
public enum RangeOption {
    /** Samples whose normalized cumulative energy falls within a fraction pair. */
    ENERGY("energy"),
    /** Samples flagged by an explicit boolean mask. */
    MASK("mask");

    private final String key;

    RangeOption(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    public static RangeOption fromName(String name) {
        if (name != null) {
            String normalized = name.trim().toLowerCase(Locale.ROOT);
            for (RangeOption option : values()) {
                if (option.key.equals(normalized)) return option;
            }
        }
        throw new UnsupportedOptionException(String.valueOf(name));
    }
}
