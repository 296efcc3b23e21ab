/*
 * GroundMotion — Stochastic Ground-Motion Simulator
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.groundmotion.core;

import ai.evacortex.groundmotion.core.math.SignalMath;

import java.util.Objects;

/**
 * {@code MotionRecord} is one acceleration, velocity and displacement history on a uniform time
 * step. Range selection returns a new record; the receiver is never modified.
 */
public final class MotionRecord {

    public static final double DEFAULT_ENERGY_LOW = 0.001;
    public static final double DEFAULT_ENERGY_HIGH = 0.999;

    private final double dt;
    private final double[] ac;
    private final double[] vel;
    private final double[] disp;

    public MotionRecord(double dt, double[] ac, double[] vel, double[] disp) {
        Objects.requireNonNull(ac, "ac must not be null");
        Objects.requireNonNull(vel, "vel must not be null");
        Objects.requireNonNull(disp, "disp must not be null");
        if (!(dt > 0.0) || !Double.isFinite(dt)) {
            throw new IllegalArgumentException("dt must be positive and finite, got " + dt);
        }
        if (ac.length != vel.length || ac.length != disp.length) {
            throw new IllegalArgumentException("ac, vel and disp must have equal length");
        }
        this.dt = dt;
        this.ac = ac.clone();
        this.vel = vel.clone();
        this.disp = disp.clone();
    }

    public double dt() {
        return dt;
    }

    public int npts() {
        return ac.length;
    }

    public double[] t() {
        double[] t = new double[ac.length];
        for (int i = 0; i < t.length; i++) {
            t[i] = i * dt;
        }
        return t;
    }

    public double[] ac() {
        return ac.clone();
    }

    public double[] vel() {
        return vel.clone();
    }

    public double[] disp() {
        return disp.clone();
    }

    public double pga() {
        return SignalMath.peak(ac);
    }

    public double pgv() {
        return SignalMath.peak(vel);
    }

    public double pgd() {
        return SignalMath.peak(disp);
    }

    /** Cumulative energy of the acceleration. */
    public double[] ce() {
        return SignalMath.cumulativeEnergy(ac, dt);
    }

    /** Energy mask for the default 0.1 % to 99.9 % band. */
    public boolean[] energyMask() {
        return energyMask(DEFAULT_ENERGY_LOW, DEFAULT_ENERGY_HIGH);
    }

    /**
     * Flags the samples whose cumulative energy, normalized by the total, lies in
     * {@code [low, high]}. A record without energy yields an all-false mask.
     */
    public boolean[] energyMask(double low, double high) {
        if (!(low >= 0.0) || !(high <= 1.0) || !(low < high)) {
            throw new IllegalArgumentException("energy range must satisfy 0 <= low < high <= 1, got ("
                    + low + ", " + high + ")");
        }
        double[] ce = ce();
        boolean[] mask = new boolean[ce.length];
        double total = ce.length == 0 ? 0.0 : ce[ce.length - 1];
        if (total <= 0.0) return mask;
        for (int i = 0; i < ce.length; i++) {
            double fraction = ce[i] / total;
            mask[i] = fraction >= low && fraction <= high;
        }
        return mask;
    }

    /**
     * Selects a range by energy fraction.
     *
     * @param option must name {@link RangeOption#ENERGY}
     * @throws ai.evacortex.groundmotion.core.exceptions.UnsupportedOptionException for unknown options
     */
    public MotionRecord selectRange(String option, double low, double high) {
        RangeOption parsed = RangeOption.fromName(option);
        if (parsed != RangeOption.ENERGY) {
            throw new IllegalArgumentException("Option '" + parsed.key() + "' requires a boolean mask");
        }
        return applyMask(energyMask(low, high));
    }

    /**
     * Selects a range by an explicit mask.
     *
     * @param option must name {@link RangeOption#MASK}
     * @throws ai.evacortex.groundmotion.core.exceptions.UnsupportedOptionException for unknown options
     */
    public MotionRecord selectRange(String option, boolean[] mask) {
        RangeOption parsed = RangeOption.fromName(option);
        if (parsed != RangeOption.MASK) {
            throw new IllegalArgumentException("Option '" + parsed.key() + "' requires an energy fraction pair");
        }
        return applyMask(mask);
    }

    private MotionRecord applyMask(boolean[] mask) {
        Objects.requireNonNull(mask, "mask must not be null");
        if (mask.length != ac.length) {
            throw new IllegalArgumentException("mask length " + mask.length + " != npts " + ac.length);
        }
        int count = 0;
        for (boolean b : mask) if (b) count++;
        if (count == 0) {
            throw new IllegalArgumentException("range selects no samples");
        }
        double[] a = new double[count];
        double[] v = new double[count];
        double[] d = new double[count];
        int j = 0;
        for (int i = 0; i < mask.length; i++) {
            if (!mask[i]) continue;
            a[j] = ac[i];
            v[j] = vel[i];
            d[j] = disp[i];
            j++;
        }
        return new MotionRecord(dt, a, v, d);
    }
}
