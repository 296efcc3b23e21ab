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
import ai.evacortex.groundmotion.core.model.StochasticModel;

import java.util.Objects;

/**
 * Realizations produced by one simulation batch. Row {@code r} of {@code ac}, {@code vel} and
 * {@code disp} belongs to realization {@code r}; every row holds {@code npts} samples spaced
 * {@code dt} apart.
 *
 * <p>The ensemble is immutable: the arrays are copied on construction and on every read.</p>
 */
public record MotionEnsemble(double dt, double[][] ac, double[][] vel, double[][] disp) {

    public MotionEnsemble {
        Objects.requireNonNull(ac, "ac must not be null");
        Objects.requireNonNull(vel, "vel must not be null");
        Objects.requireNonNull(disp, "disp must not be null");
        if (!(dt > 0.0) || !Double.isFinite(dt)) {
            throw new IllegalArgumentException("dt must be positive and finite, got " + dt);
        }
        if (ac.length != vel.length || ac.length != disp.length) {
            throw new IllegalArgumentException("ac, vel and disp must hold the same number of realizations");
        }
        ac = deepCopy(ac);
        vel = deepCopy(vel);
        disp = deepCopy(disp);
    }

    @Override
    public double[][] ac() {
        return deepCopy(ac);
    }

    @Override
    public double[][] vel() {
        return deepCopy(vel);
    }

    @Override
    public double[][] disp() {
        return deepCopy(disp);
    }

    /**
     * Ensemble of the last {@link StochasticModel#simulate(int)} call on {@code model}.
     *
     * @throws IllegalStateException if the model has not simulated yet
     */
    public static MotionEnsemble fromModel(StochasticModel model) {
        MotionEnsemble last = Objects.requireNonNull(model, "model must not be null").lastSimulation();
        if (last == null) {
            throw new IllegalStateException("Model has no simulation; call simulate(n) first");
        }
        return last;
    }

    public int size() {
        return ac.length;
    }

    public int npts() {
        return ac.length == 0 ? 0 : ac[0].length;
    }

    public double[] t() {
        double[] t = new double[npts()];
        for (int i = 0; i < t.length; i++) {
            t[i] = i * dt;
        }
        return t;
    }

    public MotionRecord record(int index) {
        Objects.checkIndex(index, size());
        return new MotionRecord(dt, ac[index], vel[index], disp[index]);
    }

    public double[] pga() {
        return peaks(ac);
    }

    public double[] pgv() {
        return peaks(vel);
    }

    public double[] pgd() {
        return peaks(disp);
    }

    private static double[][] deepCopy(double[][] rows) {
        double[][] out = new double[rows.length][];
        for (int r = 0; r < rows.length; r++) {
            out[r] = Objects.requireNonNull(rows[r], "realization rows must not be null").clone();
        }
        return out;
    }

    private static double[] peaks(double[][] rows) {
        double[] out = new double[rows.length];
        for (int r = 0; r < rows.length; r++) {
            out[r] = SignalMath.peak(rows[r]);
        }
        return out;
    }
}
