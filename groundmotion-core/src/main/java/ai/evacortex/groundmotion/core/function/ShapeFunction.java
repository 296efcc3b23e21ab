/*
 * GroundMotion — Stochastic Ground-Motion Simulator
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.groundmotion.core.function;

import ai.evacortex.groundmotion.core.exceptions.ShapeFunctionException;
import org.apache.commons.math3.special.Beta;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Closed set of parametric time-shaping functions describing how a scalar quantity (envelope
 * amplitude, filter frequency, damping ratio) evolves over the duration of a record.
 *
 * <p>Each constant is a pure function of the time axis and a short parameter vector. The beta
 * family describes an amplitude envelope: the energy density is built first and the square root
 * of {@code Et} times that density is returned.</p>
 */
public enum ShapeFunction {

    /** {@code pc} everywhere. */
    CONSTANT("constant", "pc") {
        @Override
        double[] apply(double[] t, double[] p) {
            double[] out = new double[t.length];
            Arrays.fill(out, p[0]);
            return out;
        }
    },

    /** Straight line from {@code pf} at {@code t = 0} to {@code pl} at the last sample. */
    LINEAR("linear", "pf", "pl") {
        @Override
        double[] apply(double[] t, double[] p) {
            double pf = p[0], pl = p[1];
            double tLast = requireDuration(t);
            double[] out = new double[t.length];
            for (int i = 0; i < t.length; i++) {
                out[i] = pf - (pf - pl) * (t[i] / tLast);
            }
            return out;
        }
    },

    /** Geometric interpolation from {@code pf} to {@code pl}; both must be positive. */
    EXPONENTIAL("exponential", "pf", "pl") {
        @Override
        double[] apply(double[] t, double[] p) {
            double pf = p[0], pl = p[1];
            if (!(pf > 0.0) || !(pl > 0.0)) {
                throw new ShapeFunctionException("exponential requires pf > 0 and pl > 0, got ("
                        + pf + ", " + pl + ")");
            }
            double tLast = requireDuration(t);
            double rate = Math.log(pl / pf);
            double[] out = new double[t.length];
            for (int i = 0; i < t.length; i++) {
                out[i] = pf * Math.exp(rate * (t[i] / tLast));
            }
            return out;
        }
    },

    /** Two linear ramps, {@code pf → pm} over {@code [0, tmax]} then {@code pm → pl}. */
    BILINEAR("bilinear", "pf", "pm", "pl", "tmax") {
        @Override
        double[] apply(double[] t, double[] p) {
            double pf = p[0], pm = p[1], pl = p[2], tmax = p[3];
            double tLast = requireDuration(t);
            if (!(tmax > 0.0) || !(tmax < tLast)) {
                throw new ShapeFunctionException("bilinear requires 0 < tmax < " + tLast + ", got " + tmax);
            }
            double[] out = new double[t.length];
            for (int i = 0; i < t.length; i++) {
                out[i] = t[i] <= tmax
                        ? pf - (pf - pm) * t[i] / tmax
                        : pm - (pm - pl) * (t[i] - tmax) / (tLast - tmax);
            }
            return out;
        }
    },

    /** Square root of {@code Et} times a beta density on {@code (0, tn)}. */
    BETA_BASIC("beta_basic", "p1", "c1", "Et", "tn") {
        @Override
        double[] apply(double[] t, double[] p) {
            double p1 = p[0], c1 = p[1], et = p[2], tn = p[3];
            requireBeta(p1, c1, et, tn);
            double[] out = new double[t.length];
            for (int i = 0; i < t.length; i++) {
                if (t[i] > 0.0 && t[i] < tn) {
                    out[i] = Math.sqrt(et * betaDensity(t[i], p1, c1, tn));
                }
            }
            return out;
        }
    },

    /** Beta envelope with a single strong phase over a quadratic background. */
    BETA_SINGLE("beta_single", "p1", "c1", "Et", "tn") {
        @Override
        double[] apply(double[] t, double[] p) {
            double p1 = p[0], c1 = p[1], et = p[2], tn = p[3];
            requireBeta(p1, c1, et, tn);
            double[] out = new double[t.length];
            for (int i = 1; i < t.length - 1; i++) {
                if (t[i] >= tn) continue;
                double density = BACKGROUND_WEIGHT * backgroundDensity(t[i], tn)
                        + SINGLE_PHASE_WEIGHT * betaDensity(t[i], p1, c1, tn);
                out[i] = Math.sqrt(et * density);
            }
            return out;
        }
    },

    /** Beta envelope with two strong phases weighted {@code a1} and {@code 0.95 − a1}. */
    BETA_DUAL("beta_dual", "p1", "c1", "p2", "c2", "a1", "Et", "tn") {
        @Override
        double[] apply(double[] t, double[] p) {
            double p1 = p[0], c1 = p[1], p2 = p[2], c2 = p[3], a1 = p[4], et = p[5], tn = p[6];
            requireBeta(p1, c1, et, tn);
            requireBeta(p2, c2, et, tn);
            double a2 = SINGLE_PHASE_WEIGHT - a1;
            if (!(a1 >= 0.0) || !(a2 >= 0.0)) {
                throw new ShapeFunctionException("beta_dual requires 0 <= a1 <= " + SINGLE_PHASE_WEIGHT
                        + ", got " + a1);
            }
            double[] out = new double[t.length];
            for (int i = 1; i < t.length - 1; i++) {
                if (t[i] >= tn) continue;
                double density = BACKGROUND_WEIGHT * backgroundDensity(t[i], tn)
                        + a1 * betaDensity(t[i], p1, c1, tn)
                        + a2 * betaDensity(t[i], p2, c2, tn);
                out[i] = Math.sqrt(et * density);
            }
            return out;
        }
    },

    /** {@code p0 · t^p1 · exp(−p2·t)}. */
    GAMMA("gamma", "p0", "p1", "p2") {
        @Override
        double[] apply(double[] t, double[] p) {
            double p0 = p[0], p1 = p[1], p2 = p[2];
            if (p1 < 0.0) {
                throw new ShapeFunctionException("gamma requires p1 >= 0, got " + p1);
            }
            double[] out = new double[t.length];
            for (int i = 0; i < t.length; i++) {
                out[i] = p0 * Math.pow(t[i], p1) * Math.exp(-p2 * t[i]);
            }
            return out;
        }
    },

    /** Housner-Jennings envelope: quadratic build-up, plateau, then stretched exponential decay. */
    HOUSNER("housner", "p0", "p1", "p2", "t1", "t2") {
        @Override
        double[] apply(double[] t, double[] p) {
            double p0 = p[0], p1 = p[1], p2 = p[2], t1 = p[3], t2 = p[4];
            if (!(t1 > 0.0) || !(t2 >= t1)) {
                throw new ShapeFunctionException("housner requires 0 < t1 <= t2, got (" + t1 + ", " + t2 + ")");
            }
            double[] out = new double[t.length];
            for (int i = 0; i < t.length; i++) {
                double ti = t[i];
                if (ti < t1) {
                    out[i] = p0 * (ti / t1) * (ti / t1);
                } else if (ti <= t2) {
                    out[i] = p0;
                } else {
                    out[i] = p0 * Math.exp(-p1 * Math.pow(ti - t2, p2));
                }
            }
            return out;
        }
    };

    /** Weight of the quadratic background density in the beta mixtures. */
    public static final double BACKGROUND_WEIGHT = 0.05;
    /** Weight left for the strong phase(s): {@code 1 − BACKGROUND_WEIGHT}. */
    public static final double SINGLE_PHASE_WEIGHT = 0.95;

    private final String functionName;
    private final List<String> parameterNames;

    ShapeFunction(String functionName, String... parameterNames) {
        this.functionName = functionName;
        this.parameterNames = List.of(parameterNames);
    }

    abstract double[] apply(double[] t, double[] params);

    /**
     * Evaluates this function over the time axis.
     *
     * @param t      time axis, ascending, starting at 0
     * @param params parameter vector in the order of {@link #parameterNames()}
     * @return the series, a copy of the parameters and the parameter names
     * @throws ShapeFunctionException if the parameter count or a parameter value is invalid
     */
    public ShapeFunctionResult evaluate(double[] t, double... params) {
        Objects.requireNonNull(t, "time axis must not be null");
        Objects.requireNonNull(params, "params must not be null");
        if (params.length != parameterNames.size()) {
            throw new ShapeFunctionException(functionName + " expects " + parameterNames.size()
                    + " parameters " + parameterNames + ", got " + params.length);
        }
        for (double v : params) {
            if (!Double.isFinite(v)) {
                throw new ShapeFunctionException(functionName + " parameters must be finite, got "
                        + Arrays.toString(params));
            }
        }
        double[] copy = params.clone();
        return new ShapeFunctionResult(apply(t, copy), copy, parameterNames);
    }

    public String functionName() {
        return functionName;
    }

    public List<String> parameterNames() {
        return parameterNames;
    }

    public int parameterCount() {
        return parameterNames.size();
    }

    /**
     * Resolves a function by its persisted name ({@code "beta_single"}, {@code "linear"}, ...).
     *
     * @throws ShapeFunctionException if no function has that name
     */
    public static ShapeFunction fromName(String name) {
        Objects.requireNonNull(name, "name must not be null");
        String key = name.trim().toLowerCase(Locale.ROOT);
        for (ShapeFunction fn : values()) {
            if (fn.functionName.equals(key)) return fn;
        }
        throw new ShapeFunctionException("unsupported function '" + name + "'");
    }

    private static double requireDuration(double[] t) {
        if (t.length < 2 || !(t[t.length - 1] > 0.0)) {
            throw new ShapeFunctionException("time axis must contain at least two samples and end after 0");
        }
        return t[t.length - 1];
    }

    private static void requireBeta(double p, double c, double et, double tn) {
        if (!(p > 0.0 && p < 1.0) || !(c > 0.0) || !(et >= 0.0) || !(tn > 0.0)) {
            throw new ShapeFunctionException("beta shape requires 0 < p < 1, c > 0, Et >= 0, tn > 0, got (p="
                    + p + ", c=" + c + ", Et=" + et + ", tn=" + tn + ")");
        }
    }

    private static double backgroundDensity(double t, double tn) {
        return 6.0 * t * (tn - t) / (tn * tn * tn);
    }

    // log-space evaluation keeps large c from overflowing
    private static double betaDensity(double t, double p, double c, double tn) {
        double a = c * p;
        double b = c * (1.0 - p);
        return Math.exp(a * Math.log(t) + b * Math.log(tn - t)
                - Beta.logBeta(1.0 + a, 1.0 + b) - (1.0 + c) * Math.log(tn));
    }
}
