/*
 * GroundMotion — Stochastic Ground-Motion Simulator
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.groundmotion.core.model;

import ai.evacortex.groundmotion.core.ExtremaFeature;
import ai.evacortex.groundmotion.core.ResponseType;
import ai.evacortex.groundmotion.core.domain.FrequencyTimeGrid;
import ai.evacortex.groundmotion.core.engine.FilterEngine;
import ai.evacortex.groundmotion.core.engine.SpectralMoments;
import ai.evacortex.groundmotion.core.math.ExtremaRates;
import ai.evacortex.groundmotion.core.math.SignalMath;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@code StatisticsEngine} derives the evolutionary statistics of an {@link EvolutionaryModel}:
 * the five spectral moments, the model Fourier amplitude spectrum, the cumulative energy of the
 * envelope and twelve cumulative extrema-rate curves.
 *
 * <p>Every derived quantity carries its own dirty flag. A change of the model zeroes all stored
 * arrays and raises every flag; the next read recomputes only what it needs. The moments are
 * obtained from {@link FilterEngine} in one call and cached together.</p>
 *
 * <p>Rates come from the moment ladder {@code variance_2dot, variance_dot, variance, variance_bar,
 * variance_2bar}: the local-extrema rate of a response uses two adjacent rungs starting at its own
 * position (acceleration at {@code variance_2dot}), the zero-crossing rate the next pair down.
 * Cumulative curves are rectangle-rule running sums scaled by {@code dt}.</p>
 */
public class StatisticsEngine {

    private static final Logger log = LoggerFactory.getLogger(StatisticsEngine.class);

    private final EvolutionaryModel model;

    private SpectralMoments moments;
    private double[] fas;
    private double[] ce;
    private final Map<ResponseType, Map<ExtremaFeature, double[]>> curves = new EnumMap<>(ResponseType.class);

    private boolean momentsDirty;
    private boolean fasDirty;
    private boolean ceDirty;
    private final Map<ResponseType, Map<ExtremaFeature, Boolean>> curveDirty = new EnumMap<>(ResponseType.class);

    public StatisticsEngine(EvolutionaryModel model) {
        this.model = Objects.requireNonNull(model, "model must not be null");
        allocate();
        model.addListener((m, quantity) -> invalidate());
    }

    public EvolutionaryModel model() {
        return model;
    }

    public FrequencyTimeGrid grid() {
        return model.grid();
    }

    /** Whether every stored statistic is consistent with the current model. */
    public boolean isCurrent() {
        if (momentsDirty || fasDirty || ceDirty) return false;
        for (Map<ExtremaFeature, Boolean> flags : curveDirty.values()) {
            if (flags.containsValue(Boolean.TRUE)) return false;
        }
        return true;
    }

    /** Copy of the five moments. */
    public SpectralMoments moments() {
        return currentMoments().copy();
    }

    /** Current moments without copying; callers in this package must not modify them. */
    SpectralMoments currentMoments() {
        if (momentsDirty) {
            SpectralMoments computed = FilterEngine.computeStats(
                    model.view(FilterQuantity.WU), model.view(FilterQuantity.ZU),
                    model.view(FilterQuantity.WL), model.view(FilterQuantity.ZL),
                    grid().freq());
            moments = computed;
            momentsDirty = false;
            log.debug("Recomputed spectral moments over {} samples", computed.variance().length);
        }
        return moments;
    }

    public double[] variance() {
        return currentMoments().variance().clone();
    }

    public double[] varianceDot() {
        return currentMoments().varianceDot().clone();
    }

    public double[] variance2Dot() {
        return currentMoments().variance2Dot().clone();
    }

    public double[] varianceBar() {
        return currentMoments().varianceBar().clone();
    }

    public double[] variance2Bar() {
        return currentMoments().variance2Bar().clone();
    }

    public double[] fas() {
        if (fasDirty) {
            fas = FilterEngine.computeFas(
                    model.view(FilterQuantity.MDL),
                    model.view(FilterQuantity.WU), model.view(FilterQuantity.ZU),
                    model.view(FilterQuantity.WL), model.view(FilterQuantity.ZL),
                    grid().freq());
            fasDirty = false;
        }
        return fas.clone();
    }

    public double[] ce() {
        if (ceDirty) {
            ce = SignalMath.cumulativeEnergy(model.view(FilterQuantity.MDL), grid().dt());
            ceDirty = false;
        }
        return ce.clone();
    }

    /**
     * Mean cumulative count of the given feature for the given response, excluding the effect of
     * the modulating function.
     */
    public double[] curve(ResponseType type, ExtremaFeature feature) {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(feature, "feature must not be null");
        Map<ExtremaFeature, Boolean> flags = curveDirty.get(type);
        if (flags.get(feature)) {
            double[] rate = rate(type, feature, currentMoments());
            curves.get(type).put(feature, SignalMath.cumulativeIntegral(rate, grid().dt()));
            flags.put(feature, Boolean.FALSE);
        }
        return curves.get(type).get(feature).clone();
    }

    public double[] mleAc() {
        return curve(ResponseType.ACCELERATION, ExtremaFeature.LOCAL_EXTREMA);
    }

    public double[] mleVel() {
        return curve(ResponseType.VELOCITY, ExtremaFeature.LOCAL_EXTREMA);
    }

    public double[] mleDisp() {
        return curve(ResponseType.DISPLACEMENT, ExtremaFeature.LOCAL_EXTREMA);
    }

    public double[] mzcAc() {
        return curve(ResponseType.ACCELERATION, ExtremaFeature.ZERO_CROSSING);
    }

    public double[] mzcVel() {
        return curve(ResponseType.VELOCITY, ExtremaFeature.ZERO_CROSSING);
    }

    public double[] mzcDisp() {
        return curve(ResponseType.DISPLACEMENT, ExtremaFeature.ZERO_CROSSING);
    }

    public double[] pmnmAc() {
        return curve(ResponseType.ACCELERATION, ExtremaFeature.POSITIVE_MINIMA_NEGATIVE_MAXIMA);
    }

    public double[] pmnmVel() {
        return curve(ResponseType.VELOCITY, ExtremaFeature.POSITIVE_MINIMA_NEGATIVE_MAXIMA);
    }

    public double[] pmnmDisp() {
        return curve(ResponseType.DISPLACEMENT, ExtremaFeature.POSITIVE_MINIMA_NEGATIVE_MAXIMA);
    }

    /** Brings every statistic up to date. */
    public StatisticsEngine computeAll() {
        currentMoments();
        fas();
        ce();
        for (ResponseType type : ResponseType.values()) {
            for (ExtremaFeature feature : ExtremaFeature.values()) {
                curve(type, feature);
            }
        }
        return this;
    }

    /** Copies the stored arrays as they are; stale entries read as zeros. */
    public StatisticsSnapshot snapshot() {
        SpectralMoments m = moments.copy();
        Map<ResponseType, Map<ExtremaFeature, double[]>> copy = new EnumMap<>(ResponseType.class);
        for (ResponseType type : ResponseType.values()) {
            Map<ExtremaFeature, double[]> row = new EnumMap<>(ExtremaFeature.class);
            curves.get(type).forEach((feature, values) -> row.put(feature, values.clone()));
            copy.put(type, row);
        }
        return new StatisticsSnapshot(m, fas.clone(), ce.clone(), copy);
    }

    static double[] rate(ResponseType type, ExtremaFeature feature, SpectralMoments m) {
        double[][] ladder = {m.variance2Dot(), m.varianceDot(), m.variance(), m.varianceBar(), m.variance2Bar()};
        int top = type.ordinal();
        return switch (feature) {
            case LOCAL_EXTREMA -> ExtremaRates.meanRate(ladder[top], ladder[top + 1]);
            case ZERO_CROSSING -> ExtremaRates.meanRate(ladder[top + 1], ladder[top + 2]);
            case POSITIVE_MINIMA_NEGATIVE_MAXIMA -> ExtremaRates.positiveMinimaNegativeMaximaRate(
                    ladder[top], ladder[top + 1], ladder[top + 1], ladder[top + 2]);
        };
    }

    private void invalidate() {
        allocate();
        log.debug("Model changed; statistics reset");
    }

    private void allocate() {
        int npts = grid().npts();
        moments = new SpectralMoments(new double[npts], new double[npts], new double[npts],
                new double[npts], new double[npts]);
        fas = new double[npts];
        ce = new double[npts];
        for (ResponseType type : ResponseType.values()) {
            Map<ExtremaFeature, double[]> row = new EnumMap<>(ExtremaFeature.class);
            for (ExtremaFeature feature : ExtremaFeature.values()) {
                row.put(feature, new double[npts]);
            }
            curves.put(type, row);
        }
        markDirty();
    }

    private void markDirty() {
        momentsDirty = true;
        fasDirty = true;
        ceDirty = true;
        for (ResponseType type : ResponseType.values()) {
            Map<ExtremaFeature, Boolean> flags = new EnumMap<>(ExtremaFeature.class);
            for (ExtremaFeature feature : ExtremaFeature.values()) {
                flags.put(feature, Boolean.TRUE);
            }
            curveDirty.put(type, flags);
        }
    }
}
