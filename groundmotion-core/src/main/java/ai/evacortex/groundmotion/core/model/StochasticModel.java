/*
 * GroundMotion — Stochastic Ground-Motion Simulator
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.groundmotion.core.model;

import ai.evacortex.groundmotion.core.MotionEnsemble;
import ai.evacortex.groundmotion.core.domain.FrequencyTimeGrid;
import ai.evacortex.groundmotion.core.engine.ComplexSpectrum;
import ai.evacortex.groundmotion.core.engine.FilterEngine;
import ai.evacortex.groundmotion.core.engine.SimulationOptions;
import ai.evacortex.groundmotion.core.function.ShapeFunction;
import ai.evacortex.groundmotion.core.io.codec.ModelParametersCodec;
import ai.evacortex.groundmotion.core.math.FourierTransforms;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.Well19937c;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.Objects;
import java.util.stream.IntStream;

/**
 * {@code StochasticModel} synthesizes ground motions from an evolutionary filter model.
 *
 * <p>The model is a composition: it owns a {@link StatisticsEngine}, which owns an
 * {@link EvolutionaryModel}, which owns a {@link FrequencyTimeGrid}. Each {@link #simulate(int)}
 * call draws {@code n × npts} standard normals from the instance's random stream, builds the
 * spectra of the realizations through {@link FilterEngine}, and inverse-transforms each row on the
 * oversized simulation axis before truncating to {@code npts} samples. Velocity and displacement
 * are obtained by dividing the spectrum by {@code iω} and {@code −ω²}; the zero-frequency bin is
 * dropped.</p>
 *
 * <p>Instances are not thread-safe. Concurrent callers should each work on a {@link #copy()}.</p>
 */
public class StochasticModel {

    private static final Logger log = LoggerFactory.getLogger(StochasticModel.class);

    private final StatisticsEngine statistics;
    private final SimulationOptions options;

    private RandomGenerator rng;
    private Long seed;
    private MotionEnsemble lastSimulation;

    public StochasticModel(int npts, double dt) {
        this(new EvolutionaryModel(new FrequencyTimeGrid(npts, dt)));
    }

    public StochasticModel(int npts, double dt,
                           ShapeFunction mdlFunction,
                           ShapeFunction wuFunction,
                           ShapeFunction zuFunction,
                           ShapeFunction wlFunction,
                           ShapeFunction zlFunction) {
        this(new EvolutionaryModel(new FrequencyTimeGrid(npts, dt),
                mdlFunction, wuFunction, zuFunction, wlFunction, zlFunction));
    }

    public StochasticModel(EvolutionaryModel model) {
        this(new StatisticsEngine(model), SimulationOptions.defaultOptions());
    }

    public StochasticModel(StatisticsEngine statistics, SimulationOptions options) {
        this.statistics = Objects.requireNonNull(statistics, "statistics must not be null");
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.rng = new Well19937c();
    }

    /**
     * Loads a model from a parameter file written by {@link #saveParameters(Path)}.
     */
    public static StochasticModel fromFile(Path path) {
        return new StochasticModel(ModelParametersCodec.load(path));
    }

    public StochasticModel saveParameters(Path path) {
        ModelParametersCodec.save(model(), path);
        return this;
    }

    public StatisticsEngine statistics() {
        return statistics;
    }

    public EvolutionaryModel model() {
        return statistics.model();
    }

    public FrequencyTimeGrid grid() {
        return statistics.grid();
    }

    public SimulationOptions options() {
        return options;
    }

    /** The last assigned seed, or {@code null} if the stream was never seeded. */
    public Long getSeed() {
        return seed;
    }

    /**
     * Replaces the random stream with a new one seeded with {@code seed}. Nothing of the previous
     * stream is kept.
     */
    public void setSeed(long seed) {
        this.seed = seed;
        this.rng = new Well19937c(seed);
    }

    /** Realizations of the most recent {@link #simulate(int)} call, or {@code null}. */
    public MotionEnsemble lastSimulation() {
        return lastSimulation;
    }

    /**
     * Simulates {@code n} realizations of acceleration, velocity and displacement.
     *
     * @param n number of realizations
     * @return ensemble with three {@code n × npts} arrays
     * @throws IllegalArgumentException if {@code n} is not positive
     */
    public MotionEnsemble simulate(int n) {
        if (n <= 0) {
            throw new IllegalArgumentException("Number of simulations must be positive, got " + n);
        }
        FrequencyTimeGrid grid = grid();
        EvolutionaryModel model = model();
        int npts = grid.npts();
        double[] variance = statistics.currentMoments().variance();

        double[][] whiteNoise = new double[n][npts];
        for (int r = 0; r < n; r++) {
            for (int i = 0; i < npts; i++) {
                whiteNoise[r][i] = rng.nextGaussian();
            }
        }

        double[] freqSim = grid.freqSim();
        ComplexSpectrum spectrum = FilterEngine.synthesizeSeries(n, npts, grid.t(), freqSim,
                model.view(FilterQuantity.MDL),
                model.view(FilterQuantity.WU), model.view(FilterQuantity.ZU),
                model.view(FilterQuantity.WL), model.view(FilterQuantity.ZL),
                variance, whiteNoise);

        double[][] ac = new double[n][];
        double[][] vel = new double[n][];
        double[][] disp = new double[n][];
        IntStream rows = IntStream.range(0, n);
        if (options.parallelTransforms()) rows = rows.parallel();
        rows.forEach(r -> {
            double[] re = spectrum.real()[r];
            double[] im = spectrum.imag()[r];
            ac[r] = FourierTransforms.inverseReal(re, im, npts);
            double[][] v = FourierTransforms.integrate(re, im, freqSim, 1);
            vel[r] = FourierTransforms.inverseReal(v[0], v[1], npts);
            double[][] d = FourierTransforms.integrate(re, im, freqSim, 2);
            disp[r] = FourierTransforms.inverseReal(d[0], d[1], npts);
        });

        lastSimulation = new MotionEnsemble(grid.dt(), ac, vel, disp);
        log.info("Simulated {} realization(s) of {} samples (dt={}, seed={})", n, npts, grid.dt(), seed);
        return lastSimulation;
    }

    /**
     * Independent model with the same grid, shape functions and parameters. A seeded model's copy
     * starts a fresh stream from the same seed; an unseeded model's copy draws its own entropy.
     */
    public StochasticModel copy() {
        EvolutionaryModel source = model();
        FrequencyTimeGrid grid = new FrequencyTimeGrid(grid().npts(), grid().dt());
        EvolutionaryModel target = new EvolutionaryModel(grid,
                source.function(FilterQuantity.MDL), source.function(FilterQuantity.WU),
                source.function(FilterQuantity.ZU), source.function(FilterQuantity.WL),
                source.function(FilterQuantity.ZL));
        for (FilterQuantity q : FilterQuantity.values()) {
            FilterParameters p = source.parameters(q);
            if (p != null) target.set(q, p.params());
        }
        StochasticModel copy = new StochasticModel(new StatisticsEngine(target), options);
        if (seed != null) copy.setSeed(seed);
        return copy;
    }
}
