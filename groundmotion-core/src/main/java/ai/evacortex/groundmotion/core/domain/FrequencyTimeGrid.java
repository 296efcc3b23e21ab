/*
 * GroundMotion — Stochastic Ground-Motion Simulator
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.groundmotion.core.domain;

import ai.evacortex.groundmotion.core.exceptions.InvalidGridException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@code FrequencyTimeGrid} owns the sampling of a record ({@code npts}, {@code dt}) and the axes
 * derived from it.
 *
 * <p>Derived arrays are computed on first read and cached behind a dirty flag. Assigning a new
 * {@code npts} or {@code dt} marks every cached array stale and notifies the registered
 * {@link GridListener}s, which is how the owning model learns that its time axis moved. Listeners
 * may veto a change in {@link GridListener#beforeGridChange}; a vetoed assignment leaves the grid
 * untouched.</p>
 *
 * <p>Axes:</p>
 * <ul>
 *     <li>{@code t}: {@code npts} samples, {@code t[i] = i·dt}</li>
 *     <li>{@code freq}: {@code npts} angular frequencies with step {@code π/(npts·dt)},
 *     covering {@code [0, ω_Nyquist)}</li>
 *     <li>{@code freqSim}: {@code nextPowerOfTwo(2·npts)} angular frequencies with step
 *     {@code π/(nsim·dt)}; the one-sided bins of a real inverse transform of size {@code 2·nsim}</li>
 * </ul>
 *
 * <p>Array accessors return copies. {@code npts} is capped at {@link #MAX_NPTS} so that the
 * inverse transform of size {@code 2·nsim} still fits an {@code int}.</p>
 *
 * <p>Instances are not thread-safe.</p>
 */
public class FrequencyTimeGrid {

    private static final Logger log = LoggerFactory.getLogger(FrequencyTimeGrid.class);

    /** Largest accepted {@code npts}. */
    public static final int MAX_NPTS = 1 << 28;

    private static final double[] DEFAULT_BAND_HZ =
            parseRange(System.getProperty("groundmotion.freq.band", "0.1,25.0"), 2);
    private static final double[] DEFAULT_PERIOD_RANGE =
            parseRange(System.getProperty("groundmotion.period.range", "0.04,10.04,0.01"), 3);

    /**
     * Receives a notification after {@code npts} or {@code dt} changed.
     */
    @FunctionalInterface
    public interface GridListener {
        void onGridChanged(FrequencyTimeGrid grid);

        /**
         * Called before {@code npts} or {@code dt} is assigned. Throwing rejects the change; the grid
         * keeps its current sampling and no listener is notified.
         *
         * @param grid the grid about to change, still holding the current sampling
         * @param npts candidate number of samples
         * @param dt   candidate sampling interval
         */
        default void beforeGridChange(FrequencyTimeGrid grid, int npts, double dt) {
        }
    }

    private int npts;
    private double dt;

    private double bandLowHz = DEFAULT_BAND_HZ[0];
    private double bandHighHz = DEFAULT_BAND_HZ[1];
    private double periodStart = DEFAULT_PERIOD_RANGE[0];
    private double periodStop = DEFAULT_PERIOD_RANGE[1];
    private double periodStep = DEFAULT_PERIOD_RANGE[2];

    private boolean dirty = true;
    private double[] t;
    private double[] freq;
    private double[] freqSim;
    private double[] freqSimP2;
    private double[] freqP2;
    private double[] freqP4;
    private double[] freqN2;
    private double[] freqN4;
    private boolean[] freqMask;
    private double[] tp;

    private final List<GridListener> listeners = new CopyOnWriteArrayList<>();

    public FrequencyTimeGrid(int npts, double dt) {
        this.npts = requireValidNpts(npts);
        this.dt = requireValidDt(dt);
    }

    public int npts() {
        return npts;
    }

    public double dt() {
        return dt;
    }

    public void setNpts(int npts) {
        int candidate = requireValidNpts(npts);
        vet(candidate, dt);
        this.npts = candidate;
        invalidate();
    }

    public void setDt(double dt) {
        double candidate = requireValidDt(dt);
        vet(npts, candidate);
        this.dt = candidate;
        invalidate();
    }

    public void addListener(GridListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    public void removeListener(GridListener listener) {
        listeners.remove(listener);
    }

    public double[] t() {
        ensureCurrent();
        return t.clone();
    }

    public double[] freq() {
        ensureCurrent();
        return freq.clone();
    }

    public double[] freqSim() {
        ensureCurrent();
        return freqSim.clone();
    }

    public double[] freqSimP2() {
        ensureCurrent();
        if (freqSimP2 == null) freqSimP2 = power(freqSim, 2, 0);
        return freqSimP2.clone();
    }

    public double[] freqP2() {
        ensureCurrent();
        if (freqP2 == null) freqP2 = power(freq, 2, 0);
        return freqP2.clone();
    }

    public double[] freqP4() {
        ensureCurrent();
        if (freqP4 == null) freqP4 = power(freq, 4, 0);
        return freqP4.clone();
    }

    /** {@code freq[1:]⁻²}; the zero bin is excluded. */
    public double[] freqN2() {
        ensureCurrent();
        if (freqN2 == null) freqN2 = power(freq, -2, 1);
        return freqN2.clone();
    }

    /** {@code freq[1:]⁻⁴}; the zero bin is excluded. */
    public double[] freqN4() {
        ensureCurrent();
        if (freqN4 == null) freqN4 = power(freq, -4, 1);
        return freqN4.clone();
    }

    /** Frequency step of {@link #freq()} in rad/s. */
    public double freqStep() {
        return Math.PI / (npts * dt);
    }

    /** Number of one-sided simulation bins: the smallest power of two not less than {@code 2·npts}. */
    public int simulationLength() {
        return nextPowerOfTwo(2 * npts);
    }

    public boolean[] freqMask() {
        ensureCurrent();
        if (freqMask == null) {
            double lo = 2 * Math.PI * bandLowHz;
            double hi = 2 * Math.PI * bandHighHz;
            freqMask = new boolean[freq.length];
            for (int i = 0; i < freq.length; i++) {
                freqMask[i] = freq[i] >= lo && freq[i] <= hi;
            }
        }
        return freqMask.clone();
    }

    /**
     * Sets the pass band of {@link #freqMask()}.
     *
     * @param lowHz  lower edge in Hz, inclusive
     * @param highHz upper edge in Hz, inclusive
     */
    public void setFreqMask(double lowHz, double highHz) {
        if (!(lowHz >= 0.0) || !(highHz > lowHz) || Double.isInfinite(highHz)) {
            throw new InvalidGridException("frequency band must satisfy 0 <= low < high, got ("
                    + lowHz + ", " + highHz + ")");
        }
        this.bandLowHz = lowHz;
        this.bandHighHz = highHz;
        this.freqMask = null;
    }

    public double[] tp() {
        if (tp == null) {
            // stop is exclusive; absorb rounding in the quotient
            int count = (int) Math.ceil((periodStop - periodStart) / periodStep - 1e-9);
            tp = new double[count];
            for (int i = 0; i < count; i++) {
                tp[i] = periodStart + i * periodStep;
            }
        }
        return tp.clone();
    }

    /**
     * Sets the period axis used for response spectra, {@code arange(start, stop, step)}.
     */
    public void setTp(double start, double stop, double step) {
        if (!(start >= 0.0) || !(stop > start) || !(step > 0.0) || Double.isInfinite(stop)) {
            throw new InvalidGridException("period range must satisfy 0 <= start < stop and step > 0, got ("
                    + start + ", " + stop + ", " + step + ")");
        }
        this.periodStart = start;
        this.periodStop = stop;
        this.periodStep = step;
        this.tp = null;
    }

    /** {@code npts} samples starting at 0 and spaced {@code dt} apart. */
    public static double[] timeAxis(int npts, double dt) {
        return uniformAxis(npts, dt);
    }

    public static int nextPowerOfTwo(int n) {
        if (n <= 1) return 1;
        int p = Integer.highestOneBit(n - 1) << 1;
        if (p <= 0) {
            throw new InvalidGridException("no power of two >= " + n + " fits in an int");
        }
        return p;
    }

    private void vet(int candidateNpts, double candidateDt) {
        for (GridListener listener : listeners) {
            listener.beforeGridChange(this, candidateNpts, candidateDt);
        }
    }

    private void invalidate() {
        dirty = true;
        freqMask = null;
        log.debug("Grid changed to npts={}, dt={}; derived axes invalidated", npts, dt);
        for (GridListener listener : listeners) {
            listener.onGridChanged(this);
        }
    }

    private void ensureCurrent() {
        if (!dirty) return;
        t = uniformAxis(npts, dt);
        freq = uniformAxis(npts, freqStep());
        int nsim = simulationLength();
        freqSim = uniformAxis(nsim, Math.PI / (nsim * dt));
        freqSimP2 = null;
        freqP2 = null;
        freqP4 = null;
        freqN2 = null;
        freqN4 = null;
        freqMask = null;
        dirty = false;
    }

    private static double[] uniformAxis(int length, double step) {
        double[] axis = new double[length];
        for (int i = 0; i < length; i++) {
            axis[i] = i * step;
        }
        return axis;
    }

    private static double[] power(double[] axis, int exponent, int from) {
        double[] out = new double[axis.length - from];
        for (int i = from; i < axis.length; i++) {
            out[i - from] = Math.pow(axis[i], exponent);
        }
        return out;
    }

    private static int requireValidNpts(int npts) {
        if (npts <= 0) {
            throw new InvalidGridException("npts must be positive, got " + npts);
        }
        if (npts > MAX_NPTS) {
            throw new InvalidGridException("npts must not exceed " + MAX_NPTS + ", got " + npts);
        }
        return npts;
    }

    private static double requireValidDt(double dt) {
        if (!(dt > 0.0) || Double.isInfinite(dt)) {
            throw new InvalidGridException("dt must be positive and finite, got " + dt);
        }
        return dt;
    }

    private static double[] parseRange(String value, int expected) {
        String[] parts = value.split(",");
        if (parts.length != expected) {
            throw new InvalidGridException("expected " + expected + " comma-separated values, got '" + value + "'");
        }
        double[] out = new double[expected];
        for (int i = 0; i < expected; i++) {
            out[i] = Double.parseDouble(parts[i].trim());
        }
        return out;
    }

    @Override
    public String toString() {
        return "FrequencyTimeGrid[npts=" + npts + ", dt=" + dt + "]";
    }
}
