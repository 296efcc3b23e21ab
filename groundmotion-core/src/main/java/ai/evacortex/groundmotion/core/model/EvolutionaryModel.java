/*
 * GroundMotion — Stochastic Ground-Motion Simulator
 * Copyright © 2025 Aleksandr Listopad
 * SPDX-License-Identifier: Prosperity-3.0
 *
 * Patent notice: The authors intend to seek patent protection for this software.
 * Commercial use >30 days → license@evacortex.ai
 */
package ai.evacortex.groundmotion.core.model;

import ai.evacortex.groundmotion.core.domain.FrequencyTimeGrid;
import ai.evacortex.groundmotion.core.exceptions.ShapeFunctionException;
import ai.evacortex.groundmotion.core.function.ShapeFunction;
import ai.evacortex.groundmotion.core.function.ShapeFunctionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@code EvolutionaryModel} holds the five time-varying quantities of the evolutionary filter
 * model: the modulating function {@code mdl}, the upper/lower filter frequencies {@code wu},
 * {@code wl} (rad/s) and damping ratios {@code zu}, {@code zl}.
 *
 * <p>Each quantity is produced by one {@link ShapeFunction} evaluated over the grid's time axis.
 * Assigning a quantity replaces only that series and notifies every {@link ModelListener}; a
 * failed evaluation leaves the previous series and parameters in place. Series are all zeros
 * until assigned.</p>
 *
 * <p>The model listens to its {@link FrequencyTimeGrid}: a new {@code npts} or {@code dt} is first
 * checked against every assigned quantity and rejected if any of them cannot be evaluated on the
 * new time axis; an accepted change re-evaluates every assigned quantity.</p>
 */
public class EvolutionaryModel {

    private static final Logger log = LoggerFactory.getLogger(EvolutionaryModel.class);

    /**
     * Receives a notification after the model changed.
     */
    @FunctionalInterface
    public interface ModelListener {
        /**
         * @param model    the model that changed
         * @param quantity the reassigned quantity, or {@code null} when the time axis changed
         */
        void onModelChanged(EvolutionaryModel model, FilterQuantity quantity);
    }

    private final FrequencyTimeGrid grid;
    private final Map<FilterQuantity, ShapeFunction> functions = new EnumMap<>(FilterQuantity.class);
    private final Map<FilterQuantity, double[]> series = new EnumMap<>(FilterQuantity.class);
    private final Map<FilterQuantity, FilterParameters> parameters = new EnumMap<>(FilterQuantity.class);
    private final List<ModelListener> listeners = new CopyOnWriteArrayList<>();

    public EvolutionaryModel(FrequencyTimeGrid grid) {
        this(grid, ShapeFunction.BETA_SINGLE, ShapeFunction.LINEAR, ShapeFunction.LINEAR,
                ShapeFunction.LINEAR, ShapeFunction.LINEAR);
    }

    public EvolutionaryModel(FrequencyTimeGrid grid,
                             ShapeFunction mdlFunction,
                             ShapeFunction wuFunction,
                             ShapeFunction zuFunction,
                             ShapeFunction wlFunction,
                             ShapeFunction zlFunction) {
        this.grid = Objects.requireNonNull(grid, "grid must not be null");
        functions.put(FilterQuantity.MDL, Objects.requireNonNull(mdlFunction, "mdl function must not be null"));
        functions.put(FilterQuantity.WU, Objects.requireNonNull(wuFunction, "wu function must not be null"));
        functions.put(FilterQuantity.ZU, Objects.requireNonNull(zuFunction, "zu function must not be null"));
        functions.put(FilterQuantity.WL, Objects.requireNonNull(wlFunction, "wl function must not be null"));
        functions.put(FilterQuantity.ZL, Objects.requireNonNull(zlFunction, "zl function must not be null"));
        for (FilterQuantity q : FilterQuantity.values()) {
            series.put(q, new double[grid.npts()]);
        }
        grid.addListener(new FrequencyTimeGrid.GridListener() {
            @Override
            public void beforeGridChange(FrequencyTimeGrid changing, int npts, double dt) {
                requireFits(npts, dt);
            }

            @Override
            public void onGridChanged(FrequencyTimeGrid changed) {
                reevaluate(changed);
            }
        });
    }

    public FrequencyTimeGrid grid() {
        return grid;
    }

    public void addListener(ModelListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    public void removeListener(ModelListener listener) {
        listeners.remove(listener);
    }

    public ShapeFunction function(FilterQuantity quantity) {
        return functions.get(quantity);
    }

    /**
     * Evaluates the quantity's shape function over the time axis and stores the result.
     *
     * @throws ShapeFunctionException if the parameters do not fit the assigned function
     */
    public void set(FilterQuantity quantity, double... params) {
        Objects.requireNonNull(quantity, "quantity must not be null");
        ShapeFunction fn = functions.get(quantity);
        double[] values = evaluate(quantity, fn, params, grid.t());
        series.put(quantity, values);
        parameters.put(quantity, new FilterParameters(fn, params.clone(), fn.parameterNames()));
        log.debug("Assigned {} = {}{}", quantity.key(), fn.functionName(), fn.parameterNames());
        fireChanged(quantity);
    }

    public void setMdl(double... params) {
        set(FilterQuantity.MDL, params);
    }

    public void setWu(double... params) {
        set(FilterQuantity.WU, params);
    }

    public void setZu(double... params) {
        set(FilterQuantity.ZU, params);
    }

    public void setWl(double... params) {
        set(FilterQuantity.WL, params);
    }

    public void setZl(double... params) {
        set(FilterQuantity.ZL, params);
    }

    /** Copy of the stored series. */
    public double[] get(FilterQuantity quantity) {
        return series.get(quantity).clone();
    }

    public double[] mdl() {
        return get(FilterQuantity.MDL);
    }

    public double[] wu() {
        return get(FilterQuantity.WU);
    }

    public double[] zu() {
        return get(FilterQuantity.ZU);
    }

    public double[] wl() {
        return get(FilterQuantity.WL);
    }

    public double[] zl() {
        return get(FilterQuantity.ZL);
    }

    /** Stored series without copying; callers in this package must not modify it. */
    double[] view(FilterQuantity quantity) {
        return series.get(quantity);
    }

    /**
     * @return the raw parameters of the quantity, or {@code null} if it was never assigned
     */
    public FilterParameters parameters(FilterQuantity quantity) {
        FilterParameters p = parameters.get(quantity);
        return p == null ? null : new FilterParameters(p.function(), p.params().clone(), p.names());
    }

    public boolean isAssigned(FilterQuantity quantity) {
        return parameters.containsKey(quantity);
    }

    public boolean isFullyAssigned() {
        return parameters.size() == FilterQuantity.values().length;
    }

    private static double[] evaluate(FilterQuantity quantity, ShapeFunction fn, double[] params, double[] t) {
        ShapeFunctionResult result = fn.evaluate(t, params);
        double[] values = result.series();
        if (quantity.isAngular()) {
            for (int i = 0; i < values.length; i++) {
                values[i] *= 2 * Math.PI;
            }
        }
        return values;
    }

    private void requireFits(int npts, double dt) {
        double[] t = FrequencyTimeGrid.timeAxis(npts, dt);
        List<String> failures = new ArrayList<>();
        for (Map.Entry<FilterQuantity, FilterParameters> e : parameters.entrySet()) {
            FilterParameters p = e.getValue();
            try {
                p.function().evaluate(t, p.params());
            } catch (ShapeFunctionException ex) {
                failures.add(e.getKey().key() + " (" + ex.getMessage() + ")");
            }
        }
        if (!failures.isEmpty()) {
            log.warn("Rejected grid change to npts={}, dt={}: {}", npts, dt, failures);
            throw new ShapeFunctionException("quantities " + failures
                    + " do not fit a time axis of npts=" + npts + ", dt=" + dt);
        }
    }

    private void reevaluate(FrequencyTimeGrid changed) {
        double[] t = changed.t();
        for (FilterQuantity q : FilterQuantity.values()) {
            FilterParameters p = parameters.get(q);
            series.put(q, p == null
                    ? new double[changed.npts()]
                    : evaluate(q, p.function(), p.params(), t));
        }
        fireChanged(null);
    }

    private void fireChanged(FilterQuantity quantity) {
        for (ModelListener listener : listeners) {
            listener.onModelChanged(this, quantity);
        }
    }
}
