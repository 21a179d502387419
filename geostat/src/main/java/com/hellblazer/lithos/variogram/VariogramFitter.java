/**
 * Copyright (C) 2026 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Lithos.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.lithos.variogram;

import com.hellblazer.lithos.recovery.ErrorContext;
import com.hellblazer.lithos.recovery.ErrorKind;
import org.apache.commons.math3.analysis.ParametricUnivariateFunction;
import org.apache.commons.math3.exception.MathArithmeticException;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.fitting.SimpleCurveFitter;
import org.apache.commons.math3.fitting.WeightedObservedPoints;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Fits a {@link SpatialStructureModel} to an empirical variogram by Levenberg-Marquardt least squares, weighting each
 * bin by its pair count. The optimizer works on the square roots of range, partial sill and nugget so that every
 * candidate it visits is non-negative.
 *
 * <p>A fit that does not converge, yields non-finite or non-physical parameters, or has fewer than 3 bins to work with
 * falls back to heuristic defaults: range = largest lag / 3, sill = variance of the binned semivariances, nugget = 0.
 * Fallbacks are reported through a WARNING {@link ErrorContext}; fit failures never propagate to the caller.
 *
 * @author hal.hildebrand
 */
public class VariogramFitter {
    /** Minimum bins for a least squares fit */
    public static final int MIN_FIT_BINS = 3;

    /** Default optimizer iteration budget */
    public static final int DEFAULT_MAX_ITERATIONS = 500;

    private static final Logger log = LoggerFactory.getLogger(VariogramFitter.class);

    private final int maxIterations;

    public VariogramFitter() {
        this(DEFAULT_MAX_ITERATIONS);
    }

    public VariogramFitter(int maxIterations) {
        if (maxIterations <= 0) {
            throw new IllegalArgumentException("maxIterations must be positive: " + maxIterations);
        }
        this.maxIterations = maxIterations;
    }

    /**
     * Heuristic model from the empirical variogram alone. When the semivariances have no spread, e.g. a single bin,
     * their mean is used as the sill instead of their variance.
     */
    public static SpatialStructureModel heuristic(EmpiricalVariogram empirical, VariogramKind kind, int dimension) {
        double range = empirical.maxLagCenter() / 3.0;
        if (!(range > 0)) {
            range = empirical.maxLag() > 0 ? empirical.maxLag() / 3.0 : 1.0;
        }
        var gamma = empirical.gamma();
        double sill = gamma.length >= 2 ? populationVariance(gamma) : Double.NaN;
        if (!(sill > 0) || !Double.isFinite(sill)) {
            sill = mean(gamma);
        }
        if (!(sill >= 0) || !Double.isFinite(sill)) {
            sill = 0;
        }
        return new SpatialStructureModel(kind, range, sill, 0.0, dimension);
    }

    private static double mean(double[] values) {
        if (values.length == 0) {
            return Double.NaN;
        }
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    private static double populationVariance(double[] values) {
        double mean = mean(values);
        double sum = 0;
        for (double v : values) {
            sum += (v - mean) * (v - mean);
        }
        return sum / values.length;
    }

    /**
     * Fit, or fall back to the heuristic without attempting optimization when {@code autoFit} is false
     */
    public VariogramFit fit(EmpiricalVariogram empirical, VariogramKind kind, int dimension, boolean autoFit) {
        Objects.requireNonNull(empirical, "empirical cannot be null");
        Objects.requireNonNull(kind, "kind cannot be null");
        if (!autoFit) {
            var model = heuristic(empirical, kind, dimension);
            log.debug("Automatic fitting disabled, using heuristic {}", model);
            return new VariogramFit(model, FitQuality.HEURISTIC_FALLBACK, Optional.empty());
        }
        if (empirical.binCount() < MIN_FIT_BINS) {
            return fallback(empirical, kind, dimension,
                            "Only " + empirical.binCount() + " populated lag bins, at least " + MIN_FIT_BINS
                            + " are needed to fit");
        }
        double[] fitted;
        try {
            fitted = optimize(empirical, kind);
        } catch (MathIllegalStateException | MathIllegalArgumentException | MathArithmeticException e) {
            return fallback(empirical, kind, dimension, "Least squares fit failed: " + e.getMessage());
        }
        double range = fitted[0] * fitted[0];
        double partialSill = fitted[1] * fitted[1];
        double nugget = fitted[2] * fitted[2];
        if (!Double.isFinite(range) || !Double.isFinite(partialSill) || !Double.isFinite(nugget) || !(range > 0)) {
            return fallback(empirical, kind, dimension,
                            "Fit produced non-physical parameters: range=" + range + ", partial sill=" + partialSill
                            + ", nugget=" + nugget);
        }
        var model = new SpatialStructureModel(kind, range, nugget + partialSill, nugget, dimension);
        log.debug("Fitted {} variogram: range={}, sill={}, nugget={}", kind.key(), model.range(), model.sill(),
                  model.nugget());
        return new VariogramFit(model, FitQuality.AUTO_FITTED, Optional.empty());
    }

    /**
     * Fit with automatic fitting enabled
     */
    public VariogramFit fit(EmpiricalVariogram empirical, VariogramKind kind, int dimension) {
        return fit(empirical, kind, dimension, true);
    }

    private VariogramFit fallback(EmpiricalVariogram empirical, VariogramKind kind, int dimension, String reason) {
        var model = heuristic(empirical, kind, dimension);
        Map<String, Object> parameters = Map.of("range", model.range(), "sill", model.sill(), "nugget",
                                                model.nugget());
        var warning = ErrorContext.of(ErrorKind.VARIOGRAM_FIT_FAILURE,
                                      "Variogram fitting failed; using heuristic " + kind.key() + " model",
                                      "Add samples or choose a different variogram model", reason, "variogram")
                                  .withRecovery(parameters, true);
        warning.log(log);
        return new VariogramFit(model, FitQuality.HEURISTIC_FALLBACK, Optional.of(warning));
    }

    private double[] optimize(EmpiricalVariogram empirical, VariogramKind kind) {
        var lags = empirical.lagCenters();
        var gamma = empirical.gamma();
        var pairs = empirical.pairCounts();
        var scale = empirical.maxLagCenter();

        var points = new WeightedObservedPoints();
        double maxGamma = 0, minGamma = Double.POSITIVE_INFINITY;
        for (int i = 0; i < lags.length; i++) {
            points.add(pairs[i], lags[i], gamma[i]);
            maxGamma = Math.max(maxGamma, gamma[i]);
            minGamma = Math.min(minGamma, gamma[i]);
        }
        var start = new double[] { Math.sqrt(scale / 2), Math.sqrt(Math.max(maxGamma - 0.5 * minGamma, 0)),
                                   Math.sqrt(Math.max(0.5 * minGamma, 0)) };
        var model = new SquaredParameterModel(kind, scale);
        var fitter = SimpleCurveFitter.create(model, start).withMaxIterations(maxIterations);
        return fitter.fit(points.toList());
    }

    /**
     * Semivariance as a function of the square roots of (range, partial sill, nugget)
     */
    private static class SquaredParameterModel implements ParametricUnivariateFunction {
        private final VariogramKind kind;
        private final double        minRange;

        private SquaredParameterModel(VariogramKind kind, double scale) {
            this.kind = kind;
            this.minRange = Math.max(scale, 1.0) * 1e-12;
        }

        @Override
        public double[] gradient(double h, double... p) {
            var gradient = new double[p.length];
            for (int i = 0; i < p.length; i++) {
                double step = 1e-7 * Math.max(Math.abs(p[i]), 1e-3);
                var plus = p.clone();
                var minus = p.clone();
                plus[i] += step;
                minus[i] -= step;
                gradient[i] = (value(h, plus) - value(h, minus)) / (2 * step);
            }
            return gradient;
        }

        @Override
        public double value(double h, double... p) {
            double range = Math.max(p[0] * p[0], minRange);
            return p[2] * p[2] + p[1] * p[1] * kind.structure(h / range);
        }
    }
}
