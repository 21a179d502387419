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
package com.hellblazer.lithos.kriging;

import com.hellblazer.lithos.exceptions.SingularKrigingSystemException;
import com.hellblazer.lithos.sample.Observations;
import com.hellblazer.lithos.variogram.SpatialStructureModel;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RRQRDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

import java.util.Objects;

/**
 * The factored kriging system for one set of observations and one model. The left hand side depends only on the
 * observations, so it is LU factored once and every estimate costs one back substitution.
 *
 * <p>The system has the block form
 * <pre>
 * | C   F | | w  |   | c0 |
 * | F'  0 | | mu | = | f0 |
 * </pre>
 * where {@code C} holds the covariances between observations, {@code F} the drift functions evaluated at the
 * observations (a column of ones for ordinary kriging; 1, x, y for universal kriging; nothing for simple kriging),
 * {@code c0} the covariances between the target and the observations and {@code f0} the drift at the target. The
 * kriging variance is {@code C(0) - w.c0 - mu.f0}, clipped at zero. Systems that pass the pivot test but whose
 * estimated condition number exceeds {@link #MAX_CONDITION_NUMBER} are rejected as singular.
 *
 * @author hal.hildebrand
 */
public final class KrigingSystem {
    /** Pivots smaller than this fraction of the largest matrix entry are treated as singular */
    public static final double SINGULARITY_THRESHOLD = 1e-12;

    /** Systems whose estimated 1-norm condition number exceeds this are treated as singular */
    public static final double MAX_CONDITION_NUMBER = 1e10;

    /** Singular values of the scaled drift matrix below this are treated as rank deficient */
    public static final double DRIFT_RANK_THRESHOLD = 1e-9;

    private final Observations          observations;
    private final SpatialStructureModel model;
    private final KrigingVariant        variant;
    private final DecompositionSolver   solver;
    private final double                mean;
    private final double                centerX;
    private final double                centerY;
    private final double                driftScale;

    private KrigingSystem(Observations observations, SpatialStructureModel model, KrigingVariant variant,
                          DecompositionSolver solver, double centerX, double centerY, double driftScale) {
        this.observations = observations;
        this.model = model;
        this.variant = variant;
        this.solver = solver;
        this.mean = observations.mean();
        this.centerX = centerX;
        this.centerY = centerY;
        this.driftScale = driftScale;
    }

    /**
     * Assemble and factor the system.
     *
     * @throws SingularKrigingSystemException if the drift terms are linearly dependent over the observations, or the
     *                                        system matrix is singular or ill-conditioned
     */
    public static KrigingSystem factor(Observations observations, SpatialStructureModel model, KrigingVariant variant)
    throws SingularKrigingSystemException {
        Objects.requireNonNull(observations, "observations cannot be null");
        Objects.requireNonNull(model, "model cannot be null");
        Objects.requireNonNull(variant, "variant cannot be null");
        int n = observations.size();
        int drift = variant.driftTerms();
        int size = n + drift;

        double cx = 0, cy = 0;
        for (int i = 0; i < n; i++) {
            cx += observations.x(i);
            cy += observations.y(i);
        }
        cx = n > 0 ? cx / n : 0;
        cy = n > 0 ? cy / n : 0;
        double scale = 0;
        for (int i = 0; i < n; i++) {
            scale = Math.max(scale, Math.max(Math.abs(observations.x(i) - cx), Math.abs(observations.y(i) - cy)));
        }
        scale = scale > 0 ? scale : 1;

        if (variant == KrigingVariant.UNIVERSAL) {
            checkDrift(observations, cx, cy, scale);
        }

        var matrix = new Array2DRowRealMatrix(size, size);
        double largest = 0;
        for (int i = 0; i < n; i++) {
            for (int j = i; j < n; j++) {
                double c = model.covariance(observations.distance(i, j));
                matrix.setEntry(i, j, c);
                matrix.setEntry(j, i, c);
                largest = Math.max(largest, Math.abs(c));
            }
            for (int k = 0; k < drift; k++) {
                double f = driftTerm(k, observations.x(i), observations.y(i), cx, cy, scale);
                matrix.setEntry(i, n + k, f);
                matrix.setEntry(n + k, i, f);
                largest = Math.max(largest, Math.abs(f));
            }
        }
        if (!(largest > 0)) {
            throw new SingularKrigingSystemException("Kriging system is identically zero; the model has no sill",
                                                     false);
        }
        var lu = new LUDecomposition(matrix, SINGULARITY_THRESHOLD * largest);
        var solver = lu.getSolver();
        if (!solver.isNonSingular()) {
            throw new SingularKrigingSystemException(
            "Singular " + variant.key() + " kriging system for " + n + " observations; coincident samples or a zero"
            + " nugget with duplicated values", false);
        }
        double condition = conditionEstimate(matrix, solver);
        if (!(condition <= MAX_CONDITION_NUMBER)) {
            throw new SingularKrigingSystemException(
            "Ill-conditioned " + variant.key() + " kriging system for " + n + " observations (condition estimate "
            + condition + "); nearly coincident samples with a smooth, nugget free model", false);
        }
        return new KrigingSystem(observations, model, variant, solver, cx, cy, scale);
    }

    /**
     * Hager's estimate of the 1-norm condition number, using the existing factorization. The system matrix is
     * symmetric, so solves with its transpose reuse the same solver. Non-finite intermediate results yield infinity.
     */
    static double conditionEstimate(RealMatrix matrix, DecompositionSolver solver) {
        int size = matrix.getRowDimension();
        RealVector x = new ArrayRealVector(size, 1.0 / size);
        double inverseNorm = 0;
        for (int iteration = 0; iteration < 5; iteration++) {
            var y = solver.solve(x);
            inverseNorm = Math.max(inverseNorm, y.getL1Norm());
            if (!Double.isFinite(inverseNorm)) {
                return Double.POSITIVE_INFINITY;
            }
            var signs = y.map(v -> v >= 0 ? 1.0 : -1.0);
            var z = solver.solve(signs);
            int j = 0;
            for (int i = 1; i < size; i++) {
                if (Math.abs(z.getEntry(i)) > Math.abs(z.getEntry(j))) {
                    j = i;
                }
            }
            if (Math.abs(z.getEntry(j)) <= z.dotProduct(x)) {
                break;
            }
            x = new ArrayRealVector(size);
            x.setEntry(j, 1.0);
        }
        return matrix.getNorm() * inverseNorm;
    }

    private static void checkDrift(Observations observations, double cx, double cy, double scale)
    throws SingularKrigingSystemException {
        int n = observations.size();
        if (n < 3) {
            throw new SingularKrigingSystemException(
            "Universal kriging needs at least 3 observations for a linear drift, got " + n, true);
        }
        var drift = new Array2DRowRealMatrix(n, 3);
        for (int i = 0; i < n; i++) {
            for (int k = 0; k < 3; k++) {
                drift.setEntry(i, k, driftTerm(k, observations.x(i), observations.y(i), cx, cy, scale));
            }
        }
        int rank = new RRQRDecomposition(drift).getRank(DRIFT_RANK_THRESHOLD);
        if (rank < 3) {
            throw new SingularKrigingSystemException(
            "Linear drift is degenerate: observations are colinear (drift rank " + rank + ")", true);
        }
    }

    private static double driftTerm(int k, double x, double y, double cx, double cy, double scale) {
        return switch (k) {
            case 0 -> 1.0;
            case 1 -> (x - cx) / scale;
            case 2 -> (y - cy) / scale;
            default -> throw new IllegalArgumentException("Unknown drift term: " + k);
        };
    }

    /**
     * Estimate value and kriging variance at a location. The variance is clipped at zero; the value may be
     * non-finite if the system is numerically unstable, which callers must check.
     */
    public Estimate estimate(double x, double y, double z) {
        int n = observations.size();
        int drift = variant.driftTerms();
        var rhs = new ArrayRealVector(n + drift);
        for (int i = 0; i < n; i++) {
            rhs.setEntry(i, model.covariance(observations.distanceTo(i, x, y, z)));
        }
        for (int k = 0; k < drift; k++) {
            rhs.setEntry(n + k, driftTerm(k, x, y, centerX, centerY, driftScale));
        }
        var solution = solver.solve(rhs);

        double value = variant == KrigingVariant.SIMPLE ? mean : 0;
        double variance = model.covariance(0);
        for (int i = 0; i < n; i++) {
            double w = solution.getEntry(i);
            value += variant == KrigingVariant.SIMPLE ? w * (observations.value(i) - mean) : w * observations.value(i);
            variance -= w * rhs.getEntry(i);
        }
        for (int k = 0; k < drift; k++) {
            variance -= solution.getEntry(n + k) * rhs.getEntry(n + k);
        }
        return new Estimate(value, Math.max(0, variance));
    }

    public SpatialStructureModel model() {
        return model;
    }

    public int size() {
        return observations.size();
    }

    public KrigingVariant variant() {
        return variant;
    }
}
