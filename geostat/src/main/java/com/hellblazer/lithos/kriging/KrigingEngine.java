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

import com.hellblazer.lithos.exceptions.ComputationTimeoutException;
import com.hellblazer.lithos.exceptions.GridTooLargeException;
import com.hellblazer.lithos.exceptions.InsufficientDataException;
import com.hellblazer.lithos.exceptions.NumericalInstabilityException;
import com.hellblazer.lithos.exceptions.SingularKrigingSystemException;
import com.hellblazer.lithos.sample.Observations;
import com.hellblazer.lithos.variogram.SpatialStructureModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Kriging over a regular grid. The system is factored once for the observations; each node then costs a single solve.
 * The wall clock budget is checked between nodes, never inside a solve.
 *
 * @author hal.hildebrand
 */
public class KrigingEngine implements Interpolator {
    /** Default wall clock budget for one interpolation */
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(30);

    /** Default node budget */
    public static final long DEFAULT_MAX_NODES = 1_000_000L;

    private static final Logger log = LoggerFactory.getLogger(KrigingEngine.class);

    private final SpatialStructureModel model;
    private final KrigingVariant        variant;
    private final Duration              timeout;
    private final long                  maxNodes;

    public KrigingEngine(SpatialStructureModel model, KrigingVariant variant) {
        this(model, variant, DEFAULT_TIMEOUT, DEFAULT_MAX_NODES);
    }

    public KrigingEngine(SpatialStructureModel model, KrigingVariant variant, Duration timeout, long maxNodes) {
        this.model = Objects.requireNonNull(model, "model cannot be null");
        this.variant = Objects.requireNonNull(variant, "variant cannot be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout cannot be null");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
        if (maxNodes <= 0 || maxNodes > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("maxNodes must be within [1, " + Integer.MAX_VALUE + "]: " + maxNodes);
        }
        this.maxNodes = maxNodes;
    }

    /**
     * Factor the kriging system for the observations
     *
     * @throws InsufficientDataException      if there are fewer observations than drift terms, or none at all
     * @throws SingularKrigingSystemException if the system cannot be factored
     */
    public KrigingSystem factor(Observations observations)
    throws InsufficientDataException, SingularKrigingSystemException {
        Objects.requireNonNull(observations, "observations cannot be null");
        int required = Math.max(1, variant.driftTerms());
        if (observations.size() < required) {
            throw new InsufficientDataException(observations.size(), required);
        }
        return KrigingSystem.factor(observations, model, variant);
    }

    @Override
    public InterpolatedField interpolate(Observations observations, GridDefinition grid)
    throws InsufficientDataException, SingularKrigingSystemException, GridTooLargeException,
           ComputationTimeoutException, NumericalInstabilityException {
        Objects.requireNonNull(grid, "grid cannot be null");
        long total = grid.nodeCount();
        if (total > maxNodes) {
            throw new GridTooLargeException(total, maxNodes);
        }
        long start = System.nanoTime();
        long deadline = start + timeout.toNanos();
        var system = factor(observations);

        int nodes = (int) total;
        var values = new double[nodes];
        var variance = new double[nodes];
        for (int n = 0; n < nodes; n++) {
            if (System.nanoTime() > deadline) {
                throw new ComputationTimeoutException(timeout, n, total);
            }
            var p = grid.point(n);
            var estimate = system.estimate(p.x, p.y, p.z);
            if (!Double.isFinite(estimate.value()) || !Double.isFinite(estimate.variance())) {
                throw new NumericalInstabilityException(
                "Non-finite " + variant.key() + " kriging estimate at node " + n + " (" + p.x + ", " + p.y + ", " + p.z
                + ")");
            }
            values[n] = estimate.value();
            variance[n] = estimate.variance();
        }
        log.debug("Kriged {} nodes from {} observations ({}) in {} ms", nodes, observations.size(), variant.key(),
                  Duration.ofNanos(System.nanoTime() - start).toMillis());
        return new InterpolatedField(grid, values, variance, method());
    }

    @Override
    public InterpolationMethod method() {
        return InterpolationMethod.of(variant);
    }

    public SpatialStructureModel model() {
        return model;
    }

    public KrigingVariant variant() {
        return variant;
    }
}
