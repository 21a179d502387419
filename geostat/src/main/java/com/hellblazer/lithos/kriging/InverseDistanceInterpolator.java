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

import com.hellblazer.lithos.exceptions.GridTooLargeException;
import com.hellblazer.lithos.exceptions.InsufficientDataException;
import com.hellblazer.lithos.sample.Observations;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Inverse distance weighted interpolation, the substitute method when kriging cannot complete. It needs no linear
 * solve and cannot be singular. Nodes that coincide with an observation take its value exactly. The reported variance
 * is the weighted spread of the observations about the estimate, a heuristic rather than a kriging variance.
 *
 * @author hal.hildebrand
 */
public class InverseDistanceInterpolator implements Interpolator {
    public static final double DEFAULT_POWER = 2.0;

    private static final Logger log = LoggerFactory.getLogger(InverseDistanceInterpolator.class);

    private final double power;
    private final long   maxNodes;

    public InverseDistanceInterpolator() {
        this(DEFAULT_POWER, KrigingEngine.DEFAULT_MAX_NODES);
    }

    public InverseDistanceInterpolator(double power, long maxNodes) {
        if (!(power > 0)) {
            throw new IllegalArgumentException("power must be positive: " + power);
        }
        if (maxNodes <= 0 || maxNodes > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("maxNodes must be within [1, " + Integer.MAX_VALUE + "]: " + maxNodes);
        }
        this.power = power;
        this.maxNodes = maxNodes;
    }

    public Estimate estimate(Observations observations, double x, double y, double z) {
        int n = observations.size();
        double weightSum = 0, weighted = 0;
        var weights = new double[n];
        for (int i = 0; i < n; i++) {
            double d = observations.distanceTo(i, x, y, z);
            if (d == 0) {
                return new Estimate(observations.value(i), 0);
            }
            weights[i] = 1.0 / Math.pow(d, power);
            weightSum += weights[i];
            weighted += weights[i] * observations.value(i);
        }
        double value = weighted / weightSum;
        double spread = 0;
        for (int i = 0; i < n; i++) {
            double r = observations.value(i) - value;
            spread += weights[i] / weightSum * r * r;
        }
        return new Estimate(value, spread);
    }

    @Override
    public InterpolatedField interpolate(Observations observations, GridDefinition grid)
    throws InsufficientDataException, GridTooLargeException {
        Objects.requireNonNull(observations, "observations cannot be null");
        Objects.requireNonNull(grid, "grid cannot be null");
        if (observations.size() == 0) {
            throw new InsufficientDataException(0, 1);
        }
        long total = grid.nodeCount();
        if (total > maxNodes) {
            throw new GridTooLargeException(total, maxNodes);
        }
        int nodes = (int) total;
        var values = new double[nodes];
        var variance = new double[nodes];
        for (int n = 0; n < nodes; n++) {
            var p = grid.point(n);
            var estimate = estimate(observations, p.x, p.y, p.z);
            values[n] = estimate.value();
            variance[n] = estimate.variance();
        }
        log.debug("Inverse distance interpolation of {} nodes from {} observations", nodes, observations.size());
        return new InterpolatedField(grid, values, variance, method());
    }

    @Override
    public InterpolationMethod method() {
        return InterpolationMethod.INVERSE_DISTANCE;
    }

    public double power() {
        return power;
    }
}
