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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Estimated values and their variances at every node of a grid. Values and variances are finite and variances are
 * non-negative. Immutable; accessors return copies.
 *
 * @author hal.hildebrand
 */
public final class InterpolatedField {
    private final GridDefinition      grid;
    private final double[]            values;
    private final double[]            variance;
    private final InterpolationMethod method;

    /**
     * @throws IllegalArgumentException if the arrays do not match the grid, or hold non-finite values or negative
     *                                  variances
     */
    public InterpolatedField(GridDefinition grid, double[] values, double[] variance, InterpolationMethod method) {
        this.grid = Objects.requireNonNull(grid, "grid cannot be null");
        this.method = Objects.requireNonNull(method, "method cannot be null");
        if (values.length != grid.nodeCount() || variance.length != grid.nodeCount()) {
            throw new IllegalArgumentException(
            "Field arrays (" + values.length + ", " + variance.length + ") do not match " + grid.nodeCount()
            + " grid nodes");
        }
        for (int i = 0; i < values.length; i++) {
            if (!Double.isFinite(values[i]) || !Double.isFinite(variance[i])) {
                throw new IllegalArgumentException("Non-finite estimate at node " + i);
            }
            if (variance[i] < 0) {
                throw new IllegalArgumentException("Negative variance at node " + i + ": " + variance[i]);
            }
        }
        this.values = values.clone();
        this.variance = variance.clone();
    }

    public GridDefinition grid() {
        return grid;
    }

    public double max() {
        double max = Double.NEGATIVE_INFINITY;
        for (double v : values) {
            max = Math.max(max, v);
        }
        return max;
    }

    public double maxVariance() {
        double max = 0;
        for (double v : variance) {
            max = Math.max(max, v);
        }
        return max;
    }

    public double mean() {
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    public InterpolationMethod method() {
        return method;
    }

    public double min() {
        double min = Double.POSITIVE_INFINITY;
        for (double v : values) {
            min = Math.min(min, v);
        }
        return min;
    }

    public int size() {
        return values.length;
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("method", method.key());
        map.put("grid", grid.toMap());
        map.put("values", values.clone());
        map.put("variance", variance.clone());
        return map;
    }

    public double value(int index) {
        return values[index];
    }

    public double valueAt(int i, int j, int k) {
        return values[grid.index(i, j, k)];
    }

    public double[] values() {
        return values.clone();
    }

    public double[] variance() {
        return variance.clone();
    }

    public double variance(int index) {
        return variance[index];
    }

    public double varianceAt(int i, int j, int k) {
        return variance[grid.index(i, j, k)];
    }
}
