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
package com.hellblazer.lithos.sample;

import com.hellblazer.lithos.common.Bounds3d;
import com.hellblazer.lithos.common.KdTree;

import javax.vecmath.Point3d;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Located scalar values ready for numerical work: the positions of a set of samples in 2 or 3 dimensions and the
 * attribute value at each. In 2 dimensions the z coordinate of every position is zero. Immutable; every transform
 * returns a new instance.
 *
 * @author hal.hildebrand
 */
public final class Observations {
    private final String[] ids;
    private final double[] x;
    private final double[] y;
    private final double[] z;
    private final double[] values;
    private final int      dimension;

    public Observations(String[] ids, double[] x, double[] y, double[] z, double[] values, int dimension) {
        if (dimension != 2 && dimension != 3) {
            throw new IllegalArgumentException("dimension must be 2 or 3: " + dimension);
        }
        int n = ids.length;
        if (x.length != n || y.length != n || z.length != n || values.length != n) {
            throw new IllegalArgumentException("Coordinate and value arrays must all have " + n + " entries");
        }
        this.ids = ids.clone();
        this.x = x.clone();
        this.y = y.clone();
        this.z = dimension == 2 ? new double[n] : z.clone();
        this.values = values.clone();
        this.dimension = dimension;
    }

    /**
     * Extract the attribute of every sample in the store, in store order
     */
    public static Observations extract(SampleStore store, SampleAttribute attribute, int dimension) {
        Objects.requireNonNull(store, "store cannot be null");
        Objects.requireNonNull(attribute, "attribute cannot be null");
        var samples = store.samples();
        int n = samples.size();
        var ids = new String[n];
        var x = new double[n];
        var y = new double[n];
        var z = new double[n];
        for (int i = 0; i < n; i++) {
            var s = samples.get(i);
            ids[i] = s.id();
            x[i] = s.x();
            y[i] = s.y();
            z[i] = s.z();
        }
        return new Observations(ids, x, y, z, store.values(attribute), dimension);
    }

    public Bounds3d bounds() {
        return Bounds3d.of(points());
    }

    public int dimension() {
        return dimension;
    }

    /**
     * Euclidean distance between two observations in the working dimension
     */
    public double distance(int i, int j) {
        return distanceTo(i, x[j], y[j], z[j]);
    }

    public double distanceTo(int i, double px, double py, double pz) {
        double dx = x[i] - px, dy = y[i] - py, dz = z[i] - pz;
        return dimension == 2 ? Math.sqrt(dx * dx + dy * dy) : Math.sqrt(dx * dx + dy * dy + dz * dz);
    }

    /**
     * Groups of observations that lie within {@code tolerance} of the group's first member. Groups are ordered by
     * their first member and each holds at least two indices.
     */
    public List<List<Integer>> duplicateGroups(double tolerance) {
        if (tolerance < 0) {
            throw new IllegalArgumentException("tolerance must be non-negative: " + tolerance);
        }
        var groups = new ArrayList<List<Integer>>();
        if (size() < 2) {
            return groups;
        }
        var tree = KdTree.of(dimension, points());
        var assigned = new boolean[size()];
        for (int i = 0; i < size(); i++) {
            if (assigned[i]) {
                continue;
            }
            var group = new ArrayList<Integer>();
            for (int j : tree.withinRadius(point(i), tolerance)) {
                if (!assigned[j]) {
                    assigned[j] = true;
                    group.add(j);
                }
            }
            if (group.size() > 1) {
                groups.add(List.copyOf(group));
            }
        }
        return groups;
    }

    public String id(int i) {
        return ids[i];
    }

    public List<String> ids(List<Integer> indices) {
        var result = new ArrayList<String>(indices.size());
        indices.forEach(i -> result.add(ids[i]));
        return result;
    }

    /**
     * @return indices of observations with a non-finite coordinate or value
     */
    public List<Integer> invalidIndices() {
        var invalid = new ArrayList<Integer>();
        for (int i = 0; i < size(); i++) {
            boolean finite = Double.isFinite(x[i]) && Double.isFinite(y[i]) && Double.isFinite(z[i]);
            if (!finite || !Double.isFinite(values[i])) {
                invalid.add(i);
            }
        }
        return invalid;
    }

    public double maxPairwiseDistance() {
        double max = 0;
        for (int i = 0; i < size(); i++) {
            for (int j = i + 1; j < size(); j++) {
                max = Math.max(max, distance(i, j));
            }
        }
        return max;
    }

    public double mean() {
        return Arrays.stream(values).average().orElse(Double.NaN);
    }

    /**
     * Replace each duplicate group by a single observation at the mean position carrying the mean value. The merged
     * observation keeps the id of the group's first member with the other ids appended after '+'.
     */
    public Observations mergeDuplicates(List<List<Integer>> groups) {
        var merged = new boolean[size()];
        var ids = new ArrayList<String>();
        var nx = new ArrayList<Double>();
        var ny = new ArrayList<Double>();
        var nz = new ArrayList<Double>();
        var nv = new ArrayList<Double>();
        var groupOf = new int[size()];
        Arrays.fill(groupOf, -1);
        for (int g = 0; g < groups.size(); g++) {
            for (int i : groups.get(g)) {
                groupOf[i] = g;
            }
        }
        for (int i = 0; i < size(); i++) {
            if (merged[i]) {
                continue;
            }
            if (groupOf[i] < 0) {
                ids.add(this.ids[i]);
                nx.add(x[i]);
                ny.add(y[i]);
                nz.add(z[i]);
                nv.add(values[i]);
                continue;
            }
            var group = groups.get(groupOf[i]);
            var id = new StringBuilder();
            double sx = 0, sy = 0, sz = 0, sv = 0;
            for (int member : group) {
                merged[member] = true;
                if (id.length() > 0) {
                    id.append('+');
                }
                id.append(this.ids[member]);
                sx += x[member];
                sy += y[member];
                sz += z[member];
                sv += values[member];
            }
            int count = group.size();
            ids.add(id.toString());
            nx.add(sx / count);
            ny.add(sy / count);
            nz.add(sz / count);
            nv.add(sv / count);
        }
        return new Observations(ids.toArray(new String[0]), unbox(nx), unbox(ny), unbox(nz), unbox(nv), dimension);
    }

    public Point3d point(int i) {
        return new Point3d(x[i], y[i], z[i]);
    }

    public List<Point3d> points() {
        var points = new ArrayList<Point3d>(size());
        for (int i = 0; i < size(); i++) {
            points.add(point(i));
        }
        return points;
    }

    public int size() {
        return ids.length;
    }

    public double value(int i) {
        return values[i];
    }

    public double[] values() {
        return values.clone();
    }

    /**
     * Population variance of the values
     */
    public double variance() {
        if (size() == 0) {
            return Double.NaN;
        }
        double mean = mean();
        double sum = 0;
        for (double v : values) {
            sum += (v - mean) * (v - mean);
        }
        return sum / size();
    }

    /**
     * @return a copy with additional observations appended
     */
    public Observations with(List<String> extraIds, List<Point3d> positions, double[] extraValues) {
        if (extraIds.size() != positions.size() || positions.size() != extraValues.length) {
            throw new IllegalArgumentException("Ids, positions and values must have the same length");
        }
        int n = size(), m = extraIds.size();
        var ids = Arrays.copyOf(this.ids, n + m);
        var nx = Arrays.copyOf(x, n + m);
        var ny = Arrays.copyOf(y, n + m);
        var nz = Arrays.copyOf(z, n + m);
        var nv = Arrays.copyOf(values, n + m);
        for (int k = 0; k < m; k++) {
            ids[n + k] = extraIds.get(k);
            nx[n + k] = positions.get(k).x;
            ny[n + k] = positions.get(k).y;
            nz[n + k] = positions.get(k).z;
            nv[n + k] = extraValues[k];
        }
        return new Observations(ids, nx, ny, nz, nv, dimension);
    }

    /**
     * @return a copy without the given indices
     */
    public Observations without(List<Integer> indices) {
        var excluded = new boolean[size()];
        indices.forEach(i -> excluded[i] = true);
        int kept = 0;
        for (boolean e : excluded) {
            if (!e) {
                kept++;
            }
        }
        var ids = new String[kept];
        var nx = new double[kept];
        var ny = new double[kept];
        var nz = new double[kept];
        var nv = new double[kept];
        int k = 0;
        for (int i = 0; i < size(); i++) {
            if (excluded[i]) {
                continue;
            }
            ids[k] = this.ids[i];
            nx[k] = x[i];
            ny[k] = y[i];
            nz[k] = z[i];
            nv[k] = values[i];
            k++;
        }
        return new Observations(ids, nx, ny, nz, nv, dimension);
    }

    public double x(int i) {
        return x[i];
    }

    public double y(int i) {
        return y[i];
    }

    public double z(int i) {
        return z[i];
    }

    private static double[] unbox(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).toArray();
    }
}
