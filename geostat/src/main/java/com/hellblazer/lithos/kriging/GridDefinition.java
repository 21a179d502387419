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

import com.hellblazer.lithos.common.Bounds3d;

import javax.vecmath.Point3d;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Regular grid. Nodes are numbered x fastest: {@code index = i + nx * (j + ny * k)}. Two dimensional grids have
 * {@code nz = 1}.
 *
 * @author hal.hildebrand
 */
public record GridDefinition(double originX, double originY, double originZ, double spacingX, double spacingY,
                             double spacingZ, int nx, int ny, int nz) {

    public GridDefinition {
        if (!(spacingX > 0) || !(spacingY > 0) || !(spacingZ > 0)) {
            throw new IllegalArgumentException("Grid spacing must be positive");
        }
        if (nx < 1 || ny < 1 || nz < 1) {
            throw new IllegalArgumentException("Grid must have at least one node per axis: " + nx + "x" + ny + "x" + nz);
        }
        if (!Double.isFinite(originX) || !Double.isFinite(originY) || !Double.isFinite(originZ)) {
            throw new IllegalArgumentException("Grid origin must be finite");
        }
    }

    /**
     * Two dimensional grid
     */
    public static GridDefinition of2d(double originX, double originY, double spacing, int nx, int ny) {
        return new GridDefinition(originX, originY, 0, spacing, spacing, 1, nx, ny, 1);
    }

    /**
     * Node count along an axis of the given extent at the given spacing, covering the extent
     */
    public static long nodesFor(double extent, double spacing) {
        return (long) Math.ceil(extent / spacing - 1e-9) + 1;
    }

    /**
     * The grid starting at the minimum corner of the bounds that covers them at the given spacing. The node count is
     * computed as a long first so callers can reject oversized grids before building them.
     *
     * @throws IllegalArgumentException if an axis would need more than {@link Integer#MAX_VALUE} nodes
     */
    public static GridDefinition covering(Bounds3d bounds, double spacing, double verticalSpacing, int dimension) {
        long nx = nodesFor(bounds.extentX(), spacing);
        long ny = nodesFor(bounds.extentY(), spacing);
        long nz = dimension == 3 ? nodesFor(bounds.extentZ(), verticalSpacing) : 1;
        if (nx > Integer.MAX_VALUE || ny > Integer.MAX_VALUE || nz > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Grid axis too large: " + nx + "x" + ny + "x" + nz);
        }
        return new GridDefinition(bounds.minX(), bounds.minY(), dimension == 3 ? bounds.minZ() : 0, spacing, spacing,
                                  dimension == 3 ? verticalSpacing : 1, (int) nx, (int) ny, (int) nz);
    }

    public int dimension() {
        return nz > 1 ? 3 : 2;
    }

    public int index(int i, int j, int k) {
        if (i < 0 || i >= nx || j < 0 || j >= ny || k < 0 || k >= nz) {
            throw new IndexOutOfBoundsException(
            "Node (" + i + ", " + j + ", " + k + ") outside " + nx + "x" + ny + "x" + nz);
        }
        return i + nx * (j + ny * k);
    }

    public Bounds3d bounds() {
        return new Bounds3d(originX, originY, originZ, x(nx - 1), y(ny - 1), z(nz - 1));
    }

    /**
     * Node count as a long, safe against overflow
     */
    public long nodeCount() {
        return (long) nx * ny * nz;
    }

    public Point3d point(int index) {
        int i = index % nx;
        int j = (index / nx) % ny;
        int k = index / (nx * ny);
        return new Point3d(x(i), y(j), z(k));
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("origin", new double[] { originX, originY, originZ });
        map.put("spacing", new double[] { spacingX, spacingY, spacingZ });
        map.put("shape", new int[] { nx, ny, nz });
        return map;
    }

    /**
     * The same extent with the spacing multiplied by the factor
     */
    public GridDefinition coarsened(double factor) {
        if (!(factor > 1)) {
            throw new IllegalArgumentException("factor must exceed 1: " + factor);
        }
        var b = bounds();
        return covering(b, spacingX * factor, nz > 1 ? spacingZ * factor : 1, dimension());
    }

    public double x(int i) {
        return originX + i * spacingX;
    }

    public double y(int j) {
        return originY + j * spacingY;
    }

    public double z(int k) {
        return originZ + k * spacingZ;
    }
}
