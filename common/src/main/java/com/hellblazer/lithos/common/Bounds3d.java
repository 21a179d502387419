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
package com.hellblazer.lithos.common;

import javax.vecmath.Point3d;
import javax.vecmath.Tuple3d;
import java.util.Collection;
import java.util.Objects;

/**
 * Axis aligned bounding box in double precision.
 *
 * @param minX minimum x
 * @param minY minimum y
 * @param minZ minimum z
 * @param maxX maximum x
 * @param maxY maximum y
 * @param maxZ maximum z
 * @author hal.hildebrand
 */
public record Bounds3d(double minX, double minY, double minZ, double maxX, double maxY, double maxZ) {

    public Bounds3d {
        if (!(minX <= maxX) || !(minY <= maxY) || !(minZ <= maxZ)) {
            throw new IllegalArgumentException(
            "Invalid bounds: min (%s, %s, %s) max (%s, %s, %s)".formatted(minX, minY, minZ, maxX, maxY, maxZ));
        }
    }

    /**
     * Smallest box containing every point. Non-finite points are ignored.
     *
     * @throws IllegalArgumentException if no finite point is supplied
     */
    public static Bounds3d of(Collection<? extends Tuple3d> points) {
        Objects.requireNonNull(points, "points cannot be null");
        double minX = Double.POSITIVE_INFINITY, minY = Double.POSITIVE_INFINITY, minZ = Double.POSITIVE_INFINITY;
        double maxX = Double.NEGATIVE_INFINITY, maxY = Double.NEGATIVE_INFINITY, maxZ = Double.NEGATIVE_INFINITY;
        int counted = 0;
        for (var p : points) {
            if (!isFinite(p)) {
                continue;
            }
            minX = Math.min(minX, p.x);
            minY = Math.min(minY, p.y);
            minZ = Math.min(minZ, p.z);
            maxX = Math.max(maxX, p.x);
            maxY = Math.max(maxY, p.y);
            maxZ = Math.max(maxZ, p.z);
            counted++;
        }
        if (counted == 0) {
            throw new IllegalArgumentException("No finite points to bound");
        }
        return new Bounds3d(minX, minY, minZ, maxX, maxY, maxZ);
    }

    public static boolean isFinite(Tuple3d p) {
        return Double.isFinite(p.x) && Double.isFinite(p.y) && Double.isFinite(p.z);
    }

    public Point3d center() {
        return new Point3d((minX + maxX) / 2, (minY + maxY) / 2, (minZ + maxZ) / 2);
    }

    /**
     * @return true if the point is inside or on the boundary
     */
    public boolean contains(Tuple3d p) {
        return p.x >= minX && p.x <= maxX && p.y >= minY && p.y <= maxY && p.z >= minZ && p.z <= maxZ;
    }

    public double diagonal() {
        double dx = maxX - minX, dy = maxY - minY, dz = maxZ - minZ;
        return Math.sqrt(dx * dx + dy * dy + dz * dz);
    }

    /**
     * Grow each side by the given margin per axis
     */
    public Bounds3d expand(double marginX, double marginY, double marginZ) {
        if (marginX < 0 || marginY < 0 || marginZ < 0) {
            throw new IllegalArgumentException("Margins must be non-negative");
        }
        return new Bounds3d(minX - marginX, minY - marginY, minZ - marginZ, maxX + marginX, maxY + marginY,
                            maxZ + marginZ);
    }

    public double extentX() {
        return maxX - minX;
    }

    public double extentY() {
        return maxY - minY;
    }

    public double extentZ() {
        return maxZ - minZ;
    }

    public Point3d max() {
        return new Point3d(maxX, maxY, maxZ);
    }

    public Point3d min() {
        return new Point3d(minX, minY, minZ);
    }

    /**
     * Scale the box about its center
     */
    public Bounds3d scale(double factor) {
        if (!(factor > 0)) {
            throw new IllegalArgumentException("factor must be positive: " + factor);
        }
        var c = center();
        double hx = extentX() * factor / 2, hy = extentY() * factor / 2, hz = extentZ() * factor / 2;
        return new Bounds3d(c.x - hx, c.y - hy, c.z - hz, c.x + hx, c.y + hy, c.z + hz);
    }
}
