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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A fitted variogram model. {@code sill} is the total sill, so the structured part contributes
 * {@code sill - nugget}. Semivariance is zero at zero separation and jumps to at least the nugget beyond it.
 *
 * @param kind      model family
 * @param range     correlation length, positive
 * @param sill      total sill, at least the nugget
 * @param nugget    nugget effect, non-negative
 * @param dimension 2 or 3
 * @author hal.hildebrand
 */
public record SpatialStructureModel(VariogramKind kind, double range, double sill, double nugget, int dimension) {

    public SpatialStructureModel {
        Objects.requireNonNull(kind, "kind cannot be null");
        if (!(range > 0) || !Double.isFinite(range)) {
            throw new IllegalArgumentException("range must be positive and finite: " + range);
        }
        if (!(nugget >= 0) || !Double.isFinite(nugget)) {
            throw new IllegalArgumentException("nugget must be non-negative and finite: " + nugget);
        }
        if (!(sill >= nugget) || !Double.isFinite(sill)) {
            throw new IllegalArgumentException("sill must be finite and at least the nugget: " + sill + " < " + nugget);
        }
        if (dimension != 2 && dimension != 3) {
            throw new IllegalArgumentException("dimension must be 2 or 3: " + dimension);
        }
    }

    /**
     * Covariance {@code C(h) = sill - gamma(h)}, so {@code C(0) = sill}
     */
    public double covariance(double h) {
        return sill - semivariance(h);
    }

    public double partialSill() {
        return sill - nugget;
    }

    public double semivariance(double h) {
        if (h <= 0) {
            return 0;
        }
        return nugget + partialSill() * kind.structure(h / range);
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("kind", kind.key());
        map.put("range", range);
        map.put("sill", sill);
        map.put("nugget", nugget);
        map.put("dimension", dimension);
        return map;
    }

    /**
     * A copy with a new nugget and the same structured contribution
     */
    public SpatialStructureModel withNugget(double newNugget) {
        return new SpatialStructureModel(kind, range, newNugget + partialSill(), newNugget, dimension);
    }
}
