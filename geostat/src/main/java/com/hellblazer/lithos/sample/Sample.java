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

import java.util.Objects;

/**
 * A single borehole observation. Coordinates are stored as given; non-finite values are detected during validation,
 * not on construction, so that they can be reported and recovered from.
 *
 * @param id          unique sample identifier
 * @param x           easting
 * @param y           northing
 * @param z           elevation
 * @param materialTag material classification, may be null
 * @param layerId     material layer reference, may be null
 * @param description free text, never null
 * @author hal.hildebrand
 */
public record Sample(String id, double x, double y, double z, String materialTag, Integer layerId,
                     String description) {

    public Sample {
        Objects.requireNonNull(id, "id cannot be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id cannot be blank");
        }
        description = description == null ? "" : description;
    }

    public static Sample of(String id, double x, double y, double z) {
        return new Sample(id, x, y, z, null, null, "");
    }

    public static Sample of(String id, double x, double y, double z, String materialTag) {
        return new Sample(id, x, y, z, materialTag, null, "");
    }

    public boolean hasFiniteCoordinates() {
        return Double.isFinite(x) && Double.isFinite(y) && Double.isFinite(z);
    }
}
