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

import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.TreeMap;

/**
 * A named material layer with its physical properties (density, cohesion, friction angle, permeability...).
 *
 * @author hal.hildebrand
 */
public record MaterialLayer(int layerId, String name, Map<String, Double> properties) {

    public MaterialLayer {
        Objects.requireNonNull(name, "name cannot be null");
        properties = properties == null ? Map.of() : Map.copyOf(new TreeMap<>(properties));
    }

    public OptionalDouble property(String property) {
        var value = properties.get(property);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }
}
