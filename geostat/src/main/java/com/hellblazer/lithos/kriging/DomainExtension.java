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

import java.util.Locale;

/**
 * How the interpolation domain is derived from the sample bounds
 *
 * @author hal.hildebrand
 */
public enum DomainExtension {
    /** Grow each side by a margin */
    MARGIN,
    /** Scale the sample box about its center, e.g. three times the footprint of a foundation pit */
    FOUNDATION_MULTIPLE;

    public static DomainExtension parse(String name) {
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "margin" -> MARGIN;
            case "foundation_multiple" -> FOUNDATION_MULTIPLE;
            default -> throw new IllegalArgumentException("Unknown domain extension method: " + name);
        };
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
