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
 * Kriging flavours, distinguished by how the mean is handled
 *
 * @author hal.hildebrand
 */
public enum KrigingVariant {
    /** Unknown constant mean: weights sum to one */
    ORDINARY(1),
    /** Unknown linear horizontal trend: drift terms 1, x, y */
    UNIVERSAL(3),
    /** Known mean, taken as the sample mean */
    SIMPLE(0);

    private final int driftTerms;

    KrigingVariant(int driftTerms) {
        this.driftTerms = driftTerms;
    }

    /**
     * @throws IllegalArgumentException for an unknown variant name
     */
    public static KrigingVariant parse(String name) {
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown kriging variant: " + name, e);
        }
    }

    public int driftTerms() {
        return driftTerms;
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
