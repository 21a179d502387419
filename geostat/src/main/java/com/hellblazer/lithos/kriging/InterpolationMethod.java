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
 * The method that produced an interpolated field
 *
 * @author hal.hildebrand
 */
public enum InterpolationMethod {
    ORDINARY_KRIGING, UNIVERSAL_KRIGING, SIMPLE_KRIGING, INVERSE_DISTANCE;

    public static InterpolationMethod of(KrigingVariant variant) {
        return switch (variant) {
            case ORDINARY -> ORDINARY_KRIGING;
            case UNIVERSAL -> UNIVERSAL_KRIGING;
            case SIMPLE -> SIMPLE_KRIGING;
        };
    }

    public boolean isKriging() {
        return this != INVERSE_DISTANCE;
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
