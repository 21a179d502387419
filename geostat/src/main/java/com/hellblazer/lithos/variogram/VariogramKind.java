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

import java.util.Locale;

/**
 * The supported variogram model families. Each carries its normalized structure function {@code f(r)}, where
 * {@code r = h / range}, {@code f(0) = 0} and {@code f} rises monotonically toward 1.
 *
 * @author hal.hildebrand
 */
public enum VariogramKind {
    GAUSSIAN {
        @Override
        public double structure(double r) {
            return 1.0 - Math.exp(-r * r);
        }
    },
    EXPONENTIAL {
        @Override
        public double structure(double r) {
            return 1.0 - Math.exp(-r);
        }
    },
    SPHERICAL {
        @Override
        public double structure(double r) {
            return r >= 1.0 ? 1.0 : 1.5 * r - 0.5 * r * r * r;
        }
    },
    /** Matern with smoothness 3/2 */
    MATERN {
        @Override
        public double structure(double r) {
            double s = SQRT3 * r;
            return 1.0 - (1.0 + s) * Math.exp(-s);
        }
    },
    /** Linear up to the range, flat beyond it */
    LINEAR {
        @Override
        public double structure(double r) {
            return Math.min(r, 1.0);
        }
    };

    private static final double SQRT3 = Math.sqrt(3.0);

    /**
     * @throws IllegalArgumentException for an unknown model name
     */
    public static VariogramKind parse(String name) {
        return switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "gaussian" -> GAUSSIAN;
            case "exponential", "exp" -> EXPONENTIAL;
            case "spherical" -> SPHERICAL;
            case "matern" -> MATERN;
            case "linear" -> LINEAR;
            default -> throw new IllegalArgumentException("Unknown variogram model: " + name);
        };
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @param r separation divided by range, non-negative
     * @return the normalized semivariance in [0, 1]
     */
    public abstract double structure(double r);
}
