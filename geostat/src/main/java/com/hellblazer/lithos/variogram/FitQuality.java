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

/**
 * How a variogram model was obtained
 *
 * @author hal.hildebrand
 */
public enum FitQuality {
    /** Least squares fit converged to physical parameters */
    AUTO_FITTED,
    /** Defaults derived from the empirical variogram */
    HEURISTIC_FALLBACK;

    public String key() {
        return this == AUTO_FITTED ? "auto_fitted" : "heuristic_fallback";
    }
}
