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

import com.hellblazer.lithos.recovery.ErrorContext;

import java.util.Objects;
import java.util.Optional;

/**
 * A fitted model together with how it was obtained and, for fallbacks after a failed fit, the warning describing why.
 *
 * @author hal.hildebrand
 */
public record VariogramFit(SpatialStructureModel model, FitQuality quality, Optional<ErrorContext> warning) {

    public VariogramFit {
        Objects.requireNonNull(model, "model cannot be null");
        Objects.requireNonNull(quality, "quality cannot be null");
        Objects.requireNonNull(warning, "warning cannot be null");
    }
}
