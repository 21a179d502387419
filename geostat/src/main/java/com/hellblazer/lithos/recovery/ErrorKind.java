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
package com.hellblazer.lithos.recovery;

import java.util.Locale;

/**
 * The failure kinds known to the recovery layer. {@link #UNKNOWN} marks anything the catalog could not classify.
 *
 * @author hal.hildebrand
 */
public enum ErrorKind {
    INSUFFICIENT_POINTS(ErrorCategory.DATA_VALIDATION, Severity.ERROR),
    DUPLICATE_COORDINATES(ErrorCategory.DATA_VALIDATION, Severity.WARNING),
    INVALID_COORDINATES(ErrorCategory.DATA_VALIDATION, Severity.WARNING),
    SINGULAR_SYSTEM(ErrorCategory.INTERPOLATION_FAILURE, Severity.ERROR),
    VARIOGRAM_FIT_FAILURE(ErrorCategory.INTERPOLATION_FAILURE, Severity.WARNING),
    NUMERICAL_INSTABILITY(ErrorCategory.INTERPOLATION_FAILURE, Severity.ERROR),
    MESH_GENERATION_FAILURE(ErrorCategory.GEOMETRY_ERROR, Severity.ERROR),
    MEMORY_EXHAUSTION(ErrorCategory.RESOURCE_EXHAUSTION, Severity.CRITICAL),
    COMPUTATION_TIMEOUT(ErrorCategory.RESOURCE_EXHAUSTION, Severity.ERROR),
    CANCELLED(ErrorCategory.UNKNOWN, Severity.INFO),
    UNKNOWN(ErrorCategory.UNKNOWN, Severity.CRITICAL);

    private final ErrorCategory category;
    private final Severity      defaultSeverity;

    ErrorKind(ErrorCategory category, Severity defaultSeverity) {
        this.category = category;
        this.defaultSeverity = defaultSeverity;
    }

    public ErrorCategory category() {
        return category;
    }

    public Severity defaultSeverity() {
        return defaultSeverity;
    }

    /**
     * @return the snake case key, e.g. {@code insufficient_points}
     */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
