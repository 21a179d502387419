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

import java.util.List;
import java.util.Objects;

/**
 * A problem found in the sample set.
 *
 * @param type        the kind of problem
 * @param severity    how badly it affects reconstruction
 * @param description what was found
 * @param sampleIds   the samples involved
 * @param suggestion  what to do about it
 * @param autoFixable whether the pipeline can repair it automatically
 * @author hal.hildebrand
 */
public record QualityIssue(Type type, Severity severity, String description, List<String> sampleIds, String suggestion,
                           boolean autoFixable) {

    public QualityIssue {
        Objects.requireNonNull(type, "type cannot be null");
        Objects.requireNonNull(severity, "severity cannot be null");
        sampleIds = List.copyOf(sampleIds);
    }

    public enum Type {
        MISSING_VALUES, OUTLIERS, DUPLICATES, COORDINATE_ISSUES, FORMATION_MISMATCHES, INSUFFICIENT_SAMPLES
    }

    public enum Severity {
        LOW, MEDIUM, HIGH, CRITICAL
    }
}
