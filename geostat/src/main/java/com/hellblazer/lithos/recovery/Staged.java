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

import com.hellblazer.lithos.pipeline.PipelineConfiguration;

import java.util.Objects;

/**
 * A stage's value and the configuration of the attempt that produced it. Later stages continue with that
 * configuration, so a fix applied once stays applied.
 *
 * @author hal.hildebrand
 */
public record Staged<T>(T value, PipelineConfiguration configuration) {

    public Staged {
        Objects.requireNonNull(value, "value cannot be null");
        Objects.requireNonNull(configuration, "configuration cannot be null");
    }
}
