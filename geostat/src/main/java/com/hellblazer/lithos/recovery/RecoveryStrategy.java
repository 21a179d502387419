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

/**
 * Derives a retry configuration from a classified failure. Strategies are pure: they inspect the failure and the
 * configuration that produced it and never modify either.
 *
 * @author hal.hildebrand
 */
@FunctionalInterface
public interface RecoveryStrategy {

    RecoveryStrategy NONE = (cause, context, configuration) -> RecoveryAction.none("No automatic fix available");

    RecoveryAction recover(Throwable cause, ErrorContext context, PipelineConfiguration configuration);
}
