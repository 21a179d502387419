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

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * What a {@link RecoveryStrategy} proposes: retry the failed stage with an adjusted configuration, or give up.
 *
 * @param configuration      the configuration to retry with; empty when there is no fix
 * @param modifiedParameters the changes, by configuration key, for reporting
 * @param fallbackMethod     true if the retry substitutes a different method rather than adjusting parameters
 * @param description        what the action does, or why there is none
 * @author hal.hildebrand
 */
public record RecoveryAction(Optional<PipelineConfiguration> configuration, Map<String, Object> modifiedParameters,
                             boolean fallbackMethod, String description) {

    public RecoveryAction {
        Objects.requireNonNull(configuration, "configuration cannot be null");
        modifiedParameters = Collections.unmodifiableMap(new TreeMap<>(modifiedParameters));
        Objects.requireNonNull(description, "description cannot be null");
    }

    public static RecoveryAction none(String reason) {
        return new RecoveryAction(Optional.empty(), Map.of(), false, reason);
    }

    public static RecoveryAction retry(PipelineConfiguration configuration, Map<String, Object> parameters,
                                       String description) {
        return new RecoveryAction(Optional.of(configuration), parameters, false, description);
    }

    public static RecoveryAction substitute(PipelineConfiguration configuration, Map<String, Object> parameters,
                                            String description) {
        return new RecoveryAction(Optional.of(configuration), parameters, true, description);
    }

    public boolean recoverable() {
        return configuration.isPresent();
    }
}
