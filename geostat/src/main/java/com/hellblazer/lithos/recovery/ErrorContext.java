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

import org.slf4j.Logger;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * A structured diagnostic: what went wrong, how bad it is, what was done about it. Error contexts are transient; they
 * are logged and returned with pipeline results but never persisted.
 *
 * @param kind               classified failure kind
 * @param category           failure category
 * @param severity           severity
 * @param humanMessage       message for the user
 * @param suggestedFix       what the user can do
 * @param autoFixed          true if the pipeline recovered automatically
 * @param modifiedParameters parameters changed by the recovery, by configuration key
 * @param usedFallbackMethod true if a substitute method produced the result
 * @param technicalDetail    original exception message or other technical detail
 * @param stage              pipeline stage that raised the failure
 * @author hal.hildebrand
 */
public record ErrorContext(ErrorKind kind, ErrorCategory category, Severity severity, String humanMessage,
                           String suggestedFix, boolean autoFixed, Map<String, Object> modifiedParameters,
                           boolean usedFallbackMethod, String technicalDetail, String stage) {

    public ErrorContext {
        Objects.requireNonNull(kind, "kind cannot be null");
        Objects.requireNonNull(category, "category cannot be null");
        Objects.requireNonNull(severity, "severity cannot be null");
        Objects.requireNonNull(humanMessage, "humanMessage cannot be null");
        suggestedFix = suggestedFix == null ? "" : suggestedFix;
        technicalDetail = technicalDetail == null ? "" : technicalDetail;
        stage = stage == null ? "" : stage;
        modifiedParameters = modifiedParameters == null ? Map.of()
                                                        : Collections.unmodifiableMap(new TreeMap<>(modifiedParameters));
    }

    /**
     * A fresh, not yet fixed context with the kind's category and default severity
     */
    public static ErrorContext of(ErrorKind kind, String humanMessage, String suggestedFix, String technicalDetail,
                                  String stage) {
        return new ErrorContext(kind, kind.category(), kind.defaultSeverity(), humanMessage, suggestedFix, false,
                                Map.of(), false, technicalDetail, stage);
    }

    /**
     * Log through the given logger at the level matching the severity
     */
    public ErrorContext log(Logger logger) {
        var format = "[{}] {} ({}): {}{}";
        var outcome = autoFixed ? " - auto fixed" + (modifiedParameters.isEmpty() ? "" : " with " + modifiedParameters)
                                : "";
        switch (severity) {
            case INFO -> logger.info(format, stage, kind.key(), category.key(), humanMessage, outcome);
            case WARNING -> logger.warn(format, stage, kind.key(), category.key(), humanMessage, outcome);
            case ERROR, CRITICAL -> logger.error(format, stage, kind.key(), category.key(), humanMessage, outcome);
        }
        if (!technicalDetail.isEmpty()) {
            logger.debug("[{}] {} detail: {}", stage, kind.key(), technicalDetail);
        }
        return this;
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("error_type", kind.key());
        map.put("category", category.key());
        map.put("severity", severity.key());
        map.put("human_message", humanMessage);
        map.put("suggested_fix", suggestedFix);
        map.put("auto_fixed", autoFixed);
        map.put("modified_parameters", modifiedParameters);
        map.put("used_fallback_method", usedFallbackMethod);
        map.put("technical_detail", technicalDetail);
        map.put("stage", stage);
        return map;
    }

    /**
     * The context after a successful automatic recovery, downgraded to a warning
     */
    public ErrorContext withRecovery(Map<String, Object> parameters, boolean fallback) {
        var downgraded = severity.compareTo(Severity.WARNING) > 0 ? Severity.WARNING : severity;
        return new ErrorContext(kind, category, downgraded, humanMessage, suggestedFix, true, parameters, fallback,
                                technicalDetail, stage);
    }

    /**
     * The context of a recovery that was applied but did not lead to success
     */
    public ErrorContext withFailedRecovery(Map<String, Object> parameters, boolean fallback) {
        return new ErrorContext(kind, category, severity, humanMessage, suggestedFix, false, parameters, fallback,
                                technicalDetail, stage);
    }

    public ErrorContext withSeverity(Severity newSeverity) {
        return new ErrorContext(kind, category, newSeverity, humanMessage, suggestedFix, autoFixed, modifiedParameters,
                                usedFallbackMethod, technicalDetail, stage);
    }
}
