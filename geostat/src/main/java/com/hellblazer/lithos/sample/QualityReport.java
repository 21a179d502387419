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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Result of a sample quality inspection.
 *
 * @author hal.hildebrand
 */
public record QualityReport(QualityLevel level, int totalSamples, List<QualityIssue> issues,
                            List<String> recommendations) {

    public QualityReport {
        issues = List.copyOf(issues);
        recommendations = List.copyOf(recommendations);
    }

    public boolean has(QualityIssue.Type type) {
        return issues.stream().anyMatch(issue -> issue.type() == type);
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("overall_quality", level.name().toLowerCase(Locale.ROOT));
        map.put("total_samples", totalSamples);
        map.put("issues", issues.stream().map(issue -> {
            var entry = new LinkedHashMap<String, Object>();
            entry.put("type", issue.type().name().toLowerCase(Locale.ROOT));
            entry.put("severity", issue.severity().name().toLowerCase(Locale.ROOT));
            entry.put("description", issue.description());
            entry.put("samples", issue.sampleIds());
            entry.put("suggestion", issue.suggestion());
            entry.put("auto_fixable", issue.autoFixable());
            return entry;
        }).toList());
        map.put("recommendations", recommendations);
        return map;
    }
}
