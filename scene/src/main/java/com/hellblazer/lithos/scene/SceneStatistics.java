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
package com.hellblazer.lithos.scene;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate conversion statistics.
 *
 * @param entityCount      entities exported
 * @param totalVertices    vertices across all exported entities
 * @param totalTriangles   triangles across all exported entities
 * @param omittedEntities  names of entities with no valid vertices
 * @param warnings         human readable warnings raised during conversion
 * @param conversionTime   wall clock conversion time
 * @author hal.hildebrand
 */
public record SceneStatistics(int entityCount, long totalVertices, long totalTriangles, List<String> omittedEntities,
                              List<String> warnings, Duration conversionTime) {

    public SceneStatistics {
        omittedEntities = List.copyOf(omittedEntities);
        warnings = List.copyOf(warnings);
    }

    public int warningCount() {
        return warnings.size();
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("entity_count", entityCount);
        map.put("total_vertices", totalVertices);
        map.put("total_triangles", totalTriangles);
        map.put("omitted_entities", omittedEntities);
        map.put("warning_count", warnings.size());
        map.put("warnings", warnings);
        map.put("conversion_ms", conversionTime.toMillis());
        return map;
    }
}
