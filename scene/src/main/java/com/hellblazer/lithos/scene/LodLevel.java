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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One level of detail: viewers closer than {@code maxDistance} should use this tier.
 *
 * @param tier                 the tier
 * @param maxDistance          camera distance upper bound, in scene units
 * @param vertexStride         stride applied to the full resolution vertex buffer
 * @param estimatedVertexCount vertices remaining after the stride is applied
 * @author hal.hildebrand
 */
public record LodLevel(LodTier tier, double maxDistance, int vertexStride, int estimatedVertexCount) {

    public LodLevel {
        if (vertexStride < 1) {
            throw new IllegalArgumentException("vertexStride must be positive: " + vertexStride);
        }
        if (!(maxDistance >= 0)) {
            throw new IllegalArgumentException("maxDistance must be non-negative: " + maxDistance);
        }
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("tier", tier.key());
        map.put("max_distance", maxDistance);
        map.put("vertex_stride", vertexStride);
        map.put("estimated_vertex_count", estimatedVertexCount);
        return map;
    }
}
