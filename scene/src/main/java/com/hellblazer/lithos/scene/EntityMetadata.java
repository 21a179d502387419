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

import com.hellblazer.lithos.common.Bounds3d;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per entity bookkeeping produced during conversion.
 *
 * @param vertexCount         vertices in the exported buffers
 * @param triangleCount       triangles in the exported index buffer
 * @param sourceVertexCount   vertices in the input mesh
 * @param droppedVertices     non-finite input vertices removed
 * @param droppedFaces        faces removed in lenient mode or collapsed by downsampling
 * @param downsampleStride    stride used for downsampling, 1 when the entity was not downsampled
 * @param bounds              bounding box of the exported vertices
 * @param lod                 level of detail descriptors, finest first
 * @author hal.hildebrand
 */
public record EntityMetadata(int vertexCount, int triangleCount, int sourceVertexCount, int droppedVertices,
                             int droppedFaces, int downsampleStride, Bounds3d bounds, List<LodLevel> lod) {

    public EntityMetadata {
        lod = List.copyOf(lod);
    }

    public boolean downsampled() {
        return downsampleStride > 1;
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("vertex_count", vertexCount);
        map.put("triangle_count", triangleCount);
        map.put("source_vertex_count", sourceVertexCount);
        map.put("dropped_vertices", droppedVertices);
        map.put("dropped_faces", droppedFaces);
        map.put("downsampled", downsampled());
        map.put("downsample_stride", downsampleStride);
        var box = new LinkedHashMap<String, Object>();
        box.put("min", List.of(bounds.minX(), bounds.minY(), bounds.minZ()));
        box.put("max", List.of(bounds.maxX(), bounds.maxY(), bounds.maxZ()));
        map.put("bounding_box", box);
        return map;
    }
}
