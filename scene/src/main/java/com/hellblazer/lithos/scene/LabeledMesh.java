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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Raw input geometry for one named entity: flat xyz positions, optional flat normals, polygon faces of three or more
 * vertex indices, and optional per-vertex scalar attributes.
 *
 * @param name      entity name, unique within a scene
 * @param material  material name used for coloring, or null to color by entity name
 * @param positions flat xyz coordinates
 * @param normals   flat xyz normals, or null to compute them
 * @param faces     polygons as vertex index arrays
 * @param scalars   per-vertex attributes by name
 * @author hal.hildebrand
 */
public record LabeledMesh(String name, String material, float[] positions, float[] normals, List<int[]> faces,
                          Map<String, float[]> scalars) {

    public LabeledMesh {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(positions, "positions cannot be null");
        Objects.requireNonNull(faces, "faces cannot be null");
        if (positions.length % 3 != 0) {
            throw new IllegalArgumentException(
            "positions length must be a multiple of 3 for " + name + ": " + positions.length);
        }
        faces = Collections.unmodifiableList(new ArrayList<>(faces));
        scalars = scalars == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(scalars));
    }

    public static LabeledMesh of(String name, String material, float[] positions, List<int[]> faces) {
        return new LabeledMesh(name, material, positions, null, faces, null);
    }

    public int vertexCount() {
        return positions.length / 3;
    }

    /**
     * @return a copy with an additional per-vertex attribute
     */
    public LabeledMesh withScalar(String attribute, float[] values) {
        var merged = new TreeMap<>(scalars);
        merged.put(attribute, values);
        return new LabeledMesh(name, material, positions, normals, faces, merged);
    }
}
