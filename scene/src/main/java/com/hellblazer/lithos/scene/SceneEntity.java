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

import javax.vecmath.Color3f;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Converted, renderer ready geometry of one entity. Buffers are flat: three floats per position, normal and color, and
 * three indices per triangle. Accessors return copies.
 *
 * @author hal.hildebrand
 */
public final class SceneEntity {
    private final String               name;
    private final String               material;
    private final Color3f              baseColor;
    private final float[]              positions;
    private final float[]              normals;
    private final float[]              colors;
    private final int[]                indices;
    private final Map<String, float[]> scalars;
    private final EntityMetadata       metadata;

    SceneEntity(String name, String material, Color3f baseColor, float[] positions, float[] normals, float[] colors,
                int[] indices, Map<String, float[]> scalars, EntityMetadata metadata) {
        this.name = name;
        this.material = material;
        this.baseColor = new Color3f(baseColor);
        this.positions = positions;
        this.normals = normals;
        this.colors = colors;
        this.indices = indices;
        this.scalars = Collections.unmodifiableMap(new TreeMap<>(scalars));
        this.metadata = metadata;
    }

    public Color3f baseColor() {
        return new Color3f(baseColor);
    }

    public float[] colors() {
        return colors.clone();
    }

    public int[] indices() {
        return indices.clone();
    }

    public String material() {
        return material;
    }

    public EntityMetadata metadata() {
        return metadata;
    }

    public String name() {
        return name;
    }

    public float[] normals() {
        return normals.clone();
    }

    public float[] positions() {
        return positions.clone();
    }

    public float[] scalar(String attribute) {
        var values = scalars.get(attribute);
        return values == null ? null : values.clone();
    }

    public Iterable<String> scalarNames() {
        return scalars.keySet();
    }

    /**
     * Nested document form: geometry, material, metadata and lod sections. Buffers are copied into the document.
     */
    public Map<String, Object> toDocument() {
        var geometry = new LinkedHashMap<String, Object>();
        geometry.put("positions", positions.clone());
        geometry.put("normals", normals.clone());
        geometry.put("indices", indices.clone());
        geometry.put("colors", colors.clone());
        var attributes = new LinkedHashMap<String, Object>();
        scalars.forEach((k, v) -> attributes.put(k, v.clone()));
        geometry.put("scalars", attributes);

        var materialSection = new LinkedHashMap<String, Object>();
        materialSection.put("name", material);
        materialSection.put("base_color", new float[] { baseColor.x, baseColor.y, baseColor.z });

        var lod = new LinkedHashMap<String, Object>();
        metadata.lod().forEach(level -> lod.put(level.tier().key(), level.toMap()));

        var document = new LinkedHashMap<String, Object>();
        document.put("geometry", geometry);
        document.put("material", materialSection);
        document.put("metadata", metadata.toMap());
        document.put("lod", lod);
        return document;
    }

    public int triangleCount() {
        return indices.length / 3;
    }

    public int vertexCount() {
        return positions.length / 3;
    }
}
