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
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The exported scene: converted entities in input order plus aggregate statistics. Immutable.
 *
 * @author hal.hildebrand
 */
public final class SceneMesh {
    private final List<SceneEntity> entities;
    private final SceneStatistics   statistics;
    private final String            colormapHint;

    SceneMesh(List<SceneEntity> entities, SceneStatistics statistics, String colormapHint) {
        this.entities = List.copyOf(entities);
        this.statistics = statistics;
        this.colormapHint = colormapHint;
    }

    /**
     * Colormap renderers should apply to the scalar attributes of every entity
     */
    public String colormapHint() {
        return colormapHint;
    }

    public List<SceneEntity> entities() {
        return entities;
    }

    public Optional<SceneEntity> entity(String name) {
        return entities.stream().filter(e -> e.name().equals(name)).findFirst();
    }

    public SceneStatistics statistics() {
        return statistics;
    }

    /**
     * @return {@code {"entities": {name: {...}}, "colormap_hint": "...", "statistics": {...}}}
     */
    public Map<String, Object> toDocument() {
        var byName = new LinkedHashMap<String, Object>();
        entities.forEach(e -> byName.put(e.name(), e.toDocument()));
        var document = new LinkedHashMap<String, Object>();
        document.put("entities", byName);
        document.put("colormap_hint", colormapHint);
        document.put("statistics", statistics.toMap());
        return document;
    }
}
