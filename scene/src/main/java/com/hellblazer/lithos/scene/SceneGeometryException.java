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

/**
 * Thrown when an entity's geometry cannot be converted under strict validation, e.g. a face that references a missing
 * or non-finite vertex.
 *
 * @author hal.hildebrand
 */
public class SceneGeometryException extends Exception {
    private final String entity;

    public SceneGeometryException(String entity, String message) {
        super(message);
        this.entity = entity;
    }

    public SceneGeometryException(String entity, String message, Throwable cause) {
        super(message, cause);
        this.entity = entity;
    }

    /**
     * @return the name of the entity whose geometry failed
     */
    public String entity() {
        return entity;
    }
}
