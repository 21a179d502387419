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
package com.hellblazer.lithos.exceptions;

import java.util.List;

/**
 * Two or more samples occupy the same location.
 *
 * @author hal.hildebrand
 */
public final class DuplicateCoordinatesException extends GeostatException {
    private final List<List<String>> groups;

    /**
     * @param groups the ids of the samples sharing each duplicated location
     */
    public DuplicateCoordinatesException(List<List<String>> groups) {
        super("Duplicate sample coordinates: " + groups);
        this.groups = List.copyOf(groups);
    }

    public List<List<String>> groups() {
        return groups;
    }
}
