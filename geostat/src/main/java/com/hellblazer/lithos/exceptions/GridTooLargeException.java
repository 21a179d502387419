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

/**
 * The requested grid would exceed the configured node budget.
 *
 * @author hal.hildebrand
 */
public final class GridTooLargeException extends GeostatException {
    private final long nodes;
    private final long limit;

    public GridTooLargeException(long nodes, long limit) {
        super("Grid of " + nodes + " nodes exceeds the limit of " + limit + " nodes");
        this.nodes = nodes;
        this.limit = limit;
    }

    public long limit() {
        return limit;
    }

    public long nodes() {
        return nodes;
    }
}
