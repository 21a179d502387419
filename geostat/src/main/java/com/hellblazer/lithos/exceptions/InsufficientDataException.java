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
 * Too few usable samples for the requested operation.
 *
 * @author hal.hildebrand
 */
public final class InsufficientDataException extends GeostatException {
    private final int available;
    private final int required;

    public InsufficientDataException(int available, int required) {
        super("Insufficient samples: " + available + " available, at least " + required + " required");
        this.available = available;
        this.required = required;
    }

    public int available() {
        return available;
    }

    public int required() {
        return required;
    }
}
