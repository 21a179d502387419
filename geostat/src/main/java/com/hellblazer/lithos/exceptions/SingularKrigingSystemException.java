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
 * The kriging system matrix is singular or too ill conditioned to solve, typically because of coincident samples with
 * no nugget, or because the drift terms are linearly dependent over the sample locations.
 *
 * @author hal.hildebrand
 */
public final class SingularKrigingSystemException extends GeostatException {
    private final boolean driftDegenerate;

    public SingularKrigingSystemException(String message, boolean driftDegenerate) {
        super(message);
        this.driftDegenerate = driftDegenerate;
    }

    /**
     * @return true when the singularity comes from degenerate drift terms, e.g. colinear samples under a linear trend
     */
    public boolean driftDegenerate() {
        return driftDegenerate;
    }
}
