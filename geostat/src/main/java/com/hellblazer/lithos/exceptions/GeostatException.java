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
 * Base sealed class for the classified failures of the reconstruction pipeline. Each subclass corresponds to a failure
 * kind the recovery layer knows how to describe, and possibly fix.
 *
 * @author hal.hildebrand
 */
public abstract sealed class GeostatException extends Exception
permits InsufficientDataException, DuplicateCoordinatesException, InvalidCoordinatesException,
        SingularKrigingSystemException, VariogramFitException, NumericalInstabilityException,
        ComputationTimeoutException, GridTooLargeException {

    protected GeostatException(String message) {
        super(message);
    }

    protected GeostatException(String message, Throwable cause) {
        super(message, cause);
    }
}
