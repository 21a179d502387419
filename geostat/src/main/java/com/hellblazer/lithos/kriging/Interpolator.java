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
package com.hellblazer.lithos.kriging;

import com.hellblazer.lithos.exceptions.GeostatException;
import com.hellblazer.lithos.sample.Observations;

/**
 * Estimates a field and its uncertainty on a grid from scattered observations.
 *
 * @author hal.hildebrand
 */
public interface Interpolator {

    /**
     * @throws GeostatException when the observations cannot support an estimate, the computation exceeds its budget,
     *                          or the result is not finite
     */
    InterpolatedField interpolate(Observations observations, GridDefinition grid) throws GeostatException;

    InterpolationMethod method();
}
