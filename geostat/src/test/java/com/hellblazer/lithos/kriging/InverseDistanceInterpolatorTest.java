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

import com.hellblazer.lithos.exceptions.GridTooLargeException;
import com.hellblazer.lithos.exceptions.InsufficientDataException;
import com.hellblazer.lithos.sample.Observations;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class InverseDistanceInterpolatorTest {

    @Test
    public void testExactAtObservations() throws Exception {
        var field = new InverseDistanceInterpolator().interpolate(KrigingEngineTest.corners(),
                                                                  GridDefinition.of2d(0, 0, 50, 3, 3));
        assertEquals(InterpolationMethod.INVERSE_DISTANCE, field.method());
        assertEquals(1, field.valueAt(2, 0, 0));
        assertEquals(0, field.varianceAt(2, 0, 0));
        assertEquals(0.5, field.valueAt(1, 1, 0), 1e-12);
        assertTrue(field.varianceAt(1, 1, 0) > 0);
    }

    @Test
    public void testEstimatesStayWithinObservedRange() {
        var interpolator = new InverseDistanceInterpolator(3, 10);
        var observations = KrigingEngineTest.observations(new double[][] { { 0, 0, 2 }, { 10, 0, 4 }, { 5, 8, 9 } });
        for (double x = -5; x <= 15; x += 2.5) {
            var estimate = interpolator.estimate(observations, x, 3, 0);
            assertTrue(estimate.value() >= 2 && estimate.value() <= 9);
            assertTrue(estimate.variance() >= 0);
        }
    }

    @Test
    public void testRejectsEmptyAndOversized() {
        var empty = new Observations(new String[0], new double[0], new double[0], new double[0], new double[0], 2);
        var interpolator = new InverseDistanceInterpolator(2, 4);
        assertThrows(InsufficientDataException.class,
                     () -> interpolator.interpolate(empty, GridDefinition.of2d(0, 0, 1, 2, 2)));
        assertThrows(GridTooLargeException.class, () -> interpolator.interpolate(KrigingEngineTest.corners(),
                                                                                 GridDefinition.of2d(0, 0, 1, 3, 2)));
        assertThrows(IllegalArgumentException.class, () -> new InverseDistanceInterpolator(0, 4));
        assertThrows(IllegalArgumentException.class, () -> new InverseDistanceInterpolator(2, Integer.MAX_VALUE + 1L));
    }
}
