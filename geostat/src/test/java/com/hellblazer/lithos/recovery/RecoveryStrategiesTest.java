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
package com.hellblazer.lithos.recovery;

import com.hellblazer.lithos.exceptions.InsufficientDataException;
import com.hellblazer.lithos.exceptions.SingularKrigingSystemException;
import com.hellblazer.lithos.kriging.GridDefinition;
import com.hellblazer.lithos.kriging.KrigingVariant;
import com.hellblazer.lithos.pipeline.PipelineConfiguration;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class RecoveryStrategiesTest {

    private static final ErrorContext CONTEXT = ErrorContext.of(ErrorKind.SINGULAR_SYSTEM, "singular", "", "", "test");

    @Test
    public void testNuggetEscalation() {
        var cause = new SingularKrigingSystemException("zero pivot", false);
        var config = PipelineConfiguration.defaultConfig();
        double[] expected = { 0.1, 0.2, 0.4, 0.5 };
        for (double fraction : expected) {
            var action = RecoveryStrategies.raiseNugget(cause, CONTEXT, config);
            assertTrue(action.recoverable());
            config = action.configuration().orElseThrow();
            assertEquals(fraction, config.nuggetFraction(), 1e-12);
            assertEquals(KrigingVariant.ORDINARY, config.krigingVariant());
            assertFalse(action.modifiedParameters().containsKey("kriging_variant"));
        }
        assertFalse(RecoveryStrategies.raiseNugget(cause, CONTEXT, config).recoverable());
    }

    @Test
    public void testDegenerateDriftFallsBackToOrdinary() {
        var config = PipelineConfiguration.builder().krigingVariant(KrigingVariant.UNIVERSAL).build();
        var action = RecoveryStrategies.raiseNugget(new SingularKrigingSystemException("colinear", true), CONTEXT,
                                                    config);
        var retry = action.configuration().orElseThrow();
        assertEquals(KrigingVariant.ORDINARY, retry.krigingVariant());
        assertEquals("ordinary", action.modifiedParameters().get("kriging_variant"));
    }

    @Test
    public void testSyntheticSamplesRequireOptIn() {
        var cause = new InsufficientDataException(2, 3);
        assertFalse(RecoveryStrategies.synthesizeSamples(cause, CONTEXT, PipelineConfiguration.defaultConfig())
                                      .recoverable());
        var allowed = PipelineConfiguration.builder().allowSyntheticSamples(true).build();
        var action = RecoveryStrategies.synthesizeSamples(cause, CONTEXT, allowed);
        assertTrue(action.configuration().orElseThrow().synthesizeSamples());
        assertFalse(RecoveryStrategies.synthesizeSamples(new InsufficientDataException(0, 3), CONTEXT, allowed)
                                      .recoverable());
    }

    @Test
    public void testCoarsenGrid() {
        var config = PipelineConfiguration.builder()
                                          .dimension(3)
                                          .gridResolution(5)
                                          .verticalResolution(1.0)
                                          .grid(GridDefinition.of2d(0, 0, 5, 21, 21))
                                          .build();
        var action = RecoveryStrategies.coarsenGrid(new OutOfMemoryError(), CONTEXT, config);
        var coarse = action.configuration().orElseThrow();
        assertEquals(10, coarse.gridResolution());
        assertEquals(2, coarse.verticalResolution());
        assertEquals(11, coarse.grid().nx());
        assertTrue(action.modifiedParameters().containsKey("grid"));
    }

    @Test
    public void testSubstituteInverseDistance() {
        var action = RecoveryStrategies.substituteInverseDistance(new RuntimeException(), CONTEXT,
                                                                  PipelineConfiguration.defaultConfig());
        assertTrue(action.fallbackMethod());
        var retry = action.configuration().orElseThrow();
        assertTrue(retry.inverseDistance());
        assertFalse(RecoveryStrategies.substituteInverseDistance(new RuntimeException(), CONTEXT, retry)
                                      .recoverable());
    }

    @Test
    public void testExplicitMaxLagIsReplacedWhenEmpty() {
        var config = PipelineConfiguration.builder().maxLag(5.0).build();
        var action = RecoveryStrategies.extendMaxLag(new RuntimeException(), CONTEXT, config);
        assertTrue(action.recoverable());
        var extended = action.configuration().orElseThrow();
        assertNull(extended.maxLag());
        assertTrue(extended.extendMaxLag());
        assertEquals(5.0, action.modifiedParameters().get("replaced_max_lag"));

        var defaults = RecoveryStrategies.extendMaxLag(new RuntimeException(), CONTEXT,
                                                       PipelineConfiguration.defaultConfig());
        assertTrue(defaults.configuration().orElseThrow().extendMaxLag());
        assertFalse(RecoveryStrategies.extendMaxLag(new RuntimeException(), CONTEXT,
                                                    defaults.configuration().orElseThrow()).recoverable());
    }
}
