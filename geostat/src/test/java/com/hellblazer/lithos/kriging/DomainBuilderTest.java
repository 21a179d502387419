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

import com.hellblazer.lithos.sample.Observations;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class DomainBuilderTest {

    @Test
    public void testDefaultMargin() {
        var observations = KrigingEngineTest.corners();
        var builder = new DomainBuilder(10, 10, null, DomainExtension.MARGIN, 1);
        var domain = builder.domain(observations.bounds(), 2);
        assertEquals(-20, domain.minX(), 1e-12);
        assertEquals(120, domain.maxY(), 1e-12);
        var grid = builder.grid(observations);
        assertEquals(15, grid.nx());
        assertEquals(15, grid.ny());
        assertEquals(1, grid.nz());
        assertEquals(grid.nodeCount(), builder.estimatedNodeCount(observations));
    }

    @Test
    public void testExplicitMargins() {
        var builder = new DomainBuilder(5, 5, new double[] { 5, 0 }, DomainExtension.MARGIN, 1);
        var domain = builder.domain(KrigingEngineTest.corners().bounds(), 2);
        assertEquals(-5, domain.minX(), 1e-12);
        assertEquals(0, domain.minY(), 1e-12);
        assertEquals(100, domain.maxY(), 1e-12);
    }

    @Test
    public void testFoundationMultiple() {
        var builder = new DomainBuilder(10, 10, null, DomainExtension.FOUNDATION_MULTIPLE, 3);
        var domain = builder.domain(KrigingEngineTest.corners().bounds(), 2);
        assertEquals(-100, domain.minX(), 1e-12);
        assertEquals(200, domain.maxX(), 1e-12);
        assertEquals(300, domain.extentY(), 1e-12);
    }

    @Test
    public void testVolumeGrowsVertically() {
        var observations = new Observations(new String[] { "a", "b", "c" }, new double[] { 0, 10, 0 },
                                            new double[] { 0, 0, 10 }, new double[] { -5, -10, -20 },
                                            new double[] { 1, 2, 3 }, 3);
        var builder = new DomainBuilder(5, 2, null, DomainExtension.MARGIN, 1);
        var domain = builder.domain(observations.bounds(), 3);
        assertEquals(-23, domain.minZ(), 1e-12);
        assertEquals(-2, domain.maxZ(), 1e-12);
        var grid = builder.grid(observations);
        assertEquals(3, grid.dimension());
        assertEquals(grid.nodeCount(), builder.estimatedNodeCount(observations));
    }

    @Test
    public void testInvalidArguments() {
        assertThrows(IllegalArgumentException.class, () -> new DomainBuilder(0, 1, null, DomainExtension.MARGIN, 1));
        assertThrows(IllegalArgumentException.class,
                     () -> new DomainBuilder(1, 1, new double[] { -1, 0 }, DomainExtension.MARGIN, 1));
        assertThrows(IllegalArgumentException.class,
                     () -> new DomainBuilder(1, 1, null, DomainExtension.FOUNDATION_MULTIPLE, 0.5));
    }

    @Property(tries = 50)
    void observationsLieStrictlyInsideGrid(@ForAll @IntRange(min = 0, max = 100_000) int seed,
                                           @ForAll @IntRange(min = 1, max = 25) int n) {
        var random = new Random(seed);
        var xyv = new double[n][];
        for (int i = 0; i < n; i++) {
            xyv[i] = new double[] { random.nextDouble() * 500 - 250, random.nextDouble() * 80, 1 };
        }
        var observations = KrigingEngineTest.observations(xyv);
        double resolution = 1 + random.nextDouble() * 20;
        var bounds = new DomainBuilder(resolution, resolution, null, DomainExtension.MARGIN, 1).grid(observations)
                                                                                               .bounds();
        for (int i = 0; i < n; i++) {
            assertTrue(bounds.minX() < observations.x(i) && observations.x(i) < bounds.maxX());
            assertTrue(bounds.minY() < observations.y(i) && observations.y(i) < bounds.maxY());
        }
    }
}
