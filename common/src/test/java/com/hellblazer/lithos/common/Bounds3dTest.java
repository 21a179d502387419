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
package com.hellblazer.lithos.common;

import org.junit.jupiter.api.Test;

import javax.vecmath.Point3d;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class Bounds3dTest {

    @Test
    public void testOfIgnoresNonFinite() {
        var bounds = Bounds3d.of(List.of(new Point3d(1, 2, 3), new Point3d(Double.NaN, 0, 0), new Point3d(-1, 5, 0)));
        assertEquals(new Bounds3d(-1, 2, 0, 1, 5, 3), bounds);
    }

    @Test
    public void testExpandAndScale() {
        var bounds = new Bounds3d(0, 0, 0, 10, 20, 0);
        var expanded = bounds.expand(1, 2, 0);
        assertEquals(12, expanded.extentX(), 1e-12);
        assertEquals(24, expanded.extentY(), 1e-12);
        assertTrue(expanded.contains(new Point3d(-1, -2, 0)));

        var scaled = bounds.scale(3);
        assertEquals(30, scaled.extentX(), 1e-12);
        assertEquals(new Point3d(5, 10, 0), scaled.center());
    }

    @Test
    public void testInvalid() {
        assertThrows(IllegalArgumentException.class, () -> new Bounds3d(1, 0, 0, 0, 0, 0));
        assertThrows(IllegalArgumentException.class, () -> Bounds3d.of(List.of(new Point3d(Double.NaN, 0, 0))));
        assertThrows(IllegalArgumentException.class, () -> new Bounds3d(0, 0, 0, 1, 1, 1).expand(-1, 0, 0));
    }
}
