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

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class PrimitiveArrayListTest {

    @Test
    public void testIntGrowth() {
        var list = new IntArrayList(2);
        for (int i = 0; i < 100; i++) {
            list.addInt(i * 3);
        }
        assertEquals(100, list.size());
        var array = list.toArray();
        assertEquals(100, array.length);
        assertEquals(0, array[0]);
        assertEquals(297, array[99]);
    }

    @Test
    public void testFloatGrowth() {
        var list = new FloatArrayList(0);
        assertEquals(0, list.size());
        assertEquals(0, list.toArray().length);
        list.addFloat(1f);
        list.addFloat(2f);
        list.addFloat(Float.NaN);
        assertEquals(3, list.size());
        assertArrayEquals(new float[] { 1f, 2f, Float.NaN }, list.toArray());
    }

    @Test
    public void testToArrayIsDetached() {
        var list = new FloatArrayList();
        list.addFloat(4f);
        var first = list.toArray();
        first[0] = 9f;
        list.addFloat(5f);
        assertArrayEquals(new float[] { 4f, 5f }, list.toArray());
    }

    @Test
    public void testNegativeCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new IntArrayList(-1));
        assertThrows(IllegalArgumentException.class, () -> new FloatArrayList(-1));
    }
}
