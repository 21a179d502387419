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
package com.hellblazer.lithos.sample;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class SampleStoreTest {

    @Test
    public void testDuplicateIdsRejected() {
        var samples = List.of(Sample.of("a", 0, 0, 1), Sample.of("a", 1, 1, 2));
        assertThrows(IllegalArgumentException.class, () -> SampleStore.of(samples));
    }

    @Test
    public void testDuplicateLayersRejected() {
        var layers = List.of(new MaterialLayer(1, "clay", Map.of()), new MaterialLayer(1, "sand", Map.of()));
        assertThrows(IllegalArgumentException.class, () -> SampleStore.of(List.of(), layers));
    }

    @Test
    public void testLayerPropertyExtraction() {
        var layers = List.of(new MaterialLayer(1, "clay", Map.of("density", 1.8, "cohesion", 25.0)));
        var samples = List.of(new Sample("b1", 0, 0, 10, "clay", 1, "stiff clay"),
                              new Sample("b2", 5, 0, 9, "sand", 2, "no layer entry"),
                              new Sample("b3", 0, 5, 8, null, null, ""));
        var store = SampleStore.of(samples, layers);

        var density = store.values(SampleAttribute.parse("property:density"));
        assertEquals(1.8, density[0]);
        assertTrue(Double.isNaN(density[1]));
        assertTrue(Double.isNaN(density[2]));

        var layerIds = store.values(SampleAttribute.LAYER_ID);
        assertEquals(1.0, layerIds[0]);
        assertEquals(2.0, layerIds[1]);
        assertTrue(Double.isNaN(layerIds[2]));

        assertArrayEquals(new double[] { 10, 9, 8 }, store.values(SampleAttribute.ELEVATION));
        assertTrue(store.layer(1).isPresent());
        assertTrue(store.layer(2).isEmpty());
    }

    @Test
    public void testAttributeParsing() {
        assertSame(SampleAttribute.ELEVATION, SampleAttribute.parse(" Elevation "));
        assertSame(SampleAttribute.LAYER_ID, SampleAttribute.parse("layer"));
        assertEquals(SampleAttribute.layerProperty("permeability"), SampleAttribute.parse("property:permeability"));
        assertEquals("property:permeability", SampleAttribute.layerProperty("permeability").key());
        assertThrows(IllegalArgumentException.class, () -> SampleAttribute.parse("porosity"));
    }

    @Test
    public void testTwoDimensionalObservationsDropElevationFromPosition() {
        var store = SampleStore.of(List.of(Sample.of("a", 0, 0, 12), Sample.of("b", 3, 4, 7)));
        var observations = Observations.extract(store, SampleAttribute.ELEVATION, 2);
        assertEquals(0, observations.z(0));
        assertEquals(12, observations.value(0));
        assertEquals(5, observations.distance(0, 1), 1e-12);

        var volume = Observations.extract(store, SampleAttribute.ELEVATION, 3);
        assertEquals(12, volume.z(0));
        assertEquals(Math.sqrt(50), volume.distance(0, 1), 1e-12);
    }
}
