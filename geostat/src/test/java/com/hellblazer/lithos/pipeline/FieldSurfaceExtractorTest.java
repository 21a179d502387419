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
package com.hellblazer.lithos.pipeline;

import com.hellblazer.lithos.kriging.GridDefinition;
import com.hellblazer.lithos.kriging.InterpolatedField;
import com.hellblazer.lithos.kriging.InterpolationMethod;
import com.hellblazer.lithos.scene.LabeledMesh;
import org.junit.jupiter.api.Test;

import javax.vecmath.Vector3d;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class FieldSurfaceExtractorTest {

    private final FieldSurfaceExtractor extractor = new FieldSurfaceExtractor();

    private static InterpolatedField field(GridDefinition grid) {
        int n = (int) grid.nodeCount();
        var values = new double[n];
        var variance = new double[n];
        for (int i = 0; i < n; i++) {
            values[i] = i;
            variance[i] = 0.5 * i;
        }
        return new InterpolatedField(grid, values, variance, InterpolationMethod.ORDINARY_KRIGING);
    }

    private static Vector3d vertex(LabeledMesh mesh, int index) {
        var p = mesh.positions();
        return new Vector3d(p[3 * index], p[3 * index + 1], p[3 * index + 2]);
    }

    private static Vector3d faceNormal(LabeledMesh mesh, int[] face) {
        var a = vertex(mesh, face[0]);
        var b = vertex(mesh, face[1]);
        var d = vertex(mesh, face[3]);
        b.sub(a);
        d.sub(a);
        var normal = new Vector3d();
        normal.cross(b, d);
        return normal;
    }

    @Test
    public void testHeightField() {
        var mesh = extractor.extract("elevation", null, field(GridDefinition.of2d(0, 0, 10, 3, 2)));
        assertEquals(6, mesh.vertexCount());
        assertEquals(2, mesh.faces().size());
        assertNull(mesh.material());
        var corner = vertex(mesh, 5);
        assertEquals(20, corner.x, 1e-6);
        assertEquals(10, corner.y, 1e-6);
        assertEquals(5, corner.z, 1e-6);
        assertArrayEquals(new float[] { 0, 1, 2, 3, 4, 5 }, mesh.scalars().get(FieldSurfaceExtractor.VALUE));
        assertEquals(2.5f, mesh.scalars().get(FieldSurfaceExtractor.VARIANCE)[5]);
        for (var face : mesh.faces()) {
            assertEquals(4, face.length);
        }
    }

    @Test
    public void testFlatHeightFieldFacesUp() {
        var grid = GridDefinition.of2d(0, 0, 1, 4, 4);
        var flat = new InterpolatedField(grid, new double[16], new double[16], InterpolationMethod.INVERSE_DISTANCE);
        var mesh = extractor.extract("flat", "sand", flat);
        assertEquals("sand", mesh.material());
        for (var face : mesh.faces()) {
            assertTrue(faceNormal(mesh, face).z > 0);
        }
    }

    @Test
    public void testVolumeShellFacesOutward() {
        var grid = new GridDefinition(0, 0, -10, 5, 5, 2, 3, 3, 2);
        var mesh = extractor.extract("volume", null, field(grid));
        assertEquals(42, mesh.vertexCount());
        assertEquals(16, mesh.faces().size());
        assertEquals(42, mesh.scalars().get(FieldSurfaceExtractor.VALUE).length);

        var center = new Vector3d(5, 5, -9);
        for (var face : mesh.faces()) {
            var centroid = new Vector3d();
            for (int index : face) {
                centroid.add(vertex(mesh, index));
            }
            centroid.scale(1.0 / face.length);
            centroid.sub(center);
            assertTrue(faceNormal(mesh, face).dot(centroid) > 0, "faces must point away from the volume");
        }
    }
}
