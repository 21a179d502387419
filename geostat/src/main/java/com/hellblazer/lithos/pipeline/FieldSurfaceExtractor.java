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

import com.hellblazer.lithos.common.FloatArrayList;
import com.hellblazer.lithos.kriging.InterpolatedField;
import com.hellblazer.lithos.scene.LabeledMesh;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns an interpolated field into polygonal geometry for export. A 2 dimensional field becomes a height field: one
 * vertex per node, raised to the node's value, with one quad per grid cell. A 3 dimensional field becomes the
 * boundary shell of its volume, one quad grid per box face with outward winding. Every vertex carries the node's value
 * and variance as scalar attributes.
 *
 * @author hal.hildebrand
 */
public class FieldSurfaceExtractor {
    public static final String VALUE    = "value";
    public static final String VARIANCE = "variance";

    public LabeledMesh extract(String name, String material, InterpolatedField field) {
        Objects.requireNonNull(field, "field cannot be null");
        return field.grid().dimension() == 2 ? heightField(name, material, field) : shell(name, material, field);
    }

    private LabeledMesh heightField(String name, String material, InterpolatedField field) {
        var grid = field.grid();
        int nx = grid.nx(), ny = grid.ny();
        var positions = new FloatArrayList(nx * ny * 3);
        var values = new FloatArrayList(nx * ny);
        var variances = new FloatArrayList(nx * ny);
        for (int j = 0; j < ny; j++) {
            for (int i = 0; i < nx; i++) {
                int node = grid.index(i, j, 0);
                positions.addFloat((float) grid.x(i));
                positions.addFloat((float) grid.y(j));
                positions.addFloat((float) field.value(node));
                values.addFloat((float) field.value(node));
                variances.addFloat((float) field.variance(node));
            }
        }
        var faces = new ArrayList<int[]>();
        for (int j = 0; j + 1 < ny; j++) {
            for (int i = 0; i + 1 < nx; i++) {
                int a = j * nx + i;
                faces.add(new int[] { a, a + 1, a + 1 + nx, a + nx });
            }
        }
        return LabeledMesh.of(name, material, positions.toArray(), faces)
                          .withScalar(VALUE, values.toArray())
                          .withScalar(VARIANCE, variances.toArray());
    }

    private LabeledMesh shell(String name, String material, InterpolatedField field) {
        var grid = field.grid();
        int[] dims = { grid.nx(), grid.ny(), grid.nz() };
        var positions = new FloatArrayList();
        var values = new FloatArrayList();
        var variances = new FloatArrayList();
        var faces = new ArrayList<int[]>();
        for (int axis = 0; axis < 3; axis++) {
            int u = (axis + 1) % 3, v = (axis + 2) % 3;
            if (dims[u] < 2 || dims[v] < 2) {
                continue;
            }
            for (int side = 0; side < 2; side++) {
                if (side == 1 && dims[axis] == 1) {
                    continue;
                }
                int base = values.size();
                var node = new int[3];
                node[axis] = side == 0 ? 0 : dims[axis] - 1;
                for (int iv = 0; iv < dims[v]; iv++) {
                    for (int iu = 0; iu < dims[u]; iu++) {
                        node[u] = iu;
                        node[v] = iv;
                        int index = grid.index(node[0], node[1], node[2]);
                        positions.addFloat((float) grid.x(node[0]));
                        positions.addFloat((float) grid.y(node[1]));
                        positions.addFloat((float) grid.z(node[2]));
                        values.addFloat((float) field.value(index));
                        variances.addFloat((float) field.variance(index));
                    }
                }
                addQuads(faces, base, dims[u], dims[v], side == 0);
            }
        }
        return LabeledMesh.of(name, material, positions.toArray(), faces)
                          .withScalar(VALUE, values.toArray())
                          .withScalar(VARIANCE, variances.toArray());
    }

    // (u, v, axis) is right handed, so counter clockwise quads in (u, v) face +axis
    private static void addQuads(List<int[]> faces, int base, int nu, int nv, boolean reversed) {
        for (int iv = 0; iv + 1 < nv; iv++) {
            for (int iu = 0; iu + 1 < nu; iu++) {
                int a = base + iv * nu + iu;
                int b = a + 1, c = a + 1 + nu, d = a + nu;
                faces.add(reversed ? new int[] { a, d, c, b } : new int[] { a, b, c, d });
            }
        }
    }
}
