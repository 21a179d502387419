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
package com.hellblazer.lithos.scene;

import com.hellblazer.lithos.common.Bounds3d;
import com.hellblazer.lithos.common.FloatArrayList;
import com.hellblazer.lithos.common.IntArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Color3f;
import javax.vecmath.Point3d;
import javax.vecmath.Vector3f;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Converts labeled polygon meshes into flat, renderer agnostic buffers.
 *
 * <p>Per entity the builder
 * <ol>
 *   <li>removes non-finite vertices and remaps the faces that survive,</li>
 *   <li>fan-splits polygons into triangles,</li>
 *   <li>uses the supplied normals when they cover every vertex, otherwise computes area weighted normals,</li>
 *   <li>downsamples with a uniform vertex stride when the vertex count exceeds the configured threshold,</li>
 *   <li>assigns per vertex colors from the {@link MaterialPalette} and derives level of detail tiers.</li>
 * </ol>
 * Entities left with no valid vertex are omitted and reported in the statistics. In strict mode a face that references
 * a missing or non-finite vertex fails the whole conversion; in lenient mode the face is dropped and counted.
 *
 * @author hal.hildebrand
 */
public class SceneMeshBuilder {
    private static final Logger log = LoggerFactory.getLogger(SceneMeshBuilder.class);

    private final SceneExportConfiguration config;
    private final MaterialPalette          palette;

    public SceneMeshBuilder() {
        this(SceneExportConfiguration.defaultConfig(), MaterialPalette.defaultPalette());
    }

    public SceneMeshBuilder(SceneExportConfiguration config, MaterialPalette palette) {
        this.config = Objects.requireNonNull(config, "config cannot be null");
        this.palette = Objects.requireNonNull(palette, "palette cannot be null");
    }

    /**
     * Area weighted vertex normals: each triangle adds its unnormalized face normal, whose length is twice its area,
     * to its three vertices. Vertices that touch no triangle, or whose normals cancel, get +z.
     */
    static float[] computeNormals(float[] positions, int[] triangles) {
        int vertexCount = positions.length / 3;
        var accumulated = new Vector3f[vertexCount];
        for (int i = 0; i < vertexCount; i++) {
            accumulated[i] = new Vector3f();
        }
        var e1 = new Vector3f();
        var e2 = new Vector3f();
        var faceNormal = new Vector3f();
        for (int t = 0; t < triangles.length; t += 3) {
            int a = triangles[t], b = triangles[t + 1], c = triangles[t + 2];
            e1.set(positions[3 * b] - positions[3 * a], positions[3 * b + 1] - positions[3 * a + 1],
                   positions[3 * b + 2] - positions[3 * a + 2]);
            e2.set(positions[3 * c] - positions[3 * a], positions[3 * c + 1] - positions[3 * a + 1],
                   positions[3 * c + 2] - positions[3 * a + 2]);
            faceNormal.cross(e1, e2);
            accumulated[a].add(faceNormal);
            accumulated[b].add(faceNormal);
            accumulated[c].add(faceNormal);
        }
        var normals = new float[vertexCount * 3];
        for (int i = 0; i < vertexCount; i++) {
            var n = accumulated[i];
            float length = n.length();
            if (length > 0 && Float.isFinite(length)) {
                n.scale(1f / length);
            } else {
                n.set(0, 0, 1);
            }
            normals[3 * i] = n.x;
            normals[3 * i + 1] = n.y;
            normals[3 * i + 2] = n.z;
        }
        return normals;
    }

    private static Bounds3d bounds(float[] positions) {
        var points = new ArrayList<Point3d>(positions.length / 3);
        for (int i = 0; i < positions.length; i += 3) {
            points.add(new Point3d(positions[i], positions[i + 1], positions[i + 2]));
        }
        return Bounds3d.of(points);
    }

    private static float[] compact(float[] values, int[] remap, int validCount, int components) {
        var compacted = new float[validCount * components];
        for (int v = 0; v < remap.length; v++) {
            if (remap[v] >= 0) {
                System.arraycopy(values, v * components, compacted, remap[v] * components, components);
            }
        }
        return compacted;
    }

    private static boolean finite(float[] values, int offset, int count) {
        for (int i = offset; i < offset + count; i++) {
            if (!Float.isFinite(values[i])) {
                return false;
            }
        }
        return true;
    }

    private static List<LodLevel> lod(int vertexCount, Bounds3d bounds) {
        double diagonal = bounds.diagonal();
        return List.of(new LodLevel(LodTier.HIGH, SceneExportConfiguration.HIGH_DISTANCE_FACTOR * diagonal, 1,
                                    vertexCount),
                       new LodLevel(LodTier.MEDIUM, SceneExportConfiguration.MEDIUM_DISTANCE_FACTOR * diagonal, 2,
                                    (vertexCount + 1) / 2),
                       new LodLevel(LodTier.LOW, SceneExportConfiguration.LOW_DISTANCE_FACTOR * diagonal, 4,
                                    (vertexCount + 3) / 4));
    }

    /**
     * Keep every stride-th value group; the representative of vertex v is vertex (v / stride) * stride
     */
    private static float[] stride(float[] values, int components, int stride) {
        int count = values.length / components;
        int kept = (count + stride - 1) / stride;
        var result = new float[kept * components];
        for (int i = 0; i < kept; i++) {
            System.arraycopy(values, i * stride * components, result, i * components, components);
        }
        return result;
    }

    private static String validateFace(int[] face, int vertexCount, int[] remap) {
        if (face == null || face.length < 3) {
            return "has fewer than 3 vertices";
        }
        for (int index : face) {
            if (index < 0 || index >= vertexCount) {
                return "references missing vertex " + index;
            }
            if (remap[index] < 0) {
                return "references non-finite vertex " + index;
            }
        }
        return null;
    }

    /**
     * Convert the meshes, preserving input order.
     *
     * @throws SceneGeometryException in strict mode, when an entity's faces or attributes are inconsistent with its
     *                                vertices
     * @throws IllegalArgumentException if two meshes share a name
     */
    public SceneMesh build(List<LabeledMesh> meshes) throws SceneGeometryException {
        Objects.requireNonNull(meshes, "meshes cannot be null");
        long start = System.nanoTime();
        var names = new HashSet<String>();
        for (var mesh : meshes) {
            if (!names.add(mesh.name())) {
                throw new IllegalArgumentException("Duplicate entity name: " + mesh.name());
            }
        }

        var entities = new ArrayList<SceneEntity>(meshes.size());
        var omitted = new ArrayList<String>();
        var warnings = new ArrayList<String>();
        long vertices = 0;
        long triangles = 0;
        for (var mesh : meshes) {
            var entity = convert(mesh, warnings);
            if (entity == null) {
                omitted.add(mesh.name());
                warnings.add("Entity " + mesh.name() + " has no valid vertices and was omitted");
                log.warn("Omitting entity {}: no valid vertices", mesh.name());
                continue;
            }
            entities.add(entity);
            vertices += entity.vertexCount();
            triangles += entity.triangleCount();
        }
        var elapsed = Duration.ofNanos(System.nanoTime() - start);
        log.info("Converted {} entities ({} omitted): {} vertices, {} triangles in {} ms", entities.size(),
                 omitted.size(), vertices, triangles, elapsed.toMillis());
        return new SceneMesh(entities,
                             new SceneStatistics(entities.size(), vertices, triangles, omitted, warnings, elapsed),
                             config.colormapHint());
    }

    public SceneExportConfiguration config() {
        return config;
    }

    private SceneEntity convert(LabeledMesh mesh, List<String> warnings) throws SceneGeometryException {
        var name = mesh.name();
        var source = mesh.positions();
        int sourceCount = mesh.vertexCount();

        var remap = new int[sourceCount];
        Arrays.fill(remap, -1);
        var positions = new FloatArrayList(source.length);
        int valid = 0;
        for (int v = 0; v < sourceCount; v++) {
            if (finite(source, 3 * v, 3)) {
                remap[v] = valid++;
                positions.addFloat(source[3 * v]);
                positions.addFloat(source[3 * v + 1]);
                positions.addFloat(source[3 * v + 2]);
            }
        }
        if (valid == 0) {
            return null;
        }
        int droppedVertices = sourceCount - valid;
        if (droppedVertices > 0) {
            log.debug("Entity {}: removed {} non-finite vertices", name, droppedVertices);
        }

        var indices = new IntArrayList(mesh.faces().size() * 3);
        int droppedFaces = 0;
        for (int f = 0; f < mesh.faces().size(); f++) {
            var face = mesh.faces().get(f);
            var problem = validateFace(face, sourceCount, remap);
            if (problem != null) {
                if (config.strictGeometry()) {
                    throw new SceneGeometryException(name, "Face " + f + " of entity " + name + " " + problem);
                }
                droppedFaces++;
                continue;
            }
            for (int k = 1; k < face.length - 1; k++) {
                indices.addInt(remap[face[0]]);
                indices.addInt(remap[face[k]]);
                indices.addInt(remap[face[k + 1]]);
            }
        }
        if (droppedFaces > 0) {
            warnings.add("Entity " + name + ": dropped " + droppedFaces + " invalid faces");
            log.warn("Entity {}: dropped {} invalid faces", name, droppedFaces);
        }

        var vertexBuffer = positions.toArray();
        var triangleBuffer = indices.toArray();
        float[] normals;
        var suppliedNormals = mesh.normals();
        if (suppliedNormals != null && suppliedNormals.length == source.length
        && finite(suppliedNormals, 0, source.length)) {
            normals = compact(suppliedNormals, remap, valid, 3);
        } else {
            if (suppliedNormals != null) {
                warnings.add("Entity " + name + ": supplied normals do not match vertices, recomputed");
            }
            normals = computeNormals(vertexBuffer, triangleBuffer);
        }

        var scalars = new TreeMap<String, float[]>();
        for (Map.Entry<String, float[]> attribute : mesh.scalars().entrySet()) {
            if (attribute.getValue().length != sourceCount) {
                var message = "Entity " + name + ": attribute " + attribute.getKey() + " has "
                + attribute.getValue().length + " values for " + sourceCount + " vertices";
                if (config.strictGeometry()) {
                    throw new SceneGeometryException(name, message);
                }
                warnings.add(message);
                continue;
            }
            scalars.put(attribute.getKey(), compact(attribute.getValue(), remap, valid, 1));
        }

        int stride = 1;
        if (valid > config.vertexThreshold()) {
            stride = (valid + config.vertexThreshold() - 1) / config.vertexThreshold();
            vertexBuffer = stride(vertexBuffer, 3, stride);
            normals = stride(normals, 3, stride);
            for (var attribute : scalars.entrySet()) {
                attribute.setValue(stride(attribute.getValue(), 1, stride));
            }
            var remapped = new IntArrayList(triangleBuffer.length);
            int collapsed = 0;
            for (int t = 0; t < triangleBuffer.length; t += 3) {
                int a = triangleBuffer[t] / stride;
                int b = triangleBuffer[t + 1] / stride;
                int c = triangleBuffer[t + 2] / stride;
                if (a == b || b == c || a == c) {
                    collapsed++;
                    continue;
                }
                remapped.addInt(a);
                remapped.addInt(b);
                remapped.addInt(c);
            }
            triangleBuffer = remapped.toArray();
            droppedFaces += collapsed;
            log.info("Entity {}: downsampled {} -> {} vertices (stride {}), {} triangles collapsed", name, valid,
                     vertexBuffer.length / 3, stride, collapsed);
        }

        int vertexCount = vertexBuffer.length / 3;
        var material = mesh.material() == null ? name : mesh.material();
        Color3f color = palette.colorFor(material);
        var colors = new float[vertexCount * 3];
        for (int i = 0; i < vertexCount; i++) {
            colors[3 * i] = color.x;
            colors[3 * i + 1] = color.y;
            colors[3 * i + 2] = color.z;
        }

        var bounds = bounds(vertexBuffer);
        var metadata = new EntityMetadata(vertexCount, triangleBuffer.length / 3, sourceCount, droppedVertices,
                                          droppedFaces, stride, bounds, lod(vertexCount, bounds));
        return new SceneEntity(name, material, color, vertexBuffer, normals, colors, triangleBuffer, scalars,
                               metadata);
    }
}
