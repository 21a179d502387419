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

import java.util.Objects;

/**
 * Configuration for scene export.
 *
 * <p>Thread-safe and immutable after construction.
 *
 * @author hal.hildebrand
 */
public final class SceneExportConfiguration {

    /** Default vertex count above which an entity is downsampled */
    public static final int DEFAULT_VERTEX_THRESHOLD = 65_536;

    /** Default LOD distance thresholds, as multiples of the entity's bounding box diagonal */
    public static final double HIGH_DISTANCE_FACTOR   = 1.0;
    public static final double MEDIUM_DISTANCE_FACTOR = 3.0;
    public static final double LOW_DISTANCE_FACTOR    = 8.0;

    /** Default buffer length above which numeric buffers are compressed when compression is enabled */
    public static final int DEFAULT_COMPRESSION_THRESHOLD = 100;

    /** Default colormap suggested to renderers for scalar attributes */
    public static final String DEFAULT_COLORMAP_HINT = "viridis";

    private final int     vertexThreshold;
    private final boolean strictGeometry;
    private final boolean compressBuffers;
    private final int     compressionThreshold;
    private final String  colormapHint;

    /**
     * @param vertexThreshold      downsample entities with more vertices than this
     * @param strictGeometry       fail on faces that reference invalid vertices instead of dropping them
     * @param compressBuffers      compress large buffers when writing documents
     * @param compressionThreshold minimum buffer length that is compressed
     */
    public SceneExportConfiguration(int vertexThreshold, boolean strictGeometry, boolean compressBuffers,
                                    int compressionThreshold) {
        this(vertexThreshold, strictGeometry, compressBuffers, compressionThreshold, DEFAULT_COLORMAP_HINT);
    }

    /**
     * @param colormapHint colormap renderers should apply to the scalar attributes
     */
    public SceneExportConfiguration(int vertexThreshold, boolean strictGeometry, boolean compressBuffers,
                                    int compressionThreshold, String colormapHint) {
        if (vertexThreshold < 3) {
            throw new IllegalArgumentException("vertexThreshold must be at least 3: " + vertexThreshold);
        }
        if (compressionThreshold < 0) {
            throw new IllegalArgumentException("compressionThreshold must be non-negative: " + compressionThreshold);
        }
        this.vertexThreshold = vertexThreshold;
        this.strictGeometry = strictGeometry;
        this.compressBuffers = compressBuffers;
        this.compressionThreshold = compressionThreshold;
        this.colormapHint = Objects.requireNonNull(colormapHint, "colormapHint cannot be null");
    }

    public static SceneExportConfiguration defaultConfig() {
        return new SceneExportConfiguration(DEFAULT_VERTEX_THRESHOLD, true, false, DEFAULT_COMPRESSION_THRESHOLD);
    }

    public String colormapHint() {
        return colormapHint;
    }

    public boolean compressBuffers() {
        return compressBuffers;
    }

    public int compressionThreshold() {
        return compressionThreshold;
    }

    public boolean strictGeometry() {
        return strictGeometry;
    }

    public int vertexThreshold() {
        return vertexThreshold;
    }

    public SceneExportConfiguration withCompression(boolean compressBuffers) {
        return new SceneExportConfiguration(vertexThreshold, strictGeometry, compressBuffers, compressionThreshold,
                                            colormapHint);
    }

    public SceneExportConfiguration withStrictGeometry(boolean strictGeometry) {
        return new SceneExportConfiguration(vertexThreshold, strictGeometry, compressBuffers, compressionThreshold,
                                            colormapHint);
    }

    public SceneExportConfiguration withVertexThreshold(int vertexThreshold) {
        return new SceneExportConfiguration(vertexThreshold, strictGeometry, compressBuffers, compressionThreshold,
                                            colormapHint);
    }

    @Override
    public String toString() {
        return String.format("SceneExportConfiguration[vertexThreshold=%d, strict=%s, compress=%s, threshold=%d]",
                             vertexThreshold, strictGeometry, compressBuffers, compressionThreshold,
                                            colormapHint);
    }
}
