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

import com.hellblazer.lithos.common.Bounds3d;

import javax.vecmath.Point3d;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable, ordered collection of samples and the material layer table they reference. Sample ids are unique.
 *
 * @author hal.hildebrand
 */
public final class SampleStore {
    private final List<Sample>                samples;
    private final Map<Integer, MaterialLayer> layers;

    private SampleStore(List<Sample> samples, Map<Integer, MaterialLayer> layers) {
        this.samples = samples;
        this.layers = layers;
    }

    /**
     * @throws IllegalArgumentException on duplicate sample ids or duplicate layer ids
     */
    public static SampleStore of(List<Sample> samples, List<MaterialLayer> layers) {
        Objects.requireNonNull(samples, "samples cannot be null");
        var ids = new HashSet<String>();
        for (var sample : samples) {
            Objects.requireNonNull(sample, "samples cannot contain null");
            if (!ids.add(sample.id())) {
                throw new IllegalArgumentException("Duplicate sample id: " + sample.id());
            }
        }
        var table = new LinkedHashMap<Integer, MaterialLayer>();
        if (layers != null) {
            for (var layer : layers) {
                if (table.put(layer.layerId(), layer) != null) {
                    throw new IllegalArgumentException("Duplicate layer id: " + layer.layerId());
                }
            }
        }
        return new SampleStore(List.copyOf(samples), Collections.unmodifiableMap(table));
    }

    public static SampleStore of(List<Sample> samples) {
        return of(samples, List.of());
    }

    /**
     * Bounds of the samples with finite coordinates
     */
    public Bounds3d bounds() {
        var points = new ArrayList<Point3d>(samples.size());
        for (var sample : samples) {
            points.add(new Point3d(sample.x(), sample.y(), sample.z()));
        }
        return Bounds3d.of(points);
    }

    public boolean isEmpty() {
        return samples.isEmpty();
    }

    public Optional<MaterialLayer> layer(int layerId) {
        return Optional.ofNullable(layers.get(layerId));
    }

    public Map<Integer, MaterialLayer> layers() {
        return layers;
    }

    public List<Sample> samples() {
        return samples;
    }

    public int size() {
        return samples.size();
    }

    /**
     * @return the attribute value of every sample, in store order; NaN where a sample has no value
     */
    public double[] values(SampleAttribute attribute) {
        var values = new double[samples.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = attribute.extract(samples.get(i), this);
        }
        return values;
    }

    /**
     * A store with the same layer table and the given samples
     */
    public SampleStore withSamples(List<Sample> replacement) {
        return of(replacement, List.copyOf(layers.values()));
    }
}
