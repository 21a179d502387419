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

import java.util.Locale;
import java.util.Objects;

/**
 * The scalar quantity interpolated from the samples.
 *
 * @author hal.hildebrand
 */
public final class SampleAttribute {
    public static final SampleAttribute ELEVATION = new SampleAttribute(Kind.ELEVATION, null);
    public static final SampleAttribute LAYER_ID  = new SampleAttribute(Kind.LAYER_ID, null);

    private static final String PROPERTY_PREFIX = "property:";

    private final Kind   kind;
    private final String property;

    private SampleAttribute(Kind kind, String property) {
        this.kind = kind;
        this.property = property;
    }

    /**
     * A property of the sample's material layer, e.g. {@code density}
     */
    public static SampleAttribute layerProperty(String property) {
        Objects.requireNonNull(property, "property cannot be null");
        if (property.isBlank()) {
            throw new IllegalArgumentException("property cannot be blank");
        }
        return new SampleAttribute(Kind.LAYER_PROPERTY, property);
    }

    /**
     * Parse {@code elevation}, {@code layer_id} or {@code property:<name>}
     */
    public static SampleAttribute parse(String text) {
        Objects.requireNonNull(text, "attribute cannot be null");
        var normalized = text.trim();
        if (normalized.toLowerCase(Locale.ROOT).startsWith(PROPERTY_PREFIX)) {
            return layerProperty(normalized.substring(PROPERTY_PREFIX.length()).trim());
        }
        return switch (normalized.toLowerCase(Locale.ROOT)) {
            case "elevation", "z" -> ELEVATION;
            case "layer_id", "layer" -> LAYER_ID;
            default -> throw new IllegalArgumentException("Unknown sample attribute: " + text);
        };
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SampleAttribute other)) {
            return false;
        }
        return kind == other.kind && Objects.equals(property, other.property);
    }

    /**
     * @return the attribute value, or NaN when the sample has no value for it
     */
    public double extract(Sample sample, SampleStore store) {
        return switch (kind) {
            case ELEVATION -> sample.z();
            case LAYER_ID -> sample.layerId() == null ? Double.NaN : sample.layerId();
            case LAYER_PROPERTY -> {
                if (sample.layerId() == null) {
                    yield Double.NaN;
                }
                yield store.layer(sample.layerId())
                           .map(layer -> layer.property(property).orElse(Double.NaN))
                           .orElse(Double.NaN);
            }
        };
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, property);
    }

    public boolean isElevation() {
        return kind == Kind.ELEVATION;
    }

    public String key() {
        return switch (kind) {
            case ELEVATION -> "elevation";
            case LAYER_ID -> "layer_id";
            case LAYER_PROPERTY -> PROPERTY_PREFIX + property;
        };
    }

    @Override
    public String toString() {
        return key();
    }

    private enum Kind {
        ELEVATION, LAYER_ID, LAYER_PROPERTY
    }
}
