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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Color3f;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Deterministic mapping from material names to colors.
 *
 * <p>Lookup order:
 * <ol>
 *   <li>the normalized name equals a palette keyword</li>
 *   <li>the normalized name contains a palette keyword (longest keyword wins)</li>
 *   <li>a color derived from the FNV-1a hash of the normalized name</li>
 * </ol>
 * The derived colors depend only on the name, so unknown materials keep the same color across runs and processes.
 * Instances are immutable.
 *
 * @author hal.hildebrand
 */
public final class MaterialPalette {
    public static final  String DEFAULT_RESOURCE = "/material-palette.json";
    private static final Logger log              = LoggerFactory.getLogger(MaterialPalette.class);
    private static final int    FNV_OFFSET       = 0x811c9dc5;
    private static final int    FNV_PRIME        = 0x01000193;

    private static volatile MaterialPalette defaultPalette;

    private final Map<String, Color3f> keywords;
    private final List<String>         byLength;

    public MaterialPalette(Map<String, Color3f> keywords) {
        Objects.requireNonNull(keywords, "keywords cannot be null");
        var normalized = new LinkedHashMap<String, Color3f>();
        keywords.forEach((k, v) -> normalized.put(normalize(k), new Color3f(v)));
        this.keywords = Collections.unmodifiableMap(normalized);
        var ordered = new ArrayList<>(normalized.keySet());
        ordered.sort(Comparator.<String>comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()));
        this.byLength = Collections.unmodifiableList(ordered);
    }

    /**
     * The palette bundled on the classpath, loaded once
     */
    public static MaterialPalette defaultPalette() {
        var palette = defaultPalette;
        if (palette == null) {
            synchronized (MaterialPalette.class) {
                palette = defaultPalette;
                if (palette == null) {
                    palette = load(DEFAULT_RESOURCE);
                    defaultPalette = palette;
                }
            }
        }
        return palette;
    }

    /**
     * Load a keyword palette from a classpath JSON resource of the form {@code {"keywords": {"sand": [r, g, b]}}}.
     *
     * @throws IllegalStateException if the resource is missing or malformed
     */
    public static MaterialPalette load(String resource) {
        try (InputStream is = MaterialPalette.class.getResourceAsStream(resource)) {
            if (is == null) {
                throw new IllegalStateException("Palette resource not found: " + resource);
            }
            var root = new ObjectMapper().readTree(is);
            var entries = root.get("keywords");
            if (entries == null || !entries.isObject()) {
                throw new IllegalStateException("Invalid palette format, missing keywords object: " + resource);
            }
            var keywords = new LinkedHashMap<String, Color3f>();
            var fields = entries.fields();
            while (fields.hasNext()) {
                var field = fields.next();
                keywords.put(field.getKey(), parseColor(field.getKey(), field.getValue()));
            }
            log.debug("Loaded {} palette keywords from {}", keywords.size(), resource);
            return new MaterialPalette(keywords);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load palette " + resource + ": " + e.getMessage(), e);
        }
    }

    /**
     * Derive a color from the hash of a name. Hue spans the full circle; saturation and value stay in a band that
     * remains readable on both light and dark backgrounds.
     */
    static Color3f hashColor(String normalizedName) {
        int hash = fnv1a(normalizedName);
        float hue = (hash & 0xffff) / 65536f;
        float saturation = 0.45f + ((hash >>> 16) & 0xff) / 255f * 0.35f;
        float value = 0.65f + ((hash >>> 24) & 0xff) / 255f * 0.3f;
        return hsvToRgb(hue, saturation, value);
    }

    static int fnv1a(String s) {
        int hash = FNV_OFFSET;
        for (byte b : s.getBytes(StandardCharsets.UTF_8)) {
            hash ^= (b & 0xff);
            hash *= FNV_PRIME;
        }
        return hash;
    }

    static Color3f hsvToRgb(float h, float s, float v) {
        float sector = (h * 6f) % 6f;
        int i = (int) Math.floor(sector);
        float f = sector - i;
        float p = v * (1 - s);
        float q = v * (1 - s * f);
        float t = v * (1 - s * (1 - f));
        return switch (i) {
            case 0 -> new Color3f(v, t, p);
            case 1 -> new Color3f(q, v, p);
            case 2 -> new Color3f(p, v, t);
            case 3 -> new Color3f(p, q, v);
            case 4 -> new Color3f(t, p, v);
            default -> new Color3f(v, p, q);
        };
    }

    static String normalize(String name) {
        return name == null ? "" : name.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    }

    private static Color3f parseColor(String key, JsonNode node) {
        if (node == null || !node.isArray() || node.size() != 3) {
            throw new IllegalStateException("Palette color for " + key + " must be an [r, g, b] array");
        }
        float[] rgb = new float[3];
        for (int i = 0; i < 3; i++) {
            double c = node.get(i).asDouble(Double.NaN);
            if (!(c >= 0 && c <= 1)) {
                throw new IllegalStateException("Palette color component out of [0, 1] for " + key + ": " + c);
            }
            rgb[i] = (float) c;
        }
        return new Color3f(rgb);
    }

    /**
     * @return the color for the material, never null. A null or blank name maps to the hash color of the empty string.
     */
    public Color3f colorFor(String materialName) {
        var name = normalize(materialName);
        var exact = keywords.get(name);
        if (exact != null) {
            return new Color3f(exact);
        }
        for (var keyword : byLength) {
            if (!keyword.isEmpty() && name.contains(keyword)) {
                return new Color3f(keywords.get(keyword));
            }
        }
        return hashColor(name);
    }

    public boolean hasKeyword(String keyword) {
        return keywords.containsKey(normalize(keyword));
    }

    public int size() {
        return keywords.size();
    }
}
