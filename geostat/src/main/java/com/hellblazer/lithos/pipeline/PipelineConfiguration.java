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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.hellblazer.lithos.kriging.DomainBuilder;
import com.hellblazer.lithos.kriging.DomainExtension;
import com.hellblazer.lithos.kriging.GridDefinition;
import com.hellblazer.lithos.kriging.KrigingEngine;
import com.hellblazer.lithos.kriging.KrigingVariant;
import com.hellblazer.lithos.sample.SampleAttribute;
import com.hellblazer.lithos.scene.SceneExportConfiguration;
import com.hellblazer.lithos.variogram.SpatialStructureAnalyzer;
import com.hellblazer.lithos.variogram.VariogramKind;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration of one pipeline run. Immutable; the recovery layer derives adjusted copies through the {@code withX}
 * methods and never mutates the caller's instance.
 *
 * <p>The public options are read from a mapping by {@link #fromMap(Map)}: unrecognized keys are ignored and missing
 * keys take the documented defaults. The remaining settings are switched on by recovery strategies.
 *
 * @author hal.hildebrand
 */
public final class PipelineConfiguration {
    public static final double          DEFAULT_GRID_RESOLUTION       = 10.0;
    public static final KrigingVariant  DEFAULT_KRIGING_VARIANT       = KrigingVariant.ORDINARY;
    public static final VariogramKind   DEFAULT_VARIOGRAM_MODEL       = VariogramKind.SPHERICAL;
    public static final String          DEFAULT_COLORMAP_HINT         = SceneExportConfiguration.DEFAULT_COLORMAP_HINT;
    public static final int             DEFAULT_DIMENSION             = 2;
    public static final DomainExtension DEFAULT_DOMAIN_EXTENSION      = DomainExtension.MARGIN;
    public static final double          DEFAULT_FOUNDATION_MULTIPLIER = 3.0;
    public static final double          DEFAULT_DUPLICATE_TOLERANCE   = 1e-9;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final double           gridResolution;
    private final double[]         domainExpansion;
    private final KrigingVariant   krigingVariant;
    private final VariogramKind    variogramModel;
    private final boolean          autoFitVariogram;
    private final String           colormapHint;
    private final boolean          runUncertaintyAnalysis;
    private final int              dimension;
    private final int              binCount;
    private final Double           maxLag;
    private final Double           verticalResolution;
    private final DomainExtension  domainExtension;
    private final double           foundationMultiplier;
    private final Duration         krigingTimeout;
    private final long             maxGridNodes;
    private final int              lodVertexThreshold;
    private final boolean          allowSyntheticSamples;
    private final boolean          interfaceSurfaces;
    private final double           duplicateTolerance;
    private final SampleAttribute  attribute;
    private final GridDefinition   grid;
    private final boolean          mergeDuplicates;
    private final boolean          dropInvalidSamples;
    private final boolean          synthesizeSamples;
    private final boolean          extendMaxLag;
    private final double           nuggetFraction;
    private final boolean          inverseDistance;
    private final boolean          strictGeometry;

    private PipelineConfiguration(Builder builder) {
        if (!(builder.gridResolution > 0) || !Double.isFinite(builder.gridResolution)) {
            throw new IllegalArgumentException("grid_resolution must be positive: " + builder.gridResolution);
        }
        var margins = builder.domainExpansion;
        if (margins != null && (margins.length != 2 || !(margins[0] >= 0) || !(margins[1] >= 0))) {
            throw new IllegalArgumentException("domain_expansion must be two non-negative margins");
        }
        if (builder.dimension != 2 && builder.dimension != 3) {
            throw new IllegalArgumentException("dimension must be 2 or 3: " + builder.dimension);
        }
        if (builder.binCount < 3) {
            throw new IllegalArgumentException("bin_count must be at least 3: " + builder.binCount);
        }
        if (builder.maxLag != null && !(builder.maxLag > 0)) {
            throw new IllegalArgumentException("max_lag must be positive: " + builder.maxLag);
        }
        if (builder.verticalResolution != null && !(builder.verticalResolution > 0)) {
            throw new IllegalArgumentException("vertical_resolution must be positive: " + builder.verticalResolution);
        }
        if (!(builder.foundationMultiplier >= 1)) {
            throw new IllegalArgumentException("foundation_multiplier must be at least 1: "
                                               + builder.foundationMultiplier);
        }
        if (builder.krigingTimeout.isNegative() || builder.krigingTimeout.isZero()) {
            throw new IllegalArgumentException("kriging_timeout_ms must be positive: " + builder.krigingTimeout);
        }
        if (builder.maxGridNodes <= 0) {
            throw new IllegalArgumentException("max_grid_nodes must be positive: " + builder.maxGridNodes);
        }
        if (builder.maxGridNodes > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("max_grid_nodes must be at most " + Integer.MAX_VALUE + ": "
                                               + builder.maxGridNodes);
        }
        if (builder.lodVertexThreshold < 3) {
            throw new IllegalArgumentException("lod_vertex_threshold must be at least 3: " + builder.lodVertexThreshold);
        }
        if (!(builder.duplicateTolerance >= 0)) {
            throw new IllegalArgumentException("duplicate_tolerance must be non-negative: "
                                               + builder.duplicateTolerance);
        }
        if (!(builder.nuggetFraction >= 0) || builder.nuggetFraction > 1) {
            throw new IllegalArgumentException("nugget fraction must be within [0, 1]: " + builder.nuggetFraction);
        }
        this.gridResolution = builder.gridResolution;
        this.domainExpansion = builder.domainExpansion == null ? null : builder.domainExpansion.clone();
        this.krigingVariant = Objects.requireNonNull(builder.krigingVariant, "kriging_variant cannot be null");
        this.variogramModel = Objects.requireNonNull(builder.variogramModel, "variogram_model cannot be null");
        this.autoFitVariogram = builder.autoFitVariogram;
        this.colormapHint = Objects.requireNonNull(builder.colormapHint, "colormap_hint cannot be null");
        this.runUncertaintyAnalysis = builder.runUncertaintyAnalysis;
        this.dimension = builder.dimension;
        this.binCount = builder.binCount;
        this.maxLag = builder.maxLag;
        this.verticalResolution = builder.verticalResolution;
        this.domainExtension = Objects.requireNonNull(builder.domainExtension, "domain_extension cannot be null");
        this.foundationMultiplier = builder.foundationMultiplier;
        this.krigingTimeout = builder.krigingTimeout;
        this.maxGridNodes = builder.maxGridNodes;
        this.lodVertexThreshold = builder.lodVertexThreshold;
        this.allowSyntheticSamples = builder.allowSyntheticSamples;
        this.interfaceSurfaces = builder.interfaceSurfaces;
        this.duplicateTolerance = builder.duplicateTolerance;
        this.attribute = Objects.requireNonNull(builder.attribute, "attribute cannot be null");
        this.grid = builder.grid;
        this.mergeDuplicates = builder.mergeDuplicates;
        this.dropInvalidSamples = builder.dropInvalidSamples;
        this.synthesizeSamples = builder.synthesizeSamples;
        this.extendMaxLag = builder.extendMaxLag;
        this.nuggetFraction = builder.nuggetFraction;
        this.inverseDistance = builder.inverseDistance;
        this.strictGeometry = builder.strictGeometry;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static PipelineConfiguration defaultConfig() {
        return builder().build();
    }

    /**
     * Parse a JSON object of options
     *
     * @throws IllegalArgumentException if the text is not a JSON object or an option has the wrong type
     */
    public static PipelineConfiguration fromJson(String json) {
        Objects.requireNonNull(json, "json cannot be null");
        Map<String, Object> options;
        try {
            options = MAPPER.readValue(json, new TypeReference<Map<String, Object>>() {
            });
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Invalid configuration JSON: " + e.getOriginalMessage(), e);
        }
        return fromMap(options == null ? Map.of() : options);
    }

    /**
     * Read the recognized options from the mapping. Unrecognized keys are ignored; missing keys take defaults.
     *
     * @throws IllegalArgumentException if a recognized option has the wrong type or an invalid value
     */
    public static PipelineConfiguration fromMap(Map<String, ?> options) {
        Objects.requireNonNull(options, "options cannot be null");
        var b = builder();
        for (var entry : options.entrySet()) {
            var key = entry.getKey();
            var value = entry.getValue();
            if (value == null) {
                continue;
            }
            switch (key) {
                case "grid_resolution" -> b.gridResolution(number(key, value));
                case "domain_expansion" -> b.domainExpansion(pair(key, value));
                case "kriging_variant" -> b.krigingVariant(KrigingVariant.parse(text(key, value)));
                case "variogram_model" -> b.variogramModel(VariogramKind.parse(text(key, value)));
                case "auto_fit_variogram" -> b.autoFitVariogram(bool(key, value));
                case "colormap_hint" -> b.colormapHint(text(key, value));
                case "run_uncertainty_analysis" -> b.runUncertaintyAnalysis(bool(key, value));
                case "dimension" -> b.dimension((int) integer(key, value));
                case "bin_count" -> b.binCount((int) integer(key, value));
                case "max_lag" -> b.maxLag(number(key, value));
                case "vertical_resolution" -> b.verticalResolution(number(key, value));
                case "domain_extension_method" -> b.domainExtension(DomainExtension.parse(text(key, value)));
                case "foundation_multiplier" -> b.foundationMultiplier(number(key, value));
                case "kriging_timeout_ms" -> b.krigingTimeout(Duration.ofMillis(integer(key, value)));
                case "max_grid_nodes" -> b.maxGridNodes(integer(key, value));
                case "lod_vertex_threshold" -> b.lodVertexThreshold((int) integer(key, value));
                case "allow_synthetic_samples" -> b.allowSyntheticSamples(bool(key, value));
                case "interface_surfaces" -> b.interfaceSurfaces(bool(key, value));
                case "duplicate_tolerance" -> b.duplicateTolerance(number(key, value));
                case "attribute" -> b.attribute(SampleAttribute.parse(text(key, value)));
                default -> {
                }
            }
        }
        return b.build();
    }

    private static boolean bool(String key, Object value) {
        if (value instanceof Boolean bool) {
            return bool;
        }
        throw new IllegalArgumentException(key + " must be a boolean: " + value);
    }

    private static long integer(String key, Object value) {
        double number = number(key, value);
        if (number != Math.rint(number)) {
            throw new IllegalArgumentException(key + " must be an integer: " + value);
        }
        return (long) number;
    }

    private static double number(String key, Object value) {
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        throw new IllegalArgumentException(key + " must be a number: " + value);
    }

    private static double[] pair(String key, Object value) {
        if (value instanceof List<?> list) {
            if (list.isEmpty()) {
                return null;
            }
            if (list.size() == 2) {
                return new double[] { number(key, list.get(0)), number(key, list.get(1)) };
            }
        }
        if (value instanceof double[] array) {
            return array.length == 0 ? null : array;
        }
        throw new IllegalArgumentException(key + " must be a pair of numbers: " + value);
    }

    private static String text(String key, Object value) {
        if (value instanceof String string) {
            return string;
        }
        throw new IllegalArgumentException(key + " must be a string: " + value);
    }

    public boolean allowSyntheticSamples() {
        return allowSyntheticSamples;
    }

    public SampleAttribute attribute() {
        return attribute;
    }

    public boolean autoFitVariogram() {
        return autoFitVariogram;
    }

    public int binCount() {
        return binCount;
    }

    public String colormapHint() {
        return colormapHint;
    }

    public int dimension() {
        return dimension;
    }

    /**
     * The domain builder for these settings
     */
    public DomainBuilder domainBuilder() {
        return new DomainBuilder(gridResolution, verticalResolution(), domainExpansion, domainExtension,
                                 foundationMultiplier);
    }

    /**
     * @return the explicit horizontal margins, or null for the default margin
     */
    public double[] domainExpansion() {
        return domainExpansion == null ? null : domainExpansion.clone();
    }

    public DomainExtension domainExtension() {
        return domainExtension;
    }

    public boolean dropInvalidSamples() {
        return dropInvalidSamples;
    }

    public double duplicateTolerance() {
        return duplicateTolerance;
    }

    public boolean extendMaxLag() {
        return extendMaxLag;
    }

    public double foundationMultiplier() {
        return foundationMultiplier;
    }

    /**
     * @return the explicit interpolation grid, or null to derive it from the sample bounds
     */
    public GridDefinition grid() {
        return grid;
    }

    public double gridResolution() {
        return gridResolution;
    }

    public boolean interfaceSurfaces() {
        return interfaceSurfaces;
    }

    /**
     * True when inverse distance weighting has been substituted for kriging
     */
    public boolean inverseDistance() {
        return inverseDistance;
    }

    public Duration krigingTimeout() {
        return krigingTimeout;
    }

    public KrigingVariant krigingVariant() {
        return krigingVariant;
    }

    public int lodVertexThreshold() {
        return lodVertexThreshold;
    }

    /**
     * @return the explicit maximum lag, or null for the analyzer's default
     */
    public Double maxLag() {
        return maxLag;
    }

    public long maxGridNodes() {
        return maxGridNodes;
    }

    public boolean mergeDuplicates() {
        return mergeDuplicates;
    }

    /**
     * Minimum nugget as a fraction of the reference sill; zero leaves the fitted nugget alone
     */
    public double nuggetFraction() {
        return nuggetFraction;
    }

    public boolean runUncertaintyAnalysis() {
        return runUncertaintyAnalysis;
    }

    public SceneExportConfiguration sceneConfiguration() {
        return new SceneExportConfiguration(lodVertexThreshold, strictGeometry, false,
                                            SceneExportConfiguration.DEFAULT_COMPRESSION_THRESHOLD, colormapHint);
    }

    public boolean strictGeometry() {
        return strictGeometry;
    }

    public boolean synthesizeSamples() {
        return synthesizeSamples;
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    /**
     * The public options, keyed as {@link #fromMap(Map)} reads them
     */
    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("grid_resolution", gridResolution);
        map.put("domain_expansion",
                domainExpansion == null ? List.of() : List.of(domainExpansion[0], domainExpansion[1]));
        map.put("kriging_variant", krigingVariant.key());
        map.put("variogram_model", variogramModel.key());
        map.put("auto_fit_variogram", autoFitVariogram);
        map.put("colormap_hint", colormapHint);
        map.put("run_uncertainty_analysis", runUncertaintyAnalysis);
        map.put("dimension", dimension);
        map.put("bin_count", binCount);
        map.put("max_lag", maxLag);
        map.put("vertical_resolution", verticalResolution());
        map.put("domain_extension_method", domainExtension.key());
        map.put("foundation_multiplier", foundationMultiplier);
        map.put("kriging_timeout_ms", krigingTimeout.toMillis());
        map.put("max_grid_nodes", maxGridNodes);
        map.put("lod_vertex_threshold", lodVertexThreshold);
        map.put("allow_synthetic_samples", allowSyntheticSamples);
        map.put("interface_surfaces", interfaceSurfaces);
        map.put("duplicate_tolerance", duplicateTolerance);
        map.put("attribute", attribute.key());
        return map;
    }

    @Override
    public String toString() {
        return "PipelineConfiguration" + toMap();
    }

    public VariogramKind variogramModel() {
        return variogramModel;
    }

    /**
     * Vertical grid spacing for 3 dimensional runs; the horizontal resolution unless set explicitly
     */
    public double verticalResolution() {
        return verticalResolution != null ? verticalResolution : gridResolution;
    }

    public PipelineConfiguration withDropInvalidSamples(boolean drop) {
        return toBuilder().dropInvalidSamples(drop).build();
    }

    public PipelineConfiguration withExtendMaxLag(boolean extend) {
        return toBuilder().extendMaxLag(extend).build();
    }

    public PipelineConfiguration withGrid(GridDefinition replacement) {
        return toBuilder().grid(replacement).build();
    }

    public PipelineConfiguration withGridResolution(double resolution) {
        return toBuilder().gridResolution(resolution).build();
    }

    public PipelineConfiguration withInverseDistance(boolean substitute) {
        return toBuilder().inverseDistance(substitute).build();
    }

    public PipelineConfiguration withKrigingVariant(KrigingVariant variant) {
        return toBuilder().krigingVariant(variant).build();
    }

    public PipelineConfiguration withMaxLag(Double lag) {
        return toBuilder().maxLag(lag).build();
    }

    public PipelineConfiguration withMergeDuplicates(boolean merge) {
        return toBuilder().mergeDuplicates(merge).build();
    }

    public PipelineConfiguration withNuggetFraction(double fraction) {
        return toBuilder().nuggetFraction(fraction).build();
    }

    public PipelineConfiguration withStrictGeometry(boolean strict) {
        return toBuilder().strictGeometry(strict).build();
    }

    public PipelineConfiguration withSynthesizeSamples(boolean synthesize) {
        return toBuilder().synthesizeSamples(synthesize).build();
    }

    /**
     * Builder for PipelineConfiguration
     */
    public static class Builder {
        private double          gridResolution         = DEFAULT_GRID_RESOLUTION;
        private double[]        domainExpansion;
        private KrigingVariant  krigingVariant         = DEFAULT_KRIGING_VARIANT;
        private VariogramKind   variogramModel         = DEFAULT_VARIOGRAM_MODEL;
        private boolean         autoFitVariogram       = true;
        private String          colormapHint           = DEFAULT_COLORMAP_HINT;
        private boolean         runUncertaintyAnalysis = true;
        private int             dimension              = DEFAULT_DIMENSION;
        private int             binCount               = SpatialStructureAnalyzer.DEFAULT_BIN_COUNT;
        private Double          maxLag;
        private Double          verticalResolution;
        private DomainExtension domainExtension        = DEFAULT_DOMAIN_EXTENSION;
        private double          foundationMultiplier   = DEFAULT_FOUNDATION_MULTIPLIER;
        private Duration        krigingTimeout         = KrigingEngine.DEFAULT_TIMEOUT;
        private long            maxGridNodes           = KrigingEngine.DEFAULT_MAX_NODES;
        private int             lodVertexThreshold     = SceneExportConfiguration.DEFAULT_VERTEX_THRESHOLD;
        private boolean         allowSyntheticSamples;
        private boolean         interfaceSurfaces;
        private double          duplicateTolerance     = DEFAULT_DUPLICATE_TOLERANCE;
        private SampleAttribute attribute              = SampleAttribute.ELEVATION;
        private GridDefinition  grid;
        private boolean         mergeDuplicates;
        private boolean         dropInvalidSamples;
        private boolean         synthesizeSamples;
        private boolean         extendMaxLag;
        private double          nuggetFraction;
        private boolean         inverseDistance;
        private boolean         strictGeometry         = true;

        private Builder() {
        }

        private Builder(PipelineConfiguration c) {
            gridResolution = c.gridResolution;
            domainExpansion = c.domainExpansion;
            krigingVariant = c.krigingVariant;
            variogramModel = c.variogramModel;
            autoFitVariogram = c.autoFitVariogram;
            colormapHint = c.colormapHint;
            runUncertaintyAnalysis = c.runUncertaintyAnalysis;
            dimension = c.dimension;
            binCount = c.binCount;
            maxLag = c.maxLag;
            verticalResolution = c.verticalResolution;
            domainExtension = c.domainExtension;
            foundationMultiplier = c.foundationMultiplier;
            krigingTimeout = c.krigingTimeout;
            maxGridNodes = c.maxGridNodes;
            lodVertexThreshold = c.lodVertexThreshold;
            allowSyntheticSamples = c.allowSyntheticSamples;
            interfaceSurfaces = c.interfaceSurfaces;
            duplicateTolerance = c.duplicateTolerance;
            attribute = c.attribute;
            grid = c.grid;
            mergeDuplicates = c.mergeDuplicates;
            dropInvalidSamples = c.dropInvalidSamples;
            synthesizeSamples = c.synthesizeSamples;
            extendMaxLag = c.extendMaxLag;
            nuggetFraction = c.nuggetFraction;
            inverseDistance = c.inverseDistance;
            strictGeometry = c.strictGeometry;
        }

        public Builder allowSyntheticSamples(boolean allow) {
            this.allowSyntheticSamples = allow;
            return this;
        }

        public Builder attribute(SampleAttribute attribute) {
            this.attribute = attribute;
            return this;
        }

        public Builder autoFitVariogram(boolean autoFit) {
            this.autoFitVariogram = autoFit;
            return this;
        }

        public Builder binCount(int binCount) {
            this.binCount = binCount;
            return this;
        }

        public PipelineConfiguration build() {
            return new PipelineConfiguration(this);
        }

        public Builder colormapHint(String hint) {
            this.colormapHint = hint;
            return this;
        }

        public Builder dimension(int dimension) {
            this.dimension = dimension;
            return this;
        }

        public Builder domainExpansion(double[] margins) {
            this.domainExpansion = margins == null ? null : margins.clone();
            return this;
        }

        public Builder domainExtension(DomainExtension extension) {
            this.domainExtension = extension;
            return this;
        }

        public Builder dropInvalidSamples(boolean drop) {
            this.dropInvalidSamples = drop;
            return this;
        }

        public Builder duplicateTolerance(double tolerance) {
            this.duplicateTolerance = tolerance;
            return this;
        }

        public Builder extendMaxLag(boolean extend) {
            this.extendMaxLag = extend;
            return this;
        }

        public Builder foundationMultiplier(double multiplier) {
            this.foundationMultiplier = multiplier;
            return this;
        }

        public Builder grid(GridDefinition grid) {
            this.grid = grid;
            return this;
        }

        public Builder gridResolution(double resolution) {
            this.gridResolution = resolution;
            return this;
        }

        public Builder interfaceSurfaces(boolean enable) {
            this.interfaceSurfaces = enable;
            return this;
        }

        public Builder inverseDistance(boolean substitute) {
            this.inverseDistance = substitute;
            return this;
        }

        public Builder krigingTimeout(Duration timeout) {
            this.krigingTimeout = Objects.requireNonNull(timeout, "timeout cannot be null");
            return this;
        }

        public Builder krigingVariant(KrigingVariant variant) {
            this.krigingVariant = variant;
            return this;
        }

        public Builder lodVertexThreshold(int threshold) {
            this.lodVertexThreshold = threshold;
            return this;
        }

        public Builder maxGridNodes(long maxNodes) {
            this.maxGridNodes = maxNodes;
            return this;
        }

        public Builder maxLag(Double maxLag) {
            this.maxLag = maxLag;
            return this;
        }

        public Builder mergeDuplicates(boolean merge) {
            this.mergeDuplicates = merge;
            return this;
        }

        public Builder nuggetFraction(double fraction) {
            this.nuggetFraction = fraction;
            return this;
        }

        public Builder runUncertaintyAnalysis(boolean run) {
            this.runUncertaintyAnalysis = run;
            return this;
        }

        public Builder strictGeometry(boolean strict) {
            this.strictGeometry = strict;
            return this;
        }

        public Builder synthesizeSamples(boolean synthesize) {
            this.synthesizeSamples = synthesize;
            return this;
        }

        public Builder variogramModel(VariogramKind kind) {
            this.variogramModel = kind;
            return this;
        }

        public Builder verticalResolution(Double resolution) {
            this.verticalResolution = resolution;
            return this;
        }
    }
}
