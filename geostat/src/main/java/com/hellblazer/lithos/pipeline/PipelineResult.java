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

import com.hellblazer.lithos.kriging.InterpolatedField;
import com.hellblazer.lithos.recovery.ErrorContext;
import com.hellblazer.lithos.recovery.Severity;
import com.hellblazer.lithos.sample.Observations;
import com.hellblazer.lithos.sample.QualityReport;
import com.hellblazer.lithos.scene.SceneMesh;
import com.hellblazer.lithos.validation.UncertaintyReport;
import com.hellblazer.lithos.variogram.EmpiricalVariogram;
import com.hellblazer.lithos.variogram.SpatialStructureModel;
import com.hellblazer.lithos.variogram.VariogramFit;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Everything one run produced. A successful run carries the scene; a failed run carries whatever the stages before
 * the failure produced, unchanged, and the diagnostics explain what was attempted. Diagnostics are in the order they
 * were raised.
 *
 * @author hal.hildebrand
 */
public final class PipelineResult {
    private final boolean                        successful;
    private final QualityReport                  quality;
    private final Observations                   observations;
    private final EmpiricalVariogram             empiricalVariogram;
    private final VariogramFit                   variogramFit;
    private final SpatialStructureModel          model;
    private final InterpolatedField              field;
    private final UncertaintyReport              uncertainty;
    private final Map<String, InterpolatedField> surfaces;
    private final SceneMesh                      scene;
    private final List<ErrorContext>             diagnostics;
    private final PipelineConfiguration          configuration;
    private final Duration                       elapsed;

    private PipelineResult(Builder builder) {
        this.scene = builder.scene;
        this.successful = builder.scene != null;
        this.quality = builder.quality;
        this.observations = builder.observations;
        this.empiricalVariogram = builder.empiricalVariogram;
        this.variogramFit = builder.variogramFit;
        this.model = builder.model;
        this.field = builder.field;
        this.uncertainty = builder.uncertainty;
        this.surfaces = Collections.unmodifiableMap(new TreeMap<>(builder.surfaces));
        this.diagnostics = List.copyOf(builder.diagnostics);
        this.configuration = builder.configuration;
        this.elapsed = builder.elapsed;
    }

    static Builder builder() {
        return new Builder();
    }

    /**
     * True if any diagnostic reports an automatic fix
     */
    public boolean autoFixed() {
        return diagnostics.stream().anyMatch(ErrorContext::autoFixed);
    }

    /**
     * The configuration in effect at the end of the run, including every automatic adjustment
     */
    public PipelineConfiguration configuration() {
        return configuration;
    }

    public List<ErrorContext> diagnostics() {
        return diagnostics;
    }

    public Duration elapsed() {
        return elapsed;
    }

    public Optional<EmpiricalVariogram> empiricalVariogram() {
        return Optional.ofNullable(empiricalVariogram);
    }

    /**
     * The error that ended a failed run
     */
    public Optional<ErrorContext> failure() {
        if (successful || diagnostics.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(diagnostics.get(diagnostics.size() - 1));
    }

    public Optional<InterpolatedField> field() {
        return Optional.ofNullable(field);
    }

    public boolean isSuccessful() {
        return successful;
    }

    /**
     * The model the field was estimated with, after any nugget adjustment
     */
    public Optional<SpatialStructureModel> model() {
        return Optional.ofNullable(model);
    }

    public Optional<Observations> observations() {
        return Optional.ofNullable(observations);
    }

    public Optional<QualityReport> quality() {
        return Optional.ofNullable(quality);
    }

    public Optional<SceneMesh> scene() {
        return Optional.ofNullable(scene);
    }

    /**
     * Interface surfaces by material tag
     */
    public Map<String, InterpolatedField> surfaces() {
        return surfaces;
    }

    public Map<String, Object> toMap() {
        var map = new LinkedHashMap<String, Object>();
        map.put("status", successful ? "success" : "failed");
        map.put("auto_fixed", autoFixed());
        var contexts = new ArrayList<Map<String, Object>>();
        diagnostics.forEach(d -> contexts.add(d.toMap()));
        map.put("diagnostics", contexts);
        map.put("quality", quality == null ? null : quality.toMap());
        map.put("uncertainty", uncertainty == null ? null : uncertainty.toMap());
        if (field != null) {
            var summary = new LinkedHashMap<String, Object>();
            summary.put("method", field.method().key());
            summary.put("grid", field.grid().toMap());
            summary.put("min", field.min());
            summary.put("max", field.max());
            summary.put("mean", field.mean());
            summary.put("max_variance", field.maxVariance());
            map.put("field", summary);
        }
        map.put("surfaces", List.copyOf(surfaces.keySet()));
        map.put("scene_statistics", scene == null ? null : scene.statistics().toMap());
        map.put("colormap_hint", configuration.colormapHint());
        map.put("configuration", configuration.toMap());
        map.put("elapsed_ms", elapsed.toMillis());
        return map;
    }

    public Optional<UncertaintyReport> uncertainty() {
        return Optional.ofNullable(uncertainty);
    }

    public Optional<VariogramFit> variogramFit() {
        return Optional.ofNullable(variogramFit);
    }

    /**
     * Diagnostics at warning severity or above
     */
    public List<ErrorContext> warnings() {
        return diagnostics.stream().filter(d -> d.severity().compareTo(Severity.WARNING) >= 0).toList();
    }

    static class Builder {
        private final Map<String, InterpolatedField> surfaces    = new TreeMap<>();
        private final List<ErrorContext>             diagnostics = new ArrayList<>();
        private       QualityReport                  quality;
        private       Observations                   observations;
        private       EmpiricalVariogram             empiricalVariogram;
        private       VariogramFit                   variogramFit;
        private       SpatialStructureModel          model;
        private       InterpolatedField              field;
        private       UncertaintyReport              uncertainty;
        private       SceneMesh                      scene;
        private       PipelineConfiguration          configuration;
        private       Duration                       elapsed     = Duration.ZERO;

        PipelineResult build() {
            return new PipelineResult(this);
        }

        Builder configuration(PipelineConfiguration configuration) {
            this.configuration = configuration;
            return this;
        }

        Builder diagnostic(ErrorContext context) {
            diagnostics.add(context);
            return this;
        }

        Builder diagnostics(List<ErrorContext> contexts) {
            diagnostics.addAll(contexts);
            return this;
        }

        Builder elapsed(Duration elapsed) {
            this.elapsed = elapsed;
            return this;
        }

        Builder empiricalVariogram(EmpiricalVariogram empirical) {
            this.empiricalVariogram = empirical;
            return this;
        }

        Builder field(InterpolatedField field, SpatialStructureModel model) {
            this.field = field;
            this.model = model;
            return this;
        }

        Builder observations(Observations observations) {
            this.observations = observations;
            return this;
        }

        Builder quality(QualityReport quality) {
            this.quality = quality;
            return this;
        }

        Builder scene(SceneMesh scene) {
            this.scene = scene;
            return this;
        }

        Builder surface(String tag, InterpolatedField surface) {
            surfaces.put(tag, surface);
            return this;
        }

        Builder uncertainty(UncertaintyReport uncertainty) {
            this.uncertainty = uncertainty;
            return this;
        }

        Builder variogramFit(VariogramFit fit) {
            this.variogramFit = fit;
            return this;
        }
    }
}
