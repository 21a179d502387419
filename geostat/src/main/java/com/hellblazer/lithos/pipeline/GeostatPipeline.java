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

import com.hellblazer.lithos.recovery.ErrorCatalog;
import com.hellblazer.lithos.sample.SampleStore;
import com.hellblazer.lithos.scene.MaterialPalette;
import com.hellblazer.lithos.validation.CrossValidator;
import com.hellblazer.lithos.variogram.SpatialStructureAnalyzer;
import com.hellblazer.lithos.variogram.VariogramFitter;

import java.util.Objects;

/**
 * Entry point of the reconstruction pipeline: samples in, scene out. The pipeline holds only immutable collaborators,
 * so one instance may serve concurrent runs; every run owns its own state and recovery budget.
 *
 * <pre>
 * var result = new GeostatPipeline().run(store, PipelineConfiguration.fromJson(options));
 * result.scene().ifPresent(scene -> render(scene.toDocument()));
 * result.diagnostics().forEach(notice -> show(notice.humanMessage()));
 * </pre>
 *
 * @author hal.hildebrand
 */
public class GeostatPipeline {
    private final ErrorCatalog             catalog;
    private final MaterialPalette          palette;
    private final SpatialStructureAnalyzer analyzer;
    private final VariogramFitter          fitter;
    private final CrossValidator           crossValidator;
    private final FieldSurfaceExtractor    extractor;

    public GeostatPipeline() {
        this(ErrorCatalog.defaultCatalog(), MaterialPalette.defaultPalette());
    }

    public GeostatPipeline(ErrorCatalog catalog, MaterialPalette palette) {
        this.catalog = Objects.requireNonNull(catalog, "catalog cannot be null");
        this.palette = Objects.requireNonNull(palette, "palette cannot be null");
        this.analyzer = new SpatialStructureAnalyzer();
        this.fitter = new VariogramFitter();
        this.crossValidator = new CrossValidator();
        this.extractor = new FieldSurfaceExtractor();
    }

    SpatialStructureAnalyzer analyzer() {
        return analyzer;
    }

    public ErrorCatalog catalog() {
        return catalog;
    }

    CrossValidator crossValidator() {
        return crossValidator;
    }

    FieldSurfaceExtractor extractor() {
        return extractor;
    }

    VariogramFitter fitter() {
        return fitter;
    }

    /**
     * Prepare a run that can be cancelled between stages from another thread
     */
    public PipelineRun newRun(SampleStore store, PipelineConfiguration configuration) {
        return new PipelineRun(this, store, configuration);
    }

    public MaterialPalette palette() {
        return palette;
    }

    /**
     * Run all stages to completion
     */
    public PipelineResult run(SampleStore store, PipelineConfiguration configuration) {
        return newRun(store, configuration).execute();
    }
}
