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

import com.hellblazer.lithos.exceptions.DuplicateCoordinatesException;
import com.hellblazer.lithos.exceptions.GeostatException;
import com.hellblazer.lithos.exceptions.GridTooLargeException;
import com.hellblazer.lithos.exceptions.InsufficientDataException;
import com.hellblazer.lithos.exceptions.InvalidCoordinatesException;
import com.hellblazer.lithos.kriging.GridDefinition;
import com.hellblazer.lithos.kriging.InterpolatedField;
import com.hellblazer.lithos.kriging.Interpolator;
import com.hellblazer.lithos.kriging.InverseDistanceInterpolator;
import com.hellblazer.lithos.kriging.KrigingEngine;
import com.hellblazer.lithos.recovery.ErrorContext;
import com.hellblazer.lithos.recovery.ErrorKind;
import com.hellblazer.lithos.recovery.RecoveryBudget;
import com.hellblazer.lithos.recovery.Severity;
import com.hellblazer.lithos.recovery.Stage;
import com.hellblazer.lithos.recovery.StageRunner;
import com.hellblazer.lithos.sample.Observations;
import com.hellblazer.lithos.sample.Sample;
import com.hellblazer.lithos.sample.SampleAttribute;
import com.hellblazer.lithos.sample.SampleQualityInspector;
import com.hellblazer.lithos.sample.SampleStore;
import com.hellblazer.lithos.sample.SyntheticSampleGenerator;
import com.hellblazer.lithos.scene.LabeledMesh;
import com.hellblazer.lithos.scene.SceneGeometryException;
import com.hellblazer.lithos.scene.SceneMesh;
import com.hellblazer.lithos.scene.SceneMeshBuilder;
import com.hellblazer.lithos.validation.CrossValidationReport;
import com.hellblazer.lithos.validation.FoldPredictor;
import com.hellblazer.lithos.validation.UncertaintyReport;
import com.hellblazer.lithos.variogram.EmpiricalVariogram;
import com.hellblazer.lithos.variogram.SpatialStructureModel;
import com.hellblazer.lithos.variogram.VariogramFit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One execution of the pipeline over one sample store. Stages run in order, each to completion: validation,
 * variogram, interpolation, cross validation, interface surfaces and export. A stage that fails after recovery ends
 * the run; the outputs of the stages before it are kept in the result. Cancellation is cooperative and only takes
 * effect between stages.
 *
 * @author hal.hildebrand
 */
public class PipelineRun {
    public static final String VALIDATION         = "validation";
    public static final String VARIOGRAM          = "variogram";
    public static final String INTERPOLATION      = "interpolation";
    public static final String CROSS_VALIDATION   = "cross_validation";
    public static final String INTERFACE_SURFACES = "interface_surfaces";
    public static final String EXPORT             = "export";

    /** Minimum samples for a reconstruction */
    public static final int MIN_SAMPLES = 3;

    /** Entity name prefix of interface surfaces in the scene */
    public static final String INTERFACE_PREFIX = "interface:";

    private static final Logger log = LoggerFactory.getLogger(PipelineRun.class);

    private final GeostatPipeline       pipeline;
    private final SampleStore           store;
    private final AtomicBoolean         cancelled = new AtomicBoolean();
    private final AtomicBoolean         started   = new AtomicBoolean();
    private       PipelineConfiguration current;

    PipelineRun(GeostatPipeline pipeline, SampleStore store, PipelineConfiguration configuration) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline cannot be null");
        this.store = Objects.requireNonNull(store, "store cannot be null");
        this.current = Objects.requireNonNull(configuration, "configuration cannot be null");
    }

    /**
     * The nugget adjustment requested by the configuration, applied to a fitted model. The nugget is raised to at
     * least the configured fraction of a reference sill: the model's sill, else the sample variance, else 1.
     */
    static SpatialStructureModel effectiveModel(SpatialStructureModel fitted, Observations observations,
                                                double nuggetFraction) {
        if (!(nuggetFraction > 0)) {
            return fitted;
        }
        double reference = fitted.sill() > 0 ? fitted.sill() : observations.variance();
        if (!(reference > 0)) {
            reference = 1.0;
        }
        double nugget = Math.max(fitted.nugget(), nuggetFraction * reference);
        return nugget == fitted.nugget() ? fitted : fitted.withNugget(nugget);
    }

    /**
     * Request cancellation. The stage in progress completes; no further stage starts.
     */
    public void cancel() {
        if (cancelled.compareAndSet(false, true)) {
            log.info("Cancellation requested");
        }
    }

    /**
     * Execute the run. A run executes once.
     *
     * @throws IllegalStateException if the run was already executed
     */
    public PipelineResult execute() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Pipeline run already executed");
        }
        long start = System.nanoTime();
        var result = PipelineResult.builder();
        log.info("Reconstructing {} from {} samples ({}D, {} kriging, {} variogram)", current.attribute(),
                 store.size(), current.dimension(), current.krigingVariant().key(), current.variogramModel().key());
        result.quality(new SampleQualityInspector(current.duplicateTolerance()).inspect(store));

        var runner = new StageRunner(pipeline.catalog(), new RecoveryBudget());
        var observations = step(VALIDATION, runner, true, result, c -> validate(store, c));
        if (observations.isEmpty()) {
            return finish(result, start);
        }
        var obs = observations.get();
        result.observations(obs);

        var structure = step(VARIOGRAM, runner, true, result, c -> analyze(obs, c));
        if (structure.isEmpty()) {
            return finish(result, start);
        }
        var fit = structure.get().fit();
        result.empiricalVariogram(structure.get().empirical()).variogramFit(fit);
        fit.warning().ifPresent(result::diagnostic);

        var interpolation = step(INTERPOLATION, runner, true, result, c -> interpolate(obs, fit, c));
        if (interpolation.isEmpty()) {
            return finish(result, start);
        }
        var field = interpolation.get().field();
        result.field(field, interpolation.get().model());

        Optional<CrossValidationReport> scores = Optional.empty();
        if (current.runUncertaintyAnalysis()) {
            scores = step(CROSS_VALIDATION, runner, false, result, c -> crossValidate(obs, fit, c));
            if (scores.isEmpty()) {
                return finish(result, start);
            }
        }
        result.uncertainty(new UncertaintyReport(interpolation.get().model(), fit.quality(), scores));

        var surfaces = new TreeMap<String, InterpolatedField>();
        if (current.interfaceSurfaces()) {
            if (!interfaceSurfaces(field.grid(), result, surfaces)) {
                return finish(result, start);
            }
        }

        var scene = step(EXPORT, runner, true, result, c -> export(field, surfaces, c));
        scene.ifPresent(result::scene);
        return finish(result, start);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    private Structure analyze(Observations obs, PipelineConfiguration c) throws GeostatException {
        Double maxLag = c.maxLag() != null ? c.maxLag() : c.extendMaxLag() ? obs.maxPairwiseDistance() : null;
        var empirical = pipeline.analyzer().analyze(obs, c.binCount(), maxLag);
        var fit = pipeline.fitter().fit(empirical, c.variogramModel(), obs.dimension(), c.autoFitVariogram());
        return new Structure(empirical, fit);
    }

    private ErrorContext cancellation(String stage) {
        return ErrorContext.of(ErrorKind.CANCELLED, "Run cancelled before " + stage, "Start a new run", "", stage)
                           .log(log);
    }

    private CrossValidationReport crossValidate(Observations obs, VariogramFit fit, PipelineConfiguration c)
    throws GeostatException {
        FoldPredictor predictor;
        if (c.inverseDistance()) {
            predictor = FoldPredictor.inverseDistance(new InverseDistanceInterpolator());
        } else {
            var model = effectiveModel(fit.model(), obs, c.nuggetFraction());
            predictor = FoldPredictor.kriging(model, c.krigingVariant());
        }
        return pipeline.crossValidator().validate(obs, predictor);
    }

    private SceneMesh export(InterpolatedField field, Map<String, InterpolatedField> surfaces,
                             PipelineConfiguration c) throws SceneGeometryException {
        var extractor = pipeline.extractor();
        var meshes = new ArrayList<LabeledMesh>();
        meshes.add(extractor.extract(c.attribute().key(), null, field));
        surfaces.forEach((tag, surface) -> meshes.add(extractor.extract(INTERFACE_PREFIX + tag, tag, surface)));
        return new SceneMeshBuilder(c.sceneConfiguration(), pipeline.palette()).build(meshes);
    }

    private PipelineResult finish(PipelineResult.Builder result, long start) {
        var built = result.configuration(current).elapsed(Duration.ofNanos(System.nanoTime() - start)).build();
        if (built.isSuccessful()) {
            log.info("Reconstruction complete in {} ms with {} diagnostics{}", built.elapsed().toMillis(),
                     built.diagnostics().size(), built.autoFixed() ? " (auto corrected)" : "");
        } else {
            log.warn("Reconstruction failed after {} ms: {}", built.elapsed().toMillis(),
                     built.failure().map(ErrorContext::humanMessage).orElse("no result"));
        }
        return built;
    }

    private Interpolation interpolate(Observations obs, VariogramFit fit, PipelineConfiguration c)
    throws GeostatException {
        GridDefinition grid = c.grid();
        if (grid == null) {
            var domain = c.domainBuilder();
            long nodes = domain.estimatedNodeCount(obs);
            if (nodes > c.maxGridNodes()) {
                throw new GridTooLargeException(nodes, c.maxGridNodes());
            }
            grid = domain.grid(obs);
        }
        var model = effectiveModel(fit.model(), obs, c.nuggetFraction());
        Interpolator interpolator;
        if (c.inverseDistance()) {
            interpolator = new InverseDistanceInterpolator(InverseDistanceInterpolator.DEFAULT_POWER, c.maxGridNodes());
        } else {
            interpolator = new KrigingEngine(model, c.krigingVariant(), c.krigingTimeout(), c.maxGridNodes());
        }
        var field = interpolator.interpolate(obs, grid);
        log.info("Interpolated {} nodes with {}: range [{}, {}], max variance {}", field.size(), field.method().key(),
                 field.min(), field.max(), field.maxVariance());
        return new Interpolation(field, model);
    }

    /**
     * One elevation surface per material tag over the horizontal footprint of the main grid. Each surface has its own
     * recovery budget; a surface that fails is reported and the others proceed.
     *
     * @return false if the run was cancelled
     */
    private boolean interfaceSurfaces(GridDefinition grid, PipelineResult.Builder result,
                                      Map<String, InterpolatedField> surfaces) {
        var groups = new TreeMap<String, List<Sample>>();
        for (var sample : store.samples()) {
            if (sample.materialTag() != null && !sample.materialTag().isBlank()) {
                groups.computeIfAbsent(sample.materialTag(), t -> new ArrayList<>()).add(sample);
            }
        }
        var footprint = new GridDefinition(grid.originX(), grid.originY(), 0, grid.spacingX(), grid.spacingY(), 1,
                                           grid.nx(), grid.ny(), 1);
        var base = current.toBuilder()
                          .attribute(SampleAttribute.ELEVATION)
                          .dimension(2)
                          .grid(footprint)
                          .interfaceSurfaces(false)
                          .build();
        for (var group : groups.entrySet()) {
            var tag = group.getKey();
            var name = INTERFACE_SURFACES + ":" + tag;
            if (cancelled.get()) {
                result.diagnostic(cancellation(name));
                return false;
            }
            if (group.getValue().size() < MIN_SAMPLES) {
                result.diagnostic(
                ErrorContext.of(ErrorKind.INSUFFICIENT_POINTS, "Skipped the interface surface of " + tag,
                                "Add samples tagged " + tag,
                                group.getValue().size() + " samples, " + MIN_SAMPLES + " required", name)
                            .withSeverity(Severity.WARNING)
                            .log(log));
                continue;
            }
            var samples = store.withSamples(group.getValue());
            var runner = new StageRunner(pipeline.catalog(), new RecoveryBudget());
            var outcome = runner.run(name, base, c -> surface(samples, c));
            result.diagnostics(outcome.diagnostics());
            outcome.value().ifPresent(staged -> {
                staged.value().fitWarning().ifPresent(result::diagnostic);
                surfaces.put(tag, staged.value().field());
                result.surface(tag, staged.value().field());
            });
        }
        log.info("Built {} of {} interface surfaces", surfaces.size(), groups.size());
        return true;
    }

    private <T> Optional<T> step(String name, StageRunner runner, boolean carry, PipelineResult.Builder result,
                                 Stage<T> stage) {
        if (cancelled.get()) {
            result.diagnostic(cancellation(name));
            return Optional.empty();
        }
        log.debug("Stage {} starting", name);
        var outcome = runner.run(name, current, stage);
        result.diagnostics(outcome.diagnostics());
        return outcome.value().map(staged -> {
            if (carry) {
                current = staged.configuration();
            }
            return staged.value();
        });
    }

    private Surface surface(SampleStore samples, PipelineConfiguration c) throws GeostatException {
        var obs = validate(samples, c);
        var structure = analyze(obs, c);
        var interpolation = interpolate(obs, structure.fit(), c);
        return new Surface(interpolation.field(), structure.fit().warning());
    }

    private Observations validate(SampleStore samples, PipelineConfiguration c) throws GeostatException {
        var obs = Observations.extract(samples, c.attribute(), c.dimension());
        var invalid = obs.invalidIndices();
        if (!invalid.isEmpty()) {
            if (!c.dropInvalidSamples()) {
                throw new InvalidCoordinatesException(obs.ids(invalid));
            }
            log.debug("Dropping {} invalid samples", invalid.size());
            obs = obs.without(invalid);
        }
        var groups = obs.duplicateGroups(c.duplicateTolerance());
        if (!groups.isEmpty()) {
            if (!c.mergeDuplicates()) {
                var ids = new ArrayList<List<String>>();
                for (var group : groups) {
                    ids.add(obs.ids(group));
                }
                throw new DuplicateCoordinatesException(ids);
            }
            log.debug("Merging {} duplicate groups", groups.size());
            obs = obs.mergeDuplicates(groups);
        }
        if (obs.size() < MIN_SAMPLES) {
            if (!c.synthesizeSamples() || obs.size() == 0) {
                throw new InsufficientDataException(obs.size(), MIN_SAMPLES);
            }
            obs = new SyntheticSampleGenerator(c.gridResolution()).augment(obs, MIN_SAMPLES);
        }
        return obs;
    }

    private record Interpolation(InterpolatedField field, SpatialStructureModel model) {
    }

    private record Structure(EmpiricalVariogram empirical, VariogramFit fit) {
    }

    private record Surface(InterpolatedField field, Optional<ErrorContext> fitWarning) {
    }
}
