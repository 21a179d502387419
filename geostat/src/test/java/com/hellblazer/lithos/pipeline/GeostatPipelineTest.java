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

import com.hellblazer.lithos.kriging.GridDefinition;
import com.hellblazer.lithos.kriging.InterpolationMethod;
import com.hellblazer.lithos.kriging.KrigingVariant;
import com.hellblazer.lithos.recovery.ErrorCatalog;
import com.hellblazer.lithos.recovery.ErrorCategory;
import com.hellblazer.lithos.recovery.ErrorContext;
import com.hellblazer.lithos.recovery.ErrorKind;
import com.hellblazer.lithos.recovery.Severity;
import com.hellblazer.lithos.sample.Observations;
import com.hellblazer.lithos.sample.QualityIssue;
import com.hellblazer.lithos.sample.Sample;
import com.hellblazer.lithos.sample.SampleStore;
import com.hellblazer.lithos.scene.MaterialPalette;
import com.hellblazer.lithos.variogram.SpatialStructureModel;
import com.hellblazer.lithos.variogram.VariogramKind;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class GeostatPipelineTest {

    private final GeostatPipeline pipeline = new GeostatPipeline();

    private static Optional<ErrorContext> diagnostic(PipelineResult result, ErrorKind kind) {
        return result.diagnostics().stream().filter(d -> d.kind() == kind).findFirst();
    }

    private static List<Sample> grid(int n, double spacing, String material) {
        var samples = new ArrayList<Sample>();
        for (int j = 0; j < n; j++) {
            for (int i = 0; i < n; i++) {
                double x = i * spacing, y = j * spacing;
                double z = 100 + 0.05 * x - 0.03 * y + Math.sin(x / 17.0) * Math.cos(y / 11.0);
                samples.add(Sample.of(material + "-" + i + "-" + j, x, y, z, material));
            }
        }
        return samples;
    }

    private static SampleStore corners() {
        return SampleStore.of(List.of(Sample.of("sw", 0, 0, 0), Sample.of("se", 100, 0, 1), Sample.of("nw", 0, 100, 1),
                                      Sample.of("ne", 100, 100, 0)));
    }

    @Test
    public void testSymmetricCornerReconstruction() {
        var config = PipelineConfiguration.builder()
                                          .grid(GridDefinition.of2d(0, 0, 10, 11, 11))
                                          .variogramModel(VariogramKind.EXPONENTIAL)
                                          .build();
        var result = pipeline.run(corners(), config);
        assertTrue(result.isSuccessful());

        var field = result.field().orElseThrow();
        assertEquals(0.5, field.valueAt(5, 5, 0), 1e-9);
        assertTrue(field.varianceAt(5, 5, 0) > 0);

        var variogramFix = diagnostic(result, ErrorKind.VARIOGRAM_FIT_FAILURE).orElseThrow();
        assertTrue(variogramFix.autoFixed());
        assertTrue(result.autoFixed());
        assertTrue(result.configuration().extendMaxLag());

        var uncertainty = result.uncertainty().orElseThrow();
        assertEquals(4, uncertainty.crossValidation().orElseThrow().size());

        var scene = result.scene().orElseThrow();
        var entity = scene.entity("elevation").orElseThrow();
        assertEquals(121, entity.vertexCount());
        assertEquals(200, entity.triangleCount());
        assertNotNull(entity.scalar(FieldSurfaceExtractor.VARIANCE));
        assertEquals("viridis", scene.colormapHint());
        assertEquals("viridis", scene.toDocument().get("colormap_hint"));

        var map = result.toMap();
        assertEquals("success", map.get("status"));
        assertEquals(true, map.get("auto_fixed"));
        assertEquals("viridis", map.get("colormap_hint"));
        assertNotNull(map.get("scene_statistics"));
    }

    @Test
    public void testTwoSamplesFailValidation() {
        var store = SampleStore.of(List.of(Sample.of("a", 0, 0, 1), Sample.of("b", 50, 0, 3)));
        var result = pipeline.run(store, PipelineConfiguration.defaultConfig());
        assertFalse(result.isSuccessful());
        assertTrue(result.observations().isEmpty());
        assertTrue(result.field().isEmpty());
        assertTrue(result.quality().isPresent());

        var failure = result.failure().orElseThrow();
        assertEquals(ErrorKind.INSUFFICIENT_POINTS, failure.kind());
        assertEquals(ErrorCategory.DATA_VALIDATION, failure.category());
        assertEquals(Severity.ERROR, failure.severity());
        assertFalse(failure.autoFixed());
        assertEquals(PipelineRun.VALIDATION, failure.stage());
        assertEquals("failed", result.toMap().get("status"));
    }

    @Test
    public void testSyntheticSamplesWhenAllowed() {
        var store = SampleStore.of(List.of(Sample.of("a", 0, 0, 1), Sample.of("b", 50, 0, 3)));
        var config = PipelineConfiguration.builder().allowSyntheticSamples(true).build();
        var result = pipeline.run(store, config);
        assertTrue(result.isSuccessful());
        assertEquals(3, result.observations().orElseThrow().size());
        var fix = diagnostic(result, ErrorKind.INSUFFICIENT_POINTS).orElseThrow();
        assertTrue(fix.autoFixed());
        assertEquals(true, fix.modifiedParameters().get("synthesize_samples"));
    }

    @Test
    public void testDuplicatesAreMerged() {
        var samples = grid(5, 10, "clay");
        samples.add(Sample.of("repeat", 20, 20, 97, "clay"));
        var result = pipeline.run(SampleStore.of(samples), PipelineConfiguration.defaultConfig());
        assertTrue(result.isSuccessful());

        var fix = diagnostic(result, ErrorKind.DUPLICATE_COORDINATES).orElseThrow();
        assertTrue(fix.autoFixed());
        assertEquals(Severity.WARNING, fix.severity());
        assertEquals(true, fix.modifiedParameters().get("merge_duplicates"));

        var observations = result.observations().orElseThrow();
        assertEquals(25, observations.size());
        assertTrue(observations.duplicateGroups(1e-9).isEmpty());
        assertTrue(result.configuration().mergeDuplicates());
        assertTrue(result.quality().orElseThrow().has(QualityIssue.Type.DUPLICATES));
    }

    @Test
    public void testColinearUniversalKrigingFallsBackToOrdinary() {
        var store = SampleStore.of(List.of(Sample.of("a", 0, 0, 1), Sample.of("b", 10, 0, 2), Sample.of("c", 20, 0, 3)));
        var config = PipelineConfiguration.builder().krigingVariant(KrigingVariant.UNIVERSAL).build();
        var result = pipeline.run(store, config);
        assertTrue(result.isSuccessful());

        var fix = diagnostic(result, ErrorKind.SINGULAR_SYSTEM).orElseThrow();
        assertTrue(fix.autoFixed());
        assertEquals("ordinary", fix.modifiedParameters().get("kriging_variant"));
        assertEquals(PipelineRun.INTERPOLATION, fix.stage());

        assertEquals(KrigingVariant.ORDINARY, result.configuration().krigingVariant());
        assertEquals(InterpolationMethod.ORDINARY_KRIGING, result.field().orElseThrow().method());
        assertTrue(result.model().orElseThrow().nugget() > 0);
    }

    @Test
    public void testInvalidSamplesAreDropped() {
        var samples = grid(3, 25, "sand");
        samples.add(Sample.of("lost", Double.NaN, 10, 100, "sand"));
        var result = pipeline.run(SampleStore.of(samples), PipelineConfiguration.defaultConfig());
        assertTrue(result.isSuccessful());
        assertEquals(9, result.observations().orElseThrow().size());
        var fix = diagnostic(result, ErrorKind.INVALID_COORDINATES).orElseThrow();
        assertTrue(fix.autoFixed());
        assertTrue(fix.technicalDetail().contains("lost"));
    }

    @Test
    public void testOversizedGridIsCoarsened() {
        var config = PipelineConfiguration.builder().maxGridNodes(100).build();
        var result = pipeline.run(SampleStore.of(grid(5, 25, "silt")), config);
        assertTrue(result.isSuccessful());
        assertEquals(20, result.configuration().gridResolution());
        assertEquals(8, result.field().orElseThrow().grid().nx());
        var fix = diagnostic(result, ErrorKind.MEMORY_EXHAUSTION).orElseThrow();
        assertTrue(fix.autoFixed());
        assertEquals(Severity.WARNING, fix.severity());
    }

    @Test
    public void testTimeoutSubstitutesInverseDistance() {
        var random = new Random(3);
        var samples = new ArrayList<Sample>();
        for (int i = 0; i < 100; i++) {
            double x = random.nextDouble() * 150, y = random.nextDouble() * 150;
            samples.add(Sample.of("b" + i, x, y, 50 + 0.1 * x + random.nextGaussian()));
        }
        var config = PipelineConfiguration.builder()
                                          .grid(GridDefinition.of2d(0, 0, 1, 150, 150))
                                          .krigingTimeout(Duration.ofMillis(1))
                                          .build();
        var result = pipeline.run(SampleStore.of(samples), config);
        assertTrue(result.isSuccessful());
        assertEquals(InterpolationMethod.INVERSE_DISTANCE, result.field().orElseThrow().method());
        var fix = diagnostic(result, ErrorKind.COMPUTATION_TIMEOUT).orElseThrow();
        assertTrue(fix.autoFixed());
        assertTrue(fix.usedFallbackMethod());
        assertEquals(InterpolationMethod.INVERSE_DISTANCE,
                     result.uncertainty().orElseThrow().crossValidation().orElseThrow().method());
    }

    @Test
    public void testUnclassifiedFailureKeepsOriginalMessage() {
        var bare = new GeostatPipeline(ErrorCatalog.builder().build(), MaterialPalette.defaultPalette());
        var samples = grid(3, 10, "clay");
        samples.add(Sample.of("repeat", 10, 10, 97, "clay"));
        var result = bare.run(SampleStore.of(samples), PipelineConfiguration.defaultConfig());
        assertFalse(result.isSuccessful());
        var failure = result.failure().orElseThrow();
        assertEquals(ErrorKind.UNKNOWN, failure.kind());
        assertEquals(Severity.CRITICAL, failure.severity());
        assertTrue(failure.technicalDetail().startsWith("DuplicateCoordinatesException"));
        assertTrue(failure.technicalDetail().contains("repeat"));
    }

    @Test
    public void testCancellationBeforeExecution() {
        var run = pipeline.newRun(corners(), PipelineConfiguration.defaultConfig());
        run.cancel();
        assertTrue(run.isCancelled());
        var result = run.execute();
        assertFalse(result.isSuccessful());
        var failure = result.failure().orElseThrow();
        assertEquals(ErrorKind.CANCELLED, failure.kind());
        assertEquals(PipelineRun.VALIDATION, failure.stage());
        assertTrue(result.observations().isEmpty());
        assertThrows(IllegalStateException.class, run::execute);
    }

    @Test
    public void testInterfaceSurfaces() {
        var samples = new ArrayList<Sample>();
        for (int j = 0; j < 3; j++) {
            for (int i = 0; i < 3; i++) {
                samples.add(Sample.of("top-" + i + "-" + j, i * 50, j * 50, 10 + 0.01 * i * 50, "clay"));
                samples.add(Sample.of("base-" + i + "-" + j, i * 50, j * 50, -0.02 * j * 50 - 5, "sand"));
            }
        }
        samples.add(Sample.of("lens-1", 25, 25, 5, "peat"));
        samples.add(Sample.of("lens-2", 75, 75, 4, "peat"));
        var config = PipelineConfiguration.builder().interfaceSurfaces(true).build();
        var result = pipeline.run(SampleStore.of(samples), config);
        assertTrue(result.isSuccessful());

        assertEquals(List.of("clay", "sand"), List.copyOf(result.surfaces().keySet()));
        var field = result.field().orElseThrow();
        var clay = result.surfaces().get("clay");
        assertEquals(field.grid().nx(), clay.grid().nx());
        assertEquals(field.grid().ny(), clay.grid().ny());

        var skipped = result.diagnostics()
                            .stream()
                            .filter(d -> d.stage().equals(PipelineRun.INTERFACE_SURFACES + ":peat"))
                            .findFirst()
                            .orElseThrow();
        assertEquals(ErrorKind.INSUFFICIENT_POINTS, skipped.kind());
        assertEquals(Severity.WARNING, skipped.severity());

        var scene = result.scene().orElseThrow();
        assertEquals(3, scene.entities().size());
        assertEquals("clay", scene.entity(PipelineRun.INTERFACE_PREFIX + "clay").orElseThrow().material());
        assertTrue(scene.entity(PipelineRun.INTERFACE_PREFIX + "peat").isEmpty());
    }

    @Test
    public void testExplicitLagWithoutPairsIsExtended() {
        var config = PipelineConfiguration.fromMap(Map.of("max_lag", 5.0));
        var result = pipeline.run(SampleStore.of(grid(4, 30, "clay")), config);
        assertTrue(result.isSuccessful());

        var extension = result.diagnostics()
                              .stream()
                              .filter(d -> d.kind() == ErrorKind.VARIOGRAM_FIT_FAILURE)
                              .filter(d -> d.modifiedParameters().containsKey("replaced_max_lag"))
                              .findFirst()
                              .orElseThrow();
        assertTrue(extension.autoFixed());
        assertEquals(PipelineRun.VARIOGRAM, extension.stage());
        assertEquals(5.0, extension.modifiedParameters().get("replaced_max_lag"));
        assertNull(result.configuration().maxLag());
        assertTrue(result.configuration().extendMaxLag());
        assertTrue(result.field().isPresent());
    }

    @Test
    public void testNearlyCoincidentSamplesRecoverWithNugget() {
        var samples = new ArrayList<Sample>();
        for (int j = 0; j < 4; j++) {
            for (int i = 0; i < 4; i++) {
                samples.add(Sample.of("s-" + i + "-" + j, i * 20, j * 20, i + 4 * j));
            }
        }
        samples.add(Sample.of("s-1-1-twin", 20 + 1e-6, 20, 10));
        var config = PipelineConfiguration.builder()
                                          .variogramModel(VariogramKind.GAUSSIAN)
                                          .autoFitVariogram(false)
                                          .build();
        var result = pipeline.run(SampleStore.of(samples), config);
        assertTrue(result.isSuccessful());
        assertEquals(17, result.observations().orElseThrow().size());

        var singular = diagnostic(result, ErrorKind.SINGULAR_SYSTEM).orElseThrow();
        assertTrue(singular.autoFixed());
        assertEquals(PipelineRun.INTERPOLATION, singular.stage());
        assertEquals(0.1, result.configuration().nuggetFraction(), 1e-12);
        assertTrue(result.model().orElseThrow().nugget() > 0);

        var field = result.field().orElseThrow();
        for (double value : field.values()) {
            assertTrue(Double.isFinite(value));
        }
    }

    @Test
    public void testDeterministicResults() {
        var samples = grid(6, 12, "till");
        var first = pipeline.run(SampleStore.of(samples), PipelineConfiguration.defaultConfig());
        var second = pipeline.run(SampleStore.of(samples), PipelineConfiguration.defaultConfig());
        assertArrayEquals(first.field().orElseThrow().values(), second.field().orElseThrow().values());
        assertArrayEquals(first.field().orElseThrow().variance(), second.field().orElseThrow().variance());
        assertEquals(first.model(), second.model());
    }

    @Test
    public void testNuggetFractionOfSill() {
        var fitted = new SpatialStructureModel(VariogramKind.SPHERICAL, 10, 2, 0.05, 2);
        var observations = new Observations(new String[] { "a", "b", "c" }, new double[] { 0, 1, 0 },
                                            new double[] { 0, 0, 1 }, new double[3], new double[] { 1, 2, 3 }, 2);
        assertSame(fitted, PipelineRun.effectiveModel(fitted, observations, 0));
        var raised = PipelineRun.effectiveModel(fitted, observations, 0.1);
        assertEquals(0.2, raised.nugget(), 1e-12);
        assertEquals(fitted.partialSill(), raised.partialSill(), 1e-12);

        var noSill = new SpatialStructureModel(VariogramKind.SPHERICAL, 10, 0, 0, 2);
        assertEquals(0.1 * observations.variance(), PipelineRun.effectiveModel(noSill, observations, 0.1).nugget(),
                     1e-12);
    }
}
