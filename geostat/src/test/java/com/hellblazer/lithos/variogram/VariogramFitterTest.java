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
package com.hellblazer.lithos.variogram;

import com.hellblazer.lithos.recovery.ErrorKind;
import com.hellblazer.lithos.recovery.Severity;
import com.hellblazer.lithos.sample.Observations;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class VariogramFitterTest {

    private static EmpiricalVariogram sampled(SpatialStructureModel model, int bins, double spacing) {
        var lags = new double[bins];
        var gamma = new double[bins];
        var pairs = new int[bins];
        for (int i = 0; i < bins; i++) {
            lags[i] = (i + 0.5) * spacing;
            gamma[i] = model.semivariance(lags[i]);
            pairs[i] = 10 + i;
        }
        return new EmpiricalVariogram(lags, gamma, pairs, 10 * bins, bins * spacing);
    }

    @Test
    public void testRecoversExponentialModel() {
        var truth = new SpatialStructureModel(VariogramKind.EXPONENTIAL, 20, 2.0, 0.2, 2);
        var fit = new VariogramFitter().fit(sampled(truth, 20, 2), VariogramKind.EXPONENTIAL, 2);
        assertEquals(FitQuality.AUTO_FITTED, fit.quality());
        assertTrue(fit.warning().isEmpty());
        assertEquals(20, fit.model().range(), 0.2);
        assertEquals(2.0, fit.model().sill(), 0.02);
        assertEquals(0.2, fit.model().nugget(), 0.02);
    }

    @Test
    public void testRecoversSphericalModel() {
        var truth = new SpatialStructureModel(VariogramKind.SPHERICAL, 50, 4.0, 0.0, 2);
        var fit = new VariogramFitter().fit(sampled(truth, 15, 5), VariogramKind.SPHERICAL, 2);
        assertEquals(FitQuality.AUTO_FITTED, fit.quality());
        assertEquals(50, fit.model().range(), 1.0);
        assertEquals(4.0, fit.model().sill(), 0.05);
    }

    @Test
    public void testTooFewBinsFallsBack() {
        var empirical = new EmpiricalVariogram(new double[] { 10, 30 }, new double[] { 1, 3 }, new int[] { 4, 2 }, 6,
                                               40);
        var fit = new VariogramFitter().fit(empirical, VariogramKind.GAUSSIAN, 2);
        assertEquals(FitQuality.HEURISTIC_FALLBACK, fit.quality());
        assertEquals(10, fit.model().range(), 1e-12);
        assertEquals(1, fit.model().sill(), 1e-12);
        assertEquals(0, fit.model().nugget());

        var warning = fit.warning().orElseThrow();
        assertEquals(ErrorKind.VARIOGRAM_FIT_FAILURE, warning.kind());
        assertEquals(Severity.WARNING, warning.severity());
        assertTrue(warning.autoFixed());
        assertEquals(10.0, warning.modifiedParameters().get("range"));
    }

    @Test
    public void testFlatSemivarianceUsesMeanAsSill() {
        var empirical = new EmpiricalVariogram(new double[] { 5 }, new double[] { 2.5 }, new int[] { 3 }, 3, 10);
        var model = VariogramFitter.heuristic(empirical, VariogramKind.SPHERICAL, 3);
        assertEquals(2.5, model.sill(), 1e-12);
        assertEquals(5.0 / 3.0, model.range(), 1e-12);
        assertEquals(3, model.dimension());
    }

    @Test
    public void testAutoFitDisabled() {
        var truth = new SpatialStructureModel(VariogramKind.EXPONENTIAL, 20, 2.0, 0.2, 2);
        var fit = new VariogramFitter().fit(sampled(truth, 20, 2), VariogramKind.EXPONENTIAL, 2, false);
        assertEquals(FitQuality.HEURISTIC_FALLBACK, fit.quality());
        assertTrue(fit.warning().isEmpty());
    }

    @Property(tries = 25)
    void fittedModelsArePhysical(@ForAll @IntRange(min = 0, max = 100_000) int seed,
                                 @ForAll @IntRange(min = 3, max = 40) int n) throws Exception {
        var random = new Random(seed);
        var ids = new String[n];
        var x = new double[n];
        var y = new double[n];
        var values = new double[n];
        for (int i = 0; i < n; i++) {
            ids[i] = "s" + i;
            x[i] = random.nextDouble() * 100;
            y[i] = random.nextDouble() * 100;
            values[i] = random.nextGaussian() * 5 + 0.05 * x[i];
        }
        var observations = new Observations(ids, x, y, new double[n], values, 2);
        var empirical = new SpatialStructureAnalyzer().analyze(observations, 10, observations.maxPairwiseDistance());
        for (var kind : VariogramKind.values()) {
            var model = new VariogramFitter().fit(empirical, kind, 2).model();
            assertTrue(model.range() > 0);
            assertTrue(model.nugget() >= 0);
            assertTrue(model.sill() >= model.nugget());
        }
    }
}
