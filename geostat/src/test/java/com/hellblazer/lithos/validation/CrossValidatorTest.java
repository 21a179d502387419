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
package com.hellblazer.lithos.validation;

import com.hellblazer.lithos.exceptions.InsufficientDataException;
import com.hellblazer.lithos.exceptions.NumericalInstabilityException;
import com.hellblazer.lithos.kriging.InterpolationMethod;
import com.hellblazer.lithos.kriging.InverseDistanceInterpolator;
import com.hellblazer.lithos.kriging.KrigingVariant;
import com.hellblazer.lithos.sample.Observations;
import com.hellblazer.lithos.variogram.FitQuality;
import com.hellblazer.lithos.variogram.SpatialStructureModel;
import com.hellblazer.lithos.variogram.VariogramKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class CrossValidatorTest {

    private static final SpatialStructureModel MODEL = new SpatialStructureModel(VariogramKind.EXPONENTIAL, 30, 4, 0,
                                                                                 2);

    private final CrossValidator validator = new CrossValidator();

    private static Observations observations(double[][] xy, double a, double b, double c) {
        int n = xy.length;
        var ids = new String[n];
        var x = new double[n];
        var y = new double[n];
        var values = new double[n];
        for (int i = 0; i < n; i++) {
            ids[i] = "b" + i;
            x[i] = xy[i][0];
            y[i] = xy[i][1];
            values[i] = a + b * x[i] + c * y[i];
        }
        return new Observations(ids, x, y, new double[n], values, 2);
    }

    @Test
    public void testUniversalKrigingPredictsLinearTrendExactly() throws Exception {
        var observations = observations(new double[][] { { 0, 0 }, { 40, 5 }, { 10, 30 }, { 35, 40 }, { 20, 15 } }, 1,
                                        2, 3);
        var report = validator.validate(observations, FoldPredictor.kriging(MODEL, KrigingVariant.UNIVERSAL));
        assertEquals(InterpolationMethod.UNIVERSAL_KRIGING, report.method());
        assertEquals(5, report.size());
        assertEquals(0, report.skippedFolds());
        assertEquals(0, report.rmse(), 1e-6);
        assertEquals(1, report.r2(), 1e-9);
        assertEquals(List.of("b0", "b1", "b2", "b3", "b4"), report.ids());
    }

    @Test
    public void testDegenerateFoldsAreSkipped() throws Exception {
        var observations = observations(new double[][] { { 0, 0 }, { 10, 0 }, { 20, 0 }, { 5, 10 } }, 0, 1, 1);
        var report = validator.validate(observations, FoldPredictor.kriging(MODEL, KrigingVariant.UNIVERSAL));
        assertEquals(3, report.size());
        assertEquals(1, report.skippedFolds());
        assertFalse(report.ids().contains("b3"));
    }

    @Test
    public void testNoPredictableFold() {
        var observations = observations(new double[][] { { 0, 0 }, { 10, 0 }, { 5, 10 } }, 0, 1, 1);
        assertThrows(NumericalInstabilityException.class,
                     () -> validator.validate(observations, FoldPredictor.kriging(MODEL, KrigingVariant.UNIVERSAL)));
    }

    @Test
    public void testTooFewObservations() {
        var observations = observations(new double[][] { { 0, 0 }, { 10, 0 } }, 0, 1, 1);
        var predictor = FoldPredictor.inverseDistance(new InverseDistanceInterpolator());
        assertThrows(InsufficientDataException.class, () -> validator.validate(observations, predictor));
    }

    @Test
    public void testMetricsAreConsistent() throws Exception {
        var observations = observations(new double[][] { { 0, 0 }, { 40, 5 }, { 10, 30 }, { 35, 40 }, { 20, 15 },
                                                         { 50, 50 } }, 5, 0.3, -0.2);
        var report = validator.validate(observations, FoldPredictor.inverseDistance(new InverseDistanceInterpolator()));
        assertEquals(InterpolationMethod.INVERSE_DISTANCE, report.method());
        assertEquals(6, report.size());

        var errors = report.errors();
        double sum = 0, abs = 0, squares = 0;
        for (double e : errors) {
            sum += e;
            abs += Math.abs(e);
            squares += e * e;
        }
        assertEquals(sum / 6, report.bias(), 1e-12);
        assertEquals(abs / 6, report.mae(), 1e-12);
        assertEquals(Math.sqrt(squares / 6), report.rmse(), 1e-12);
        assertTrue(report.rmse() >= report.mae());
        assertTrue(report.r2() <= 1);
        for (double v : report.variance()) {
            assertTrue(v >= 0);
        }
    }

    @Test
    public void testScoreForConstantObservations() {
        var perfect = new CrossValidationReport(InterpolationMethod.ORDINARY_KRIGING, List.of("a", "b"),
                                                new double[] { 3, 3 }, new double[] { 3, 3 }, new double[2], 0);
        assertEquals(1, perfect.r2());
        var off = new CrossValidationReport(InterpolationMethod.ORDINARY_KRIGING, List.of("a", "b"),
                                            new double[] { 3, 3 }, new double[] { 3, 4 }, new double[2], 0);
        assertEquals(0, off.r2());
        assertEquals(0.5, off.bias(), 1e-12);

        var empty = new CrossValidationReport(InterpolationMethod.ORDINARY_KRIGING, List.of(), new double[0],
                                              new double[0], new double[0], 3);
        assertTrue(Double.isNaN(empty.rmse()));
    }

    @Test
    @SuppressWarnings("unchecked")
    public void testUncertaintyReportMap() throws Exception {
        var observations = observations(new double[][] { { 0, 0 }, { 40, 5 }, { 10, 30 }, { 35, 40 } }, 1, 1, 1);
        var cv = validator.validate(observations, FoldPredictor.kriging(MODEL, KrigingVariant.ORDINARY));
        var report = new UncertaintyReport(MODEL, FitQuality.AUTO_FITTED, Optional.of(cv));
        var map = report.toMap();
        var variogram = (Map<String, Object>) map.get("variogram_model");
        assertEquals("exponential", variogram.get("kind"));
        assertEquals("auto_fitted", variogram.get("fit_quality"));
        var crossValidation = (Map<String, Object>) map.get("cross_validation");
        assertEquals(4, ((List<?>) crossValidation.get("predictions")).size());
        assertEquals("ordinary_kriging", crossValidation.get("method"));

        assertNull(new UncertaintyReport(MODEL, FitQuality.HEURISTIC_FALLBACK, Optional.empty()).toMap()
                                                                                               .get("cross_validation"));
    }
}
