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

import com.hellblazer.lithos.exceptions.GeostatException;
import com.hellblazer.lithos.exceptions.InsufficientDataException;
import com.hellblazer.lithos.exceptions.NumericalInstabilityException;
import com.hellblazer.lithos.exceptions.SingularKrigingSystemException;
import com.hellblazer.lithos.sample.Observations;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Leave one out cross validation: every observation is predicted from all the others. Folds whose training system is
 * singular, or whose prediction is not finite, are skipped and counted.
 *
 * @author hal.hildebrand
 */
public class CrossValidator {
    /** Minimum observations for a meaningful leave one out pass */
    public static final int MIN_OBSERVATIONS = 3;

    private static final Logger log = LoggerFactory.getLogger(CrossValidator.class);

    /**
     * @throws InsufficientDataException     if fewer than {@link #MIN_OBSERVATIONS} observations are supplied
     * @throws NumericalInstabilityException if no fold could be predicted
     * @throws GeostatException              for any other classified failure of the predictor
     */
    public CrossValidationReport validate(Observations observations, FoldPredictor predictor)
    throws GeostatException {
        Objects.requireNonNull(observations, "observations cannot be null");
        Objects.requireNonNull(predictor, "predictor cannot be null");
        int n = observations.size();
        if (n < MIN_OBSERVATIONS) {
            throw new InsufficientDataException(n, MIN_OBSERVATIONS);
        }
        var ids = new ArrayList<String>();
        var observed = new double[n];
        var predicted = new double[n];
        var variance = new double[n];
        int k = 0;
        int skipped = 0;
        for (int i = 0; i < n; i++) {
            var training = observations.without(List.of(i));
            try {
                var estimate = predictor.predict(training, observations.x(i), observations.y(i), observations.z(i));
                if (!Double.isFinite(estimate.value()) || !Double.isFinite(estimate.variance())) {
                    log.debug("Fold {} ({}) produced a non-finite estimate, skipping", i, observations.id(i));
                    skipped++;
                    continue;
                }
                ids.add(observations.id(i));
                observed[k] = observations.value(i);
                predicted[k] = estimate.value();
                variance[k] = estimate.variance();
                k++;
            } catch (SingularKrigingSystemException e) {
                log.debug("Fold {} ({}) is singular, skipping: {}", i, observations.id(i), e.getMessage());
                skipped++;
            }
        }
        if (k == 0) {
            throw new NumericalInstabilityException(
            "Cross validation could not predict any of the " + n + " held out observations");
        }
        var report = new CrossValidationReport(predictor.method(), ids, Arrays.copyOf(observed, k),
                                               Arrays.copyOf(predicted, k), Arrays.copyOf(variance, k), skipped);
        log.info("Cross validation ({}): {} folds, {} skipped, RMSE {}, R2 {}", predictor.method().key(), k, skipped,
                 report.rmse(), report.r2());
        return report;
    }
}
