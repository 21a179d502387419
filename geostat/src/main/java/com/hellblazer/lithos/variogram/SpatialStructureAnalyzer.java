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

import com.hellblazer.lithos.exceptions.InsufficientDataException;
import com.hellblazer.lithos.exceptions.VariogramFitException;
import com.hellblazer.lithos.sample.Observations;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Computes the empirical variogram of a set of observations. Every unordered pair separated by at most the maximum
 * lag contributes {@code (v_i - v_j)^2 / 2} to the bin of its separation; each bin reports the mean of its
 * contributions at the bin's center separation. Empty bins are dropped.
 *
 * @author hal.hildebrand
 */
public class SpatialStructureAnalyzer {
    /** Default number of lag bins */
    public static final int DEFAULT_BIN_COUNT = 20;

    /** The default maximum lag is this fraction of the largest pairwise distance */
    public static final double DEFAULT_MAX_LAG_FRACTION = 1.0 / 3.0;

    /** Minimum number of observations for structure analysis */
    public static final int MIN_OBSERVATIONS = 3;

    private static final Logger log = LoggerFactory.getLogger(SpatialStructureAnalyzer.class);

    /**
     * @param observations located values
     * @param binCount     number of lag bins, at least 3
     * @param maxLag       maximum separation, or null for a third of the largest pairwise distance
     * @throws InsufficientDataException if fewer than 3 observations are supplied
     * @throws VariogramFitException     if no pair falls within the maximum lag
     */
    public EmpiricalVariogram analyze(Observations observations, int binCount, Double maxLag)
    throws InsufficientDataException, VariogramFitException {
        Objects.requireNonNull(observations, "observations cannot be null");
        if (binCount < 3) {
            throw new IllegalArgumentException("binCount must be at least 3: " + binCount);
        }
        if (maxLag != null && !(maxLag > 0)) {
            throw new IllegalArgumentException("maxLag must be positive: " + maxLag);
        }
        int n = observations.size();
        if (n < MIN_OBSERVATIONS) {
            throw new InsufficientDataException(n, MIN_OBSERVATIONS);
        }

        double lagLimit = maxLag != null ? maxLag : observations.maxPairwiseDistance() * DEFAULT_MAX_LAG_FRACTION;
        if (!(lagLimit > 0)) {
            throw new VariogramFitException("All observations share one location; no separation to analyze");
        }
        double binWidth = lagLimit / binCount;
        var sums = new double[binCount];
        var counts = new int[binCount];
        int total = 0;
        for (int i = 0; i < n; i++) {
            double vi = observations.value(i);
            for (int j = i + 1; j < n; j++) {
                double h = observations.distance(i, j);
                if (h > lagLimit) {
                    continue;
                }
                int bin = Math.min(binCount - 1, (int) (h / binWidth));
                double d = vi - observations.value(j);
                sums[bin] += 0.5 * d * d;
                counts[bin]++;
                total++;
            }
        }
        if (total == 0) {
            throw new VariogramFitException(
            "No sample pairs within the maximum lag of " + lagLimit + "; extend the lag to cover the samples");
        }

        int populated = 0;
        for (int count : counts) {
            if (count > 0) {
                populated++;
            }
        }
        var lags = new double[populated];
        var gamma = new double[populated];
        var pairs = new int[populated];
        int k = 0;
        for (int b = 0; b < binCount; b++) {
            if (counts[b] == 0) {
                continue;
            }
            lags[k] = (b + 0.5) * binWidth;
            gamma[k] = sums[b] / counts[b];
            pairs[k] = counts[b];
            k++;
        }
        log.debug("Empirical variogram: {} pairs in {} of {} bins, max lag {}", total, populated, binCount, lagLimit);
        return new EmpiricalVariogram(lags, gamma, pairs, total, lagLimit);
    }
}
