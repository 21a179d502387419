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

/**
 * Binned semivariances. Only bins that received at least one pair are present.
 *
 * @param lagCenters  center separation of each bin
 * @param gamma       mean semivariance of each bin
 * @param pairCounts  number of pairs in each bin
 * @param totalPairs  pairs within the maximum lag
 * @param maxLag      maximum separation considered
 * @author hal.hildebrand
 */
public record EmpiricalVariogram(double[] lagCenters, double[] gamma, int[] pairCounts, int totalPairs,
                                 double maxLag) {

    public EmpiricalVariogram {
        if (lagCenters.length != gamma.length || gamma.length != pairCounts.length) {
            throw new IllegalArgumentException("Bin arrays must have the same length");
        }
        lagCenters = lagCenters.clone();
        gamma = gamma.clone();
        pairCounts = pairCounts.clone();
    }

    public int binCount() {
        return gamma.length;
    }

    @Override
    public double[] gamma() {
        return gamma.clone();
    }

    @Override
    public double[] lagCenters() {
        return lagCenters.clone();
    }

    public double maxLagCenter() {
        double max = 0;
        for (double lag : lagCenters) {
            max = Math.max(max, lag);
        }
        return max;
    }

    @Override
    public int[] pairCounts() {
        return pairCounts.clone();
    }
}
