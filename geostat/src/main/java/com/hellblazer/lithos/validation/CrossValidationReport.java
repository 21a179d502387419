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

import com.hellblazer.lithos.kriging.InterpolationMethod;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Leave one out scores. Per point arrays are parallel to {@link #ids()}; folds that could not be predicted are absent
 * and counted in {@link #skippedFolds()}. Errors are {@code predicted - observed}.
 *
 * @author hal.hildebrand
 */
public record CrossValidationReport(InterpolationMethod method, List<String> ids, double[] observed,
                                    double[] predicted, double[] variance, int skippedFolds) {

    public CrossValidationReport {
        Objects.requireNonNull(method, "method cannot be null");
        ids = List.copyOf(ids);
        if (observed.length != ids.size() || predicted.length != ids.size() || variance.length != ids.size()) {
            throw new IllegalArgumentException("Per point arrays must match the " + ids.size() + " ids");
        }
        observed = observed.clone();
        predicted = predicted.clone();
        variance = variance.clone();
    }

    /**
     * Mean error; positive when the predictor overestimates
     */
    public double bias() {
        if (size() == 0) {
            return Double.NaN;
        }
        double sum = 0;
        for (int i = 0; i < size(); i++) {
            sum += predicted[i] - observed[i];
        }
        return sum / size();
    }

    public double[] errors() {
        var errors = new double[size()];
        for (int i = 0; i < errors.length; i++) {
            errors[i] = predicted[i] - observed[i];
        }
        return errors;
    }

    public double mae() {
        if (size() == 0) {
            return Double.NaN;
        }
        double sum = 0;
        for (int i = 0; i < size(); i++) {
            sum += Math.abs(predicted[i] - observed[i]);
        }
        return sum / size();
    }

    @Override
    public double[] observed() {
        return observed.clone();
    }

    @Override
    public double[] predicted() {
        return predicted.clone();
    }

    /**
     * Explained variance, {@code 1 - SSE / SST}. When the observations have no spread the score is 1 for a perfect
     * prediction and 0 otherwise.
     */
    public double r2() {
        if (size() == 0) {
            return Double.NaN;
        }
        double mean = 0;
        for (double v : observed) {
            mean += v;
        }
        mean /= size();
        double sse = 0, sst = 0;
        for (int i = 0; i < size(); i++) {
            double e = predicted[i] - observed[i];
            double d = observed[i] - mean;
            sse += e * e;
            sst += d * d;
        }
        if (sst == 0) {
            return sse == 0 ? 1.0 : 0.0;
        }
        return 1.0 - sse / sst;
    }

    public double rmse() {
        if (size() == 0) {
            return Double.NaN;
        }
        double sum = 0;
        for (int i = 0; i < size(); i++) {
            double e = predicted[i] - observed[i];
            sum += e * e;
        }
        return Math.sqrt(sum / size());
    }

    public int size() {
        return ids.size();
    }

    public Map<String, Object> toMap() {
        var points = new ArrayList<Map<String, Object>>();
        for (int i = 0; i < size(); i++) {
            var point = new LinkedHashMap<String, Object>();
            point.put("id", ids.get(i));
            point.put("observed", observed[i]);
            point.put("predicted", predicted[i]);
            point.put("error", predicted[i] - observed[i]);
            point.put("variance", variance[i]);
            points.add(point);
        }
        var map = new LinkedHashMap<String, Object>();
        map.put("method", method.key());
        map.put("predictions", points);
        map.put("rmse", rmse());
        map.put("r2", r2());
        map.put("bias", bias());
        map.put("mae", mae());
        map.put("skipped_folds", skippedFolds);
        return map;
    }

    @Override
    public double[] variance() {
        return variance.clone();
    }
}
