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
import com.hellblazer.lithos.kriging.Estimate;
import com.hellblazer.lithos.kriging.InterpolationMethod;
import com.hellblazer.lithos.kriging.InverseDistanceInterpolator;
import com.hellblazer.lithos.kriging.KrigingSystem;
import com.hellblazer.lithos.kriging.KrigingVariant;
import com.hellblazer.lithos.sample.Observations;
import com.hellblazer.lithos.variogram.SpatialStructureModel;

/**
 * Predicts a held out location from the training observations of one cross validation fold
 *
 * @author hal.hildebrand
 */
public interface FoldPredictor {

    static FoldPredictor inverseDistance(InverseDistanceInterpolator interpolator) {
        return new FoldPredictor() {
            @Override
            public InterpolationMethod method() {
                return InterpolationMethod.INVERSE_DISTANCE;
            }

            @Override
            public Estimate predict(Observations training, double x, double y, double z) {
                return interpolator.estimate(training, x, y, z);
            }
        };
    }

    static FoldPredictor kriging(SpatialStructureModel model, KrigingVariant variant) {
        return new FoldPredictor() {
            @Override
            public InterpolationMethod method() {
                return InterpolationMethod.of(variant);
            }

            @Override
            public Estimate predict(Observations training, double x, double y, double z) throws GeostatException {
                return KrigingSystem.factor(training, model, variant).estimate(x, y, z);
            }
        };
    }

    InterpolationMethod method();

    Estimate predict(Observations training, double x, double y, double z) throws GeostatException;
}
