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

import com.hellblazer.lithos.variogram.FitQuality;
import com.hellblazer.lithos.variogram.SpatialStructureModel;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * What the uncertainty reporting collaborator receives: the model the field was estimated with, how it was obtained,
 * and the cross validation scores when they were computed.
 *
 * @author hal.hildebrand
 */
public record UncertaintyReport(SpatialStructureModel model, FitQuality fitQuality,
                                Optional<CrossValidationReport> crossValidation) {

    public UncertaintyReport {
        Objects.requireNonNull(model, "model cannot be null");
        Objects.requireNonNull(fitQuality, "fitQuality cannot be null");
        Objects.requireNonNull(crossValidation, "crossValidation cannot be null");
    }

    public Map<String, Object> toMap() {
        var variogram = new LinkedHashMap<String, Object>();
        variogram.put("kind", model.kind().key());
        variogram.put("range", model.range());
        variogram.put("sill", model.sill());
        variogram.put("nugget", model.nugget());
        variogram.put("fit_quality", fitQuality.key());

        var map = new LinkedHashMap<String, Object>();
        map.put("cross_validation", crossValidation.map(CrossValidationReport::toMap).orElse(null));
        map.put("variogram_model", variogram);
        return map;
    }
}
