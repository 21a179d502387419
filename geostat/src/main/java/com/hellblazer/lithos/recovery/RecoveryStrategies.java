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
package com.hellblazer.lithos.recovery;

import com.hellblazer.lithos.exceptions.InsufficientDataException;
import com.hellblazer.lithos.exceptions.SingularKrigingSystemException;
import com.hellblazer.lithos.kriging.KrigingVariant;
import com.hellblazer.lithos.pipeline.PipelineConfiguration;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The automatic fixes of the default catalog
 *
 * @author hal.hildebrand
 */
public final class RecoveryStrategies {
    /** Nugget fraction applied on the first singular system */
    public static final double INITIAL_NUGGET_FRACTION = 0.1;

    /** Largest nugget fraction a retry will request */
    public static final double MAX_NUGGET_FRACTION = 0.5;

    /** Grid spacing multiplier when the grid does not fit the budget */
    public static final double COARSENING_FACTOR = 2.0;

    private RecoveryStrategies() {
    }

    /**
     * Double the grid spacing, for memory exhaustion and oversized grids
     */
    public static RecoveryAction coarsenGrid(Throwable cause, ErrorContext context, PipelineConfiguration config) {
        var resolution = config.gridResolution() * COARSENING_FACTOR;
        var builder = config.toBuilder().gridResolution(resolution);
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("grid_resolution", resolution);
        if (config.dimension() == 3) {
            var vertical = config.verticalResolution() * COARSENING_FACTOR;
            builder.verticalResolution(vertical);
            parameters.put("vertical_resolution", vertical);
        }
        if (config.grid() != null) {
            var coarse = config.grid().coarsened(COARSENING_FACTOR);
            builder.grid(coarse);
            parameters.put("grid", coarse.toMap());
        }
        return RecoveryAction.retry(builder.build(), parameters, "Coarsen the interpolation grid");
    }

    public static RecoveryAction dropInvalidSamples(Throwable cause, ErrorContext context,
                                                    PipelineConfiguration config) {
        if (config.dropInvalidSamples()) {
            return RecoveryAction.none("Invalid samples are already dropped");
        }
        return RecoveryAction.retry(config.withDropInvalidSamples(true), Map.of("drop_invalid_samples", true),
                                    "Drop samples with non-finite coordinates or values");
    }

    /**
     * Use the largest pairwise distance as the maximum lag. An explicit lag that leaves no sample pair to analyze is
     * replaced as well.
     */
    public static RecoveryAction extendMaxLag(Throwable cause, ErrorContext context, PipelineConfiguration config) {
        if (config.extendMaxLag() && config.maxLag() == null) {
            return RecoveryAction.none("Maximum lag already covers every sample pair");
        }
        var parameters = new LinkedHashMap<String, Object>();
        parameters.put("max_lag", "max_pairwise_distance");
        if (config.maxLag() != null) {
            parameters.put("replaced_max_lag", config.maxLag());
        }
        return RecoveryAction.retry(config.withMaxLag(null).withExtendMaxLag(true), parameters,
                                    "Extend the maximum lag to the largest sample separation");
    }

    public static RecoveryAction lenientGeometry(Throwable cause, ErrorContext context, PipelineConfiguration config) {
        if (!config.strictGeometry()) {
            return RecoveryAction.none("Geometry validation is already lenient");
        }
        return RecoveryAction.retry(config.withStrictGeometry(false), Map.of("strict_geometry", false),
                                    "Drop faces that reference invalid vertices");
    }

    public static RecoveryAction mergeDuplicates(Throwable cause, ErrorContext context, PipelineConfiguration config) {
        if (config.mergeDuplicates()) {
            return RecoveryAction.none("Duplicates are already merged");
        }
        return RecoveryAction.retry(config.withMergeDuplicates(true), Map.of("merge_duplicates", true),
                                    "Merge coincident samples to their mean value");
    }

    /**
     * Raise the nugget, which makes the covariance matrix strictly diagonally dominant at coincident points. A
     * degenerate drift, or a universal system in general, also falls back to ordinary kriging.
     */
    public static RecoveryAction raiseNugget(Throwable cause, ErrorContext context, PipelineConfiguration config) {
        double current = config.nuggetFraction();
        if (current >= MAX_NUGGET_FRACTION) {
            return RecoveryAction.none("Nugget is already at its maximum fraction of the sill");
        }
        double fraction = current > 0 ? Math.min(MAX_NUGGET_FRACTION, current * 2) : INITIAL_NUGGET_FRACTION;
        var builder = config.toBuilder().nuggetFraction(fraction);
        Map<String, Object> parameters = new LinkedHashMap<>();
        parameters.put("nugget_fraction", fraction);
        boolean degenerateDrift = cause instanceof SingularKrigingSystemException singular
                                  && singular.driftDegenerate();
        if (degenerateDrift || config.krigingVariant() == KrigingVariant.UNIVERSAL) {
            builder.krigingVariant(KrigingVariant.ORDINARY);
            parameters.put("kriging_variant", KrigingVariant.ORDINARY.key());
        }
        return RecoveryAction.retry(builder.build(), parameters, "Raise the nugget effect");
    }

    /**
     * Substitute inverse distance weighting for kriging
     */
    public static RecoveryAction substituteInverseDistance(Throwable cause, ErrorContext context,
                                                           PipelineConfiguration config) {
        if (config.inverseDistance()) {
            return RecoveryAction.none("Inverse distance weighting is already in use");
        }
        return RecoveryAction.substitute(config.withInverseDistance(true),
                                         Map.of("interpolation_method", "inverse_distance"),
                                         "Replace kriging with inverse distance weighting");
    }

    /**
     * Pad the observations with synthetic samples, only when the configuration allows it
     */
    public static RecoveryAction synthesizeSamples(Throwable cause, ErrorContext context,
                                                   PipelineConfiguration config) {
        if (!config.allowSyntheticSamples()) {
            return RecoveryAction.none("Synthetic samples are not allowed");
        }
        if (config.synthesizeSamples()) {
            return RecoveryAction.none("Synthetic samples are already in use");
        }
        if (cause instanceof InsufficientDataException insufficient && insufficient.available() == 0) {
            return RecoveryAction.none("No samples to synthesize from");
        }
        return RecoveryAction.retry(config.withSynthesizeSamples(true), Map.of("synthesize_samples", true),
                                    "Add synthetic samples around the existing ones");
    }
}
