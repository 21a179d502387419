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
package com.hellblazer.lithos.sample;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.vecmath.Point3d;
import java.util.ArrayList;

/**
 * Pads an undersized observation set with synthetic observations carrying the mean value, so that a structure model
 * can still be fitted. Only used when the caller explicitly allows synthetic samples. Placement is deterministic: the
 * synthetic points are spread on a circle around the centroid whose radius is half the largest pairwise distance, or
 * the fallback spacing when the observations are a single point.
 *
 * @author hal.hildebrand
 */
public class SyntheticSampleGenerator {
    public static final String ID_PREFIX = "synthetic-";

    private static final Logger log = LoggerFactory.getLogger(SyntheticSampleGenerator.class);

    private final double fallbackSpacing;

    public SyntheticSampleGenerator(double fallbackSpacing) {
        if (!(fallbackSpacing > 0)) {
            throw new IllegalArgumentException("fallbackSpacing must be positive: " + fallbackSpacing);
        }
        this.fallbackSpacing = fallbackSpacing;
    }

    /**
     * @return the observations padded to {@code target} entries, or unchanged when already large enough
     * @throws IllegalArgumentException when there is no observation to derive synthetic values from
     */
    public Observations augment(Observations observations, int target) {
        int missing = target - observations.size();
        if (missing <= 0) {
            return observations;
        }
        if (observations.size() == 0) {
            throw new IllegalArgumentException("Cannot synthesize samples without any observation");
        }
        double cx = 0, cy = 0, cz = 0;
        for (int i = 0; i < observations.size(); i++) {
            cx += observations.x(i);
            cy += observations.y(i);
            cz += observations.z(i);
        }
        cx /= observations.size();
        cy /= observations.size();
        cz /= observations.size();
        double radius = observations.maxPairwiseDistance() / 2;
        if (!(radius > 0)) {
            radius = fallbackSpacing;
        }
        double mean = observations.mean();
        var ids = new ArrayList<String>(missing);
        var positions = new ArrayList<Point3d>(missing);
        var values = new double[missing];
        // start perpendicular to the first pair so a padded pair never ends up colinear
        double phase = Math.PI / 4;
        if (observations.size() >= 2) {
            phase = Math.atan2(observations.y(1) - observations.y(0), observations.x(1) - observations.x(0))
            + Math.PI / 2;
        }
        for (int k = 0; k < missing; k++) {
            double angle = phase + 2 * Math.PI * k / (missing + 1);
            ids.add(ID_PREFIX + k);
            positions.add(new Point3d(cx + radius * Math.cos(angle), cy + radius * Math.sin(angle), cz));
            values[k] = mean;
        }
        log.warn("Synthesized {} samples around ({}, {}) with value {}", missing, cx, cy, mean);
        return observations.with(ids, positions, values);
    }
}
