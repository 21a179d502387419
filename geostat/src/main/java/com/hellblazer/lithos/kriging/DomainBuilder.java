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
package com.hellblazer.lithos.kriging;

import com.hellblazer.lithos.common.Bounds3d;
import com.hellblazer.lithos.sample.Observations;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Derives the interpolation grid from the observation bounds.
 *
 * <p>With {@link DomainExtension#MARGIN} each horizontal side grows by the configured margin, or by default by
 * {@code max(0.2 * extent, resolution)} so every observation lies strictly inside the grid. With
 * {@link DomainExtension#FOUNDATION_MULTIPLE} the horizontal footprint is scaled about its center by the multiplier.
 * Three dimensional domains always grow vertically by {@code max(0.2 * extent, verticalResolution)}.
 *
 * @author hal.hildebrand
 */
public class DomainBuilder {
    /** Default margin as a fraction of the sample extent */
    public static final double DEFAULT_MARGIN_FRACTION = 0.2;

    private static final Logger log = LoggerFactory.getLogger(DomainBuilder.class);

    private final double          resolution;
    private final double          verticalResolution;
    private final double[]        margins;
    private final DomainExtension extension;
    private final double          multiplier;

    /**
     * @param resolution         horizontal grid spacing
     * @param verticalResolution vertical grid spacing, used in 3 dimensions
     * @param margins            explicit horizontal margins [mx, my], or null for the default
     * @param extension          extension method
     * @param multiplier         footprint scale for {@link DomainExtension#FOUNDATION_MULTIPLE}
     */
    public DomainBuilder(double resolution, double verticalResolution, double[] margins, DomainExtension extension,
                         double multiplier) {
        if (!(resolution > 0) || !(verticalResolution > 0)) {
            throw new IllegalArgumentException("Resolutions must be positive: " + resolution + ", " + verticalResolution);
        }
        if (margins != null && (margins.length != 2 || !(margins[0] >= 0) || !(margins[1] >= 0))) {
            throw new IllegalArgumentException("Margins must be two non-negative values");
        }
        if (!(multiplier >= 1)) {
            throw new IllegalArgumentException("multiplier must be at least 1: " + multiplier);
        }
        this.resolution = resolution;
        this.verticalResolution = verticalResolution;
        this.margins = margins == null ? null : margins.clone();
        this.extension = Objects.requireNonNull(extension, "extension cannot be null");
        this.multiplier = multiplier;
    }

    private static double defaultMargin(double extent, double resolution) {
        return Math.max(DEFAULT_MARGIN_FRACTION * extent, resolution);
    }

    /**
     * The extended domain around the sample bounds
     */
    public Bounds3d domain(Bounds3d sampleBounds, int dimension) {
        double mz = dimension == 3 ? defaultMargin(sampleBounds.extentZ(), verticalResolution) : 0;
        Bounds3d domain;
        if (extension == DomainExtension.FOUNDATION_MULTIPLE) {
            double hx = Math.max(sampleBounds.extentX() * multiplier / 2, sampleBounds.extentX() / 2 + resolution);
            double hy = Math.max(sampleBounds.extentY() * multiplier / 2, sampleBounds.extentY() / 2 + resolution);
            var c = sampleBounds.center();
            domain = new Bounds3d(c.x - hx, c.y - hy, sampleBounds.minZ() - mz, c.x + hx, c.y + hy,
                                  sampleBounds.maxZ() + mz);
        } else {
            double mx = margins != null ? margins[0] : defaultMargin(sampleBounds.extentX(), resolution);
            double my = margins != null ? margins[1] : defaultMargin(sampleBounds.extentY(), resolution);
            domain = sampleBounds.expand(mx, my, mz);
        }
        if (dimension == 2) {
            domain = new Bounds3d(domain.minX(), domain.minY(), 0, domain.maxX(), domain.maxY(), 0);
        }
        return domain;
    }

    /**
     * Node count of the grid {@link #grid(Observations)} would build, without building it
     */
    public long estimatedNodeCount(Observations observations) {
        var domain = domain(observations.bounds(), observations.dimension());
        long nodes = GridDefinition.nodesFor(domain.extentX(), resolution) * GridDefinition.nodesFor(domain.extentY(),
                                                                                                     resolution);
        if (observations.dimension() == 3) {
            nodes *= GridDefinition.nodesFor(domain.extentZ(), verticalResolution);
        }
        return nodes;
    }

    /**
     * The grid over the extended domain of the observations
     */
    public GridDefinition grid(Observations observations) {
        var domain = domain(observations.bounds(), observations.dimension());
        var grid = GridDefinition.covering(domain, resolution, verticalResolution, observations.dimension());
        log.debug("Domain {} -> grid {}x{}x{} at spacing {}", domain, grid.nx(), grid.ny(), grid.nz(), resolution);
        return grid;
    }
}
