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

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class SampleQualityInspectorTest {

    private final SampleQualityInspector inspector = new SampleQualityInspector(1e-9);

    private static List<Sample> grid(int n, String material) {
        var samples = new ArrayList<Sample>();
        for (int j = 0; j < n; j++) {
            for (int i = 0; i < n; i++) {
                samples.add(Sample.of("b" + i + "-" + j, i * 10, j * 10, 100 + 0.1 * i + 0.2 * j, material));
            }
        }
        return samples;
    }

    @Test
    public void testCleanSamples() {
        var report = inspector.inspect(SampleStore.of(grid(4, "clay")));
        assertEquals(QualityLevel.EXCELLENT, report.level());
        assertTrue(report.issues().isEmpty());
        assertEquals(List.of("Sample quality is good"), report.recommendations());
        assertEquals(16, report.totalSamples());
    }

    @Test
    public void testDuplicates() {
        var samples = grid(3, "clay");
        samples.add(Sample.of("again", 10, 10, 100.3, "clay"));
        var report = inspector.inspect(SampleStore.of(samples));
        assertTrue(report.has(QualityIssue.Type.DUPLICATES));
        assertEquals(QualityLevel.GOOD, report.level());
    }

    @Test
    public void testTooFewLocations() {
        var samples = List.of(Sample.of("a", 0, 0, 1), Sample.of("b", 0, 0, 2), Sample.of("c", 5, 5, 3));
        var report = inspector.inspect(SampleStore.of(samples));
        assertTrue(report.has(QualityIssue.Type.INSUFFICIENT_SAMPLES));
        assertEquals(QualityLevel.CRITICAL, report.level());
    }

    @Test
    public void testInvalidCoordinates() {
        var samples = grid(3, null);
        samples.add(Sample.of("broken", Double.NaN, 0, 1));
        var report = inspector.inspect(SampleStore.of(samples));
        assertTrue(report.has(QualityIssue.Type.COORDINATE_ISSUES));
        assertEquals(QualityLevel.FAIR, report.level());
        assertFalse(report.has(QualityIssue.Type.MISSING_VALUES));
    }

    @Test
    public void testFormationNamingAndMissingMaterial() {
        var samples = new ArrayList<>(grid(2, "Clay"));
        samples.add(Sample.of("lower", 50, 50, 90, "clay "));
        samples.add(Sample.of("untagged", 60, 50, 90));
        var report = inspector.inspect(SampleStore.of(samples));
        assertTrue(report.has(QualityIssue.Type.FORMATION_MISMATCHES));
        assertTrue(report.has(QualityIssue.Type.MISSING_VALUES));
        assertEquals(QualityLevel.GOOD, report.level());
    }

    @Test
    public void testElevationOutliers() {
        var samples = new ArrayList<Sample>();
        for (int i = 0; i < 11; i++) {
            samples.add(Sample.of("b" + i, i * 10, (i % 3) * 10, 10));
        }
        samples.add(Sample.of("spike", 200, 200, 100));
        var report = inspector.inspect(SampleStore.of(samples));
        assertTrue(report.has(QualityIssue.Type.OUTLIERS));
        var outliers = report.issues()
                             .stream()
                             .filter(issue -> issue.type() == QualityIssue.Type.OUTLIERS)
                             .findFirst()
                             .orElseThrow();
        assertEquals(List.of("spike"), outliers.sampleIds());
        assertEquals(QualityIssue.Severity.MEDIUM, outliers.severity());
    }
}
