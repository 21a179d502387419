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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Inspects a sample set before reconstruction and grades it. The inspection never modifies the samples; it reports
 * duplicated and invalid locations, missing material tags, inconsistent material naming and elevation outliers.
 *
 * @author hal.hildebrand
 */
public class SampleQualityInspector {
    /** Minimum number of samples for the interquartile outlier test */
    public static final int MIN_OUTLIER_SAMPLES = 10;

    private static final Logger log = LoggerFactory.getLogger(SampleQualityInspector.class);

    private final double duplicateTolerance;

    public SampleQualityInspector(double duplicateTolerance) {
        if (duplicateTolerance < 0) {
            throw new IllegalArgumentException("duplicateTolerance must be non-negative: " + duplicateTolerance);
        }
        this.duplicateTolerance = duplicateTolerance;
    }

    static QualityLevel grade(List<QualityIssue> issues) {
        long critical = issues.stream().filter(i -> i.severity() == QualityIssue.Severity.CRITICAL).count();
        long high = issues.stream().filter(i -> i.severity() == QualityIssue.Severity.HIGH).count();
        long medium = issues.stream().filter(i -> i.severity() == QualityIssue.Severity.MEDIUM).count();
        if (critical > 0) {
            return QualityLevel.CRITICAL;
        } else if (high > 2) {
            return QualityLevel.POOR;
        } else if (high > 0 || medium > 3) {
            return QualityLevel.FAIR;
        } else if (medium > 0) {
            return QualityLevel.GOOD;
        }
        return QualityLevel.EXCELLENT;
    }

    /**
     * Linear interpolation quantile of sorted values
     */
    static double quantile(double[] sorted, double q) {
        double position = q * (sorted.length - 1);
        int lower = (int) Math.floor(position);
        int upper = (int) Math.ceil(position);
        return sorted[lower] + (sorted[upper] - sorted[lower]) * (position - lower);
    }

    private static List<String> recommendations(List<QualityIssue> issues) {
        var types = new LinkedHashSet<QualityIssue.Type>();
        issues.forEach(issue -> types.add(issue.type()));
        var recommendations = new ArrayList<String>();
        if (types.contains(QualityIssue.Type.INSUFFICIENT_SAMPLES)) {
            recommendations.add("Collect at least three samples at distinct locations");
        }
        if (types.contains(QualityIssue.Type.MISSING_VALUES)) {
            recommendations.add("Classify the material of every sample or collect additional measurements");
        }
        if (types.contains(QualityIssue.Type.OUTLIERS)) {
            recommendations.add("Verify outlier values through field validation or measurement review");
        }
        if (types.contains(QualityIssue.Type.DUPLICATES)) {
            recommendations.add("Merge or remove duplicate entries to keep the kriging system solvable");
        }
        if (types.contains(QualityIssue.Type.COORDINATE_ISSUES)) {
            recommendations.add("Verify coordinate system and measurement accuracy");
        }
        if (types.contains(QualityIssue.Type.FORMATION_MISMATCHES)) {
            recommendations.add("Standardize geological formation naming conventions");
        }
        if (recommendations.isEmpty()) {
            recommendations.add("Sample quality is good");
        }
        return recommendations;
    }

    public QualityReport inspect(SampleStore store) {
        var issues = new ArrayList<QualityIssue>();
        var samples = store.samples();

        var invalid = new ArrayList<String>();
        var valid = new ArrayList<Sample>();
        for (var sample : samples) {
            if (sample.hasFiniteCoordinates()) {
                valid.add(sample);
            } else {
                invalid.add(sample.id());
            }
        }
        if (!invalid.isEmpty()) {
            issues.add(new QualityIssue(QualityIssue.Type.COORDINATE_ISSUES, QualityIssue.Severity.HIGH,
                                        "Found " + invalid.size() + " samples with non-finite coordinates", invalid,
                                        "Correct or remove the affected samples", true));
        }

        checkDuplicates(store.withSamples(valid), issues);
        checkMissingMaterial(samples, issues);
        checkFormationNames(samples, issues);
        checkOutliers(valid, issues);

        long distinct = valid.stream().map(s -> Arrays.asList(s.x(), s.y())).distinct().count();
        if (distinct < 3) {
            issues.add(new QualityIssue(QualityIssue.Type.INSUFFICIENT_SAMPLES, QualityIssue.Severity.CRITICAL,
                                        "Only " + distinct + " distinct sample locations", List.of(),
                                        "Add samples before reconstruction", false));
        }

        var report = new QualityReport(grade(issues), samples.size(), issues, recommendations(issues));
        log.debug("Inspected {} samples: {} issues, quality {}", samples.size(), issues.size(), report.level());
        return report;
    }

    private void checkDuplicates(SampleStore valid, List<QualityIssue> issues) {
        if (valid.isEmpty()) {
            return;
        }
        var observations = Observations.extract(valid, SampleAttribute.ELEVATION, 2);
        var groups = observations.duplicateGroups(duplicateTolerance);
        if (groups.isEmpty()) {
            return;
        }
        var ids = new ArrayList<String>();
        groups.forEach(group -> ids.addAll(observations.ids(group)));
        issues.add(new QualityIssue(QualityIssue.Type.DUPLICATES, QualityIssue.Severity.MEDIUM,
                                    "Found " + groups.size() + " locations shared by more than one sample", ids,
                                    "Merge samples at the same location to their mean", true));
    }

    private void checkFormationNames(List<Sample> samples, List<QualityIssue> issues) {
        var spellings = new LinkedHashMap<String, Set<String>>();
        for (var sample : samples) {
            if (sample.materialTag() != null && !sample.materialTag().isBlank()) {
                spellings.computeIfAbsent(sample.materialTag().trim().toLowerCase(Locale.ROOT), k -> new TreeSet<>())
                         .add(sample.materialTag());
            }
        }
        var inconsistent = new TreeSet<String>();
        spellings.values().stream().filter(set -> set.size() > 1).forEach(inconsistent::addAll);
        if (inconsistent.isEmpty()) {
            return;
        }
        var affected = samples.stream()
                              .filter(s -> s.materialTag() != null && inconsistent.contains(s.materialTag()))
                              .map(Sample::id)
                              .toList();
        issues.add(new QualityIssue(QualityIssue.Type.FORMATION_MISMATCHES, QualityIssue.Severity.MEDIUM,
                                    "Found inconsistent formation names: " + inconsistent, affected,
                                    "Standardize formation naming convention", true));
    }

    private void checkMissingMaterial(List<Sample> samples, List<QualityIssue> issues) {
        var missing = samples.stream()
                             .filter(s -> s.materialTag() == null || s.materialTag().isBlank())
                             .map(Sample::id)
                             .toList();
        if (missing.isEmpty() || missing.size() == samples.size()) {
            // untagged sample sets are legitimate for pure elevation surfaces
            return;
        }
        issues.add(new QualityIssue(QualityIssue.Type.MISSING_VALUES, QualityIssue.Severity.LOW,
                                    missing.size() + " samples have no material classification", missing,
                                    "Classify the material of these samples", false));
    }

    private void checkOutliers(List<Sample> valid, List<QualityIssue> issues) {
        if (valid.size() < MIN_OUTLIER_SAMPLES) {
            return;
        }
        var sorted = valid.stream().mapToDouble(Sample::z).sorted().toArray();
        double q1 = quantile(sorted, 0.25), q3 = quantile(sorted, 0.75);
        double iqr = q3 - q1;
        double lower = q1 - 1.5 * iqr, upper = q3 + 1.5 * iqr;
        var outliers = valid.stream().filter(s -> s.z() < lower || s.z() > upper).map(Sample::id).toList();
        if (outliers.isEmpty()) {
            return;
        }
        double percentage = 100.0 * outliers.size() / valid.size();
        var severity = percentage > 10 ? QualityIssue.Severity.HIGH
                                       : percentage > 5 ? QualityIssue.Severity.MEDIUM : QualityIssue.Severity.LOW;
        issues.add(new QualityIssue(QualityIssue.Type.OUTLIERS, severity,
                                    String.format("Found %d elevation outliers (%.1f%%)", outliers.size(), percentage),
                                    outliers, String.format("Review elevations outside [%.2f, %.2f]", lower, upper),
                                    false));
    }
}
