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

import com.hellblazer.lithos.exceptions.ComputationTimeoutException;
import com.hellblazer.lithos.exceptions.DuplicateCoordinatesException;
import com.hellblazer.lithos.exceptions.GridTooLargeException;
import com.hellblazer.lithos.exceptions.InsufficientDataException;
import com.hellblazer.lithos.exceptions.InvalidCoordinatesException;
import com.hellblazer.lithos.exceptions.NumericalInstabilityException;
import com.hellblazer.lithos.exceptions.SingularKrigingSystemException;
import com.hellblazer.lithos.exceptions.VariogramFitException;
import com.hellblazer.lithos.scene.SceneGeometryException;
import org.apache.commons.math3.linear.SingularMatrixException;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.regex.Pattern;

/**
 * Maps failures to the kind, user facing description and automatic fix the recovery layer applies. Entries match
 * either structurally, by exception type, or textually, by a regular expression over the messages of the failure and
 * its causes. Structural entries are consulted before textual ones, each group in registration order.
 *
 * <p>Immutable; share one instance between concurrent runs.
 *
 * @author hal.hildebrand
 */
public final class ErrorCatalog {
    private static volatile ErrorCatalog defaultCatalog;

    private final List<Entry> structural;
    private final List<Entry> textual;

    private ErrorCatalog(List<Entry> structural, List<Entry> textual) {
        this.structural = List.copyOf(structural);
        this.textual = List.copyOf(textual);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * The catalog of the failure modes the pipeline knows how to describe and fix
     */
    public static ErrorCatalog defaultCatalog() {
        var catalog = defaultCatalog;
        if (catalog == null) {
            synchronized (ErrorCatalog.class) {
                catalog = defaultCatalog;
                if (catalog == null) {
                    defaultCatalog = catalog = buildDefault();
                }
            }
        }
        return catalog;
    }

    private static ErrorCatalog buildDefault() {
        return builder().structural(InsufficientDataException.class, ErrorKind.INSUFFICIENT_POINTS,
                                    "Not enough samples to model spatial structure",
                                    "Provide at least 3 samples at distinct locations",
                                    RecoveryStrategies::synthesizeSamples)
                        .structural(DuplicateCoordinatesException.class, ErrorKind.DUPLICATE_COORDINATES,
                                    "Several samples share the same location",
                                    "Remove or merge duplicated boreholes", RecoveryStrategies::mergeDuplicates)
                        .structural(InvalidCoordinatesException.class, ErrorKind.INVALID_COORDINATES,
                                    "Some samples have missing or non-finite coordinates or values",
                                    "Check the coordinates of the listed samples",
                                    RecoveryStrategies::dropInvalidSamples)
                        .structural(SingularKrigingSystemException.class, ErrorKind.SINGULAR_SYSTEM,
                                    "The kriging system is singular",
                                    "Remove coincident samples or add a nugget to the variogram model",
                                    RecoveryStrategies::raiseNugget)
                        .structural(SingularMatrixException.class, ErrorKind.SINGULAR_SYSTEM,
                                    "The kriging system is singular",
                                    "Remove coincident samples or add a nugget to the variogram model",
                                    RecoveryStrategies::raiseNugget)
                        .structural(VariogramFitException.class, ErrorKind.VARIOGRAM_FIT_FAILURE,
                                    "The spatial structure of the samples could not be analyzed",
                                    "Increase the maximum lag or choose a different variogram model",
                                    RecoveryStrategies::extendMaxLag)
                        .structural(NumericalInstabilityException.class, ErrorKind.NUMERICAL_INSTABILITY,
                                    "Interpolation produced non-finite values",
                                    "Choose a smoother variogram model or a larger nugget",
                                    RecoveryStrategies::substituteInverseDistance)
                        .structural(ComputationTimeoutException.class, ErrorKind.COMPUTATION_TIMEOUT,
                                    "Interpolation took longer than allowed",
                                    "Increase the timeout or use a coarser grid",
                                    RecoveryStrategies::substituteInverseDistance)
                        .structural(GridTooLargeException.class, ErrorKind.MEMORY_EXHAUSTION,
                                    "The interpolation grid is too large", "Use a coarser grid resolution",
                                    RecoveryStrategies::coarsenGrid)
                        .structural(OutOfMemoryError.class, ErrorKind.MEMORY_EXHAUSTION,
                                    "Ran out of memory", "Use a coarser grid resolution",
                                    RecoveryStrategies::coarsenGrid)
                        .structural(SceneGeometryException.class, ErrorKind.MESH_GENERATION_FAILURE,
                                    "Scene geometry could not be built", "Check the mesh for invalid faces",
                                    RecoveryStrategies::lenientGeometry)
                        .textual("singular|not positive definite", ErrorKind.SINGULAR_SYSTEM,
                                 "The kriging system is singular",
                                 "Remove coincident samples or add a nugget to the variogram model",
                                 RecoveryStrategies::raiseNugget)
                        .textual("java heap space|out of memory|cannot allocate", ErrorKind.MEMORY_EXHAUSTION,
                                 "Ran out of memory", "Use a coarser grid resolution",
                                 RecoveryStrategies::coarsenGrid)
                        .textual("timed? ?out", ErrorKind.COMPUTATION_TIMEOUT, "Interpolation took longer than allowed",
                                 "Increase the timeout or use a coarser grid",
                                 RecoveryStrategies::substituteInverseDistance)
                        .textual("triangulat|mesh", ErrorKind.MESH_GENERATION_FAILURE,
                                 "Scene geometry could not be built", "Check the mesh for invalid faces",
                                 RecoveryStrategies::lenientGeometry)
                        .build();
    }

    private static String describe(Throwable failure) {
        var message = failure.getMessage();
        return failure.getClass().getSimpleName() + (message == null ? "" : ": " + message);
    }

    /**
     * Classify a failure raised by the named stage. Unmatched failures yield an {@link ErrorKind#UNKNOWN}
     * classification that preserves the original message and has no fix.
     */
    public Classification classify(Throwable failure, String stage) {
        Objects.requireNonNull(failure, "failure cannot be null");
        var entry = match(failure);
        var detail = describe(failure);
        if (entry.isEmpty()) {
            var context = ErrorContext.of(ErrorKind.UNKNOWN, "Unexpected failure in " + stage,
                                          "Report the technical detail", detail, stage);
            return new Classification(context, RecoveryStrategy.NONE, false);
        }
        var e = entry.get();
        var context = ErrorContext.of(e.kind(), e.humanMessage(), e.suggestedFix(), detail, stage);
        return new Classification(context, e.strategy(), true);
    }

    private Optional<Entry> match(Throwable failure) {
        for (var entry : structural) {
            if (entry.signature().test(failure)) {
                return Optional.of(entry);
            }
        }
        for (var entry : textual) {
            if (entry.signature().test(failure)) {
                return Optional.of(entry);
            }
        }
        return Optional.empty();
    }

    public int size() {
        return structural.size() + textual.size();
    }

    /**
     * Result of classifying a failure
     *
     * @param context  the description of the failure
     * @param strategy the fix to attempt
     * @param known    false for failures no entry matched
     */
    public record Classification(ErrorContext context, RecoveryStrategy strategy, boolean known) {
    }

    private record Entry(ErrorKind kind, Predicate<Throwable> signature, String humanMessage, String suggestedFix,
                         RecoveryStrategy strategy) {
    }

    /**
     * Builder for ErrorCatalog
     */
    public static class Builder {
        private final List<Entry> structural = new ArrayList<>();
        private final List<Entry> textual    = new ArrayList<>();

        public ErrorCatalog build() {
            return new ErrorCatalog(structural, textual);
        }

        /**
         * Match failures of the type, or failures caused by one
         */
        public Builder structural(Class<? extends Throwable> type, ErrorKind kind, String humanMessage,
                                  String suggestedFix, RecoveryStrategy strategy) {
            Objects.requireNonNull(type, "type cannot be null");
            Predicate<Throwable> signature = failure -> {
                for (var t = failure; t != null; t = t.getCause()) {
                    if (type.isInstance(t)) {
                        return true;
                    }
                }
                return false;
            };
            structural.add(new Entry(kind, signature, humanMessage, suggestedFix, strategy));
            return this;
        }

        /**
         * Match failures whose message, or the message of one of their causes, contains the case insensitive regular
         * expression
         */
        public Builder textual(String regex, ErrorKind kind, String humanMessage, String suggestedFix,
                               RecoveryStrategy strategy) {
            var pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
            Predicate<Throwable> signature = failure -> {
                for (var t = failure; t != null; t = t.getCause()) {
                    if (t.getMessage() != null && pattern.matcher(t.getMessage()).find()) {
                        return true;
                    }
                }
                return false;
            };
            textual.add(new Entry(kind, signature, humanMessage, suggestedFix, strategy));
            return this;
        }
    }
}
