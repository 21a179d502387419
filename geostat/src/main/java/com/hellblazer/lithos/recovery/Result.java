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

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of a pipeline stage: a value, or the error that ended the stage. Both carry the diagnostics produced along
 * the way, including any automatic fixes that were applied.
 *
 * @param <T> the stage's value type
 * @author hal.hildebrand
 */
public sealed interface Result<T> permits Result.Ok, Result.Err {

    static <T> Result<T> err(ErrorContext error, Throwable cause, List<ErrorContext> diagnostics) {
        return new Err<>(error, cause, diagnostics);
    }

    static <T> Result<T> ok(T value, List<ErrorContext> diagnostics) {
        return new Ok<>(value, diagnostics);
    }

    List<ErrorContext> diagnostics();

    /**
     * @return the error, when the stage failed
     */
    default Optional<ErrorContext> error() {
        return this instanceof Err<T> err ? Optional.of(err.failure()) : Optional.empty();
    }

    default boolean isOk() {
        return this instanceof Ok;
    }

    /**
     * @return the value, when the stage succeeded
     */
    default Optional<T> value() {
        return this instanceof Ok<T> ok ? Optional.of(ok.payload()) : Optional.empty();
    }

    record Ok<T>(T payload, List<ErrorContext> diagnostics) implements Result<T> {
        public Ok {
            Objects.requireNonNull(payload, "value cannot be null");
            diagnostics = List.copyOf(diagnostics);
        }
    }

    /**
     * @param failure     the final, unrecovered error; the last entry of the diagnostics
     * @param cause       the failure that produced it
     * @param diagnostics every context reported by the stage, in order
     */
    record Err<T>(ErrorContext failure, Throwable cause, List<ErrorContext> diagnostics) implements Result<T> {
        public Err {
            Objects.requireNonNull(failure, "error cannot be null");
            diagnostics = List.copyOf(diagnostics);
        }
    }
}
