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

import com.hellblazer.lithos.pipeline.PipelineConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Executes stages under the error catalog. A failing stage is classified; if the catalog knows a fix and the budget
 * still has the retry for that kind, the stage runs again with the adjusted configuration. The loop ends on success,
 * on an unclassified failure, when no fix applies, or when the budget for the failure's kind is spent, so a stage runs
 * at most once more than there are failure kinds.
 *
 * <p>Diagnostics report every fix: as auto fixed when the stage then succeeded, and as failed otherwise.
 *
 * @author hal.hildebrand
 */
public class StageRunner {
    private static final Logger log = LoggerFactory.getLogger(StageRunner.class);

    private final ErrorCatalog   catalog;
    private final RecoveryBudget budget;

    public StageRunner(ErrorCatalog catalog, RecoveryBudget budget) {
        this.catalog = Objects.requireNonNull(catalog, "catalog cannot be null");
        this.budget = Objects.requireNonNull(budget, "budget cannot be null");
    }

    private static Severity fatal(Severity severity) {
        return severity.compareTo(Severity.ERROR) < 0 ? Severity.ERROR : severity;
    }

    public RecoveryBudget budget() {
        return budget;
    }

    public <T> Result<Staged<T>> run(String name, PipelineConfiguration configuration, Stage<T> stage) {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(configuration, "configuration cannot be null");
        Objects.requireNonNull(stage, "stage cannot be null");
        var applied = new ArrayList<Fix>();
        var current = configuration;
        while (true) {
            Throwable failure;
            try {
                var value = stage.execute(current);
                if (value == null) {
                    throw new IllegalStateException("Stage " + name + " produced no value");
                }
                var diagnostics = new ArrayList<ErrorContext>();
                for (var fix : applied) {
                    diagnostics.add(fix.context().withRecovery(fix.action().modifiedParameters(),
                                                               fix.action().fallbackMethod()).log(log));
                }
                return Result.ok(new Staged<>(value, current), diagnostics);
            } catch (Exception | OutOfMemoryError e) {
                failure = e;
            }

            var classification = catalog.classify(failure, name);
            var context = classification.context();
            String reason;
            if (!classification.known()) {
                reason = "unclassified failure";
            } else if (!budget.tryAcquire(context.kind())) {
                reason = "retry for " + context.kind().key() + " already used";
            } else {
                var action = classification.strategy().recover(failure, context, current);
                if (action.recoverable()) {
                    log.info("Stage {} failed with {}, retrying: {} {}", name, context.kind().key(),
                             action.description(), action.modifiedParameters());
                    applied.add(new Fix(context, action));
                    current = action.configuration().orElseThrow();
                    continue;
                }
                reason = action.description();
            }
            log.debug("Stage {} cannot recover from {}: {}", name, context.kind().key(), reason);
            return failed(context, failure, applied);
        }
    }

    private <T> Result<Staged<T>> failed(ErrorContext context, Throwable failure, List<Fix> applied) {
        var diagnostics = new ArrayList<ErrorContext>();
        for (var fix : applied) {
            diagnostics.add(fix.context()
                               .withFailedRecovery(fix.action().modifiedParameters(), fix.action().fallbackMethod())
                               .log(log));
        }
        var error = context.withSeverity(fatal(context.severity())).log(log);
        diagnostics.add(error);
        return Result.err(error, failure, diagnostics);
    }

    private record Fix(ErrorContext context, RecoveryAction action) {
    }
}
