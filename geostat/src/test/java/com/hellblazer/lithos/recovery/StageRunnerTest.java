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

import com.hellblazer.lithos.exceptions.DuplicateCoordinatesException;
import com.hellblazer.lithos.exceptions.SingularKrigingSystemException;
import com.hellblazer.lithos.exceptions.VariogramFitException;
import com.hellblazer.lithos.pipeline.PipelineConfiguration;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * @author hal.hildebrand
 */
public class StageRunnerTest {

    private final PipelineConfiguration config   = PipelineConfiguration.defaultConfig();
    private final AtomicInteger         attempts = new AtomicInteger();
    private       StageRunner           runner;

    @BeforeEach
    public void setUp() {
        runner = new StageRunner(ErrorCatalog.defaultCatalog(), new RecoveryBudget());
        attempts.set(0);
    }

    @Test
    public void testSuccessWithoutDiagnostics() {
        var result = runner.run("validation", config, c -> "ok");
        assertTrue(result.isOk());
        assertTrue(result.diagnostics().isEmpty());
        assertEquals("ok", result.value().orElseThrow().value());
        assertSame(config, result.value().orElseThrow().configuration());
    }

    @Test
    public void testRecoveredFailureIsReportedAsAutoFixed() {
        Result<Staged<String>> result = runner.run("validation", config, c -> {
            attempts.incrementAndGet();
            if (!c.mergeDuplicates()) {
                throw new DuplicateCoordinatesException(List.of(List.of("a", "b")));
            }
            return "merged";
        });
        assertTrue(result.isOk());
        assertEquals(2, attempts.get());
        var staged = result.value().orElseThrow();
        assertTrue(staged.configuration().mergeDuplicates());

        assertEquals(1, result.diagnostics().size());
        var diagnostic = result.diagnostics().get(0);
        assertEquals(ErrorKind.DUPLICATE_COORDINATES, diagnostic.kind());
        assertTrue(diagnostic.autoFixed());
        assertEquals(Severity.WARNING, diagnostic.severity());
        assertEquals(Map.of("merge_duplicates", true), diagnostic.modifiedParameters());
        assertEquals("validation", diagnostic.stage());
    }

    @Test
    public void testOneRetryPerKind() {
        Result<Staged<String>> result = runner.run("interpolation", config, c -> {
            attempts.incrementAndGet();
            throw new SingularKrigingSystemException("zero pivot", false);
        });
        assertFalse(result.isOk());
        assertEquals(2, attempts.get());
        assertEquals(2, result.diagnostics().size());

        var attempted = result.diagnostics().get(0);
        assertFalse(attempted.autoFixed());
        assertEquals(0.1, attempted.modifiedParameters().get("nugget_fraction"));

        var error = result.error().orElseThrow();
        assertSame(error, result.diagnostics().get(1));
        assertEquals(ErrorKind.SINGULAR_SYSTEM, error.kind());
        assertEquals(Severity.ERROR, error.severity());
        assertFalse(error.autoFixed());
        assertInstanceOf(SingularKrigingSystemException.class, ((Result.Err<?>) result).cause());
    }

    @Test
    public void testSuccessiveFixesOfDifferentKinds() {
        Result<Staged<Integer>> result = runner.run("variogram", config, c -> {
            attempts.incrementAndGet();
            if (!c.extendMaxLag()) {
                throw new VariogramFitException("no pairs");
            }
            if (c.nuggetFraction() == 0) {
                throw new SingularKrigingSystemException("zero pivot", false);
            }
            return 42;
        });
        assertTrue(result.isOk());
        assertEquals(3, attempts.get());
        assertEquals(List.of(ErrorKind.VARIOGRAM_FIT_FAILURE, ErrorKind.SINGULAR_SYSTEM),
                     result.diagnostics().stream().map(ErrorContext::kind).toList());
        assertTrue(result.diagnostics().stream().allMatch(ErrorContext::autoFixed));
    }

    @Test
    public void testUnknownFailureIsNotRetried() {
        Result<Staged<String>> result = runner.run("export", config, c -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("disk full");
        });
        assertFalse(result.isOk());
        assertEquals(1, attempts.get());
        var error = result.error().orElseThrow();
        assertEquals(ErrorKind.UNKNOWN, error.kind());
        assertTrue(error.technicalDetail().contains("disk full"));
    }

    @Test
    public void testFixFollowedByUnrecoverableFailure() {
        Result<Staged<String>> result = runner.run("validation", config, c -> {
            if (!c.mergeDuplicates()) {
                throw new DuplicateCoordinatesException(List.of(List.of("a", "b")));
            }
            throw new IllegalArgumentException("corrupt sample");
        });
        assertFalse(result.isOk());
        assertEquals(2, result.diagnostics().size());
        var fix = result.diagnostics().get(0);
        assertEquals(ErrorKind.DUPLICATE_COORDINATES, fix.kind());
        assertFalse(fix.autoFixed());
        assertEquals(Map.of("merge_duplicates", true), fix.modifiedParameters());
        assertEquals(ErrorKind.UNKNOWN, result.error().orElseThrow().kind());
    }

    @Test
    public void testBudgetIsSharedAcrossStages() {
        var first = runner.run("interpolation", config, c -> {
            if (c.nuggetFraction() == 0) {
                throw new SingularKrigingSystemException("zero pivot", false);
            }
            return "first";
        });
        assertTrue(first.isOk());
        assertTrue(runner.budget().isSpent(ErrorKind.SINGULAR_SYSTEM));

        Result<Staged<String>> second = runner.run("cross_validation", config, c -> {
            attempts.incrementAndGet();
            throw new SingularKrigingSystemException("zero pivot", false);
        });
        assertFalse(second.isOk());
        assertEquals(1, attempts.get());
        assertEquals(1, second.diagnostics().size());
    }

    @Test
    public void testOutOfMemoryIsRecovered() {
        var result = runner.run("interpolation", config, c -> {
            if (c.gridResolution() < 20) {
                throw new OutOfMemoryError("Java heap space");
            }
            return c.gridResolution();
        });
        assertTrue(result.isOk());
        assertEquals(20.0, result.value().orElseThrow().value());
        var diagnostic = result.diagnostics().get(0);
        assertEquals(ErrorKind.MEMORY_EXHAUSTION, diagnostic.kind());
        assertEquals(Severity.WARNING, diagnostic.severity());
    }

    @Test
    public void testStageWithoutValueFails() {
        var result = runner.run("analysis", config, c -> null);
        assertFalse(result.isOk());
        assertEquals(ErrorKind.UNKNOWN, result.error().orElseThrow().kind());
    }
}
