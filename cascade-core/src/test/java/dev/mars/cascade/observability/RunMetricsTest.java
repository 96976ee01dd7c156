package dev.mars.cascade.observability;

/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for RunMetrics. Without an SDK installed the instruments are no-ops, so only the
 * locally tracked active-run gauge is observable.
 */
class RunMetricsTest {

    @Test
    void testSingleton() {
        assertSame(RunMetrics.getInstance(), RunMetrics.getInstance());
    }

    @Test
    void testActiveRunsTracksStartAndFinish() {
        RunMetrics metrics = RunMetrics.getInstance();
        long before = metrics.getActiveRuns();

        metrics.recordRunStarted("free");
        assertEquals(before + 1, metrics.getActiveRuns());

        metrics.recordRunFinished("free", "SUCCESS", 0.25);
        assertEquals(before, metrics.getActiveRuns());
    }

    @Test
    void testActionCountersAcceptAnyKind() {
        RunMetrics metrics = RunMetrics.getInstance();

        assertDoesNotThrow(() -> {
            metrics.recordActionExecuted("shell");
            metrics.recordActionFailed("shell");
            metrics.recordActionSkipped("echo");
            metrics.recordRunStarted("strict");
            metrics.recordRunFinished("strict", "CANCELLED", 1.0);
        });
    }
}
