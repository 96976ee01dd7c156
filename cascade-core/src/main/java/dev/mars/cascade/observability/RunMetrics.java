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

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * OpenTelemetry metrics for workflow runs.
 *
 * Provides 9 metrics:
 * - cascade.run.active (gauge) - Runs currently in progress
 * - cascade.run.total (counter) - Runs started
 * - cascade.run.completed (counter) - Runs that ended in SUCCESS
 * - cascade.run.failed (counter) - Runs that ended in FAILURE
 * - cascade.run.cancelled (counter) - Runs that ended in CANCELLED
 * - cascade.action.executed (counter) - Actions handed to a runner
 * - cascade.action.failed (counter) - Actions that ended in FAILURE
 * - cascade.action.skipped (counter) - Actions that were skipped
 * - cascade.run.duration.seconds (histogram) - Run duration distribution
 *
 * Without an OpenTelemetry SDK registered globally every instrument is a no-op.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-01-27
 * @version 1.0
 */
public class RunMetrics {

    private static final Logger logger = LoggerFactory.getLogger(RunMetrics.class);
    private static final String METER_NAME = "cascade-engine";

    private static RunMetrics instance;

    private final LongCounter runsTotal;
    private final LongCounter runsCompleted;
    private final LongCounter runsFailed;
    private final LongCounter runsCancelled;
    private final LongCounter actionsExecuted;
    private final LongCounter actionsFailed;
    private final LongCounter actionsSkipped;

    private final DoubleHistogram runDuration;

    private final AtomicLong activeRuns = new AtomicLong(0);

    private static final AttributeKey<String> STRATEGY_KEY = AttributeKey.stringKey("strategy");
    private static final AttributeKey<String> ACTION_KIND_KEY = AttributeKey.stringKey("action.kind");

    private RunMetrics() {
        Meter meter = GlobalOpenTelemetry.getMeter(METER_NAME);

        runsTotal = meter.counterBuilder("cascade.run.total")
                .setDescription("Total number of runs started")
                .setUnit("1")
                .build();

        runsCompleted = meter.counterBuilder("cascade.run.completed")
                .setDescription("Number of runs that ended in SUCCESS")
                .setUnit("1")
                .build();

        runsFailed = meter.counterBuilder("cascade.run.failed")
                .setDescription("Number of runs that ended in FAILURE")
                .setUnit("1")
                .build();

        runsCancelled = meter.counterBuilder("cascade.run.cancelled")
                .setDescription("Number of runs that ended in CANCELLED")
                .setUnit("1")
                .build();

        actionsExecuted = meter.counterBuilder("cascade.action.executed")
                .setDescription("Number of actions handed to a runner")
                .setUnit("1")
                .build();

        actionsFailed = meter.counterBuilder("cascade.action.failed")
                .setDescription("Number of actions that ended in FAILURE")
                .setUnit("1")
                .build();

        actionsSkipped = meter.counterBuilder("cascade.action.skipped")
                .setDescription("Number of actions that were skipped")
                .setUnit("1")
                .build();

        runDuration = meter.histogramBuilder("cascade.run.duration.seconds")
                .setDescription("Run duration in seconds")
                .setUnit("s")
                .build();

        meter.gaugeBuilder("cascade.run.active")
                .setDescription("Number of runs currently in progress")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(activeRuns.get()));

        logger.debug("RunMetrics initialized");
    }

    public static synchronized RunMetrics getInstance() {
        if (instance == null) {
            instance = new RunMetrics();
        }
        return instance;
    }

    public void recordRunStarted(String strategy) {
        runsTotal.add(1, Attributes.of(STRATEGY_KEY, strategy));
        activeRuns.incrementAndGet();
    }

    /**
     * Record the end of a run.
     *
     * @param strategy        strategy name
     * @param verdict         final verdict name (SUCCESS, FAILURE or CANCELLED)
     * @param durationSeconds wall-clock duration
     */
    public void recordRunFinished(String strategy, String verdict, double durationSeconds) {
        activeRuns.decrementAndGet();
        Attributes attrs = Attributes.of(STRATEGY_KEY, strategy);
        switch (verdict) {
            case "SUCCESS":
                runsCompleted.add(1, attrs);
                break;
            case "CANCELLED":
                runsCancelled.add(1, attrs);
                break;
            default:
                runsFailed.add(1, attrs);
                break;
        }
        runDuration.record(durationSeconds, attrs);
    }

    public void recordActionExecuted(String kind) {
        actionsExecuted.add(1, Attributes.of(ACTION_KIND_KEY, kind));
    }

    public void recordActionFailed(String kind) {
        actionsFailed.add(1, Attributes.of(ACTION_KIND_KEY, kind));
    }

    public void recordActionSkipped(String kind) {
        actionsSkipped.add(1, Attributes.of(ACTION_KIND_KEY, kind));
    }

    public long getActiveRuns() {
        return activeRuns.get();
    }
}
