package dev.mars.cascade.engine;

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

import dev.mars.cascade.core.ActionState;
import dev.mars.cascade.core.exceptions.RunAbortedException;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Caller's grip on a started run: cancel it, watch it, or wait for its result.
 */
public class RunHandle {

    private final WorkflowRun run;
    private final CompletableFuture<RunResult> result;

    RunHandle(WorkflowRun run, CompletableFuture<RunResult> result) {
        this.run = run;
        this.result = result;
    }

    public String getRunId() {
        return run.getRunId();
    }

    /**
     * Requests cooperative cancellation. Returns immediately; the run finishes once in-flight
     * runners stop or the grace period runs out. Has no effect on a finished run.
     */
    public void cancel() {
        if (!result.isDone()) {
            run.cancel();
        }
    }

    public boolean isCancelRequested() {
        return run.isCancelRequested();
    }

    public boolean isDone() {
        return result.isDone();
    }

    /**
     * Live state of an action while the run is in progress.
     */
    public ActionState getState(String actionId) {
        return run.getState(actionId);
    }

    /**
     * Blocks until the run finishes.
     *
     * @throws RunAbortedException  if the run was aborted by an engine invariant violation
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public RunResult await() throws InterruptedException {
        try {
            return result.get();
        } catch (ExecutionException e) {
            throw aborted(e.getCause());
        }
    }

    /**
     * Blocks until the run finishes or the timeout elapses.
     *
     * @throws TimeoutException if the run is still going after {@code timeout}
     */
    public RunResult await(Duration timeout) throws InterruptedException, TimeoutException {
        try {
            return result.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (ExecutionException e) {
            throw aborted(e.getCause());
        }
    }

    /**
     * The result as a future; it completes exceptionally with a {@link RunAbortedException}
     * when the run aborts.
     */
    public CompletableFuture<RunResult> toCompletableFuture() {
        return result.handle((value, error) -> {
            if (error != null) {
                throw aborted(error);
            }
            return value;
        });
    }

    private RunAbortedException aborted(Throwable cause) {
        Throwable root = cause instanceof CompletionException && cause.getCause() != null ? cause.getCause() : cause;
        if (root instanceof RunAbortedException runAborted) {
            return runAborted;
        }
        return new RunAbortedException(getRunId(), root);
    }
}
