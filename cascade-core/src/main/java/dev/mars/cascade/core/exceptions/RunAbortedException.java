package dev.mars.cascade.core.exceptions;

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


/**
 * Surfaces an engine invariant violation (outcome conflict, illegal state transition,
 * stalled scheduler) to the caller waiting on a run. Action failures never produce it.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
public class RunAbortedException extends RuntimeException {

    private final String runId;

    public RunAbortedException(String runId, Throwable cause) {
        super("Run " + runId + " aborted: " + cause.getMessage(), cause);
        this.runId = runId;
    }

    public String getRunId() {
        return runId;
    }
}
