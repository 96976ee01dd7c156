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


/**
 * Process exit codes for the command-line runner.
 */
public enum ExitCode {

    SUCCESS(0),
    FAILURE(1),
    USAGE_ERROR(2),
    INTERNAL_ERROR(101),
    LOAD_ERROR(102),
    VALIDATION_ERROR(103),
    SOURCE_ERROR(104),
    /** 128 + SIGINT, as shells report an interrupted command. */
    CANCELLED(130);

    private final int code;

    ExitCode(int code) {
        this.code = code;
    }

    public int getCode() {
        return code;
    }

    public static ExitCode forVerdict(RunVerdict verdict) {
        return switch (verdict) {
            case SUCCESS -> SUCCESS;
            case FAILURE -> FAILURE;
            case CANCELLED -> CANCELLED;
        };
    }
}
