package dev.mars.cascade.strategy;

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
 * Single lane, fixed topological order, and the first failure halts the run: every action
 * that has not started yet is skipped. Every dependency edge is strict, so dependents of a
 * WARNING or SKIPPED action are skipped as well.
 */
public class StrictStrategy extends SingleLaneStrategy {

    public static final String NAME = "strict";

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    protected boolean haltsOnFailure() {
        return true;
    }

    @Override
    protected FailurePropagation.EdgePolicy edgePolicy() {
        return FailurePropagation.EdgePolicy.ALL_STRICT;
    }
}
