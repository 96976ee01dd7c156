package dev.mars.cascade.runner;

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

import dev.mars.cascade.config.CascadeConfiguration;

/**
 * Service-provider hook through which runner plugins contribute kinds to a registry.
 * Implementations are listed in {@code META-INF/services/dev.mars.cascade.runner.ActionRunnerProvider}
 * and need a public no-argument constructor.
 */
public interface ActionRunnerProvider {

    /**
     * Short name used in log messages.
     */
    String getName();

    /**
     * Called once before {@link #registerRunners(ActionRunnerRegistry)} with the effective
     * configuration.
     */
    default void configure(CascadeConfiguration configuration) {
    }

    void registerRunners(ActionRunnerRegistry registry);
}
