package dev.mars.cascade.workflow.runners;

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
import dev.mars.cascade.runner.ActionRunnerProvider;
import dev.mars.cascade.runner.ActionRunnerRegistry;

/**
 * Contributes the runners shipped with Cascade: {@code echo} and {@code shell}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-25
 * @version 1.0
 */
public class BundledRunnerProvider implements ActionRunnerProvider {

    private boolean injectShellFunctions = true;

    @Override
    public String getName() {
        return "bundled";
    }

    @Override
    public void configure(CascadeConfiguration configuration) {
        this.injectShellFunctions = configuration.isShellInjectFunctions();
    }

    @Override
    public void registerRunners(ActionRunnerRegistry registry) {
        boolean inject = injectShellFunctions;
        registry.register(EchoRunner.KIND, EchoRunner::new);
        registry.register(ShellRunner.KIND, () -> new ShellRunner(inject));
    }

    boolean isInjectShellFunctions() {
        return injectShellFunctions;
    }
}
