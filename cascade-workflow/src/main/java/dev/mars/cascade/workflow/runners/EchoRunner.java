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

import dev.mars.cascade.runner.ActionInvocation;
import dev.mars.cascade.runner.ActionResult;
import dev.mars.cascade.runner.ActionRunner;
import dev.mars.cascade.runner.CancelSignal;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Emits its {@code message} parameter line by line. An optional {@code yield} mapping is
 * published as the action's outcomes.
 */
public class EchoRunner implements ActionRunner {

    public static final String KIND = "echo";

    static final String MESSAGE = "message";
    static final String YIELD = "yield";

    @Override
    public ActionResult run(ActionInvocation invocation, CancelSignal cancelSignal) {
        Optional<Object> message = invocation.getParameter(MESSAGE);
        if (message.isEmpty()) {
            return ActionResult.failure("Missing required parameter '" + MESSAGE + "'");
        }
        for (String line : String.valueOf(message.get()).split("\\R", -1)) {
            invocation.emit(line);
        }

        Optional<Object> yield = invocation.getParameter(YIELD);
        if (yield.isEmpty()) {
            return ActionResult.success();
        }
        if (!(yield.get() instanceof Map)) {
            return ActionResult.failure("Parameter '" + YIELD + "' should be a mapping");
        }
        Map<String, String> outcomes = new LinkedHashMap<>();
        ((Map<?, ?>) yield.get()).forEach((key, value) ->
                outcomes.put(String.valueOf(key), value == null ? "" : String.valueOf(value)));
        return ActionResult.success(outcomes);
    }
}
