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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Wraps a runner so that every call ends in an {@link ActionResult}: thrown exceptions and
 * {@code null} results become failures, and an interrupt after cancellation becomes a
 * cancelled result.
 */
public class GuardedActionRunner implements ActionRunner {

    private static final Logger logger = LoggerFactory.getLogger(GuardedActionRunner.class);

    private final ActionRunner delegate;

    public GuardedActionRunner(ActionRunner delegate) {
        this.delegate = Objects.requireNonNull(delegate, "Runner cannot be null");
    }

    @Override
    public ActionResult run(ActionInvocation invocation, CancelSignal cancelSignal) {
        try {
            ActionResult result = delegate.run(invocation, cancelSignal);
            if (result == null) {
                return ActionResult.failure("Runner for '" + invocation.getKind() + "' returned no result");
            }
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (cancelSignal.isCancelled()) {
                return ActionResult.cancelled("Interrupted by cancellation");
            }
            return ActionResult.failure("Interrupted", e);
        } catch (Exception e) {
            logger.debug("Runner for action '{}' threw", invocation.getActionId(), e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return ActionResult.failure(message, e);
        }
    }

    public ActionRunner getDelegate() {
        return delegate;
    }
}
