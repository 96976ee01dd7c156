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


/**
 * Executes one kind of action.
 *
 * <p>Implementations run on a worker thread and must not touch engine state. They should
 * check the cancel signal at reasonable intervals and return
 * {@link ActionResult#cancelled(String)} once they have stopped because of it. Exceptions
 * are allowed; the engine turns them into failures.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
@FunctionalInterface
public interface ActionRunner {

    ActionResult run(ActionInvocation invocation, CancelSignal cancelSignal) throws Exception;
}
