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

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class ActionRunnerRegistryTest {

    private ActionRunnerRegistry registry;

    @BeforeEach
    void setUp() {
        registry = new ActionRunnerRegistry();
    }

    private static ActionInvocation invocation(String kind) {
        return new ActionInvocation("a", kind, Map.of(), List.of(), null);
    }

    @Test
    void kindsAreCaseInsensitive() throws Exception {
        registry.register("Echo", () -> (invocation, signal) -> ActionResult.success());

        assertThat(registry.isRegistered("ECHO")).isTrue();
        assertThat(registry.getKinds()).containsExactly("echo");
        assertThat(registry.create("echo")).isPresent();
        assertThat(registry.create("echo").get().run(invocation("echo"), new CancelSignal()).isSuccess()).isTrue();
    }

    @Test
    void unknownKindCreatesNothing() {
        assertThat(registry.create("missing")).isEmpty();
        assertThat(registry.create(null)).isEmpty();
        assertThat(registry.isRegistered(null)).isFalse();
    }

    @Test
    void createdRunnerIsGuarded() {
        registry.register("x", () -> (invocation, signal) -> ActionResult.success());

        assertThat(registry.create("x")).get().isInstanceOf(GuardedActionRunner.class);
    }

    @Test
    void aliasSharesFactory() {
        registry.register("shell", () -> (invocation, signal) -> ActionResult.success());
        registry.alias("sh", "shell");

        assertThat(registry.getKinds()).containsExactly("sh", "shell");
        assertThatThrownBy(() -> registry.alias("zz", "nope")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void laterRegistrationReplacesEarlier() throws Exception {
        registry.register("x", () -> (invocation, signal) -> ActionResult.failure("old"));
        registry.register("x", () -> (invocation, signal) -> ActionResult.success());

        assertThat(registry.create("x").get().run(invocation("x"), new CancelSignal()).isSuccess()).isTrue();
    }

    @Test
    void unregisterRemovesKind() {
        registry.register("x", () -> (invocation, signal) -> ActionResult.success());
        registry.unregister("X");

        assertThat(registry.isRegistered("x")).isFalse();
    }

    @Test
    void installDelegatesToProvider() {
        ActionRunnerProvider provider = mock(ActionRunnerProvider.class);

        registry.install(provider);

        verify(provider).registerRunners(registry);
    }
}
