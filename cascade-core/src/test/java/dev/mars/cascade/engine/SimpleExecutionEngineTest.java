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

import dev.mars.cascade.core.ActionDescriptor;
import dev.mars.cascade.core.ActionSeverity;
import dev.mars.cascade.core.ActionState;
import dev.mars.cascade.core.exceptions.GraphValidationException;
import dev.mars.cascade.core.exceptions.RunAbortedException;
import dev.mars.cascade.outcome.RenderingMode;
import dev.mars.cascade.runner.ActionResult;
import dev.mars.cascade.runner.ActionRunnerRegistry;
import dev.mars.cascade.strategy.ExecutionStrategy;
import dev.mars.cascade.strategy.SchedulingContext;
import dev.mars.cascade.strategy.SchedulingDecision;
import dev.mars.cascade.strategy.StrategyRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.awaitility.Awaitility.await;

/**
 * End-to-end runs of the engine with in-process test runners.
 *
 * <ul>
 *   <li>{@code produce}: succeeds with the map in its {@code outcomes} parameter</li>
 *   <li>{@code record}: succeeds and remembers its rendered parameters</li>
 *   <li>{@code fail}: fails with exit code 3</li>
 *   <li>{@code block}: waits for the cancel signal</li>
 *   <li>{@code stubborn}: sleeps and ignores the cancel signal</li>
 *   <li>{@code overlap}: tracks how many overlap runners are active at once</li>
 *   <li>{@code plugin}: succeeds with an outcome whose value is {@code null}</li>
 * </ul>
 */
@DisplayName("SimpleExecutionEngine")
@Timeout(value = 30, unit = TimeUnit.SECONDS)
class SimpleExecutionEngineTest {

    private final Map<String, Map<String, Object>> recorded = new ConcurrentHashMap<>();
    private final AtomicInteger signalled = new AtomicInteger();
    private final AtomicInteger active = new AtomicInteger();
    private final AtomicInteger maxActive = new AtomicInteger();

    private ActionRunnerRegistry runners;
    private SimpleExecutionEngine engine;

    @BeforeEach
    void setUp() {
        runners = new ActionRunnerRegistry();
        runners.register("produce", () -> (invocation, signal) -> {
            Map<String, String> outcomes = new LinkedHashMap<>();
            Object declared = invocation.getParameters().get("outcomes");
            if (declared instanceof Map<?, ?> map) {
                map.forEach((k, v) -> outcomes.put(String.valueOf(k), String.valueOf(v)));
            }
            return ActionResult.success(outcomes);
        });
        runners.register("record", () -> (invocation, signal) -> {
            recorded.put(invocation.getActionId(), invocation.getParameters());
            invocation.emit("recorded " + invocation.getActionId());
            return ActionResult.success();
        });
        runners.register("fail", () -> (invocation, signal) -> ActionResult.failure("exit status 3", 3));
        runners.register("block", () -> (invocation, signal) -> {
            if (signal.await(Duration.ofSeconds(20))) {
                signalled.incrementAndGet();
                return ActionResult.cancelled("Stopped on request");
            }
            return ActionResult.success();
        });
        runners.register("stubborn", () -> (invocation, signal) -> {
            Thread.sleep(20_000);
            return ActionResult.success();
        });
        runners.register("overlap", () -> (invocation, signal) -> {
            int now = active.incrementAndGet();
            maxActive.accumulateAndGet(now, Math::max);
            try {
                Thread.sleep(100);
            } finally {
                active.decrementAndGet();
            }
            return ActionResult.success();
        });
        runners.register("plugin", () -> (invocation, signal) -> {
            Map<String, String> outcomes = new HashMap<>();
            outcomes.put("k", null);
            return ActionResult.success(outcomes);
        });
        engine = new SimpleExecutionEngine(EngineSettings.defaults(), runners);
    }

    @AfterEach
    void tearDown() {
        engine.shutdown();
    }

    private void useSettings(EngineSettings settings) {
        engine.shutdown();
        engine = new SimpleExecutionEngine(settings, runners);
    }

    private static ActionDescriptor.Builder action(String id, String kind) {
        return ActionDescriptor.builder(id).kind(kind);
    }

    private static int indexOf(List<ActionEvent> events, String actionId, ActionState to) {
        for (int i = 0; i < events.size(); i++) {
            ActionEvent event = events.get(i);
            if (event.actionId().equals(actionId) && event.to() == to) {
                return i;
            }
        }
        return -1;
    }

    private static List<ActionDescriptor> diamond(String kindOfB) {
        return List.of(
                action("A", "produce").parameter("outcomes", Map.of("path", "/tmp")).build(),
                action("B", kindOfB).parameter("dir", "@{A.path}/b").dependsOn("A").build(),
                action("C", "produce").dependsOn("A").build(),
                action("D", "record").parameter("summary", "@{A.path} @{status.B} @{status.C}")
                        .dependsOn("B", "C").build());
    }

    @Nested
    @DisplayName("scenarios")
    class Scenarios {

        @Test
        @DisplayName("diamond graph succeeds and renders outcomes")
        void diamondSucceeds() throws Exception {
            RunResult result = engine.run(diamond("record"));

            assertThat(result.getVerdict()).isEqualTo(RunVerdict.SUCCESS);
            assertThat(result.getExitCode()).isEqualTo(ExitCode.SUCCESS);
            assertThat(recorded.get("B")).containsEntry("dir", "/tmp/b");
            assertThat(recorded.get("D")).containsEntry("summary", "/tmp SUCCESS SUCCESS");
            assertThat(String.valueOf(recorded.get("D").get("summary"))).doesNotContain("@{");
            assertThat(result.getOutcomes()).containsEntry("A", Map.of("path", "/tmp"));

            List<ActionEvent> events = result.getEvents();
            int dRunning = indexOf(events, "D", ActionState.RUNNING);
            assertThat(dRunning).isGreaterThan(indexOf(events, "B", ActionState.SUCCESS));
            assertThat(dRunning).isGreaterThan(indexOf(events, "C", ActionState.SUCCESS));
        }

        @Test
        @DisplayName("failure skips descendants and leaves siblings alone under free")
        void failureSkipsDescendants() throws Exception {
            RunResult result = engine.run(diamond("fail"));

            assertThat(result.getVerdict()).isEqualTo(RunVerdict.FAILURE);
            assertThat(result.getExitCode()).isEqualTo(ExitCode.FAILURE);
            assertThat(result.getState("B")).isEqualTo(ActionState.FAILURE);
            assertThat(result.getAction("B").getExitCode()).contains(3);
            assertThat(result.getState("C")).isEqualTo(ActionState.SUCCESS);
            assertThat(result.getState("D")).isEqualTo(ActionState.SKIPPED);
            assertThat(result.getAction("D").getCause()).contains("Upstream action 'B' ended in FAILURE");
            assertThat(recorded).doesNotContainKey("D");
        }

        @Test
        @DisplayName("unknown dependency is rejected before anything runs")
        void unknownDependencyRejected() {
            GraphValidationException e = catchThrowableOfType(
                    () -> engine.start(List.of(action("A", "record").dependsOn("ghost").build()), Map.of()),
                    GraphValidationException.class);

            assertThat(e.getKind()).isEqualTo(GraphValidationException.Kind.UNKNOWN_DEPENDENCY);
            assertThat(recorded).isEmpty();
            assertThat(engine.getActiveRuns()).isEmpty();
        }

        @Test
        @DisplayName("cancel stops running actions and never dispatches pending ones")
        void cancelWhileRunning() throws Exception {
            List<ActionEvent> seen = Collections.synchronizedList(new ArrayList<>());
            engine.addListener(new ExecutionListener() {
                @Override
                public void onTransition(ActionEvent event) {
                    seen.add(event);
                }
            });

            RunHandle handle = engine.start(List.of(
                    action("r1", "block").build(),
                    action("r2", "block").build(),
                    action("p", "record").dependsOn("r1").build()), Map.of());

            await().atMost(5, TimeUnit.SECONDS).until(() ->
                    handle.getState("r1") == ActionState.RUNNING && handle.getState("r2") == ActionState.RUNNING);
            assertThat(handle.getState("p")).isEqualTo(ActionState.PENDING);

            handle.cancel();
            RunResult result = handle.await(Duration.ofSeconds(10));

            assertThat(result.getVerdict()).isEqualTo(RunVerdict.CANCELLED);
            assertThat(result.getExitCode()).isEqualTo(ExitCode.CANCELLED);
            assertThat(signalled.get()).isEqualTo(2);
            assertThat(result.getState("r1")).isEqualTo(ActionState.CANCELLED);
            assertThat(result.getState("r2")).isEqualTo(ActionState.CANCELLED);
            assertThat(result.getState("p")).isEqualTo(ActionState.CANCELLED);
            assertThat(result.getEvents("p")).noneMatch(event -> event.to() == ActionState.RUNNING);
            assertThat(seen).anyMatch(event -> event.actionId().equals("p") && event.to() == ActionState.CANCELLED);
            assertThat(handle.isDone()).isTrue();
        }
    }

    @Nested
    @DisplayName("strategies")
    class Strategies {

        @Test
        void freeRunsIndependentActionsSideBySide() throws Exception {
            CountDownLatch bothStarted = new CountDownLatch(2);
            runners.register("rendezvous", () -> (invocation, signal) -> {
                bothStarted.countDown();
                return bothStarted.await(5, TimeUnit.SECONDS)
                        ? ActionResult.success() : ActionResult.failure("Ran alone");
            });

            RunResult result = engine.run(List.of(action("x", "rendezvous").build(), action("y", "rendezvous").build()));

            assertThat(result.getVerdict()).isEqualTo(RunVerdict.SUCCESS);
        }

        @Test
        void strictNeverOverlaps() throws Exception {
            useSettings(EngineSettings.builder().strategy("strict").build());

            RunResult result = engine.run(List.of(
                    action("x", "overlap").build(), action("y", "overlap").build(), action("z", "overlap").build()));

            assertThat(result.getVerdict()).isEqualTo(RunVerdict.SUCCESS);
            assertThat(maxActive.get()).isEqualTo(1);
            assertThat(result.getStrategy()).isEqualTo("strict");
        }

        @Test
        void strictHaltsAfterFirstFailure() throws Exception {
            useSettings(EngineSettings.builder().strategy("strict").build());

            RunResult result = engine.run(List.of(
                    action("x", "fail").build(), action("y", "record").build()));

            assertThat(result.getState("x")).isEqualTo(ActionState.FAILURE);
            assertThat(result.getState("y")).isEqualTo(ActionState.SKIPPED);
            assertThat(result.getAction("y").getCause()).contains("Run halted after 'x' ended in FAILURE");
        }

        @Test
        void concurrencyLimitBoundsFreeStrategy() throws Exception {
            useSettings(EngineSettings.builder().concurrencyLimit(2).build());

            List<ActionDescriptor> actions = new ArrayList<>();
            for (int i = 0; i < 6; i++) {
                actions.add(action("o" + i, "overlap").build());
            }
            RunResult result = engine.run(actions);

            assertThat(result.getVerdict()).isEqualTo(RunVerdict.SUCCESS);
            assertThat(maxActive.get()).isBetween(1, 2);
        }

        @Test
        void looseRunsDependentsOfFailures() throws Exception {
            useSettings(EngineSettings.builder().strategy("loose").build());

            RunResult result = engine.run(diamond("fail"));

            assertThat(result.getState("D")).isEqualTo(ActionState.SUCCESS);
            assertThat(result.getVerdict()).isEqualTo(RunVerdict.FAILURE);
        }

        @Test
        void looseSkipsDependentsOverStrictEdges() throws Exception {
            useSettings(EngineSettings.builder().strategy("loose").build());

            RunResult result = engine.run(List.of(
                    action("A", "fail").build(),
                    action("B", "record").dependsOnStrictly("A").build(),
                    action("C", "record").dependsOn("A").build(),
                    action("D", "record").dependsOn("B").build()));

            assertThat(result.getState("B")).isEqualTo(ActionState.SKIPPED);
            assertThat(result.getAction("B").getCause()).contains("Upstream action 'A' ended in FAILURE");
            assertThat(result.getState("C")).isEqualTo(ActionState.SUCCESS);
            assertThat(result.getState("D")).isEqualTo(ActionState.SUCCESS);
        }

        @Test
        void unknownStrategyIsRejectedAtConstruction() {
            assertThatThrownBy(() -> new SimpleExecutionEngine(
                    EngineSettings.builder().strategy("eager").build(), runners))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("eager");
        }
    }

    @Nested
    @DisplayName("severity")
    class Severity {

        @Test
        void lowSeverityFailureEndsInWarning() throws Exception {
            RunResult result = engine.run(List.of(
                    action("lint", "fail").severity(ActionSeverity.LOW).build(),
                    action("build", "record").dependsOn("lint").build()));

            assertThat(result.getState("lint")).isEqualTo(ActionState.WARNING);
            assertThat(result.getAction("lint").getExitCode()).contains(3);
            assertThat(result.getState("build")).isEqualTo(ActionState.SUCCESS);
            assertThat(result.getVerdict()).isEqualTo(RunVerdict.SUCCESS);
            assertThat(result.getExitCode()).isEqualTo(ExitCode.SUCCESS);
        }

        @Test
        void warningSkipsStrictDependents() throws Exception {
            RunResult result = engine.run(List.of(
                    action("lint", "fail").severity(ActionSeverity.LOW).build(),
                    action("publish", "record").dependsOnStrictly("lint").build()));

            assertThat(result.getState("publish")).isEqualTo(ActionState.SKIPPED);
            assertThat(result.getAction("publish").getCause()).contains("Upstream action 'lint' ended in WARNING");
            assertThat(result.getVerdict()).isEqualTo(RunVerdict.SUCCESS);
        }

        @Test
        void lowSeverityRenderErrorIsAWarningToo() throws Exception {
            useSettings(EngineSettings.builder().renderingMode(RenderingMode.STRICT).build());

            RunResult result = engine.run(List.of(
                    action("A", "record").parameter("v", "@{context.missing}").severity(ActionSeverity.LOW).build()));

            assertThat(result.getState("A")).isEqualTo(ActionState.WARNING);
            assertThat(result.isSuccessful()).isTrue();
        }
    }

    @Nested
    @DisplayName("rendering and outcomes")
    class RenderingAndOutcomes {

        @Test
        void nullOutcomeValueFailsOnlyThatAction() throws Exception {
            RunResult result = engine.run(List.of(
                    action("a", "plugin").build(),
                    action("b", "produce").parameter("outcomes", Map.of("ok", "yes")).build()));

            assertThat(result.getVerdict()).isEqualTo(RunVerdict.FAILURE);
            assertThat(result.getState("a")).isEqualTo(ActionState.FAILURE);
            assertThat(result.getAction("a").getCause()).hasValueSatisfying(cause ->
                    assertThat(cause).contains("null value"));
            assertThat(result.getState("b")).isEqualTo(ActionState.SUCCESS);
            assertThat(result.getOutcomes()).containsEntry("b", Map.of("ok", "yes"));
        }

        @Test
        void strictRenderingFailsTheConsumer() throws Exception {
            useSettings(EngineSettings.builder().renderingMode(RenderingMode.STRICT).build());

            RunResult result = engine.run(List.of(
                    action("A", "produce").build(),
                    action("B", "record").parameter("v", "@{A.version}").dependsOn("A").build()));

            assertThat(result.getState("B")).isEqualTo(ActionState.FAILURE);
            assertThat(result.getAction("B").getCause()).hasValueSatisfying(cause ->
                    assertThat(cause).startsWith("Render error: ").contains("version"));
            assertThat(result.getVerdict()).isEqualTo(RunVerdict.FAILURE);
        }

        @Test
        void lenientRenderingUsesEmptyString() throws Exception {
            RunResult result = engine.run(List.of(
                    action("A", "produce").build(),
                    action("B", "record").parameter("v", "[@{A.version}]").dependsOn("A").build()));

            assertThat(result.getVerdict()).isEqualTo(RunVerdict.SUCCESS);
            assertThat(recorded.get("B")).containsEntry("v", "[]");
        }

        @Test
        void unknownActionReferenceFailsEvenWhenLenient() throws Exception {
            RunResult result = engine.run(List.of(action("B", "record").parameter("v", "@{ghost.k}").build()));

            assertThat(result.getState("B")).isEqualTo(ActionState.FAILURE);
        }

        @Test
        void contextVariablesAreRendered() throws Exception {
            RunResult result = engine.start(List.of(action("B", "record").parameter("v", "@{context.region}").build()),
                    Map.of("region", "eu-west-1")).await();

            assertThat(result.isSuccessful()).isTrue();
            assertThat(recorded.get("B")).containsEntry("v", "eu-west-1");
        }

        @Test
        void declaredOutcomesAreEnforcedWhenConfigured() throws Exception {
            useSettings(EngineSettings.builder().enforceDeclaredOutcomes(true).build());

            RunResult result = engine.run(List.of(
                    action("A", "produce").parameter("outcomes", Map.of("path", "/tmp")).declaresOutcomes("url").build()));

            assertThat(result.getState("A")).isEqualTo(ActionState.FAILURE);
            assertThat(result.getAction("A").getCause()).contains("Declared outcomes not produced: [url]");
            assertThat(result.getOutcomes()).doesNotContainKey("A");
        }

        @Test
        void declaredOutcomesAreAdvisoryByDefault() throws Exception {
            RunResult result = engine.run(List.of(
                    action("A", "produce").parameter("outcomes", Map.of("path", "/tmp")).declaresOutcomes("url").build()));

            assertThat(result.getState("A")).isEqualTo(ActionState.SUCCESS);
        }
    }

    @Nested
    @DisplayName("lifecycle")
    class Lifecycle {

        @Test
        void emptyGraphSucceedsImmediately() throws Exception {
            RunResult result = engine.run(List.of());

            assertThat(result.getVerdict()).isEqualTo(RunVerdict.SUCCESS);
            assertThat(result.getActions()).isEmpty();
        }

        @Test
        void unknownKindIsRejectedBeforeStart() {
            GraphValidationException e = catchThrowableOfType(
                    () -> engine.start(List.of(action("A", "teleport").build()), Map.of()),
                    GraphValidationException.class);

            assertThat(e.getKind()).isEqualTo(GraphValidationException.Kind.UNKNOWN_ACTION_KIND);
            assertThat(e.getActionId()).isEqualTo("A");
        }

        @Test
        void stubbornRunnerIsInterruptedAfterGracePeriod() throws Exception {
            useSettings(EngineSettings.builder().cancelGracePeriod(Duration.ofMillis(200)).build());

            RunHandle handle = engine.start(List.of(action("s", "stubborn").build()), Map.of());
            await().atMost(5, TimeUnit.SECONDS).until(() -> handle.getState("s") == ActionState.RUNNING);
            handle.cancel();
            RunResult result = handle.await(Duration.ofSeconds(5));

            assertThat(result.getState("s")).isEqualTo(ActionState.CANCELLED);
            assertThat(result.getAction("s").getCause()).contains("Did not stop within the cancellation grace period");
        }

        @Test
        void runnerMessagesReachListeners() throws Exception {
            List<String> messages = Collections.synchronizedList(new ArrayList<>());
            engine.addListener(new ExecutionListener() {
                @Override
                public void onActionMessage(String runId, String actionId, String message) {
                    messages.add(actionId + ": " + message);
                }
            });

            engine.run(List.of(action("B", "record").build()));

            assertThat(messages).containsExactly("B: recorded B");
        }

        @Test
        void failingListenerDoesNotBreakTheRun() throws Exception {
            engine.addListener(new ExecutionListener() {
                @Override
                public void onTransition(ActionEvent event) {
                    throw new IllegalStateException("listener bug");
                }
            });

            RunResult result = engine.run(diamond("record"));

            assertThat(result.getVerdict()).isEqualTo(RunVerdict.SUCCESS);
        }

        @Test
        void stalledStrategyAbortsTheRun() throws Exception {
            StrategyRegistry strategies = new StrategyRegistry();
            strategies.register("idle", () -> new ExecutionStrategy() {
                @Override
                public String getName() {
                    return "idle";
                }

                @Override
                public SchedulingDecision schedule(SchedulingContext context,
                                                   List<String> ready) {
                    return SchedulingDecision.deferAll();
                }
            });
            engine.shutdown();
            engine = new SimpleExecutionEngine(EngineSettings.builder().strategy("idle").build(), runners, strategies);

            RunHandle handle = engine.start(List.of(action("A", "record").build()), Map.of());

            assertThatThrownBy(handle::await)
                    .isInstanceOf(RunAbortedException.class)
                    .hasMessageContaining("Scheduling stalled");
        }

        @Test
        void shutdownRejectsNewRuns() {
            engine.shutdown();

            assertThatThrownBy(() -> engine.start(List.of(action("A", "record").build()), Map.of()))
                    .isInstanceOf(IllegalStateException.class);
        }
    }
}
