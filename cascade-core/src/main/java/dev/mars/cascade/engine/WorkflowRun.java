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
import dev.mars.cascade.core.exceptions.CascadeException;
import dev.mars.cascade.core.exceptions.InvalidTransitionException;
import dev.mars.cascade.core.exceptions.RenderException;
import dev.mars.cascade.graph.DependencyGraph;
import dev.mars.cascade.observability.RunMetrics;
import dev.mars.cascade.outcome.OutcomeLedger;
import dev.mars.cascade.outcome.OutcomeRenderer;
import dev.mars.cascade.outcome.RenderContext;
import dev.mars.cascade.runner.ActionInvocation;
import dev.mars.cascade.runner.ActionResult;
import dev.mars.cascade.runner.ActionRunner;
import dev.mars.cascade.runner.ActionRunnerRegistry;
import dev.mars.cascade.runner.CancelSignal;
import dev.mars.cascade.strategy.ConcurrencyLimiter;
import dev.mars.cascade.strategy.ExecutionStrategy;
import dev.mars.cascade.strategy.SchedulingContext;
import dev.mars.cascade.strategy.SchedulingDecision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * State of one run and the single-threaded loop that drives it.
 *
 * <p>Only the loop thread mutates action state, writes the ledger, renders parameters and
 * consults the strategy. Runner bodies execute on the worker pool and report back through
 * the completion queue.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2025-08-21
 * @version 1.0
 */
final class WorkflowRun implements SchedulingContext {

    private static final Logger logger = LoggerFactory.getLogger(WorkflowRun.class);

    static final String MDC_RUN = "cascade.run";
    static final String MDC_ACTION = "cascade.action";

    private static final Completion WAKE_UP = new Completion(null, null);

    private final String runId;
    private final DependencyGraph graph;
    private final EngineSettings settings;
    private final ExecutionStrategy strategy;
    private final ActionRunnerRegistry runners;
    private final ExecutorService workers;
    private final List<ExecutionListener> listeners;
    private final RunMetrics metrics;

    private final OutcomeLedger ledger = new OutcomeLedger();
    private final OutcomeRenderer renderer = new OutcomeRenderer();
    private final RenderContext renderContext;
    private final CancelSignal cancelSignal = new CancelSignal();
    private final ConcurrencyLimiter limiter;
    private final BlockingQueue<Completion> completions = new LinkedBlockingQueue<>();
    private final Map<String, ActionRecord> records = new LinkedHashMap<>();
    private final Map<String, Future<?>> inFlight = new HashMap<>();
    private final List<ActionEvent> events = new ArrayList<>();

    private int runningCount;
    private boolean cancellationPerformed;

    WorkflowRun(String runId, DependencyGraph graph, Map<String, Object> context, EngineSettings settings,
                ExecutionStrategy strategy, ActionRunnerRegistry runners, ExecutorService workers,
                List<ExecutionListener> listeners, RunMetrics metrics) {
        this.runId = runId;
        this.graph = graph;
        this.settings = settings;
        this.strategy = strategy;
        this.runners = runners;
        this.workers = workers;
        this.listeners = listeners;
        this.metrics = metrics;
        this.limiter = ConcurrencyLimiter.of(settings.getConcurrencyLimit());
        for (String actionId : graph.getTopologicalOrder()) {
            records.put(actionId, new ActionRecord(graph.getDescriptor(actionId)));
        }
        this.renderContext = RenderContext.builder(ledger)
                .actionIds(graph.getActionIds())
                .states(this::getState)
                .variables(context)
                .mode(settings.getRenderingMode())
                .build();
    }

    String getRunId() {
        return runId;
    }

    /**
     * Raises the cancel signal and wakes the loop. Safe from any thread.
     */
    void cancel() {
        if (cancelSignal.cancel()) {
            logger.info("Cancellation requested for run {}", runId);
        }
        completions.offer(WAKE_UP);
    }

    boolean isCancelRequested() {
        return cancelSignal.isCancelled();
    }

    // SchedulingContext

    @Override
    public DependencyGraph getGraph() {
        return graph;
    }

    @Override
    public ActionState getState(String actionId) {
        ActionRecord record = records.get(actionId);
        if (record == null) {
            throw new NoSuchElementException("Unknown action: " + actionId);
        }
        return record.state;
    }

    @Override
    public int getRunningCount() {
        return runningCount;
    }

    @Override
    public ConcurrencyLimiter getLimiter() {
        return limiter;
    }

    /**
     * Drives the run to completion on the calling thread.
     *
     * @return the final result
     * @throws CascadeException on an invariant violation; in-flight runners are cancelled first
     */
    RunResult execute() throws CascadeException {
        MDC.put(MDC_RUN, runId);
        Instant startedAt = Instant.now();
        metrics.recordRunStarted(strategy.getName());
        logger.info("Starting run {} with {} actions (strategy: {})", runId, graph.size(), strategy.getName());
        notifyListeners(listener -> listener.onRunStarted(runId, graph));
        try {
            loop();
        } catch (CascadeException | RuntimeException e) {
            logger.error("Run {} aborted: {}", runId, e.getMessage());
            logger.debug("Run {} abort details", runId, e);
            abortInFlight();
            metrics.recordRunFinished(strategy.getName(), RunVerdict.FAILURE.name(),
                    secondsSince(startedAt));
            throw e;
        } finally {
            MDC.remove(MDC_RUN);
        }

        Instant finishedAt = Instant.now();
        RunResult result = buildResult(startedAt, finishedAt);
        metrics.recordRunFinished(strategy.getName(), result.getVerdict().name(), secondsSince(startedAt));
        logger.info("Run {} finished with verdict {} in {} ms", runId, result.getVerdict(),
                result.getDuration().toMillis());
        notifyListeners(listener -> listener.onRunFinished(result));
        return result;
    }

    private void loop() throws CascadeException {
        boolean interrupted = false;
        while (true) {
            if (cancelSignal.isCancelled()) {
                performCancellation();
                if (interrupted) {
                    Thread.currentThread().interrupt();
                }
                return;
            }

            boolean progressed = promoteReady();
            List<String> ready = idsIn(ActionState.READY);
            if (!ready.isEmpty()) {
                SchedulingDecision decision = strategy.schedule(this, ready);
                logger.debug("Run {} scheduling round: ready={}, decision={}", runId, ready, decision);
                for (Map.Entry<String, String> skip : decision.getSkip().entrySet()) {
                    ActionRecord record = records.get(skip.getKey());
                    transition(record, ActionState.SKIPPED, skip.getValue());
                    metrics.recordActionSkipped(record.descriptor.getKind());
                    progressed = true;
                }
                for (String actionId : decision.getDispatch()) {
                    dispatch(records.get(actionId));
                    progressed = true;
                }
            }

            if (allTerminal()) {
                return;
            }
            if (progressed) {
                continue;
            }
            if (inFlight.isEmpty()) {
                throw new IllegalStateException("Scheduling stalled in run " + runId
                        + ": nothing is running and strategy '" + strategy.getName()
                        + "' neither dispatched nor skipped " + ready);
            }

            try {
                handle(completions.take());
            } catch (InterruptedException e) {
                logger.warn("Run {} loop interrupted; cancelling", runId);
                interrupted = true;
                cancelSignal.cancel();
                continue;
            }
            Completion next;
            while ((next = completions.poll()) != null) {
                handle(next);
            }
        }
    }

    private boolean promoteReady() throws InvalidTransitionException {
        boolean promoted = false;
        for (ActionRecord record : records.values()) {
            if (record.state != ActionState.PENDING) {
                continue;
            }
            boolean dependenciesDone = true;
            for (String dependency : graph.getDependencies(record.id())) {
                if (!records.get(dependency).state.isTerminal()) {
                    dependenciesDone = false;
                    break;
                }
            }
            if (dependenciesDone) {
                transition(record, ActionState.READY, null);
                promoted = true;
            }
        }
        return promoted;
    }

    private void dispatch(ActionRecord record) throws InvalidTransitionException {
        ActionDescriptor descriptor = record.descriptor;
        String actionId = record.id();

        Map<String, Object> parameters;
        try {
            parameters = renderer.render(descriptor.getParameters(), renderContext);
        } catch (RenderException e) {
            limiter.release();
            logger.warn("Action '{}' failed to render parameters: {}", actionId, e.getMessage());
            fail(record, "Render error: " + e.getMessage());
            return;
        }

        Optional<ActionRunner> runner;
        try {
            runner = runners.create(descriptor.getKind());
        } catch (RuntimeException e) {
            limiter.release();
            logger.warn("Runner for action '{}' could not be created: {}", actionId, e.getMessage());
            fail(record, "Runner could not be created: " + e.getMessage());
            return;
        }
        if (runner.isEmpty()) {
            limiter.release();
            fail(record, "No runner registered for kind '" + descriptor.getKind() + "'");
            return;
        }

        record.startedAt = Instant.now();
        transition(record, ActionState.RUNNING, null);
        runningCount++;
        metrics.recordActionExecuted(descriptor.getKind());

        ActionInvocation invocation = new ActionInvocation(actionId, descriptor.getKind(), parameters,
                descriptor.getDeclaredOutcomes(),
                message -> notifyListeners(listener -> listener.onActionMessage(runId, actionId, message)));
        ActionRunner selected = runner.get();
        try {
            inFlight.put(actionId, workers.submit(() -> runAction(actionId, selected, invocation)));
        } catch (RejectedExecutionException e) {
            runningCount--;
            limiter.release();
            record.finishedAt = Instant.now();
            fail(record, "Worker pool rejected the action: " + e.getMessage());
        }
    }

    // Runs on a worker thread.
    private void runAction(String actionId, ActionRunner runner, ActionInvocation invocation) {
        MDC.put(MDC_RUN, runId);
        MDC.put(MDC_ACTION, actionId);
        ActionResult result = null;
        try {
            logger.debug("Runner started for action '{}'", actionId);
            result = runner.run(invocation, cancelSignal);
        } catch (Exception e) {
            result = ActionResult.failure(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), e);
        } finally {
            if (result == null) {
                result = ActionResult.failure("Runner terminated abnormally");
            }
            completions.offer(new Completion(actionId, result));
            MDC.remove(MDC_ACTION);
            MDC.remove(MDC_RUN);
        }
    }

    private void handle(Completion completion) throws CascadeException {
        if (completion == WAKE_UP) {
            return;
        }
        String actionId = completion.actionId();
        if (inFlight.remove(actionId) == null) {
            logger.debug("Ignoring late completion of action '{}'", actionId);
            return;
        }
        runningCount--;
        limiter.release();

        ActionRecord record = records.get(actionId);
        ActionResult result = completion.result();
        record.finishedAt = Instant.now();
        record.exitCode = result.getExitCode().orElse(null);

        switch (result.getStatus()) {
            case SUCCESS -> {
                Optional<String> violation = checkDeclaredOutcomes(record.descriptor, result.getOutcomes());
                if (violation.isPresent()) {
                    logger.warn("Action '{}' failed outcome check: {}", actionId, violation.get());
                    fail(record, violation.get());
                    return;
                }
                ledger.record(actionId, result.getOutcomes());
                transition(record, ActionState.SUCCESS, null);
            }
            case FAILURE -> {
                String cause = result.getCause().orElse("Action failed");
                logger.warn("Action '{}' failed: {}", actionId, cause);
                result.getError().ifPresent(error -> logger.debug("Action '{}' failure details", actionId, error));
                fail(record, cause);
            }
            case CANCELLED -> transition(record, ActionState.CANCELLED, result.getCause().orElse("Cancelled"));
        }
    }

    private Optional<String> checkDeclaredOutcomes(ActionDescriptor descriptor, Map<String, String> produced) {
        if (!settings.isEnforceDeclaredOutcomes()) {
            return Optional.empty();
        }
        Set<String> declared = new LinkedHashSet<>(descriptor.getDeclaredOutcomes());
        Set<String> missing = new LinkedHashSet<>(declared);
        missing.removeAll(produced.keySet());
        if (!missing.isEmpty()) {
            return Optional.of("Declared outcomes not produced: " + missing);
        }
        Set<String> undeclared = new LinkedHashSet<>(produced.keySet());
        undeclared.removeAll(declared);
        if (!undeclared.isEmpty()) {
            return Optional.of("Undeclared outcomes produced: " + undeclared);
        }
        return Optional.empty();
    }

    private void performCancellation() throws CascadeException {
        cancellationPerformed = true;
        logger.info("Cancelling run {}: {} action(s) in flight", runId, inFlight.size());

        Duration grace = settings.getCancelGracePeriod();
        long deadline = System.nanoTime() + grace.toNanos();
        while (!inFlight.isEmpty()) {
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                break;
            }
            Completion completion;
            try {
                completion = completions.poll(remaining, TimeUnit.NANOSECONDS);
            } catch (InterruptedException e) {
                logger.warn("Interrupted while waiting for in-flight actions of run {}", runId);
                Thread.currentThread().interrupt();
                break;
            }
            if (completion != null) {
                handle(completion);
            }
        }

        for (String actionId : new ArrayList<>(inFlight.keySet())) {
            inFlight.remove(actionId).cancel(true);
            runningCount--;
            limiter.release();
            ActionRecord record = records.get(actionId);
            record.finishedAt = Instant.now();
            logger.warn("Action '{}' did not stop within {} ms; interrupted", actionId, grace.toMillis());
            transition(record, ActionState.CANCELLED, "Did not stop within the cancellation grace period");
        }

        for (ActionRecord record : records.values()) {
            if (!record.state.isTerminal()) {
                transition(record, ActionState.CANCELLED, "Run cancelled before the action started");
            }
        }
    }

    private void abortInFlight() {
        cancelSignal.cancel();
        inFlight.values().forEach(future -> future.cancel(true));
        inFlight.clear();
    }

    // A low-severity action ends in WARNING instead of FAILURE.
    private void fail(ActionRecord record, String cause) throws InvalidTransitionException {
        ActionState target = record.descriptor.getSeverity() == ActionSeverity.LOW
                ? ActionState.WARNING : ActionState.FAILURE;
        transition(record, target, cause);
        metrics.recordActionFailed(record.descriptor.getKind());
    }

    private void transition(ActionRecord record, ActionState target, String cause)
            throws InvalidTransitionException {
        ActionState from = record.state;
        record.state = from.transitionTo(record.id(), target);
        if (cause != null) {
            record.cause = cause;
        }
        ActionEvent event = new ActionEvent(runId, record.id(), from, target, Instant.now(), cause);
        events.add(event);
        if (target.isTerminal()) {
            logger.info("Action '{}' {} -> {}{}", record.id(), from, target, cause != null ? " (" + cause + ")" : "");
        } else {
            logger.debug("Action '{}' {} -> {}", record.id(), from, target);
        }
        notifyListeners(listener -> listener.onTransition(event));
    }

    private void notifyListeners(Consumer<ExecutionListener> callback) {
        for (ExecutionListener listener : listeners) {
            try {
                callback.accept(listener);
            } catch (RuntimeException e) {
                logger.warn("Execution listener {} failed: {}", listener.getClass().getName(), e.getMessage(), e);
            }
        }
    }

    private List<String> idsIn(ActionState state) {
        List<String> ids = new ArrayList<>();
        for (ActionRecord record : records.values()) {
            if (record.state == state) {
                ids.add(record.id());
            }
        }
        return ids;
    }

    private boolean allTerminal() {
        for (ActionRecord record : records.values()) {
            if (!record.state.isTerminal()) {
                return false;
            }
        }
        return true;
    }

    private RunResult buildResult(Instant startedAt, Instant finishedAt) {
        List<ActionReport> reports = new ArrayList<>();
        List<ActionState> finalStates = new ArrayList<>();
        for (ActionRecord record : records.values()) {
            finalStates.add(record.state);
            reports.add(new ActionReport(record.id(), record.descriptor.getKind(), record.state, record.cause,
                    record.exitCode, record.startedAt, record.finishedAt, ledger.getOutcomes(record.id())));
        }
        RunVerdict verdict = RunVerdict.of(cancellationPerformed, finalStates);
        return new RunResult(runId, strategy.getName(), verdict, startedAt, finishedAt, reports, events,
                ledger.snapshot());
    }

    private static double secondsSince(Instant start) {
        return Duration.between(start, Instant.now()).toMillis() / 1000.0;
    }

    private static final class ActionRecord {
        private final ActionDescriptor descriptor;
        private volatile ActionState state = ActionState.PENDING;
        private String cause;
        private Integer exitCode;
        private Instant startedAt;
        private Instant finishedAt;

        private ActionRecord(ActionDescriptor descriptor) {
            this.descriptor = descriptor;
        }

        private String id() {
            return descriptor.getId();
        }
    }

    private record Completion(String actionId, ActionResult result) {
    }
}
