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
import dev.mars.cascade.core.exceptions.CascadeException;
import dev.mars.cascade.core.exceptions.GraphValidationException;
import dev.mars.cascade.graph.DependencyGraph;
import dev.mars.cascade.observability.RunMetrics;
import dev.mars.cascade.runner.ActionRunnerRegistry;
import dev.mars.cascade.strategy.ExecutionStrategy;
import dev.mars.cascade.strategy.StrategyRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Default {@link ExecutionEngine}. Each run gets its own loop thread; runner bodies share a
 * cached pool of daemon worker threads.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 1.0
 */
public class SimpleExecutionEngine implements ExecutionEngine {

    private static final Logger logger = LoggerFactory.getLogger(SimpleExecutionEngine.class);

    private final EngineSettings settings;
    private final ActionRunnerRegistry runners;
    private final StrategyRegistry strategies;
    private final ExecutorService coordinators;
    private final ExecutorService workers;
    private final List<ExecutionListener> listeners = new CopyOnWriteArrayList<>();
    private final Map<String, RunHandle> activeRuns = new ConcurrentHashMap<>();
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    public SimpleExecutionEngine(EngineSettings settings, ActionRunnerRegistry runners) {
        this(settings, runners, new StrategyRegistry());
    }

    /**
     * @throws IllegalArgumentException if the configured strategy is not in the registry
     */
    public SimpleExecutionEngine(EngineSettings settings, ActionRunnerRegistry runners, StrategyRegistry strategies) {
        this.settings = Objects.requireNonNull(settings, "Settings cannot be null");
        this.runners = Objects.requireNonNull(runners, "Runner registry cannot be null");
        this.strategies = Objects.requireNonNull(strategies, "Strategy registry cannot be null");
        if (!strategies.isRegistered(settings.getStrategyName())) {
            throw new IllegalArgumentException("Unknown execution strategy: '" + settings.getStrategyName()
                    + "'. Available: " + strategies.getNames());
        }
        this.coordinators = Executors.newCachedThreadPool(daemonThreads("cascade-run-"));
        this.workers = Executors.newCachedThreadPool(daemonThreads("cascade-action-"));
        logger.info("SimpleExecutionEngine initialized: {}", settings);
    }

    @Override
    public RunHandle start(DependencyGraph graph, Map<String, Object> context) throws GraphValidationException {
        Objects.requireNonNull(graph, "Graph cannot be null");
        if (shutdown.get()) {
            throw new IllegalStateException("Execution engine is shut down");
        }
        validateKinds(graph.getDescriptors());

        ExecutionStrategy strategy = strategies.create(settings.getStrategyName());
        String runId = UUID.randomUUID().toString();
        WorkflowRun run = new WorkflowRun(runId, graph, context != null ? context : Map.of(), settings, strategy,
                runners, workers, List.copyOf(listeners), RunMetrics.getInstance());

        CompletableFuture<RunResult> future = CompletableFuture.supplyAsync(() -> {
            try {
                return run.execute();
            } catch (CascadeException e) {
                throw new CompletionException(e);
            }
        }, coordinators);
        RunHandle handle = new RunHandle(run, future);
        activeRuns.put(runId, handle);
        future.whenComplete((result, error) -> activeRuns.remove(runId));
        return handle;
    }

    @Override
    public void addListener(ExecutionListener listener) {
        listeners.add(Objects.requireNonNull(listener, "Listener cannot be null"));
    }

    @Override
    public void removeListener(ExecutionListener listener) {
        listeners.remove(listener);
    }

    public Collection<RunHandle> getActiveRuns() {
        return List.copyOf(activeRuns.values());
    }

    public EngineSettings getSettings() {
        return settings;
    }

    @Override
    public void shutdown() {
        if (shutdown.getAndSet(true)) {
            return;
        }
        logger.info("Shutting down execution engine...");
        activeRuns.values().forEach(RunHandle::cancel);
        coordinators.shutdown();
        workers.shutdown();

        long timeoutMs = settings.getCancelGracePeriod().toMillis() + 1000;
        try {
            if (!coordinators.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS)) {
                logger.warn("Execution engine shutdown timed out, forcing shutdown");
                coordinators.shutdownNow();
            }
            if (!workers.awaitTermination(timeoutMs, TimeUnit.MILLISECONDS)) {
                workers.shutdownNow();
            }
            logger.info("Execution engine shutdown completed");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            coordinators.shutdownNow();
            workers.shutdownNow();
        }
    }

    private void validateKinds(Collection<ActionDescriptor> descriptors) throws GraphValidationException {
        for (ActionDescriptor descriptor : descriptors) {
            if (!runners.isRegistered(descriptor.getKind())) {
                throw new GraphValidationException(GraphValidationException.Kind.UNKNOWN_ACTION_KIND,
                        descriptor.getId(), "Action '" + descriptor.getId() + "' uses unknown kind '"
                        + descriptor.getKind() + "'. Available: " + runners.getKinds());
            }
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
