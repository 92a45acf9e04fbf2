package org.neuralchilli.stepgraph.core;

import io.quarkus.vertx.ConsumeEvent;
import io.vertx.mutiny.core.eventbus.EventBus;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.stepgraph.config.EngineConfig;
import org.neuralchilli.stepgraph.config.GraphLoaderService;
import org.neuralchilli.stepgraph.domain.Graph;
import org.neuralchilli.stepgraph.plan.ExecutionPlan;
import org.neuralchilli.stepgraph.plan.ExecutionStep;
import org.neuralchilli.stepgraph.plan.InvalidMappingKeyException;
import org.neuralchilli.stepgraph.plan.PlanCompiler;
import org.neuralchilli.stepgraph.plan.RunConfig;
import org.neuralchilli.stepgraph.reexecution.ReExecutionException;
import org.neuralchilli.stepgraph.reexecution.ReExecutionMode;
import org.neuralchilli.stepgraph.reexecution.ReExecutionPlanner;
import org.neuralchilli.stepgraph.reexecution.StaleParentArtifactException;
import org.neuralchilli.stepgraph.run.RunRecord;
import org.neuralchilli.stepgraph.run.RunStatus;
import org.neuralchilli.stepgraph.run.StepEvent;
import org.neuralchilli.stepgraph.run.StepOutcome;
import org.neuralchilli.stepgraph.run.StepStatus;
import org.neuralchilli.stepgraph.scheduler.SchedulerCore;
import org.neuralchilli.stepgraph.scheduler.StepResult;
import org.neuralchilli.stepgraph.scheduler.StepScheduler;
import org.neuralchilli.stepgraph.spi.RunStorage;
import org.neuralchilli.stepgraph.worker.StepCompletionEvent;
import org.neuralchilli.stepgraph.worker.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Drives runs from launch to completion.
 * <p>
 * Each evaluation polls the run's scheduler for ready steps and hands them to the worker pool;
 * completions come back on the event bus and are applied before the next evaluation. In test
 * mode ready steps execute inline and a launch returns only once the run has finished.
 */
@ApplicationScoped
public class RunCoordinator {

    private static final Logger log = LoggerFactory.getLogger(RunCoordinator.class);

    public static final String RUN_EVALUATE = "run.evaluate";

    @Inject
    PlanCompiler compiler;

    @Inject
    SchedulerCore schedulerCore;

    @Inject
    ReExecutionPlanner reExecutionPlanner;

    @Inject
    RunStorage runStorage;

    @Inject
    WorkerPool workerPool;

    @Inject
    GraphLoaderService graphLoader;

    @Inject
    EventBus eventBus;

    @Inject
    EngineConfig config;

    private final Map<UUID, ActiveRun> activeRuns = new ConcurrentHashMap<>();

    /**
     * A run in flight: its record as created and its scheduler.
     */
    private static final class ActiveRun {
        final RunRecord record;
        final StepScheduler scheduler;
        final CompletableFuture<RunRecord> completion = new CompletableFuture<>();
        boolean finished;

        ActiveRun(RunRecord record, StepScheduler scheduler) {
            this.record = record;
            this.scheduler = scheduler;
        }
    }

    public UUID launch(Graph graph, RunConfig runConfig) {
        RunConfig effective = runConfig != null ? runConfig : RunConfig.empty();
        ExecutionPlan plan = compiler.compile(graph, effective);
        RunRecord record = RunRecord.create(plan, effective.tags());
        log.info("Launching run {} of graph '{}'", record.runId(), graph.name());
        return start(record);
    }

    /**
     * Launch a graph registered with the {@link GraphLoaderService}.
     */
    public UUID launch(String graphName, RunConfig runConfig) {
        Graph graph = graphLoader.find(graphName)
                .orElseThrow(() -> new IllegalArgumentException("Graph not found: " + graphName));
        return launch(graph, runConfig);
    }

    /**
     * Start a run derived from a finished parent run.
     *
     * @throws ReExecutionException         if the parent is unknown or cannot be re-executed
     * @throws StaleParentArtifactException if a reused output no longer exists
     */
    public UUID reexecute(UUID parentRunId, ReExecutionMode mode, String selection) {
        RunRecord parent = runStorage.getRun(parentRunId)
                .orElseThrow(() -> new ReExecutionException("Run not found: " + parentRunId));

        ExecutionPlan plan = reExecutionPlanner.planReExecution(parent, mode, selection);
        RunRecord record = RunRecord.reExecutionOf(parent, plan, mode, selection);
        log.info("Launching run {} as {} re-execution of run {}", record.runId(), mode, parentRunId);
        return start(record);
    }

    /**
     * Request cancellation of a running run.
     *
     * @return false if the run is not running
     */
    public boolean cancel(UUID runId) {
        ActiveRun run = activeRuns.get(runId);
        if (run == null) {
            log.debug("Cancel ignored, run {} is not running", runId);
            return false;
        }
        run.scheduler.cancel();
        workerPool.cancel(runId);
        triggerEvaluation(runId);
        return true;
    }

    /**
     * Wait for a run to finish.
     *
     * @return the run record, still RUNNING if the timeout elapsed first
     */
    public RunRecord awaitRun(UUID runId, Duration timeout) {
        ActiveRun run = activeRuns.get(runId);
        if (run != null) {
            try {
                return run.completion.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                log.debug("Run {} still running after {}", runId, timeout);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException("Interrupted waiting for run " + runId, e);
            } catch (ExecutionException e) {
                throw new IllegalStateException("Run " + runId + " did not complete", e.getCause());
            }
        }
        return runStorage.getRun(runId)
                .orElseThrow(() -> new IllegalArgumentException("Run not found: " + runId));
    }

    public Optional<RunRecord> findRun(UUID runId) {
        return runStorage.getRun(runId);
    }

    public List<StepEvent> events(UUID runId) {
        return runStorage.events(runId);
    }

    /**
     * Live outcomes of a running run, or the recorded outcomes of a finished one.
     */
    public Map<String, StepOutcome> outcomes(UUID runId) {
        ActiveRun run = activeRuns.get(runId);
        if (run != null) {
            return run.scheduler.snapshot();
        }
        return runStorage.getRun(runId).map(RunRecord::outcomes).orElse(Map.of());
    }

    public boolean isActive(UUID runId) {
        return activeRuns.containsKey(runId);
    }

    @ConsumeEvent(value = RUN_EVALUATE, blocking = true)
    public void evaluate(UUID runId) {
        ActiveRun run = activeRuns.get(runId);
        if (run == null) {
            log.debug("Run {} is not active, nothing to evaluate", runId);
            return;
        }

        synchronized (run) {
            if (run.finished) {
                return;
            }
            if (config.testMode()) {
                executeInline(run);
            } else {
                dispatch(run);
            }
            if (run.scheduler.isComplete()) {
                finish(run);
            }
        }
    }

    @ConsumeEvent(value = WorkerPool.STEP_COMPLETED, blocking = true)
    public void onStepCompleted(StepCompletionEvent event) {
        ActiveRun run = activeRuns.get(event.runId());
        if (run == null) {
            log.warn("Dropping result of step {}: run {} is not active", event.stepKey(), event.runId());
            return;
        }

        synchronized (run) {
            try {
                applyResult(run, event.stepKey(), event.result());
            } catch (InvalidMappingKeyException e) {
                log.debug("Run {} aborted, no further evaluation", event.runId());
                return;
            }
        }
        evaluate(event.runId());
    }

    private UUID start(RunRecord record) {
        runStorage.createRun(record);

        StepScheduler scheduler;
        try {
            scheduler = schedulerCore.start(record.runId(), record.plan(), runStorage::appendEvent);
        } catch (StaleParentArtifactException e) {
            log.error("Run {} cannot start: {}", record.runId(), e.getMessage());
            runStorage.updateRun(record.complete(RunStatus.FAILED, record.plan(), Map.of(), e.getMessage()));
            throw e;
        }

        activeRuns.put(record.runId(), new ActiveRun(record, scheduler));
        triggerEvaluation(record.runId());
        return record.runId();
    }

    private void triggerEvaluation(UUID runId) {
        if (config.testMode()) {
            log.debug("Test mode: direct synchronous evaluation for run: {}", runId);
            evaluate(runId);
        } else {
            log.debug("Async evaluation via event bus for run: {}", runId);
            eventBus.publish(RUN_EVALUATE, runId);
        }
    }

    private void executeInline(ActiveRun run) {
        StepScheduler scheduler = run.scheduler;
        List<ExecutionStep> ready = scheduler.poll();

        while (!ready.isEmpty()) {
            for (ExecutionStep step : ready) {
                if (scheduler.isCancelRequested()) {
                    break;
                }
                if (!scheduler.markRunning(step.key())) {
                    continue;
                }
                StepResult result = workerPool.executeInline(scheduler.dispatchFor(step.key()));
                applyResult(run, step.key(), result);
            }
            ready = scheduler.poll();
        }
    }

    private void dispatch(ActiveRun run) {
        StepScheduler scheduler = run.scheduler;
        for (ExecutionStep step : scheduler.poll()) {
            if (!scheduler.markRunning(step.key())) {
                continue;
            }
            log.debug("Dispatching step {} of run {}", step.key(), run.record.runId());
            try {
                workerPool.submit(scheduler.dispatchFor(step.key()));
            } catch (RuntimeException e) {
                log.error("Failed to dispatch step {} of run {}", step.key(), run.record.runId(), e);
                applyResult(run, step.key(), StepResult.failure("Dispatch failed: " + e.getMessage()));
            }
        }
    }

    private void applyResult(ActiveRun run, String stepKey, StepResult result) {
        try {
            run.scheduler.applyOutcome(stepKey, result);
        } catch (InvalidMappingKeyException e) {
            log.error("Run {} aborted by step {}: {}", run.record.runId(), stepKey, e.getMessage());
            finish(run);
            throw e;
        }
    }

    private void finish(ActiveRun run) {
        if (run.finished) {
            return;
        }
        run.finished = true;

        StepScheduler scheduler = run.scheduler;
        RunStatus status = scheduler.runStatus();
        if (!status.isTerminal()) {
            status = RunStatus.FAILED;
        }
        Map<String, StepOutcome> outcomes = scheduler.snapshot();

        RunRecord completed = run.record.complete(status, scheduler.plan(), outcomes, errorSummary(status, outcomes));
        runStorage.updateRun(completed);
        run.completion.complete(completed);
        activeRuns.remove(completed.runId());

        log.info("Run {} finished: {} ({} steps)", completed.runId(), status, outcomes.size());
    }

    private static String errorSummary(RunStatus status, Map<String, StepOutcome> outcomes) {
        if (status != RunStatus.FAILED) {
            return null;
        }
        String failed = outcomes.values().stream()
                .filter(o -> o.status() == StepStatus.FAILED)
                .map(o -> o.stepKey() + ": " + o.error())
                .collect(Collectors.joining("; "));
        return failed.isEmpty() ? "Run failed" : failed;
    }
}
