package org.neuralchilli.stepgraph.core;

import io.vertx.mutiny.core.eventbus.EventBus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.neuralchilli.stepgraph.config.EngineConfig;
import org.neuralchilli.stepgraph.plan.ExecutionPlan;
import org.neuralchilli.stepgraph.plan.PlanCompiler;
import org.neuralchilli.stepgraph.plan.RunConfig;
import org.neuralchilli.stepgraph.run.ArtifactHandle;
import org.neuralchilli.stepgraph.run.RunRecord;
import org.neuralchilli.stepgraph.run.RunStatus;
import org.neuralchilli.stepgraph.run.SkipReason;
import org.neuralchilli.stepgraph.run.StepOutcome;
import org.neuralchilli.stepgraph.run.StepStatus;
import org.neuralchilli.stepgraph.scheduler.MissingOutputPolicy;
import org.neuralchilli.stepgraph.scheduler.SchedulerCore;
import org.neuralchilli.stepgraph.scheduler.StepEventListener;
import org.neuralchilli.stepgraph.scheduler.StepResult;
import org.neuralchilli.stepgraph.scheduler.StepScheduler;
import org.neuralchilli.stepgraph.spi.RunStorage;
import org.neuralchilli.stepgraph.testing.InMemoryArtifactStore;
import org.neuralchilli.stepgraph.testing.TestGraphs;
import org.neuralchilli.stepgraph.worker.StepCompletionEvent;
import org.neuralchilli.stepgraph.worker.WorkerPool;

import java.time.Duration;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.*;

/**
 * Tests for handing ready steps to the worker pool outside test mode.
 */
class RunCoordinatorDispatchTest {

    private RunCoordinator coordinator;
    private WorkerPool workerPool;
    private RunStorage runStorage;
    private InMemoryArtifactStore store;

    @BeforeEach
    void setup() {
        PlanCompiler compiler = new PlanCompiler();
        store = new InMemoryArtifactStore();

        EngineConfig config = mock(EngineConfig.class);
        when(config.testMode()).thenReturn(false);

        SchedulerCore schedulerCore = mock(SchedulerCore.class);
        when(schedulerCore.start(any(), any(), any())).thenAnswer(inv -> {
            StepScheduler scheduler = new StepScheduler(inv.getArgument(0), inv.<ExecutionPlan>getArgument(1),
                    compiler, store, MissingOutputPolicy.FAIL_STEP, inv.<StepEventListener>getArgument(2));
            scheduler.start();
            return scheduler;
        });

        workerPool = mock(WorkerPool.class);
        runStorage = mock(RunStorage.class);

        coordinator = new RunCoordinator();
        coordinator.compiler = compiler;
        coordinator.schedulerCore = schedulerCore;
        coordinator.runStorage = runStorage;
        coordinator.workerPool = workerPool;
        coordinator.eventBus = mock(EventBus.class);
        coordinator.config = config;
    }

    @Test
    void shouldFailStepWhenWorkerPoolRefusesIt() {
        // Given: A pool that has been stopped
        doThrow(new IllegalStateException("Worker pool is not running")).when(workerPool).submit(any());
        UUID runId = coordinator.launch(TestGraphs.linear(), RunConfig.empty());

        // When
        coordinator.evaluate(runId);

        // Then: The refused step fails and the run finishes instead of hanging
        RunRecord record = coordinator.awaitRun(runId, Duration.ofSeconds(1));
        assertThat(record.status()).isEqualTo(RunStatus.FAILED);
        assertThat(coordinator.isActive(runId)).isFalse();

        Map<String, StepOutcome> outcomes = record.outcomes();
        assertThat(outcomes.get("A").status()).isEqualTo(StepStatus.FAILED);
        assertThat(outcomes.get("A").error()).isEqualTo("Dispatch failed: Worker pool is not running");
        assertThat(outcomes.get("B").skipReason()).isEqualTo(SkipReason.UPSTREAM_FAILURE);
        assertThat(outcomes.get("C").skipReason()).isEqualTo(SkipReason.UPSTREAM_FAILURE);
        verify(runStorage).updateRun(argThat(r -> r.status() == RunStatus.FAILED));
    }

    @Test
    void shouldDispatchNextStepOnCompletion() {
        // Given: A launched run whose first step has been handed to the pool
        UUID runId = coordinator.launch(TestGraphs.linear(), RunConfig.empty());
        coordinator.evaluate(runId);
        verify(workerPool).submit(argThat(d -> d.step().key().equals("A")));
        assertThat(coordinator.outcomes(runId).get("A").status()).isEqualTo(StepStatus.RUNNING);

        // When: The worker reports A's result
        ArtifactHandle handle = store.store(runId, "A", "result", null, "a");
        coordinator.onStepCompleted(StepCompletionEvent.of(runId, "A",
                StepResult.success(Map.of("result", handle))));

        // Then
        verify(workerPool).submit(argThat(d -> d.step().key().equals("B")));
        assertThat(coordinator.outcomes(runId).get("A").status()).isEqualTo(StepStatus.SUCCEEDED);
        assertThat(coordinator.isActive(runId)).isTrue();
    }
}
