package org.neuralchilli.stepgraph.worker;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.neuralchilli.stepgraph.plan.ExecutionPlan;
import org.neuralchilli.stepgraph.plan.PlanCompiler;
import org.neuralchilli.stepgraph.plan.RunConfig;
import org.neuralchilli.stepgraph.run.ArtifactHandle;
import org.neuralchilli.stepgraph.scheduler.InputBinding;
import org.neuralchilli.stepgraph.scheduler.StepDispatch;
import org.neuralchilli.stepgraph.scheduler.StepResult;
import org.neuralchilli.stepgraph.spi.ArtifactStore;
import org.neuralchilli.stepgraph.spi.ComputeCollaborator;
import org.neuralchilli.stepgraph.spi.ComputeResult;
import org.neuralchilli.stepgraph.spi.StepExecutionException;
import org.neuralchilli.stepgraph.spi.StepInvocation;
import org.neuralchilli.stepgraph.testing.InMemoryArtifactStore;
import org.neuralchilli.stepgraph.testing.TestGraphs;

import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Tests for executing a single dispatched step.
 */
class StepExecutorTest {

    private StepExecutor executor;
    private ComputeCollaborator compute;
    private InMemoryArtifactStore store;
    private UUID runId;
    private ExecutionPlan plan;

    @BeforeEach
    void setup() {
        compute = mock(ComputeCollaborator.class);
        store = new InMemoryArtifactStore();

        executor = new StepExecutor();
        executor.compute = compute;
        executor.artifactStore = store;

        runId = UUID.randomUUID();
        plan = new PlanCompiler().compile(TestGraphs.linear(), RunConfig.empty());
    }

    @Test
    void shouldLoadInputsAndStoreOutputs() {
        // Given: A's output is stored and B is dispatched against it
        ArtifactHandle upstream = store.store(runId, "A", "result", null, "hello");
        StepDispatch dispatch = new StepDispatch(runId, plan.step("B"),
                Map.of("in", new InputBinding.Artifact(upstream)));
        when(compute.execute(any())).thenReturn(ComputeResult.builder().output("result", "HELLO").build());

        // When
        StepResult result = executor.execute(dispatch);

        // Then: Compute saw the loaded value
        ArgumentCaptor<StepInvocation> captor = ArgumentCaptor.forClass(StepInvocation.class);
        verify(compute).execute(captor.capture());
        StepInvocation invocation = captor.getValue();
        assertThat(invocation.runId()).isEqualTo(runId);
        assertThat(invocation.stepKey()).isEqualTo("B");
        assertThat(invocation.opName()).isEqualTo("B");
        assertThat(invocation.input("in")).isEqualTo("hello");

        // And: The output was stored under B
        assertThat(result.success()).isTrue();
        ArtifactHandle handle = result.outputs().get("result");
        assertThat(handle).isEqualTo(new ArtifactHandle(runId, "B", "result", null));
        assertThat(store.load(handle)).isEqualTo("HELLO");
    }

    @Test
    void shouldLoadCollectedInputsAsList() {
        ArtifactHandle first = store.store(runId, "process[a]", "result", null, 1);
        ArtifactHandle second = store.store(runId, "process[b]", "result", null, 2);
        StepDispatch dispatch = new StepDispatch(runId, plan.step("B"),
                Map.of("in", new InputBinding.Artifacts(List.of(first, second))));
        when(compute.execute(any())).thenReturn(ComputeResult.success(Map.of("result", 3)));

        executor.execute(dispatch);

        ArgumentCaptor<StepInvocation> captor = ArgumentCaptor.forClass(StepInvocation.class);
        verify(compute).execute(captor.capture());
        assertThat(captor.getValue().input("in")).isEqualTo(List.of(1, 2));
    }

    @Test
    void shouldStoreDynamicInstancesUnderRawKeys() {
        StepDispatch dispatch = new StepDispatch(runId, plan.step("A"), Map.of());
        when(compute.execute(any())).thenReturn(ComputeResult.builder()
                .dynamicOutput("items", "file-1.csv", "one")
                .dynamicOutput("items", "file-2.csv", "two")
                .build());

        StepResult result = executor.execute(dispatch);

        assertThat(result.dynamicOutputs().get("items")).containsOnlyKeys("file-1.csv", "file-2.csv");
        assertThat(store.load(result.dynamicOutputs().get("items").get("file-2.csv"))).isEqualTo("two");
    }

    @Test
    void shouldReportComputeFailure() {
        StepDispatch dispatch = new StepDispatch(runId, plan.step("A"), Map.of());
        when(compute.execute(any())).thenReturn(ComputeResult.failure("bad data"));

        StepResult result = executor.execute(dispatch);

        assertThat(result.success()).isFalse();
        assertThat(result.error()).isEqualTo("bad data");
        assertThat(store.size()).isZero();
    }

    @Test
    void shouldConvertExceptionsToFailures() {
        StepDispatch dispatch = new StepDispatch(runId, plan.step("A"), Map.of());

        when(compute.execute(any())).thenThrow(new StepExecutionException("declared failure"));
        assertThat(executor.execute(dispatch).error()).isEqualTo("declared failure");

        reset(compute);
        when(compute.execute(any())).thenThrow(new IllegalStateException("unexpected"));
        assertThat(executor.execute(dispatch).error()).isEqualTo("IllegalStateException: unexpected");

        reset(compute);
        when(compute.execute(any())).thenReturn(null);
        assertThat(executor.execute(dispatch).error()).contains("no result");
    }

    @Test
    void shouldFailWhenInputCannotBeLoaded() {
        // Given: A handle nothing was stored under
        ArtifactHandle missing = new ArtifactHandle(runId, "A", "result", null);
        StepDispatch dispatch = new StepDispatch(runId, plan.step("B"),
                Map.of("in", new InputBinding.Artifact(missing)));

        // When
        StepResult result = executor.execute(dispatch);

        // Then: Compute is never called
        assertThat(result.error()).startsWith("Failed to load inputs");
        verifyNoInteractions(compute);
    }

    @Test
    void shouldFailWhenOutputCannotBeStored() {
        ArtifactStore failing = mock(ArtifactStore.class);
        when(failing.store(any(), any(), any(), any(), any())).thenThrow(new IllegalArgumentException("disk full"));
        executor.artifactStore = failing;
        when(compute.execute(any())).thenReturn(ComputeResult.success(Map.of("result", 1)));

        StepResult result = executor.execute(new StepDispatch(runId, plan.step("A"), Map.of()));

        assertThat(result.error()).isEqualTo("Failed to store outputs: disk full");
    }
}
