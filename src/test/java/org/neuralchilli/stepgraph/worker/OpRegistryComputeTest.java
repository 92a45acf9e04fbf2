package org.neuralchilli.stepgraph.worker;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.neuralchilli.stepgraph.spi.ComputeResult;
import org.neuralchilli.stepgraph.spi.StepExecutionException;
import org.neuralchilli.stepgraph.spi.StepInvocation;

import java.io.IOException;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.*;

class OpRegistryComputeTest {

    private OpRegistryCompute registry;
    private UUID runId;

    @BeforeEach
    void setup() {
        registry = new OpRegistryCompute();
        runId = UUID.randomUUID();
    }

    @Test
    void shouldDispatchByOpName() {
        registry.register("double", inv -> ComputeResult.success(Map.of("result", (Integer) inv.input("n") * 2)));

        ComputeResult result = registry.execute(invocation("double", Map.of("n", 21)));

        assertThat(registry.isRegistered("double")).isTrue();
        assertThat(result.outputs()).containsEntry("result", 42);
    }

    @Test
    void shouldFailUnknownOp() {
        ComputeResult result = registry.execute(invocation("missing", Map.of()));

        assertThat(result.isSuccess()).isFalse();
        assertThat(result.error()).contains("No compute registered for op 'missing'");
    }

    @Test
    void shouldWrapCheckedExceptions() {
        registry.register("io", inv -> {
            throw new IOException("file gone");
        });

        assertThatThrownBy(() -> registry.execute(invocation("io", Map.of())))
                .isInstanceOf(StepExecutionException.class)
                .hasMessage("file gone")
                .hasCauseInstanceOf(IOException.class);
    }

    @Test
    void shouldTrackCancellation() {
        registry.cancel(runId, "slow");

        assertThat(registry.isCancelled(runId, "slow")).isTrue();
        assertThat(registry.isCancelled(runId, "other")).isFalse();

        registry.clear();
        assertThat(registry.isCancelled(runId, "slow")).isFalse();
    }

    @Test
    void shouldDropCancellationSignalOnceStepReturns() {
        // Given: An op whose step is cancelled while it runs
        AtomicBoolean seen = new AtomicBoolean();
        registry.register("slow", inv -> {
            registry.cancel(inv.runId(), inv.stepKey());
            seen.set(registry.isCancelled(inv.runId(), inv.stepKey()));
            return ComputeResult.empty();
        });

        // When
        registry.execute(invocation("slow", Map.of()));

        // Then: The op saw the signal and nothing is retained afterwards
        assertThat(seen).isTrue();
        assertThat(registry.isCancelled(runId, "slow")).isFalse();
    }

    @Test
    void shouldRejectInvalidRegistration() {
        assertThatThrownBy(() -> registry.register(" ", inv -> ComputeResult.empty()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registry.register("op", null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private StepInvocation invocation(String op, Map<String, Object> inputs) {
        return new StepInvocation(runId, op, op, op, null, inputs, Map.of());
    }
}
