package org.neuralchilli.stepgraph.spi;

import java.util.UUID;

/**
 * Executes the op behind a step.
 * Implementations report failure either through {@link ComputeResult#failure} or by throwing.
 */
public interface ComputeCollaborator {

    ComputeResult execute(StepInvocation invocation);

    /**
     * Best-effort signal that a running step's run was cancelled.
     */
    default void cancel(UUID runId, String stepKey) {
    }
}
