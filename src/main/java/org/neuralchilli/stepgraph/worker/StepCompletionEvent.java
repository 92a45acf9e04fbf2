package org.neuralchilli.stepgraph.worker;

import org.neuralchilli.stepgraph.scheduler.StepResult;

import java.io.Serial;
import java.io.Serializable;
import java.util.UUID;

/**
 * Event published when a worker finishes a step, successfully or not.
 */
public final class StepCompletionEvent implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    private final UUID runId;
    private final String stepKey;
    private final StepResult result;

    public StepCompletionEvent(UUID runId, String stepKey, StepResult result) {
        if (runId == null) {
            throw new IllegalArgumentException("Run ID cannot be null");
        }
        if (stepKey == null || stepKey.isBlank()) {
            throw new IllegalArgumentException("Step key cannot be null or empty");
        }
        if (result == null) {
            throw new IllegalArgumentException("Result cannot be null");
        }
        this.runId = runId;
        this.stepKey = stepKey;
        this.result = result;
    }

    public static StepCompletionEvent of(UUID runId, String stepKey, StepResult result) {
        return new StepCompletionEvent(runId, stepKey, result);
    }

    public UUID runId() {
        return runId;
    }

    public String stepKey() {
        return stepKey;
    }

    public StepResult result() {
        return result;
    }

    @Override
    public String toString() {
        return "StepCompletionEvent[runId=" + runId + ", stepKey=" + stepKey + ", success=" + result.success() + "]";
    }
}
