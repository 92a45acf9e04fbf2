package org.neuralchilli.stepgraph.plan;

import java.io.Serializable;
import java.util.UUID;

/**
 * Whether a step executes in this run or reuses the outcome of a parent run.
 */
public record StepSource(Kind kind, UUID parentRunId, String parentStepKey) implements Serializable {

    public enum Kind {
        FRESH,
        REUSED
    }

    private static final StepSource FRESH = new StepSource(Kind.FRESH, null, null);

    public StepSource {
        if (kind == null) {
            throw new IllegalArgumentException("Step source kind cannot be null");
        }
        if (kind == Kind.REUSED && (parentRunId == null || parentStepKey == null)) {
            throw new IllegalArgumentException("Reused step source requires parent run and step");
        }
    }

    public static StepSource fresh() {
        return FRESH;
    }

    public static StepSource reused(UUID parentRunId, String parentStepKey) {
        return new StepSource(Kind.REUSED, parentRunId, parentStepKey);
    }

    public boolean isReused() {
        return kind == Kind.REUSED;
    }
}
