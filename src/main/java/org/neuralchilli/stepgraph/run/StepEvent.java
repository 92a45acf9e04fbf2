package org.neuralchilli.stepgraph.run;

import java.io.Serializable;
import java.time.Instant;
import java.util.UUID;

/**
 * One transition of one step, in run sequence order.
 */
public record StepEvent(
        UUID runId,
        long sequence,
        String stepKey,
        StepStatus status,
        SkipReason skipReason,
        String message,
        Instant timestamp
) implements Serializable {

    public static StepEvent of(UUID runId, StepOutcome outcome) {
        return new StepEvent(
                runId,
                outcome.sequence(),
                outcome.stepKey(),
                outcome.status(),
                outcome.skipReason(),
                outcome.error(),
                outcome.updatedAt()
        );
    }
}
