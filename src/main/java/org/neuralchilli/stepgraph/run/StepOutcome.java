package org.neuralchilli.stepgraph.run;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The recorded state of one step in one run.
 * Each transition returns a new outcome stamped with the run's next sequence number.
 */
public record StepOutcome(
        String stepKey,
        StepStatus status,
        SkipReason skipReason,
        String error,
        Map<String, ArtifactHandle> outputs,
        Map<String, Map<String, ArtifactHandle>> dynamicOutputs,
        long sequence,
        Instant updatedAt,
        boolean reused
) implements Serializable {

    public StepOutcome {
        if (stepKey == null || stepKey.isBlank()) {
            throw new IllegalArgumentException("Step key cannot be null or empty");
        }
        if (status == null) {
            throw new IllegalArgumentException("Status cannot be null");
        }
        if (status == StepStatus.SKIPPED && skipReason == null) {
            throw new IllegalArgumentException("Skipped step '" + stepKey + "' must have a skip reason");
        }

        // Defaults
        outputs = outputs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
        if (dynamicOutputs == null) {
            dynamicOutputs = Map.of();
        } else {
            Map<String, Map<String, ArtifactHandle>> copy = new LinkedHashMap<>();
            dynamicOutputs.forEach((output, instances) ->
                    copy.put(output, Collections.unmodifiableMap(new LinkedHashMap<>(instances))));
            dynamicOutputs = Collections.unmodifiableMap(copy);
        }
        if (updatedAt == null) {
            updatedAt = Instant.now();
        }
    }

    /**
     * Create a new pending outcome
     */
    public static StepOutcome pending(String stepKey, long sequence) {
        return new StepOutcome(stepKey, StepStatus.PENDING, null, null, null, null,
                sequence, Instant.now(), false);
    }

    /**
     * Create an outcome for a step that never got past planning
     */
    public static StepOutcome skipped(String stepKey, SkipReason reason, String detail, long sequence) {
        return new StepOutcome(stepKey, StepStatus.SKIPPED, reason, detail, null, null,
                sequence, Instant.now(), false);
    }

    /**
     * Mark as ready
     */
    public StepOutcome ready(long sequence) {
        return transition(StepStatus.READY, null, null, outputs, dynamicOutputs, sequence, reused);
    }

    /**
     * Mark as running
     */
    public StepOutcome running(long sequence) {
        return transition(StepStatus.RUNNING, null, null, outputs, dynamicOutputs, sequence, reused);
    }

    /**
     * Mark as succeeded with the emitted outputs
     */
    public StepOutcome succeed(Map<String, ArtifactHandle> emitted,
                               Map<String, Map<String, ArtifactHandle>> emittedDynamic,
                               long sequence) {
        return transition(StepStatus.SUCCEEDED, null, null, emitted, emittedDynamic, sequence, false);
    }

    /**
     * Mark as succeeded with outputs carried over from a parent run
     */
    public StepOutcome reuse(StepOutcome parent, long sequence) {
        return transition(StepStatus.SUCCEEDED, null, null, parent.outputs(), parent.dynamicOutputs(), sequence, true);
    }

    /**
     * Mark as failed
     */
    public StepOutcome fail(String errorMessage, long sequence) {
        return transition(StepStatus.FAILED, null, errorMessage, outputs, dynamicOutputs, sequence, reused);
    }

    /**
     * Mark as skipped
     */
    public StepOutcome skip(SkipReason reason, String detail, long sequence) {
        return transition(StepStatus.SKIPPED, reason, detail, outputs, dynamicOutputs, sequence, reused);
    }

    /**
     * Mark as skipped, carried over from a parent run
     */
    public StepOutcome reuseSkip(SkipReason reason, String detail, long sequence) {
        return transition(StepStatus.SKIPPED, reason, detail, outputs, dynamicOutputs, sequence, true);
    }

    private StepOutcome transition(StepStatus next, SkipReason reason, String detail,
                                   Map<String, ArtifactHandle> nextOutputs,
                                   Map<String, Map<String, ArtifactHandle>> nextDynamic,
                                   long nextSequence, boolean nextReused) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Step '" + stepKey + "' cannot move from " + status + " to " + next);
        }
        return new StepOutcome(stepKey, next, reason, detail, nextOutputs, nextDynamic,
                nextSequence, Instant.now(), nextReused);
    }

    /**
     * Check if step is finished
     */
    public boolean isFinished() {
        return status.isTerminal();
    }

    public boolean hasEmitted(String outputName) {
        return outputs.containsKey(outputName) || dynamicOutputs.containsKey(outputName);
    }

    /**
     * The handle of an emitted output, or of one instance of an emitted dynamic output.
     */
    public Optional<ArtifactHandle> handleFor(String outputName, String mappingKey) {
        if (mappingKey == null) {
            return Optional.ofNullable(outputs.get(outputName));
        }
        return Optional.ofNullable(dynamicOutputs.getOrDefault(outputName, Map.of()).get(mappingKey));
    }

    public List<String> dynamicKeys(String outputName) {
        return List.copyOf(dynamicOutputs.getOrDefault(outputName, Map.of()).keySet());
    }

    /**
     * Every handle this outcome references, single and dynamic.
     */
    public List<ArtifactHandle> allHandles() {
        List<ArtifactHandle> handles = new ArrayList<>(outputs.values());
        dynamicOutputs.values().forEach(instances -> handles.addAll(instances.values()));
        return handles;
    }
}
