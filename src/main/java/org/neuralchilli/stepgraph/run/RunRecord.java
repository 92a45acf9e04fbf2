package org.neuralchilli.stepgraph.run;

import org.neuralchilli.stepgraph.plan.ExecutionPlan;
import org.neuralchilli.stepgraph.reexecution.ReExecutionMode;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * One run of a graph, fresh or derived from a parent run.
 * Outcomes are recorded when the run finishes; a finished record is never changed.
 */
public record RunRecord(
        UUID runId,
        String graphName,
        UUID parentRunId,
        UUID rootRunId,
        ReExecutionMode mode,
        String stepSelection,
        ExecutionPlan plan,
        RunStatus status,
        Map<String, StepOutcome> outcomes,
        Map<String, String> tags,
        Instant startedAt,
        Instant completedAt,
        String error
) implements Serializable {

    public RunRecord {
        if (runId == null) {
            throw new IllegalArgumentException("Run ID cannot be null");
        }
        if (graphName == null || graphName.isBlank()) {
            throw new IllegalArgumentException("Graph name cannot be null or empty");
        }
        if (plan == null) {
            throw new IllegalArgumentException("Plan cannot be null");
        }
        if (status == null) {
            throw new IllegalArgumentException("Status cannot be null");
        }
        if (startedAt == null) {
            throw new IllegalArgumentException("Started at cannot be null");
        }
        if (parentRunId != null && rootRunId == null) {
            throw new IllegalArgumentException("Re-execution must record its root run");
        }

        // Defaults
        outcomes = outcomes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(outcomes));
        tags = tags == null ? Map.of() : Map.copyOf(tags);
    }

    /**
     * Create a new run
     */
    public static RunRecord create(ExecutionPlan plan, Map<String, String> tags) {
        return new RunRecord(
                UUID.randomUUID(),
                plan.graphName(),
                null,
                null,
                null,
                null,
                plan,
                RunStatus.RUNNING,
                Map.of(),
                tags,
                Instant.now(),
                null,
                null
        );
    }

    /**
     * Create a run derived from a parent run
     */
    public static RunRecord reExecutionOf(RunRecord parent, ExecutionPlan plan,
                                          ReExecutionMode mode, String stepSelection) {
        Map<String, String> tags = new LinkedHashMap<>(parent.tags());
        tags.put("parent_run_id", parent.runId().toString());
        tags.put("reexecution_mode", mode.name());
        return new RunRecord(
                UUID.randomUUID(),
                parent.graphName(),
                parent.runId(),
                parent.rootRunId() != null ? parent.rootRunId() : parent.runId(),
                mode,
                stepSelection,
                plan,
                RunStatus.RUNNING,
                Map.of(),
                tags,
                Instant.now(),
                null,
                null
        );
    }

    /**
     * Mark as finished with the final plan and outcomes
     */
    public RunRecord complete(RunStatus finalStatus, ExecutionPlan finalPlan,
                              Map<String, StepOutcome> finalOutcomes, String errorMessage) {
        if (isFinished()) {
            throw new IllegalStateException("Run " + runId + " already finished as " + status);
        }
        if (!finalStatus.isTerminal()) {
            throw new IllegalArgumentException("Final status must be terminal, got " + finalStatus);
        }
        return new RunRecord(
                runId, graphName, parentRunId, rootRunId, mode, stepSelection,
                finalPlan, finalStatus, finalOutcomes, tags, startedAt, Instant.now(), errorMessage
        );
    }

    /**
     * Check if run is finished
     */
    public boolean isFinished() {
        return status.isTerminal();
    }

    public boolean isReExecution() {
        return parentRunId != null;
    }
}
