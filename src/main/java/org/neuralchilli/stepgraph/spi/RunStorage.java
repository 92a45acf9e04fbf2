package org.neuralchilli.stepgraph.spi;

import org.neuralchilli.stepgraph.run.RunRecord;
import org.neuralchilli.stepgraph.run.StepEvent;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persists run records and their append-only step event logs.
 */
public interface RunStorage {

    void createRun(RunRecord record);

    /**
     * Replace a run record that has not finished yet.
     *
     * @throws IllegalStateException if the stored run already finished
     */
    void updateRun(RunRecord record);

    Optional<RunRecord> getRun(UUID runId);

    void appendEvent(StepEvent event);

    List<StepEvent> events(UUID runId);
}
