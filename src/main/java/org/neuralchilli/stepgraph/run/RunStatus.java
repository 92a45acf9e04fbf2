package org.neuralchilli.stepgraph.run;

/**
 * Overall status of a run.
 */
public enum RunStatus {
    RUNNING,
    SUCCEEDED,
    FAILED,
    CANCELLED;

    /**
     * Check if this is a terminal state (run finished)
     */
    public boolean isTerminal() {
        return this != RUNNING;
    }
}
