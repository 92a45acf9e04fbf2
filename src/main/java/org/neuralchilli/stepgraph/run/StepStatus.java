package org.neuralchilli.stepgraph.run;

/**
 * Lifecycle status of a step within a run.
 * Transitions only move forward; terminal statuses never change.
 */
public enum StepStatus {
    /**
     * Waiting for upstream steps
     */
    PENDING(0),

    /**
     * All inputs available, may be dispatched
     */
    READY(1),

    /**
     * Handed to compute
     */
    RUNNING(2),

    /**
     * Completed successfully
     */
    SUCCEEDED(3),

    /**
     * Compute failed or a required output was missing
     */
    FAILED(3),

    /**
     * Not executed, see the skip reason
     */
    SKIPPED(3);

    private final int rank;

    StepStatus(int rank) {
        this.rank = rank;
    }

    /**
     * Check if this is a terminal state (step finished)
     */
    public boolean isTerminal() {
        return rank == 3;
    }

    public boolean canTransitionTo(StepStatus next) {
        return !isTerminal() && next.rank > rank;
    }
}
