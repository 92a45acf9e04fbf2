package org.neuralchilli.stepgraph.scheduler;

/**
 * What happens when a step succeeds without emitting a required output.
 */
public enum MissingOutputPolicy {
    /**
     * The step is recorded as failed
     */
    FAIL_STEP,

    /**
     * The step succeeds and consumers of the missing output are skipped
     */
    SKIP_DOWNSTREAM
}
