package org.neuralchilli.stepgraph.spi;

/**
 * Thrown by compute to fail a step. Recorded on the step, never propagated to the run.
 */
public class StepExecutionException extends RuntimeException {

    public StepExecutionException(String message) {
        super(message);
    }

    public StepExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
