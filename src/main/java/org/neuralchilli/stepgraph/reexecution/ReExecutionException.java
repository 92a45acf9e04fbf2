package org.neuralchilli.stepgraph.reexecution;

/**
 * A re-execution request that cannot be planned against its parent run.
 */
public class ReExecutionException extends RuntimeException {

    public ReExecutionException(String message) {
        super(message);
    }

    public ReExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
