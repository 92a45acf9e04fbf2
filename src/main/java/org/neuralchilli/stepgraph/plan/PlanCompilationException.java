package org.neuralchilli.stepgraph.plan;

/**
 * Base class for errors raised while lowering a graph into an execution plan.
 */
public class PlanCompilationException extends RuntimeException {

    public PlanCompilationException(String message) {
        super(message);
    }

    public PlanCompilationException(String message, Throwable cause) {
        super(message, cause);
    }
}
