package org.neuralchilli.stepgraph.plan;

/**
 * Thrown when dynamic mapping keys are empty or collide after sanitization.
 */
public class InvalidMappingKeyException extends PlanCompilationException {

    public InvalidMappingKeyException(String message) {
        super(message);
    }
}
