package org.neuralchilli.stepgraph.domain;

/**
 * Thrown when a dependency would close a cycle in a graph.
 */
public class CycleDetectedException extends GraphStructureException {

    public CycleDetectedException(String message) {
        super(message);
    }

    public CycleDetectedException(String message, Throwable cause) {
        super(message, cause);
    }
}
