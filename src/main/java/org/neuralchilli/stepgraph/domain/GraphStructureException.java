package org.neuralchilli.stepgraph.domain;

/**
 * Thrown when a graph is structurally invalid.
 * Structural errors are always fatal at build or compile time.
 */
public class GraphStructureException extends RuntimeException {

    public GraphStructureException(String message) {
        super(message);
    }

    public GraphStructureException(String message, Throwable cause) {
        super(message, cause);
    }
}
