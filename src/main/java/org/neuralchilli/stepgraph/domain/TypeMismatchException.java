package org.neuralchilli.stepgraph.domain;

/**
 * Thrown when a source cannot flow into an input because the types are incompatible.
 */
public class TypeMismatchException extends GraphStructureException {

    public TypeMismatchException(String message) {
        super(message);
    }
}
