package org.neuralchilli.stepgraph.selection;

/**
 * Base class for errors raised while evaluating a step selection.
 * No partial selection is ever returned alongside one of these.
 */
public class SelectionException extends RuntimeException {

    public SelectionException(String message) {
        super(message);
    }

    public SelectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
