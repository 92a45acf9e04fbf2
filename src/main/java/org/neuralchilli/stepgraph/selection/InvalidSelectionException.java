package org.neuralchilli.stepgraph.selection;

public class InvalidSelectionException extends SelectionException {

    public InvalidSelectionException(String message) {
        super(message);
    }
}
