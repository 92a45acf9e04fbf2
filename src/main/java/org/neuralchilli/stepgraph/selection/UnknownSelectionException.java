package org.neuralchilli.stepgraph.selection;

/**
 * A selection token names no step or node of the plan.
 */
public class UnknownSelectionException extends SelectionException {

    private final String name;

    public UnknownSelectionException(String name) {
        super("No step or node matches '" + name + "'");
        this.name = name;
    }

    public String getName() {
        return name;
    }
}
