package org.neuralchilli.stepgraph.plan;

/**
 * Thrown when a required input has no wired source, no config value and no default.
 */
public class UnresolvedInputException extends PlanCompilationException {

    private final String handle;
    private final String input;

    public UnresolvedInputException(String handle, String input) {
        super("Input '" + input + "' of node '" + handle + "' is not wired, not set in run config "
                + "(ops." + handle + ".inputs." + input + ") and has no default");
        this.handle = handle;
        this.input = input;
    }

    public String getHandle() {
        return handle;
    }

    public String getInput() {
        return input;
    }
}
