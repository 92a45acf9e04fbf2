package org.neuralchilli.stepgraph.reexecution;

/**
 * Which steps of a parent run a re-execution runs again.
 */
public enum ReExecutionMode {
    /**
     * Every step runs fresh
     */
    ALL,

    /**
     * Only the selected steps run; everything else is reused
     */
    SELECTED,

    /**
     * The selected steps and everything downstream of them run
     */
    FROM_SELECTED,

    /**
     * Failed or unfinished steps and everything downstream of them run
     */
    FROM_FAILURE;

    public boolean requiresSelection() {
        return this == SELECTED || this == FROM_SELECTED;
    }

    public static ReExecutionMode fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Re-execution mode cannot be null");
        }
        try {
            return valueOf(value.trim().toUpperCase().replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Invalid re-execution mode: " + value +
                            ". Valid modes: all, selected, from_selected, from_failure"
            );
        }
    }
}
