package org.neuralchilli.stepgraph.plan;

import java.io.Serializable;

/**
 * Identifies one output of one step; the mapping key selects an instance of a dynamic output.
 */
public record StepOutputHandle(String stepKey, String outputName, String mappingKey) implements Serializable {

    public StepOutputHandle {
        if (stepKey == null || stepKey.isBlank()) {
            throw new IllegalArgumentException("Step key cannot be null or empty");
        }
        if (outputName == null || outputName.isBlank()) {
            throw new IllegalArgumentException("Output name cannot be null or empty");
        }
    }

    public static StepOutputHandle of(String stepKey, String outputName) {
        return new StepOutputHandle(stepKey, outputName, null);
    }

    @Override
    public String toString() {
        return mappingKey == null
                ? stepKey + "." + outputName
                : stepKey + "." + outputName + "[" + mappingKey + "]";
    }
}
