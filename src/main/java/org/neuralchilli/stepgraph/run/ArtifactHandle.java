package org.neuralchilli.stepgraph.run;

import java.io.Serializable;
import java.util.UUID;

/**
 * Address of a stored output value, including the run that produced it.
 */
public record ArtifactHandle(
        UUID runId,
        String stepKey,
        String outputName,
        String mappingKey
) implements Serializable {

    public ArtifactHandle {
        if (runId == null) {
            throw new IllegalArgumentException("Run ID cannot be null");
        }
        if (stepKey == null || stepKey.isBlank()) {
            throw new IllegalArgumentException("Step key cannot be null or empty");
        }
        if (outputName == null || outputName.isBlank()) {
            throw new IllegalArgumentException("Output name cannot be null or empty");
        }
    }

    @Override
    public String toString() {
        String output = mappingKey == null ? outputName : outputName + "[" + mappingKey + "]";
        return runId + "/" + stepKey + "." + output;
    }
}
