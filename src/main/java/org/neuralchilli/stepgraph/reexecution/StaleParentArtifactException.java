package org.neuralchilli.stepgraph.reexecution;

import org.neuralchilli.stepgraph.run.ArtifactHandle;

/**
 * Thrown when a step reused from a parent run points at an artifact that no longer exists.
 */
public class StaleParentArtifactException extends RuntimeException {

    private final String stepKey;
    private final ArtifactHandle handle;

    public StaleParentArtifactException(String stepKey, ArtifactHandle handle) {
        super("Step '" + stepKey + "' reuses artifact " + handle + " which no longer exists");
        this.stepKey = stepKey;
        this.handle = handle;
    }

    public String getStepKey() {
        return stepKey;
    }

    public ArtifactHandle getHandle() {
        return handle;
    }
}
