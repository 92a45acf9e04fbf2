package org.neuralchilli.stepgraph.spi;

import org.neuralchilli.stepgraph.run.ArtifactHandle;

import java.util.UUID;

/**
 * Persists step output values and resolves them by handle.
 */
public interface ArtifactStore {

    ArtifactHandle store(UUID runId, String stepKey, String outputName, String mappingKey, Object value);

    Object load(ArtifactHandle handle);

    boolean exists(ArtifactHandle handle);

    default boolean exists(String stepKey, String outputName, UUID runId) {
        return exists(new ArtifactHandle(runId, stepKey, outputName, null));
    }
}
