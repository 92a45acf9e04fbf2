package org.neuralchilli.stepgraph.storage;

import com.hazelcast.core.HazelcastInstance;
import com.hazelcast.map.IMap;
import com.hazelcast.query.Predicates;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.stepgraph.run.ArtifactHandle;
import org.neuralchilli.stepgraph.spi.ArtifactStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.util.Set;
import java.util.UUID;

/**
 * Artifact store backed by a Hazelcast map keyed by handle.
 * Values must be serializable; null is a valid value.
 */
@ApplicationScoped
public class HazelcastArtifactStore implements ArtifactStore {

    private static final Logger log = LoggerFactory.getLogger(HazelcastArtifactStore.class);

    @Inject
    HazelcastInstance hazelcast;

    private IMap<ArtifactHandle, StoredArtifact> artifacts;

    /**
     * Wrapper so null values can be stored.
     */
    record StoredArtifact(Object value) implements Serializable {
    }

    @PostConstruct
    void init() {
        artifacts = hazelcast.getMap("artifacts");
        log.info("HazelcastArtifactStore initialized");
    }

    @Override
    public ArtifactHandle store(UUID runId, String stepKey, String outputName, String mappingKey, Object value) {
        if (value != null && !(value instanceof Serializable)) {
            throw new IllegalArgumentException(
                    "Output " + stepKey + "." + outputName + " is not serializable: " + value.getClass().getName());
        }
        ArtifactHandle handle = new ArtifactHandle(runId, stepKey, outputName, mappingKey);
        artifacts.set(handle, new StoredArtifact(value));
        log.trace("Stored artifact {}", handle);
        return handle;
    }

    @Override
    public Object load(ArtifactHandle handle) {
        StoredArtifact stored = artifacts.get(handle);
        if (stored == null) {
            throw new IllegalArgumentException("Artifact not found: " + handle);
        }
        return stored.value();
    }

    @Override
    public boolean exists(ArtifactHandle handle) {
        return artifacts.containsKey(handle);
    }

    /**
     * Remove every artifact of a run.
     *
     * @return number of artifacts removed
     */
    public int purge(UUID runId) {
        Set<ArtifactHandle> handles = artifacts.keySet(Predicates.equal("__key.runId", runId));
        handles.forEach(artifacts::delete);
        log.info("Purged {} artifacts of run {}", handles.size(), runId);
        return handles.size();
    }
}
