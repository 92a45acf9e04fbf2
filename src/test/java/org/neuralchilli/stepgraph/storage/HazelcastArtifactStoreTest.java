package org.neuralchilli.stepgraph.storage;

import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.Test;
import org.neuralchilli.stepgraph.run.ArtifactHandle;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.*;

@QuarkusTest
class HazelcastArtifactStoreTest {

    @Inject
    HazelcastArtifactStore store;

    @Test
    void shouldStoreAndLoadValues() {
        // Given
        UUID runId = UUID.randomUUID();

        // When
        ArtifactHandle single = store.store(runId, "A", "result", null, List.of(1, 2, 3));
        ArtifactHandle instance = store.store(runId, "split", "items", "a.b", "first");

        // Then: Handles keep the raw mapping key
        assertThat(store.load(single)).isEqualTo(List.of(1, 2, 3));
        assertThat(instance.mappingKey()).isEqualTo("a.b");
        assertThat(store.load(instance)).isEqualTo("first");
        assertThat(store.exists(instance)).isTrue();
    }

    @Test
    void shouldStoreNullValues() {
        ArtifactHandle handle = store.store(UUID.randomUUID(), "A", "result", null, null);

        assertThat(store.exists(handle)).isTrue();
        assertThat(store.load(handle)).isNull();
    }

    @Test
    void shouldRejectNonSerializableValues() {
        Object value = new Object();

        assertThatThrownBy(() -> store.store(UUID.randomUUID(), "A", "result", null, value))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not serializable");
    }

    @Test
    void shouldFailToLoadMissingArtifact() {
        ArtifactHandle handle = new ArtifactHandle(UUID.randomUUID(), "A", "result", null);

        assertThat(store.exists(handle)).isFalse();
        assertThatThrownBy(() -> store.load(handle))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Artifact not found");
    }

    @Test
    void shouldPurgeOnlyTheGivenRun() {
        // Given
        UUID purged = UUID.randomUUID();
        UUID kept = UUID.randomUUID();
        ArtifactHandle first = store.store(purged, "A", "result", null, 1);
        ArtifactHandle second = store.store(purged, "B", "result", null, 2);
        ArtifactHandle mapped = store.store(purged, "B", "result", "k1", 4);
        ArtifactHandle other = store.store(kept, "A", "result", null, 3);

        // When
        int removed = store.purge(purged);

        // Then
        assertThat(removed).isEqualTo(3);
        assertThat(store.exists(first)).isFalse();
        assertThat(store.exists(second)).isFalse();
        assertThat(store.exists(mapped)).isFalse();
        assertThat(store.exists(other)).isTrue();
    }
}
