package org.neuralchilli.stepgraph.scheduler;

import org.neuralchilli.stepgraph.run.ArtifactHandle;

import java.util.List;

/**
 * How a worker obtains the value of one step input.
 */
public sealed interface InputBinding
        permits InputBinding.Artifact, InputBinding.Artifacts, InputBinding.Value {

    record Artifact(ArtifactHandle handle) implements InputBinding {
    }

    /**
     * Fan-in: every emitted instance, in mapping-key order.
     */
    record Artifacts(List<ArtifactHandle> handles) implements InputBinding {
        public Artifacts {
            handles = List.copyOf(handles);
        }
    }

    record Value(Object value) implements InputBinding {
    }
}
