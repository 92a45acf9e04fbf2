package org.neuralchilli.stepgraph.scheduler;

import org.neuralchilli.stepgraph.run.ArtifactHandle;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of executing a step, with outputs already stored.
 * Dynamic output instances are keyed by the raw mapping key reported by compute.
 */
public record StepResult(
        boolean success,
        Map<String, ArtifactHandle> outputs,
        Map<String, Map<String, ArtifactHandle>> dynamicOutputs,
        String error
) implements Serializable {

    public StepResult {
        outputs = outputs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(outputs));
        Map<String, Map<String, ArtifactHandle>> dynamic = new LinkedHashMap<>();
        if (dynamicOutputs != null) {
            dynamicOutputs.forEach((name, instances) ->
                    dynamic.put(name, Collections.unmodifiableMap(new LinkedHashMap<>(instances))));
        }
        dynamicOutputs = Collections.unmodifiableMap(dynamic);
    }

    public static StepResult success(Map<String, ArtifactHandle> outputs) {
        return new StepResult(true, outputs, Map.of(), null);
    }

    public static StepResult success(Map<String, ArtifactHandle> outputs,
                                     Map<String, Map<String, ArtifactHandle>> dynamicOutputs) {
        return new StepResult(true, outputs, dynamicOutputs, null);
    }

    public static StepResult failure(String error) {
        return new StepResult(false, Map.of(), Map.of(), error);
    }
}
