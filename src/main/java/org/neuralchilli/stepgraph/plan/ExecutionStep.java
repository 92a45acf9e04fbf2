package org.neuralchilli.stepgraph.plan;

import org.neuralchilli.stepgraph.domain.OutputDefinition;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A concrete unit of work: one op instance with resolved inputs.
 * The key is the node handle, suffixed with {@code [mappingKey]} for mapped clones.
 */
public record ExecutionStep(
        String key,
        String handle,
        String opName,
        String mappingKey,
        Map<String, StepInput> inputs,
        List<OutputDefinition> outputs,
        StepSource source,
        Map<String, String> tags
) implements Serializable {

    public ExecutionStep {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Step key cannot be null or empty");
        }
        if (handle == null || handle.isBlank()) {
            throw new IllegalArgumentException("Step handle cannot be null or empty");
        }

        // Defaults
        inputs = inputs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
        outputs = outputs == null ? List.of() : List.copyOf(outputs);
        if (source == null) {
            source = StepSource.fresh();
        }
        tags = tags == null ? Map.of() : Map.copyOf(tags);
    }

    public static String keyOf(String handle, String mappingKey) {
        return mappingKey == null ? handle : handle + "[" + mappingKey + "]";
    }

    public ExecutionStep withSource(StepSource newSource) {
        return new ExecutionStep(key, handle, opName, mappingKey, inputs, outputs, newSource, tags);
    }

    public boolean isReused() {
        return source.isReused();
    }

    public Optional<OutputDefinition> output(String name) {
        return outputs.stream().filter(o -> o.name().equals(name)).findFirst();
    }

    /**
     * Keys of every step this step waits on.
     */
    public Set<String> upstreamStepKeys() {
        Set<String> keys = new LinkedHashSet<>();
        inputs.values().forEach(input -> keys.addAll(input.source().producerStepKeys()));
        return keys;
    }
}
