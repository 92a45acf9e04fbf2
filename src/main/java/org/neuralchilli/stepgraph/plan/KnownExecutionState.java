package org.neuralchilli.stepgraph.plan;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Dynamic mapping keys already known for a run: producer step key to output to keys.
 */
public record KnownExecutionState(Map<String, Map<String, List<String>>> dynamicMappings) implements Serializable {

    private static final KnownExecutionState EMPTY = new KnownExecutionState(Map.of());

    public KnownExecutionState {
        Map<String, Map<String, List<String>>> copy = new LinkedHashMap<>();
        if (dynamicMappings != null) {
            dynamicMappings.forEach((step, outputs) -> {
                Map<String, List<String>> outputCopy = new LinkedHashMap<>();
                outputs.forEach((output, keys) -> outputCopy.put(output, List.copyOf(keys)));
                copy.put(step, Collections.unmodifiableMap(outputCopy));
            });
        }
        dynamicMappings = Collections.unmodifiableMap(copy);
    }

    public static KnownExecutionState empty() {
        return EMPTY;
    }

    public Optional<List<String>> keysFor(String stepKey, String outputName) {
        return Optional.ofNullable(dynamicMappings.getOrDefault(stepKey, Map.of()).get(outputName));
    }

    public KnownExecutionState with(String stepKey, String outputName, List<String> keys) {
        Map<String, Map<String, List<String>>> next = new LinkedHashMap<>();
        dynamicMappings.forEach((step, outputs) -> next.put(step, new LinkedHashMap<>(outputs)));
        next.computeIfAbsent(stepKey, k -> new LinkedHashMap<>()).put(outputName, keys);
        return new KnownExecutionState(next);
    }

    /**
     * Keep only the mappings of producers accepted by the filter.
     */
    public KnownExecutionState restrictedTo(Predicate<String> producerFilter) {
        Map<String, Map<String, List<String>>> next = new LinkedHashMap<>();
        dynamicMappings.forEach((step, outputs) -> {
            if (producerFilter.test(step)) {
                next.put(step, outputs);
            }
        });
        return new KnownExecutionState(next);
    }
}
