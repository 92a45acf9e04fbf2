package org.neuralchilli.stepgraph.plan;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Per-run configuration: input stubs keyed by node handle, and run tags.
 */
public record RunConfig(
        Map<String, Map<String, Object>> inputs,
        Map<String, String> tags
) implements Serializable {

    private static final RunConfig EMPTY = new RunConfig(Map.of(), Map.of());

    public RunConfig {
        Map<String, Map<String, Object>> copy = new LinkedHashMap<>();
        if (inputs != null) {
            inputs.forEach((handle, values) ->
                    copy.put(handle, Collections.unmodifiableMap(new LinkedHashMap<>(values))));
        }
        inputs = Collections.unmodifiableMap(copy);
        tags = tags == null ? Map.of() : Map.copyOf(tags);
    }

    public static RunConfig empty() {
        return EMPTY;
    }

    public boolean hasInput(String handle, String input) {
        return inputs.getOrDefault(handle, Map.of()).containsKey(input);
    }

    public Object input(String handle, String input) {
        return inputs.getOrDefault(handle, Map.of()).get(input);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, Map<String, Object>> inputs = new LinkedHashMap<>();
        private final Map<String, String> tags = new LinkedHashMap<>();

        public Builder input(String handle, String input, Object value) {
            inputs.computeIfAbsent(handle, k -> new LinkedHashMap<>()).put(input, value);
            return this;
        }

        public Builder tag(String key, String value) {
            tags.put(key, value);
            return this;
        }

        public RunConfig build() {
            return new RunConfig(inputs, tags);
        }
    }
}
