package org.neuralchilli.stepgraph.domain;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * A leaf computation: named, with typed inputs and outputs.
 * The compute behind an op is bound by name at run time.
 */
public record OpDefinition(
        String name,
        String description,
        List<InputDefinition> inputs,
        List<OutputDefinition> outputs,
        Map<String, String> tags
) implements NodeDefinition {

    public OpDefinition {
        Names.requireValid(name, "Op");

        inputs = inputs == null ? List.of() : List.copyOf(inputs);
        outputs = outputs == null ? List.of() : List.copyOf(outputs);
        tags = tags == null ? Map.of() : Map.copyOf(tags);

        Set<String> seen = new HashSet<>();
        for (InputDefinition input : inputs) {
            if (!seen.add(input.name())) {
                throw new IllegalArgumentException(
                        "Op '" + name + "' declares input '" + input.name() + "' more than once"
                );
            }
        }
        seen.clear();
        for (OutputDefinition output : outputs) {
            if (!seen.add(output.name())) {
                throw new IllegalArgumentException(
                        "Op '" + name + "' declares output '" + output.name() + "' more than once"
                );
            }
        }
    }

    public boolean hasDynamicOutput() {
        return outputs.stream().anyMatch(OutputDefinition::dynamic);
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static class Builder {
        private final String name;
        private String description;
        private final List<InputDefinition> inputs = new ArrayList<>();
        private final List<OutputDefinition> outputs = new ArrayList<>();
        private final Map<String, String> tags = new LinkedHashMap<>();

        private Builder(String name) {
            this.name = name;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder input(InputDefinition input) {
            this.inputs.add(input);
            return this;
        }

        public Builder input(String name, SemanticType type) {
            return input(InputDefinition.of(name, type));
        }

        public Builder output(OutputDefinition output) {
            this.outputs.add(output);
            return this;
        }

        public Builder output(String name, SemanticType type) {
            return output(OutputDefinition.of(name, type));
        }

        public Builder tag(String key, String value) {
            this.tags.put(key, value);
            return this;
        }

        public OpDefinition build() {
            return new OpDefinition(name, description, inputs, outputs, tags);
        }
    }
}
