package org.neuralchilli.stepgraph.domain;

import java.io.Serializable;

/**
 * A declared output of a node definition.
 * Dynamic outputs emit zero or more keyed instances at run time.
 */
public record OutputDefinition(
        String name,
        SemanticType type,
        boolean required,
        boolean dynamic
) implements Serializable {

    public static final String DEFAULT_NAME = "result";

    public OutputDefinition {
        Names.requireValid(name, "Output");
        if (type == null) {
            type = SemanticType.ANY;
        }
    }

    public static OutputDefinition of(String name, SemanticType type) {
        return new OutputDefinition(name, type, true, false);
    }

    public static OutputDefinition optional(String name, SemanticType type) {
        return new OutputDefinition(name, type, false, false);
    }

    public static OutputDefinition dynamic(String name, SemanticType type) {
        return new OutputDefinition(name, type, true, true);
    }

    public static OutputDefinition result() {
        return of(DEFAULT_NAME, SemanticType.ANY);
    }
}
