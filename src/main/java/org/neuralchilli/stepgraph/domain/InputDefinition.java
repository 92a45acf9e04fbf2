package org.neuralchilli.stepgraph.domain;

import java.io.Serializable;

/**
 * A declared input of a node definition.
 * No-data inputs carry no value and are always typed NOTHING; they are wired with
 * ordering dependencies only.
 */
public record InputDefinition(
        String name,
        SemanticType type,
        Object defaultValue,
        boolean hasDefault,
        boolean noData
) implements Serializable {

    public InputDefinition {
        Names.requireValid(name, "Input");

        if (type == null) {
            type = noData ? SemanticType.NOTHING : SemanticType.ANY;
        }
        if (type == SemanticType.NOTHING) {
            noData = true;
        }
        if (noData && type != SemanticType.NOTHING) {
            throw new IllegalArgumentException(
                    "No-data input '" + name + "' cannot be typed " + type
            );
        }
        if (noData && hasDefault) {
            throw new IllegalArgumentException("No-data input '" + name + "' cannot have a default");
        }
        if (hasDefault && !type.accepts(defaultValue)) {
            throw new IllegalArgumentException(
                    "Default value for input '" + name + "' is not a valid " + type + ": " + defaultValue
            );
        }
        if (!hasDefault) {
            defaultValue = null;
        }
    }

    public static InputDefinition of(String name) {
        return new InputDefinition(name, SemanticType.ANY, null, false, false);
    }

    public static InputDefinition of(String name, SemanticType type) {
        return new InputDefinition(name, type, null, false, false);
    }

    public static InputDefinition withDefault(String name, SemanticType type, Object defaultValue) {
        return new InputDefinition(name, type, defaultValue, true, false);
    }

    public static InputDefinition noData(String name) {
        return new InputDefinition(name, SemanticType.NOTHING, null, false, true);
    }

    /**
     * Required inputs must be wired or stubbed from config.
     */
    public boolean isRequired() {
        return !hasDefault && !noData;
    }
}
