package org.neuralchilli.stepgraph.domain;

import java.util.Collection;
import java.util.Map;

/**
 * Type tags for op inputs and outputs.
 * ANY is the untyped escape hatch, NOTHING marks no-data (ordering) inputs and outputs.
 */
public enum SemanticType {
    ANY,
    NOTHING,
    STRING,
    INT,
    FLOAT,
    BOOL,
    LIST,
    MAP;

    /**
     * Parse type from string (case-insensitive)
     */
    public static SemanticType fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Type cannot be null");
        }
        try {
            return valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "Invalid type: " + value +
                            ". Valid types: any, nothing, string, int, float, bool, list, map"
            );
        }
    }

    /**
     * Whether a value of this type may flow into an input of the target type.
     */
    public boolean isAssignableTo(SemanticType target) {
        if (this == target) {
            return true;
        }
        if (this == NOTHING || target == NOTHING) {
            return false;
        }
        if (this == ANY || target == ANY) {
            return true;
        }
        return this == INT && target == FLOAT;
    }

    /**
     * Whether a literal value conforms to this type.
     */
    public boolean accepts(Object value) {
        if (value == null) {
            return this == ANY || this == NOTHING;
        }
        return switch (this) {
            case ANY -> true;
            case NOTHING -> false;
            case STRING -> value instanceof CharSequence;
            case INT -> value instanceof Integer || value instanceof Long
                    || value instanceof Short || value instanceof Byte;
            case FLOAT -> value instanceof Number;
            case BOOL -> value instanceof Boolean;
            case LIST -> value instanceof Collection;
            case MAP -> value instanceof Map;
        };
    }

    /**
     * Whether an unwired input of this type can be supplied from run config.
     */
    public boolean isConfigLoadable() {
        return this != NOTHING;
    }
}
