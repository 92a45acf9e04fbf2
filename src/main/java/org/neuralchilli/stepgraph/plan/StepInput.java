package org.neuralchilli.stepgraph.plan;

import org.neuralchilli.stepgraph.domain.SemanticType;

import java.io.Serializable;

public record StepInput(String name, SemanticType type, StepInputSource source) implements Serializable {

    public StepInput {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Input name cannot be null or empty");
        }
        if (source == null) {
            throw new IllegalArgumentException("Input '" + name + "' must have a source");
        }
    }
}
