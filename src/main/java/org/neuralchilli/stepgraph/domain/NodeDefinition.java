package org.neuralchilli.stepgraph.domain;

import java.io.Serializable;
import java.util.List;
import java.util.Optional;

/**
 * Something that can be invoked as a node of a graph: a leaf op or a nested graph.
 */
public sealed interface NodeDefinition extends Serializable permits OpDefinition, Graph {

    String name();

    String description();

    List<InputDefinition> inputs();

    List<OutputDefinition> outputs();

    default Optional<InputDefinition> input(String name) {
        return inputs().stream().filter(i -> i.name().equals(name)).findFirst();
    }

    default Optional<OutputDefinition> output(String name) {
        return outputs().stream().filter(o -> o.name().equals(name)).findFirst();
    }
}
