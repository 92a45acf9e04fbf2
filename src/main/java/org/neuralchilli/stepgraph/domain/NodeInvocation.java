package org.neuralchilli.stepgraph.domain;

import java.io.Serializable;

/**
 * A named use of a definition inside a graph.
 */
public record NodeInvocation(String name, NodeDefinition definition) implements Serializable {

    public NodeInvocation {
        Names.requireValid(name, "Node");
        if (definition == null) {
            throw new IllegalArgumentException("Node '" + name + "' must have a definition");
        }
    }

    public boolean isGraph() {
        return definition instanceof Graph;
    }
}
