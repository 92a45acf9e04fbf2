package org.neuralchilli.stepgraph.domain;

import java.io.Serializable;

/**
 * Exposes an output of one of a nested graph's nodes as a graph output.
 */
public record OutputMapping(String graphOutput, String node, String output) implements Serializable {

    public OutputMapping {
        Names.requireValid(graphOutput, "Graph output");
        Names.requireValid(node, "Node");
        Names.requireValid(output, "Output");
    }
}
