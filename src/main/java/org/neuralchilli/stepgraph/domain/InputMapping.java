package org.neuralchilli.stepgraph.domain;

import java.io.Serializable;

/**
 * Routes a nested graph's input to an input of one of its nodes.
 */
public record InputMapping(String graphInput, String node, String input) implements Serializable {

    public InputMapping {
        Names.requireValid(graphInput, "Graph input");
        Names.requireValid(node, "Node");
        Names.requireValid(input, "Input");
    }
}
