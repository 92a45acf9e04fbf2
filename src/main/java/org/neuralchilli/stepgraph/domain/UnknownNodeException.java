package org.neuralchilli.stepgraph.domain;

/**
 * Thrown when a dependency references a node that is not part of the graph.
 */
public class UnknownNodeException extends GraphStructureException {

    private final String node;

    public UnknownNodeException(String node, String graph) {
        super("Node '" + node + "' not found in graph '" + graph + "'");
        this.node = node;
    }

    public String getNode() {
        return node;
    }
}
