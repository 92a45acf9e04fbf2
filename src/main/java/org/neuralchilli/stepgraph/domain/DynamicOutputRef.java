package org.neuralchilli.stepgraph.domain;

import java.io.Serializable;

/**
 * Identifies a dynamic output by the handle of the node that declares it.
 */
public record DynamicOutputRef(String node, String output) implements Serializable {

    @Override
    public String toString() {
        return node + "." + output;
    }
}
