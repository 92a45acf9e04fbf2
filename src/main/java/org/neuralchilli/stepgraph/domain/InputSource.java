package org.neuralchilli.stepgraph.domain;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Where a node input gets its value from.
 * Node references are invocation names within one graph, or handles once a graph is flattened.
 */
public sealed interface InputSource extends Serializable
        permits InputSource.FromOutput, InputSource.Mapped, InputSource.Collect,
        InputSource.Literal, InputSource.After {

    /**
     * Nodes this source depends on.
     */
    Set<String> upstreamNodes();

    /**
     * The output of another node.
     */
    record FromOutput(String node, String output) implements InputSource {
        public FromOutput {
            requireRef(node, output);
        }

        @Override
        public Set<String> upstreamNodes() {
            return Set.of(node);
        }
    }

    /**
     * Each instance of a dynamic output, or of an output inside a mapped scope.
     */
    record Mapped(String node, String output) implements InputSource {
        public Mapped {
            requireRef(node, output);
        }

        @Override
        public Set<String> upstreamNodes() {
            return Set.of(node);
        }
    }

    /**
     * All instances of a dynamic output gathered into one list.
     */
    record Collect(String node, String output) implements InputSource {
        public Collect {
            requireRef(node, output);
        }

        @Override
        public Set<String> upstreamNodes() {
            return Set.of(node);
        }
    }

    /**
     * A literal value supplied with the graph.
     */
    record Literal(Object value) implements InputSource {
        @Override
        public Set<String> upstreamNodes() {
            return Set.of();
        }
    }

    /**
     * No-data ordering: run after the given nodes complete.
     */
    record After(Set<String> nodes) implements InputSource {
        public After {
            nodes = nodes == null ? Set.of() : Collections.unmodifiableSet(new LinkedHashSet<>(nodes));
        }

        @Override
        public Set<String> upstreamNodes() {
            return nodes;
        }
    }

    static InputSource from(String node) {
        return new FromOutput(node, OutputDefinition.DEFAULT_NAME);
    }

    static InputSource from(String node, String output) {
        return new FromOutput(node, output);
    }

    static InputSource mapped(String node, String output) {
        return new Mapped(node, output);
    }

    static InputSource collect(String node, String output) {
        return new Collect(node, output);
    }

    static InputSource value(Object value) {
        return new Literal(value);
    }

    static InputSource after(String... nodes) {
        return new After(new LinkedHashSet<>(List.of(nodes)));
    }

    private static void requireRef(String node, String output) {
        if (node == null || node.isBlank()) {
            throw new IllegalArgumentException("Source node cannot be null or empty");
        }
        if (output == null || output.isBlank()) {
            throw new IllegalArgumentException("Source output cannot be null or empty");
        }
    }
}
