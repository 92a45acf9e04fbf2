package org.neuralchilli.stepgraph.domain;

import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.DirectedAcyclicGraph;

import java.io.Serial;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A graph of node invocations wired by a dependency map.
 * A graph can itself be invoked as a node of another graph; its inputs and outputs are then
 * defined by its input and output mappings.
 */
public final class Graph implements NodeDefinition {

    @Serial
    private static final long serialVersionUID = 1L;

    private final String name;
    private final String description;
    private final List<NodeInvocation> invocations;
    private final Map<String, Map<String, InputSource>> dependencies;
    private final List<InputMapping> inputMappings;
    private final List<OutputMapping> outputMappings;
    private final Map<String, String> tags;

    private Graph(
            String name,
            String description,
            List<NodeInvocation> invocations,
            Map<String, Map<String, InputSource>> dependencies,
            List<InputMapping> inputMappings,
            List<OutputMapping> outputMappings,
            Map<String, String> tags
    ) {
        Names.requireValid(name, "Graph");

        if (invocations == null || invocations.isEmpty()) {
            throw new IllegalArgumentException("Graph must have at least one node");
        }

        this.name = name;
        this.description = description;
        this.invocations = List.copyOf(invocations);

        Map<String, Map<String, InputSource>> deps = new LinkedHashMap<>();
        dependencies.forEach((node, inputs) ->
                deps.put(node, Collections.unmodifiableMap(new LinkedHashMap<>(inputs))));
        this.dependencies = Collections.unmodifiableMap(deps);

        this.inputMappings = List.copyOf(inputMappings);
        this.outputMappings = List.copyOf(outputMappings);
        this.tags = tags != null ? Map.copyOf(tags) : Map.of();
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String description() {
        return description;
    }

    public List<NodeInvocation> invocations() {
        return invocations;
    }

    public Optional<NodeInvocation> invocation(String node) {
        return invocations.stream().filter(i -> i.name().equals(node)).findFirst();
    }

    /**
     * Dependency map: node name to input name to source.
     */
    public Map<String, Map<String, InputSource>> dependencies() {
        return dependencies;
    }

    public Optional<InputSource> dependency(String node, String input) {
        return Optional.ofNullable(dependencies.getOrDefault(node, Map.of()).get(input));
    }

    public List<InputMapping> inputMappings() {
        return inputMappings;
    }

    public List<OutputMapping> outputMappings() {
        return outputMappings;
    }

    public Optional<InputMapping> inputMappingFor(String node, String input) {
        return inputMappings.stream()
                .filter(m -> m.node().equals(node) && m.input().equals(input))
                .findFirst();
    }

    public Optional<OutputMapping> outputMapping(String graphOutput) {
        return outputMappings.stream()
                .filter(m -> m.graphOutput().equals(graphOutput))
                .findFirst();
    }

    public Map<String, String> tags() {
        return tags;
    }

    /**
     * Get all node names in this graph
     */
    public List<String> getNodeNames() {
        return invocations.stream().map(NodeInvocation::name).toList();
    }

    /**
     * Inputs exposed when this graph is invoked as a node, one per mapped graph input.
     */
    @Override
    public List<InputDefinition> inputs() {
        Map<String, InputDefinition> inputs = new LinkedHashMap<>();
        for (InputMapping mapping : inputMappings) {
            if (inputs.containsKey(mapping.graphInput())) {
                continue;
            }
            InputDefinition inner = requireInvocation(mapping.node()).definition()
                    .input(mapping.input())
                    .orElseThrow();
            inputs.put(mapping.graphInput(), inner.noData()
                    ? InputDefinition.noData(mapping.graphInput())
                    : InputDefinition.of(mapping.graphInput(), inner.type()));
        }
        return List.copyOf(inputs.values());
    }

    /**
     * Outputs exposed when this graph is invoked as a node.
     */
    @Override
    public List<OutputDefinition> outputs() {
        List<OutputDefinition> outputs = new ArrayList<>();
        for (OutputMapping mapping : outputMappings) {
            OutputDefinition inner = requireInvocation(mapping.node()).definition()
                    .output(mapping.output())
                    .orElseThrow();
            outputs.add(new OutputDefinition(
                    mapping.graphOutput(), inner.type(), inner.required(), inner.dynamic()));
        }
        return List.copyOf(outputs);
    }

    /**
     * Check the graph for defects that the builder cannot catch edge by edge.
     */
    public ValidationResult validate() {
        return GraphValidator.validate(this);
    }

    /**
     * Inline nested graphs into a flat list of ops keyed by handle.
     */
    public FlatGraph flatten() {
        return FlatGraph.of(this);
    }

    private NodeInvocation requireInvocation(String node) {
        return invocation(node).orElseThrow(() -> new UnknownNodeException(node, name));
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) return true;
        if (obj == null || obj.getClass() != this.getClass()) return false;
        Graph that = (Graph) obj;
        return Objects.equals(this.name, that.name) &&
                Objects.equals(this.description, that.description) &&
                Objects.equals(this.invocations, that.invocations) &&
                Objects.equals(this.dependencies, that.dependencies) &&
                Objects.equals(this.inputMappings, that.inputMappings) &&
                Objects.equals(this.outputMappings, that.outputMappings) &&
                Objects.equals(this.tags, that.tags);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, description, invocations, dependencies, inputMappings, outputMappings, tags);
    }

    @Override
    public String toString() {
        return "Graph[" +
                "name=" + name + ", " +
                "nodes=" + getNodeNames() + ", " +
                "dependencies=" + dependencies + ']';
    }

    /**
     * Builder for creating graphs fluently
     */
    public static Builder builder(String name) {
        return new Builder(name);
    }

    /**
     * Incremental graph builder.
     * Every dependency is checked as it is added: unknown nodes, type mismatches and cycles
     * are rejected immediately, whatever order the nodes were declared in.
     */
    public static class Builder {
        private final String name;
        private String description;
        private final Map<String, NodeInvocation> invocations = new LinkedHashMap<>();
        private final Map<String, Map<String, InputSource>> dependencies = new LinkedHashMap<>();
        private final List<InputMapping> inputMappings = new ArrayList<>();
        private final List<OutputMapping> outputMappings = new ArrayList<>();
        private final Map<String, String> tags = new LinkedHashMap<>();
        private final DirectedAcyclicGraph<String, DefaultEdge> dag =
                new DirectedAcyclicGraph<>(DefaultEdge.class);

        public Builder(String name) {
            this.name = name;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder tag(String key, String value) {
            this.tags.put(key, value);
            return this;
        }

        /**
         * Add a node named after its definition. Reusing a definition yields
         * {@code name_2}, {@code name_3}, ...
         */
        public Builder addNode(NodeDefinition definition) {
            if (definition == null) {
                throw new IllegalArgumentException("Node definition cannot be null");
            }
            String alias = definition.name();
            int suffix = 2;
            while (invocations.containsKey(alias)) {
                alias = definition.name() + "_" + suffix++;
            }
            return addInvocation(new NodeInvocation(alias, definition));
        }

        /**
         * Add a node under an explicit alias.
         */
        public Builder addNode(String alias, NodeDefinition definition) {
            if (invocations.containsKey(alias)) {
                throw new GraphStructureException(
                        "Duplicate node name '" + alias + "' in graph '" + name + "'"
                );
            }
            return addInvocation(new NodeInvocation(alias, definition));
        }

        private Builder addInvocation(NodeInvocation invocation) {
            invocations.put(invocation.name(), invocation);
            dag.addVertex(invocation.name());
            return this;
        }

        public Builder addDependency(String node, String input, InputSource source) {
            NodeInvocation target = requireNode(node);
            if (source == null) {
                throw new IllegalArgumentException("Source cannot be null");
            }
            InputDefinition inputDef = target.definition().input(input)
                    .orElseThrow(() -> new GraphStructureException(
                            "Node '" + node + "' has no input '" + input + "'"));

            if (dependencies.getOrDefault(node, Map.of()).containsKey(input)) {
                throw new GraphStructureException(
                        "Input '" + node + "." + input + "' is already wired");
            }
            if (inputMappings.stream().anyMatch(m -> m.node().equals(node) && m.input().equals(input))) {
                throw new GraphStructureException(
                        "Input '" + node + "." + input + "' is already mapped from a graph input");
            }

            checkSourceType(node, inputDef, source);
            addEdges(node, source);

            dependencies.computeIfAbsent(node, k -> new LinkedHashMap<>()).put(input, source);
            return this;
        }

        /**
         * Route a graph input to an input of one of this graph's nodes.
         */
        public Builder mapInput(String graphInput, String node, String input) {
            NodeInvocation target = requireNode(node);
            if (target.definition().input(input).isEmpty()) {
                throw new GraphStructureException("Node '" + node + "' has no input '" + input + "'");
            }
            if (dependencies.getOrDefault(node, Map.of()).containsKey(input)) {
                throw new GraphStructureException(
                        "Input '" + node + "." + input + "' is already wired");
            }
            inputMappings.add(new InputMapping(graphInput, node, input));
            return this;
        }

        /**
         * Expose an output of one of this graph's nodes as a graph output.
         */
        public Builder mapOutput(String graphOutput, String node, String output) {
            NodeInvocation source = requireNode(node);
            if (source.definition().output(output).isEmpty()) {
                throw new GraphStructureException("Node '" + node + "' has no output '" + output + "'");
            }
            if (outputMappings.stream().anyMatch(m -> m.graphOutput().equals(graphOutput))) {
                throw new GraphStructureException(
                        "Graph output '" + graphOutput + "' is already mapped");
            }
            outputMappings.add(new OutputMapping(graphOutput, node, output));
            return this;
        }

        public ValidationResult validate() {
            if (invocations.isEmpty()) {
                return ValidationResult.defect("Graph '" + name + "' has no nodes");
            }
            return build().validate();
        }

        public Graph build() {
            return new Graph(name, description, List.copyOf(invocations.values()), dependencies,
                    inputMappings, outputMappings, tags);
        }

        /**
         * Build and validate, throwing the first defect as a structural error.
         */
        public Graph buildValidated() {
            Graph graph = build();
            graph.validate().orThrow();
            return graph;
        }

        private NodeInvocation requireNode(String node) {
            NodeInvocation invocation = invocations.get(node);
            if (invocation == null) {
                throw new UnknownNodeException(node, name);
            }
            return invocation;
        }

        private void checkSourceType(String node, InputDefinition input, InputSource source) {
            String target = node + "." + input.name();

            if (source instanceof InputSource.After) {
                if (!input.noData()) {
                    throw new GraphStructureException(
                            "Ordering dependency on '" + target + "' requires a no-data input");
                }
                for (String upstream : source.upstreamNodes()) {
                    requireNode(upstream);
                }
                return;
            }

            if (source instanceof InputSource.Literal literal) {
                if (!input.type().accepts(literal.value())) {
                    throw new TypeMismatchException(
                            "Literal " + literal.value() + " is not a valid " + input.type() + " for '" + target + "'");
                }
                return;
            }

            String upstream;
            String outputName;
            if (source instanceof InputSource.FromOutput from) {
                upstream = from.node();
                outputName = from.output();
            } else if (source instanceof InputSource.Mapped mapped) {
                upstream = mapped.node();
                outputName = mapped.output();
            } else {
                InputSource.Collect collect = (InputSource.Collect) source;
                upstream = collect.node();
                outputName = collect.output();
            }

            OutputDefinition output = requireNode(upstream).definition().output(outputName)
                    .orElseThrow(() -> new GraphStructureException(
                            "Node '" + upstream + "' has no output '" + outputName + "'"));

            if (source instanceof InputSource.Collect) {
                if (input.type() != SemanticType.LIST && input.type() != SemanticType.ANY) {
                    throw new TypeMismatchException(
                            "Collect into '" + target + "' requires a list input, got " + input.type());
                }
                return;
            }

            if (!output.type().isAssignableTo(input.type())) {
                throw new TypeMismatchException(
                        "Output '" + upstream + "." + outputName + "' of type " + output.type()
                                + " cannot flow into '" + target + "' of type " + input.type());
            }
        }

        private void addEdges(String node, InputSource source) {
            List<DefaultEdge> added = new ArrayList<>();
            for (String upstream : source.upstreamNodes()) {
                if (upstream.equals(node)) {
                    rollback(added);
                    throw new CycleDetectedException(
                            "Node '" + node + "' cannot depend on itself in graph '" + name + "'");
                }
                try {
                    DefaultEdge edge = dag.addEdge(upstream, node);
                    if (edge != null) {
                        added.add(edge);
                    }
                } catch (IllegalArgumentException e) {
                    rollback(added);
                    throw new CycleDetectedException(
                            "Cycle detected in graph '" + name + "': " + upstream + " -> " + node, e);
                }
            }
        }

        private void rollback(List<DefaultEdge> added) {
            added.forEach(dag::removeEdge);
        }
    }
}
