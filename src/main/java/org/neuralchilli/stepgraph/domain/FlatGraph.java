package org.neuralchilli.stepgraph.domain;

import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.DirectedAcyclicGraph;

import java.io.Serial;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A graph with nested graphs inlined: every op is addressed by its dotted handle and every
 * source refers to op handles.
 * Also records the dynamic scope of each op: the dynamic output it is mapped over, if any,
 * and the dynamic output it collects, if any.
 */
public final class FlatGraph implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    /**
     * One op of a flattened graph.
     */
    public record FlatNode(
            String handle,
            OpDefinition op,
            Map<String, InputSource> sources
    ) implements Serializable {
        public FlatNode {
            sources = Collections.unmodifiableMap(new LinkedHashMap<>(sources));
        }

        public Optional<InputSource> source(String input) {
            return Optional.ofNullable(sources.get(input));
        }
    }

    private final String name;
    private final List<FlatNode> nodes;
    private final Map<String, FlatNode> byHandle;
    private final Map<String, DynamicOutputRef> mappedScopes;
    private final Map<String, DynamicOutputRef> collectScopes;

    private FlatGraph(String name, List<FlatNode> nodes,
                      Map<String, DynamicOutputRef> mappedScopes,
                      Map<String, DynamicOutputRef> collectScopes) {
        this.name = name;
        this.nodes = List.copyOf(nodes);
        Map<String, FlatNode> index = new LinkedHashMap<>();
        nodes.forEach(n -> index.put(n.handle(), n));
        this.byHandle = Collections.unmodifiableMap(index);
        this.mappedScopes = Collections.unmodifiableMap(new LinkedHashMap<>(mappedScopes));
        this.collectScopes = Collections.unmodifiableMap(new LinkedHashMap<>(collectScopes));
    }

    public static FlatGraph of(Graph graph) {
        List<FlatNode> declared = new ArrayList<>();
        flatten(graph, "", Map.of(), declared);

        List<FlatNode> ordered = topologicalOrder(graph.name(), declared);

        Map<String, FlatNode> index = new LinkedHashMap<>();
        ordered.forEach(n -> index.put(n.handle(), n));

        Map<String, DynamicOutputRef> mapped = new LinkedHashMap<>();
        Map<String, DynamicOutputRef> collected = new LinkedHashMap<>();
        for (FlatNode node : ordered) {
            analyzeScope(node, index, mapped, collected);
        }
        return new FlatGraph(graph.name(), ordered, mapped, collected);
    }

    public String name() {
        return name;
    }

    /**
     * Ops in topological order.
     */
    public List<FlatNode> nodes() {
        return nodes;
    }

    public FlatNode node(String handle) {
        FlatNode node = byHandle.get(handle);
        if (node == null) {
            throw new UnknownNodeException(handle, name);
        }
        return node;
    }

    public boolean contains(String handle) {
        return byHandle.containsKey(handle);
    }

    /**
     * The dynamic output an op is mapped over, if it sits inside a mapped scope.
     */
    public Optional<DynamicOutputRef> mappedScopeOf(String handle) {
        return Optional.ofNullable(mappedScopes.get(handle));
    }

    /**
     * The dynamic output an op collects, if it has a collect input.
     */
    public Optional<DynamicOutputRef> collectScopeOf(String handle) {
        return Optional.ofNullable(collectScopes.get(handle));
    }

    public boolean isDynamic(String handle, String output) {
        FlatNode node = byHandle.get(handle);
        return node != null && node.op().output(output).map(OutputDefinition::dynamic).orElse(false);
    }

    // Flattening

    private static void flatten(Graph graph, String prefix, Map<String, InputSource> inherited,
                                List<FlatNode> out) {
        for (NodeInvocation invocation : graph.invocations()) {
            String handle = Names.join(prefix, invocation.name());

            Map<String, InputSource> sources = new LinkedHashMap<>();
            for (InputDefinition input : invocation.definition().inputs()) {
                Optional<InputSource> wired = graph.dependency(invocation.name(), input.name());
                if (wired.isPresent()) {
                    sources.put(input.name(), resolve(graph, prefix, wired.get()));
                    continue;
                }
                graph.inputMappingFor(invocation.name(), input.name())
                        .map(mapping -> inherited.get(mapping.graphInput()))
                        .ifPresent(source -> sources.put(input.name(), source));
            }

            if (invocation.definition() instanceof OpDefinition op) {
                out.add(new FlatNode(handle, op, sources));
            } else {
                flatten((Graph) invocation.definition(), handle, sources, out);
            }
        }
    }

    private static InputSource resolve(Graph graph, String prefix, InputSource source) {
        if (source instanceof InputSource.FromOutput from) {
            DynamicOutputRef ref = resolveOutput(graph, prefix, from.node(), from.output());
            return new InputSource.FromOutput(ref.node(), ref.output());
        }
        if (source instanceof InputSource.Mapped mapped) {
            DynamicOutputRef ref = resolveOutput(graph, prefix, mapped.node(), mapped.output());
            return new InputSource.Mapped(ref.node(), ref.output());
        }
        if (source instanceof InputSource.Collect collect) {
            DynamicOutputRef ref = resolveOutput(graph, prefix, collect.node(), collect.output());
            return new InputSource.Collect(ref.node(), ref.output());
        }
        if (source instanceof InputSource.After after) {
            Set<String> handles = new LinkedHashSet<>();
            for (String node : after.nodes()) {
                collectOpHandles(graph, prefix, node, handles);
            }
            return new InputSource.After(handles);
        }
        return source;
    }

    /**
     * Follow output mappings down to the op that actually produces an output.
     */
    private static DynamicOutputRef resolveOutput(Graph graph, String prefix, String node, String output) {
        NodeInvocation invocation = graph.invocation(node)
                .orElseThrow(() -> new UnknownNodeException(node, graph.name()));
        String handle = Names.join(prefix, node);
        if (invocation.definition() instanceof Graph nested) {
            OutputMapping mapping = nested.outputMapping(output)
                    .orElseThrow(() -> new GraphStructureException(
                            "Graph '" + handle + "' does not map an output named '" + output + "'"));
            return resolveOutput(nested, handle, mapping.node(), mapping.output());
        }
        return new DynamicOutputRef(handle, output);
    }

    private static void collectOpHandles(Graph graph, String prefix, String node, Set<String> out) {
        NodeInvocation invocation = graph.invocation(node)
                .orElseThrow(() -> new UnknownNodeException(node, graph.name()));
        String handle = Names.join(prefix, node);
        if (invocation.definition() instanceof Graph nested) {
            for (NodeInvocation inner : nested.invocations()) {
                collectOpHandles(nested, handle, inner.name(), out);
            }
        } else {
            out.add(handle);
        }
    }

    private static List<FlatNode> topologicalOrder(String graphName, List<FlatNode> declared) {
        DirectedAcyclicGraph<String, DefaultEdge> dag = new DirectedAcyclicGraph<>(DefaultEdge.class);
        Map<String, FlatNode> index = new LinkedHashMap<>();

        for (FlatNode node : declared) {
            dag.addVertex(node.handle());
            index.put(node.handle(), node);
        }
        for (FlatNode node : declared) {
            for (InputSource source : node.sources().values()) {
                for (String upstream : source.upstreamNodes()) {
                    if (!index.containsKey(upstream)) {
                        throw new UnknownNodeException(upstream, graphName);
                    }
                    try {
                        dag.addEdge(upstream, node.handle());
                    } catch (IllegalArgumentException e) {
                        throw new CycleDetectedException(
                                "Cycle detected in graph '" + graphName + "': "
                                        + upstream + " -> " + node.handle(), e);
                    }
                }
            }
        }

        List<FlatNode> ordered = new ArrayList<>();
        dag.iterator().forEachRemaining(handle -> ordered.add(index.get(handle)));
        return ordered;
    }

    // Dynamic scope analysis

    private static void analyzeScope(FlatNode node, Map<String, FlatNode> index,
                                     Map<String, DynamicOutputRef> mapped,
                                     Map<String, DynamicOutputRef> collected) {
        String handle = node.handle();
        DynamicOutputRef scope = null;
        DynamicOutputRef collects = null;

        for (Map.Entry<String, InputSource> entry : node.sources().entrySet()) {
            String target = handle + "." + entry.getKey();
            InputSource source = entry.getValue();
            DynamicOutputRef candidate = null;

            if (source instanceof InputSource.FromOutput from) {
                if (isDynamic(index, from.node(), from.output())) {
                    throw new GraphStructureException(
                            "Dynamic output '" + from.node() + "." + from.output() + "' is consumed by '"
                                    + target + "' without map or collect");
                }
                candidate = mapped.get(from.node());
            } else if (source instanceof InputSource.Mapped m) {
                if (isDynamic(index, m.node(), m.output())) {
                    candidate = new DynamicOutputRef(m.node(), m.output());
                } else if (mapped.containsKey(m.node())) {
                    candidate = mapped.get(m.node());
                } else {
                    throw new GraphStructureException(
                            "Mapped input '" + target + "' requires a dynamic output, but '"
                                    + m.node() + "." + m.output() + "' is static");
                }
            } else if (source instanceof InputSource.Collect c) {
                DynamicOutputRef ref = isDynamic(index, c.node(), c.output())
                        ? new DynamicOutputRef(c.node(), c.output())
                        : mapped.get(c.node());
                if (ref == null) {
                    throw new GraphStructureException(
                            "Collect input '" + target + "' requires a dynamic output, but '"
                                    + c.node() + "." + c.output() + "' is static");
                }
                if (collects != null && !collects.equals(ref)) {
                    throw new GraphStructureException(
                            "Node '" + handle + "' collects from more than one dynamic output");
                }
                collects = ref;
            } else if (source instanceof InputSource.After after) {
                for (String upstream : after.nodes()) {
                    DynamicOutputRef upstreamScope = mapped.get(upstream);
                    if (upstreamScope != null) {
                        scope = mergeScope(handle, scope, upstreamScope);
                    }
                }
            }

            if (candidate != null) {
                scope = mergeScope(handle, scope, candidate);
            }
        }

        if (scope != null && collects != null) {
            throw new GraphStructureException(
                    "Node '" + handle + "' cannot collect inside the mapped scope of '" + scope + "'");
        }
        if (scope != null && node.op().hasDynamicOutput()) {
            throw new GraphStructureException(
                    "Node '" + handle + "' declares a dynamic output inside the mapped scope of '"
                            + scope + "'; nested mapping is not supported");
        }
        if (scope != null) {
            mapped.put(handle, scope);
        }
        if (collects != null) {
            collected.put(handle, collects);
        }
    }

    private static DynamicOutputRef mergeScope(String handle, DynamicOutputRef current, DynamicOutputRef candidate) {
        if (current == null || current.equals(candidate)) {
            return candidate;
        }
        throw new GraphStructureException(
                "Node '" + handle + "' is downstream of more than one dynamic output: "
                        + current + " and " + candidate);
    }

    private static boolean isDynamic(Map<String, FlatNode> index, String handle, String output) {
        FlatNode node = index.get(handle);
        if (node == null) {
            return false;
        }
        return node.op().output(output)
                .map(OutputDefinition::dynamic)
                .orElseThrow(() -> new GraphStructureException(
                        "Node '" + handle + "' has no output '" + output + "'"));
    }
}
