package org.neuralchilli.stepgraph.plan;

import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.DirectedAcyclicGraph;
import org.neuralchilli.stepgraph.domain.DynamicOutputRef;
import org.neuralchilli.stepgraph.domain.FlatGraph;
import org.neuralchilli.stepgraph.domain.Graph;
import org.neuralchilli.stepgraph.run.StepOutcome;

import java.io.Serial;
import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * The compiled, run-specific form of a graph: concrete steps plus templates still waiting on
 * dynamic outputs.
 * Plans are immutable; expansion and reuse return new plans.
 */
public final class ExecutionPlan implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    private final Graph graph;
    private final RunConfig runConfig;
    private final FlatGraph flatGraph;
    private final Map<String, ExecutionStep> steps;
    private final Map<String, UnresolvedStep> unresolved;
    private final KnownExecutionState knownState;
    private final UUID parentRunId;
    private final Map<String, StepOutcome> reusedOutcomes;

    private transient volatile DirectedAcyclicGraph<String, DefaultEdge> dag;

    ExecutionPlan(Graph graph, RunConfig runConfig, FlatGraph flatGraph,
                  Map<String, ExecutionStep> steps, Map<String, UnresolvedStep> unresolved,
                  KnownExecutionState knownState, UUID parentRunId,
                  Map<String, StepOutcome> reusedOutcomes) {
        this.graph = graph;
        this.runConfig = runConfig;
        this.flatGraph = flatGraph;
        this.steps = Collections.unmodifiableMap(new LinkedHashMap<>(steps));
        this.unresolved = Collections.unmodifiableMap(new LinkedHashMap<>(unresolved));
        this.knownState = knownState;
        this.parentRunId = parentRunId;
        this.reusedOutcomes = Collections.unmodifiableMap(new LinkedHashMap<>(reusedOutcomes));
    }

    public Graph graph() {
        return graph;
    }

    public String graphName() {
        return graph.name();
    }

    public RunConfig runConfig() {
        return runConfig;
    }

    public FlatGraph flatGraph() {
        return flatGraph;
    }

    /**
     * Concrete steps in plan order.
     */
    public Collection<ExecutionStep> steps() {
        return steps.values();
    }

    public Set<String> stepKeys() {
        return steps.keySet();
    }

    public boolean hasStep(String key) {
        return steps.containsKey(key);
    }

    public Optional<ExecutionStep> findStep(String key) {
        return Optional.ofNullable(steps.get(key));
    }

    public ExecutionStep step(String key) {
        ExecutionStep step = steps.get(key);
        if (step == null) {
            throw new IllegalArgumentException("Step not found in plan: " + key);
        }
        return step;
    }

    public Collection<UnresolvedStep> unresolvedSteps() {
        return unresolved.values();
    }

    public Optional<UnresolvedStep> findUnresolved(String key) {
        return Optional.ofNullable(unresolved.get(key));
    }

    /**
     * Templates waiting on the given dynamic output.
     */
    public List<UnresolvedStep> awaiting(DynamicOutputRef ref) {
        return unresolved.values().stream()
                .filter(u -> u.awaiting().equals(ref))
                .toList();
    }

    /**
     * Concrete step keys followed by placeholder keys.
     */
    public Set<String> allKeys() {
        Set<String> keys = new LinkedHashSet<>(steps.keySet());
        keys.addAll(unresolved.keySet());
        return keys;
    }

    /**
     * Node handle behind a concrete or placeholder key.
     */
    public Optional<String> handleOf(String key) {
        if (steps.containsKey(key)) {
            return Optional.of(steps.get(key).handle());
        }
        return Optional.ofNullable(unresolved.get(key)).map(UnresolvedStep::handle);
    }

    public KnownExecutionState knownState() {
        return knownState;
    }

    public Optional<UUID> parentRunId() {
        return Optional.ofNullable(parentRunId);
    }

    public Map<String, StepOutcome> reusedOutcomes() {
        return reusedOutcomes;
    }

    /**
     * Mark steps as reused from a parent run. Steps without an entry stay fresh.
     */
    public ExecutionPlan withReuse(UUID parent, Map<String, StepSource> sources,
                                   Map<String, StepOutcome> parentOutcomes) {
        Map<String, ExecutionStep> updated = new LinkedHashMap<>();
        for (ExecutionStep step : steps.values()) {
            StepSource source = sources.get(step.key());
            updated.put(step.key(), source == null ? step : step.withSource(source));
        }
        Map<String, StepOutcome> reused = new LinkedHashMap<>();
        sources.forEach((key, source) -> {
            if (source.isReused() && parentOutcomes.containsKey(source.parentStepKey())) {
                reused.put(key, parentOutcomes.get(source.parentStepKey()));
            }
        });
        return new ExecutionPlan(graph, runConfig, flatGraph, updated, unresolved, knownState, parent, reused);
    }

    // Traversal

    public Set<String> dependenciesOf(String key) {
        DirectedAcyclicGraph<String, DefaultEdge> g = dag();
        requireVertex(g, key);
        return g.incomingEdgesOf(key).stream()
                .map(g::getEdgeSource)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public Set<String> dependentsOf(String key) {
        DirectedAcyclicGraph<String, DefaultEdge> g = dag();
        requireVertex(g, key);
        return g.outgoingEdgesOf(key).stream()
                .map(g::getEdgeTarget)
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    public Set<String> ancestorsOf(String key) {
        DirectedAcyclicGraph<String, DefaultEdge> g = dag();
        requireVertex(g, key);
        return g.getAncestors(key);
    }

    public Set<String> descendantsOf(String key) {
        DirectedAcyclicGraph<String, DefaultEdge> g = dag();
        requireVertex(g, key);
        return g.getDescendants(key);
    }

    /**
     * Concrete and placeholder keys in topological order.
     */
    public List<String> topologicalOrder() {
        List<String> order = new ArrayList<>();
        dag().iterator().forEachRemaining(order::add);
        return order;
    }

    public PlanStatistics statistics() {
        DirectedAcyclicGraph<String, DefaultEdge> g = dag();
        int roots = (int) g.vertexSet().stream().filter(v -> g.inDegreeOf(v) == 0).count();
        int leaves = (int) g.vertexSet().stream().filter(v -> g.outDegreeOf(v) == 0).count();
        List<Set<String>> levels = executionLevels(g);
        int maxParallelism = levels.stream().mapToInt(Set::size).max().orElse(0);
        return new PlanStatistics(steps.size(), unresolved.size(), roots, leaves, levels.size(), maxParallelism);
    }

    private static List<Set<String>> executionLevels(DirectedAcyclicGraph<String, DefaultEdge> g) {
        List<Set<String>> levels = new ArrayList<>();
        Set<String> processed = new HashSet<>();
        Set<String> remaining = new LinkedHashSet<>(g.vertexSet());

        while (!remaining.isEmpty()) {
            Set<String> currentLevel = new LinkedHashSet<>();
            for (String key : remaining) {
                boolean ready = g.incomingEdgesOf(key).stream()
                        .map(g::getEdgeSource)
                        .allMatch(processed::contains);
                if (ready) {
                    currentLevel.add(key);
                }
            }
            if (currentLevel.isEmpty()) {
                throw new IllegalStateException("Could not determine execution levels");
            }
            levels.add(currentLevel);
            processed.addAll(currentLevel);
            remaining.removeAll(currentLevel);
        }
        return levels;
    }

    private DirectedAcyclicGraph<String, DefaultEdge> dag() {
        DirectedAcyclicGraph<String, DefaultEdge> current = dag;
        if (current == null) {
            synchronized (this) {
                current = dag;
                if (current == null) {
                    current = buildDag();
                    dag = current;
                }
            }
        }
        return current;
    }

    private DirectedAcyclicGraph<String, DefaultEdge> buildDag() {
        DirectedAcyclicGraph<String, DefaultEdge> g = new DirectedAcyclicGraph<>(DefaultEdge.class);

        // First pass: every concrete and placeholder key is a vertex
        steps.keySet().forEach(g::addVertex);
        unresolved.keySet().forEach(g::addVertex);

        // Second pass: edges from producers
        for (ExecutionStep step : steps.values()) {
            addEdges(g, step.key(), step.upstreamStepKeys());
        }
        for (UnresolvedStep template : unresolved.values()) {
            addEdges(g, template.key(), template.upstreamKeys());
        }
        return g;
    }

    private static void addEdges(DirectedAcyclicGraph<String, DefaultEdge> g, String key, Set<String> upstream) {
        for (String producer : upstream) {
            if (!g.containsVertex(producer)) {
                throw new IllegalStateException("Step '" + key + "' depends on unknown step '" + producer + "'");
            }
            g.addEdge(producer, key);
        }
    }

    private static void requireVertex(DirectedAcyclicGraph<String, DefaultEdge> g, String key) {
        if (!g.containsVertex(key)) {
            throw new IllegalArgumentException("Step not found in plan: " + key);
        }
    }

    @Override
    public String toString() {
        return "ExecutionPlan[" +
                "graph=" + graph.name() + ", " +
                "steps=" + steps.keySet() + ", " +
                "unresolved=" + unresolved.keySet() + ']';
    }
}
