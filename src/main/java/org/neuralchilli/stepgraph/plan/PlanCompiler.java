package org.neuralchilli.stepgraph.plan;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.stepgraph.domain.DynamicOutputRef;
import org.neuralchilli.stepgraph.domain.FlatGraph;
import org.neuralchilli.stepgraph.domain.FlatGraph.FlatNode;
import org.neuralchilli.stepgraph.domain.Graph;
import org.neuralchilli.stepgraph.domain.InputDefinition;
import org.neuralchilli.stepgraph.domain.InputSource;
import org.neuralchilli.stepgraph.plan.StepInputSource.ValueOrigin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Lowers a graph and its run config into an execution plan.
 * Nodes inside a dynamic scope stay templates until the dynamic output reports its mapping
 * keys, either through {@link KnownExecutionState} at compile time or through
 * {@link #expand} while the run is in flight.
 */
@ApplicationScoped
public class PlanCompiler {

    private static final Logger log = LoggerFactory.getLogger(PlanCompiler.class);

    public ExecutionPlan compile(Graph graph, RunConfig config) {
        return compile(graph, config, KnownExecutionState.empty());
    }

    public ExecutionPlan compile(Graph graph, RunConfig config, KnownExecutionState known) {
        if (graph == null) {
            throw new IllegalArgumentException("Graph cannot be null");
        }
        RunConfig runConfig = config != null ? config : RunConfig.empty();
        KnownExecutionState knownState = known != null ? known : KnownExecutionState.empty();

        graph.validate().orThrow();
        FlatGraph flat = graph.flatten();
        checkInputs(flat, runConfig);

        Map<String, ExecutionStep> steps = new LinkedHashMap<>();
        Map<String, UnresolvedStep> unresolved = new LinkedHashMap<>();

        for (FlatNode node : flat.nodes()) {
            String handle = node.handle();
            Optional<DynamicOutputRef> mappedScope = flat.mappedScopeOf(handle);
            Optional<DynamicOutputRef> collectScope = flat.collectScopeOf(handle);

            if (mappedScope.isPresent()) {
                DynamicOutputRef ref = mappedScope.get();
                Optional<List<String>> keys = knownState.keysFor(ref.node(), ref.output());
                if (keys.isPresent()) {
                    for (String key : keys.get()) {
                        ExecutionStep step = buildStep(flat, node, runConfig, key, null);
                        steps.put(step.key(), step);
                    }
                } else {
                    UnresolvedStep template = template(flat, node, UnresolvedStep.Kind.MAPPED, ref);
                    unresolved.put(template.key(), template);
                }
            } else if (collectScope.isPresent()) {
                DynamicOutputRef ref = collectScope.get();
                Optional<List<String>> keys = knownState.keysFor(ref.node(), ref.output());
                if (keys.isPresent()) {
                    ExecutionStep step = buildStep(flat, node, runConfig, null, keys.get());
                    steps.put(step.key(), step);
                } else {
                    UnresolvedStep template = template(flat, node, UnresolvedStep.Kind.COLLECT, ref);
                    unresolved.put(template.key(), template);
                }
            } else {
                steps.put(handle, buildStep(flat, node, runConfig, null, null));
            }
        }

        ExecutionPlan plan = new ExecutionPlan(graph, runConfig, flat, steps, unresolved, knownState, null, Map.of());
        log.info("Compiled graph '{}': {} steps, {} unresolved", graph.name(), steps.size(), unresolved.size());
        return plan;
    }

    /**
     * Resolve the templates waiting on a dynamic output now that its mapping keys are known.
     * Mapped templates become one clone per key; collect templates become a single step over
     * every instance. An empty key list resolves collect templates to an empty fan-in.
     *
     * @throws InvalidMappingKeyException if a key is empty or keys collide after sanitization
     */
    public ExecutionPlan expand(ExecutionPlan plan, String producerStepKey, String outputName, List<String> mappingKeys) {
        FlatGraph flat = plan.flatGraph();
        if (!flat.isDynamic(producerStepKey, outputName)) {
            throw new IllegalArgumentException(
                    "'" + producerStepKey + "." + outputName + "' is not a dynamic output of graph '"
                            + plan.graphName() + "'");
        }
        if (plan.knownState().keysFor(producerStepKey, outputName).isPresent()) {
            throw new IllegalStateException(
                    "Dynamic output '" + producerStepKey + "." + outputName + "' is already expanded");
        }

        List<String> keys = MappingKeys.sanitizeAll(producerStepKey, outputName, mappingKeys);
        DynamicOutputRef ref = new DynamicOutputRef(producerStepKey, outputName);
        List<UnresolvedStep> templates = plan.awaiting(ref);

        Map<String, ExecutionStep> steps = new LinkedHashMap<>();
        plan.steps().forEach(step -> steps.put(step.key(), step));
        Map<String, UnresolvedStep> unresolved = new LinkedHashMap<>();
        plan.unresolvedSteps().forEach(template -> unresolved.put(template.key(), template));

        int added = 0;
        for (UnresolvedStep template : templates) {
            FlatNode node = flat.node(template.handle());
            if (template.kind() == UnresolvedStep.Kind.MAPPED) {
                for (String key : keys) {
                    ExecutionStep step = buildStep(flat, node, plan.runConfig(), key, null);
                    steps.put(step.key(), step);
                    added++;
                }
            } else {
                ExecutionStep step = buildStep(flat, node, plan.runConfig(), null, keys);
                steps.put(step.key(), step);
                added++;
            }
            unresolved.remove(template.key());
        }

        log.debug("Expanded {} with {} keys: {} templates resolved into {} steps",
                ref, keys.size(), templates.size(), added);

        return new ExecutionPlan(plan.graph(), plan.runConfig(), flat, steps, unresolved,
                plan.knownState().with(producerStepKey, outputName, keys),
                plan.parentRunId().orElse(null), plan.reusedOutcomes());
    }

    /**
     * Every required input must have a source before any step is built, mapped or not.
     */
    private void checkInputs(FlatGraph flat, RunConfig config) {
        for (FlatNode node : flat.nodes()) {
            String handle = node.handle();
            for (InputDefinition input : node.op().inputs()) {
                boolean wired = node.sources().containsKey(input.name());
                boolean configured = config.hasInput(handle, input.name());

                if (wired && configured) {
                    log.warn("Run config value for wired input {}.{} is ignored", handle, input.name());
                    continue;
                }
                if (configured && !input.type().accepts(config.input(handle, input.name()))) {
                    throw new PlanCompilationException(
                            "Run config value for " + handle + "." + input.name() + " is not a valid "
                                    + input.type() + ": " + config.input(handle, input.name()));
                }
                if (!wired && !configured && input.isRequired()) {
                    throw new UnresolvedInputException(handle, input.name());
                }
            }
        }
    }

    private ExecutionStep buildStep(FlatGraph flat, FlatNode node, RunConfig config,
                                    String mappingKey, List<String> collectKeys) {
        String handle = node.handle();
        Map<String, StepInput> inputs = new LinkedHashMap<>();

        for (InputDefinition input : node.op().inputs()) {
            InputSource source = node.sources().get(input.name());
            StepInputSource resolved;
            if (source != null) {
                resolved = resolveSource(flat, source, mappingKey, collectKeys);
            } else if (config.hasInput(handle, input.name())) {
                resolved = new StepInputSource.FromValue(config.input(handle, input.name()), ValueOrigin.CONFIG);
            } else if (input.hasDefault()) {
                resolved = new StepInputSource.FromValue(input.defaultValue(), ValueOrigin.DEFAULT);
            } else if (input.noData()) {
                resolved = new StepInputSource.AfterSteps(Set.of());
            } else {
                throw new UnresolvedInputException(handle, input.name());
            }
            inputs.put(input.name(), new StepInput(input.name(), input.type(), resolved));
        }

        return new ExecutionStep(
                ExecutionStep.keyOf(handle, mappingKey),
                handle,
                node.op().name(),
                mappingKey,
                inputs,
                node.op().outputs(),
                StepSource.fresh(),
                node.op().tags()
        );
    }

    private StepInputSource resolveSource(FlatGraph flat, InputSource source,
                                          String mappingKey, List<String> collectKeys) {
        if (source instanceof InputSource.FromOutput from) {
            return new StepInputSource.FromStepOutput(
                    StepOutputHandle.of(stepKeyOf(flat, from.node(), mappingKey), from.output()));
        }
        if (source instanceof InputSource.Mapped mapped) {
            if (flat.isDynamic(mapped.node(), mapped.output())) {
                return new StepInputSource.FromStepOutput(
                        new StepOutputHandle(mapped.node(), mapped.output(), mappingKey));
            }
            return new StepInputSource.FromStepOutput(
                    StepOutputHandle.of(ExecutionStep.keyOf(mapped.node(), mappingKey), mapped.output()));
        }
        if (source instanceof InputSource.Collect collect) {
            if (flat.isDynamic(collect.node(), collect.output())) {
                List<StepOutputHandle> handles = collectKeys.stream()
                        .map(key -> new StepOutputHandle(collect.node(), collect.output(), key))
                        .toList();
                return new StepInputSource.FromCollect(collect.node(), handles);
            }
            DynamicOutputRef scope = flat.mappedScopeOf(collect.node()).orElseThrow();
            List<StepOutputHandle> handles = collectKeys.stream()
                    .map(key -> StepOutputHandle.of(ExecutionStep.keyOf(collect.node(), key), collect.output()))
                    .toList();
            return new StepInputSource.FromCollect(scope.node(), handles);
        }
        if (source instanceof InputSource.After after) {
            Set<String> keys = new LinkedHashSet<>();
            after.nodes().forEach(node -> keys.add(stepKeyOf(flat, node, mappingKey)));
            return new StepInputSource.AfterSteps(keys);
        }
        return new StepInputSource.FromValue(((InputSource.Literal) source).value(), ValueOrigin.LITERAL);
    }

    /**
     * Step key of an upstream node as seen from a step with the given mapping key.
     */
    private static String stepKeyOf(FlatGraph flat, String handle, String mappingKey) {
        return flat.mappedScopeOf(handle).isPresent() ? ExecutionStep.keyOf(handle, mappingKey) : handle;
    }

    private static UnresolvedStep template(FlatGraph flat, FlatNode node, UnresolvedStep.Kind kind,
                                           DynamicOutputRef awaiting) {
        Set<String> upstream = new LinkedHashSet<>();
        for (InputSource source : node.sources().values()) {
            if (source instanceof InputSource.Mapped mapped && flat.isDynamic(mapped.node(), mapped.output())) {
                upstream.add(mapped.node());
            } else if (source instanceof InputSource.Collect collect && flat.isDynamic(collect.node(), collect.output())) {
                upstream.add(collect.node());
            } else {
                source.upstreamNodes().forEach(handle -> upstream.add(
                        flat.mappedScopeOf(handle).isPresent() ? UnresolvedStep.placeholderKey(handle) : handle));
            }
        }
        String key = kind == UnresolvedStep.Kind.MAPPED
                ? UnresolvedStep.placeholderKey(node.handle())
                : node.handle();
        return new UnresolvedStep(key, node.handle(), kind, awaiting, upstream);
    }
}
