package org.neuralchilli.stepgraph.plan;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.neuralchilli.stepgraph.domain.Graph;
import org.neuralchilli.stepgraph.domain.GraphStructureException;
import org.neuralchilli.stepgraph.domain.InputDefinition;
import org.neuralchilli.stepgraph.domain.InputSource;
import org.neuralchilli.stepgraph.domain.OpDefinition;
import org.neuralchilli.stepgraph.domain.SemanticType;
import org.neuralchilli.stepgraph.testing.TestGraphs;

import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.neuralchilli.stepgraph.testing.TestGraphs.op;

/**
 * Tests for lowering graphs into execution plans.
 */
class PlanCompilerTest {

    private PlanCompiler compiler;

    @BeforeEach
    void setup() {
        compiler = new PlanCompiler();
    }

    @Test
    void shouldCompileLinearGraph() {
        // When
        ExecutionPlan plan = compiler.compile(TestGraphs.linear(), RunConfig.empty());

        // Then: One step per op, wired to its producer
        assertThat(plan.stepKeys()).containsExactly("A", "B", "C");
        assertThat(plan.unresolvedSteps()).isEmpty();
        assertThat(plan.step("B").inputs().get("in").source())
                .isEqualTo(new StepInputSource.FromStepOutput(StepOutputHandle.of("A", "result")));
        assertThat(plan.step("C").upstreamStepKeys()).containsExactly("B");
        assertThat(plan.steps()).allMatch(step -> !step.isReused());
    }

    @Test
    void shouldRejectUnresolvedInput() {
        // Given: B has an input nothing supplies
        Graph graph = Graph.builder("dangling")
                .addNode(op("A"))
                .addNode(op("B", "in"))
                .build();

        // When
        UnresolvedInputException e = catchThrowableOfType(
                () -> compiler.compile(graph, RunConfig.empty()), UnresolvedInputException.class);

        // Then
        assertThat(e).isNotNull();
        assertThat(e.getHandle()).isEqualTo("B");
        assertThat(e.getInput()).isEqualTo("in");
    }

    @Test
    void shouldSupplyUnwiredInputsFromConfigAndDefaults() {
        // Given: One input from config, one from its default
        OpDefinition load = OpDefinition.builder("load")
                .input("path", SemanticType.STRING)
                .input(InputDefinition.withDefault("limit", SemanticType.INT, 10))
                .build();
        Graph graph = Graph.builder("configured").addNode(load).build();
        RunConfig config = RunConfig.builder().input("load", "path", "/data/in.csv").build();

        // When
        ExecutionStep step = compiler.compile(graph, config).step("load");

        // Then
        assertThat(step.inputs().get("path").source())
                .isEqualTo(new StepInputSource.FromValue("/data/in.csv", StepInputSource.ValueOrigin.CONFIG));
        assertThat(step.inputs().get("limit").source())
                .isEqualTo(new StepInputSource.FromValue(10, StepInputSource.ValueOrigin.DEFAULT));
    }

    @Test
    void shouldRejectConfigValueOfWrongType() {
        OpDefinition load = OpDefinition.builder("load").input("limit", SemanticType.INT).build();
        Graph graph = Graph.builder("configured").addNode(load).build();
        RunConfig config = RunConfig.builder().input("load", "limit", "ten").build();

        assertThatThrownBy(() -> compiler.compile(graph, config))
                .isInstanceOf(PlanCompilationException.class)
                .hasMessageContaining("load.limit");
    }

    @Test
    void shouldPreferWiringOverConfig() {
        RunConfig config = RunConfig.builder().input("B", "in", "ignored").build();

        ExecutionPlan plan = compiler.compile(TestGraphs.linear(), config);

        assertThat(plan.step("B").inputs().get("in").source())
                .isInstanceOf(StepInputSource.FromStepOutput.class);
    }

    @Test
    void shouldRejectStructurallyInvalidGraph() {
        Graph graph = Graph.builder("static_map")
                .addNode(op("A"))
                .addNode(op("B", "in"))
                .addDependency("B", "in", InputSource.mapped("A", "result"))
                .build();

        assertThatThrownBy(() -> compiler.compile(graph, RunConfig.empty()))
                .isInstanceOf(GraphStructureException.class);
    }

    @Test
    void shouldLeaveDynamicScopeAsTemplates() {
        // When
        ExecutionPlan plan = compiler.compile(TestGraphs.fanOut(), RunConfig.empty());

        // Then: Only the producer is concrete
        assertThat(plan.stepKeys()).containsExactly("split");
        assertThat(plan.unresolvedSteps()).extracting(UnresolvedStep::key)
                .containsExactly("process[?]", "summarize");
        assertThat(plan.findUnresolved("process[?]")).get()
                .extracting(UnresolvedStep::kind).isEqualTo(UnresolvedStep.Kind.MAPPED);
        assertThat(plan.findUnresolved("summarize")).get()
                .extracting(UnresolvedStep::kind).isEqualTo(UnresolvedStep.Kind.COLLECT);
        assertThat(plan.topologicalOrder()).containsExactly("split", "process[?]", "summarize");
        assertThat(plan.statistics().isFullyResolved()).isFalse();
    }

    @Test
    void shouldExpandTemplatesWhenKeysArrive() {
        // Given
        ExecutionPlan plan = compiler.compile(TestGraphs.fanOut(), RunConfig.empty());

        // When: split reports three items, one needing sanitization
        ExecutionPlan expanded = compiler.expand(plan, "split", "items", List.of("a", "b", "c-1"));

        // Then: One clone per key plus a single collector
        assertThat(expanded.stepKeys())
                .containsExactly("split", "process[a]", "process[b]", "process[c_1]", "summarize");
        assertThat(expanded.unresolvedSteps()).isEmpty();
        assertThat(expanded.step("process[b]").mappingKey()).isEqualTo("b");
        assertThat(expanded.step("process[b]").inputs().get("item").source())
                .isEqualTo(new StepInputSource.FromStepOutput(new StepOutputHandle("split", "items", "b")));

        StepInputSource.FromCollect collect =
                (StepInputSource.FromCollect) expanded.step("summarize").inputs().get("results").source();
        assertThat(collect.dynamicProducer()).isEqualTo("split");
        assertThat(collect.handles()).extracting(StepOutputHandle::stepKey)
                .containsExactly("process[a]", "process[b]", "process[c_1]");
        assertThat(expanded.knownState().keysFor("split", "items")).contains(List.of("a", "b", "c_1"));

        // And: The original plan is untouched
        assertThat(plan.stepKeys()).containsExactly("split");
    }

    @Test
    void shouldExpandEmptyKeysIntoEmptyFanIn() {
        ExecutionPlan plan = compiler.compile(TestGraphs.fanOut(), RunConfig.empty());

        ExecutionPlan expanded = compiler.expand(plan, "split", "items", List.of());

        assertThat(expanded.stepKeys()).containsExactly("split", "summarize");
        assertThat(expanded.step("summarize").upstreamStepKeys()).containsExactly("split");
    }

    @Test
    void shouldRejectSecondExpansion() {
        ExecutionPlan expanded = compiler.expand(
                compiler.compile(TestGraphs.fanOut(), RunConfig.empty()), "split", "items", List.of("a"));

        assertThatThrownBy(() -> compiler.expand(expanded, "split", "items", List.of("b")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already expanded");
    }

    @Test
    void shouldRejectCollidingKeys() {
        ExecutionPlan plan = compiler.compile(TestGraphs.fanOut(), RunConfig.empty());

        assertThatThrownBy(() -> compiler.expand(plan, "split", "items", List.of("a.b", "a_b")))
                .isInstanceOf(InvalidMappingKeyException.class)
                .hasMessageContaining("collide");
    }

    @Test
    void shouldRejectExpansionOfStaticOutput() {
        ExecutionPlan plan = compiler.compile(TestGraphs.linear(), RunConfig.empty());

        assertThatThrownBy(() -> compiler.expand(plan, "A", "result", List.of("a")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not a dynamic output");
    }

    @Test
    void shouldCompileKnownMappingsIntoConcreteSteps() {
        // Given: Keys already known, as in a re-execution
        KnownExecutionState known = KnownExecutionState.empty().with("split", "items", List.of("x", "y"));

        // When
        ExecutionPlan plan = compiler.compile(TestGraphs.fanOut(), RunConfig.empty(), known);

        // Then
        assertThat(plan.stepKeys()).containsExactly("split", "process[x]", "process[y]", "summarize");
        assertThat(plan.unresolvedSteps()).isEmpty();
    }

    @Test
    void shouldTraverseCompiledPlan() {
        ExecutionPlan plan = compiler.compile(TestGraphs.linear(), RunConfig.empty());

        assertThat(plan.dependenciesOf("B")).containsExactly("A");
        assertThat(plan.dependentsOf("B")).containsExactly("C");
        assertThat(plan.ancestorsOf("C")).containsExactlyInAnyOrder("A", "B");
        assertThat(plan.descendantsOf("A")).containsExactlyInAnyOrder("B", "C");
        assertThat(plan.topologicalOrder()).containsExactly("A", "B", "C");
        assertThatThrownBy(() -> plan.dependenciesOf("Z"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldComputeStatistics() {
        // When
        PlanStatistics stats = compiler.compile(TestGraphs.siblings(), RunConfig.empty()).statistics();

        // Then: A, then B and C side by side
        assertThat(stats.totalSteps()).isEqualTo(3);
        assertThat(stats.rootSteps()).isEqualTo(1);
        assertThat(stats.leafSteps()).isEqualTo(2);
        assertThat(stats.executionLevels()).isEqualTo(2);
        assertThat(stats.maxParallelism()).isEqualTo(2);
        assertThat(stats.hasParallelism()).isTrue();
        assertThat(stats.isFullyResolved()).isTrue();
    }
}
