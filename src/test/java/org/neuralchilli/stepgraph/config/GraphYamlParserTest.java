package org.neuralchilli.stepgraph.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.neuralchilli.stepgraph.domain.GraphStructureException;
import org.neuralchilli.stepgraph.domain.Graph;
import org.neuralchilli.stepgraph.domain.InputDefinition;
import org.neuralchilli.stepgraph.domain.InputSource;
import org.neuralchilli.stepgraph.domain.OpDefinition;
import org.neuralchilli.stepgraph.domain.OutputDefinition;
import org.neuralchilli.stepgraph.domain.SemanticType;
import org.neuralchilli.stepgraph.domain.TypeMismatchException;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.*;

class GraphYamlParserTest {

    private GraphYamlParser parser;

    @BeforeEach
    void setup() {
        parser = new GraphYamlParser();
    }

    @Test
    void shouldParseCompleteGraph() {
        // Given
        String yaml = """
                name: etl
                description: Split, count and summarize
                tags:
                  team: data
                ops:
                  split:
                    inputs:
                      path: string
                    outputs:
                      parts: {type: string, dynamic: true}
                  count:
                    inputs:
                      part: string
                      limit: {type: int, default: 100}
                    outputs:
                      total: int
                  summarize:
                    inputs:
                      totals: list
                    outputs:
                      report: {type: map, optional: true}
                    tags:
                      tier: gold
                dependencies:
                  count:
                    part: {mapped: split.parts}
                  summarize:
                    totals: {collect: count.total}
                """;

        // When
        Graph graph = parser.parseGraph(yaml);

        // Then: Header fields
        assertThat(graph.name()).isEqualTo("etl");
        assertThat(graph.description()).isEqualTo("Split, count and summarize");
        assertThat(graph.tags()).containsEntry("team", "data");
        assertThat(graph.getNodeNames()).containsExactly("split", "count", "summarize");

        // And: Op declarations
        OpDefinition split = (OpDefinition) graph.invocation("split").orElseThrow().definition();
        assertThat(split.output("parts")).get().satisfies(output -> {
            assertThat(output.dynamic()).isTrue();
            assertThat(output.type()).isEqualTo(SemanticType.STRING);
        });
        OpDefinition count = (OpDefinition) graph.invocation("count").orElseThrow().definition();
        assertThat(count.input("limit")).get()
                .extracting(InputDefinition::defaultValue).isEqualTo(100);
        OpDefinition summarize = (OpDefinition) graph.invocation("summarize").orElseThrow().definition();
        assertThat(summarize.output("report")).get()
                .extracting(OutputDefinition::required).isEqualTo(false);
        assertThat(summarize.tags()).containsEntry("tier", "gold");

        // And: Wiring
        assertThat(graph.dependency("count", "part")).contains(InputSource.mapped("split", "parts"));
        assertThat(graph.dependency("summarize", "totals")).contains(InputSource.collect("count", "total"));
        assertThat(graph.validate().isValid()).isTrue();
    }

    @Test
    void shouldParseAliasesLiteralsAndOrdering() {
        String yaml = """
                name: aliased
                ops:
                  load:
                    inputs:
                      table: string
                    outputs:
                      result: any
                  audit:
                    inputs:
                      gate: nothing
                nodes:
                  - {op: load, alias: load_users}
                  - {op: load, alias: load_orders}
                  - audit
                dependencies:
                  load_users:
                    table: {value: users}
                  load_orders:
                    table: {value: orders}
                  audit:
                    gate: {after: [load_users, load_orders]}
                """;

        Graph graph = parser.parseGraph(yaml);

        assertThat(graph.getNodeNames()).containsExactly("load_users", "load_orders", "audit");
        assertThat(graph.dependency("load_orders", "table")).contains(InputSource.value("orders"));
        assertThat(graph.dependency("audit", "gate")).contains(InputSource.after("load_users", "load_orders"));
    }

    @Test
    void shouldDefaultReferenceToResultOutput() {
        String yaml = """
                name: defaults
                ops:
                  A:
                    outputs:
                      result: any
                  B:
                    inputs:
                      in: any
                dependencies:
                  B:
                    in: {from: A}
                """;

        Graph graph = parser.parseGraph(yaml);

        assertThat(graph.dependency("B", "in")).contains(InputSource.from("A", "result"));
    }

    @Test
    void shouldParseFromStream() {
        String yaml = "name: tiny\nops:\n  only:\n    outputs:\n      result: any\n";

        Graph graph = parser.parseGraph(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));

        assertThat(graph.getNodeNames()).containsExactly("only");
    }

    @Test
    void shouldRejectMissingName() {
        assertThatThrownBy(() -> parser.parseGraph("ops:\n  A: {}\n"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Missing required field: name");
    }

    @Test
    void shouldRejectGraphWithoutOps() {
        assertThatThrownBy(() -> parser.parseGraph("name: empty\n"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("at least one op");
    }

    @Test
    void shouldRejectUnknownOpInNodes() {
        String yaml = "name: bad\nops:\n  A: {}\nnodes:\n  - B\n";

        assertThatThrownBy(() -> parser.parseGraph(yaml))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown op: B");
    }

    @Test
    void shouldRejectUnknownSourceKind() {
        String yaml = """
                name: bad
                ops:
                  A:
                    outputs:
                      result: any
                  B:
                    inputs:
                      in: any
                dependencies:
                  B:
                    in: {pipe: A}
                """;

        assertThatThrownBy(() -> parser.parseGraph(yaml))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown source kind 'pipe'");
    }

    @Test
    void shouldRejectInvalidType() {
        String yaml = "name: bad\nops:\n  A:\n    inputs:\n      in: decimal\n";

        assertThatThrownBy(() -> parser.parseGraph(yaml))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid type: decimal");
    }

    @Test
    void shouldSurfaceStructuralErrors() {
        String yaml = """
                name: typed
                ops:
                  A:
                    outputs:
                      text: string
                  B:
                    inputs:
                      n: int
                dependencies:
                  B:
                    n: {from: A.text}
                """;

        assertThatThrownBy(() -> parser.parseGraph(yaml))
                .isInstanceOf(TypeMismatchException.class)
                .isInstanceOf(GraphStructureException.class);
    }
}
