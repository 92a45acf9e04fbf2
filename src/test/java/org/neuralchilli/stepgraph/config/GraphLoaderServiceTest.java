package org.neuralchilli.stepgraph.config;

import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.neuralchilli.stepgraph.domain.Graph;
import org.neuralchilli.stepgraph.domain.GraphStructureException;
import org.neuralchilli.stepgraph.domain.InputSource;
import org.neuralchilli.stepgraph.testing.TestGraphs;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.*;

@QuarkusTest
class GraphLoaderServiceTest {

    @Inject
    GraphLoaderService loader;

    private Path tempDir;

    @BeforeEach
    void setup() throws IOException {
        tempDir = Files.createTempDirectory("stepgraph-test-");
    }

    @AfterEach
    void cleanup() throws IOException {
        try (Stream<Path> paths = Files.walk(tempDir)) {
            paths.sorted(Comparator.reverseOrder()).map(Path::toFile).forEach(File::delete);
        }
    }

    @Test
    void shouldLoadGraphFile() throws IOException {
        // Given: A valid graph YAML file
        Path file = tempDir.resolve("pipeline.yaml");
        Files.writeString(file, """
                name: loaded_pipeline
                ops:
                  extract:
                    outputs:
                      result: any
                  load:
                    inputs:
                      in: any
                    outputs:
                      result: any
                dependencies:
                  load:
                    in: {from: extract}
                """);

        // When
        LoadResult result = loader.loadGraph(file);

        // Then: Registered under its own name
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.name()).isEqualTo("loaded_pipeline");
        assertThat(loader.find("loaded_pipeline")).get()
                .satisfies(graph -> assertThat(graph.dependency("load", "in"))
                        .contains(InputSource.from("extract", "result")));
    }

    @Test
    void shouldReportInvalidGraphFile() throws IOException {
        // Given: A graph with a cycle
        Path file = tempDir.resolve("cyclic.yaml");
        Files.writeString(file, """
                name: cyclic
                ops:
                  A:
                    inputs:
                      in: any
                    outputs:
                      result: any
                  B:
                    inputs:
                      in: any
                    outputs:
                      result: any
                dependencies:
                  A:
                    in: {from: B}
                  B:
                    in: {from: A}
                """);

        // When
        LoadResult result = loader.loadGraph(file);

        // Then: The failure names the file
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.name()).isEqualTo("cyclic.yaml");
        assertThat(result.error()).isPresent();
        assertThat(loader.find("cyclic")).isEmpty();
    }

    @Test
    void shouldLoadEveryYamlFileInDirectory() throws IOException {
        // Given: Two graphs in nested directories and a file that is not YAML
        Path nested = Files.createDirectories(tempDir.resolve("team"));
        Files.writeString(tempDir.resolve("first.yaml"), "name: dir_first\nops:\n  only:\n    outputs:\n      result: any\n");
        Files.writeString(nested.resolve("second.yml"), "name: dir_second\nops:\n  only:\n    outputs:\n      result: any\n");
        Files.writeString(tempDir.resolve("notes.txt"), "not a graph");

        // When
        List<LoadResult> results = loader.loadAllGraphs(tempDir);

        // Then
        assertThat(results).hasSize(2).allMatch(LoadResult::isSuccess);
        assertThat(results).extracting(LoadResult::name)
                .containsExactlyInAnyOrder("dir_first", "dir_second");
    }

    @Test
    void shouldReturnNoResultsForMissingDirectory() {
        List<LoadResult> results = loader.loadAllGraphs(tempDir.resolve("absent"));

        assertThat(results).isEmpty();
    }

    @Test
    void shouldRegisterAndReplaceGraph() {
        // Given
        loader.register(TestGraphs.siblings());

        // When: A graph with the same name is registered again
        Graph replacement = Graph.builder("siblings")
                .addNode(TestGraphs.op("A"))
                .build();
        loader.register(replacement);

        // Then
        assertThat(loader.find("siblings")).get()
                .extracting(Graph::getNodeNames).isEqualTo(List.of("A"));
    }

    @Test
    void shouldRejectInvalidGraphOnRegister() {
        // Given: A mapped input over a static output
        Graph invalid = Graph.builder("invalid_registration")
                .addNode(TestGraphs.op("A"))
                .addNode(TestGraphs.op("B", "in"))
                .addDependency("B", "in", InputSource.mapped("A", "result"))
                .build();

        // When/Then
        assertThatThrownBy(() -> loader.register(invalid))
                .isInstanceOf(GraphStructureException.class);
        assertThat(loader.find("invalid_registration")).isEmpty();
    }
}
