package org.neuralchilli.stepgraph.config;

import com.hazelcast.core.HazelcastInstance;
import com.hazelcast.map.IMap;
import io.quarkus.runtime.StartupEvent;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.neuralchilli.stepgraph.domain.Graph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Registry of named graphs, backed by Hazelcast.
 * Graphs are registered programmatically or loaded from the YAML files under
 * {@code stepgraph.graphs.path} at startup.
 */
@ApplicationScoped
public class GraphLoaderService {

    private static final Logger log = LoggerFactory.getLogger(GraphLoaderService.class);

    @Inject
    GraphYamlParser yamlParser;

    @Inject
    HazelcastInstance hazelcast;

    @Inject
    EngineConfig config;

    private IMap<String, Graph> graphDefinitions;

    @PostConstruct
    void init() {
        graphDefinitions = hazelcast.getMap("graph-definitions");
    }

    void onStart(@Observes StartupEvent event) {
        config.graphs().path().ifPresent(path -> {
            log.info("Loading graphs from: {}", path);
            logResults(loadAllGraphs(Path.of(path)));
        });
    }

    /**
     * Validate and register a graph under its name, replacing any previous version.
     */
    public void register(Graph graph) {
        graph.validate().orThrow();
        graphDefinitions.set(graph.name(), graph);
        log.info("Registered graph: {} ({} nodes)", graph.name(), graph.invocations().size());
    }

    public Optional<Graph> find(String name) {
        return Optional.ofNullable(graphDefinitions.get(name));
    }

    public List<LoadResult> loadAllGraphs(Path graphsDir) {
        List<LoadResult> results = new ArrayList<>();

        if (!Files.exists(graphsDir)) {
            log.warn("Graphs directory does not exist: {}", graphsDir);
            return results;
        }

        try (Stream<Path> paths = Files.walk(graphsDir)) {
            paths.filter(p -> p.toString().endsWith(".yaml") || p.toString().endsWith(".yml"))
                    .sorted()
                    .forEach(path -> results.add(loadGraph(path)));
        } catch (IOException e) {
            log.error("Error scanning graphs directory: {}", graphsDir, e);
            results.add(LoadResult.failure(graphsDir.toString(), e));
        }

        return results;
    }

    public LoadResult loadGraph(Path path) {
        try {
            log.debug("Loading graph from: {}", path);
            Graph graph = yamlParser.parseGraph(Files.readString(path));
            register(graph);
            return LoadResult.success(graph.name());
        } catch (IOException e) {
            log.error("Failed to read graph file: {}", path, e);
            return LoadResult.failure(path.getFileName().toString(), e);
        } catch (RuntimeException e) {
            log.error("Failed to load graph from: {}", path, e);
            return LoadResult.failure(path.getFileName().toString(), e);
        }
    }

    private void logResults(List<LoadResult> results) {
        long successful = results.stream().filter(LoadResult::isSuccess).count();
        long failed = results.size() - successful;

        if (failed > 0) {
            log.warn("Loaded {} graphs: {} successful, {} failed", results.size(), successful, failed);
            results.stream()
                    .filter(r -> !r.isSuccess())
                    .forEach(r -> log.error("  {}: {}", r.name(), r.error().orElse("unknown error")));
        } else {
            log.info("Loaded {} graphs: all successful", results.size());
        }
    }
}
