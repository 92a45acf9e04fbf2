package org.neuralchilli.stepgraph.config;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.stepgraph.plan.RunConfig;
import org.yaml.snakeyaml.Yaml;

import java.io.InputStream;
import java.util.Map;

/**
 * Parses run configs from YAML.
 *
 * <pre>
 * ops:
 *   split:
 *     inputs:
 *       path: /data/in.csv
 *   sub.load:           # nested ops by dotted handle
 *     inputs:
 *       table: events
 * tags:
 *   owner: data-eng
 * </pre>
 */
@ApplicationScoped
public class RunConfigParser {

    private final Yaml yaml = new Yaml();

    public RunConfig parse(String yamlContent) {
        Map<String, Object> data = yaml.load(yamlContent);
        return parseFromMap(data);
    }

    public RunConfig parse(InputStream inputStream) {
        Map<String, Object> data = yaml.load(inputStream);
        return parseFromMap(data);
    }

    private RunConfig parseFromMap(Map<String, Object> data) {
        RunConfig.Builder builder = RunConfig.builder();
        if (data == null) {
            return builder.build();
        }

        asMap(data.get("ops"), "ops").forEach((handle, opConfig) -> {
            Map<?, ?> inputs = asMap(asMap(opConfig, "ops." + handle).get("inputs"), "ops." + handle + ".inputs");
            inputs.forEach((input, value) -> builder.input(handle.toString(), input.toString(), value));
        });

        asMap(data.get("tags"), "tags").forEach((key, value) ->
                builder.tag(key.toString(), value != null ? value.toString() : ""));

        return builder.build();
    }

    private Map<?, ?> asMap(Object value, String field) {
        if (value == null) {
            return Map.of();
        }
        if (value instanceof Map<?, ?> map) {
            return map;
        }
        throw new IllegalArgumentException("Field '" + field + "' must be a map");
    }
}
