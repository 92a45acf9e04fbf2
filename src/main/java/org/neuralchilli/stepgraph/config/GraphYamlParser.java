package org.neuralchilli.stepgraph.config;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.stepgraph.domain.Graph;
import org.neuralchilli.stepgraph.domain.InputDefinition;
import org.neuralchilli.stepgraph.domain.InputSource;
import org.neuralchilli.stepgraph.domain.OpDefinition;
import org.neuralchilli.stepgraph.domain.OutputDefinition;
import org.neuralchilli.stepgraph.domain.SemanticType;
import org.yaml.snakeyaml.Yaml;

import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Parses graph definitions from YAML.
 *
 * <pre>
 * name: etl
 * ops:
 *   split:
 *     inputs:
 *       path: string
 *     outputs:
 *       parts: {type: string, dynamic: true}
 *   count:
 *     inputs:
 *       part: string
 *       gate: nothing
 * nodes:                      # optional, defaults to one node per op
 *   - op: split
 *   - {op: count, alias: counter}
 * dependencies:
 *   counter:
 *     part: {mapped: split.parts}
 *     gate: {after: [split]}
 * </pre>
 *
 * Sources are {@code from}, {@code mapped} and {@code collect} with a {@code node.output}
 * reference (output defaults to {@code result}), {@code value} with a literal, and
 * {@code after} with a list of nodes.
 */
@ApplicationScoped
public class GraphYamlParser {

    private final Yaml yaml = new Yaml();

    public Graph parseGraph(String yamlContent) {
        Map<String, Object> data = yaml.load(yamlContent);
        return parseGraphFromMap(data);
    }

    public Graph parseGraph(InputStream inputStream) {
        Map<String, Object> data = yaml.load(inputStream);
        return parseGraphFromMap(data);
    }

    @SuppressWarnings("unchecked")
    private Graph parseGraphFromMap(Map<String, Object> data) {
        if (data == null) {
            throw new IllegalArgumentException("Graph YAML is empty");
        }
        String name = getString(data, "name", true);

        Map<String, OpDefinition> ops = parseOps(getMap(data, "ops"));
        if (ops.isEmpty()) {
            throw new IllegalArgumentException("Graph must declare at least one op");
        }

        Graph.Builder builder = Graph.builder(name)
                .description(getString(data, "description", false));
        getStringMap(data, "tags").forEach(builder::tag);

        Object nodes = data.get("nodes");
        if (nodes == null) {
            ops.values().forEach(builder::addNode);
        } else {
            for (Object node : (List<Object>) nodes) {
                addNode(builder, ops, node);
            }
        }

        getMap(data, "dependencies").forEach((node, inputs) -> {
            Map<String, Object> inputMap = (Map<String, Object>) inputs;
            inputMap.forEach((input, source) -> builder.addDependency(node, input, parseSource(node, input, source)));
        });

        return builder.build();
    }

    @SuppressWarnings("unchecked")
    private void addNode(Graph.Builder builder, Map<String, OpDefinition> ops, Object node) {
        if (node instanceof String opName) {
            builder.addNode(requireOp(ops, opName));
            return;
        }
        Map<String, Object> nodeMap = (Map<String, Object>) node;
        OpDefinition op = requireOp(ops, getString(nodeMap, "op", true));
        String alias = getString(nodeMap, "alias", false);
        if (alias == null) {
            builder.addNode(op);
        } else {
            builder.addNode(alias, op);
        }
    }

    private OpDefinition requireOp(Map<String, OpDefinition> ops, String opName) {
        OpDefinition op = ops.get(opName);
        if (op == null) {
            throw new IllegalArgumentException("Unknown op: " + opName);
        }
        return op;
    }

    @SuppressWarnings("unchecked")
    private Map<String, OpDefinition> parseOps(Map<String, Object> opsMap) {
        Map<String, OpDefinition> result = new LinkedHashMap<>();

        for (Map.Entry<String, Object> entry : opsMap.entrySet()) {
            Map<String, Object> opDef = entry.getValue() == null
                    ? Map.of()
                    : (Map<String, Object>) entry.getValue();

            OpDefinition.Builder op = OpDefinition.builder(entry.getKey())
                    .description(getString(opDef, "description", false));

            getMap(opDef, "inputs").forEach((inputName, declaration) -> op.input(parseInput(inputName, declaration)));
            getMap(opDef, "outputs").forEach((outputName, declaration) -> op.output(parseOutput(outputName, declaration)));
            getStringMap(opDef, "tags").forEach(op::tag);

            result.put(entry.getKey(), op.build());
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    private InputDefinition parseInput(String name, Object declaration) {
        if (declaration == null || declaration instanceof String) {
            SemanticType type = declaration == null ? SemanticType.ANY : SemanticType.fromString((String) declaration);
            return InputDefinition.of(name, type);
        }
        Map<String, Object> inputDef = (Map<String, Object>) declaration;
        String typeStr = getString(inputDef, "type", false);
        SemanticType type = typeStr == null ? SemanticType.ANY : SemanticType.fromString(typeStr);

        if (inputDef.containsKey("default")) {
            return InputDefinition.withDefault(name, type, inputDef.get("default"));
        }
        return InputDefinition.of(name, type);
    }

    @SuppressWarnings("unchecked")
    private OutputDefinition parseOutput(String name, Object declaration) {
        if (declaration == null || declaration instanceof String) {
            SemanticType type = declaration == null ? SemanticType.ANY : SemanticType.fromString((String) declaration);
            return OutputDefinition.of(name, type);
        }
        Map<String, Object> outputDef = (Map<String, Object>) declaration;
        String typeStr = getString(outputDef, "type", false);
        SemanticType type = typeStr == null ? SemanticType.ANY : SemanticType.fromString(typeStr);
        boolean optional = getBoolean(outputDef, "optional", false);
        boolean dynamic = getBoolean(outputDef, "dynamic", false);
        return new OutputDefinition(name, type, !optional, dynamic);
    }

    @SuppressWarnings("unchecked")
    private InputSource parseSource(String node, String input, Object declaration) {
        if (!(declaration instanceof Map)) {
            throw new IllegalArgumentException(
                    "Source of " + node + "." + input + " must be a map, got: " + declaration);
        }
        Map<String, Object> source = (Map<String, Object>) declaration;
        if (source.size() != 1) {
            throw new IllegalArgumentException(
                    "Source of " + node + "." + input + " must have exactly one of from, mapped, collect, value, after");
        }

        Map.Entry<String, Object> entry = source.entrySet().iterator().next();
        switch (entry.getKey()) {
            case "from": {
                String[] ref = parseReference(entry.getValue());
                return InputSource.from(ref[0], ref[1]);
            }
            case "mapped": {
                String[] ref = parseReference(entry.getValue());
                return InputSource.mapped(ref[0], ref[1]);
            }
            case "collect": {
                String[] ref = parseReference(entry.getValue());
                return InputSource.collect(ref[0], ref[1]);
            }
            case "value":
                return InputSource.value(entry.getValue());
            case "after": {
                Object nodes = entry.getValue();
                List<String> upstream = nodes instanceof List<?> list
                        ? list.stream().map(Object::toString).collect(Collectors.toList())
                        : List.of(nodes.toString());
                return new InputSource.After(new LinkedHashSet<>(upstream));
            }
            default:
                throw new IllegalArgumentException(
                        "Unknown source kind '" + entry.getKey() + "' for " + node + "." + input);
        }
    }

    /**
     * {@code node.output} or just {@code node} for the default output.
     */
    private String[] parseReference(Object value) {
        if (value == null) {
            throw new IllegalArgumentException("Output reference cannot be empty");
        }
        String ref = value.toString();
        int dot = ref.indexOf('.');
        if (dot < 0) {
            return new String[]{ref, OutputDefinition.DEFAULT_NAME};
        }
        return new String[]{ref.substring(0, dot), ref.substring(dot + 1)};
    }

    // Helper methods for type-safe extraction

    private String getString(Map<String, Object> map, String key, boolean required) {
        Object value = map.get(key);
        if (value == null) {
            if (required) {
                throw new IllegalArgumentException("Missing required field: " + key);
            }
            return null;
        }
        return value.toString();
    }

    private boolean getBoolean(Map<String, Object> map, String key, boolean defaultValue) {
        Object value = map.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return Boolean.parseBoolean(value.toString());
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> getMap(Map<String, Object> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return Map.of();
        }
        if (value instanceof Map) {
            Map<String, Object> result = new LinkedHashMap<>();
            ((Map<?, ?>) value).forEach((k, v) -> result.put(k.toString(), v));
            return result;
        }
        throw new IllegalArgumentException("Field '" + key + "' must be a map");
    }

    private Map<String, String> getStringMap(Map<String, Object> map, String key) {
        Map<String, String> result = new LinkedHashMap<>();
        getMap(map, key).forEach((k, v) -> result.put(k, v != null ? v.toString() : null));
        return result;
    }
}
