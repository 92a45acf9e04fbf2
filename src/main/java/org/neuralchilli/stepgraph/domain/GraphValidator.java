package org.neuralchilli.stepgraph.domain;

import java.util.Map;

/**
 * Whole-graph checks run by {@link Graph#validate()}.
 * Returns the first defect found; nested graphs are checked before the flattened whole.
 */
final class GraphValidator {

    private GraphValidator() {
    }

    static ValidationResult validate(Graph graph) {
        for (NodeInvocation invocation : graph.invocations()) {
            String node = invocation.name();

            for (InputDefinition input : invocation.definition().inputs()) {
                boolean wired = graph.dependency(node, input.name()).isPresent()
                        || graph.inputMappingFor(node, input.name()).isPresent();
                if (!wired && input.isRequired() && !input.type().isConfigLoadable()) {
                    return ValidationResult.defect(
                            "Input '" + node + "." + input.name() + "' is not wired, has no default "
                                    + "and cannot be supplied from config");
                }
            }

            for (Map.Entry<String, InputSource> entry : graph.dependencies().getOrDefault(node, Map.of()).entrySet()) {
                if (entry.getValue() instanceof InputSource.After after && after.nodes().isEmpty()) {
                    return ValidationResult.defect(
                            "Ordering dependency of '" + node + "." + entry.getKey() + "' is empty");
                }
            }

            if (invocation.definition() instanceof Graph nested) {
                ValidationResult nestedResult = validate(nested);
                if (!nestedResult.isValid()) {
                    return ValidationResult.defect(
                            "In nested graph '" + node + "': " + nestedResult.defect().orElseThrow());
                }
            }
        }

        try {
            graph.flatten();
        } catch (GraphStructureException e) {
            return ValidationResult.defect(e.getMessage());
        }
        return ValidationResult.valid();
    }
}
