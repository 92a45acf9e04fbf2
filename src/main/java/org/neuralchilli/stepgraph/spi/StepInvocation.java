package org.neuralchilli.stepgraph.spi;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * What compute receives for one step: identity plus loaded input values.
 * Collect inputs arrive as lists in mapping-key order.
 */
public record StepInvocation(
        UUID runId,
        String stepKey,
        String handle,
        String opName,
        String mappingKey,
        Map<String, Object> inputs,
        Map<String, String> tags
) {
    public StepInvocation {
        if (runId == null) {
            throw new IllegalArgumentException("Run ID cannot be null");
        }
        if (stepKey == null || stepKey.isBlank()) {
            throw new IllegalArgumentException("Step key cannot be null or empty");
        }
        // Values may be null, so no Map.copyOf
        inputs = inputs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
        tags = tags == null ? Map.of() : Map.copyOf(tags);
    }

    public Object input(String name) {
        return inputs.get(name);
    }
}
