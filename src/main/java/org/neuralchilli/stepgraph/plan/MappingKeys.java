package org.neuralchilli.stepgraph.plan;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Sanitizes mapping keys reported by dynamic outputs so they can be embedded in step keys.
 */
public final class MappingKeys {

    private MappingKeys() {
    }

    public static String sanitize(String key) {
        return key.replaceAll("[^A-Za-z0-9_]", "_");
    }

    /**
     * Sanitize every key, preserving order.
     *
     * @throws InvalidMappingKeyException if a key is empty or two keys sanitize to the same value
     */
    public static List<String> sanitizeAll(String stepKey, String outputName, List<String> keys) {
        List<String> sanitized = new ArrayList<>(keys.size());
        Map<String, String> seen = new HashMap<>();

        for (String raw : keys) {
            if (raw == null || raw.isEmpty()) {
                throw new InvalidMappingKeyException(
                        "Empty mapping key reported for dynamic output " + stepKey + "." + outputName);
            }
            String key = sanitize(raw);
            String previous = seen.putIfAbsent(key, raw);
            if (previous != null) {
                throw new InvalidMappingKeyException(
                        "Mapping keys '" + previous + "' and '" + raw + "' of dynamic output "
                                + stepKey + "." + outputName + " collide as '" + key + "'");
            }
            sanitized.add(key);
        }
        return sanitized;
    }
}
