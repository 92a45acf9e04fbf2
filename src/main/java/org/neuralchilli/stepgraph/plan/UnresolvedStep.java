package org.neuralchilli.stepgraph.plan;

import org.neuralchilli.stepgraph.domain.DynamicOutputRef;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A step template waiting for a dynamic output to report its mapping keys.
 * Mapped templates use the placeholder key {@code handle[?]}; collect templates use the handle.
 */
public record UnresolvedStep(
        String key,
        String handle,
        Kind kind,
        DynamicOutputRef awaiting,
        Set<String> upstreamKeys
) implements Serializable {

    public static final String PLACEHOLDER = "?";

    public enum Kind {
        MAPPED,
        COLLECT
    }

    public UnresolvedStep {
        upstreamKeys = Collections.unmodifiableSet(new LinkedHashSet<>(upstreamKeys));
    }

    public static String placeholderKey(String handle) {
        return ExecutionStep.keyOf(handle, PLACEHOLDER);
    }
}
