package org.neuralchilli.stepgraph.scheduler;

import org.neuralchilli.stepgraph.plan.ExecutionStep;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * A ready step handed to a worker, with its input bindings.
 */
public record StepDispatch(UUID runId, ExecutionStep step, Map<String, InputBinding> inputs) {

    public StepDispatch {
        inputs = Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
    }
}
