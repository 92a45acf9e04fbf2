package org.neuralchilli.stepgraph.plan;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Resolved source of a step input.
 */
public sealed interface StepInputSource extends Serializable
        permits StepInputSource.FromStepOutput, StepInputSource.FromCollect,
        StepInputSource.FromValue, StepInputSource.AfterSteps {

    /**
     * Steps that must reach a terminal outcome before this input is settled.
     */
    Set<String> producerStepKeys();

    enum ValueOrigin {
        LITERAL,
        CONFIG,
        DEFAULT
    }

    record FromStepOutput(StepOutputHandle handle) implements StepInputSource {
        @Override
        public Set<String> producerStepKeys() {
            return Set.of(handle.stepKey());
        }
    }

    /**
     * Fan-in over every instance produced for a dynamic output.
     * The producer of the dynamic output is kept even when there are no instances.
     */
    record FromCollect(String dynamicProducer, List<StepOutputHandle> handles) implements StepInputSource {
        public FromCollect {
            handles = List.copyOf(handles);
        }

        @Override
        public Set<String> producerStepKeys() {
            Set<String> keys = new LinkedHashSet<>();
            keys.add(dynamicProducer);
            handles.forEach(h -> keys.add(h.stepKey()));
            return Collections.unmodifiableSet(keys);
        }
    }

    record FromValue(Object value, ValueOrigin origin) implements StepInputSource {
        @Override
        public Set<String> producerStepKeys() {
            return Set.of();
        }
    }

    record AfterSteps(Set<String> stepKeys) implements StepInputSource {
        public AfterSteps {
            stepKeys = Collections.unmodifiableSet(new LinkedHashSet<>(stepKeys));
        }

        @Override
        public Set<String> producerStepKeys() {
            return stepKeys;
        }
    }
}
