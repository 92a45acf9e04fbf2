package org.neuralchilli.stepgraph.scheduler;

import org.neuralchilli.stepgraph.run.StepEvent;

/**
 * Receives every step transition of a run, in sequence order.
 */
@FunctionalInterface
public interface StepEventListener {

    StepEventListener NONE = event -> {
    };

    void onEvent(StepEvent event);
}
