package org.neuralchilli.stepgraph.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;
import org.neuralchilli.stepgraph.scheduler.MissingOutputPolicy;

import java.util.Optional;

/**
 * Engine settings under the {@code stepgraph} prefix.
 */
@ConfigMapping(prefix = "stepgraph")
public interface EngineConfig {

    /**
     * Execute steps inline on the coordinating thread instead of the worker pool.
     */
    @WithName("test-mode")
    @WithDefault("false")
    boolean testMode();

    Worker worker();

    Scheduler scheduler();

    Graphs graphs();

    interface Worker {
        @WithName("id")
        @WithDefault("worker-local")
        String id();

        @WithName("threads")
        @WithDefault("4")
        int threads();
    }

    interface Scheduler {
        @WithName("missing-output-policy")
        @WithDefault("FAIL_STEP")
        MissingOutputPolicy missingOutputPolicy();
    }

    interface Graphs {
        /**
         * Directory of graph YAML files loaded at startup.
         */
        @WithName("path")
        Optional<String> path();
    }
}
