package org.neuralchilli.stepgraph.scheduler;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.stepgraph.config.EngineConfig;
import org.neuralchilli.stepgraph.plan.ExecutionPlan;
import org.neuralchilli.stepgraph.plan.PlanCompiler;
import org.neuralchilli.stepgraph.spi.ArtifactStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.UUID;

/**
 * Creates and starts a {@link StepScheduler} per run, wired to the engine's compiler,
 * artifact store and missing-output policy.
 */
@ApplicationScoped
public class SchedulerCore {

    private static final Logger log = LoggerFactory.getLogger(SchedulerCore.class);

    @Inject
    PlanCompiler compiler;

    @Inject
    ArtifactStore artifactStore;

    @Inject
    EngineConfig config;

    public StepScheduler start(UUID runId, ExecutionPlan plan, StepEventListener listener) {
        MissingOutputPolicy policy = config.scheduler().missingOutputPolicy();
        log.debug("Starting scheduler for run {} with missing output policy {}", runId, policy);

        StepScheduler scheduler = new StepScheduler(runId, plan, compiler, artifactStore, policy, listener);
        scheduler.start();
        return scheduler;
    }
}
