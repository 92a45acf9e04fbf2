package org.neuralchilli.stepgraph.reexecution;

import org.neuralchilli.stepgraph.plan.ExecutionPlan;
import org.neuralchilli.stepgraph.plan.ExecutionStep;
import org.neuralchilli.stepgraph.run.ArtifactHandle;
import org.neuralchilli.stepgraph.run.StepOutcome;
import org.neuralchilli.stepgraph.run.StepStatus;
import org.neuralchilli.stepgraph.spi.ArtifactStore;

/**
 * Checks that every output a plan reuses from its parent run is still stored.
 */
public final class ReusedArtifacts {

    private ReusedArtifacts() {
    }

    /**
     * @throws StaleParentArtifactException on the first missing artifact
     */
    public static void verify(ExecutionPlan plan, ArtifactStore artifactStore) {
        for (ExecutionStep step : plan.steps()) {
            if (!step.isReused()) {
                continue;
            }
            StepOutcome parent = plan.reusedOutcomes().get(step.key());
            if (parent == null || parent.status() != StepStatus.SUCCEEDED) {
                continue;
            }
            for (ArtifactHandle handle : parent.allHandles()) {
                if (!artifactStore.exists(handle)) {
                    throw new StaleParentArtifactException(step.key(), handle);
                }
            }
        }
    }
}
