package org.neuralchilli.stepgraph.plan;

import javax.annotation.Nonnull;

/**
 * Shape of an execution plan.
 * Unresolved steps are templates still waiting for a dynamic output; they count towards
 * roots, leaves and levels as single placeholders.
 */
public record PlanStatistics(
        int totalSteps,
        int unresolvedSteps,
        int rootSteps,
        int leafSteps,
        int executionLevels,
        int maxParallelism
) {
    public PlanStatistics {
        if (totalSteps < 0 || unresolvedSteps < 0 || rootSteps < 0 || leafSteps < 0
                || executionLevels < 0 || maxParallelism < 0) {
            throw new IllegalArgumentException("Plan statistics cannot be negative");
        }
    }

    /**
     * Check if the plan has any parallelism opportunity
     */
    public boolean hasParallelism() {
        return maxParallelism > 1;
    }

    public boolean isFullyResolved() {
        return unresolvedSteps == 0;
    }

    @Nonnull
    @Override
    public String toString() {
        return String.format(
                "PlanStatistics[steps=%d, unresolved=%d, levels=%d, max_parallel=%d, roots=%d, leaves=%d]",
                totalSteps, unresolvedSteps, executionLevels, maxParallelism, rootSteps, leafSteps
        );
    }
}
