package org.neuralchilli.stepgraph.reexecution;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.stepgraph.plan.ExecutionPlan;
import org.neuralchilli.stepgraph.plan.ExecutionStep;
import org.neuralchilli.stepgraph.plan.KnownExecutionState;
import org.neuralchilli.stepgraph.plan.PlanCompiler;
import org.neuralchilli.stepgraph.plan.StepSource;
import org.neuralchilli.stepgraph.run.RunRecord;
import org.neuralchilli.stepgraph.run.StepOutcome;
import org.neuralchilli.stepgraph.run.StepStatus;
import org.neuralchilli.stepgraph.selection.SelectionEngine;
import org.neuralchilli.stepgraph.spi.ArtifactStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Derives the plan of a re-execution from a finished parent run.
 * <p>
 * Steps are split into a fresh set, which runs again, and everything else, which reuses the
 * parent's outcome. Dynamic mappings of reused producers are carried over so their clones are
 * concrete from the start; mappings of fresh producers are rediscovered at run time.
 * The parent record is never modified.
 */
@ApplicationScoped
public class ReExecutionPlanner {

    private static final Logger log = LoggerFactory.getLogger(ReExecutionPlanner.class);

    @Inject
    PlanCompiler compiler;

    @Inject
    SelectionEngine selectionEngine;

    @Inject
    ArtifactStore artifactStore;

    /**
     * @param selection selection query, required for {@code SELECTED} and {@code FROM_SELECTED}
     * @throws ReExecutionException         if the parent cannot be re-executed in this mode
     * @throws StaleParentArtifactException if a reused output no longer exists
     */
    public ExecutionPlan planReExecution(RunRecord parent, ReExecutionMode mode, String selection) {
        if (parent == null) {
            throw new IllegalArgumentException("Parent run cannot be null");
        }
        if (mode == null) {
            throw new IllegalArgumentException("Re-execution mode cannot be null");
        }
        if (!parent.isFinished()) {
            throw new ReExecutionException("Run " + parent.runId() + " is still running");
        }
        boolean hasSelection = selection != null && !selection.isBlank();
        if (mode.requiresSelection() && !hasSelection) {
            throw new ReExecutionException("Mode " + mode + " requires a step selection");
        }

        ExecutionPlan parentPlan = parent.plan();

        if (mode == ReExecutionMode.ALL) {
            if (hasSelection) {
                log.warn("Selection '{}' ignored for full re-execution of run {}", selection, parent.runId());
            }
            ExecutionPlan plan = compiler.compile(parentPlan.graph(), parentPlan.runConfig());
            log.info("Planned full re-execution of run {}: {} fresh steps", parent.runId(), plan.stepKeys().size());
            return plan.withReuse(parent.runId(), Map.of(), Map.of());
        }

        Set<String> fresh = freshKeys(parent, mode, selection);
        KnownExecutionState known = parentPlan.knownState().restrictedTo(producer -> !fresh.contains(producer));
        ExecutionPlan compiled = compiler.compile(parentPlan.graph(), parentPlan.runConfig(), known);

        Map<String, StepSource> sources = new LinkedHashMap<>();
        for (ExecutionStep step : compiled.steps()) {
            if (!fresh.contains(step.key()) && parent.outcomes().containsKey(step.key())) {
                sources.put(step.key(), StepSource.reused(parent.runId(), step.key()));
            }
        }

        ExecutionPlan plan = compiled.withReuse(parent.runId(), sources, parent.outcomes());
        ReusedArtifacts.verify(plan, artifactStore);

        log.info("Planned {} re-execution of run {}: {} reused, {} fresh",
                mode, parent.runId(), sources.size(), plan.stepKeys().size() - sources.size());
        return plan;
    }

    private Set<String> freshKeys(RunRecord parent, ReExecutionMode mode, String selection) {
        ExecutionPlan parentPlan = parent.plan();
        Set<String> fresh = new LinkedHashSet<>();

        switch (mode) {
            case SELECTED -> fresh.addAll(selectionEngine.select(parentPlan, selection));
            case FROM_SELECTED -> {
                for (String key : selectionEngine.select(parentPlan, selection)) {
                    fresh.add(key);
                    fresh.addAll(parentPlan.descendantsOf(key));
                }
            }
            case FROM_FAILURE -> {
                for (String key : parentPlan.allKeys()) {
                    if (needsRetry(parent.outcomes().get(key))) {
                        fresh.add(key);
                        fresh.addAll(parentPlan.descendantsOf(key));
                    }
                }
                if (fresh.isEmpty()) {
                    throw new ReExecutionException("Run " + parent.runId() + " has no failed steps to re-execute");
                }
            }
            default -> throw new IllegalStateException("Unexpected mode " + mode);
        }
        return fresh;
    }

    private static boolean needsRetry(StepOutcome outcome) {
        if (outcome == null || !outcome.status().isTerminal()) {
            return true;
        }
        return outcome.status() == StepStatus.FAILED
                || (outcome.status() == StepStatus.SKIPPED && outcome.skipReason().isFailureLike());
    }
}
