package org.neuralchilli.stepgraph.scheduler;

import org.neuralchilli.stepgraph.domain.OutputDefinition;
import org.neuralchilli.stepgraph.plan.ExecutionPlan;
import org.neuralchilli.stepgraph.plan.ExecutionStep;
import org.neuralchilli.stepgraph.plan.InvalidMappingKeyException;
import org.neuralchilli.stepgraph.plan.MappingKeys;
import org.neuralchilli.stepgraph.plan.PlanCompiler;
import org.neuralchilli.stepgraph.plan.StepInput;
import org.neuralchilli.stepgraph.plan.StepInputSource;
import org.neuralchilli.stepgraph.plan.StepOutputHandle;
import org.neuralchilli.stepgraph.plan.UnresolvedStep;
import org.neuralchilli.stepgraph.reexecution.ReusedArtifacts;
import org.neuralchilli.stepgraph.run.ArtifactHandle;
import org.neuralchilli.stepgraph.run.RunStatus;
import org.neuralchilli.stepgraph.run.SkipReason;
import org.neuralchilli.stepgraph.run.StepEvent;
import org.neuralchilli.stepgraph.run.StepOutcome;
import org.neuralchilli.stepgraph.run.StepStatus;
import org.neuralchilli.stepgraph.spi.ArtifactStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Outcome state machine of one run.
 * <p>
 * Every transition happens under one lock and is stamped with the next value of the run's
 * sequence, so the event stream has a total order. Statuses only move forward: a step that
 * reached SUCCEEDED, FAILED or SKIPPED never changes again, and results arriving for it
 * afterwards are dropped.
 * <p>
 * Readiness is recomputed to a fixpoint on every poll and after every applied result:
 * a step becomes READY once every input is available, or SKIPPED as soon as one input can
 * never be satisfied.
 */
public final class StepScheduler {

    private static final Logger log = LoggerFactory.getLogger(StepScheduler.class);

    private final UUID runId;
    private final PlanCompiler compiler;
    private final ArtifactStore artifactStore;
    private final MissingOutputPolicy missingOutputPolicy;
    private final StepEventListener listener;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, StepOutcome> outcomes = new LinkedHashMap<>();

    private volatile ExecutionPlan plan;
    private volatile boolean cancelRequested;
    private boolean started;
    private boolean aborted;
    private long sequence;

    public StepScheduler(UUID runId, ExecutionPlan plan, PlanCompiler compiler, ArtifactStore artifactStore,
                         MissingOutputPolicy missingOutputPolicy, StepEventListener listener) {
        if (runId == null || plan == null || compiler == null || artifactStore == null) {
            throw new IllegalArgumentException("Run ID, plan, compiler and artifact store are required");
        }
        this.runId = runId;
        this.plan = plan;
        this.compiler = compiler;
        this.artifactStore = artifactStore;
        this.missingOutputPolicy = missingOutputPolicy != null ? missingOutputPolicy : MissingOutputPolicy.FAIL_STEP;
        this.listener = listener != null ? listener : StepEventListener.NONE;
    }

    /**
     * Create outcomes for every step and resolve steps reused from a parent run.
     *
     * @throws org.neuralchilli.stepgraph.reexecution.StaleParentArtifactException if a reused
     *                                                                               artifact is gone
     */
    public void start() {
        lock.lock();
        try {
            if (started) {
                throw new IllegalStateException("Run " + runId + " already started");
            }
            ReusedArtifacts.verify(plan, artifactStore);

            for (ExecutionStep step : plan.steps()) {
                record(StepOutcome.pending(step.key(), nextSequence()));
            }
            for (ExecutionStep step : List.copyOf(plan.steps())) {
                if (step.isReused()) {
                    resolveReused(step);
                }
            }
            started = true;
            propagate();

            log.info("Run {} started: {} steps, {} unresolved",
                    runId, plan.stepKeys().size(), plan.unresolvedSteps().size());
        } finally {
            lock.unlock();
        }
    }

    public UUID runId() {
        return runId;
    }

    /**
     * The current plan, including every expansion applied so far.
     */
    public ExecutionPlan plan() {
        return plan;
    }

    /**
     * Settle readiness and return every step currently READY, in plan order.
     * Calling poll again without new results returns the same steps.
     */
    public List<ExecutionStep> poll() {
        lock.lock();
        try {
            requireStarted();
            if (cancelRequested) {
                skipRemaining(SkipReason.CANCELLED, "Run cancelled");
                return List.of();
            }
            propagate();

            List<ExecutionStep> ready = new ArrayList<>();
            for (ExecutionStep step : plan.steps()) {
                if (outcomes.get(step.key()).status() == StepStatus.READY) {
                    ready.add(step);
                }
            }
            return ready;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Record that a READY step was handed to compute.
     *
     * @return false if the step is no longer READY, for instance because the run was cancelled
     */
    public boolean markRunning(String stepKey) {
        lock.lock();
        try {
            StepOutcome current = requireOutcome(stepKey);
            if (current.status() != StepStatus.READY) {
                log.debug("Step {} not dispatched, status is {}", stepKey, current.status());
                return false;
            }
            record(current.running(nextSequence()));
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Build the input bindings a worker needs to execute a READY or RUNNING step.
     */
    public StepDispatch dispatchFor(String stepKey) {
        lock.lock();
        try {
            ExecutionStep step = plan.step(stepKey);
            Map<String, InputBinding> bindings = new LinkedHashMap<>();

            for (StepInput input : step.inputs().values()) {
                StepInputSource source = input.source();
                if (source instanceof StepInputSource.FromStepOutput from) {
                    bindings.put(input.name(), new InputBinding.Artifact(requireHandle(stepKey, from.handle())));
                } else if (source instanceof StepInputSource.FromCollect collect) {
                    List<ArtifactHandle> handles = new ArrayList<>();
                    for (StepOutputHandle handle : collect.handles()) {
                        StepOutcome producer = outcomes.get(handle.stepKey());
                        if (producer != null) {
                            producer.handleFor(handle.outputName(), handle.mappingKey()).ifPresent(handles::add);
                        }
                    }
                    bindings.put(input.name(), new InputBinding.Artifacts(handles));
                } else if (source instanceof StepInputSource.FromValue value) {
                    bindings.put(input.name(), new InputBinding.Value(value.value()));
                }
            }
            return new StepDispatch(runId, step, bindings);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Apply the result of executing a step.
     * Dynamic outputs expand the plan immediately; readiness is then settled again.
     *
     * @return the step's outcome after the result was applied
     * @throws InvalidMappingKeyException if the step reported unusable mapping keys; the step is
     *                                    failed and the run aborted before this is thrown
     */
    public StepOutcome applyOutcome(String stepKey, StepResult result) {
        lock.lock();
        try {
            StepOutcome current = requireOutcome(stepKey);
            if (current.status().isTerminal()) {
                log.warn("Dropping late result for step {} of run {}: already {}", stepKey, runId, current.status());
                return current;
            }
            if (current.status() == StepStatus.PENDING) {
                throw new IllegalStateException("Step " + stepKey + " is not ready, cannot apply a result");
            }

            ExecutionStep step = plan.step(stepKey);
            StepOutcome updated;

            if (!result.success()) {
                updated = current.fail(result.error(), nextSequence());
                log.info("Step {} failed: {}", stepKey, result.error());
            } else {
                String undeclared = undeclaredOutputs(step, result);
                List<String> missing = missingRequiredOutputs(step, result);

                if (undeclared != null) {
                    updated = current.fail(undeclared, nextSequence());
                } else if (!missing.isEmpty() && missingOutputPolicy == MissingOutputPolicy.FAIL_STEP) {
                    updated = current.fail("Required outputs not emitted: " + missing, nextSequence());
                } else {
                    if (!missing.isEmpty()) {
                        log.warn("Step {} did not emit required outputs {}, downstream will be skipped", stepKey, missing);
                    }
                    Map<String, Map<String, ArtifactHandle>> dynamic;
                    try {
                        dynamic = sanitizeDynamicOutputs(stepKey, result.dynamicOutputs());
                    } catch (InvalidMappingKeyException e) {
                        record(current.fail(e.getMessage(), nextSequence()));
                        abort(e.getMessage());
                        throw e;
                    }
                    updated = current.succeed(result.outputs(), dynamic, nextSequence());
                }
            }

            record(updated);
            if (updated.status() == StepStatus.SUCCEEDED) {
                expandDynamicOutputs(step, updated);
            }
            propagate();
            return outcomes.get(stepKey);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Request cancellation. Every non-terminal step is skipped at the next poll; results
     * arriving later are dropped.
     */
    public void cancel() {
        cancelRequested = true;
        log.info("Cancellation requested for run {}", runId);
    }

    public boolean isCancelRequested() {
        return cancelRequested;
    }

    /**
     * True once every step and every unresolved template has a terminal outcome.
     */
    public boolean isComplete() {
        lock.lock();
        try {
            return isCompleteLocked();
        } finally {
            lock.unlock();
        }
    }

    public RunStatus runStatus() {
        lock.lock();
        try {
            if (!isCompleteLocked()) {
                return RunStatus.RUNNING;
            }
            if (aborted) {
                return RunStatus.FAILED;
            }
            boolean cancelled = outcomes.values().stream()
                    .anyMatch(o -> !o.reused() && o.skipReason() == SkipReason.CANCELLED);
            if (cancelRequested && cancelled) {
                return RunStatus.CANCELLED;
            }
            boolean failed = outcomes.values().stream()
                    .filter(o -> !o.reused())
                    .anyMatch(o -> o.status() == StepStatus.FAILED
                            || o.skipReason() == SkipReason.UPSTREAM_FAILURE);
            return failed ? RunStatus.FAILED : RunStatus.SUCCEEDED;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Read-only copy of every outcome recorded so far.
     */
    public Map<String, StepOutcome> snapshot() {
        lock.lock();
        try {
            return Collections.unmodifiableMap(new LinkedHashMap<>(outcomes));
        } finally {
            lock.unlock();
        }
    }

    public Optional<StepOutcome> outcome(String stepKey) {
        lock.lock();
        try {
            return Optional.ofNullable(outcomes.get(stepKey));
        } finally {
            lock.unlock();
        }
    }

    // Readiness

    private record Readiness(boolean ready, SkipReason skipReason, String detail) {
        static final Readiness WAITING = new Readiness(false, null, null);
        static final Readiness READY = new Readiness(true, null, null);
    }

    private void propagate() {
        boolean changed = true;
        while (changed) {
            changed = false;

            for (ExecutionStep step : plan.steps()) {
                StepOutcome current = outcomes.get(step.key());
                if (current.status() != StepStatus.PENDING) {
                    continue;
                }
                Readiness readiness = evaluate(step);
                if (readiness.ready()) {
                    record(current.ready(nextSequence()));
                    changed = true;
                } else if (readiness.skipReason() != null) {
                    record(current.skip(readiness.skipReason(), readiness.detail(), nextSequence()));
                    changed = true;
                }
            }

            for (UnresolvedStep template : plan.unresolvedSteps()) {
                if (outcomes.containsKey(template.key())) {
                    continue;
                }
                StepOutcome producer = outcomes.get(template.awaiting().node());
                if (producer == null || !producer.status().isTerminal()) {
                    continue;
                }
                SkipReason reason = switch (producer.status()) {
                    case FAILED -> SkipReason.UPSTREAM_FAILURE;
                    case SKIPPED -> producer.skipReason().propagated();
                    default -> SkipReason.OUTPUT_NOT_EMITTED;
                };
                record(StepOutcome.skipped(template.key(), reason,
                        "Dynamic output " + template.awaiting() + " was never expanded", nextSequence()));
                changed = true;
            }
        }
    }

    private Readiness evaluate(ExecutionStep step) {
        SkipReason worst = null;
        String detail = null;
        boolean waiting = false;

        for (StepInput input : step.inputs().values()) {
            StepInputSource source = input.source();
            SkipReason reason = null;

            if (source instanceof StepInputSource.FromStepOutput from) {
                StepOutputHandle handle = from.handle();
                StepOutcome producer = outcomes.get(handle.stepKey());
                if (producer == null || !producer.status().isTerminal()) {
                    waiting = true;
                } else if (producer.status() == StepStatus.FAILED) {
                    reason = SkipReason.UPSTREAM_FAILURE;
                } else if (producer.status() == StepStatus.SKIPPED) {
                    reason = producer.skipReason().propagated();
                } else if (producer.handleFor(handle.outputName(), handle.mappingKey()).isEmpty()) {
                    reason = SkipReason.OUTPUT_NOT_EMITTED;
                }
            } else if (source instanceof StepInputSource.FromCollect collect) {
                // Fan-in waits for every instance before deciding
                boolean pendingInstances = false;
                SkipReason collectReason = null;
                for (String producerKey : collect.producerStepKeys()) {
                    StepOutcome producer = outcomes.get(producerKey);
                    if (producer == null || !producer.status().isTerminal()) {
                        pendingInstances = true;
                    } else {
                        collectReason = SkipReason.mostSevere(collectReason, failureOf(producer));
                    }
                }
                if (pendingInstances) {
                    waiting = true;
                } else {
                    reason = collectReason;
                }
            } else if (source instanceof StepInputSource.AfterSteps after) {
                for (String key : after.stepKeys()) {
                    StepOutcome producer = outcomes.get(key);
                    if (producer == null || !producer.status().isTerminal()) {
                        waiting = true;
                    } else {
                        reason = SkipReason.mostSevere(reason, failureOf(producer));
                    }
                }
            }

            if (reason != null && SkipReason.mostSevere(worst, reason) == reason) {
                worst = reason;
                detail = "Input '" + input.name() + "': " + describe(reason);
            }
        }

        if (worst != null) {
            log.debug("Step {} skipped: {}", step.key(), detail);
            return new Readiness(false, worst, detail);
        }
        return waiting ? Readiness.WAITING : Readiness.READY;
    }

    /**
     * Skip reason inherited through inputs that only propagate failures: collect and ordering.
     */
    private static SkipReason failureOf(StepOutcome producer) {
        if (producer.status() == StepStatus.FAILED) {
            return SkipReason.UPSTREAM_FAILURE;
        }
        if (producer.status() == StepStatus.SKIPPED && producer.skipReason().isFailureLike()) {
            return producer.skipReason();
        }
        return null;
    }

    private static String describe(SkipReason reason) {
        return switch (reason) {
            case UPSTREAM_FAILURE -> "upstream step failed";
            case UPSTREAM_SKIPPED -> "upstream step skipped";
            case OUTPUT_NOT_EMITTED -> "upstream output not emitted";
            case CANCELLED -> "run cancelled";
            case RUN_ABORTED -> "run aborted";
        };
    }

    // Results

    private String undeclaredOutputs(ExecutionStep step, StepResult result) {
        for (String name : result.outputs().keySet()) {
            Optional<OutputDefinition> output = step.output(name);
            if (output.isEmpty()) {
                return "Step emitted undeclared output '" + name + "'";
            }
            if (output.get().dynamic()) {
                return "Dynamic output '" + name + "' was emitted without mapping keys";
            }
        }
        for (String name : result.dynamicOutputs().keySet()) {
            Optional<OutputDefinition> output = step.output(name);
            if (output.isEmpty()) {
                return "Step emitted undeclared output '" + name + "'";
            }
            if (!output.get().dynamic()) {
                return "Output '" + name + "' is not dynamic but was emitted with mapping keys";
            }
        }
        return null;
    }

    private List<String> missingRequiredOutputs(ExecutionStep step, StepResult result) {
        List<String> missing = new ArrayList<>();
        for (OutputDefinition output : step.outputs()) {
            if (output.required()
                    && !result.outputs().containsKey(output.name())
                    && !result.dynamicOutputs().containsKey(output.name())) {
                missing.add(output.name());
            }
        }
        return missing;
    }

    private Map<String, Map<String, ArtifactHandle>> sanitizeDynamicOutputs(
            String stepKey, Map<String, Map<String, ArtifactHandle>> reported) {
        Map<String, Map<String, ArtifactHandle>> sanitized = new LinkedHashMap<>();
        reported.forEach((output, instances) -> {
            List<String> raw = new ArrayList<>(instances.keySet());
            List<String> keys = MappingKeys.sanitizeAll(stepKey, output, raw);
            Map<String, ArtifactHandle> byKey = new LinkedHashMap<>();
            for (int i = 0; i < raw.size(); i++) {
                byKey.put(keys.get(i), instances.get(raw.get(i)));
            }
            sanitized.put(output, byKey);
        });
        return sanitized;
    }

    private void expandDynamicOutputs(ExecutionStep step, StepOutcome outcome) {
        for (Map.Entry<String, Map<String, ArtifactHandle>> entry : outcome.dynamicOutputs().entrySet()) {
            String output = entry.getKey();
            if (plan.knownState().keysFor(step.key(), output).isPresent()) {
                continue;
            }
            List<String> keys = new ArrayList<>(entry.getValue().keySet());
            ExecutionPlan expanded = compiler.expand(plan, step.key(), output, keys);

            for (ExecutionStep added : expanded.steps()) {
                if (!outcomes.containsKey(added.key())) {
                    record(StepOutcome.pending(added.key(), nextSequence()));
                }
            }
            plan = expanded;
            log.debug("Run {}: {}.{} mapped over {}", runId, step.key(), output, keys);
        }
    }

    private void resolveReused(ExecutionStep step) {
        StepOutcome current = outcomes.get(step.key());
        StepOutcome parent = plan.reusedOutcomes().get(step.key());
        UUID parentRun = step.source().parentRunId();

        if (parent != null && parent.status() == StepStatus.SUCCEEDED) {
            StepOutcome reused = current.reuse(parent, nextSequence());
            record(reused);
            expandDynamicOutputs(step, reused);
        } else if (parent != null && parent.status() == StepStatus.SKIPPED) {
            record(current.reuseSkip(parent.skipReason(), "Skipped in parent run " + parentRun, nextSequence()));
        } else {
            record(current.reuseSkip(SkipReason.UPSTREAM_FAILURE,
                    "Did not succeed in parent run " + parentRun, nextSequence()));
        }
    }

    // Termination

    private void skipRemaining(SkipReason reason, String detail) {
        for (StepOutcome outcome : List.copyOf(outcomes.values())) {
            if (!outcome.status().isTerminal()) {
                record(outcome.skip(reason, detail, nextSequence()));
            }
        }
        for (UnresolvedStep template : plan.unresolvedSteps()) {
            if (!outcomes.containsKey(template.key())) {
                record(StepOutcome.skipped(template.key(), reason, detail, nextSequence()));
            }
        }
    }

    private void abort(String reason) {
        aborted = true;
        log.error("Run {} aborted: {}", runId, reason);
        skipRemaining(SkipReason.RUN_ABORTED, reason);
    }

    private boolean isCompleteLocked() {
        for (String key : plan.stepKeys()) {
            StepOutcome outcome = outcomes.get(key);
            if (outcome == null || !outcome.status().isTerminal()) {
                return false;
            }
        }
        for (UnresolvedStep template : plan.unresolvedSteps()) {
            StepOutcome outcome = outcomes.get(template.key());
            if (outcome == null || !outcome.status().isTerminal()) {
                return false;
            }
        }
        return true;
    }

    // Bookkeeping

    private void record(StepOutcome outcome) {
        outcomes.put(outcome.stepKey(), outcome);
        log.trace("Run {} #{}: {} -> {}", runId, outcome.sequence(), outcome.stepKey(), outcome.status());
        listener.onEvent(StepEvent.of(runId, outcome));
    }

    private long nextSequence() {
        return ++sequence;
    }

    private StepOutcome requireOutcome(String stepKey) {
        StepOutcome outcome = outcomes.get(stepKey);
        if (outcome == null) {
            throw new IllegalArgumentException("Unknown step for run " + runId + ": " + stepKey);
        }
        return outcome;
    }

    private ArtifactHandle requireHandle(String stepKey, StepOutputHandle handle) {
        StepOutcome producer = outcomes.get(handle.stepKey());
        if (producer == null) {
            throw new IllegalStateException("Input " + handle + " of step " + stepKey + " has no producer outcome");
        }
        return producer.handleFor(handle.outputName(), handle.mappingKey())
                .orElseThrow(() -> new IllegalStateException(
                        "Input " + handle + " of step " + stepKey + " was not emitted"));
    }

    private void requireStarted() {
        if (!started) {
            throw new IllegalStateException("Run " + runId + " has not been started");
        }
    }
}
