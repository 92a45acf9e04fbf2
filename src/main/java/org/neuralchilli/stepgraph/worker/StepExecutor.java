package org.neuralchilli.stepgraph.worker;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.stepgraph.plan.ExecutionStep;
import org.neuralchilli.stepgraph.run.ArtifactHandle;
import org.neuralchilli.stepgraph.scheduler.InputBinding;
import org.neuralchilli.stepgraph.scheduler.StepDispatch;
import org.neuralchilli.stepgraph.scheduler.StepResult;
import org.neuralchilli.stepgraph.spi.ArtifactStore;
import org.neuralchilli.stepgraph.spi.ComputeCollaborator;
import org.neuralchilli.stepgraph.spi.ComputeResult;
import org.neuralchilli.stepgraph.spi.StepExecutionException;
import org.neuralchilli.stepgraph.spi.StepInvocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Executes one dispatched step: loads its inputs, calls compute, stores what compute emitted.
 * Every failure along the way becomes a failed {@link StepResult}; nothing is thrown.
 */
@ApplicationScoped
public class StepExecutor {

    private static final Logger log = LoggerFactory.getLogger(StepExecutor.class);

    @Inject
    ComputeCollaborator compute;

    @Inject
    ArtifactStore artifactStore;

    public StepResult execute(StepDispatch dispatch) {
        ExecutionStep step = dispatch.step();

        Map<String, Object> inputs;
        try {
            inputs = loadInputs(dispatch);
        } catch (RuntimeException e) {
            log.error("Failed to load inputs of step {}", step.key(), e);
            return StepResult.failure("Failed to load inputs: " + e.getMessage());
        }

        StepInvocation invocation = new StepInvocation(
                dispatch.runId(),
                step.key(),
                step.handle(),
                step.opName(),
                step.mappingKey(),
                inputs,
                step.tags()
        );

        ComputeResult result;
        try {
            result = compute.execute(invocation);
        } catch (StepExecutionException e) {
            log.warn("Step {} failed: {}", step.key(), e.getMessage());
            return StepResult.failure(e.getMessage());
        } catch (Exception e) {
            log.error("Exception executing step {}", step.key(), e);
            return StepResult.failure(e.getClass().getSimpleName() + ": " + e.getMessage());
        }

        if (result == null) {
            return StepResult.failure("Compute returned no result for step " + step.key());
        }
        if (!result.isSuccess()) {
            return StepResult.failure(result.error() != null ? result.error() : "Step reported failure");
        }

        try {
            return storeOutputs(dispatch, result);
        } catch (RuntimeException e) {
            log.error("Failed to store outputs of step {}", step.key(), e);
            return StepResult.failure("Failed to store outputs: " + e.getMessage());
        }
    }

    private Map<String, Object> loadInputs(StepDispatch dispatch) {
        Map<String, Object> inputs = new LinkedHashMap<>();
        dispatch.inputs().forEach((name, binding) -> {
            if (binding instanceof InputBinding.Artifact artifact) {
                inputs.put(name, artifactStore.load(artifact.handle()));
            } else if (binding instanceof InputBinding.Artifacts artifacts) {
                List<Object> values = new ArrayList<>();
                for (ArtifactHandle handle : artifacts.handles()) {
                    values.add(artifactStore.load(handle));
                }
                inputs.put(name, values);
            } else if (binding instanceof InputBinding.Value value) {
                inputs.put(name, value.value());
            }
        });
        return inputs;
    }

    private StepResult storeOutputs(StepDispatch dispatch, ComputeResult result) {
        String stepKey = dispatch.step().key();

        Map<String, ArtifactHandle> outputs = new LinkedHashMap<>();
        result.outputs().forEach((name, value) ->
                outputs.put(name, artifactStore.store(dispatch.runId(), stepKey, name, null, value)));

        Map<String, Map<String, ArtifactHandle>> dynamic = new LinkedHashMap<>();
        result.dynamicOutputs().forEach((name, instances) -> {
            Map<String, ArtifactHandle> handles = new LinkedHashMap<>();
            instances.forEach((key, value) ->
                    handles.put(key, artifactStore.store(dispatch.runId(), stepKey, name, key, value)));
            dynamic.put(name, handles);
        });

        log.debug("Step {} emitted {} outputs and {} dynamic outputs", stepKey, outputs.size(), dynamic.size());
        return StepResult.success(outputs, dynamic);
    }
}
