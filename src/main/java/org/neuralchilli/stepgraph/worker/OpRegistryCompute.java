package org.neuralchilli.stepgraph.worker;

import io.quarkus.arc.DefaultBean;
import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.stepgraph.spi.ComputeCollaborator;
import org.neuralchilli.stepgraph.spi.ComputeResult;
import org.neuralchilli.stepgraph.spi.StepExecutionException;
import org.neuralchilli.stepgraph.spi.StepInvocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-process compute: op bodies registered by op definition name.
 * Used unless the application provides its own {@link ComputeCollaborator}.
 */
@ApplicationScoped
@DefaultBean
public class OpRegistryCompute implements ComputeCollaborator {

    private static final Logger log = LoggerFactory.getLogger(OpRegistryCompute.class);

    private final Map<String, OpCompute> ops = new ConcurrentHashMap<>();
    private final Set<String> cancelled = ConcurrentHashMap.newKeySet();

    public void register(String opName, OpCompute compute) {
        if (opName == null || opName.isBlank()) {
            throw new IllegalArgumentException("Op name cannot be null or empty");
        }
        if (compute == null) {
            throw new IllegalArgumentException("Compute for op '" + opName + "' cannot be null");
        }
        OpCompute previous = ops.put(opName, compute);
        if (previous != null) {
            log.info("Replaced compute for op '{}'", opName);
        } else {
            log.debug("Registered compute for op '{}'", opName);
        }
    }

    public boolean isRegistered(String opName) {
        return ops.containsKey(opName);
    }

    public void clear() {
        ops.clear();
        cancelled.clear();
    }

    @Override
    public ComputeResult execute(StepInvocation invocation) {
        OpCompute compute = ops.get(invocation.opName());
        if (compute == null) {
            return ComputeResult.failure("No compute registered for op '" + invocation.opName() + "'");
        }
        try {
            return compute.compute(invocation);
        } catch (RuntimeException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new StepExecutionException("Step " + invocation.stepKey() + " interrupted", e);
        } catch (Exception e) {
            throw new StepExecutionException(e.getMessage(), e);
        } finally {
            cancelled.remove(signalKey(invocation.runId(), invocation.stepKey()));
        }
    }

    /**
     * Ops can poll this to stop early once their run is cancelled.
     */
    public boolean isCancelled(UUID runId, String stepKey) {
        return cancelled.contains(signalKey(runId, stepKey));
    }

    @Override
    public void cancel(UUID runId, String stepKey) {
        cancelled.add(signalKey(runId, stepKey));
        log.debug("Cancellation signalled to step {} of run {}", stepKey, runId);
    }

    private static String signalKey(UUID runId, String stepKey) {
        return runId + "/" + stepKey;
    }
}
