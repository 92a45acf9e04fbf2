package org.neuralchilli.stepgraph.worker;

import io.quarkus.runtime.ShutdownEvent;
import io.quarkus.runtime.StartupEvent;
import io.vertx.mutiny.core.eventbus.EventBus;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.neuralchilli.stepgraph.config.EngineConfig;
import org.neuralchilli.stepgraph.scheduler.StepDispatch;
import org.neuralchilli.stepgraph.scheduler.StepResult;
import org.neuralchilli.stepgraph.spi.ComputeCollaborator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded pool of worker threads executing dispatched steps.
 * Each finished step is published on the event bus as a {@link StepCompletionEvent}.
 */
@ApplicationScoped
public class WorkerPool {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    public static final String STEP_COMPLETED = "step.completed";

    @Inject
    StepExecutor stepExecutor;

    @Inject
    ComputeCollaborator compute;

    @Inject
    EventBus eventBus;

    @Inject
    EngineConfig config;

    private final Map<String, StepDispatch> inFlight = new ConcurrentHashMap<>();
    private ExecutorService executorService;
    private volatile boolean running = false;
    private int workerThreads;

    void onStart(@Observes StartupEvent event) {
        if (config.testMode()) {
            log.info("Test mode: steps execute inline, worker pool not started");
            return;
        }
        start(config.worker().threads());
    }

    void onStop(@Observes ShutdownEvent event) {
        stop();
    }

    public synchronized void start(int threads) {
        if (running) {
            log.warn("Worker pool already running");
            return;
        }
        if (threads < 1) {
            throw new IllegalArgumentException("Worker threads must be at least 1, got " + threads);
        }

        this.workerThreads = threads;
        this.executorService = Executors.newFixedThreadPool(threads, new WorkerThreadFactory(config.worker().id()));
        this.running = true;

        log.info("Worker pool started: {} threads, worker ID: {}", threads, config.worker().id());
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Queue a step for execution. Its completion is published on {@value #STEP_COMPLETED}.
     */
    public void submit(StepDispatch dispatch) {
        if (!running) {
            throw new IllegalStateException("Worker pool is not running");
        }
        String key = inFlightKey(dispatch.runId(), dispatch.step().key());
        inFlight.put(key, dispatch);
        try {
            executorService.submit(() -> executeWork(dispatch));
        } catch (RejectedExecutionException e) {
            inFlight.remove(key);
            throw new IllegalStateException("Worker pool rejected step " + dispatch.step().key(), e);
        }
    }

    /**
     * Execute a step on the calling thread.
     */
    public StepResult executeInline(StepDispatch dispatch) {
        return stepExecutor.execute(dispatch);
    }

    /**
     * Signal cancellation to every in-flight step of a run. Running compute is not interrupted.
     */
    public void cancel(UUID runId) {
        inFlight.values().stream()
                .filter(dispatch -> dispatch.runId().equals(runId))
                .forEach(dispatch -> {
                    log.debug("Signalling cancellation to step {} of run {}", dispatch.step().key(), runId);
                    compute.cancel(runId, dispatch.step().key());
                });
    }

    private void executeWork(StepDispatch dispatch) {
        String threadName = Thread.currentThread().getName();
        String stepKey = dispatch.step().key();
        log.info("[{}] Executing: {}", threadName, stepKey);

        Instant start = Instant.now();
        StepResult result;
        try {
            result = stepExecutor.execute(dispatch);
        } catch (Exception e) {
            log.error("[{}] Exception executing step: {}", threadName, stepKey, e);
            result = StepResult.failure("Exception: " + e.getMessage());
        } finally {
            inFlight.remove(inFlightKey(dispatch.runId(), stepKey));
        }

        Duration duration = Duration.between(start, Instant.now());
        if (result.success()) {
            log.info("[{}] Completed: {} ({}ms)", threadName, stepKey, duration.toMillis());
        } else {
            log.error("[{}] Failed: {} - {}", threadName, stepKey, result.error());
        }
        eventBus.publish(STEP_COMPLETED, StepCompletionEvent.of(dispatch.runId(), stepKey, result));
    }

    /**
     * Stop the worker pool gracefully.
     * Allows in-flight steps to complete.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }

        log.info("Stopping worker pool gracefully...");
        running = false;

        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(60, TimeUnit.SECONDS)) {
                log.warn("Worker pool did not terminate in 60 seconds, forcing shutdown");
                executorService.shutdownNow();
                if (!executorService.awaitTermination(10, TimeUnit.SECONDS)) {
                    log.error("Worker pool did not terminate after forced shutdown");
                }
            }
        } catch (InterruptedException e) {
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }

        log.info("Worker pool stopped");
    }

    public WorkerPoolStats getStats() {
        return new WorkerPoolStats(workerThreads, inFlight.size(), running);
    }

    private static String inFlightKey(UUID runId, String stepKey) {
        return runId + "/" + stepKey;
    }

    /**
     * Thread factory for creating named worker threads.
     */
    private static class WorkerThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger(0);
        private final String workerId;

        WorkerThreadFactory(String workerId) {
            this.workerId = workerId;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r);
            t.setName(workerId + "-thread-" + counter.incrementAndGet());
            t.setDaemon(false);
            return t;
        }
    }

    public record WorkerPoolStats(
            int totalThreads,
            int inFlightSteps,
            boolean running
    ) {
        public double utilization() {
            return totalThreads > 0 ? Math.min(1.0, (double) inFlightSteps / totalThreads) : 0.0;
        }
    }
}
