package org.neuralchilli.stepgraph.storage;

import com.hazelcast.collection.IList;
import com.hazelcast.core.HazelcastInstance;
import com.hazelcast.map.IMap;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.stepgraph.run.RunRecord;
import org.neuralchilli.stepgraph.run.StepEvent;
import org.neuralchilli.stepgraph.spi.RunStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Run storage backed by Hazelcast: one map of run records and one list of step events per run.
 */
@ApplicationScoped
public class HazelcastRunStorage implements RunStorage {

    private static final Logger log = LoggerFactory.getLogger(HazelcastRunStorage.class);

    @Inject
    HazelcastInstance hazelcast;

    private IMap<UUID, RunRecord> runs;

    @PostConstruct
    void init() {
        runs = hazelcast.getMap("runs");
        log.info("HazelcastRunStorage initialized");
    }

    @Override
    public void createRun(RunRecord record) {
        RunRecord existing = runs.putIfAbsent(record.runId(), record);
        if (existing != null) {
            throw new IllegalStateException("Run already exists: " + record.runId());
        }
        log.debug("Created run {} of graph '{}'", record.runId(), record.graphName());
    }

    @Override
    public void updateRun(RunRecord record) {
        runs.lock(record.runId());
        try {
            RunRecord current = runs.get(record.runId());
            if (current == null) {
                throw new IllegalArgumentException("Run not found: " + record.runId());
            }
            if (current.isFinished()) {
                throw new IllegalStateException(
                        "Run " + record.runId() + " already finished as " + current.status());
            }
            runs.set(record.runId(), record);
            log.debug("Updated run {}: {}", record.runId(), record.status());
        } finally {
            runs.unlock(record.runId());
        }
    }

    @Override
    public Optional<RunRecord> getRun(UUID runId) {
        return Optional.ofNullable(runs.get(runId));
    }

    @Override
    public void appendEvent(StepEvent event) {
        eventLog(event.runId()).add(event);
    }

    @Override
    public List<StepEvent> events(UUID runId) {
        List<StepEvent> events = new ArrayList<>(eventLog(runId));
        events.sort(Comparator.comparingLong(StepEvent::sequence));
        return events;
    }

    /**
     * Runs derived, directly or transitively, from the given root run.
     */
    public List<RunRecord> lineage(UUID rootRunId) {
        List<RunRecord> derived = new ArrayList<>();
        for (RunRecord record : runs.values()) {
            if (rootRunId.equals(record.rootRunId())) {
                derived.add(record);
            }
        }
        derived.sort(Comparator.comparing(RunRecord::startedAt));
        return derived;
    }

    private IList<StepEvent> eventLog(UUID runId) {
        return hazelcast.getList("step-events-" + runId);
    }
}
