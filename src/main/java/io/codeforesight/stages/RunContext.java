package io.codeforesight.stages;

import io.codeforesight.model.Finding;
import io.codeforesight.model.Stage;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Per-run state: run id, start time and the finding id sequence of each stage.
 * Created for one run and never shared with another.
 */
public final class RunContext {

    private final String runId;
    private final Instant startTime;
    private final Map<Stage, AtomicInteger> sequences = new EnumMap<>(Stage.class);

    public RunContext() {
        this(UUID.randomUUID().toString(), Instant.now());
    }

    public RunContext(String runId, Instant startTime) {
        this.runId = runId;
        this.startTime = startTime;
        for (Stage stage : Stage.values()) {
            sequences.put(stage, new AtomicInteger());
        }
    }

    public String runId() {
        return runId;
    }

    public Instant startTime() {
        return startTime;
    }

    /**
     * Next finding id of the stage ("S1-0001", "S1-0002", ...).
     */
    public String nextId(Stage stage) {
        return String.format("%s-%04d", stage.idPrefix(), sequences.get(stage).incrementAndGet());
    }

    /**
     * Sorts findings into report order and assigns ids in that order, so identical input
     * yields identical ids however the findings were produced.
     */
    public List<Finding> assignIds(Stage stage, List<Finding> findings) {
        List<Finding> sorted = new ArrayList<>(findings);
        sorted.sort(Finding.REPORT_ORDER);
        List<Finding> result = new ArrayList<>(sorted.size());
        for (Finding f : sorted) {
            result.add(f.withId(nextId(stage)));
        }
        return result;
    }
}
