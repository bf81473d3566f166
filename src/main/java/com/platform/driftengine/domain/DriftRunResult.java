package com.platform.driftengine.domain;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * Aggregate outcome of one drift run.
 * <p>
 * Lifecycle: {@code pending -> running -> completed | failed}, or
 * {@code pending -> failed} when the run aborts before it starts. A completed
 * run may still carry an {@code error} for a problem after its last monitor.
 * Monitor counts are derived from {@link #getResults()} on every read.
 */
@JsonPropertyOrder({"run_id", "dataset_id", "started_at", "completed_at", "status",
        "total_monitors", "drift_detected_count", "error", "results"})
public class DriftRunResult {

    private final UUID runId;
    private final String datasetId;
    private final Instant startedAt;
    private final List<DriftResult> results = new ArrayList<>();
    private Instant completedAt;
    private RunStatus status = RunStatus.PENDING;
    private String error;

    public DriftRunResult(UUID runId, String datasetId, Instant startedAt) {
        this.runId = runId;
        this.datasetId = datasetId;
        this.startedAt = startedAt;
    }

    public static DriftRunResult start(String datasetId) {
        return new DriftRunResult(UUID.randomUUID(), datasetId, Instant.now());
    }

    public synchronized void markRunning() {
        requireStatus(RunStatus.PENDING, RunStatus.RUNNING);
        status = RunStatus.RUNNING;
    }

    public synchronized void addResult(DriftResult result) {
        if (status != RunStatus.RUNNING) {
            throw new IllegalStateException("Cannot add results to a " + status.label() + " run");
        }
        results.add(result);
    }

    public synchronized void complete() {
        requireStatus(RunStatus.RUNNING, RunStatus.COMPLETED);
        status = RunStatus.COMPLETED;
        completedAt = Instant.now();
    }

    /**
     * Complete a run whose results all stand, recording a problem that came
     * after the last monitor (a baseline that could not be written).
     */
    public synchronized void completeWithError(String problem) {
        requireStatus(RunStatus.RUNNING, RunStatus.COMPLETED);
        status = RunStatus.COMPLETED;
        error = problem;
        completedAt = Instant.now();
    }

    public synchronized void fail(String reason) {
        if (status.isTerminal()) {
            throw new IllegalStateException("Run " + runId + " already " + status.label());
        }
        status = RunStatus.FAILED;
        error = reason;
        completedAt = Instant.now();
    }

    private void requireStatus(RunStatus expected, RunStatus target) {
        if (status != expected) {
            throw new IllegalStateException("Illegal transition " + status.label() + " -> " + target.label()
                    + " for run " + runId);
        }
    }

    @JsonProperty("run_id")
    public UUID getRunId() { return runId; }

    @JsonProperty("dataset_id")
    public String getDatasetId() { return datasetId; }

    @JsonProperty("started_at")
    public Instant getStartedAt() { return startedAt; }

    @JsonProperty("completed_at")
    public synchronized Instant getCompletedAt() { return completedAt; }

    public synchronized RunStatus getStatus() { return status; }

    public synchronized String getError() { return error; }

    public synchronized List<DriftResult> getResults() {
        return Collections.unmodifiableList(new ArrayList<>(results));
    }

    @JsonProperty("total_monitors")
    public synchronized int getTotalMonitors() {
        return results.size();
    }

    @JsonProperty("drift_detected_count")
    public synchronized int getDriftDetectedCount() {
        return (int) results.stream().filter(DriftResult::detected).count();
    }
}
