package com.platform.driftengine.dto;

import com.platform.driftengine.domain.ConfigIssue;
import com.platform.driftengine.domain.TableRef;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * REST API DTOs. Run results are returned as {@link com.platform.driftengine.domain.DriftRunResult}.
 */
public final class Dtos {

    private Dtos() {}

    // --- Drift DTOs ---

    public record ValidateConfigRequest(String config) {}

    public record ValidationResponse(
            boolean valid, List<ConfigIssue> errors, List<ConfigIssue> warnings,
            int monitorCount, Integer timeTravelDays) {}

    public record RunDriftRequest(
            String tenantId, String datasetId, TableRef table, String config) {}

    // --- Baseline DTOs ---

    public record RefreshBaselineRequest(TableRef table) {}

    public record BaselineResponse(
            String tenantId, String datasetId, long rowCount, List<String> columns,
            Map<String, String> columnTypes, Instant createdAt, Instant updatedAt,
            List<Long> rowCountHistory, List<String> profiledColumns) {}

    public record BaselineListResponse(String tenantId, List<String> datasetIds) {}

    public record DeleteBaselineResponse(String tenantId, String datasetId, boolean deleted) {}

    // --- Snapshot DTOs ---

    public record RegisterSnapshotRequest(
            TableRef table, List<String> columns, Map<String, String> columnTypes,
            List<List<Object>> rows, Instant capturedAt) {}

    public record SnapshotResponse(
            String table, int rowCount, int columnCount, Instant capturedAt, int versions) {}

    // --- Errors ---

    public record ApiError(
            int status, String code, String message, List<ConfigIssue> issues, Instant timestamp) {}
}
