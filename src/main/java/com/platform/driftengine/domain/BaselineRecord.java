package com.platform.driftengine.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.*;

/**
 * The single live baseline of a (tenant, dataset) pair.
 * <p>
 * {@code columns} and {@code columnTypes} always describe {@code snapshot}.
 * {@code columnProfiles} may additionally hold columns established after the
 * snapshot was taken.
 */
public record BaselineRecord(
        @JsonProperty("tenant_id") String tenantId,
        @JsonProperty("dataset_id") String datasetId,
        DatasetSnapshot snapshot,
        @JsonProperty("row_count") long rowCount,
        List<String> columns,
        @JsonProperty("column_types") Map<String, String> columnTypes,
        @JsonProperty("created_at") Instant createdAt,
        @JsonProperty("updated_at") Instant updatedAt,
        @JsonProperty("row_count_history") List<Long> rowCountHistory,
        @JsonProperty("column_profiles") Map<String, ColumnProfile> columnProfiles
) {
    public BaselineRecord {
        Objects.requireNonNull(snapshot, "snapshot");
        if (!snapshot.columns().equals(columns)) {
            throw new IllegalArgumentException("Baseline columns " + columns
                    + " do not match snapshot columns " + snapshot.columns());
        }
        columns = List.copyOf(columns);
        columnTypes = Collections.unmodifiableMap(new LinkedHashMap<>(columnTypes));
        rowCountHistory = List.copyOf(rowCountHistory);
        columnProfiles = Collections.unmodifiableMap(new LinkedHashMap<>(columnProfiles));
    }

    /**
     * Build a fresh baseline from a snapshot, profiling every column.
     */
    public static BaselineRecord establish(String tenantId, String datasetId,
                                           DatasetSnapshot snapshot, Instant now) {
        Map<String, ColumnProfile> profiles = new LinkedHashMap<>();
        for (String column : snapshot.columns()) {
            profiles.put(column, ColumnProfile.fromSnapshot(snapshot, column, now));
        }
        return new BaselineRecord(tenantId, datasetId, snapshot, snapshot.rowCount(),
                snapshot.columns(), snapshot.columnTypes(), now, now,
                List.of((long) snapshot.rowCount()), profiles);
    }

    public Optional<ColumnProfile> profile(String column) {
        return Optional.ofNullable(columnProfiles.get(column));
    }

    /**
     * Append a row count to the rolling history, evicting the oldest entries
     * beyond {@code maxEntries}.
     */
    public BaselineRecord withRowCountObserved(long count, int maxEntries, Instant now) {
        List<Long> history = new ArrayList<>(rowCountHistory);
        history.add(count);
        if (history.size() > maxEntries) {
            history = history.subList(history.size() - maxEntries, history.size());
        }
        return new BaselineRecord(tenantId, datasetId, snapshot, rowCount, columns, columnTypes,
                createdAt, now, history, columnProfiles);
    }

    public BaselineRecord withProfiles(Collection<ColumnProfile> added, Instant now) {
        Map<String, ColumnProfile> merged = new LinkedHashMap<>(columnProfiles);
        for (ColumnProfile profile : added) {
            merged.putIfAbsent(profile.column(), profile);
        }
        return new BaselineRecord(tenantId, datasetId, snapshot, rowCount, columns, columnTypes,
                createdAt, now, rowCountHistory, merged);
    }

    @JsonIgnore
    public String key() {
        return tenantId + "/" + datasetId;
    }
}
