package com.platform.driftengine.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.*;

/**
 * Bounded tabular sample of a table at a point in time.
 * <p>
 * Rows are positional: {@code rows.get(r).get(c)} is the value of
 * {@code columns.get(c)}. Values may be null.
 */
public record DatasetSnapshot(
        List<String> columns,
        @JsonProperty("column_types") Map<String, String> columnTypes,
        List<List<Object>> rows,
        @JsonProperty("captured_at") Instant capturedAt,
        SnapshotSource source
) {
    private static final List<String> NUMERIC_TYPE_MARKERS = List.of(
            "int", "float", "double", "number", "numeric", "decimal", "real", "long", "short");

    public DatasetSnapshot {
        columns = List.copyOf(columns);
        Map<String, String> types = new LinkedHashMap<>();
        for (String column : columns) {
            types.put(column, columnTypes != null ? columnTypes.getOrDefault(column, "unknown") : "unknown");
        }
        columnTypes = Collections.unmodifiableMap(types);

        List<List<Object>> copied = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            List<Object> row = rows.get(i);
            if (row.size() != columns.size()) {
                throw new IllegalArgumentException("Row " + i + " has " + row.size()
                        + " values, expected " + columns.size());
            }
            copied.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        rows = Collections.unmodifiableList(copied);
        capturedAt = capturedAt != null ? capturedAt : Instant.now();
        source = source != null ? source : SnapshotSource.CURRENT;
    }

    public static DatasetSnapshot of(Map<String, String> schema, List<List<Object>> rows) {
        return new DatasetSnapshot(new ArrayList<>(schema.keySet()), schema, rows, Instant.now(), SnapshotSource.CURRENT);
    }

    @JsonIgnore
    public int rowCount() {
        return rows.size();
    }

    @JsonIgnore
    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public boolean hasColumn(String column) {
        return columnTypes.containsKey(column);
    }

    /**
     * Column name to declared type, in column order.
     */
    @JsonIgnore
    public Map<String, String> schema() {
        return columnTypes;
    }

    public List<Object> columnValues(String column) {
        int idx = columns.indexOf(column);
        if (idx < 0) {
            throw new NoSuchElementException("Column not in snapshot: " + column);
        }
        List<Object> values = new ArrayList<>(rows.size());
        for (List<Object> row : rows) {
            values.add(row.get(idx));
        }
        return values;
    }

    /**
     * A column is numeric when its declared type says so, or when it has no
     * usable declared type and every non-null value is a {@link Number}.
     */
    public boolean isNumeric(String column) {
        String type = columnTypes.getOrDefault(column, "unknown").toLowerCase(Locale.ROOT);
        for (String marker : NUMERIC_TYPE_MARKERS) {
            if (type.contains(marker)) {
                return true;
            }
        }
        if (!type.equals("unknown") && !type.isBlank()) {
            return false;
        }
        boolean sawValue = false;
        for (Object v : columnValues(column)) {
            if (v == null) continue;
            if (!(v instanceof Number)) return false;
            sawValue = true;
        }
        return sawValue;
    }

    public DatasetSnapshot limit(int maxRows) {
        if (rows.size() <= maxRows) {
            return this;
        }
        return new DatasetSnapshot(columns, columnTypes, rows.subList(0, maxRows), capturedAt, source);
    }

    public DatasetSnapshot withSource(SnapshotSource newSource) {
        return new DatasetSnapshot(columns, columnTypes, rows, capturedAt, newSource);
    }

    /**
     * Same columns, no rows. Returned when a historical version does not exist.
     */
    public DatasetSnapshot emptyCopy(SnapshotSource newSource) {
        return new DatasetSnapshot(columns, columnTypes, List.of(), capturedAt, newSource);
    }
}
