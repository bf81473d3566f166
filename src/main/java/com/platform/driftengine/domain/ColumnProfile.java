package com.platform.driftengine.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.*;

/**
 * Baseline summary of one column: declared type, the sampled values the
 * column tests compare against, and a few counts for display.
 */
public record ColumnProfile(
        String column,
        String type,
        boolean numeric,
        List<Object> values,
        @JsonProperty("null_count") long nullCount,
        @JsonProperty("distinct_count") long distinctCount,
        @JsonProperty("established_at") Instant establishedAt
) {
    public ColumnProfile {
        values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    public static ColumnProfile fromSnapshot(DatasetSnapshot snapshot, String column, Instant now) {
        List<Object> values = snapshot.columnValues(column);
        long nulls = values.stream().filter(Objects::isNull).count();
        long distinct = values.stream().filter(Objects::nonNull).map(String::valueOf).distinct().count();
        return new ColumnProfile(column, snapshot.columnTypes().get(column), snapshot.isNumeric(column),
                values, nulls, distinct, now);
    }
}
