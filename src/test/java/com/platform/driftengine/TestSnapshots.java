package com.platform.driftengine;

import com.platform.driftengine.domain.DatasetSnapshot;
import com.platform.driftengine.domain.SnapshotSource;

import java.time.Instant;
import java.util.*;

/**
 * Snapshot fixtures for tests.
 */
public final class TestSnapshots {

    private TestSnapshots() {}

    /**
     * {@code orders} table: ID (int), STATUS (string), AMOUNT (double).
     * STATUS is "A" for the first {@code statusA} rows and "B" after that.
     */
    public static DatasetSnapshot orders(int rows, int statusA) {
        Map<String, String> schema = new LinkedHashMap<>();
        schema.put("ID", "int");
        schema.put("STATUS", "string");
        schema.put("AMOUNT", "double");
        List<List<Object>> data = new ArrayList<>();
        for (int i = 0; i < rows; i++) {
            data.add(Arrays.asList(i, i < statusA ? "A" : "B", (double) (i % 50)));
        }
        return DatasetSnapshot.of(schema, data);
    }

    public static DatasetSnapshot withSchema(Map<String, String> schema, int rows) {
        List<List<Object>> data = new ArrayList<>();
        for (int i = 0; i < rows; i++) {
            List<Object> row = new ArrayList<>();
            for (String type : schema.values()) {
                row.add(type.contains("int") ? (Object) i : "v" + (i % 3));
            }
            data.add(row);
        }
        return DatasetSnapshot.of(schema, data);
    }

    public static DatasetSnapshot capturedAt(DatasetSnapshot snapshot, Instant capturedAt) {
        return new DatasetSnapshot(snapshot.columns(), snapshot.columnTypes(), snapshot.rows(),
                capturedAt, SnapshotSource.CURRENT);
    }
}
