package com.platform.driftengine.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.platform.driftengine.TestSnapshots;
import com.platform.driftengine.domain.BaselineRecord;
import com.platform.driftengine.domain.ColumnProfile;
import com.platform.driftengine.domain.DatasetSnapshot;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.*;

import static org.junit.jupiter.api.Assertions.*;

class BaselineCodecTest {

    private final ObjectMapper json = new ObjectMapper();

    @Test
    void testSnapshotValuesStoredOnce() throws Exception {
        BaselineRecord record = BaselineRecord.establish("t1", "orders", TestSnapshots.orders(200, 80), Instant.now());

        JsonNode tree = json.readTree(BaselineCodec.encode(record));

        assertEquals(200, tree.path("snapshot").path("rows").size());
        for (JsonNode profile : tree.path(BaselineCodec.PROFILES)) {
            assertFalse(profile.has(BaselineCodec.VALUES), profile.path("column").asText());
        }
    }

    @Test
    void testDecodeRestoresProfileValues() throws Exception {
        DatasetSnapshot snapshot = TestSnapshots.orders(50, 20);
        BaselineRecord record = BaselineRecord.establish("t1", "orders", snapshot, Instant.now());

        BaselineRecord decoded = BaselineCodec.decode(BaselineCodec.encode(record));

        for (String column : snapshot.columns()) {
            assertEquals(snapshot.columnValues(column), decoded.profile(column).orElseThrow().values(), column);
        }
        assertEquals(record.profile("STATUS").orElseThrow().distinctCount(),
                decoded.profile("STATUS").orElseThrow().distinctCount());
    }

    @Test
    void testLaterProfileKeepsOwnValues() throws Exception {
        BaselineRecord record = BaselineRecord.establish("t1", "orders", TestSnapshots.orders(30, 10), Instant.now());
        Map<String, String> schema = new LinkedHashMap<>();
        schema.put("ID", "int");
        schema.put("REGION", "string");
        DatasetSnapshot later = DatasetSnapshot.of(schema, List.of(
                Arrays.asList(1, "eu"), Arrays.asList(2, "us"), Arrays.asList(3, null)));
        record = record.withProfiles(List.of(ColumnProfile.fromSnapshot(later, "REGION", Instant.now())), Instant.now());

        byte[] raw = BaselineCodec.encode(record);
        JsonNode tree = json.readTree(raw);
        BaselineRecord decoded = BaselineCodec.decode(raw);

        assertTrue(tree.path(BaselineCodec.PROFILES).path("REGION").has(BaselineCodec.VALUES));
        assertEquals(Arrays.asList("eu", "us", null), decoded.profile("REGION").orElseThrow().values());
    }
}
