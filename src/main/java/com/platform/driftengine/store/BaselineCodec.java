package com.platform.driftengine.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.platform.driftengine.domain.BaselineRecord;

import java.io.IOException;
import java.util.Iterator;

/**
 * JSON encoding of {@link BaselineRecord} shared by RocksDB and Redis.
 * <p>
 * A column profile whose values are exactly the snapshot's column is written
 * without {@code values}; decoding restores them from {@code snapshot.rows}.
 * Profiles established from later snapshots keep their own values.
 */
public final class BaselineCodec {

    static final String PROFILES = "column_profiles";
    static final String VALUES = "values";

    private static final ObjectMapper mapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private BaselineCodec() {}

    public static byte[] encode(BaselineRecord record) throws JsonProcessingException {
        ObjectNode tree = mapper.valueToTree(record);
        JsonNode snapshot = tree.path("snapshot");
        for (Iterator<JsonNode> it = tree.path(PROFILES).elements(); it.hasNext(); ) {
            ObjectNode profile = (ObjectNode) it.next();
            ArrayNode fromSnapshot = snapshotColumn(snapshot, profile.path("column").asText());
            if (fromSnapshot != null && fromSnapshot.equals(profile.get(VALUES))) {
                profile.remove(VALUES);
            }
        }
        return mapper.writeValueAsBytes(tree);
    }

    public static BaselineRecord decode(byte[] raw) throws IOException {
        JsonNode tree = mapper.readTree(raw);
        JsonNode snapshot = tree.path("snapshot");
        for (Iterator<JsonNode> it = tree.path(PROFILES).elements(); it.hasNext(); ) {
            ObjectNode profile = (ObjectNode) it.next();
            if (profile.has(VALUES)) continue;
            String column = profile.path("column").asText();
            ArrayNode fromSnapshot = snapshotColumn(snapshot, column);
            if (fromSnapshot == null) {
                throw new IOException("Profile " + column + " has no values and no snapshot column");
            }
            profile.set(VALUES, fromSnapshot);
        }
        return mapper.treeToValue(tree, BaselineRecord.class);
    }

    private static ArrayNode snapshotColumn(JsonNode snapshot, String column) {
        JsonNode columns = snapshot.path("columns");
        int index = -1;
        for (int i = 0; i < columns.size(); i++) {
            if (columns.get(i).asText().equals(column)) {
                index = i;
                break;
            }
        }
        if (index < 0) {
            return null;
        }
        ArrayNode values = mapper.createArrayNode();
        for (JsonNode row : snapshot.path("rows")) {
            values.add(row.get(index));
        }
        return values;
    }
}
