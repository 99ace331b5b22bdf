package io.dhtprobe.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.dhtprobe.error.CorruptStoreException;
import io.dhtprobe.model.ProbeRecord;
import io.dhtprobe.util.Jsons;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * JSON document form of the store: one object mapping record key to record.
 */
final class ProbeRecordCodec {
    private ProbeRecordCodec() {
    }

    static LinkedHashMap<String, ProbeRecord> decode(String json, String location) {
        LinkedHashMap<String, ProbeRecord> out = new LinkedHashMap<>();
        if (json == null || json.isBlank()) {
            return out;
        }
        JsonNode root;
        try {
            root = Jsons.mapper().readTree(json);
        } catch (JsonProcessingException e) {
            throw new CorruptStoreException("Probe store is not valid JSON: " + location, e);
        }
        if (root == null || !root.isObject()) {
            throw new CorruptStoreException("Probe store must be a JSON object keyed by record key: " + location);
        }
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> entry = fields.next();
            JsonNode value = entry.getValue();
            if (value == null || !value.isObject()) {
                throw new CorruptStoreException("Probe store entry is not an object: " + entry.getKey());
            }
            ObjectNode withKey = ((ObjectNode) value).deepCopy();
            if (!withKey.hasNonNull("record_key")) {
                withKey.put("record_key", entry.getKey());
            }
            ProbeRecord record;
            try {
                record = Jsons.mapper().treeToValue(withKey, ProbeRecord.class);
            } catch (JsonProcessingException | IllegalArgumentException e) {
                throw new CorruptStoreException("Probe store entry is invalid: " + entry.getKey(), e);
            }
            if (!entry.getKey().equals(record.recordKey())) {
                throw new CorruptStoreException("Probe store entry key " + entry.getKey()
                        + " does not match record_key " + record.recordKey());
            }
            out.put(entry.getKey(), record);
        }
        return out;
    }

    static String encode(Map<String, ProbeRecord> records) {
        return Jsons.toJson(new TreeMap<>(records));
    }
}
