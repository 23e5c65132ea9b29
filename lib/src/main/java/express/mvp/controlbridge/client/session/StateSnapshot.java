package express.mvp.controlbridge.client.session;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import express.mvp.controlbridge.client.protocol.Json;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable copy of the cached remote state.
 *
 * @param values last known value per field; absent fields have never been reported
 * @param timestamp epoch millis of the last applied update, 0 if none
 */
public record StateSnapshot(Map<StateField, JsonNode> values, long timestamp) {

    public StateSnapshot {
        EnumMap<StateField, JsonNode> copy = new EnumMap<>(StateField.class);
        copy.putAll(values);
        values = Collections.unmodifiableMap(copy);
    }

    /** Snapshot with nothing reported yet. */
    public static StateSnapshot empty() {
        return new StateSnapshot(Map.of(), 0);
    }

    /**
     * Returns the value of a field.
     *
     * @param field the field
     * @return the value, or {@link NullNode} if never reported
     */
    public JsonNode get(StateField field) {
        JsonNode value = values.get(field);
        return value != null ? value : NullNode.getInstance();
    }

    public boolean has(StateField field) {
        return values.containsKey(field);
    }

    /**
     * Renders the snapshot with semantic field names, every field present.
     *
     * @return e.g. {@code {"hardwareState":..., "connectedSources":[...], ..., "timestamp":...}}
     */
    public ObjectNode toJson() {
        ObjectNode node = Json.MAPPER.createObjectNode();
        for (StateField field : StateField.values()) {
            node.set(field.semanticName(), get(field));
        }
        node.put("timestamp", timestamp);
        return node;
    }
}
