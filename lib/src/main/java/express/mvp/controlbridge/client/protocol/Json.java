package express.mvp.controlbridge.client.protocol;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;

/** Shared Jackson mapper and small node helpers for the wire protocol. */
public final class Json {

    /** Thread-safe once configured; shared by every codec in the client. */
    public static final ObjectMapper MAPPER =
            new ObjectMapper().configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private Json() {
        // Utility class
    }

    /**
     * Converts an arbitrary control value into a JSON node.
     *
     * @param value a number, boolean, string, map, list, or node
     * @return the node; {@link NullNode} for null
     */
    public static JsonNode toNode(Object value) {
        if (value == null) {
            return NullNode.getInstance();
        }
        if (value instanceof JsonNode node) {
            return node;
        }
        return MAPPER.valueToTree(value);
    }

    /**
     * Reads a text field, treating missing and JSON null alike.
     *
     * @param node the object node, may be null
     * @param field the field name
     * @return the text, or null
     */
    public static String text(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    /**
     * Reads a numeric field.
     *
     * @param node the object node, may be null
     * @param field the field name
     * @param fallback value when the field is missing or not numeric
     * @return the value
     */
    public static long number(JsonNode node, String field, long fallback) {
        if (node == null) {
            return fallback;
        }
        JsonNode value = node.get(field);
        return value != null && value.isNumber() ? value.asLong() : fallback;
    }
}
