package express.mvp.controlbridge.client.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A discovered component and its control surface.
 *
 * <p>Discovery snapshots are authoritative, so records are replaced wholesale and never merged.
 *
 * @param id component id assigned by the controller
 * @param displayName component name as configured on the controller
 * @param controls control name to last-known descriptor ({@code value}, {@code string}, ...)
 */
public record ComponentRecord(String id, String displayName, Map<String, JsonNode> controls) {

    public ComponentRecord {
        Objects.requireNonNull(id, "id");
        displayName = displayName == null ? id : displayName;
        controls =
                controls == null
                        ? Map.of()
                        : Collections.unmodifiableMap(new LinkedHashMap<>(controls));
    }

    /**
     * Decodes a component object as sent by the controller.
     *
     * @param fallbackId id to use when the object carries none (the key it was found under)
     * @param node the component object with {@code name} and {@code controls}
     * @return the record
     */
    static ComponentRecord fromWire(String fallbackId, JsonNode node) {
        String id = Json.text(node, "id");
        Map<String, JsonNode> controls = new LinkedHashMap<>();
        JsonNode controlsNode = node.get("controls");
        if (controlsNode != null && controlsNode.isObject()) {
            controlsNode.fields().forEachRemaining(e -> controls.put(e.getKey(), e.getValue()));
        }
        return new ComponentRecord(
                id != null ? id : fallbackId, Json.text(node, "name"), controls);
    }

    /**
     * Returns a control descriptor.
     *
     * @param controlName control name
     * @return the descriptor, or null if the component has no such control
     */
    public JsonNode control(String controlName) {
        return controls.get(controlName);
    }
}
