package express.mvp.controlbridge.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import express.mvp.controlbridge.client.protocol.Json;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Logger;

/**
 * In-memory stand-in for an AV controller behind the bridge.
 *
 * <p>Holds components with named controls. Each control is a JSON object with a {@code value} and
 * its {@code string} rendering, as the bridge reports them. Commands update the control in place.
 *
 * <p>Test hooks: {@link #rejectControl(String)} makes commands on a control fail, {@link
 * #setAcknowledgeCommands(boolean)} makes the bridge silently drop commands, and {@link
 * #setOnline(boolean)} reports the controller as disconnected.
 *
 * <p>Thread-safe; every method synchronizes on the instance.
 */
public final class SimulatedController {

    private static final Logger LOGGER = Logger.getLogger(SimulatedController.class.getName());

    /** A command the controller refused. */
    public static final class RejectedCommandException extends RuntimeException {
        private static final long serialVersionUID = 1L;

        RejectedCommandException(String message) {
            super(message);
        }
    }

    private final String controllerId;
    private final Map<String, ObjectNode> components = new LinkedHashMap<>();
    private final Set<String> rejectedControls = new HashSet<>();
    private boolean acknowledgeCommands = true;
    private boolean online = true;

    public SimulatedController(String controllerId) {
        this.controllerId = Objects.requireNonNull(controllerId, "controllerId");
    }

    /**
     * Creates a controller with one component per standard room role.
     *
     * @param controllerId controller id
     * @return the controller
     */
    public static SimulatedController standardRoom(String controllerId) {
        SimulatedController controller = new SimulatedController(controllerId);
        controller.addComponent(
                "comp-wall",
                "BUControl Video Wall",
                Map.of(
                        "HardwareState", "on",
                        "ConnectedSources", "{\"sources\":[\"hdmi1\",\"hdmi2\"]}"));
        controller.addComponent(
                "comp-display", "Generic_HDMI_Display_1", Map.of("hdmi.enabled.button", true));
        controller.addComponent(
                "comp-gpio", "GPIO_Out_Core-Maktabi", Map.of("pin.8.digital.out", false));
        controller.addComponent(
                "comp-decoder", "HDMI_I/ODecoder_1", Map.of("hdmi.out.1.select.hdmi.1", true));
        controller.addComponent(
                "comp-lighting", "LutronLEAPZone_Office", Map.of("ZoneDimLevel1", 50));
        controller.addComponent("comp-mixer", "Mixer_8x8_2", Map.of("output.1.gain", -20));
        return controller;
    }

    public String getControllerId() {
        return controllerId;
    }

    /**
     * Adds or replaces a component.
     *
     * @param componentId component id
     * @param name display name
     * @param controls control name to initial value
     * @return this controller
     */
    public synchronized SimulatedController addComponent(
            String componentId, String name, Map<String, ?> controls) {
        ObjectNode component = Json.MAPPER.createObjectNode();
        component.put("id", componentId);
        component.put("name", name);
        ObjectNode controlsNode = component.putObject("controls");
        for (Map.Entry<String, ?> entry : controls.entrySet()) {
            JsonNode value = Json.toNode(entry.getValue());
            controlsNode.set(entry.getKey(), controlNode(entry.getKey(), value));
        }
        components.put(componentId, component);
        return this;
    }

    public synchronized void removeAllComponents() {
        components.clear();
    }

    public synchronized int componentCount() {
        return components.size();
    }

    /**
     * Returns every component as the bridge lists them in {@code controller:state}.
     *
     * @return array of component objects
     */
    public synchronized ArrayNode componentsJson() {
        ArrayNode array = Json.MAPPER.createArrayNode();
        for (ObjectNode component : components.values()) {
            array.add(component.deepCopy());
        }
        return array;
    }

    public synchronized Optional<ObjectNode> component(String componentId) {
        ObjectNode component = components.get(componentId);
        return component == null ? Optional.empty() : Optional.of(component.deepCopy());
    }

    public synchronized Optional<JsonNode> control(String componentId, String controlId) {
        ObjectNode component = components.get(componentId);
        if (component == null || !component.path("controls").has(controlId)) {
            return Optional.empty();
        }
        return Optional.of(component.get("controls").get(controlId).deepCopy());
    }

    /**
     * Sets a control.
     *
     * @param componentId component id
     * @param controlId control name
     * @param value new value
     * @return the updated control object
     * @throws RejectedCommandException if the component or control is unknown, or rejected
     */
    public synchronized JsonNode applyControl(
            String componentId, String controlId, JsonNode value) {
        ObjectNode component = components.get(componentId);
        if (component == null) {
            throw new RejectedCommandException("Unknown component: " + componentId);
        }
        if (rejectedControls.contains(controlId)) {
            throw new RejectedCommandException("Control " + controlId + " is read-only");
        }
        ObjectNode controls = (ObjectNode) component.get("controls");
        if (!controls.has(controlId)) {
            throw new RejectedCommandException(
                    "Unknown control " + controlId + " on " + componentId);
        }
        ObjectNode updated = controlNode(controlId, value);
        controls.set(controlId, updated);
        LOGGER.fine(() -> componentId + "/" + controlId + " = " + value);
        return updated.deepCopy();
    }

    public synchronized void rejectControl(String controlId) {
        rejectedControls.add(controlId);
    }

    public synchronized Set<String> rejectedControls() {
        return Collections.unmodifiableSet(new HashSet<>(rejectedControls));
    }

    public synchronized boolean isAcknowledgeCommands() {
        return acknowledgeCommands;
    }

    public synchronized void setAcknowledgeCommands(boolean acknowledgeCommands) {
        this.acknowledgeCommands = acknowledgeCommands;
    }

    public synchronized boolean isOnline() {
        return online;
    }

    public synchronized void setOnline(boolean online) {
        this.online = online;
    }

    private static ObjectNode controlNode(String controlId, JsonNode value) {
        ObjectNode control = Json.MAPPER.createObjectNode();
        control.put("name", controlId);
        control.set("value", value);
        control.put("string", value.isTextual() ? value.asText() : value.toString());
        return control;
    }
}
