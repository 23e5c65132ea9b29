package express.mvp.controlbridge.client.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Maps (event name, payload) pairs to {@link InboundEvent}s.
 *
 * <p>Unknown event names are dropped at FINE. Known events missing a field they cannot do
 * without (a transaction id, a control id) are dropped at WARNING. Nothing past this class
 * reads raw payload fields.
 */
public final class InboundEventDecoder {

    private static final Logger LOGGER = Logger.getLogger(InboundEventDecoder.class.getName());

    public static final String IDENTIFY_SUCCESS = "client:identify:success";
    public static final String IDENTIFY_SUCCESS_ALIAS = "identify:success";
    public static final String CONTROLLER_STATE = "controller:state";
    public static final String COMPONENT_STATE = "component:state";
    public static final String CONTROL_UPDATE = "control:update";
    public static final String CONTROL_SET_SUCCESS = "control:set:success";
    public static final String CONTROL_SET_ERROR = "control:set:error";
    public static final String PONG = "pong";
    public static final String SYSTEM_READY = "system:ready";
    public static final String DIGITALTWIN_READY = "digitaltwin:ready";
    public static final String CONTROLLER_STATUS = "controller:status";

    private InboundEventDecoder() {
        // Utility class
    }

    /**
     * Decodes an event.
     *
     * @param name event name
     * @param payload event payload, may be null
     * @return the event, or empty when the name is unknown or the payload unusable
     */
    public static Optional<InboundEvent> decode(String name, JsonNode payload) {
        JsonNode body = payload == null ? Json.MAPPER.createObjectNode() : payload;
        switch (name) {
            case IDENTIFY_SUCCESS:
            case IDENTIFY_SUCCESS_ALIAS:
                return Optional.of(identifySuccess(body));
            case CONTROLLER_STATE:
                return Optional.of(controllerState(body));
            case COMPONENT_STATE:
                return Optional.of(componentState(body));
            case CONTROL_UPDATE:
                return controlUpdate(body);
            case CONTROL_SET_SUCCESS:
                return transactionId(name, body).map(InboundEvent.ControlSetSuccess::new);
            case CONTROL_SET_ERROR:
                return transactionId(name, body)
                        .map(id -> new InboundEvent.ControlSetError(id, errorMessage(body)));
            case PONG:
                return Optional.of(new InboundEvent.Pong(Json.number(body, "clientTimestamp", 0)));
            case SYSTEM_READY:
                return Optional.of(new InboundEvent.SystemReady(count(body.get("controllers"))));
            case DIGITALTWIN_READY:
                return Optional.of(
                        new InboundEvent.DigitalTwinReady(
                                count(body.get("controllers")),
                                (int) Json.number(body, "totalComponents", 0)));
            case CONTROLLER_STATUS:
                return Optional.of(controllerStatus(body));
            default:
                LOGGER.fine(() -> "Ignoring unknown event '" + name + "'");
                return Optional.empty();
        }
    }

    private static InboundEvent identifySuccess(JsonNode body) {
        JsonNode connection = body.get("connection");
        if (connection == null) {
            connection = body.get("connectionInfo");
        }
        return new InboundEvent.IdentifySuccess(
                Json.text(body, "socketId"),
                Json.text(body, "clientId"),
                Json.number(body, "serverTime", 0),
                Json.text(connection, "transport"),
                Json.text(connection, "ipAddress"),
                Json.text(connection, "connectedAt"));
    }

    private static InboundEvent controllerState(JsonNode body) {
        JsonNode componentsNode = body.get("components");
        JsonNode connectedNode = body.path("connected");
        boolean connected = !connectedNode.isBoolean() || connectedNode.asBoolean();
        if (componentsNode == null || componentsNode.isNull()) {
            return new InboundEvent.ControllerState(null, connected);
        }

        List<ComponentRecord> components = new ArrayList<>();
        if (componentsNode.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> it = componentsNode.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> entry = it.next();
                if (entry.getValue().isObject()) {
                    components.add(ComponentRecord.fromWire(entry.getKey(), entry.getValue()));
                }
            }
        } else if (componentsNode.isArray()) {
            for (JsonNode component : componentsNode) {
                String id = Json.text(component, "id");
                if (id != null) {
                    components.add(ComponentRecord.fromWire(id, component));
                }
            }
        }
        return new InboundEvent.ControllerState(components, connected);
    }

    private static InboundEvent componentState(JsonNode body) {
        JsonNode componentNode = body.get("component");
        String componentId = Json.text(body, "componentId");
        ComponentRecord component = null;
        if (componentNode != null && componentNode.isObject()) {
            String nestedId = Json.text(componentNode, "id");
            if (componentId == null) {
                componentId = nestedId;
            }
            String id = nestedId != null ? nestedId : componentId;
            if (id != null) {
                component = ComponentRecord.fromWire(id, componentNode);
            }
        }
        return new InboundEvent.ComponentState(componentId, component, body);
    }

    private static Optional<InboundEvent> controlUpdate(JsonNode body) {
        String controlId = Json.text(body, "controlId");
        JsonNode control = body.get("control");
        if (controlId == null || control == null || control.isNull()) {
            LOGGER.warning("Dropping control:update without controlId/control: " + body);
            return Optional.empty();
        }
        return Optional.of(
                new InboundEvent.ControlUpdate(Json.text(body, "componentId"), controlId, control));
    }

    private static InboundEvent controllerStatus(JsonNode body) {
        boolean connected = body.path("connected").asBoolean(false);
        String health = Json.text(body, "health");
        if (health == null) {
            health = connected ? "healthy" : "disconnected";
        }
        return new InboundEvent.ControllerStatus(
                Json.text(body, "controllerId"), connected, Json.text(body, "status"), health);
    }

    private static Optional<String> transactionId(String name, JsonNode body) {
        String transactionId = Json.text(body, "transactionId");
        if (transactionId == null) {
            LOGGER.warning("Dropping " + name + " without transactionId");
        }
        return Optional.ofNullable(transactionId);
    }

    private static String errorMessage(JsonNode body) {
        String message = Json.text(body, "message");
        if (message == null) {
            message = Json.text(body, "error");
        }
        return message != null ? message : "Command failed";
    }

    private static int count(JsonNode node) {
        if (node == null) {
            return 0;
        }
        if (node.isArray()) {
            return node.size();
        }
        return node.isNumber() ? node.asInt() : 0;
    }
}
