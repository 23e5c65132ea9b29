package express.mvp.controlbridge.client.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/** Events the client emits to the bridge. */
public sealed interface OutboundEvent
        permits OutboundEvent.Identify,
                OutboundEvent.ControllerSubscribe,
                OutboundEvent.ComponentSubscribe,
                OutboundEvent.ControlSubscribe,
                OutboundEvent.ControlSet,
                OutboundEvent.Ping {

    /**
     * Returns the wire event name.
     *
     * @return the name
     */
    String eventName();

    /**
     * Builds the event payload.
     *
     * @return a fresh object node
     */
    ObjectNode toPayload();

    /** {@code client:identify}. */
    record Identify(ClientMetadata metadata) implements OutboundEvent {
        @Override
        public String eventName() {
            return "client:identify";
        }

        @Override
        public ObjectNode toPayload() {
            ObjectNode node = Json.MAPPER.createObjectNode();
            node.put("platform", metadata.platform());
            node.put("device", metadata.device());
            node.put("osVersion", metadata.osVersion());
            node.put("appVersion", metadata.appVersion());
            node.put("buildNumber", metadata.buildNumber());
            node.put("deviceName", metadata.deviceName());
            return node;
        }
    }

    /** {@code controller:subscribe}: requests the full controller snapshot. */
    record ControllerSubscribe(String controllerId) implements OutboundEvent {
        @Override
        public String eventName() {
            return "controller:subscribe";
        }

        @Override
        public ObjectNode toPayload() {
            return Json.MAPPER.createObjectNode().put("controllerId", controllerId);
        }
    }

    /** {@code component:subscribe}. */
    record ComponentSubscribe(String controllerId, String componentId) implements OutboundEvent {
        @Override
        public String eventName() {
            return "component:subscribe";
        }

        @Override
        public ObjectNode toPayload() {
            return Json.MAPPER
                    .createObjectNode()
                    .put("controllerId", controllerId)
                    .put("componentId", componentId);
        }
    }

    /** {@code control:subscribe}. */
    record ControlSubscribe(String controllerId, String componentId, String controlId)
            implements OutboundEvent {
        @Override
        public String eventName() {
            return "control:subscribe";
        }

        @Override
        public ObjectNode toPayload() {
            return Json.MAPPER
                    .createObjectNode()
                    .put("controllerId", controllerId)
                    .put("componentId", componentId)
                    .put("controlId", controlId);
        }
    }

    /** {@code control:set}. */
    record ControlSet(
            String controllerId,
            String componentId,
            String controlId,
            JsonNode value,
            String transactionId)
            implements OutboundEvent {
        @Override
        public String eventName() {
            return "control:set";
        }

        @Override
        public ObjectNode toPayload() {
            ObjectNode node =
                    Json.MAPPER
                            .createObjectNode()
                            .put("controllerId", controllerId)
                            .put("componentId", componentId)
                            .put("controlId", controlId);
            node.set("value", value);
            node.put("transactionId", transactionId);
            return node;
        }
    }

    /** {@code ping}: application heartbeat, answered with {@code pong}. */
    record Ping(long timestamp) implements OutboundEvent {
        @Override
        public String eventName() {
            return "ping";
        }

        @Override
        public ObjectNode toPayload() {
            return Json.MAPPER.createObjectNode().put("timestamp", timestamp);
        }
    }
}
