package express.mvp.controlbridge.client.protocol;

import com.fasterxml.jackson.databind.JsonNode;
import java.util.List;

/**
 * Events received from the bridge, decoded at the channel boundary.
 *
 * <p>The set is closed: {@link InboundEventDecoder} maps every known event name to one of
 * these records and drops anything else.
 */
public sealed interface InboundEvent
        permits InboundEvent.IdentifySuccess,
                InboundEvent.ControllerState,
                InboundEvent.ComponentState,
                InboundEvent.ControlUpdate,
                InboundEvent.ControlSetSuccess,
                InboundEvent.ControlSetError,
                InboundEvent.Pong,
                InboundEvent.SystemReady,
                InboundEvent.DigitalTwinReady,
                InboundEvent.ControllerStatus {

    /** {@code client:identify:success}. */
    record IdentifySuccess(
            String socketId,
            String clientId,
            long serverTime,
            String transport,
            String ipAddress,
            String connectedAt)
            implements InboundEvent {}

    /**
     * {@code controller:state}: the full component snapshot of a controller.
     *
     * @param components components in the order the controller listed them, null when the
     *     payload carried no {@code components} object
     * @param connected whether the bridge reports the controller as connected
     */
    record ControllerState(List<ComponentRecord> components, boolean connected)
            implements InboundEvent {

        public boolean hasComponents() {
            return components != null;
        }
    }

    /**
     * {@code component:state}: snapshot of one component.
     *
     * @param componentId id from {@code componentId} or {@code component.id}, may be null
     * @param component the decoded component, null when the payload has none
     * @param raw the payload as received
     */
    record ComponentState(String componentId, ComponentRecord component, JsonNode raw)
            implements InboundEvent {}

    /**
     * {@code control:update}: a single control changed.
     *
     * @param componentId owning component when the bridge includes it, may be null
     * @param controlId control name
     * @param control descriptor with {@code value} and possibly {@code string}
     */
    record ControlUpdate(String componentId, String controlId, JsonNode control)
            implements InboundEvent {}

    /** {@code control:set:success}. */
    record ControlSetSuccess(String transactionId) implements InboundEvent {}

    /** {@code control:set:error}. */
    record ControlSetError(String transactionId, String message) implements InboundEvent {}

    /**
     * {@code pong}: answer to our heartbeat.
     *
     * @param clientTimestamp the timestamp we sent, 0 when absent
     */
    record Pong(long clientTimestamp) implements InboundEvent {}

    /** {@code system:ready}. */
    record SystemReady(int controllers) implements InboundEvent {}

    /** {@code digitaltwin:ready}. */
    record DigitalTwinReady(int controllers, int totalComponents) implements InboundEvent {}

    /** {@code controller:status}: the bridge's view of the controller behind it. */
    record ControllerStatus(String controllerId, boolean connected, String status, String health)
            implements InboundEvent {}
}
