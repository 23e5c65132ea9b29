package express.mvp.controlbridge.client.protocol;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One decoded WebSocket text frame.
 *
 * <p>Engine.IO control packets ({@link Kind#OPEN}, {@link Kind#PING}, ...) carry no event name.
 * {@link Kind#EVENT} carries the event name and its first argument as payload. {@link
 * Kind#OPEN}, {@link Kind#CONNECT} and {@link Kind#CONNECT_ERROR} carry their JSON body as
 * payload.
 *
 * @param kind packet kind
 * @param namespace Socket.IO namespace, {@code "/"} by default
 * @param event event name for {@link Kind#EVENT}, otherwise null
 * @param payload JSON body, never null (an empty object when absent)
 */
public record SocketIoPacket(Kind kind, String namespace, String event, JsonNode payload) {

    /** Packet kinds, Engine.IO level first, then Socket.IO level. */
    public enum Kind {
        OPEN,
        CLOSE,
        PING,
        PONG,
        UPGRADE,
        NOOP,
        CONNECT,
        DISCONNECT,
        EVENT,
        ACK,
        CONNECT_ERROR
    }
}
