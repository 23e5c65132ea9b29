package express.mvp.controlbridge.client.protocol;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Codec between WebSocket text frames and Socket.IO packets.
 *
 * <p>Implements the subset of Engine.IO v4 and Socket.IO v5 the bridge speaks over a pure
 * WebSocket transport:
 *
 * <table border="1">
 *   <caption>Text frame layout</caption>
 *   <tr><th>Frame</th><th>Meaning</th></tr>
 *   <tr><td>{@code 0{...}}</td><td>Engine.IO open (sid, pingInterval, pingTimeout)</td></tr>
 *   <tr><td>{@code 1}</td><td>Engine.IO close</td></tr>
 *   <tr><td>{@code 2} / {@code 3}</td><td>Engine.IO ping / pong</td></tr>
 *   <tr><td>{@code 40[{auth}]}</td><td>Socket.IO namespace connect or its ack</td></tr>
 *   <tr><td>{@code 41}</td><td>Socket.IO disconnect</td></tr>
 *   <tr><td>{@code 42["event",{...}]}</td><td>Socket.IO event</td></tr>
 *   <tr><td>{@code 44{"message":...}}</td><td>Socket.IO connect error</td></tr>
 * </table>
 *
 * <p>A namespace ({@code 42/admin,[...]}) and an ack id ({@code 4217[...]}) are tolerated on
 * decode; binary packets are rejected. All methods are stateless and thread-safe.
 */
public final class SocketIoFrames {

    /** Path the Socket.IO server listens on. */
    public static final String DEFAULT_PATH = "/socket.io/";

    /** Query string selecting Engine.IO v4 over a WebSocket from the first request. */
    public static final String WEBSOCKET_QUERY = "EIO=4&transport=websocket";

    private static final String DEFAULT_NAMESPACE = "/";

    private SocketIoFrames() {
        // Utility class
    }

    /**
     * Encodes an event.
     *
     * @param event event name
     * @param payload single event argument
     * @return the text frame
     */
    public static String encodeEvent(String event, JsonNode payload) {
        ArrayNode array = Json.MAPPER.createArrayNode();
        array.add(event);
        array.add(payload);
        return "42" + write(array);
    }

    /**
     * Encodes the client's namespace connect.
     *
     * @param authToken token to pass in the auth object, or null for none
     * @return the text frame
     */
    public static String encodeConnect(String authToken) {
        if (authToken == null || authToken.isEmpty()) {
            return "40";
        }
        ObjectNode auth = Json.MAPPER.createObjectNode();
        auth.put("token", authToken);
        return "40" + write(auth);
    }

    /**
     * Encodes the server's namespace connect acknowledgement.
     *
     * @param sid socket id assigned to the client
     * @return the text frame
     */
    public static String encodeConnectAck(String sid) {
        ObjectNode body = Json.MAPPER.createObjectNode();
        body.put("sid", sid);
        return "40" + write(body);
    }

    /**
     * Encodes a namespace connect refusal.
     *
     * @param message reason shown to the client
     * @return the text frame
     */
    public static String encodeConnectError(String message) {
        ObjectNode body = Json.MAPPER.createObjectNode();
        body.put("message", message);
        return "44" + write(body);
    }

    /**
     * Encodes the Engine.IO open packet sent by a server.
     *
     * @param sid engine session id
     * @param pingIntervalMillis server ping interval
     * @param pingTimeoutMillis server ping timeout
     * @return the text frame
     */
    public static String encodeOpen(String sid, long pingIntervalMillis, long pingTimeoutMillis) {
        ObjectNode body = Json.MAPPER.createObjectNode();
        body.put("sid", sid);
        body.putArray("upgrades");
        body.put("pingInterval", pingIntervalMillis);
        body.put("pingTimeout", pingTimeoutMillis);
        body.put("maxPayload", 1_000_000);
        return "0" + write(body);
    }

    public static String enginePing() {
        return "2";
    }

    public static String enginePong() {
        return "3";
    }

    public static String disconnect() {
        return "41";
    }

    /**
     * Decodes a text frame.
     *
     * @param text the frame content
     * @return the packet
     * @throws FramingException if the frame is empty, binary, or carries malformed JSON
     */
    public static SocketIoPacket decode(String text) {
        if (text == null || text.isEmpty()) {
            throw new FramingException("Empty frame");
        }

        char engineType = text.charAt(0);
        String rest = text.substring(1);
        switch (engineType) {
            case '0':
                return packet(SocketIoPacket.Kind.OPEN, DEFAULT_NAMESPACE, null, parseBody(rest));
            case '1':
                return packet(SocketIoPacket.Kind.CLOSE, DEFAULT_NAMESPACE, null, null);
            case '2':
                return packet(SocketIoPacket.Kind.PING, DEFAULT_NAMESPACE, null, null);
            case '3':
                return packet(SocketIoPacket.Kind.PONG, DEFAULT_NAMESPACE, null, null);
            case '4':
                return decodeMessage(rest);
            case '5':
                return packet(SocketIoPacket.Kind.UPGRADE, DEFAULT_NAMESPACE, null, null);
            case '6':
                return packet(SocketIoPacket.Kind.NOOP, DEFAULT_NAMESPACE, null, null);
            default:
                throw new FramingException("Unknown Engine.IO packet type '" + engineType + "'");
        }
    }

    private static SocketIoPacket decodeMessage(String message) {
        if (message.isEmpty()) {
            throw new FramingException("Empty Socket.IO packet");
        }

        char type = message.charAt(0);
        int pos = 1;

        String namespace = DEFAULT_NAMESPACE;
        if (pos < message.length() && message.charAt(pos) == '/') {
            int comma = message.indexOf(',', pos);
            if (comma < 0) {
                namespace = message.substring(pos);
                pos = message.length();
            } else {
                namespace = message.substring(pos, comma);
                pos = comma + 1;
            }
        }

        // Optional ack id
        while (pos < message.length() && Character.isDigit(message.charAt(pos))) {
            pos++;
        }

        String body = message.substring(pos);
        switch (type) {
            case '0':
                return packet(SocketIoPacket.Kind.CONNECT, namespace, null, parseBody(body));
            case '1':
                return packet(SocketIoPacket.Kind.DISCONNECT, namespace, null, null);
            case '2':
                return decodeEvent(namespace, body);
            case '3':
                return packet(SocketIoPacket.Kind.ACK, namespace, null, parseBody(body));
            case '4':
                return packet(SocketIoPacket.Kind.CONNECT_ERROR, namespace, null, parseBody(body));
            case '5':
            case '6':
                throw new FramingException("Binary Socket.IO packets are not supported");
            default:
                throw new FramingException("Unknown Socket.IO packet type '" + type + "'");
        }
    }

    private static SocketIoPacket decodeEvent(String namespace, String body) {
        JsonNode node = parseBody(body);
        if (!node.isArray() || node.isEmpty() || !node.get(0).isTextual()) {
            throw new FramingException("Malformed event packet: " + abbreviate(body));
        }
        String event = node.get(0).asText();
        JsonNode payload = node.size() > 1 ? node.get(1) : null;
        return packet(SocketIoPacket.Kind.EVENT, namespace, event, payload);
    }

    private static SocketIoPacket packet(
            SocketIoPacket.Kind kind, String namespace, String event, JsonNode payload) {
        JsonNode body =
                payload == null || payload.isNull() ? Json.MAPPER.createObjectNode() : payload;
        return new SocketIoPacket(kind, namespace, event, body);
    }

    private static JsonNode parseBody(String body) {
        if (body.isEmpty()) {
            return Json.MAPPER.createObjectNode();
        }
        try {
            return Json.MAPPER.readTree(body);
        } catch (JsonProcessingException e) {
            throw new FramingException("Malformed JSON in frame: " + abbreviate(body), e);
        }
    }

    private static String write(JsonNode node) {
        try {
            return Json.MAPPER.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new FramingException("Unable to encode frame", e);
        }
    }

    private static String abbreviate(String s) {
        return s.length() <= 80 ? s : s.substring(0, 77) + "...";
    }
}
