package express.mvp.controlbridge.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import express.mvp.controlbridge.client.protocol.FramingException;
import express.mvp.controlbridge.client.protocol.InboundEventDecoder;
import express.mvp.controlbridge.client.protocol.Json;
import express.mvp.controlbridge.client.protocol.SocketIoFrames;
import express.mvp.controlbridge.client.protocol.SocketIoPacket;
import io.netty.channel.Channel;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.util.concurrent.ScheduledFuture;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.time.Instant;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One client session on the simulated bridge.
 *
 * <h2>Lifecycle</h2>
 *
 * <ol>
 *   <li>WebSocket handshake complete: sends the Engine.IO open packet and starts engine pings
 *   <li>{@code 40}: checks the auth token and acknowledges the namespace connect
 *   <li>{@code 42[...]}: answers bridge events until the link closes
 * </ol>
 *
 * <p>A fresh instance per connection; all callbacks run on that connection's Netty event loop.
 */
final class BridgeServerHandler extends SimpleChannelInboundHandler<TextWebSocketFrame> {

    private static final Logger LOGGER = Logger.getLogger(BridgeServerHandler.class.getName());

    private final BridgeServer server;
    private final BridgeServerConfig config;
    private final SimulatedController controller;
    private final String sid = UUID.randomUUID().toString().replace("-", "").substring(0, 20);
    private final Set<String> subscriptions = new HashSet<>();

    private ScheduledFuture<?> enginePing;
    private boolean namespaceConnected;
    private String clientId;
    private String connectedAt;

    BridgeServerHandler(BridgeServer server) {
        this.server = server;
        this.config = server.getConfig();
        this.controller = server.getController();
    }

    @Override
    public void userEventTriggered(ChannelHandlerContext ctx, Object evt) throws Exception {
        if (evt instanceof WebSocketServerProtocolHandler.HandshakeComplete) {
            LOGGER.fine(() -> "WebSocket open from " + ctx.channel().remoteAddress());
            send(
                    ctx.channel(),
                    SocketIoFrames.encodeOpen(
                            sid, config.getPingIntervalMillis(), config.getPingTimeoutMillis()));
            long interval = config.getPingIntervalMillis();
            enginePing =
                    ctx.executor()
                            .scheduleAtFixedRate(
                                    () -> send(ctx.channel(), SocketIoFrames.enginePing()),
                                    interval,
                                    interval,
                                    TimeUnit.MILLISECONDS);
            return;
        }
        super.userEventTriggered(ctx, evt);
    }

    @Override
    public void channelInactive(ChannelHandlerContext ctx) throws Exception {
        if (enginePing != null) {
            enginePing.cancel(false);
        }
        server.sessionClosed(ctx.channel());
        if (clientId != null) {
            LOGGER.info("Client " + clientId + " disconnected");
        }
        super.channelInactive(ctx);
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, TextWebSocketFrame frame) {
        SocketIoPacket packet;
        try {
            packet = SocketIoFrames.decode(frame.text());
        } catch (FramingException e) {
            LOGGER.log(Level.WARNING, "Closing session on malformed frame", e);
            ctx.close();
            return;
        }
        Channel ch = ctx.channel();
        switch (packet.kind()) {
            case PING -> send(ch, SocketIoFrames.enginePong());
            case PONG, NOOP, UPGRADE, ACK -> {
                // nothing to answer
            }
            case CONNECT -> onNamespaceConnect(ch, packet.payload());
            case DISCONNECT, CLOSE -> ctx.close();
            case EVENT -> {
                if (namespaceConnected) {
                    onEvent(ch, packet.event(), packet.payload());
                } else {
                    LOGGER.warning("Event " + packet.event() + " before namespace connect");
                }
            }
            default -> LOGGER.fine(() -> "Ignoring " + packet.kind() + " from client");
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        LOGGER.log(Level.WARNING, "Session error, closing", cause);
        ctx.close();
    }

    private void onNamespaceConnect(Channel ch, JsonNode auth) {
        String expected = config.getAuthToken();
        if (expected != null && !expected.equals(Json.text(auth, "token"))) {
            LOGGER.warning("Refusing namespace connect from " + ch.remoteAddress() + ": bad token");
            ch.writeAndFlush(
                    new TextWebSocketFrame(SocketIoFrames.encodeConnectError("Unauthorized")));
            ch.close();
            return;
        }
        namespaceConnected = true;
        connectedAt = Instant.now().toString();
        server.sessionOpened(ch);
        send(ch, SocketIoFrames.encodeConnectAck(sid));
    }

    private void onEvent(Channel ch, String name, JsonNode payload) {
        switch (name) {
            case "client:identify" -> identify(ch, payload);
            case "controller:subscribe" -> controllerState(ch, payload);
            case "component:subscribe" -> componentState(ch, payload);
            case "control:subscribe" -> controlState(ch, payload);
            case "control:set" -> setControl(ch, payload);
            case "ping" -> pong(ch, payload);
            default -> LOGGER.fine(() -> "Ignoring client event " + name);
        }
    }

    private void identify(Channel ch, JsonNode metadata) {
        clientId = server.nextClientId();
        LOGGER.info(
                () ->
                        "Identified "
                                + clientId
                                + " ("
                                + Json.text(metadata, "deviceName")
                                + ", "
                                + Json.text(metadata, "appVersion")
                                + ")");
        ObjectNode reply = Json.MAPPER.createObjectNode();
        reply.put("socketId", sid);
        reply.put("clientId", clientId);
        reply.put("serverTime", System.currentTimeMillis());
        ObjectNode connection = reply.putObject("connection");
        connection.put("transport", "websocket");
        connection.put("ipAddress", hostOf(ch.remoteAddress()));
        connection.put("connectedAt", connectedAt);
        emit(ch, InboundEventDecoder.IDENTIFY_SUCCESS, reply);
    }

    private void controllerState(Channel ch, JsonNode request) {
        String requested = Json.text(request, "controllerId");
        ObjectNode reply = Json.MAPPER.createObjectNode();
        if (controller.getControllerId().equals(requested)) {
            reply.set("components", controller.componentsJson());
            reply.put("connected", controller.isOnline());
        } else {
            LOGGER.warning("Subscribe for unknown controller " + requested);
            reply.putArray("components");
            reply.put("connected", false);
        }
        emit(ch, InboundEventDecoder.CONTROLLER_STATE, reply);
    }

    private void componentState(Channel ch, JsonNode request) {
        String componentId = Json.text(request, "componentId");
        Optional<ObjectNode> component =
                componentId == null ? Optional.empty() : controller.component(componentId);
        if (component.isEmpty()) {
            LOGGER.warning("Subscribe for unknown component " + componentId);
            return;
        }
        subscriptions.add(componentId);
        ObjectNode reply = Json.MAPPER.createObjectNode();
        reply.put("componentId", componentId);
        reply.set("component", component.get());
        emit(ch, InboundEventDecoder.COMPONENT_STATE, reply);
    }

    private void controlState(Channel ch, JsonNode request) {
        String componentId = Json.text(request, "componentId");
        String controlId = Json.text(request, "controlId");
        if (componentId == null || controlId == null) {
            LOGGER.warning("control:subscribe without componentId/controlId");
            return;
        }
        Optional<JsonNode> control = controller.control(componentId, controlId);
        if (control.isEmpty()) {
            LOGGER.warning("Subscribe for unknown control " + componentId + "/" + controlId);
            return;
        }
        subscriptions.add(componentId + ":" + controlId);
        emit(ch, InboundEventDecoder.CONTROL_UPDATE, update(componentId, controlId, control.get()));
    }

    private void setControl(Channel ch, JsonNode command) {
        String transactionId = Json.text(command, "transactionId");
        if (!controller.isAcknowledgeCommands()) {
            LOGGER.fine(() -> "Dropping command " + transactionId);
            return;
        }
        String componentId = Json.text(command, "componentId");
        String controlId = Json.text(command, "controlId");
        JsonNode value = command.has("value") ? command.get("value") : Json.MAPPER.nullNode();
        ObjectNode reply = Json.MAPPER.createObjectNode();
        reply.put("transactionId", transactionId);
        JsonNode updated;
        try {
            updated = controller.applyControl(componentId, controlId, value);
        } catch (SimulatedController.RejectedCommandException e) {
            LOGGER.info("Rejected " + transactionId + ": " + e.getMessage());
            reply.put("message", e.getMessage());
            emit(ch, InboundEventDecoder.CONTROL_SET_ERROR, reply);
            return;
        }
        emit(ch, InboundEventDecoder.CONTROL_SET_SUCCESS, reply);
        server.broadcast(
                InboundEventDecoder.CONTROL_UPDATE, update(componentId, controlId, updated));
    }

    private void pong(Channel ch, JsonNode ping) {
        ObjectNode reply = Json.MAPPER.createObjectNode();
        reply.put("clientTimestamp", Json.number(ping, "timestamp", 0));
        reply.put("serverTimestamp", System.currentTimeMillis());
        emit(ch, InboundEventDecoder.PONG, reply);
    }

    private static ObjectNode update(String componentId, String controlId, JsonNode control) {
        ObjectNode update = Json.MAPPER.createObjectNode();
        update.put("componentId", componentId);
        update.put("controlId", controlId);
        update.set("control", control);
        return update;
    }

    private static void emit(Channel ch, String event, JsonNode payload) {
        send(ch, SocketIoFrames.encodeEvent(event, payload));
    }

    private static void send(Channel ch, String frame) {
        if (ch.isActive()) {
            ch.writeAndFlush(new TextWebSocketFrame(frame));
        }
    }

    private static String hostOf(SocketAddress address) {
        if (address instanceof InetSocketAddress inet) {
            return inet.getHostString();
        }
        return String.valueOf(address);
    }
}
