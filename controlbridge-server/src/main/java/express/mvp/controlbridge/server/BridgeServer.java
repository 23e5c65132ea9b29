package express.mvp.controlbridge.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import express.mvp.controlbridge.client.protocol.InboundEventDecoder;
import express.mvp.controlbridge.client.protocol.Json;
import express.mvp.controlbridge.client.protocol.SocketIoFrames;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.group.ChannelGroup;
import io.netty.channel.group.DefaultChannelGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketServerProtocolHandler;
import io.netty.util.concurrent.GlobalEventExecutor;
import java.net.InetSocketAddress;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/**
 * Simulated control bridge: a Netty WebSocket server speaking the bridge's Socket.IO dialect in
 * front of a {@link SimulatedController}.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * ┌───────────────────────────────────────────────────────────┐
 * │                       BridgeServer                        │
 * ├───────────────────────────────────────────────────────────┤
 * │  boss group ──accept──► worker group (one pipeline/client) │
 * │                                                           │
 * │  HttpServerCodec ─► HttpObjectAggregator                  │
 * │       ─► WebSocketServerProtocolHandler(/socket.io/)      │
 * │       ─► BridgeServerHandler ──► SimulatedController      │
 * │                                                           │
 * │  sessions: ChannelGroup of namespace-connected clients    │
 * └───────────────────────────────────────────────────────────┘
 * </pre>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * BridgeServerConfig config = BridgeServerConfig.builder().port(0).build();
 * try (BridgeServer server =
 *         new BridgeServer(config, SimulatedController.standardRoom("ctrl-01"))) {
 *     server.start();
 *     int port = server.getPort();
 *     // point a client at ws://127.0.0.1:port/socket.io/
 *     server.announceReady();
 * }
 * }</pre>
 *
 * @see BridgeServerConfig
 * @see SimulatedController
 */
public class BridgeServer implements AutoCloseable {

    private static final Logger LOGGER = Logger.getLogger(BridgeServer.class.getName());

    private static final int MAX_FRAME_SIZE = 65536;

    private final BridgeServerConfig config;

    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP2",
            justification = "The controller is shared with tests that drive it.")
    private final SimulatedController controller;

    private final ChannelGroup sessions = new DefaultChannelGroup(GlobalEventExecutor.INSTANCE);
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicInteger clientCounter = new AtomicInteger();

    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    /**
     * Creates a server. Nothing is bound until {@link #start()}.
     *
     * @param config bind address and protocol settings
     * @param controller the controller to serve
     */
    public BridgeServer(BridgeServerConfig config, SimulatedController controller) {
        this.config = config;
        this.controller = controller;
    }

    /**
     * Binds the server socket. Returns once the server accepts connections.
     *
     * @throws InterruptedException if interrupted while binding
     */
    public void start() throws InterruptedException {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();
        ServerBootstrap bootstrap =
                new ServerBootstrap()
                        .group(bossGroup, workerGroup)
                        .channel(NioServerSocketChannel.class)
                        .option(ChannelOption.SO_REUSEADDR, true)
                        .childOption(ChannelOption.TCP_NODELAY, true)
                        .childHandler(
                                new ChannelInitializer<SocketChannel>() {
                                    @Override
                                    protected void initChannel(SocketChannel ch) {
                                        ch.pipeline()
                                                .addLast(new HttpServerCodec())
                                                .addLast(new HttpObjectAggregator(MAX_FRAME_SIZE))
                                                .addLast(
                                                        new WebSocketServerProtocolHandler(
                                                                config.getPath(),
                                                                null,
                                                                true,
                                                                MAX_FRAME_SIZE,
                                                                false,
                                                                true))
                                                .addLast(
                                                        new BridgeServerHandler(
                                                                BridgeServer.this));
                                    }
                                });
        try {
            serverChannel = bootstrap.bind(config.getHost(), config.getPort()).sync().channel();
        } catch (InterruptedException | RuntimeException e) {
            running.set(false);
            shutdownGroups();
            throw e;
        }
        LOGGER.info(
                () ->
                        "Bridge simulator for "
                                + controller.getControllerId()
                                + " listening on "
                                + config.getHost()
                                + ":"
                                + getPort()
                                + config.getPath());
    }

    public boolean isRunning() {
        return running.get();
    }

    public BridgeServerConfig getConfig() {
        return config;
    }

    public SimulatedController getController() {
        return controller;
    }

    /**
     * Returns the bound port.
     *
     * @return the port, resolved when the config asked for an ephemeral one
     * @throws IllegalStateException if the server is not started
     */
    public int getPort() {
        Channel ch = serverChannel;
        if (ch == null) {
            throw new IllegalStateException("Server not started");
        }
        return ((InetSocketAddress) ch.localAddress()).getPort();
    }

    /**
     * Returns the number of namespace-connected clients.
     *
     * @return connected sessions
     */
    public int getSessionCount() {
        return sessions.size();
    }

    /**
     * Sends an event to every connected client.
     *
     * @param event event name
     * @param payload event argument
     */
    public void broadcast(String event, JsonNode payload) {
        sessions.writeAndFlush(new TextWebSocketFrame(SocketIoFrames.encodeEvent(event, payload)));
    }

    /** Announces {@code system:ready} and {@code digitaltwin:ready} to every client. */
    public void announceReady() {
        ObjectNode system = Json.MAPPER.createObjectNode();
        ArrayNode controllers = system.putArray("controllers");
        controllers.add(controller.getControllerId());
        broadcast(InboundEventDecoder.SYSTEM_READY, system);

        ObjectNode twin = Json.MAPPER.createObjectNode();
        twin.put("controllers", 1);
        twin.put("totalComponents", controller.componentCount());
        broadcast(InboundEventDecoder.DIGITALTWIN_READY, twin);
    }

    /**
     * Broadcasts the controller's status.
     *
     * @param status free-form status text
     * @param health health label such as {@code healthy} or {@code degraded}
     */
    public void announceStatus(String status, String health) {
        ObjectNode payload = Json.MAPPER.createObjectNode();
        payload.put("controllerId", controller.getControllerId());
        payload.put("connected", controller.isOnline());
        payload.put("status", status);
        payload.put("health", health);
        broadcast(InboundEventDecoder.CONTROLLER_STATUS, payload);
    }

    /** Closes every client link, leaving the server listening. */
    public void dropSessions() {
        LOGGER.info("Dropping " + sessions.size() + " session(s)");
        sessions.close().awaitUninterruptibly(5, TimeUnit.SECONDS);
    }

    /** Stops the server and closes all client links. */
    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        sessions.close().awaitUninterruptibly(5, TimeUnit.SECONDS);
        if (serverChannel != null) {
            serverChannel.close().awaitUninterruptibly(5, TimeUnit.SECONDS);
        }
        shutdownGroups();
        LOGGER.info("Bridge simulator stopped");
    }

    @Override
    public void close() {
        stop();
    }

    String nextClientId() {
        return "client-" + clientCounter.incrementAndGet();
    }

    void sessionOpened(Channel channel) {
        sessions.add(channel);
    }

    void sessionClosed(Channel channel) {
        sessions.remove(channel);
    }

    private void shutdownGroups() {
        if (bossGroup != null) {
            bossGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).awaitUninterruptibly();
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully(0, 2, TimeUnit.SECONDS).awaitUninterruptibly();
        }
    }

    /**
     * Runs a simulator for local development.
     *
     * <p>Reads {@code BRIDGE_HOST}, {@code BRIDGE_PORT}, {@code CONTROLLER_ID} and {@code
     * WEBSOCKET_AUTH_TOKEN} from the environment.
     *
     * @param args ignored
     * @throws InterruptedException if interrupted while running
     */
    public static void main(String[] args) throws InterruptedException {
        String port = System.getenv("BRIDGE_PORT");
        BridgeServerConfig config =
                BridgeServerConfig.builder()
                        .host(envOr("BRIDGE_HOST", "127.0.0.1"))
                        .port(port == null || port.isBlank() ? 3001 : Integer.parseInt(port.trim()))
                        .authToken(System.getenv("WEBSOCKET_AUTH_TOKEN"))
                        .build();
        SimulatedController controller =
                SimulatedController.standardRoom(envOr("CONTROLLER_ID", "ctrl-01"));
        BridgeServer server = new BridgeServer(config, controller);
        Runtime.getRuntime().addShutdownHook(new Thread(server::stop, "bridge-server-shutdown"));
        server.start();
        server.serverChannel.closeFuture().sync();
    }

    private static String envOr(String name, String fallback) {
        String value = System.getenv(name);
        return value == null || value.isBlank() ? fallback : value.trim();
    }
}
