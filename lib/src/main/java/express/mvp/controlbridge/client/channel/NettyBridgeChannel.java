package express.mvp.controlbridge.client.channel;

import com.fasterxml.jackson.databind.JsonNode;
import express.mvp.controlbridge.client.BridgeClientConfig;
import express.mvp.controlbridge.client.BridgeError;
import express.mvp.controlbridge.client.BridgeException;
import express.mvp.controlbridge.client.error.RetryContext;
import express.mvp.controlbridge.client.error.RetryPolicy;
import express.mvp.controlbridge.client.protocol.FramingException;
import express.mvp.controlbridge.client.protocol.Json;
import express.mvp.controlbridge.client.protocol.OutboundEvent;
import express.mvp.controlbridge.client.protocol.SocketIoFrames;
import express.mvp.controlbridge.client.protocol.SocketIoPacket;
import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.http.DefaultHttpHeaders;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpClientCodec;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.websocketx.CloseWebSocketFrame;
import io.netty.handler.codec.http.websocketx.TextWebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshaker;
import io.netty.handler.codec.http.websocketx.WebSocketClientHandshakerFactory;
import io.netty.handler.codec.http.websocketx.WebSocketFrame;
import io.netty.handler.codec.http.websocketx.WebSocketHandshakeException;
import io.netty.handler.codec.http.websocketx.WebSocketVersion;
import java.net.URI;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link BridgeChannel} speaking Socket.IO over a Netty WebSocket client.
 *
 * <h2>Link Lifecycle</h2>
 *
 * <pre>
 *   open() ──► TCP connect ──► WS handshake ──► "0{open}" ──► send "40[auth]"
 *                                                                  │
 *                          onOpen(false) ◄── "40{sid}" (connect ack)
 *
 *   link drops ──► onClose ──► onReconnecting(n) ──► backoff ──► connect again
 *                                                                  │
 *                                             onOpen(true) ◄───────┘
 * </pre>
 *
 * <p>Engine.IO pings ({@code "2"}) are answered with {@code "3"} on the I/O thread. Everything
 * else is handed to the {@link EventLoop} before it reaches the listener. Each link carries a
 * generation number; callbacks from a link that has since been replaced or closed are dropped.
 *
 * <p>Link-level reconnection is paced by {@link BridgeClientConfig#linkRetryPolicy()} and resets
 * after every successful open.
 */
public final class NettyBridgeChannel implements BridgeChannel {

    private static final Logger LOGGER = Logger.getLogger(NettyBridgeChannel.class.getName());

    private static final int MAX_CONTENT_LENGTH = 65536;

    private final URI uri;
    private final String authToken;
    private final int connectTimeoutMillis;
    private final RetryPolicy linkPolicy;
    private final EventLoop loop;
    private final EventLoopGroup group;

    /** Bumped whenever a link is retired; stale callbacks compare against it. */
    private final AtomicInteger generation = new AtomicInteger();

    private volatile Channel channel;
    private volatile boolean linkUp;
    private volatile boolean closed;

    // Loop-confined
    private BridgeChannelListener listener;
    private CompletableFuture<Void> openFuture;
    private boolean active;
    private RetryContext reconnectContext;
    private EventLoop.Scheduled reconnectTimer;

    /**
     * Creates a channel.
     *
     * @param config connection settings
     * @param loop loop on which every listener callback runs
     */
    public NettyBridgeChannel(BridgeClientConfig config, EventLoop loop) {
        this.uri = config.uri();
        this.authToken = config.authToken();
        this.connectTimeoutMillis =
                (int) Math.min(Integer.MAX_VALUE, config.connectionTimeout().toMillis());
        this.linkPolicy = config.linkRetryPolicy();
        this.loop = Objects.requireNonNull(loop, "loop");
        this.group = new NioEventLoopGroup(1);
    }

    @Override
    public CompletableFuture<Void> open(BridgeChannelListener listener) {
        Objects.requireNonNull(listener, "listener");
        if (closed) {
            return CompletableFuture.failedFuture(
                    new BridgeException(BridgeError.TRANSPORT_ERROR, "Channel is closed"));
        }
        retireLink();
        CompletableFuture<Void> future = new CompletableFuture<>();
        loop.execute(
                () -> {
                    this.listener = listener;
                    this.openFuture = future;
                    this.active = true;
                    this.reconnectContext =
                            new RetryContext(
                                    "link:" + uri.getAuthority(),
                                    linkPolicy.getMaxAttempts(),
                                    loop::now);
                    connect(generation.get());
                });
        return future;
    }

    @Override
    public boolean emit(OutboundEvent event) {
        Channel ch = channel;
        if (!linkUp || ch == null || !ch.isActive()) {
            return false;
        }
        String frame = SocketIoFrames.encodeEvent(event.eventName(), event.toPayload());
        ch.writeAndFlush(new TextWebSocketFrame(frame));
        return true;
    }

    @Override
    public boolean isOpen() {
        return linkUp;
    }

    @Override
    public void disconnect() {
        retireLink();
        loop.execute(
                () -> {
                    active = false;
                    cancelReconnect();
                    failOpen(new BridgeException(BridgeError.TRANSPORT_ERROR, "Disconnected"));
                });
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        disconnect();
        try {
            group.shutdownGracefully(0, 2, TimeUnit.SECONDS).sync();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warning("Interrupted while shutting down Netty event loop group");
        }
    }

    /** Drops the current link without notifying the listener. */
    private void retireLink() {
        generation.incrementAndGet();
        boolean wasUp = linkUp;
        linkUp = false;
        Channel ch = channel;
        channel = null;
        if (ch != null && ch.isOpen()) {
            if (wasUp) {
                ch.writeAndFlush(new TextWebSocketFrame(SocketIoFrames.disconnect()));
            }
            ch.close();
        }
    }

    private void connect(int linkGeneration) {
        if (closed || linkGeneration != generation.get()) {
            return;
        }
        LinkHandler handler =
                new LinkHandler(
                        linkGeneration,
                        WebSocketClientHandshakerFactory.newHandshaker(
                                uri,
                                WebSocketVersion.V13,
                                null,
                                false,
                                new DefaultHttpHeaders(),
                                MAX_CONTENT_LENGTH));

        Bootstrap bootstrap =
                new Bootstrap()
                        .group(group)
                        .channel(NioSocketChannel.class)
                        .option(ChannelOption.TCP_NODELAY, true)
                        .option(ChannelOption.SO_KEEPALIVE, true)
                        .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeoutMillis)
                        .handler(
                                new ChannelInitializer<SocketChannel>() {
                                    @Override
                                    protected void initChannel(SocketChannel ch) {
                                        ch.pipeline()
                                                .addLast(new HttpClientCodec())
                                                .addLast(
                                                        new HttpObjectAggregator(
                                                                MAX_CONTENT_LENGTH))
                                                .addLast(handler);
                                    }
                                });

        int port = uri.getPort() == -1 ? 80 : uri.getPort();
        LOGGER.fine(() -> "Connecting to " + uri);
        ChannelFuture connectFuture = bootstrap.connect(uri.getHost(), port);
        channel = connectFuture.channel();
        connectFuture.addListener(
                (ChannelFuture f) -> {
                    if (!f.isSuccess()) {
                        loop.execute(() -> linkFailed(linkGeneration, f.cause()));
                    }
                });
    }

    private void linkOpened(int linkGeneration) {
        if (linkGeneration != generation.get() || !active) {
            return;
        }
        linkUp = true;
        boolean reconnected = openFuture == null || openFuture.isDone();
        reconnectContext.reset();
        LOGGER.info(() -> (reconnected ? "Reconnected to " : "Connected to ") + uri);
        notifyListener(l -> l.onOpen(reconnected));
        if (!reconnected) {
            openFuture.complete(null);
        }
    }

    private void linkClosed(int linkGeneration, String reason) {
        if (linkGeneration != generation.get()) {
            return;
        }
        if (!linkUp) {
            linkFailed(linkGeneration, new BridgeException(BridgeError.TRANSPORT_ERROR, reason));
            return;
        }
        generation.incrementAndGet();
        linkUp = false;
        channel = null;
        LOGGER.warning("Link to " + uri + " closed: " + reason);
        notifyListener(l -> l.onClose(reason));
        if (active) {
            scheduleReconnect(null);
        }
    }

    private void linkFailed(int linkGeneration, Throwable cause) {
        if (linkGeneration != generation.get()) {
            return;
        }
        generation.incrementAndGet();
        linkUp = false;
        Channel ch = channel;
        channel = null;
        if (ch != null) {
            ch.close();
        }
        if (openFuture != null && !openFuture.isDone()) {
            active = false;
            failOpen(transportError("Unable to connect to " + uri, cause));
            return;
        }
        if (active) {
            scheduleReconnect(cause);
        }
    }

    private void scheduleReconnect(Throwable cause) {
        if (cause != null) {
            reconnectContext.recordFailure(cause);
        }
        if (!linkPolicy.shouldRetry(reconnectContext)) {
            active = false;
            LOGGER.severe(
                    "Giving up link reconnection to "
                            + uri
                            + " after "
                            + reconnectContext.getAttemptCount()
                            + " attempt(s)");
            BridgeException error =
                    transportError("Link reconnection exhausted", reconnectContext.getLastError());
            notifyListener(l -> l.onError(error));
            return;
        }
        int attempt = reconnectContext.startAttempt();
        long delay = linkPolicy.calculateDelay(reconnectContext);
        reconnectContext.recordDelay(delay);
        LOGGER.info(() -> "Link reconnection attempt " + attempt + " in " + delay + "ms");
        notifyListener(l -> l.onReconnecting(attempt));
        int linkGeneration = generation.get();
        reconnectTimer = loop.schedule(() -> connect(linkGeneration), delay);
    }

    private void cancelReconnect() {
        if (reconnectTimer != null) {
            reconnectTimer.cancel();
            reconnectTimer = null;
        }
    }

    private void failOpen(BridgeException error) {
        if (openFuture != null && !openFuture.isDone()) {
            openFuture.completeExceptionally(error);
        }
    }

    private void deliver(int linkGeneration, String name, JsonNode payload) {
        if (linkGeneration == generation.get() && linkUp) {
            notifyListener(l -> l.onEvent(name, payload));
        }
    }

    private void reportError(int linkGeneration, Throwable cause) {
        if (linkGeneration == generation.get()) {
            notifyListener(l -> l.onError(cause));
        }
    }

    private void notifyListener(Consumer<BridgeChannelListener> call) {
        BridgeChannelListener current = listener;
        if (current == null) {
            return;
        }
        try {
            call.accept(current);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Channel listener threw", e);
        }
    }

    private static BridgeException transportError(String message, Throwable cause) {
        if (cause instanceof BridgeException be) {
            return be;
        }
        return cause == null
                ? new BridgeException(BridgeError.TRANSPORT_ERROR, message)
                : new BridgeException(
                        BridgeError.TRANSPORT_ERROR, message + ": " + cause.getMessage(), cause);
    }

    /** Per-link pipeline handler. A fresh instance per connection attempt. */
    private final class LinkHandler extends SimpleChannelInboundHandler<Object> {
        private final int linkGeneration;
        private final WebSocketClientHandshaker handshaker;

        LinkHandler(int linkGeneration, WebSocketClientHandshaker handshaker) {
            this.linkGeneration = linkGeneration;
            this.handshaker = handshaker;
        }

        @Override
        public void channelActive(ChannelHandlerContext ctx) {
            handshaker.handshake(ctx.channel());
        }

        @Override
        public void channelInactive(ChannelHandlerContext ctx) {
            loop.execute(() -> linkClosed(linkGeneration, "connection closed"));
        }

        @Override
        protected void channelRead0(ChannelHandlerContext ctx, Object msg) {
            Channel ch = ctx.channel();
            if (!handshaker.isHandshakeComplete()) {
                if (msg instanceof FullHttpResponse response) {
                    try {
                        handshaker.finishHandshake(ch, response);
                    } catch (WebSocketHandshakeException e) {
                        LOGGER.log(Level.WARNING, "WebSocket handshake with " + uri + " failed", e);
                        ch.close();
                    }
                }
                return;
            }

            if (msg instanceof FullHttpResponse response) {
                LOGGER.warning("Unexpected HTTP response after handshake: " + response.status());
                ch.close();
                return;
            }
            if (msg instanceof CloseWebSocketFrame) {
                ch.close();
            } else if (msg instanceof TextWebSocketFrame text) {
                onText(ch, text.text());
            } else if (msg instanceof WebSocketFrame frame) {
                LOGGER.fine(() -> "Ignoring " + frame.getClass().getSimpleName());
            }
        }

        private void onText(Channel ch, String text) {
            SocketIoPacket packet;
            try {
                packet = SocketIoFrames.decode(text);
            } catch (FramingException e) {
                LOGGER.log(Level.WARNING, "Dropping malformed frame", e);
                loop.execute(() -> reportError(linkGeneration, e));
                return;
            }

            switch (packet.kind()) {
                case OPEN ->
                        ch.writeAndFlush(
                                new TextWebSocketFrame(SocketIoFrames.encodeConnect(authToken)));
                case PING -> ch.writeAndFlush(new TextWebSocketFrame(SocketIoFrames.enginePong()));
                case CONNECT -> loop.execute(() -> linkOpened(linkGeneration));
                case CONNECT_ERROR -> {
                    String message = Json.text(packet.payload(), "message");
                    LOGGER.warning("Bridge refused namespace connect: " + message);
                    BridgeException error =
                            new BridgeException(
                                    BridgeError.TRANSPORT_ERROR,
                                    "Connect refused: " + (message != null ? message : "unknown"));
                    loop.execute(() -> linkFailed(linkGeneration, error));
                    ch.close();
                }
                case EVENT ->
                        loop.execute(
                                () -> deliver(linkGeneration, packet.event(), packet.payload()));
                case DISCONNECT, CLOSE -> ch.close();
                default -> LOGGER.fine(() -> "Ignoring " + packet.kind() + " packet");
            }
        }

        @Override
        public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
            LOGGER.log(Level.WARNING, "Channel exception on link to " + uri, cause);
            ctx.close();
        }
    }
}
