package express.mvp.controlbridge.client;

import com.fasterxml.jackson.databind.JsonNode;
import express.mvp.controlbridge.client.channel.BridgeChannel;
import express.mvp.controlbridge.client.channel.BridgeChannelListener;
import express.mvp.controlbridge.client.channel.EventLoop;
import express.mvp.controlbridge.client.lifecycle.ConnectionState;
import express.mvp.controlbridge.client.lifecycle.ConnectionStateListener;
import express.mvp.controlbridge.client.lifecycle.ConnectionStateMachine;
import express.mvp.controlbridge.client.lifecycle.ShutdownCoordinator;
import express.mvp.controlbridge.client.protocol.ComponentRecord;
import express.mvp.controlbridge.client.protocol.InboundEvent;
import express.mvp.controlbridge.client.protocol.InboundEventDecoder;
import express.mvp.controlbridge.client.protocol.Json;
import express.mvp.controlbridge.client.protocol.OutboundEvent;
import express.mvp.controlbridge.client.session.CommandResult;
import express.mvp.controlbridge.client.session.ComponentDirectory;
import express.mvp.controlbridge.client.session.ControllerStatus;
import express.mvp.controlbridge.client.session.HealthMonitor;
import express.mvp.controlbridge.client.session.HealthReport;
import express.mvp.controlbridge.client.session.Latency;
import express.mvp.controlbridge.client.session.ServerIdentity;
import express.mvp.controlbridge.client.session.StateCache;
import express.mvp.controlbridge.client.session.StateSnapshot;
import express.mvp.controlbridge.client.session.SubscriptionRecord;
import express.mvp.controlbridge.client.session.TransactionTable;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns the connection to the bridge and sequences the protocol over it.
 *
 * <h2>Lifecycle</h2>
 *
 * <pre>
 *  DISCONNECTED ──connect()──► CONNECTING ──link open──► IDENTIFYING
 *       ▲                          │                         │ identify ok
 *       │ timeout, link lost       │                         ▼
 *       ◄──────────────────────────┴──────────────────── DISCOVERING
 *       │                                                    │ snapshot or readiness wait
 *       │                                                    ▼
 *       ◄───────────── link lost ────────── DEGRADED ◄─missed pong─► READY
 * </pre>
 *
 * <p>When the channel re-establishes a dropped link on its own, the manager goes through
 * CONNECTING and IDENTIFYING again and re-runs identification and discovery from scratch. If
 * re-identification fails the manager stays in IDENTIFYING: the link is up but commands fail with
 * {@link BridgeError#NOT_IDENTIFIED}.
 *
 * <h2>Threading</h2>
 *
 * <p>Every field below is confined to the {@link EventLoop}; public methods hop onto it. Futures
 * handed out complete on the loop.
 *
 * @see ReconnectDriver
 * @see ControlBridges
 */
public final class ConnectionManager implements ControlBridge, ReconnectDriver.Target {

    private static final Logger LOGGER = Logger.getLogger(ConnectionManager.class.getName());

    private static final Duration DEFAULT_DRAIN = Duration.ofSeconds(5);

    private final BridgeClientConfig config;
    private final EventLoop loop;
    private final BridgeChannel channel;
    private final ConnectionStateMachine stateMachine;
    private final TransactionTable transactions;
    private final StateCache stateCache;
    private final ComponentDirectory directory;
    private final HealthMonitor health;
    private final ShutdownCoordinator shutdown = new ShutdownCoordinator();
    private final ReconnectDriver driver;
    private final List<Consumer<ControllerStatus>> statusListeners = new CopyOnWriteArrayList<>();
    private final Map<String, EventLoop.Scheduled> subscriptionTimeouts = new HashMap<>();

    private volatile ServerIdentity identity;
    private volatile ControllerStatus controllerStatus = ControllerStatus.unknown();

    // Loop-confined
    private CompletableFuture<Void> connectFuture;
    private CompletableFuture<Void> relinkFuture;
    private EventLoop.Scheduled connectTimeout;
    private int session;
    private boolean handshakeRunning;
    private boolean updatesActive;
    private CompletableFuture<InboundEvent.IdentifySuccess> pendingIdentify;
    private CompletableFuture<InboundEvent.ControllerState> pendingDiscovery;
    private CompletableFuture<Void> pendingReadyWait;
    private CompletableFuture<StateSnapshot> pendingRefresh;

    /**
     * Creates a manager. Nothing happens on the wire until {@link #init()} or {@link #connect()}.
     *
     * @param config connection settings
     * @param loop the connection's event loop
     * @param channel channel delivering on {@code loop}
     */
    public ConnectionManager(BridgeClientConfig config, EventLoop loop, BridgeChannel channel) {
        this.config = Objects.requireNonNull(config, "config");
        this.loop = Objects.requireNonNull(loop, "loop");
        this.channel = Objects.requireNonNull(channel, "channel");
        this.stateMachine = new ConnectionStateMachine(config.controllerId());
        this.transactions = new TransactionTable(loop, "mcp");
        this.stateCache = new StateCache(loop::now, config.stateTtl().toMillis());
        this.directory = new ComponentDirectory(config.rolePatterns());
        this.health =
                new HealthMonitor(
                        loop,
                        config.heartbeatInterval().toMillis(),
                        config.livenessInterval().toMillis(),
                        config.pongTimeout().toMillis(),
                        config.maxMissedPongs(),
                        timestamp -> channel.emit(new OutboundEvent.Ping(timestamp)),
                        new HealthListener());
        this.driver =
                new ReconnectDriver(
                        loop,
                        config.initRetryPolicy(),
                        config.healthCheckInterval().toMillis(),
                        this);
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Connection lifecycle
    // ─────────────────────────────────────────────────────────────────────────

    @Override
    public CompletableFuture<Void> init() {
        return onLoop(
                () -> {
                    requireRunning();
                    return driver.start();
                });
    }

    /**
     * Runs one connection attempt end to end: open, identify, discover. A call while an attempt
     * is in flight, including the channel re-establishing a dropped link, returns that attempt.
     *
     * @return future completing in READY, or failing with {@link BridgeError#TRANSPORT_ERROR} or
     *     {@link BridgeError#IDENTIFY_TIMEOUT}
     */
    @Override
    public CompletableFuture<Void> connect() {
        return onLoop(
                () -> {
                    requireRunning();
                    if (isConnectInFlight()) {
                        return joinAttemptInFlight();
                    }
                    if (stateMachine.getState().acceptsCommands()) {
                        return CompletableFuture.completedFuture(null);
                    }
                    if (stateMachine.getState() != ConnectionState.DISCONNECTED) {
                        teardown("restarting connection", true);
                    }
                    return startConnect();
                });
    }

    @Override
    public CompletableFuture<Void> forceReconnect() {
        return onLoop(
                () -> {
                    requireRunning();
                    if (isConnectInFlight()) {
                        LOGGER.fine("Reconnect requested while connecting, joining attempt");
                        return joinAttemptInFlight();
                    }
                    LOGGER.info("Forcing reconnect");
                    teardown("forced reconnect", true);
                    return startConnect();
                });
    }

    @Override
    public CompletableFuture<Void> reconnect() {
        return onLoop(
                () -> {
                    requireRunning();
                    if (!driver.isRunning()) {
                        driver.start();
                    }
                    return forceReconnect();
                });
    }

    @Override
    public void disconnect() {
        runOnLoop(
                () -> {
                    driver.stop();
                    teardown("client disconnect", true);
                });
    }

    @Override
    public ConnectionState state() {
        return stateMachine.getState();
    }

    @Override
    public boolean isConnectInFlight() {
        return (connectFuture != null && !connectFuture.isDone())
                || handshakeRunning
                || stateMachine.getState() == ConnectionState.CONNECTING;
    }

    /**
     * Returns the attempt in flight: the explicit connect, or the channel re-establishing a
     * dropped link on its own.
     */
    private CompletableFuture<Void> joinAttemptInFlight() {
        if (connectFuture != null && !connectFuture.isDone()) {
            return connectFuture;
        }
        if (relinkFuture == null || relinkFuture.isDone()) {
            relinkFuture = new CompletableFuture<>();
        }
        return relinkFuture;
    }

    private void settleRelink(Throwable error) {
        CompletableFuture<Void> future = relinkFuture;
        relinkFuture = null;
        if (future == null) {
            return;
        }
        if (error == null) {
            future.complete(null);
        } else {
            future.completeExceptionally(error);
        }
    }

    private CompletableFuture<Void> startConnect() {
        CompletableFuture<Void> future = new CompletableFuture<>();
        connectFuture = future;
        int attempt = ++session;
        stateMachine.transitionTo(ConnectionState.CONNECTING);
        LOGGER.info(() -> "Connecting to " + config.uri());

        long timeoutMillis = config.connectionTimeout().toMillis();
        connectTimeout =
                loop.schedule(
                        () ->
                                failConnect(
                                        attempt,
                                        new BridgeException(
                                                BridgeError.TRANSPORT_ERROR,
                                                "Connection timeout after "
                                                        + timeoutMillis
                                                        + "ms")),
                        timeoutMillis);

        channel.open(new ChannelEvents())
                .whenComplete(
                        (ignored, error) -> {
                            if (error != null) {
                                runOnLoop(() -> failConnect(attempt, unwrap(error)));
                            }
                        });
        return future;
    }

    /** Fails the in-flight initial connect and drops whatever link it had. */
    private void failConnect(int attempt, Throwable error) {
        if (attempt != session || connectFuture == null || connectFuture.isDone()) {
            return;
        }
        LOGGER.warning("Connect failed: " + error.getMessage());
        CompletableFuture<Void> future = connectFuture;
        connectFuture = null;
        teardown("connect failed", true);
        future.completeExceptionally(asBridgeException(error, BridgeError.TRANSPORT_ERROR));
    }

    private void cancelConnectTimeout() {
        if (connectTimeout != null) {
            connectTimeout.cancel();
            connectTimeout = null;
        }
    }

    /**
     * Link is up: identify, then discover.
     *
     * @param reconnected whether the channel re-established a dropped link by itself
     */
    private void startHandshake(boolean reconnected) {
        cancelConnectTimeout();
        if (reconnected) {
            ++session;
            if (stateMachine.getState() == ConnectionState.DISCONNECTED) {
                stateMachine.transitionTo(ConnectionState.CONNECTING);
            }
        }
        int handshake = session;
        stateMachine.transitionTo(ConnectionState.IDENTIFYING);
        health.start();
        handshakeRunning = true;
        LOGGER.info(reconnected ? "Link re-established, re-identifying" : "Link open, identifying");

        identify()
                .thenCompose(
                        identified -> {
                            if (handshake != session) {
                                return CompletableFuture.completedFuture(null);
                            }
                            stateMachine.transitionTo(ConnectionState.DISCOVERING);
                            return discover();
                        })
                .whenComplete(
                        (ignored, error) -> {
                            if (handshake != session) {
                                return;
                            }
                            handshakeRunning = false;
                            if (error == null) {
                                enterReady();
                            } else {
                                handshakeFailed(reconnected, unwrap(error));
                            }
                        });
    }

    private void handshakeFailed(boolean reconnected, Throwable error) {
        if (reconnected) {
            LOGGER.log(Level.SEVERE, "Failed to re-identify after reconnection", error);
            updateControllerStatus(
                    new ControllerStatus(
                            controllerStatus.connected(),
                            controllerStatus.health(),
                            "re-identification failed: " + error.getMessage(),
                            loop.now()));
            settleRelink(asBridgeException(error, BridgeError.IDENTIFY_TIMEOUT));
            return;
        }
        if (connectFuture != null && !connectFuture.isDone()) {
            CompletableFuture<Void> future = connectFuture;
            connectFuture = null;
            teardown("handshake failed", true);
            future.completeExceptionally(asBridgeException(error, BridgeError.TRANSPORT_ERROR));
        }
    }

    private void enterReady() {
        stateMachine.transitionTo(ConnectionState.READY);
        updatesActive = true;
        LOGGER.info(
                () ->
                        "Bridge ready: "
                                + directory.size()
                                + " component(s), roles "
                                + directory.roles().keySet());
        if (connectFuture != null && !connectFuture.isDone()) {
            connectFuture.complete(null);
        }
        settleRelink(null);
    }

    /**
     * Resets everything tied to the current link.
     *
     * @param reason logged and reported to status listeners
     * @param dropLink whether to close the channel as well
     */
    private void teardown(String reason, boolean dropLink) {
        ++session;
        cancelConnectTimeout();
        if (dropLink) {
            channel.disconnect();
        }
        handshakeRunning = false;
        updatesActive = false;
        identity = null;
        health.stop();

        BridgeException lost =
                new BridgeException(BridgeError.NOT_CONNECTED, "Disconnected: " + reason);
        failPending(
                pendingIdentify,
                new BridgeException(BridgeError.TRANSPORT_ERROR, "Link lost during identify"));
        pendingIdentify = null;
        failPending(pendingDiscovery, lost);
        pendingDiscovery = null;
        failPending(pendingReadyWait, lost);
        pendingReadyWait = null;
        for (EventLoop.Scheduled timeout : subscriptionTimeouts.values()) {
            timeout.cancel();
        }
        subscriptionTimeouts.clear();
        directory.clearSubscriptions(lost);
        int failed = transactions.failAll(lost);
        if (failed > 0) {
            LOGGER.warning("Failed " + failed + " in-flight command(s): " + reason);
        }

        ConnectionState previous = stateMachine.getState();
        if (previous != ConnectionState.DISCONNECTED) {
            stateMachine.transitionTo(ConnectionState.DISCONNECTED);
            LOGGER.warning("Disconnected from bridge: " + reason);
            updateControllerStatus(
                    new ControllerStatus(
                            false, "disconnected", controllerStatus.status(), loop.now()));
        }
        if (connectFuture != null && !connectFuture.isDone()) {
            connectFuture.completeExceptionally(
                    new BridgeException(BridgeError.TRANSPORT_ERROR, "Connection lost: " + reason));
        }
        settleRelink(
                new BridgeException(BridgeError.TRANSPORT_ERROR, "Connection lost: " + reason));
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Handshake steps
    // ─────────────────────────────────────────────────────────────────────────

    private CompletableFuture<ServerIdentity> identify() {
        CompletableFuture<InboundEvent.IdentifySuccess> reply = new CompletableFuture<>();
        pendingIdentify = reply;
        if (!channel.emit(new OutboundEvent.Identify(config.clientMetadata()))) {
            reply.completeExceptionally(
                    new BridgeException(
                            BridgeError.TRANSPORT_ERROR, "Link closed before identify"));
            return reply.thenApply(ignored -> null);
        }
        long timeoutMillis = config.identifyTimeout().toMillis();
        EventLoop.Scheduled timeout =
                loop.schedule(
                        () ->
                                reply.completeExceptionally(
                                        new BridgeException(
                                                BridgeError.IDENTIFY_TIMEOUT,
                                                "No identify response within "
                                                        + timeoutMillis
                                                        + "ms")),
                        timeoutMillis);
        return reply.whenComplete((ok, error) -> timeout.cancel()).thenApply(this::storeIdentity);
    }

    private ServerIdentity storeIdentity(InboundEvent.IdentifySuccess reply) {
        long offset = reply.serverTime() > 0 ? reply.serverTime() - loop.now() : 0;
        ServerIdentity stored =
                new ServerIdentity(
                        reply.socketId(),
                        reply.clientId(),
                        offset,
                        reply.transport(),
                        reply.ipAddress(),
                        reply.connectedAt());
        identity = stored;
        LOGGER.info(
                () ->
                        "Identified by bridge: client "
                                + stored.assignedClientId()
                                + ", socket "
                                + stored.sessionId()
                                + ", transport "
                                + stored.transportKind());
        return stored;
    }

    /**
     * Requests the controller snapshot. An empty or missing snapshot is followed by one wait for
     * a readiness event and one more request; the handshake continues either way.
     */
    private CompletableFuture<Void> discover() {
        int handshake = session;
        return discoverOnce()
                .thenCompose(
                        count -> {
                            if (count > 0 || handshake != session) {
                                return CompletableFuture.completedFuture(count);
                            }
                            LOGGER.info(
                                    "Initial discovery returned no components, waiting for"
                                            + " readiness");
                            return awaitReadiness().thenCompose(ignored -> discoverOnce());
                        })
                .thenAccept(
                        count -> {
                            if (count == 0 && handshake == session) {
                                LOGGER.warning(
                                        BridgeError.DISCOVERY_INCOMPLETE
                                                + ": controller "
                                                + config.controllerId()
                                                + " reported no components");
                            }
                        });
    }

    /** One discovery round. Completes with the component count, 0 on timeout. */
    private CompletableFuture<Integer> discoverOnce() {
        CompletableFuture<InboundEvent.ControllerState> reply = new CompletableFuture<>();
        pendingDiscovery = reply;
        if (!channel.emit(new OutboundEvent.ControllerSubscribe(config.controllerId()))) {
            reply.completeExceptionally(
                    new BridgeException(
                            BridgeError.TRANSPORT_ERROR, "Link closed before discovery"));
        }
        long timeoutMillis = config.discoveryTimeout().toMillis();
        EventLoop.Scheduled timeout =
                loop.schedule(
                        () -> {
                            if (reply.complete(null)) {
                                LOGGER.warning("Discovery timed out after " + timeoutMillis + "ms");
                            }
                        },
                        timeoutMillis);
        return reply.whenComplete((ok, error) -> timeout.cancel()).thenApply(this::applyDiscovery);
    }

    private int applyDiscovery(InboundEvent.ControllerState snapshot) {
        if (pendingDiscovery != null && pendingDiscovery.isDone()) {
            pendingDiscovery = null;
        }
        if (snapshot == null || !snapshot.hasComponents()) {
            return 0;
        }
        updateControllerStatus(
                new ControllerStatus(
                        snapshot.connected(),
                        snapshot.connected() ? "healthy" : "disconnected",
                        controllerStatus.status(),
                        loop.now()));
        Map<String, String> roles = directory.replaceAll(snapshot.components());
        stateCache.applyComponents(snapshot.components());
        LOGGER.info(
                () ->
                        "Discovered "
                                + snapshot.components().size()
                                + " component(s), "
                                + roles.size()
                                + " role(s) resolved");
        for (String componentId : roles.values()) {
            subscribe(componentId, null)
                    .whenComplete(
                            (record, error) -> {
                                if (error != null) {
                                    LOGGER.fine(
                                            () ->
                                                    "Role subscription to "
                                                            + componentId
                                                            + " failed: "
                                                            + unwrap(error).getMessage());
                                }
                            });
        }
        return snapshot.components().size();
    }

    private CompletableFuture<Void> awaitReadiness() {
        CompletableFuture<Void> ready = new CompletableFuture<>();
        pendingReadyWait = ready;
        long timeoutMillis = config.readyWaitTimeout().toMillis();
        EventLoop.Scheduled timeout =
                loop.schedule(
                        () -> {
                            if (ready.complete(null)) {
                                LOGGER.warning(
                                        "No readiness event within "
                                                + timeoutMillis
                                                + "ms, retrying discovery anyway");
                            }
                        },
                        timeoutMillis);
        return ready.whenComplete((ok, error) -> timeout.cancel());
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Inbound events
    // ─────────────────────────────────────────────────────────────────────────

    void dispatch(String name, JsonNode payload) {
        Optional<InboundEvent> decoded = InboundEventDecoder.decode(name, payload);
        if (decoded.isEmpty()) {
            return;
        }
        InboundEvent event = decoded.get();
        if (event instanceof InboundEvent.IdentifySuccess identified) {
            if (pendingIdentify != null && pendingIdentify.complete(identified)) {
                pendingIdentify = null;
            } else {
                LOGGER.fine("Unsolicited identify response ignored");
            }
        } else if (event instanceof InboundEvent.ControllerState snapshot) {
            onControllerState(snapshot);
        } else if (event instanceof InboundEvent.ComponentState componentState) {
            onComponentState(componentState);
        } else if (event instanceof InboundEvent.ControlUpdate update) {
            onControlUpdate(update);
        } else if (event instanceof InboundEvent.ControlSetSuccess success) {
            transactions.resolveSuccess(success.transactionId());
        } else if (event instanceof InboundEvent.ControlSetError failure) {
            transactions.resolveError(failure.transactionId(), failure.message());
        } else if (event instanceof InboundEvent.Pong pong) {
            health.onPong(pong.clientTimestamp());
        } else if (event instanceof InboundEvent.SystemReady ready) {
            LOGGER.info(() -> "System ready, " + ready.controllers() + " controller(s)");
            completeReadyWait();
        } else if (event instanceof InboundEvent.DigitalTwinReady ready) {
            onDigitalTwinReady(ready);
        } else if (event instanceof InboundEvent.ControllerStatus status) {
            LOGGER.info(
                    () ->
                            "Controller "
                                    + status.controllerId()
                                    + " status "
                                    + status.status()
                                    + ", health "
                                    + status.health());
            updateControllerStatus(
                    new ControllerStatus(
                            status.connected(), status.health(), status.status(), loop.now()));
        }
    }

    private void onControllerState(InboundEvent.ControllerState snapshot) {
        if (pendingDiscovery != null && !pendingDiscovery.isDone()) {
            pendingDiscovery.complete(snapshot);
            return;
        }
        if (updatesActive && snapshot.hasComponents()) {
            stateCache.applyComponents(snapshot.components());
        }
    }

    private void onComponentState(InboundEvent.ComponentState event) {
        JsonNode raw = event.raw();
        JsonNode delivered = raw.has("component") ? raw.get("component") : raw;
        if (event.componentId() != null) {
            confirmSubscription(event.componentId(), null, delivered);
        }
        if (event.component() != null && !event.component().id().equals(event.componentId())) {
            confirmSubscription(event.component().id(), null, delivered);
        }
        if (updatesActive && event.component() != null) {
            stateCache.applyComponent(event.component());
        }
    }

    private void onControlUpdate(InboundEvent.ControlUpdate update) {
        if (update.componentId() != null) {
            confirmSubscription(update.componentId(), update.controlId(), update.control());
        }
        if (updatesActive) {
            stateCache.applyControl(update.controlId(), update.control());
        }
    }

    private void onDigitalTwinReady(InboundEvent.DigitalTwinReady ready) {
        LOGGER.info(
                () ->
                        "Digital twin ready: "
                                + ready.controllers()
                                + " controller(s), "
                                + ready.totalComponents()
                                + " component(s)");
        completeReadyWait();
        if (stateMachine.getState().acceptsCommands() && directory.isEmpty()) {
            discoverOnce()
                    .whenComplete(
                            (count, error) -> {
                                if (error != null) {
                                    LOGGER.log(
                                            Level.WARNING,
                                            "Re-discovery after digitaltwin:ready failed",
                                            error);
                                }
                            });
        }
    }

    private void completeReadyWait() {
        if (pendingReadyWait != null) {
            pendingReadyWait.complete(null);
            pendingReadyWait = null;
        }
    }

    private void confirmSubscription(String componentId, String controlId, JsonNode delivered) {
        String key = SubscriptionRecord.key(componentId, controlId);
        Optional<SubscriptionRecord> confirmed =
                directory.confirmSubscription(componentId, controlId, delivered, loop.now());
        if (confirmed.isPresent()) {
            EventLoop.Scheduled timeout = subscriptionTimeouts.remove(key);
            if (timeout != null) {
                timeout.cancel();
            }
        }
    }

    private void updateControllerStatus(ControllerStatus status) {
        controllerStatus = status;
        for (Consumer<ControllerStatus> listener : statusListeners) {
            try {
                listener.accept(status);
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "Status listener threw", e);
            }
        }
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Operations
    // ─────────────────────────────────────────────────────────────────────────

    @Override
    public CompletableFuture<CommandResult> sendControl(
            String target, String controlId, Object value) {
        Objects.requireNonNull(controlId, "controlId");
        if (!shutdown.operationStarted()) {
            return CompletableFuture.failedFuture(
                    new BridgeException(
                            BridgeError.SHUTTING_DOWN, "Bridge client is shutting down"));
        }
        CompletableFuture<CommandResult> result =
                onLoop(
                        () -> {
                            requireCommandsAccepted();
                            String componentId =
                                    directory
                                            .resolveTarget(target)
                                            .orElseThrow(
                                                    () ->
                                                            new BridgeException(
                                                                    BridgeError.COMPONENT_NOT_FOUND,
                                                                    "Component not found: "
                                                                            + target));
                            String transactionId = transactions.nextTransactionId();
                            CompletableFuture<CommandResult> ack =
                                    transactions.register(
                                            transactionId,
                                            componentId,
                                            controlId,
                                            config.commandTimeout().toMillis());
                            OutboundEvent.ControlSet command =
                                    new OutboundEvent.ControlSet(
                                            config.controllerId(),
                                            componentId,
                                            controlId,
                                            Json.toNode(value),
                                            transactionId);
                            if (!channel.emit(command)) {
                                transactions.fail(
                                        transactionId,
                                        new BridgeException(
                                                BridgeError.NOT_CONNECTED, "Link closed"));
                            } else {
                                LOGGER.fine(
                                        () ->
                                                "control:set "
                                                        + componentId
                                                        + "/"
                                                        + controlId
                                                        + " tx "
                                                        + transactionId);
                            }
                            return ack;
                        });
        return result.whenComplete((ok, error) -> shutdown.operationCompleted());
    }

    @Override
    public CompletableFuture<StateSnapshot> getState() {
        return onLoop(
                () -> {
                    if (!stateCache.isStale() || !stateMachine.getState().isIdentified()) {
                        return CompletableFuture.completedFuture(stateCache.snapshot());
                    }
                    if (pendingRefresh != null && !pendingRefresh.isDone()) {
                        return pendingRefresh;
                    }
                    OutboundEvent refreshRequest =
                            new OutboundEvent.ControllerSubscribe(config.controllerId());
                    if (!channel.emit(refreshRequest)) {
                        return CompletableFuture.completedFuture(stateCache.snapshot());
                    }
                    CompletableFuture<StateSnapshot> refresh = new CompletableFuture<>();
                    pendingRefresh = refresh;
                    loop.schedule(
                            () -> refresh.complete(stateCache.snapshot()),
                            config.refreshGrace().toMillis());
                    return refresh;
                });
    }

    @Override
    public Optional<ComponentRecord> findComponent(String name) {
        Objects.requireNonNull(name, "name");
        return directory.findComponent(name);
    }

    /**
     * Returns the component holding a role.
     *
     * @param role role alias such as {@code lighting}
     * @return the component, or empty if the role did not resolve
     */
    public Optional<ComponentRecord> findByRole(String role) {
        return directory.findByRole(role);
    }

    @Override
    public CompletableFuture<SubscriptionRecord> subscribeToComponent(String componentId) {
        Objects.requireNonNull(componentId, "componentId");
        return onLoop(
                () -> {
                    requireIdentified();
                    return subscribe(componentId, null);
                });
    }

    @Override
    public CompletableFuture<SubscriptionRecord> subscribeToControl(
            String componentId, String controlId) {
        Objects.requireNonNull(componentId, "componentId");
        Objects.requireNonNull(controlId, "controlId");
        return onLoop(
                () -> {
                    requireIdentified();
                    return subscribe(componentId, controlId);
                });
    }

    private CompletableFuture<SubscriptionRecord> subscribe(String componentId, String controlId) {
        String key = SubscriptionRecord.key(componentId, controlId);
        Optional<SubscriptionRecord> existing = directory.subscription(key);
        if (existing.isPresent()) {
            LOGGER.fine(() -> "Already subscribed to " + key);
            return CompletableFuture.completedFuture(existing.get());
        }
        Optional<CompletableFuture<SubscriptionRecord>> inFlight =
                directory.pendingSubscription(key);
        if (inFlight.isPresent()) {
            return inFlight.get().copy();
        }

        CompletableFuture<SubscriptionRecord> future = directory.beginSubscription(key);
        OutboundEvent request =
                controlId == null
                        ? new OutboundEvent.ComponentSubscribe(config.controllerId(), componentId)
                        : new OutboundEvent.ControlSubscribe(
                                config.controllerId(), componentId, controlId);
        if (!channel.emit(request)) {
            directory.failSubscription(
                    key, new BridgeException(BridgeError.NOT_CONNECTED, "Link closed"));
            return future.copy();
        }
        long timeoutMillis = config.commandTimeout().toMillis();
        subscriptionTimeouts.put(
                key,
                loop.schedule(
                        () -> {
                            subscriptionTimeouts.remove(key);
                            directory.failSubscription(
                                    key,
                                    new BridgeException(
                                            BridgeError.SUBSCRIBE_TIMEOUT,
                                            "No state for "
                                                    + key
                                                    + " within "
                                                    + timeoutMillis
                                                    + "ms"));
                        },
                        timeoutMillis));
        return future.copy();
    }

    @Override
    public HealthReport getConnectionHealth() {
        ConnectionState state = stateMachine.getState();
        return health.report(state.isLinkUp(), state.isIdentified());
    }

    @Override
    public Latency getLatency() {
        return health.latency();
    }

    @Override
    public ControllerStatus getControllerStatus() {
        return controllerStatus;
    }

    @Override
    public Optional<ServerIdentity> getServerIdentity() {
        return Optional.ofNullable(identity);
    }

    @Override
    public ConnectionState getConnectionState() {
        return stateMachine.getState();
    }

    /**
     * Returns the number of commands waiting for acknowledgement.
     *
     * @return pending commands
     */
    public int pendingCommandCount() {
        return transactions.pendingCount();
    }

    @Override
    public CompletableFuture<Void> awaitReady(Duration timeout) {
        CompletableFuture<Void> ready = new CompletableFuture<>();
        ConnectionStateListener listener =
                (previous, current, cause) -> {
                    if (current.acceptsCommands()) {
                        ready.complete(null);
                    }
                };
        stateMachine.addListener(listener);
        if (stateMachine.getState().acceptsCommands()) {
            ready.complete(null);
        }
        runOnLoop(
                () -> {
                    if (ready.isDone()) {
                        return;
                    }
                    EventLoop.Scheduled timer =
                            loop.schedule(
                                    () ->
                                            ready.completeExceptionally(
                                                    new BridgeException(
                                                            BridgeError.NOT_CONNECTED,
                                                            "Not ready within " + timeout)),
                                    timeout.toMillis());
                    ready.whenComplete((ok, error) -> timer.cancel());
                });
        return ready.whenComplete((ok, error) -> stateMachine.removeListener(listener));
    }

    @Override
    public Registration onStateChange(Consumer<StateSnapshot> listener) {
        stateCache.addListener(listener);
        return () -> stateCache.removeListener(listener);
    }

    @Override
    public Registration onStatusChange(Consumer<ControllerStatus> listener) {
        statusListeners.add(Objects.requireNonNull(listener, "listener"));
        return () -> statusListeners.remove(listener);
    }

    @Override
    public Registration onConnectionStateChange(ConnectionStateListener listener) {
        stateMachine.addListener(listener);
        return () -> stateMachine.removeListener(listener);
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Shutdown
    // ─────────────────────────────────────────────────────────────────────────

    @Override
    public boolean shutdown(Duration drainTimeout) throws InterruptedException {
        return shutdown.shutdown(drainTimeout, this::closeEverything);
    }

    @Override
    public void close() {
        try {
            shutdown(DEFAULT_DRAIN);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warning("Interrupted while shutting down");
        }
    }

    private void closeEverything() {
        CompletableFuture<Void> stopped = new CompletableFuture<>();
        runOnLoop(
                () -> {
                    driver.stop();
                    transactions.failAll(
                            new BridgeException(BridgeError.SHUTTING_DOWN, "Shut down"));
                    teardown("shutdown", true);
                    stopped.complete(null);
                });
        try {
            stopped.get(DEFAULT_DRAIN.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOGGER.warning("Interrupted while stopping the connection");
        } catch (ExecutionException | TimeoutException e) {
            LOGGER.log(Level.WARNING, "Connection did not stop cleanly", e);
        }
        channel.close();
        loop.shutdown();
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Helpers
    // ─────────────────────────────────────────────────────────────────────────

    private void requireRunning() {
        if (!shutdown.isAcceptingOperations()) {
            throw new BridgeException(BridgeError.SHUTTING_DOWN, "Bridge client is shutting down");
        }
    }

    private void requireCommandsAccepted() {
        ConnectionState state = stateMachine.getState();
        if (state.acceptsCommands()) {
            return;
        }
        if (!state.isLinkUp()) {
            throw new BridgeException(BridgeError.NOT_CONNECTED, "Not connected (" + state + ")");
        }
        throw new BridgeException(BridgeError.NOT_IDENTIFIED, "Not identified (" + state + ")");
    }

    private void requireIdentified() {
        ConnectionState state = stateMachine.getState();
        if (!state.isLinkUp()) {
            throw new BridgeException(BridgeError.NOT_CONNECTED, "Not connected (" + state + ")");
        }
        if (!state.isIdentified()) {
            throw new BridgeException(BridgeError.NOT_IDENTIFIED, "Not identified (" + state + ")");
        }
    }

    private <T> CompletableFuture<T> onLoop(Supplier<CompletableFuture<T>> action) {
        if (loop.inEventLoop()) {
            return invoke(action);
        }
        CompletableFuture<T> result = new CompletableFuture<>();
        try {
            loop.execute(
                    () ->
                            invoke(action)
                                    .whenComplete(
                                            (value, error) -> {
                                                if (error != null) {
                                                    result.completeExceptionally(unwrap(error));
                                                } else {
                                                    result.complete(value);
                                                }
                                            }));
        } catch (RejectedExecutionException e) {
            result.completeExceptionally(
                    new BridgeException(BridgeError.SHUTTING_DOWN, "Event loop stopped", e));
        }
        return result;
    }

    private void runOnLoop(Runnable action) {
        if (loop.inEventLoop()) {
            action.run();
            return;
        }
        try {
            loop.execute(action);
        } catch (RejectedExecutionException e) {
            LOGGER.log(Level.FINE, "Event loop stopped, dropping task", e);
        }
    }

    private static <T> CompletableFuture<T> invoke(Supplier<CompletableFuture<T>> action) {
        try {
            return action.get();
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    private static void failPending(CompletableFuture<?> future, BridgeException error) {
        if (future != null) {
            future.completeExceptionally(error);
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static BridgeException asBridgeException(Throwable error, BridgeError fallback) {
        Throwable cause = unwrap(error);
        if (cause instanceof BridgeException be) {
            return be;
        }
        return new BridgeException(fallback, String.valueOf(cause.getMessage()), cause);
    }

    @Override
    public String toString() {
        return "ConnectionManager{"
                + "controller="
                + config.controllerId()
                + ", state="
                + stateMachine.getState()
                + ", "
                + directory
                + ", pendingCommands="
                + transactions.pendingCount()
                + '}';
    }

    /** Channel callbacks, already on the loop. */
    private final class ChannelEvents implements BridgeChannelListener {

        @Override
        public void onOpen(boolean reconnected) {
            startHandshake(reconnected);
        }

        @Override
        public void onReconnecting(int attempt) {
            if (stateMachine.getState() == ConnectionState.DISCONNECTED) {
                stateMachine.transitionTo(ConnectionState.CONNECTING);
            }
            LOGGER.info(() -> "Link reconnection attempt " + attempt);
        }

        @Override
        public void onEvent(String name, JsonNode payload) {
            dispatch(name, payload);
        }

        @Override
        public void onClose(String reason) {
            boolean initial = connectFuture != null && !connectFuture.isDone();
            teardown(reason, initial);
        }

        @Override
        public void onError(Throwable cause) {
            if (cause instanceof BridgeException be
                    && be.getError() == BridgeError.TRANSPORT_ERROR) {
                LOGGER.log(Level.SEVERE, "Link lost for good: " + cause.getMessage(), cause);
                teardown("link reconnection exhausted", true);
            } else {
                LOGGER.log(Level.WARNING, "Channel error", cause);
            }
        }
    }

    /** Liveness reactions. */
    private final class HealthListener implements HealthMonitor.Listener {

        @Override
        public void onPongMissed(int consecutive) {
            if (consecutive >= HealthReport.DEGRADED_MISSED_PONGS
                    && stateMachine.getState() == ConnectionState.READY) {
                stateMachine.transitionTo(ConnectionState.DEGRADED);
            }
        }

        @Override
        public void onPongReceived(long latencyMillis) {
            if (stateMachine.getState() == ConnectionState.DEGRADED) {
                stateMachine.transitionTo(ConnectionState.READY);
            }
        }

        @Override
        public void onStale() {
            forceReconnect()
                    .whenComplete(
                            (ignored, error) -> {
                                if (error != null) {
                                    LOGGER.warning(
                                            "Reconnect after stale connection failed: "
                                                    + unwrap(error).getMessage());
                                }
                            });
        }
    }
}
