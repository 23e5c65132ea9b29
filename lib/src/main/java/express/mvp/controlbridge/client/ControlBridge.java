package express.mvp.controlbridge.client;

import express.mvp.controlbridge.client.lifecycle.ConnectionState;
import express.mvp.controlbridge.client.lifecycle.ConnectionStateListener;
import express.mvp.controlbridge.client.protocol.ComponentRecord;
import express.mvp.controlbridge.client.session.CommandResult;
import express.mvp.controlbridge.client.session.ControllerStatus;
import express.mvp.controlbridge.client.session.HealthReport;
import express.mvp.controlbridge.client.session.Latency;
import express.mvp.controlbridge.client.session.ServerIdentity;
import express.mvp.controlbridge.client.session.StateSnapshot;
import express.mvp.controlbridge.client.session.SubscriptionRecord;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * A persistent connection to a control bridge, as seen by the code that routes user requests.
 *
 * <p>Asynchronous operations never block the caller. Their futures fail with {@link
 * BridgeException}; {@link BridgeException#getError()} tells which precondition or remote step
 * failed. Futures complete on the connection's event loop, so dependent stages should not block.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * try (ControlBridge bridge = ControlBridges.create(BridgeClientConfig.fromEnvironment())) {
 *     bridge.init().join();
 *
 *     bridge.sendControl("lighting", "ZoneDimLevel1", 40)
 *           .thenAccept(r -> LOGGER.info("Dimmed, tx " + r.transactionId()));
 *
 *     StateSnapshot state = bridge.getState().join();
 * }
 * }</pre>
 *
 * @see ControlBridges
 */
public interface ControlBridge extends AutoCloseable {

    /**
     * Connects, retrying with backoff, and keeps reconnecting in the background afterwards.
     *
     * @return future completing once the connection is ready, or failing when every attempt
     *     failed
     */
    CompletableFuture<Void> init();

    /**
     * Returns the cached remote state, refreshing it first when older than the TTL.
     *
     * @return the snapshot
     */
    CompletableFuture<StateSnapshot> getState();

    /**
     * Sets a remote control and waits for the acknowledgement.
     *
     * @param target component id, or a role alias such as {@code lighting}
     * @param controlId control name
     * @param value new value: number, boolean, string, or a JSON node
     * @return the acknowledged result
     */
    CompletableFuture<CommandResult> sendControl(String target, String controlId, Object value);

    /**
     * Finds the first discovered component whose name contains {@code name}, ignoring case.
     *
     * @param name part of the component name
     * @return the component, or empty
     */
    Optional<ComponentRecord> findComponent(String name);

    /**
     * Subscribes to a component. Idempotent for the lifetime of the connection.
     *
     * @param componentId component id
     * @return the subscription, confirmed by the first state delivery
     */
    CompletableFuture<SubscriptionRecord> subscribeToComponent(String componentId);

    /**
     * Subscribes to one control of a component. Idempotent for the lifetime of the connection.
     *
     * @param componentId component id
     * @param controlId control name
     * @return the subscription, confirmed by the first update of that control
     */
    CompletableFuture<SubscriptionRecord> subscribeToControl(String componentId, String controlId);

    HealthReport getConnectionHealth();

    Latency getLatency();

    ControllerStatus getControllerStatus();

    /**
     * Returns what the bridge reported about this session.
     *
     * @return the identity, or empty while not identified
     */
    Optional<ServerIdentity> getServerIdentity();

    ConnectionState getConnectionState();

    /**
     * Waits for the connection to accept commands.
     *
     * @param timeout maximum wait
     * @return future completing when ready, failing with {@link BridgeError#NOT_CONNECTED} on
     *     timeout
     */
    CompletableFuture<Void> awaitReady(Duration timeout);

    /** Closes the connection and stops background reconnection until {@link #reconnect()}. */
    void disconnect();

    /**
     * Tears the connection down and connects again. Returns the in-flight attempt if one is
     * already running.
     *
     * @return future completing once ready again
     */
    CompletableFuture<Void> reconnect();

    Registration onStateChange(Consumer<StateSnapshot> listener);

    Registration onStatusChange(Consumer<ControllerStatus> listener);

    Registration onConnectionStateChange(ConnectionStateListener listener);

    /**
     * Stops accepting commands, waits for outstanding ones, then closes everything.
     *
     * @param drainTimeout maximum wait for outstanding commands
     * @return true if every outstanding command resolved in time
     * @throws InterruptedException if interrupted while draining
     */
    boolean shutdown(Duration drainTimeout) throws InterruptedException;

    /** Shuts down with a five second drain. */
    @Override
    void close();
}
