package express.mvp.controlbridge.client;

import express.mvp.controlbridge.client.channel.EventLoop;
import express.mvp.controlbridge.client.error.ErrorClassifier;
import express.mvp.controlbridge.client.error.RetryContext;
import express.mvp.controlbridge.client.error.RetryPolicy;
import express.mvp.controlbridge.client.lifecycle.ConnectionState;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Connects a {@link Target} with retries, then keeps an eye on it.
 *
 * <h2>Behavior</h2>
 *
 * <ol>
 *   <li>{@link #start()} calls {@link Target#connect()} up to {@code maxAttempts} times, pacing
 *       attempts with the policy's backoff and giving up early on errors the policy does not
 *       retry.
 *   <li>A periodic health check then runs every {@code healthCheckMillis}. It calls {@code
 *       connect()} when the target is disconnected, and {@code forceReconnect()} when the target
 *       has a link but never finished identifying. It does nothing while a connect is in flight.
 * </ol>
 *
 * <p>The driver knows nothing about the protocol; it only sees the target's state.
 */
public final class ReconnectDriver {

    private static final Logger LOGGER = Logger.getLogger(ReconnectDriver.class.getName());

    /** What the driver keeps connected. */
    public interface Target {

        CompletableFuture<Void> connect();

        CompletableFuture<Void> forceReconnect();

        ConnectionState state();

        /**
         * Returns whether a connect, handshake, or link-level reconnection is under way.
         *
         * @return true while the target is working on its own
         */
        boolean isConnectInFlight();
    }

    private final EventLoop loop;
    private final RetryPolicy policy;
    private final long healthCheckMillis;
    private final Target target;

    // Loop-confined
    private CompletableFuture<Void> retrying;
    private EventLoop.Scheduled healthCheck;
    private EventLoop.Scheduled retryTimer;
    private volatile boolean running;

    /**
     * Creates a driver.
     *
     * @param loop loop for timers
     * @param policy retry policy for {@link #start()}
     * @param healthCheckMillis period of the background health check
     * @param target what to keep connected
     */
    public ReconnectDriver(
            EventLoop loop, RetryPolicy policy, long healthCheckMillis, Target target) {
        this.loop = Objects.requireNonNull(loop, "loop");
        this.policy = Objects.requireNonNull(policy, "policy");
        this.healthCheckMillis = healthCheckMillis;
        this.target = Objects.requireNonNull(target, "target");
    }

    /**
     * Connects with retries and starts the health check. Must be called on the loop.
     *
     * @return future completing on the first successful connect, or failing with the last error
     *     once the policy gives up
     */
    public CompletableFuture<Void> start() {
        running = true;
        if (healthCheck == null) {
            healthCheck =
                    loop.scheduleAtFixedRate(
                            this::healthCheck, healthCheckMillis, healthCheckMillis);
        }
        return connectWithRetry();
    }

    /** Stops the health check and any pending retry. Must be called on the loop. */
    public void stop() {
        running = false;
        if (healthCheck != null) {
            healthCheck.cancel();
            healthCheck = null;
        }
        if (retryTimer != null) {
            retryTimer.cancel();
            retryTimer = null;
        }
        if (retrying != null && !retrying.isDone()) {
            retrying.completeExceptionally(
                    new BridgeException(BridgeError.NOT_CONNECTED, "Reconnect driver stopped"));
        }
        retrying = null;
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Returns whether a retry sequence is in progress.
     *
     * @return true between the first attempt and success or give-up
     */
    public boolean isRetrying() {
        return retrying != null && !retrying.isDone();
    }

    CompletableFuture<Void> connectWithRetry() {
        if (isRetrying()) {
            return retrying;
        }
        CompletableFuture<Void> result = new CompletableFuture<>();
        retrying = result;
        attempt(new RetryContext("connect", policy.getMaxAttempts(), loop::now), result);
        return result;
    }

    private void attempt(RetryContext context, CompletableFuture<Void> result) {
        if (result.isDone()) {
            return;
        }
        int attempt = context.startAttempt();
        LOGGER.info(() -> "Connect attempt " + attempt + "/" + policy.getMaxAttempts());
        target.connect()
                .whenComplete(
                        (ignored, error) -> {
                            if (error == null) {
                                result.complete(null);
                                return;
                            }
                            loop.execute(() -> attemptFailed(context, result, error));
                        });
    }

    private void attemptFailed(
            RetryContext context, CompletableFuture<Void> result, Throwable error) {
        if (result.isDone()) {
            return;
        }
        context.recordFailure(error);
        if (!running || !policy.shouldRetry(context)) {
            LOGGER.log(
                    Level.SEVERE,
                    "Giving up connecting after "
                            + context.getAttemptCount()
                            + " attempt(s): "
                            + ErrorClassifier.describeError(error),
                    error);
            result.completeExceptionally(unwrap(error));
            return;
        }
        long delay = policy.calculateDelay(context);
        context.recordDelay(delay);
        LOGGER.warning(
                "Connect attempt "
                        + context.getAttemptCount()
                        + " failed ("
                        + ErrorClassifier.describeError(error)
                        + "), retrying in "
                        + delay
                        + "ms");
        retryTimer = loop.schedule(() -> attempt(context, result), delay);
    }

    void healthCheck() {
        if (!running || isRetrying() || target.isConnectInFlight()) {
            return;
        }
        ConnectionState state = target.state();
        if (state == ConnectionState.DISCONNECTED) {
            LOGGER.info("Health check found the connection down, reconnecting");
            target.connect()
                    .whenComplete(
                            (ignored, error) -> {
                                if (error != null) {
                                    LOGGER.warning(
                                            "Health check reconnect failed: "
                                                    + ErrorClassifier.describeError(error));
                                }
                            });
        } else if (state == ConnectionState.IDENTIFYING) {
            LOGGER.warning("Health check found the connection unidentified, forcing reconnect");
            target.forceReconnect()
                    .whenComplete(
                            (ignored, error) -> {
                                if (error != null) {
                                    LOGGER.warning(
                                            "Forced reconnect failed: "
                                                    + ErrorClassifier.describeError(error));
                                }
                            });
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while (current instanceof CompletionException
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
