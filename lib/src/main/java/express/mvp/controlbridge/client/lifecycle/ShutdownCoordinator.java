package express.mvp.controlbridge.client.lifecycle;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Coordinates a graceful shutdown of the connection manager.
 *
 * <p>Every command registers itself with {@link #operationStarted()} and reports back through
 * {@link #operationCompleted()} once it resolved (acknowledged, rejected or timed out).
 * {@link #shutdown(Duration, Runnable)} stops accepting new commands, waits for the in-flight
 * ones to drain up to a deadline, then runs the closer.
 *
 * <h2>Shutdown Flow</h2>
 *
 * <pre>
 * shutdown()
 *   └─▶ RUNNING → DRAINING   refuse new commands, wait for in-flight (≤ drainTimeout)
 *   └─▶ closer.run()         close the channel, stop timers
 *   └─▶ DRAINING → TERMINATED
 * </pre>
 *
 * <p>Thread-safe. {@code shutdown} blocks the caller and must not be called from the event loop,
 * since the commands it waits for resolve there.
 */
public final class ShutdownCoordinator {

    private static final Logger LOGGER = Logger.getLogger(ShutdownCoordinator.class.getName());

    private final AtomicReference<ShutdownPhase> phase =
            new AtomicReference<>(ShutdownPhase.RUNNING);

    private final AtomicInteger inFlightOperations = new AtomicInteger(0);

    private final CountDownLatch drainCompleteLatch = new CountDownLatch(1);

    private final CountDownLatch terminatedLatch = new CountDownLatch(1);

    public ShutdownPhase getPhase() {
        return phase.get();
    }

    public boolean isAcceptingOperations() {
        return phase.get().isAcceptingOperations();
    }

    public boolean isTerminated() {
        return phase.get().isTerminated();
    }

    public int getInFlightCount() {
        return inFlightOperations.get();
    }

    /**
     * Records that a command has started.
     *
     * @return true if accepted, false if shutdown is in progress
     */
    public boolean operationStarted() {
        while (true) {
            if (!phase.get().isAcceptingOperations()) {
                return false;
            }
            int current = inFlightOperations.get();
            if (inFlightOperations.compareAndSet(current, current + 1)) {
                if (phase.get().isAcceptingOperations()) {
                    return true;
                }
                // Shutdown started between the two checks
                operationCompleted();
                return false;
            }
        }
    }

    /** Records that a command has resolved, whatever the outcome. */
    public void operationCompleted() {
        int remaining = inFlightOperations.decrementAndGet();
        if (remaining < 0) {
            inFlightOperations.set(0);
            remaining = 0;
        }
        if (remaining == 0 && phase.get() == ShutdownPhase.DRAINING) {
            drainCompleteLatch.countDown();
        }
    }

    /**
     * Performs the shutdown. Only the first caller drains and closes; later callers wait for
     * termination.
     *
     * @param drainTimeout maximum time to wait for in-flight commands
     * @param closer closes the channel and releases resources
     * @return true if every in-flight command resolved before the deadline
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean shutdown(Duration drainTimeout, Runnable closer) throws InterruptedException {
        if (!phase.compareAndSet(ShutdownPhase.RUNNING, ShutdownPhase.DRAINING)) {
            return terminatedLatch.await(drainTimeout.toMillis(), TimeUnit.MILLISECONDS);
        }

        long started = System.nanoTime();
        int draining = inFlightOperations.get();
        if (draining == 0) {
            drainCompleteLatch.countDown();
        }
        LOGGER.info(() -> "Shutting down, draining " + draining + " in-flight command(s)");

        boolean drained = drainCompleteLatch.await(drainTimeout.toMillis(), TimeUnit.MILLISECONDS);
        if (!drained) {
            LOGGER.warning(
                    "Drain timed out with " + inFlightOperations.get() + " command(s) unresolved");
        }

        try {
            if (closer != null) {
                closer.run();
            }
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Error while closing during shutdown", e);
        } finally {
            phase.set(ShutdownPhase.TERMINATED);
            terminatedLatch.countDown();
        }

        LOGGER.info(
                () ->
                        "Shutdown complete in "
                                + TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - started)
                                + "ms (graceful="
                                + drained
                                + ")");
        return drained;
    }
}
