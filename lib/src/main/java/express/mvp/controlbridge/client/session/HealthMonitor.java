package express.mvp.controlbridge.client.session;

import express.mvp.controlbridge.client.channel.EventLoop;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.LongPredicate;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Heartbeat and liveness loops for one connection.
 *
 * <h2>Loops</h2>
 *
 * <ul>
 *   <li><b>Heartbeat</b> (every {@code heartbeatMillis}): emits a ping carrying the local time.
 *       The matching pong gives a latency sample.
 *   <li><b>Liveness</b> (every {@code livenessMillis}): if the last ping is newer than the last
 *       pong and the last pong is older than {@code pongTimeoutMillis}, one more pong counts as
 *       missed. At {@code maxMissedPongs} the connection is declared stale once and the counter
 *       starts over.
 * </ul>
 *
 * <p>Both loops run on the connection's {@link EventLoop} from {@link #start()} to {@link
 * #stop()}. Confined to that loop apart from the read-only accessors.
 */
public final class HealthMonitor {

    private static final Logger LOGGER = Logger.getLogger(HealthMonitor.class.getName());

    /** Reactions to liveness changes. */
    public interface Listener {

        /**
         * A liveness check failed.
         *
         * @param consecutive failures in a row, including this one
         */
        default void onPongMissed(int consecutive) {}

        /**
         * A pong arrived.
         *
         * @param latencyMillis round trip, or -1 when the pong carried no timestamp
         */
        default void onPongReceived(long latencyMillis) {}

        /** {@code maxMissedPongs} checks failed in a row. */
        void onStale();
    }

    private final EventLoop loop;
    private final long heartbeatMillis;
    private final long livenessMillis;
    private final long pongTimeoutMillis;
    private final int maxMissedPongs;
    private final LongPredicate pingEmitter;
    private final Listener listener;
    private final LatencySamples latency = new LatencySamples();

    private volatile long lastPingSentAt;
    private volatile long lastPongReceivedAt;
    private volatile int missedPongs;
    private EventLoop.Scheduled heartbeatTask;
    private EventLoop.Scheduled livenessTask;

    /**
     * Creates a monitor.
     *
     * @param loop loop for both timers and the clock
     * @param heartbeatMillis heartbeat period
     * @param livenessMillis liveness check period
     * @param pongTimeoutMillis silence after which a pending ping counts as missed
     * @param maxMissedPongs missed checks that make the connection stale
     * @param pingEmitter sends a ping with the given timestamp; false if nothing was sent
     * @param listener liveness reactions
     */
    public HealthMonitor(
            EventLoop loop,
            long heartbeatMillis,
            long livenessMillis,
            long pongTimeoutMillis,
            int maxMissedPongs,
            LongPredicate pingEmitter,
            Listener listener) {
        this.loop = Objects.requireNonNull(loop, "loop");
        this.heartbeatMillis = heartbeatMillis;
        this.livenessMillis = livenessMillis;
        this.pongTimeoutMillis = pongTimeoutMillis;
        this.maxMissedPongs = maxMissedPongs;
        this.pingEmitter = Objects.requireNonNull(pingEmitter, "pingEmitter");
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    /** Resets the bookkeeping and (re)starts both loops. */
    public void start() {
        stop();
        reset();
        heartbeatTask =
                loop.scheduleAtFixedRate(this::heartbeat, heartbeatMillis, heartbeatMillis);
        livenessTask =
                loop.scheduleAtFixedRate(this::checkLiveness, livenessMillis, livenessMillis);
    }

    /** Cancels both loops. The bookkeeping is kept for reporting. */
    public void stop() {
        if (heartbeatTask != null) {
            heartbeatTask.cancel();
            heartbeatTask = null;
        }
        if (livenessTask != null) {
            livenessTask.cancel();
            livenessTask = null;
        }
    }

    public boolean isRunning() {
        return heartbeatTask != null;
    }

    /** Treats the connection as freshly heard from. */
    public void reset() {
        lastPongReceivedAt = loop.now();
        missedPongs = 0;
    }

    /**
     * Records a pong.
     *
     * @param clientTimestamp the timestamp echoed back, 0 or less when absent
     */
    public void onPong(long clientTimestamp) {
        long now = loop.now();
        lastPongReceivedAt = now;
        missedPongs = 0;
        long sample = -1;
        if (clientTimestamp > 0) {
            sample = Math.max(0, now - clientTimestamp);
            latency.add(sample);
            long measured = sample;
            LOGGER.fine(() -> "Latency " + measured + "ms, average " + latency.average() + "ms");
        }
        fire(listener::onPongReceived, sample);
    }

    void heartbeat() {
        long now = loop.now();
        if (pingEmitter.test(now)) {
            lastPingSentAt = now;
        }
    }

    void checkLiveness() {
        long now = loop.now();
        long sinceLastPong = now - lastPongReceivedAt;
        if (lastPingSentAt <= lastPongReceivedAt || sinceLastPong <= pongTimeoutMillis) {
            return;
        }
        int missed = ++missedPongs;
        LOGGER.warning(
                "Missed pong "
                        + missed
                        + "/"
                        + maxMissedPongs
                        + " ("
                        + sinceLastPong
                        + "ms since last pong)");
        fire(listener::onPongMissed, missed);
        if (missed >= maxMissedPongs) {
            LOGGER.severe("Connection stale after " + missed + " missed pongs");
            missedPongs = 0;
            try {
                listener.onStale();
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "Stale handler threw", e);
            }
        }
    }

    public ConnectionHealth connectionHealth() {
        return new ConnectionHealth(
                lastPingSentAt, lastPongReceivedAt, missedPongs, maxMissedPongs, pongTimeoutMillis);
    }

    public Latency latency() {
        return latency.snapshot();
    }

    /**
     * Builds a health report.
     *
     * @param connected whether the link is up
     * @param identified whether the handshake completed
     * @return the report
     */
    public HealthReport report(boolean connected, boolean identified) {
        return HealthReport.builder()
                .now(loop.now())
                .connected(connected)
                .identified(identified)
                .health(connectionHealth())
                .averageLatencyMillis(latency.average())
                .build();
    }

    private static <T> void fire(Consumer<T> callback, T value) {
        try {
            callback.accept(value);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Health listener threw", e);
        }
    }
}
