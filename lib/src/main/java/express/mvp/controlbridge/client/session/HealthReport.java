package express.mvp.controlbridge.client.session;

/**
 * Point-in-time connection health.
 *
 * <h2>Health Levels</h2>
 *
 * <ul>
 *   <li><b>disconnected:</b> the link is down
 *   <li><b>degraded:</b> two or more liveness checks missed in a row
 *   <li><b>stale:</b> no pong for more than a minute
 *   <li><b>healthy:</b> anything else
 * </ul>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * HealthReport report = bridge.getConnectionHealth();
 * if (report.health() != HealthReport.Level.HEALTHY) {
 *     LOGGER.warning("Bridge " + report.health().wireName()
 *         + ", " + report.secondsSinceLastPong() + "s since last pong");
 * }
 * }</pre>
 */
public final class HealthReport {

    /** Consecutive missed pongs at which the connection counts as degraded. */
    public static final int DEGRADED_MISSED_PONGS = 2;
    static final long STALE_AFTER_MILLIS = 60_000;

    /** Health levels, in order of precedence. */
    public enum Level {
        DISCONNECTED("disconnected"),
        DEGRADED("degraded"),
        STALE("stale"),
        HEALTHY("healthy");

        private final String wireName;

        Level(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }
    }

    private final Level health;
    private final boolean connected;
    private final boolean identified;
    private final long lastPingSentAt;
    private final long lastPongReceivedAt;
    private final long secondsSinceLastPong;
    private final int missedPongs;
    private final long averageLatencyMillis;

    private HealthReport(Builder builder) {
        this.connected = builder.connected;
        this.identified = builder.identified;
        this.lastPingSentAt = builder.lastPingSentAt;
        this.lastPongReceivedAt = builder.lastPongReceivedAt;
        this.missedPongs = builder.missedPongs;
        this.averageLatencyMillis = builder.averageLatencyMillis;
        long sinceLastPong = builder.now - builder.lastPongReceivedAt;
        this.secondsSinceLastPong = Math.round(sinceLastPong / 1000.0);
        if (!connected) {
            this.health = Level.DISCONNECTED;
        } else if (missedPongs >= DEGRADED_MISSED_PONGS) {
            this.health = Level.DEGRADED;
        } else if (sinceLastPong > STALE_AFTER_MILLIS) {
            this.health = Level.STALE;
        } else {
            this.health = Level.HEALTHY;
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public Level health() {
        return health;
    }

    public boolean connected() {
        return connected;
    }

    public boolean identified() {
        return identified;
    }

    public long lastPingSentAt() {
        return lastPingSentAt;
    }

    public long lastPongReceivedAt() {
        return lastPongReceivedAt;
    }

    public long secondsSinceLastPong() {
        return secondsSinceLastPong;
    }

    public int missedPongs() {
        return missedPongs;
    }

    public long averageLatencyMillis() {
        return averageLatencyMillis;
    }

    @Override
    public String toString() {
        return "HealthReport{"
                + health.wireName()
                + ", connected="
                + connected
                + ", identified="
                + identified
                + ", missedPongs="
                + missedPongs
                + ", sinceLastPong="
                + secondsSinceLastPong
                + "s, latency="
                + averageLatencyMillis
                + "ms}";
    }

    /** Builder for {@link HealthReport}. */
    public static final class Builder {
        private long now;
        private boolean connected;
        private boolean identified;
        private long lastPingSentAt;
        private long lastPongReceivedAt;
        private int missedPongs;
        private long averageLatencyMillis;

        private Builder() {}

        /**
         * Sets the evaluation time.
         *
         * @param epochMillis the time the report describes
         * @return this builder
         */
        public Builder now(long epochMillis) {
            this.now = epochMillis;
            return this;
        }

        public Builder connected(boolean connected) {
            this.connected = connected;
            return this;
        }

        public Builder identified(boolean identified) {
            this.identified = identified;
            return this;
        }

        public Builder health(ConnectionHealth health) {
            this.lastPingSentAt = health.lastPingSentAt();
            this.lastPongReceivedAt = health.lastPongReceivedAt();
            this.missedPongs = health.consecutiveMissedPongs();
            return this;
        }

        public Builder averageLatencyMillis(long millis) {
            this.averageLatencyMillis = millis;
            return this;
        }

        public HealthReport build() {
            return new HealthReport(this);
        }
    }
}
