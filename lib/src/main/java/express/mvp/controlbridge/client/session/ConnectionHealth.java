package express.mvp.controlbridge.client.session;

/**
 * Heartbeat bookkeeping for the current connection.
 *
 * @param lastPingSentAt epoch millis of the last heartbeat, 0 if none yet
 * @param lastPongReceivedAt epoch millis of the last pong, or of the reset at connect
 * @param consecutiveMissedPongs liveness checks failed in a row
 * @param maxMissedPongs failures that make the connection stale
 * @param pongTimeoutMillis silence after which a pending ping counts as missed
 */
public record ConnectionHealth(
        long lastPingSentAt,
        long lastPongReceivedAt,
        int consecutiveMissedPongs,
        int maxMissedPongs,
        long pongTimeoutMillis) {}
