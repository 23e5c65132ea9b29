package express.mvp.controlbridge.client.error;

/**
 * Categories of bridge failures for retry and recovery decisions.
 *
 * <ul>
 *   <li><b>TRANSIENT:</b> a timed-out handshake step or command; retry after a short delay
 *   <li><b>NETWORK:</b> the link to the bridge is down or refused; reconnect with backoff
 *   <li><b>PROTOCOL:</b> the bridge answered but rejected the request or the target is unknown
 *   <li><b>FATAL:</b> the client is shutting down or the JVM is in trouble; never retried
 *   <li><b>UNKNOWN:</b> anything else; conservatively retried
 * </ul>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * ErrorCategory category = ErrorClassifier.classify(exception);
 * if (category.requiresReconnect()) {
 *     manager.reconnect();
 * }
 * }</pre>
 *
 * @see ErrorClassifier
 * @see RetryPolicy
 */
public enum ErrorCategory {

    /**
     * Timeouts waiting for the bridge: identification, discovery, a command acknowledgement or a
     * subscription response.
     */
    TRANSIENT(true, "Transient error - may succeed on retry"),

    /**
     * The link itself failed: connection refused, reset, WebSocket handshake failure, Socket.IO
     * connect error.
     */
    NETWORK(true, "Network error - reconnection required"),

    /**
     * The bridge is reachable but the request cannot succeed as issued: remote rejection of a
     * control value, unknown component, malformed frames.
     */
    PROTOCOL(false, "Protocol error - not retryable by the connection layer"),

    /** Shutdown in progress, JVM errors, security violations. */
    FATAL(false, "Fatal error - shutdown required"),

    /** Unclassified. */
    UNKNOWN(true, "Unknown error - conservative retry");

    private final boolean retryable;
    private final String description;

    ErrorCategory(boolean retryable, String description) {
        this.retryable = retryable;
        this.description = description;
    }

    /**
     * Checks if errors in this category are generally retryable.
     *
     * @return true if a retry is appropriate
     */
    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Returns a human-readable description of this category.
     *
     * @return the description
     */
    public String description() {
        return description;
    }

    /**
     * Checks if this error calls for tearing the link down and connecting again.
     *
     * @return true for NETWORK
     */
    public boolean requiresReconnect() {
        return this == NETWORK;
    }

    /**
     * Checks if this is a fatal error.
     *
     * @return true only for FATAL
     */
    public boolean isFatal() {
        return this == FATAL;
    }

    @Override
    public String toString() {
        return name() + " (" + description + ")";
    }
}
