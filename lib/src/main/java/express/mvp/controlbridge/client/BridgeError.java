package express.mvp.controlbridge.client;

import express.mvp.controlbridge.client.error.ErrorCategory;

/**
 * Kinds of failure the connection manager reports.
 *
 * <p>Transport failures and timeouts are retried by the reconnect driver. Remote rejections and
 * unknown components are returned to the caller for domain-specific handling.
 */
public enum BridgeError {

    /** The link could not be opened or dropped while opening. */
    TRANSPORT_ERROR(ErrorCategory.NETWORK),

    /** The bridge did not answer {@code client:identify} in time. */
    IDENTIFY_TIMEOUT(ErrorCategory.TRANSIENT),

    /** Discovery returned no components. Logged only; the connection still becomes ready. */
    DISCOVERY_INCOMPLETE(ErrorCategory.TRANSIENT),

    /** A command was issued while the link is down. */
    NOT_CONNECTED(ErrorCategory.NETWORK),

    /** A command was issued while the link is up but the handshake has not completed. */
    NOT_IDENTIFIED(ErrorCategory.TRANSIENT),

    /** The target is neither a component id nor a resolved role. */
    COMPONENT_NOT_FOUND(ErrorCategory.PROTOCOL),

    /** No acknowledgement arrived for a command in time. */
    COMMAND_TIMEOUT(ErrorCategory.TRANSIENT),

    /** The bridge answered a command with {@code control:set:error}. */
    COMMAND_REJECTED(ErrorCategory.PROTOCOL),

    /** No state arrived for a component or control subscription in time. */
    SUBSCRIBE_TIMEOUT(ErrorCategory.TRANSIENT),

    /** The manager is shutting down and no longer accepts work. */
    SHUTTING_DOWN(ErrorCategory.FATAL);

    private final ErrorCategory category;

    BridgeError(ErrorCategory category) {
        this.category = category;
    }

    /**
     * Returns the retry category for this kind.
     *
     * @return the category
     */
    public ErrorCategory category() {
        return category;
    }
}
