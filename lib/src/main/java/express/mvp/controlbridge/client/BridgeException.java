package express.mvp.controlbridge.client;

import java.util.Objects;

/**
 * Unchecked exception for every failure surfaced by the connection manager.
 *
 * <p>Asynchronous operations complete their futures exceptionally with this type; inspect
 * {@link #getError()} to decide whether to retry, tell the user, or give up.
 *
 * <pre>{@code
 * manager.sendControl("lighting", "ZoneDimLevel1", 40).exceptionally(e -> {
 *     Throwable cause = e instanceof CompletionException ? e.getCause() : e;
 *     if (cause instanceof BridgeException be && be.getError() == BridgeError.COMMAND_REJECTED) {
 *         // remote said no
 *     }
 *     return null;
 * });
 * }</pre>
 */
public class BridgeException extends RuntimeException {

    private final BridgeError error;

    /**
     * Constructs a new bridge exception.
     *
     * @param error the failure kind
     * @param message the detail message
     */
    public BridgeException(BridgeError error, String message) {
        super(message);
        this.error = Objects.requireNonNull(error, "error");
    }

    /**
     * Constructs a new bridge exception with a cause.
     *
     * @param error the failure kind
     * @param message the detail message
     * @param cause the underlying cause
     */
    public BridgeException(BridgeError error, String message, Throwable cause) {
        super(message, cause);
        this.error = Objects.requireNonNull(error, "error");
    }

    /**
     * Returns the failure kind.
     *
     * @return the kind, never null
     */
    public BridgeError getError() {
        return error;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + error + "]: " + getMessage();
    }
}
