package express.mvp.controlbridge.client.lifecycle;

/**
 * Phases of a graceful shutdown.
 *
 * <pre>
 * RUNNING → DRAINING → TERMINATED
 * </pre>
 */
public enum ShutdownPhase {

    /** Commands are accepted. */
    RUNNING,

    /** New commands are refused; in-flight commands are allowed to resolve. */
    DRAINING,

    /** Channel and event loop are closed. */
    TERMINATED;

    public boolean isAcceptingOperations() {
        return this == RUNNING;
    }

    public boolean isTerminated() {
        return this == TERMINATED;
    }
}
