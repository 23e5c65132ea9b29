package express.mvp.controlbridge.client.lifecycle;

/**
 * Callback for connection state changes.
 *
 * <p>Invoked synchronously on the thread performing the transition, which for the connection
 * manager is its event loop. Implementations must be quick and must not block.
 *
 * @see ConnectionStateMachine
 */
@FunctionalInterface
public interface ConnectionStateListener {

    /**
     * Called when the connection state changes.
     *
     * @param previousState the state before the transition
     * @param currentState the new state
     * @param cause the reason for the transition, may be null
     */
    void onStateChanged(
            ConnectionState previousState, ConnectionState currentState, Throwable cause);
}
