package express.mvp.controlbridge.client.lifecycle;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * State machine for the bridge connection lifecycle.
 *
 * <p>Transitions are the only way the connection state changes, and only the edges below are
 * accepted; anything else is refused and reported as {@code false}.
 *
 * <h2>Valid Transitions</h2>
 *
 * <pre>
 * DISCONNECTED → CONNECTING
 * CONNECTING   → IDENTIFYING, DISCONNECTED
 * IDENTIFYING  → DISCOVERING, DISCONNECTED
 * DISCOVERING  → READY, DISCONNECTED
 * READY        → DEGRADED, DISCONNECTED
 * DEGRADED     → READY, DISCONNECTED
 * </pre>
 *
 * <p>Reads are safe from any thread. The connection manager performs all transitions from its
 * event loop.
 *
 * @see ConnectionState
 * @see ConnectionStateListener
 */
public final class ConnectionStateMachine {

    private static final Logger LOGGER = Logger.getLogger(ConnectionStateMachine.class.getName());

    private static final Map<ConnectionState, Set<ConnectionState>> TRANSITIONS =
            new EnumMap<>(ConnectionState.class);

    static {
        TRANSITIONS.put(ConnectionState.DISCONNECTED, EnumSet.of(ConnectionState.CONNECTING));
        TRANSITIONS.put(
                ConnectionState.CONNECTING,
                EnumSet.of(ConnectionState.IDENTIFYING, ConnectionState.DISCONNECTED));
        TRANSITIONS.put(
                ConnectionState.IDENTIFYING,
                EnumSet.of(ConnectionState.DISCOVERING, ConnectionState.DISCONNECTED));
        TRANSITIONS.put(
                ConnectionState.DISCOVERING,
                EnumSet.of(ConnectionState.READY, ConnectionState.DISCONNECTED));
        TRANSITIONS.put(
                ConnectionState.READY,
                EnumSet.of(ConnectionState.DEGRADED, ConnectionState.DISCONNECTED));
        TRANSITIONS.put(
                ConnectionState.DEGRADED,
                EnumSet.of(ConnectionState.READY, ConnectionState.DISCONNECTED));
    }

    private final AtomicReference<ConnectionState> state =
            new AtomicReference<>(ConnectionState.DISCONNECTED);

    private final List<ConnectionStateListener> listeners = new CopyOnWriteArrayList<>();

    /** Optional identifier used in logs. */
    private final String connectionId;

    /** Creates a state machine in {@link ConnectionState#DISCONNECTED}. */
    public ConnectionStateMachine() {
        this(null);
    }

    /**
     * Creates a state machine with an identifier for logging.
     *
     * @param connectionId identifier for this connection
     */
    public ConnectionStateMachine(String connectionId) {
        this.connectionId = connectionId;
    }

    public ConnectionState getState() {
        return state.get();
    }

    public String getConnectionId() {
        return connectionId;
    }

    /**
     * Registers a listener for state changes.
     *
     * @param listener the listener to register
     */
    public void addListener(ConnectionStateListener listener) {
        listeners.add(listener);
    }

    /**
     * Removes a previously registered listener.
     *
     * @param listener the listener to remove
     * @return true if the listener was found and removed
     */
    public boolean removeListener(ConnectionStateListener listener) {
        return listeners.remove(listener);
    }

    /**
     * Attempts to transition to a new state.
     *
     * @param newState the desired state
     * @return true if the transition was valid and applied
     */
    public boolean transitionTo(ConnectionState newState) {
        return transitionTo(newState, null);
    }

    /**
     * Attempts to transition to a new state with a cause.
     *
     * @param newState the desired state
     * @param cause the reason for the transition, may be null
     * @return true if the transition was valid and applied
     */
    public boolean transitionTo(ConnectionState newState, Throwable cause) {
        while (true) {
            ConnectionState current = state.get();
            if (!isValidTransition(current, newState)) {
                return false;
            }
            if (state.compareAndSet(current, newState)) {
                LOGGER.fine(() -> label() + current + " -> " + newState);
                notifyListeners(current, newState, cause);
                return true;
            }
        }
    }

    /**
     * Transitions only if the current state is {@code expectedState}.
     *
     * @param expectedState the expected current state
     * @param newState the desired state
     * @return true if applied
     */
    public boolean transitionFrom(ConnectionState expectedState, ConnectionState newState) {
        if (!isValidTransition(expectedState, newState)) {
            return false;
        }
        if (state.compareAndSet(expectedState, newState)) {
            LOGGER.fine(() -> label() + expectedState + " -> " + newState);
            notifyListeners(expectedState, newState, null);
            return true;
        }
        return false;
    }

    /**
     * Checks if a transition is one of the accepted edges.
     *
     * @param from the source state
     * @param to the target state
     * @return true if the edge is accepted
     */
    public static boolean isValidTransition(ConnectionState from, ConnectionState to) {
        return from != to && TRANSITIONS.get(from).contains(to);
    }

    /**
     * Returns the set of states reachable in one step.
     *
     * @param from the source state
     * @return a copy of the target set
     */
    public static Set<ConnectionState> getValidTransitions(ConnectionState from) {
        Set<ConnectionState> targets = TRANSITIONS.get(from);
        return targets.isEmpty() ? EnumSet.noneOf(ConnectionState.class) : EnumSet.copyOf(targets);
    }

    private void notifyListeners(
            ConnectionState previous, ConnectionState current, Throwable cause) {
        for (ConnectionStateListener listener : listeners) {
            try {
                listener.onStateChanged(previous, current, cause);
            } catch (Exception e) {
                LOGGER.log(Level.WARNING, "Connection state listener failed", e);
            }
        }
    }

    private String label() {
        return connectionId == null ? "" : "[" + connectionId + "] ";
    }

    @Override
    public String toString() {
        return connectionId != null
                ? "ConnectionStateMachine[" + connectionId + ":" + state.get() + "]"
                : "ConnectionStateMachine[" + state.get() + "]";
    }
}
