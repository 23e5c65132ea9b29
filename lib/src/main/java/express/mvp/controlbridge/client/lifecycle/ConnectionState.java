package express.mvp.controlbridge.client.lifecycle;

/**
 * States of the bridge connection.
 *
 * <h2>State Diagram</h2>
 *
 * <pre>
 * DISCONNECTED ──▶ CONNECTING ──▶ IDENTIFYING ──▶ DISCOVERING ──▶ READY ◀──▶ DEGRADED
 *      ▲               │               │               │            │            │
 *      └───────────────┴───────────────┴───────────────┴────────────┴────────────┘
 *                                 disconnect / failure
 * </pre>
 *
 * <ul>
 *   <li>{@link #DISCONNECTED}: no link; the initial state
 *   <li>{@link #CONNECTING}: link being opened (first time or by the link-level retry)
 *   <li>{@link #IDENTIFYING}: link up, waiting for {@code client:identify:success}
 *   <li>{@link #DISCOVERING}: identified, waiting for the controller snapshot
 *   <li>{@link #READY}: commands accepted
 *   <li>{@link #DEGRADED}: commands accepted but heartbeats are going unanswered
 * </ul>
 *
 * @see ConnectionStateMachine
 */
public enum ConnectionState {
    DISCONNECTED("Disconnected"),
    CONNECTING("Connecting"),
    IDENTIFYING("Identifying"),
    DISCOVERING("Discovering"),
    READY("Ready"),
    DEGRADED("Degraded");

    private final String displayName;

    ConnectionState(String displayName) {
        this.displayName = displayName;
    }

    /**
     * Returns a human-readable name.
     *
     * @return the display name
     */
    public String displayName() {
        return displayName;
    }

    /**
     * Checks whether the transport link is up in this state.
     *
     * @return true from IDENTIFYING onwards
     */
    public boolean isLinkUp() {
        return this == IDENTIFYING || this == DISCOVERING || this == READY || this == DEGRADED;
    }

    /**
     * Checks whether the handshake has established a session identity.
     *
     * @return true for DISCOVERING, READY and DEGRADED
     */
    public boolean isIdentified() {
        return this == DISCOVERING || this == READY || this == DEGRADED;
    }

    /**
     * Checks whether commands may be issued.
     *
     * @return true for READY and DEGRADED
     */
    public boolean acceptsCommands() {
        return this == READY || this == DEGRADED;
    }
}
