package express.mvp.controlbridge.client;

/** Handle returned by listener registration. */
@FunctionalInterface
public interface Registration {

    /** Removes the listener. Removing twice is a no-op. */
    void remove();
}
