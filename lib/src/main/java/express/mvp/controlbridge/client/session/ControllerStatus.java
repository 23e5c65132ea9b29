package express.mvp.controlbridge.client.session;

/**
 * The bridge's view of the controller behind it.
 *
 * @param connected whether the bridge reaches the controller
 * @param health {@code healthy}, {@code disconnected}, or whatever the bridge reports
 * @param status free-form status text, may be null
 * @param lastUpdate epoch millis of the last status change, 0 if never reported
 */
public record ControllerStatus(boolean connected, String health, String status, long lastUpdate) {

    public static ControllerStatus unknown() {
        return new ControllerStatus(false, "unknown", null, 0);
    }
}
