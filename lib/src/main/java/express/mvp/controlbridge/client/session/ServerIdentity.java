package express.mvp.controlbridge.client.session;

/**
 * What the bridge told us about this session in {@code client:identify:success}.
 *
 * @param sessionId socket id assigned by the bridge
 * @param assignedClientId client id assigned by the bridge
 * @param serverClockOffsetMillis server time minus local time at receipt, 0 if not reported
 * @param transportKind transport the bridge sees, e.g. {@code websocket}
 * @param observedAddress client address as seen by the bridge
 * @param connectedAt bridge-side connection time as reported
 */
public record ServerIdentity(
        String sessionId,
        String assignedClientId,
        long serverClockOffsetMillis,
        String transportKind,
        String observedAddress,
        String connectedAt) {}
