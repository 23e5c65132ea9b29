package express.mvp.controlbridge.client.session;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * A confirmed subscription.
 *
 * @param key {@code componentId} or {@code componentId:controlId}
 * @param componentId subscribed component
 * @param controlId subscribed control, null for a whole-component subscription
 * @param subscribedAt epoch millis of confirmation
 * @param lastDelivered the most recent component or control state delivered for the key
 */
public record SubscriptionRecord(
        String key,
        String componentId,
        String controlId,
        long subscribedAt,
        JsonNode lastDelivered) {

    /**
     * Builds the subscription key.
     *
     * @param componentId component id
     * @param controlId control id, or null
     * @return the key
     */
    public static String key(String componentId, String controlId) {
        return controlId == null ? componentId : componentId + ":" + controlId;
    }

    /**
     * Returns this subscription with a newer delivered state.
     *
     * @param delivered the state just delivered
     * @return the refreshed record
     */
    public SubscriptionRecord withLastDelivered(JsonNode delivered) {
        return new SubscriptionRecord(key, componentId, controlId, subscribedAt, delivered);
    }

    public boolean isControlSubscription() {
        return controlId != null;
    }
}
