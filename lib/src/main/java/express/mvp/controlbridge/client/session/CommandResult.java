package express.mvp.controlbridge.client.session;

/**
 * Outcome of an acknowledged {@code control:set}.
 *
 * @param success always true; failures complete the future exceptionally instead
 * @param transactionId correlation id of the command
 * @param componentId resolved component id
 * @param controlId control that was set
 * @param roundTripMillis time from emit to acknowledgement
 */
public record CommandResult(
        boolean success,
        String transactionId,
        String componentId,
        String controlId,
        long roundTripMillis) {}
