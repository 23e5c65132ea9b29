package express.mvp.controlbridge.client.channel;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Callbacks from a {@link BridgeChannel}. Always invoked on the channel's {@link EventLoop}.
 */
public interface BridgeChannelListener {

    /**
     * The namespace connect was acknowledged and events can flow.
     *
     * @param reconnected true when this follows a link-level reconnection rather than {@link
     *     BridgeChannel#open}
     */
    void onOpen(boolean reconnected);

    /**
     * The link dropped and the channel is about to retry.
     *
     * @param attempt 1-based reconnection attempt
     */
    default void onReconnecting(int attempt) {}

    /**
     * An application event arrived.
     *
     * @param name event name
     * @param payload first event argument, never null
     */
    void onEvent(String name, JsonNode payload);

    /**
     * The link closed. Follows every {@link #onOpen}.
     *
     * @param reason short description
     */
    void onClose(String reason);

    /**
     * A failure that does not by itself close the link, or link-level reconnection gave up.
     *
     * @param cause the failure
     */
    default void onError(Throwable cause) {}
}
