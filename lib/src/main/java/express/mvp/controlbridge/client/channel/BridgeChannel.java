package express.mvp.controlbridge.client.channel;

import express.mvp.controlbridge.client.protocol.OutboundEvent;
import java.util.concurrent.CompletableFuture;

/**
 * A persistent duplex event channel to the bridge.
 *
 * <p>A channel owns one link at a time. After {@link #open} succeeds it keeps that link alive on
 * its own: when the link drops unexpectedly it reports {@link BridgeChannelListener#onClose},
 * retries, and reports {@link BridgeChannelListener#onOpen} with {@code reconnected = true} once
 * a new link is up. {@link #disconnect()} stops that.
 */
public interface BridgeChannel {

    /**
     * Opens a link.
     *
     * <p>Any existing link is dropped first, without link-level retry. The future completes on
     * the channel's event loop once the bridge acknowledges the namespace connect, and fails with
     * the connect error otherwise. The caller bounds the wait.
     *
     * @param listener receives every callback for this link and its reconnections
     * @return future completing when the link is open
     */
    CompletableFuture<Void> open(BridgeChannelListener listener);

    /**
     * Sends an event.
     *
     * @param event the event
     * @return false when no link is open and the event was not sent
     */
    boolean emit(OutboundEvent event);

    boolean isOpen();

    /** Closes the current link and stops link-level reconnection. The channel can be reopened. */
    void disconnect();

    /** Disconnects and releases I/O resources. The channel cannot be reopened. */
    void close();
}
