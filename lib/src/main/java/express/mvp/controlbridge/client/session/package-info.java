/**
 * Per-connection session state: outstanding commands, the mirrored remote state, the component
 * directory with its subscriptions, and connection health.
 *
 * <p>Everything here is confined to the connection's {@link
 * express.mvp.controlbridge.client.channel.EventLoop}; snapshots and reports handed out are
 * immutable.
 */
package express.mvp.controlbridge.client.session;
