/**
 * The duplex event channel to the bridge and the event loop it delivers on.
 *
 * <p>{@link express.mvp.controlbridge.client.channel.NettyBridgeChannel} is the production
 * channel. Everything above this package sees only {@link
 * express.mvp.controlbridge.client.channel.BridgeChannel} callbacks, already serialized onto an
 * {@link express.mvp.controlbridge.client.channel.EventLoop}.
 */
package express.mvp.controlbridge.client.channel;
