/**
 * Client for a room-control bridge reachable over Socket.IO.
 *
 * <p>The client connects, identifies itself, discovers the components of one controller and keeps
 * a cached view of their state. Commands go out as {@code control:set} and resolve when the bridge
 * acknowledges them.
 *
 * <h2>Key Types</h2>
 *
 * <ul>
 *   <li>{@link express.mvp.controlbridge.client.ControlBridge} - Public client API
 *   <li>{@link express.mvp.controlbridge.client.ControlBridges} - Creates wired clients
 *   <li>{@link express.mvp.controlbridge.client.BridgeClientConfig} - Connection settings
 *   <li>{@link express.mvp.controlbridge.client.ConnectionManager} - Connection lifecycle
 *   <li>{@link express.mvp.controlbridge.client.ReconnectDriver} - Retry and health check
 * </ul>
 *
 * @see express.mvp.controlbridge.client.channel.NettyBridgeChannel
 * @see express.mvp.controlbridge.client.session.StateCache
 */
package express.mvp.controlbridge.client;
