/**
 * The bridge wire protocol.
 *
 * <ul>
 *   <li>{@link express.mvp.controlbridge.client.protocol.SocketIoFrames} - Engine.IO / Socket.IO
 *       text frame codec
 *   <li>{@link express.mvp.controlbridge.client.protocol.OutboundEvent} - events the client emits
 *   <li>{@link express.mvp.controlbridge.client.protocol.InboundEvent} - closed set of events the
 *       client understands, produced by {@link
 *       express.mvp.controlbridge.client.protocol.InboundEventDecoder}
 * </ul>
 */
package express.mvp.controlbridge.client.protocol;
