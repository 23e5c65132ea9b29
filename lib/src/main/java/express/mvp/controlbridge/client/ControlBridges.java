package express.mvp.controlbridge.client;

import express.mvp.controlbridge.client.channel.NettyBridgeChannel;
import express.mvp.controlbridge.client.channel.SingleThreadEventLoop;

/**
 * Factory for bridge clients.
 *
 * <p>Wires a {@link ConnectionManager} to its own event loop and a Netty WebSocket channel. The
 * returned client owns both; {@link ControlBridge#close()} releases them.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * BridgeClientConfig config = BridgeClientConfig.builder()
 *     .host("bridge.local")
 *     .port(3001)
 *     .controllerId("ctrl-01")
 *     .build();
 *
 * try (ControlBridge bridge = ControlBridges.create(config)) {
 *     bridge.init().join();
 *     bridge.findComponent("Lighting").ifPresent(c -> LOGGER.info("Lights: " + c.id()));
 * }
 * }</pre>
 *
 * @see BridgeClientConfig
 * @see ConnectionManager
 */
public final class ControlBridges {

    private ControlBridges() {
        // Utility class
    }

    /**
     * Creates a client. Nothing connects until {@link ControlBridge#init()}.
     *
     * @param config connection settings
     * @return a new client
     */
    public static ConnectionManager create(BridgeClientConfig config) {
        SingleThreadEventLoop loop = new SingleThreadEventLoop();
        NettyBridgeChannel channel = new NettyBridgeChannel(config, loop);
        return new ConnectionManager(config, loop, channel);
    }

    /**
     * Creates a client configured from the process environment.
     *
     * @return a new client
     * @throws IllegalArgumentException if an environment value is malformed
     */
    public static ConnectionManager fromEnvironment() {
        return create(BridgeClientConfig.fromEnvironment());
    }
}
