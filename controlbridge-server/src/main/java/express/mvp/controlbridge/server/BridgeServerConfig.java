package express.mvp.controlbridge.server;

import express.mvp.controlbridge.client.protocol.SocketIoFrames;
import java.util.Objects;

/**
 * Configuration for a {@link BridgeServer}.
 *
 * <table border="1">
 *   <caption>Configuration options</caption>
 *   <tr><th>Option</th><th>Default</th><th>Description</th></tr>
 *   <tr><td>host</td><td>127.0.0.1</td><td>Bind address</td></tr>
 *   <tr><td>port</td><td>3001</td><td>TCP port, 0 for an ephemeral one</td></tr>
 *   <tr><td>path</td><td>/socket.io/</td><td>WebSocket upgrade path</td></tr>
 *   <tr><td>authToken</td><td>none</td><td>Token required in the namespace connect</td></tr>
 *   <tr><td>pingIntervalMillis</td><td>25000</td><td>Engine.IO ping interval</td></tr>
 *   <tr><td>pingTimeoutMillis</td><td>20000</td><td>Engine.IO ping timeout</td></tr>
 * </table>
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * BridgeServerConfig config = BridgeServerConfig.builder()
 *     .host("0.0.0.0")
 *     .port(3001)
 *     .authToken("secret")
 *     .build();
 * }</pre>
 *
 * @see BridgeServer
 */
public final class BridgeServerConfig {

    private final String host;
    private final int port;
    private final String path;
    private final String authToken;
    private final long pingIntervalMillis;
    private final long pingTimeoutMillis;

    private BridgeServerConfig(Builder builder) {
        this.host = builder.host;
        this.port = builder.port;
        this.path = builder.path;
        this.authToken = builder.authToken;
        this.pingIntervalMillis = builder.pingIntervalMillis;
        this.pingTimeoutMillis = builder.pingTimeoutMillis;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getHost() {
        return host;
    }

    /**
     * Returns the configured port.
     *
     * @return the port, 0 meaning the OS picks one (see {@link BridgeServer#getPort()})
     */
    public int getPort() {
        return port;
    }

    public String getPath() {
        return path;
    }

    /**
     * Returns the token clients must present.
     *
     * @return the token, or null if connects are not checked
     */
    public String getAuthToken() {
        return authToken;
    }

    public long getPingIntervalMillis() {
        return pingIntervalMillis;
    }

    public long getPingTimeoutMillis() {
        return pingTimeoutMillis;
    }

    @Override
    public String toString() {
        return "BridgeServerConfig{"
                + "host='"
                + host
                + '\''
                + ", port="
                + port
                + ", path='"
                + path
                + '\''
                + ", auth="
                + (authToken == null ? "none" : "****")
                + '}';
    }

    /** Builder for {@link BridgeServerConfig}. */
    public static final class Builder {
        private String host = "127.0.0.1";
        private int port = 3001;
        private String path = SocketIoFrames.DEFAULT_PATH;
        private String authToken;
        private long pingIntervalMillis = 25_000;
        private long pingTimeoutMillis = 20_000;

        private Builder() {}

        public Builder host(String host) {
            this.host = Objects.requireNonNull(host, "host");
            return this;
        }

        /**
         * Sets the port.
         *
         * @param port 0..65535, 0 for ephemeral
         * @return this builder
         */
        public Builder port(int port) {
            if (port < 0 || port > 65535) {
                throw new IllegalArgumentException("port must be 0..65535: " + port);
            }
            this.port = port;
            return this;
        }

        public Builder path(String path) {
            Objects.requireNonNull(path, "path");
            if (!path.startsWith("/")) {
                throw new IllegalArgumentException("path must start with '/': " + path);
            }
            this.path = path;
            return this;
        }

        public Builder authToken(String authToken) {
            this.authToken = authToken == null || authToken.isEmpty() ? null : authToken;
            return this;
        }

        public Builder pingIntervalMillis(long pingIntervalMillis) {
            if (pingIntervalMillis <= 0) {
                throw new IllegalArgumentException("pingIntervalMillis must be positive");
            }
            this.pingIntervalMillis = pingIntervalMillis;
            return this;
        }

        public Builder pingTimeoutMillis(long pingTimeoutMillis) {
            if (pingTimeoutMillis <= 0) {
                throw new IllegalArgumentException("pingTimeoutMillis must be positive");
            }
            this.pingTimeoutMillis = pingTimeoutMillis;
            return this;
        }

        public BridgeServerConfig build() {
            return new BridgeServerConfig(this);
        }
    }
}
