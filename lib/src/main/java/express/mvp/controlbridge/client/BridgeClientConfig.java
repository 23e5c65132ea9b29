package express.mvp.controlbridge.client;

import express.mvp.controlbridge.client.error.RetryPolicy;
import express.mvp.controlbridge.client.protocol.ClientMetadata;
import express.mvp.controlbridge.client.protocol.SocketIoFrames;
import express.mvp.controlbridge.client.session.RolePattern;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Configuration for a bridge connection.
 *
 * <p>Immutable. Build one with {@link #builder()} or load it from the process environment with
 * {@link #fromEnvironment(Map)}.
 *
 * <h2>Configuration Options</h2>
 *
 * <table border="1">
 *   <caption>Bridge Client Configuration</caption>
 *   <tr><th>Parameter</th><th>Env var</th><th>Default</th></tr>
 *   <tr><td>host</td><td>WEBSOCKET_HOST</td><td>127.0.0.1</td></tr>
 *   <tr><td>port</td><td>WEBSOCKET_PORT</td><td>3004</td></tr>
 *   <tr><td>controllerId</td><td>CONTROLLER_ID</td><td>modular-controller-config</td></tr>
 *   <tr><td>authToken</td><td>WEBSOCKET_AUTH_TOKEN</td><td>none</td></tr>
 *   <tr><td>reconnectionDelayBase</td><td>RECONNECTION_DELAY_BASE</td><td>1s</td></tr>
 *   <tr><td>reconnectionDelayMax</td><td>RECONNECTION_DELAY_MAX</td><td>30s</td></tr>
 *   <tr><td>reconnectionAttempts</td><td>RECONNECTION_ATTEMPTS</td><td>0 (unlimited)</td></tr>
 *   <tr><td>connectionTimeout</td><td>CONNECTION_TIMEOUT</td><td>20s</td></tr>
 *   <tr><td>identifyTimeout</td><td>IDENTIFY_TIMEOUT</td><td>5s</td></tr>
 *   <tr><td>commandTimeout</td><td>COMMAND_TIMEOUT</td><td>10s</td></tr>
 *   <tr><td>discoveryTimeout</td><td>DISCOVERY_TIMEOUT</td><td>10s</td></tr>
 *   <tr><td>readyWaitTimeout</td><td></td><td>30s</td></tr>
 *   <tr><td>stateTtl / refreshGrace</td><td></td><td>5s / 100ms</td></tr>
 *   <tr><td>heartbeatInterval / livenessInterval</td><td></td><td>25s / 30s</td></tr>
 *   <tr><td>pongTimeout / maxMissedPongs</td><td></td><td>30s / 3</td></tr>
 *   <tr><td>initAttempts / healthCheckInterval</td><td></td><td>10 / 30s</td></tr>
 * </table>
 *
 * <p>Durations read from the environment are in milliseconds.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * BridgeClientConfig config = BridgeClientConfig.builder()
 *     .host("10.0.0.12")
 *     .port(3004)
 *     .controllerId("boardroom")
 *     .commandTimeout(Duration.ofSeconds(5))
 *     .build();
 *
 * ControlBridge bridge = ControlBridges.create(config);
 * bridge.init().join();
 * }</pre>
 *
 * @see ControlBridges
 */
public final class BridgeClientConfig {

    static final String DEFAULT_APP_VERSION = "2.1.0";

    private final String host;
    private final int port;
    private final String path;
    private final String controllerId;
    private final String authToken;
    private final Duration reconnectionDelayBase;
    private final Duration reconnectionDelayMax;
    private final int reconnectionAttempts;
    private final Duration connectionTimeout;
    private final Duration identifyTimeout;
    private final Duration commandTimeout;
    private final Duration discoveryTimeout;
    private final Duration readyWaitTimeout;
    private final Duration stateTtl;
    private final Duration refreshGrace;
    private final Duration heartbeatInterval;
    private final Duration livenessInterval;
    private final Duration pongTimeout;
    private final int maxMissedPongs;
    private final int initAttempts;
    private final Duration healthCheckInterval;
    private final ClientMetadata clientMetadata;
    private final List<RolePattern> rolePatterns;

    private BridgeClientConfig(Builder builder) {
        this.host = builder.host;
        this.port = builder.port;
        this.path = builder.path;
        this.controllerId = builder.controllerId;
        this.authToken = builder.authToken;
        this.reconnectionDelayBase = builder.reconnectionDelayBase;
        this.reconnectionDelayMax = builder.reconnectionDelayMax;
        this.reconnectionAttempts = builder.reconnectionAttempts;
        this.connectionTimeout = builder.connectionTimeout;
        this.identifyTimeout = builder.identifyTimeout;
        this.commandTimeout = builder.commandTimeout;
        this.discoveryTimeout = builder.discoveryTimeout;
        this.readyWaitTimeout = builder.readyWaitTimeout;
        this.stateTtl = builder.stateTtl;
        this.refreshGrace = builder.refreshGrace;
        this.heartbeatInterval = builder.heartbeatInterval;
        this.livenessInterval = builder.livenessInterval;
        this.pongTimeout = builder.pongTimeout;
        this.maxMissedPongs = builder.maxMissedPongs;
        this.initAttempts = builder.initAttempts;
        this.healthCheckInterval = builder.healthCheckInterval;
        this.clientMetadata = builder.clientMetadata;
        this.rolePatterns = List.copyOf(builder.rolePatterns);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a configuration with every default.
     *
     * @return default configuration
     */
    public static BridgeClientConfig defaults() {
        return builder().build();
    }

    /**
     * Loads configuration from the process environment.
     *
     * @return configuration
     * @throws IllegalArgumentException if a variable holds a malformed number
     */
    public static BridgeClientConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Loads configuration from environment-style variables. Unset and blank variables keep their
     * defaults.
     *
     * @param env variable map
     * @return configuration
     * @throws IllegalArgumentException if a variable holds a malformed number
     */
    public static BridgeClientConfig fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        Builder builder = builder();
        String host = value(env, "WEBSOCKET_HOST");
        if (host != null) {
            builder.host(host);
        }
        String port = value(env, "WEBSOCKET_PORT");
        if (port != null) {
            builder.port(parseInt("WEBSOCKET_PORT", port));
        }
        String controllerId = value(env, "CONTROLLER_ID");
        if (controllerId != null) {
            builder.controllerId(controllerId);
        }
        builder.authToken(value(env, "WEBSOCKET_AUTH_TOKEN"));

        Duration base = millis(env, "RECONNECTION_DELAY_BASE");
        if (base != null) {
            builder.reconnectionDelayBase(base);
        }
        Duration max = millis(env, "RECONNECTION_DELAY_MAX");
        if (max != null) {
            builder.reconnectionDelayMax(max);
        }
        String attempts = value(env, "RECONNECTION_ATTEMPTS");
        if (attempts != null) {
            builder.reconnectionAttempts(parseInt("RECONNECTION_ATTEMPTS", attempts));
        }
        Duration connect = millis(env, "CONNECTION_TIMEOUT");
        if (connect != null) {
            builder.connectionTimeout(connect);
        }
        Duration identify = millis(env, "IDENTIFY_TIMEOUT");
        if (identify != null) {
            builder.identifyTimeout(identify);
        }
        Duration command = millis(env, "COMMAND_TIMEOUT");
        if (command != null) {
            builder.commandTimeout(command);
        }
        Duration discovery = millis(env, "DISCOVERY_TIMEOUT");
        if (discovery != null) {
            builder.discoveryTimeout(discovery);
        }

        String buildNumber = value(env, "BUILD_NUMBER");
        String deviceName = value(env, "DEVICE_NAME");
        if (buildNumber != null || deviceName != null) {
            ClientMetadata defaults = defaultMetadata();
            builder.clientMetadata(
                    new ClientMetadata(
                            defaults.platform(),
                            defaults.device(),
                            defaults.osVersion(),
                            defaults.appVersion(),
                            buildNumber != null ? buildNumber : defaults.buildNumber(),
                            deviceName != null ? deviceName : defaults.deviceName()));
        }
        return builder.build();
    }

    /**
     * Returns the WebSocket endpoint, including the Engine.IO query.
     *
     * @return the URI
     */
    public URI uri() {
        return URI.create(
                "ws://" + host + ":" + port + path + "?" + SocketIoFrames.WEBSOCKET_QUERY);
    }

    /**
     * Returns the policy the channel uses for link-level reconnection.
     *
     * @return retry policy built from the reconnection delay and attempt settings
     */
    public RetryPolicy linkRetryPolicy() {
        return RetryPolicy.builder()
                .maxAttempts(reconnectionAttempts)
                .initialDelay(reconnectionDelayBase)
                .maxDelay(reconnectionDelayMax)
                .build();
    }

    /**
     * Returns the policy the reconnect driver uses for whole-connect retries.
     *
     * @return retry policy with {@link #initAttempts()} attempts
     */
    public RetryPolicy initRetryPolicy() {
        return RetryPolicy.builder()
                .maxAttempts(initAttempts)
                .initialDelay(reconnectionDelayBase)
                .maxDelay(reconnectionDelayMax)
                .build();
    }

    public String host() {
        return host;
    }

    public int port() {
        return port;
    }

    public String path() {
        return path;
    }

    public String controllerId() {
        return controllerId;
    }

    /**
     * Returns the token passed in the Socket.IO namespace connect.
     *
     * @return the token, or null when none is configured
     */
    public String authToken() {
        return authToken;
    }

    public Duration reconnectionDelayBase() {
        return reconnectionDelayBase;
    }

    public Duration reconnectionDelayMax() {
        return reconnectionDelayMax;
    }

    /**
     * Returns the link-level reconnection attempt limit.
     *
     * @return attempts, 0 or less meaning unlimited
     */
    public int reconnectionAttempts() {
        return reconnectionAttempts;
    }

    public Duration connectionTimeout() {
        return connectionTimeout;
    }

    public Duration identifyTimeout() {
        return identifyTimeout;
    }

    public Duration commandTimeout() {
        return commandTimeout;
    }

    public Duration discoveryTimeout() {
        return discoveryTimeout;
    }

    /**
     * Returns how long discovery waits for a readiness event when the first snapshot is empty.
     *
     * @return the wait
     */
    public Duration readyWaitTimeout() {
        return readyWaitTimeout;
    }

    public Duration stateTtl() {
        return stateTtl;
    }

    public Duration refreshGrace() {
        return refreshGrace;
    }

    public Duration heartbeatInterval() {
        return heartbeatInterval;
    }

    public Duration livenessInterval() {
        return livenessInterval;
    }

    public Duration pongTimeout() {
        return pongTimeout;
    }

    public int maxMissedPongs() {
        return maxMissedPongs;
    }

    public int initAttempts() {
        return initAttempts;
    }

    public Duration healthCheckInterval() {
        return healthCheckInterval;
    }

    public ClientMetadata clientMetadata() {
        return clientMetadata;
    }

    public List<RolePattern> rolePatterns() {
        return rolePatterns;
    }

    @Override
    public String toString() {
        return "BridgeClientConfig{"
                + "uri="
                + uri()
                + ", controllerId='"
                + controllerId
                + "', auth="
                + (authToken != null ? "***" : "none")
                + ", commandTimeout="
                + commandTimeout
                + '}';
    }

    static ClientMetadata defaultMetadata() {
        String appVersion = BridgeClientConfig.class.getPackage().getImplementationVersion();
        return new ClientMetadata(
                "mcp-unified",
                "server",
                System.getProperty("os.name", "unknown")
                        + " "
                        + System.getProperty("os.version", ""),
                appVersion != null ? appVersion : DEFAULT_APP_VERSION,
                "1",
                "BUControl MCP Unified Server");
    }

    private static String value(Map<String, String> env, String name) {
        String value = env.get(name);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static Duration millis(Map<String, String> env, String name) {
        String value = value(env, name);
        return value == null ? null : Duration.ofMillis(parseLong(name, value));
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer: " + value, e);
        }
    }

    private static long parseLong(String name, String value) {
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    name + " must be a number of milliseconds: " + value, e);
        }
    }

    /** Builder for {@link BridgeClientConfig}. */
    public static final class Builder {
        private String host = "127.0.0.1";
        private int port = 3004;
        private String path = SocketIoFrames.DEFAULT_PATH;
        private String controllerId = "modular-controller-config";
        private String authToken;
        private Duration reconnectionDelayBase = Duration.ofSeconds(1);
        private Duration reconnectionDelayMax = Duration.ofSeconds(30);
        private int reconnectionAttempts = 0;
        private Duration connectionTimeout = Duration.ofSeconds(20);
        private Duration identifyTimeout = Duration.ofSeconds(5);
        private Duration commandTimeout = Duration.ofSeconds(10);
        private Duration discoveryTimeout = Duration.ofSeconds(10);
        private Duration readyWaitTimeout = Duration.ofSeconds(30);
        private Duration stateTtl = Duration.ofSeconds(5);
        private Duration refreshGrace = Duration.ofMillis(100);
        private Duration heartbeatInterval = Duration.ofSeconds(25);
        private Duration livenessInterval = Duration.ofSeconds(30);
        private Duration pongTimeout = Duration.ofSeconds(30);
        private int maxMissedPongs = 3;
        private int initAttempts = 10;
        private Duration healthCheckInterval = Duration.ofSeconds(30);
        private ClientMetadata clientMetadata = defaultMetadata();
        private List<RolePattern> rolePatterns = RolePattern.defaults();

        private Builder() {}

        public Builder host(String host) {
            this.host = Objects.requireNonNull(host, "host");
            return this;
        }

        /**
         * Sets the bridge port.
         *
         * @param port TCP port
         * @return this builder
         * @throws IllegalArgumentException if the port is out of range
         */
        public Builder port(int port) {
            if (port < 1 || port > 65535) {
                throw new IllegalArgumentException("port out of range: " + port);
            }
            this.port = port;
            return this;
        }

        public Builder path(String path) {
            this.path = Objects.requireNonNull(path, "path");
            return this;
        }

        public Builder controllerId(String controllerId) {
            this.controllerId = Objects.requireNonNull(controllerId, "controllerId");
            return this;
        }

        public Builder authToken(String authToken) {
            this.authToken = authToken;
            return this;
        }

        public Builder reconnectionDelayBase(Duration delay) {
            this.reconnectionDelayBase = positive(delay, "reconnectionDelayBase");
            return this;
        }

        public Builder reconnectionDelayMax(Duration delay) {
            this.reconnectionDelayMax = positive(delay, "reconnectionDelayMax");
            return this;
        }

        public Builder reconnectionAttempts(int attempts) {
            this.reconnectionAttempts = attempts;
            return this;
        }

        public Builder connectionTimeout(Duration timeout) {
            this.connectionTimeout = positive(timeout, "connectionTimeout");
            return this;
        }

        public Builder identifyTimeout(Duration timeout) {
            this.identifyTimeout = positive(timeout, "identifyTimeout");
            return this;
        }

        public Builder commandTimeout(Duration timeout) {
            this.commandTimeout = positive(timeout, "commandTimeout");
            return this;
        }

        public Builder discoveryTimeout(Duration timeout) {
            this.discoveryTimeout = positive(timeout, "discoveryTimeout");
            return this;
        }

        public Builder readyWaitTimeout(Duration timeout) {
            this.readyWaitTimeout = positive(timeout, "readyWaitTimeout");
            return this;
        }

        public Builder stateTtl(Duration ttl) {
            this.stateTtl = positive(ttl, "stateTtl");
            return this;
        }

        public Builder refreshGrace(Duration grace) {
            this.refreshGrace = Objects.requireNonNull(grace, "refreshGrace");
            return this;
        }

        public Builder heartbeatInterval(Duration interval) {
            this.heartbeatInterval = positive(interval, "heartbeatInterval");
            return this;
        }

        public Builder livenessInterval(Duration interval) {
            this.livenessInterval = positive(interval, "livenessInterval");
            return this;
        }

        public Builder pongTimeout(Duration timeout) {
            this.pongTimeout = positive(timeout, "pongTimeout");
            return this;
        }

        public Builder maxMissedPongs(int max) {
            if (max <= 0) {
                throw new IllegalArgumentException("maxMissedPongs must be positive");
            }
            this.maxMissedPongs = max;
            return this;
        }

        public Builder initAttempts(int attempts) {
            if (attempts <= 0) {
                throw new IllegalArgumentException("initAttempts must be positive");
            }
            this.initAttempts = attempts;
            return this;
        }

        public Builder healthCheckInterval(Duration interval) {
            this.healthCheckInterval = positive(interval, "healthCheckInterval");
            return this;
        }

        public Builder clientMetadata(ClientMetadata metadata) {
            this.clientMetadata = Objects.requireNonNull(metadata, "clientMetadata");
            return this;
        }

        public Builder rolePatterns(List<RolePattern> patterns) {
            this.rolePatterns = Objects.requireNonNull(patterns, "rolePatterns");
            return this;
        }

        /**
         * Builds the configuration.
         *
         * @return the configuration
         * @throws IllegalArgumentException if the reconnection base delay exceeds the maximum
         */
        public BridgeClientConfig build() {
            if (reconnectionDelayBase.compareTo(reconnectionDelayMax) > 0) {
                throw new IllegalArgumentException(
                        "reconnectionDelayBase must not exceed reconnectionDelayMax");
            }
            return new BridgeClientConfig(this);
        }

        private static Duration positive(Duration value, String name) {
            Objects.requireNonNull(value, name);
            if (value.isNegative() || value.isZero()) {
                throw new IllegalArgumentException(name + " must be positive");
            }
            return value;
        }
    }
}
