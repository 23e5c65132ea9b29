package express.mvp.controlbridge.client;

import static org.junit.jupiter.api.Assertions.*;

import express.mvp.controlbridge.client.channel.ManualEventLoop;
import express.mvp.controlbridge.client.channel.RecordingBridgeChannel;
import express.mvp.controlbridge.client.lifecycle.ConnectionState;
import express.mvp.controlbridge.client.protocol.OutboundEvent;
import express.mvp.controlbridge.client.session.CommandResult;
import express.mvp.controlbridge.client.session.ControllerStatus;
import express.mvp.controlbridge.client.session.HealthReport;
import express.mvp.controlbridge.client.session.ServerIdentity;
import express.mvp.controlbridge.client.session.StateField;
import express.mvp.controlbridge.client.session.StateSnapshot;
import express.mvp.controlbridge.client.session.SubscriptionRecord;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link ConnectionManager}, driven on a virtual clock with the test playing the
 * bridge's side of the channel.
 */
@DisplayName("ConnectionManager")
class ConnectionManagerTest {

    private static final String CONTROLLER = "ctrl-01";
    private static final long CONNECT_TIMEOUT = 20_000;
    private static final long IDENTIFY_TIMEOUT = 5_000;
    private static final long COMMAND_TIMEOUT = 10_000;
    private static final long DISCOVERY_TIMEOUT = 10_000;
    private static final long READY_WAIT = 30_000;
    private static final long STATE_TTL = 5_000;
    private static final long HEALTH_CHECK = 60_000;
    private static final Duration QUIET = Duration.ofHours(1);

    private static final String ROOM =
            "{'components':["
                    + "{'id':'comp-wall','name':'BUControl Video Wall',"
                    + "'controls':{'HardwareState':{'value':'on'}}},"
                    + "{'id':'comp-lighting','name':'LutronLEAPZone_Office',"
                    + "'controls':{'ZoneDimLevel1':{'value':50}}},"
                    + "{'id':'comp-mixer','name':'Mixer_8x8_2',"
                    + "'controls':{'output.1.gain':{'value':-20}}}"
                    + "],'connected':true}";

    private static final String EMPTY_ROOM = "{'components':[],'connected':true}";

    private ManualEventLoop loop;
    private RecordingBridgeChannel channel;
    private ConnectionManager manager;
    private List<ConnectionState> states;

    @BeforeEach
    void setUp() {
        loop = new ManualEventLoop();
        channel = new RecordingBridgeChannel();
        manager = new ConnectionManager(config().build(), loop, channel);
        states = new ArrayList<>();
        manager.onConnectionStateChange((previous, current, cause) -> states.add(current));
    }

    private static BridgeClientConfig.Builder config() {
        return BridgeClientConfig.builder()
                .controllerId(CONTROLLER)
                .connectionTimeout(Duration.ofMillis(CONNECT_TIMEOUT))
                .identifyTimeout(Duration.ofMillis(IDENTIFY_TIMEOUT))
                .commandTimeout(Duration.ofMillis(COMMAND_TIMEOUT))
                .discoveryTimeout(Duration.ofMillis(DISCOVERY_TIMEOUT))
                .readyWaitTimeout(Duration.ofMillis(READY_WAIT))
                .stateTtl(Duration.ofMillis(STATE_TTL))
                .refreshGrace(Duration.ofMillis(100))
                .heartbeatInterval(QUIET)
                .livenessInterval(QUIET)
                .pongTimeout(QUIET)
                .healthCheckInterval(Duration.ofMillis(HEALTH_CHECK));
    }

    private static BridgeError errorOf(CompletableFuture<?> future) {
        assertTrue(future.isDone(), "future should be done");
        CompletionException thrown = assertThrows(CompletionException.class, future::join);
        return assertInstanceOf(BridgeException.class, thrown.getCause()).getError();
    }

    private void identifyOk() {
        channel.inject(
                "client:identify:success",
                "{'socketId':'sock-1','clientId':'client-7','serverTime':"
                        + (loop.now() + 250)
                        + ",'connection':{'transport':'websocket','ipAddress':'10.0.0.5'}}");
    }

    /** Runs a full handshake against the standard room. */
    private CompletableFuture<Void> ready() {
        CompletableFuture<Void> connected = manager.connect();
        channel.acceptOpen();
        identifyOk();
        channel.inject("controller:state", ROOM);
        assertEquals(ConnectionState.READY, manager.getConnectionState());
        return connected;
    }

    private int controllerSubscribes() {
        return channel.emitted(OutboundEvent.ControllerSubscribe.class).size();
    }

    private void ack(String transactionId) {
        channel.inject("control:set:success", "{'transactionId':'" + transactionId + "'}");
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Connecting
    // ─────────────────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("Connecting")
    class ConnectTests {

        @Test
        @DisplayName("open, identify and discover lead to READY")
        void fullHandshake() {
            CompletableFuture<Void> connected = manager.connect();
            assertEquals(ConnectionState.CONNECTING, manager.getConnectionState());
            assertFalse(connected.isDone());

            channel.acceptOpen();
            assertEquals(ConnectionState.IDENTIFYING, manager.getConnectionState());
            OutboundEvent.Identify identify = channel.last(OutboundEvent.Identify.class);
            assertEquals("mcp-unified", identify.metadata().platform());

            identifyOk();
            assertEquals(ConnectionState.DISCOVERING, manager.getConnectionState());
            assertEquals(
                    CONTROLLER,
                    channel.last(OutboundEvent.ControllerSubscribe.class).controllerId());

            channel.inject("controller:state", ROOM);

            assertEquals(ConnectionState.READY, manager.getConnectionState());
            assertTrue(connected.isDone());
            assertFalse(connected.isCompletedExceptionally());
            assertEquals(
                    List.of(
                            ConnectionState.CONNECTING,
                            ConnectionState.IDENTIFYING,
                            ConnectionState.DISCOVERING,
                            ConnectionState.READY),
                    states);
        }

        @Test
        @DisplayName("identification stores the session and clock offset")
        void storesIdentity() {
            assertTrue(manager.getServerIdentity().isEmpty());
            ready();

            ServerIdentity identity = manager.getServerIdentity().orElseThrow();
            assertEquals("sock-1", identity.sessionId());
            assertEquals("client-7", identity.assignedClientId());
            assertEquals(250, identity.serverClockOffsetMillis());
            assertEquals("websocket", identity.transportKind());
            assertEquals("10.0.0.5", identity.observedAddress());
        }

        @Test
        @DisplayName("a second connect joins the attempt in flight")
        void joinsInFlight() {
            CompletableFuture<Void> first = manager.connect();
            CompletableFuture<Void> second = manager.connect();

            assertSame(first, second);
            assertEquals(1, channel.openCount());
        }

        @Test
        @DisplayName("connect when ready completes at once")
        void alreadyReady() {
            ready();

            CompletableFuture<Void> again = manager.connect();

            assertTrue(again.isDone());
            assertEquals(1, channel.openCount());
        }

        @Test
        @DisplayName("an unanswered open times out as a transport error")
        void connectTimeout() {
            CompletableFuture<Void> connected = manager.connect();

            loop.advance(CONNECT_TIMEOUT - 1);
            assertFalse(connected.isDone());
            loop.advance(1);

            assertEquals(BridgeError.TRANSPORT_ERROR, errorOf(connected));
            assertEquals(ConnectionState.DISCONNECTED, manager.getConnectionState());
            assertEquals(1, channel.disconnectCount());
        }

        @Test
        @DisplayName("a refused open fails the connect with its cause")
        void openRefused() {
            CompletableFuture<Void> connected = manager.connect();

            channel.failOpen(new BridgeException(BridgeError.TRANSPORT_ERROR, "refused"));

            assertEquals(BridgeError.TRANSPORT_ERROR, errorOf(connected));
            CompletionException thrown = assertThrows(CompletionException.class, connected::join);
            assertEquals("refused", thrown.getCause().getMessage());
            assertEquals(ConnectionState.DISCONNECTED, manager.getConnectionState());
        }

        @Test
        @DisplayName("no identify response fails with IDENTIFY_TIMEOUT")
        void identifyTimeout() {
            CompletableFuture<Void> connected = manager.connect();
            channel.acceptOpen();

            loop.advance(IDENTIFY_TIMEOUT);

            assertEquals(BridgeError.IDENTIFY_TIMEOUT, errorOf(connected));
            assertEquals(ConnectionState.DISCONNECTED, manager.getConnectionState());
            assertTrue(manager.getServerIdentity().isEmpty());
        }

        @Test
        @DisplayName("losing the link while identifying fails the connect")
        void linkLostWhileIdentifying() {
            CompletableFuture<Void> connected = manager.connect();
            channel.acceptOpen();

            channel.drop("transport close");

            assertEquals(BridgeError.TRANSPORT_ERROR, errorOf(connected));
            assertEquals(ConnectionState.DISCONNECTED, manager.getConnectionState());
        }

        @Test
        @DisplayName("awaitReady completes once the handshake finishes")
        void awaitReady() {
            CompletableFuture<Void> waiting = manager.awaitReady(Duration.ofMinutes(1));
            assertFalse(waiting.isDone());

            ready();

            assertTrue(waiting.isDone());
            assertFalse(waiting.isCompletedExceptionally());
        }

        @Test
        @DisplayName("awaitReady gives up after its timeout")
        void awaitReadyTimeout() {
            CompletableFuture<Void> waiting = manager.awaitReady(Duration.ofSeconds(1));

            loop.advance(1_000);

            assertEquals(BridgeError.NOT_CONNECTED, errorOf(waiting));
        }
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Discovery
    // ─────────────────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("Discovery")
    class DiscoveryTests {

        @Test
        @DisplayName("resolves roles and seeds the state cache")
        void resolvesRoles() {
            ready();

            assertEquals("comp-lighting", manager.findByRole("lighting").orElseThrow().id());
            assertEquals("comp-wall", manager.findByRole("videoWall").orElseThrow().id());
            assertTrue(manager.findByRole("gpio").isEmpty());
            assertEquals("comp-mixer", manager.findComponent("mixer_8x8").orElseThrow().id());

            StateSnapshot state = manager.getState().join();
            assertEquals(50, state.get(StateField.LIGHTING_LEVEL).asInt());
            assertEquals(-20, state.get(StateField.VOLUME_LEVEL).asInt());
            assertEquals("on", state.get(StateField.HARDWARE_STATE).asText());
            assertEquals(1, controllerSubscribes());
        }

        @Test
        @DisplayName("subscribes to every component holding a role")
        void subscribesToRoles() {
            ready();

            List<String> subscribed = new ArrayList<>();
            for (OutboundEvent.ComponentSubscribe request :
                    channel.emitted(OutboundEvent.ComponentSubscribe.class)) {
                subscribed.add(request.componentId());
            }
            assertEquals(3, subscribed.size());
            assertTrue(subscribed.containsAll(List.of("comp-wall", "comp-lighting", "comp-mixer")));
        }

        @Test
        @DisplayName("an empty controller becomes READY after the readiness wait")
        void emptyControllerAfterWait() {
            CompletableFuture<Void> connected = manager.connect();
            channel.acceptOpen();
            identifyOk();
            channel.inject("controller:state", EMPTY_ROOM);

            loop.advance(READY_WAIT - 1);
            assertEquals(ConnectionState.DISCOVERING, manager.getConnectionState());
            assertEquals(1, controllerSubscribes());

            loop.advance(1);
            assertEquals(2, controllerSubscribes());
            channel.inject("controller:state", EMPTY_ROOM);

            assertEquals(ConnectionState.READY, manager.getConnectionState());
            assertFalse(connected.isCompletedExceptionally());
            assertTrue(manager.findComponent("Mixer").isEmpty());
        }

        @Test
        @DisplayName("a silent controller still reaches READY")
        void silentController() {
            CompletableFuture<Void> connected = manager.connect();
            channel.acceptOpen();
            identifyOk();

            loop.advance(DISCOVERY_TIMEOUT + READY_WAIT + DISCOVERY_TIMEOUT);

            assertEquals(ConnectionState.READY, manager.getConnectionState());
            assertTrue(connected.isDone());
            assertFalse(connected.isCompletedExceptionally());
        }

        @Test
        @DisplayName("system:ready cuts the readiness wait short")
        void systemReadyShortensWait() {
            manager.connect();
            channel.acceptOpen();
            identifyOk();
            channel.inject("controller:state", EMPTY_ROOM);

            channel.inject("system:ready", "{'controllers':['ctrl-01']}");

            assertEquals(2, controllerSubscribes());
            channel.inject("controller:state", ROOM);
            assertEquals(ConnectionState.READY, manager.getConnectionState());
            assertTrue(manager.findByRole("mixer").isPresent());
        }

        @Test
        @DisplayName("digitaltwin:ready re-discovers an empty directory")
        void digitalTwinRediscovers() {
            manager.connect();
            channel.acceptOpen();
            identifyOk();
            channel.inject("controller:state", EMPTY_ROOM);
            loop.advance(READY_WAIT);
            channel.inject("controller:state", EMPTY_ROOM);
            assertEquals(ConnectionState.READY, manager.getConnectionState());

            channel.inject("digitaltwin:ready", "{'controllers':1,'totalComponents':3}");
            assertEquals(3, controllerSubscribes());
            channel.inject("controller:state", ROOM);

            assertEquals("comp-lighting", manager.findByRole("lighting").orElseThrow().id());
        }

        @Test
        @DisplayName("controller snapshot reports the controller status")
        void reportsStatus() {
            List<ControllerStatus> seen = new ArrayList<>();
            manager.onStatusChange(seen::add);

            ready();

            assertTrue(manager.getControllerStatus().connected());
            assertEquals("healthy", manager.getControllerStatus().health());
            assertFalse(seen.isEmpty());
        }
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Commands
    // ─────────────────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("Commands")
    class CommandTests {

        @Test
        @DisplayName("fail with NOT_CONNECTED before connecting")
        void notConnected() {
            CompletableFuture<CommandResult> result =
                    manager.sendControl("lighting", "ZoneDimLevel1", 40);

            assertEquals(BridgeError.NOT_CONNECTED, errorOf(result));
            assertTrue(channel.emitted().isEmpty());
        }

        @Test
        @DisplayName("fail with NOT_IDENTIFIED while identifying")
        void notIdentified() {
            manager.connect();
            channel.acceptOpen();

            CompletableFuture<CommandResult> result =
                    manager.sendControl("comp-lighting", "ZoneDimLevel1", 40);

            assertEquals(BridgeError.NOT_IDENTIFIED, errorOf(result));
        }

        @Test
        @DisplayName("fail with COMPONENT_NOT_FOUND for an unresolved role")
        void unknownRole() {
            ready();

            CompletableFuture<CommandResult> result =
                    manager.sendControl("projector", "power", true);

            assertEquals(BridgeError.COMPONENT_NOT_FOUND, errorOf(result));
            assertTrue(channel.emitted(OutboundEvent.ControlSet.class).isEmpty());
            assertEquals(0, manager.pendingCommandCount());
        }

        @Test
        @DisplayName("resolve a role, send, and complete on acknowledgement")
        void roleCommand() {
            ready();
            loop.advance(30);

            CompletableFuture<CommandResult> result =
                    manager.sendControl("lighting", "ZoneDimLevel1", 40);

            OutboundEvent.ControlSet sent = channel.last(OutboundEvent.ControlSet.class);
            assertEquals(CONTROLLER, sent.controllerId());
            assertEquals("comp-lighting", sent.componentId());
            assertEquals("ZoneDimLevel1", sent.controlId());
            assertEquals(40, sent.value().asInt());
            assertEquals(1, manager.pendingCommandCount());
            assertFalse(result.isDone());

            loop.advance(15);
            ack(sent.transactionId());

            CommandResult ok = result.join();
            assertTrue(ok.success());
            assertEquals(sent.transactionId(), ok.transactionId());
            assertEquals("comp-lighting", ok.componentId());
            assertEquals(15, ok.roundTripMillis());
            assertEquals(0, manager.pendingCommandCount());
        }

        @Test
        @DisplayName("targets with a dash are sent as component ids")
        void explicitId() {
            ready();

            manager.sendControl("comp-gpio", "pin.8.digital.out", true);

            OutboundEvent.ControlSet sent = channel.last(OutboundEvent.ControlSet.class);
            assertEquals("comp-gpio", sent.componentId());
            assertTrue(sent.value().asBoolean());
        }

        @Test
        @DisplayName("a bridge rejection fails with COMMAND_REJECTED")
        void rejected() {
            ready();
            CompletableFuture<CommandResult> result =
                    manager.sendControl("mixer", "output.1.gain", 20);
            String tx = channel.last(OutboundEvent.ControlSet.class).transactionId();

            channel.inject(
                    "control:set:error", "{'transactionId':'" + tx + "','message':'Out of range'}");

            assertEquals(BridgeError.COMMAND_REJECTED, errorOf(result));
            CompletionException thrown = assertThrows(CompletionException.class, result::join);
            assertTrue(thrown.getCause().getMessage().contains("Out of range"));
        }

        @Test
        @DisplayName("two commands resolve independently when one times out")
        void independentResolution() {
            ready();
            CompletableFuture<CommandResult> first =
                    manager.sendControl("mixer", "output.1.gain", -10);
            String firstTx = channel.last(OutboundEvent.ControlSet.class).transactionId();
            loop.advance(2_000);
            CompletableFuture<CommandResult> second =
                    manager.sendControl("lighting", "ZoneDimLevel1", 70);
            String secondTx = channel.last(OutboundEvent.ControlSet.class).transactionId();
            assertNotEquals(firstTx, secondTx);

            ack(secondTx);
            loop.advance(COMMAND_TIMEOUT - 2_000);

            assertTrue(second.join().success());
            assertEquals(BridgeError.COMMAND_TIMEOUT, errorOf(first));
            assertEquals(0, manager.pendingCommandCount());

            ack(firstTx);
            assertEquals(BridgeError.COMMAND_TIMEOUT, errorOf(first));
        }

        @Test
        @DisplayName("every command resolves exactly once and none are left pending")
        void manyCommands() {
            ready();
            int count = 30;
            List<CompletableFuture<CommandResult>> results = new ArrayList<>();
            for (int i = 0; i < count; i++) {
                results.add(manager.sendControl("mixer", "output.1.gain", -i));
            }
            List<OutboundEvent.ControlSet> sent = channel.emitted(OutboundEvent.ControlSet.class);
            assertEquals(count, sent.size());
            assertEquals(count, manager.pendingCommandCount());

            for (int i = 0; i < count; i += 2) {
                ack(sent.get(i).transactionId());
                ack(sent.get(i).transactionId());
            }
            assertEquals(count / 2, manager.pendingCommandCount());
            loop.advance(COMMAND_TIMEOUT);

            assertEquals(0, manager.pendingCommandCount());
            for (int i = 0; i < count; i++) {
                if (i % 2 == 0) {
                    assertTrue(results.get(i).join().success());
                } else {
                    assertEquals(BridgeError.COMMAND_TIMEOUT, errorOf(results.get(i)));
                }
            }
        }

        @Test
        @DisplayName("disconnect fails pending commands with NOT_CONNECTED")
        void disconnectFailsPending() {
            ready();
            CompletableFuture<CommandResult> result =
                    manager.sendControl("lighting", "ZoneDimLevel1", 10);

            manager.disconnect();

            assertEquals(BridgeError.NOT_CONNECTED, errorOf(result));
            assertEquals(ConnectionState.DISCONNECTED, manager.getConnectionState());
            assertEquals(0, manager.pendingCommandCount());
        }

        @Test
        @DisplayName("a dropped link fails pending commands with NOT_CONNECTED")
        void dropFailsPending() {
            ready();
            CompletableFuture<CommandResult> result =
                    manager.sendControl("lighting", "ZoneDimLevel1", 10);

            channel.drop("ping timeout");

            assertEquals(BridgeError.NOT_CONNECTED, errorOf(result));
        }

        @Test
        @DisplayName("a command that cannot be written fails with NOT_CONNECTED")
        void emitFails() {
            ready();
            channel.disconnect();

            CompletableFuture<CommandResult> result =
                    manager.sendControl("lighting", "ZoneDimLevel1", 10);

            assertEquals(BridgeError.NOT_CONNECTED, errorOf(result));
            assertEquals(0, manager.pendingCommandCount());
        }
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Subscriptions
    // ─────────────────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("Subscriptions")
    class SubscriptionTests {

        private int componentSubscribes(String componentId) {
            int n = 0;
            for (OutboundEvent.ComponentSubscribe request :
                    channel.emitted(OutboundEvent.ComponentSubscribe.class)) {
                if (request.componentId().equals(componentId)) {
                    n++;
                }
            }
            return n;
        }

        @Test
        @DisplayName("require identification")
        void requireIdentification() {
            assertEquals(
                    BridgeError.NOT_CONNECTED, errorOf(manager.subscribeToComponent("comp-mixer")));

            manager.connect();
            channel.acceptOpen();
            assertEquals(
                    BridgeError.NOT_IDENTIFIED,
                    errorOf(manager.subscribeToControl("comp-mixer", "output.1.gain")));
        }

        @Test
        @DisplayName("a pending subscription is shared, not re-requested")
        void sharesPending() {
            ready();
            assertEquals(1, componentSubscribes("comp-mixer"));

            CompletableFuture<SubscriptionRecord> first =
                    manager.subscribeToComponent("comp-mixer");
            CompletableFuture<SubscriptionRecord> second =
                    manager.subscribeToComponent("comp-mixer");
            assertEquals(1, componentSubscribes("comp-mixer"));

            channel.inject(
                    "component:state",
                    "{'componentId':'comp-mixer','component':{'id':'comp-mixer',"
                            + "'name':'Mixer_8x8_2','controls':{'output.1.gain':{'value':-6}}}}");

            assertEquals("comp-mixer", first.join().componentId());
            assertEquals(first.join(), second.join());
            assertEquals(-6, manager.getState().join().get(StateField.VOLUME_LEVEL).asInt());
        }

        @Test
        @DisplayName("subscribing again after confirmation sends nothing")
        void idempotent() {
            ready();
            channel.inject(
                    "component:state",
                    "{'component':{'id':'comp-wall','controls':{}}}");

            SubscriptionRecord record = manager.subscribeToComponent("comp-wall").join();

            assertEquals("comp-wall", record.key());
            assertEquals(1, componentSubscribes("comp-wall"));
        }

        @Test
        @DisplayName("control subscriptions are confirmed by control updates")
        void controlSubscription() {
            ready();
            CompletableFuture<SubscriptionRecord> subscribed =
                    manager.subscribeToControl("comp-lighting", "ZoneDimLevel1");
            OutboundEvent.ControlSubscribe request =
                    channel.last(OutboundEvent.ControlSubscribe.class);
            assertEquals("ZoneDimLevel1", request.controlId());

            channel.inject(
                    "control:update",
                    "{'componentId':'comp-lighting','controlId':'ZoneDimLevel1',"
                            + "'control':{'value':80}}");

            SubscriptionRecord record = subscribed.join();
            assertEquals("comp-lighting:ZoneDimLevel1", record.key());
            assertTrue(record.isControlSubscription());
            assertEquals(80, record.lastDelivered().get("value").asInt());
        }

        @Test
        @DisplayName("unanswered subscriptions time out and can be retried")
        void timeout() {
            ready();
            CompletableFuture<SubscriptionRecord> subscribed =
                    manager.subscribeToComponent("comp-gpio");

            loop.advance(COMMAND_TIMEOUT);

            assertEquals(BridgeError.SUBSCRIBE_TIMEOUT, errorOf(subscribed));
            manager.subscribeToComponent("comp-gpio");
            assertEquals(2, componentSubscribes("comp-gpio"));
        }

        @Test
        @DisplayName("a reconnect forgets previous subscriptions")
        void forgottenOnReconnect() {
            ready();
            channel.inject("component:state", "{'component':{'id':'comp-wall','controls':{}}}");

            channel.drop("transport close");
            channel.relink();
            identifyOk();
            channel.inject("controller:state", ROOM);

            assertEquals(2, componentSubscribes("comp-wall"));
        }
    }

    // ─────────────────────────────────────────────────────────────────────────
    // State
    // ─────────────────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("State")
    class StateTests {

        @Test
        @DisplayName("updates after READY reach the cache and its listeners")
        void liveUpdates() {
            ready();
            List<StateSnapshot> seen = new ArrayList<>();
            Registration registration = manager.onStateChange(seen::add);

            channel.inject(
                    "control:update",
                    "{'controlId':'ZoneDimLevel1','control':{'value':80}}");

            assertEquals(1, seen.size());
            assertEquals(80, seen.get(0).get(StateField.LIGHTING_LEVEL).asInt());

            registration.remove();
            channel.inject(
                    "control:update",
                    "{'controlId':'ZoneDimLevel1','control':{'value':90}}");
            assertEquals(1, seen.size());
        }

        @Test
        @DisplayName("a stale cache is refreshed once for concurrent callers")
        void staleRefresh() {
            ready();
            loop.advance(STATE_TTL + 1);

            CompletableFuture<StateSnapshot> first = manager.getState();
            CompletableFuture<StateSnapshot> second = manager.getState();
            assertFalse(first.isDone());
            assertSame(first, second);
            assertEquals(2, controllerSubscribes());

            channel.inject(
                    "controller:state",
                    "{'components':[{'id':'comp-lighting','name':'LutronLEAPZone_Office',"
                            + "'controls':{'ZoneDimLevel1':{'value':65}}}]}");
            loop.advance(100);

            assertEquals(65, first.join().get(StateField.LIGHTING_LEVEL).asInt());
            assertEquals(loop.now() - 100, first.join().timestamp());
        }

        @Test
        @DisplayName("a stale cache without a session is returned as is")
        void staleWhileDisconnected() {
            ready();
            manager.disconnect();
            loop.advance(STATE_TTL * 2);

            CompletableFuture<StateSnapshot> state = manager.getState();

            assertTrue(state.isDone());
            assertEquals(50, state.join().get(StateField.LIGHTING_LEVEL).asInt());
        }

        @Test
        @DisplayName("controller:status updates status and listeners")
        void controllerStatus() {
            ready();
            List<ControllerStatus> seen = new ArrayList<>();
            manager.onStatusChange(seen::add);

            channel.inject(
                    "controller:status",
                    "{'controllerId':'ctrl-01','connected':false,'status':'rebooting'}");

            ControllerStatus status = manager.getControllerStatus();
            assertFalse(status.connected());
            assertEquals("disconnected", status.health());
            assertEquals("rebooting", status.status());
            assertEquals(List.of(status), seen);
        }
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Reconnection
    // ─────────────────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("Reconnection")
    class ReconnectTests {

        @Test
        @DisplayName("a re-established link is identified and discovered again")
        void reidentifies() {
            ready();
            List<ControllerStatus> statuses = new ArrayList<>();
            manager.onStatusChange(statuses::add);
            states.clear();

            channel.drop("transport close");
            assertEquals(ConnectionState.DISCONNECTED, manager.getConnectionState());
            assertFalse(statuses.get(0).connected());
            assertTrue(manager.getServerIdentity().isEmpty());

            channel.reconnecting(1);
            channel.relink();
            assertEquals(2, channel.emitted(OutboundEvent.Identify.class).size());
            identifyOk();
            channel.inject("controller:state", ROOM);

            assertEquals(
                    List.of(
                            ConnectionState.DISCONNECTED,
                            ConnectionState.CONNECTING,
                            ConnectionState.IDENTIFYING,
                            ConnectionState.DISCOVERING,
                            ConnectionState.READY),
                    states);
            assertEquals(1, channel.openCount());
            assertTrue(manager.getServerIdentity().isPresent());
        }

        @Test
        @DisplayName("failed re-identification stays IDENTIFYING and refuses commands")
        void reidentifyFails() {
            ready();
            channel.drop("transport close");
            channel.relink();

            loop.advance(IDENTIFY_TIMEOUT);

            assertEquals(ConnectionState.IDENTIFYING, manager.getConnectionState());
            assertTrue(manager.getControllerStatus().status().contains("re-identification"));
            assertEquals(
                    BridgeError.NOT_IDENTIFIED,
                    errorOf(manager.sendControl("lighting", "ZoneDimLevel1", 1)));
            assertFalse(manager.isConnectInFlight());
        }

        @Test
        @DisplayName("forceReconnect drops the link and opens a new one")
        void forceReconnect() {
            ready();

            CompletableFuture<Void> reconnected = manager.forceReconnect();

            assertEquals(ConnectionState.CONNECTING, manager.getConnectionState());
            assertEquals(1, channel.disconnectCount());
            assertEquals(2, channel.openCount());

            channel.acceptOpen();
            identifyOk();
            channel.inject("controller:state", ROOM);
            assertTrue(reconnected.isDone());
            assertFalse(reconnected.isCompletedExceptionally());
        }

        @Test
        @DisplayName("forceReconnect joins a re-handshake instead of opening a second link")
        void forceReconnectJoinsRelink() {
            ready();
            channel.drop("transport close");
            channel.reconnecting(1);
            channel.relink();
            assertTrue(manager.isConnectInFlight());

            CompletableFuture<Void> forced = manager.forceReconnect();
            CompletableFuture<Void> connected = manager.connect();

            assertEquals(1, channel.openCount());
            assertEquals(0, channel.disconnectCount());
            assertEquals(ConnectionState.IDENTIFYING, manager.getConnectionState());
            assertFalse(forced.isDone());

            identifyOk();
            channel.inject("controller:state", ROOM);

            assertEquals(ConnectionState.READY, manager.getConnectionState());
            assertTrue(forced.isDone());
            assertFalse(forced.isCompletedExceptionally());
            assertTrue(connected.isDone());
            assertFalse(connected.isCompletedExceptionally());
        }

        @Test
        @DisplayName("connect during link backoff joins the channel's own reconnection")
        void connectJoinsLinkBackoff() {
            ready();
            channel.drop("transport close");
            channel.reconnecting(1);

            CompletableFuture<Void> connected = manager.connect();

            assertEquals(1, channel.openCount());
            assertEquals(ConnectionState.CONNECTING, manager.getConnectionState());

            channel.error(new BridgeException(BridgeError.TRANSPORT_ERROR, "gave up"));

            assertEquals(BridgeError.TRANSPORT_ERROR, errorOf(connected));
        }

        @Test
        @DisplayName("a joined re-handshake fails with it, then a forced reconnect proceeds")
        void joinedRelinkFails() {
            ready();
            channel.drop("transport close");
            channel.relink();
            CompletableFuture<Void> joined = manager.forceReconnect();

            loop.advance(IDENTIFY_TIMEOUT);

            assertEquals(BridgeError.IDENTIFY_TIMEOUT, errorOf(joined));
            assertFalse(manager.isConnectInFlight());

            manager.forceReconnect();

            assertEquals(2, channel.openCount());
            assertEquals(1, channel.disconnectCount());
        }

        @Test
        @DisplayName("an exhausted link reconnection leaves the manager disconnected")
        void linkGivesUp() {
            ready();
            channel.drop("transport close");
            channel.reconnecting(1);
            assertEquals(ConnectionState.CONNECTING, manager.getConnectionState());

            channel.error(new BridgeException(BridgeError.TRANSPORT_ERROR, "gave up"));

            assertEquals(ConnectionState.DISCONNECTED, manager.getConnectionState());
        }
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Liveness
    // ─────────────────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("Liveness")
    class LivenessTests {

        @BeforeEach
        void fastHeartbeat() {
            manager =
                    new ConnectionManager(
                            config()
                                    .heartbeatInterval(Duration.ofMillis(1_000))
                                    .livenessInterval(Duration.ofMillis(2_000))
                                    .pongTimeout(Duration.ofMillis(1_500))
                                    .maxMissedPongs(3)
                                    .build(),
                            loop,
                            channel);
        }

        @Test
        @DisplayName("state and health report degrade at the same missed-pong count")
        void degradeAndRecover() {
            ready();

            loop.advance(2_000);
            assertEquals(ConnectionState.READY, manager.getConnectionState());
            assertEquals(HealthReport.Level.HEALTHY, manager.getConnectionHealth().health());

            loop.advance(2_000);
            assertEquals(ConnectionState.DEGRADED, manager.getConnectionState());
            assertEquals(HealthReport.Level.DEGRADED, manager.getConnectionHealth().health());
            assertTrue(manager.getConnectionState().acceptsCommands());

            long sent = channel.emitted(OutboundEvent.Ping.class).get(0).timestamp();
            channel.inject("pong", "{'clientTimestamp':" + sent + "}");

            assertEquals(ConnectionState.READY, manager.getConnectionState());
            assertEquals(HealthReport.Level.HEALTHY, manager.getConnectionHealth().health());
            assertEquals(loop.now() - sent, manager.getLatency().currentMillis());
        }

        @Test
        @DisplayName("a stale connection is reconnected")
        void staleReconnects() {
            ready();

            loop.advance(6_000);

            assertEquals(ConnectionState.CONNECTING, manager.getConnectionState());
            assertEquals(2, channel.openCount());
        }

        @Test
        @DisplayName("health report reflects the link")
        void healthReport() {
            assertFalse(manager.getConnectionHealth().connected());
            ready();
            assertTrue(manager.getConnectionHealth().connected());
            assertTrue(manager.getConnectionHealth().identified());
        }
    }

    // ─────────────────────────────────────────────────────────────────────────
    // Lifecycle
    // ─────────────────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("Lifecycle")
    class LifecycleTests {

        @Test
        @DisplayName("init connects and then keeps the connection up")
        void initKeepsConnected() {
            CompletableFuture<Void> initialized = manager.init();
            channel.acceptOpen();
            identifyOk();
            channel.inject("controller:state", ROOM);
            assertTrue(initialized.isDone());

            channel.drop("transport close");
            loop.advance(HEALTH_CHECK);

            assertEquals(2, channel.openCount());
            assertEquals(ConnectionState.CONNECTING, manager.getConnectionState());
        }

        @Test
        @DisplayName("disconnect stops background reconnection until reconnect")
        void disconnectStopsDriver() {
            manager.init();
            channel.acceptOpen();
            identifyOk();
            channel.inject("controller:state", ROOM);

            manager.disconnect();
            loop.advance(HEALTH_CHECK * 3);
            assertEquals(1, channel.openCount());

            manager.reconnect();
            assertEquals(2, channel.openCount());
        }

        @Test
        @DisplayName("shutdown fails pending work and refuses new work")
        void shutdown() throws InterruptedException {
            ready();
            CompletableFuture<CommandResult> pending =
                    manager.sendControl("lighting", "ZoneDimLevel1", 10);

            assertFalse(manager.shutdown(Duration.ofMillis(20)));

            assertEquals(BridgeError.SHUTTING_DOWN, errorOf(pending));
            assertEquals(
                    BridgeError.SHUTTING_DOWN,
                    errorOf(manager.sendControl("lighting", "ZoneDimLevel1", 10)));
            assertEquals(BridgeError.SHUTTING_DOWN, errorOf(manager.connect()));
            assertTrue(channel.isClosed());
            assertTrue(loop.isShutdown());
            assertEquals(ConnectionState.DISCONNECTED, manager.getConnectionState());
        }

        @Test
        @DisplayName("close with nothing pending drains at once")
        void closeDrains() {
            ready();
            manager.close();

            assertTrue(channel.isClosed());
            assertTrue(loop.isShutdown());
        }
    }
}
