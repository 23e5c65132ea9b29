package express.mvp.controlbridge.server;

import static org.junit.jupiter.api.Assertions.*;

import express.mvp.controlbridge.client.BridgeClientConfig;
import express.mvp.controlbridge.client.BridgeError;
import express.mvp.controlbridge.client.BridgeException;
import express.mvp.controlbridge.client.ConnectionManager;
import express.mvp.controlbridge.client.ControlBridges;
import express.mvp.controlbridge.client.lifecycle.ConnectionState;
import express.mvp.controlbridge.client.session.CommandResult;
import express.mvp.controlbridge.client.session.ServerIdentity;
import express.mvp.controlbridge.client.session.StateField;
import express.mvp.controlbridge.client.session.StateSnapshot;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** End-to-end tests of the Netty client against {@link BridgeServer}. */
@DisplayName("BridgeServer end to end")
class BridgeServerTest {

    private static final String CONTROLLER = "ctrl-01";
    private static final long WAIT_SECONDS = 10;

    private BridgeServer server;
    private ConnectionManager client;

    @AfterEach
    void tearDown() throws InterruptedException {
        if (client != null) {
            client.shutdown(Duration.ofSeconds(2));
        }
        if (server != null) {
            server.stop();
        }
    }

    private void startServer(String authToken) throws InterruptedException {
        BridgeServerConfig config =
                BridgeServerConfig.builder().port(0).authToken(authToken).build();
        server = new BridgeServer(config, SimulatedController.standardRoom(CONTROLLER));
        server.start();
    }

    private BridgeClientConfig.Builder clientConfig() {
        return BridgeClientConfig.builder()
                .host("127.0.0.1")
                .port(server.getPort())
                .controllerId(CONTROLLER)
                .reconnectionDelayBase(Duration.ofMillis(100))
                .reconnectionDelayMax(Duration.ofMillis(500))
                .connectionTimeout(Duration.ofSeconds(5))
                .initAttempts(1);
    }

    private static <T> T await(CompletableFuture<T> future) throws Exception {
        return future.get(WAIT_SECONDS, TimeUnit.SECONDS);
    }

    private static BridgeError errorOf(CompletableFuture<?> future) {
        ExecutionException thrown =
                assertThrows(
                        ExecutionException.class, () -> future.get(WAIT_SECONDS, TimeUnit.SECONDS));
        return assertInstanceOf(BridgeException.class, thrown.getCause()).getError();
    }

    @Nested
    @DisplayName("Connected client")
    class ConnectedTests {

        @BeforeEach
        void connect() throws Exception {
            startServer(null);
            client = ControlBridges.create(clientConfig().build());
            await(client.init());
        }

        @Test
        @DisplayName("init identifies and discovers the room")
        void initReachesReady() {
            assertEquals(ConnectionState.READY, client.getConnectionState());
            assertEquals(1, server.getSessionCount());

            ServerIdentity identity = client.getServerIdentity().orElseThrow();
            assertEquals("client-1", identity.assignedClientId());
            assertEquals("websocket", identity.transportKind());

            assertEquals("comp-mixer", client.findByRole("mixer").orElseThrow().id());
            assertEquals("comp-lighting", client.findComponent("lutron").orElseThrow().id());
            assertTrue(client.getControllerStatus().connected());
        }

        @Test
        @DisplayName("discovery seeds the state cache")
        void stateSeeded() throws Exception {
            StateSnapshot state = await(client.getState());

            assertEquals(50, state.get(StateField.LIGHTING_LEVEL).asInt());
            assertEquals("on", state.get(StateField.HARDWARE_STATE).asText());
            assertTrue(state.get(StateField.SCREEN_POWER).asBoolean());
        }

        @Test
        @DisplayName("an acknowledged command updates controller and cache")
        void commandApplied() throws Exception {
            CountDownLatch updated = new CountDownLatch(1);
            client.onStateChange(
                    snapshot -> {
                        if (snapshot.has(StateField.VOLUME_LEVEL)
                                && snapshot.get(StateField.VOLUME_LEVEL).asInt() == -5) {
                            updated.countDown();
                        }
                    });

            CommandResult result = await(client.sendControl("mixer", "output.1.gain", -5));

            assertTrue(result.success());
            assertEquals("comp-mixer", result.componentId());
            assertEquals(
                    -5,
                    server.getController()
                            .control("comp-mixer", "output.1.gain")
                            .orElseThrow()
                            .get("value")
                            .asInt());
            assertTrue(updated.await(WAIT_SECONDS, TimeUnit.SECONDS));
            assertEquals(0, client.pendingCommandCount());
        }

        @Test
        @DisplayName("a rejected command fails with the bridge's reason")
        void commandRejected() {
            server.getController().rejectControl("ZoneDimLevel1");

            assertEquals(
                    BridgeError.COMMAND_REJECTED,
                    errorOf(client.sendControl("lighting", "ZoneDimLevel1", 80)));
        }

        @Test
        @DisplayName("an unknown role fails without reaching the bridge")
        void unknownRole() {
            assertEquals(
                    BridgeError.COMPONENT_NOT_FOUND,
                    errorOf(client.sendControl("projector", "power", true)));
        }

        @Test
        @DisplayName("subscriptions are confirmed by delivered state")
        void subscribeToControl() throws Exception {
            assertEquals(
                    "comp-gpio:pin.8.digital.out",
                    await(client.subscribeToControl("comp-gpio", "pin.8.digital.out")).key());
        }

        @Test
        @DisplayName("controller status broadcasts reach listeners")
        void statusBroadcast() throws Exception {
            CountDownLatch degraded = new CountDownLatch(1);
            client.onStatusChange(
                    status -> {
                        if ("degraded".equals(status.health())) {
                            degraded.countDown();
                        }
                    });

            server.announceStatus("core overheating", "degraded");

            assertTrue(degraded.await(WAIT_SECONDS, TimeUnit.SECONDS));
            assertEquals("core overheating", client.getControllerStatus().status());
        }

        @Test
        @DisplayName("a dropped link re-identifies and becomes ready again")
        void relinks() throws Exception {
            CountDownLatch readyAgain = new CountDownLatch(1);
            CountDownLatch dropped = new CountDownLatch(1);
            client.onConnectionStateChange(
                    (previous, current, cause) -> {
                        if (!current.acceptsCommands()) {
                            dropped.countDown();
                        } else if (dropped.getCount() == 0) {
                            readyAgain.countDown();
                        }
                    });

            server.dropSessions();

            assertTrue(dropped.await(WAIT_SECONDS, TimeUnit.SECONDS));
            assertTrue(readyAgain.await(WAIT_SECONDS, TimeUnit.SECONDS));
            assertEquals(
                    "client-2", client.getServerIdentity().orElseThrow().assignedClientId());
            assertTrue(await(client.sendControl("gpio", "pin.8.digital.out", true)).success());
        }
    }

    @Nested
    @DisplayName("Authentication")
    class AuthTests {

        @Test
        @DisplayName("the right token is accepted")
        void tokenAccepted() throws Exception {
            startServer("s3cret");
            client = ControlBridges.create(clientConfig().authToken("s3cret").build());

            await(client.init());

            assertEquals(ConnectionState.READY, client.getConnectionState());
        }

        @Test
        @DisplayName("a wrong token fails init")
        void tokenRejected() throws Exception {
            startServer("s3cret");
            client = ControlBridges.create(clientConfig().authToken("guess").build());

            assertEquals(BridgeError.TRANSPORT_ERROR, errorOf(client.init()));
            assertEquals(ConnectionState.DISCONNECTED, client.getConnectionState());
            assertEquals(0, server.getSessionCount());
        }
    }

    @Nested
    @DisplayName("Unreachable bridge")
    class UnreachableTests {

        @Test
        @DisplayName("init fails once the server is gone")
        void serverStopped() throws Exception {
            startServer(null);
            BridgeClientConfig config = clientConfig().build();
            server.stop();
            client = ControlBridges.create(config);

            assertEquals(BridgeError.TRANSPORT_ERROR, errorOf(client.init()));
        }
    }
}
