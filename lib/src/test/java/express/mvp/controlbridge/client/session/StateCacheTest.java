package express.mvp.controlbridge.client.session;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import express.mvp.controlbridge.client.protocol.ComponentRecord;
import express.mvp.controlbridge.client.protocol.Json;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Unit tests for {@link StateCache}. */
@DisplayName("StateCache")
class StateCacheTest {

    private static final long TTL = 5_000;

    private final AtomicLong clock = new AtomicLong(10_000);
    private StateCache cache;

    @BeforeEach
    void setUp() {
        cache = new StateCache(clock::get, TTL);
    }

    private static JsonNode json(String text) throws JsonProcessingException {
        return Json.MAPPER.readTree(text.replace('\'', '"'));
    }

    @Nested
    @DisplayName("Control deltas")
    class DeltaTests {

        @Test
        @DisplayName("mirrored controls store their value")
        void storesValue() throws Exception {
            cache.applyControl("ZoneDimLevel1", json("{'value':75,'string':'75%'}"));

            StateSnapshot snapshot = cache.snapshot();
            assertEquals(75, snapshot.get(StateField.LIGHTING_LEVEL).asInt());
            assertEquals(10_000, snapshot.timestamp());
        }

        @Test
        @DisplayName("unmirrored controls only refresh the timestamp")
        void unmirroredControl() throws Exception {
            cache.applyControl("ZoneDimLevel1", json("{'value':10}"));
            clock.addAndGet(1_000);

            cache.applyControl("SomethingElse", json("{'value':1}"));

            assertEquals(11_000, cache.timestamp());
            assertEquals(10, cache.snapshot().get(StateField.LIGHTING_LEVEL).asInt());
        }

        @Test
        @DisplayName("wire names match exactly")
        void exactMatch() throws Exception {
            cache.applyControl("zonedimlevel1", json("{'value':10}"));
            assertFalse(cache.snapshot().has(StateField.LIGHTING_LEVEL));
        }

        @Test
        @DisplayName("a control without value stores null")
        void missingValue() throws Exception {
            cache.applyControl("hdmi.enabled.button", json("{'string':'on'}"));

            assertTrue(cache.snapshot().has(StateField.SCREEN_POWER));
            assertTrue(cache.snapshot().get(StateField.SCREEN_POWER).isNull());
        }
    }

    @Nested
    @DisplayName("ConnectedSources")
    class SourcesTests {

        @Test
        @DisplayName("keeps the sources array of the embedded document")
        void parsesDocument() {
            ObjectNode node = Json.MAPPER.createObjectNode();
            node.put("string", "{\"sources\":[{\"id\":1},{\"id\":2}]}");

            cache.applyControl("ConnectedSources", node);

            JsonNode sources = cache.snapshot().get(StateField.CONNECTED_SOURCES);
            assertTrue(sources.isArray());
            assertEquals(2, sources.size());
        }

        @Test
        @DisplayName("a malformed document keeps the previous value")
        void malformedKeepsPrevious() {
            ObjectNode good = Json.MAPPER.createObjectNode();
            good.put("string", "{\"sources\":[\"hdmi1\"]}");
            cache.applyControl("ConnectedSources", good);

            ObjectNode bad = Json.MAPPER.createObjectNode();
            bad.put("string", "{not json");
            cache.applyControl("ConnectedSources", bad);

            JsonNode sources = cache.snapshot().get(StateField.CONNECTED_SOURCES);
            assertEquals("hdmi1", sources.get(0).asText());
        }

        @Test
        @DisplayName("a document without sources stores null")
        void withoutSources() {
            ObjectNode control = Json.MAPPER.createObjectNode();
            control.put("string", "{\"other\":1}");

            cache.applyControl("ConnectedSources", control);

            assertTrue(cache.snapshot().get(StateField.CONNECTED_SOURCES).isNull());
        }
    }

    @Nested
    @DisplayName("Snapshots")
    class SnapshotTests {

        @Test
        @DisplayName("controller snapshot applies every component as one update")
        void controllerSnapshot() throws Exception {
            List<StateSnapshot> seen = new ArrayList<>();
            cache.addListener(seen::add);

            cache.applyComponents(
                    List.of(
                            new ComponentRecord(
                                    "comp-lighting",
                                    "LutronLEAPZone_Office",
                                    Map.of("ZoneDimLevel1", json("{'value':50}"))),
                            new ComponentRecord(
                                    "comp-mixer",
                                    "Mixer_8x8_2",
                                    Map.of("output.1.gain", json("{'value':-20}")))));

            assertEquals(1, seen.size());
            assertEquals(50, seen.get(0).get(StateField.LIGHTING_LEVEL).asInt());
            assertEquals(-20, seen.get(0).get(StateField.VOLUME_LEVEL).asInt());
        }

        @Test
        @DisplayName("semantic JSON lists every field")
        void semanticJson() throws Exception {
            cache.applyControl("output.1.gain", json("{'value':-12}"));

            ObjectNode rendered = cache.snapshot().toJson();

            for (StateField field : StateField.values()) {
                assertTrue(rendered.has(field.semanticName()), field.semanticName());
            }
            assertEquals(-12, rendered.get("volumeLevel").asInt());
            assertTrue(rendered.get("hardwareState").isNull());
            assertEquals(10_000, rendered.get("timestamp").asLong());
        }

        @Test
        @DisplayName("snapshots are not affected by later updates")
        void immutableSnapshots() throws Exception {
            cache.applyControl("ZoneDimLevel1", json("{'value':1}"));
            StateSnapshot before = cache.snapshot();

            cache.applyControl("ZoneDimLevel1", json("{'value':2}"));

            assertEquals(1, before.get(StateField.LIGHTING_LEVEL).asInt());
            assertEquals(2, cache.snapshot().get(StateField.LIGHTING_LEVEL).asInt());
        }

        @Test
        @DisplayName("a throwing listener does not stop the others")
        void throwingListener() throws Exception {
            List<StateSnapshot> seen = new ArrayList<>();
            cache.addListener(
                    snapshot -> {
                        throw new IllegalStateException("boom");
                    });
            cache.addListener(seen::add);

            cache.applyControl("ZoneDimLevel1", json("{'value':1}"));

            assertEquals(1, seen.size());
        }
    }

    @Nested
    @DisplayName("Freshness")
    class FreshnessTests {

        @Test
        @DisplayName("never updated is stale")
        void emptyIsStale() {
            assertTrue(cache.isStale());
            assertEquals(0, cache.timestamp());
        }

        @Test
        @DisplayName("stale only once older than the TTL")
        void ttl() throws Exception {
            cache.applyControl("ZoneDimLevel1", json("{'value':1}"));

            clock.addAndGet(TTL);
            assertFalse(cache.isStale());

            clock.addAndGet(1);
            assertTrue(cache.isStale());
        }
    }
}
