package express.mvp.controlbridge.client.session;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import express.mvp.controlbridge.client.protocol.ComponentRecord;
import express.mvp.controlbridge.client.protocol.Json;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.LongSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Local mirror of the remote controls listed in {@link StateField}.
 *
 * <p>Fed by two shapes of update: a single control delta ({@code control:update}) and a
 * component snapshot ({@code component:state}, or every component of a {@code controller:state}).
 * Every applied update stamps the whole cache, so freshness is tracked for the cache as a whole
 * rather than per field.
 *
 * <p>{@code ConnectedSources} carries a JSON document as a string; only its {@code sources} array
 * is kept. A document that does not parse leaves the previous value in place.
 *
 * <p>Mutation is confined to the connection's event loop. Listeners run synchronously after each
 * update; a listener that throws is logged and skipped.
 */
public final class StateCache {

    private static final Logger LOGGER = Logger.getLogger(StateCache.class.getName());

    private final LongSupplier clock;
    private final long ttlMillis;
    private final Map<StateField, JsonNode> values = new EnumMap<>(StateField.class);
    private final List<Consumer<StateSnapshot>> listeners = new CopyOnWriteArrayList<>();
    private volatile StateSnapshot current = StateSnapshot.empty();

    /**
     * Creates a cache.
     *
     * @param clock epoch-millis clock
     * @param ttlMillis age after which the cache is stale
     */
    public StateCache(LongSupplier clock, long ttlMillis) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.ttlMillis = ttlMillis;
    }

    /**
     * Applies a single control delta. Controls that are not mirrored still refresh the timestamp.
     *
     * @param controlId wire control name
     * @param control control descriptor
     */
    public void applyControl(String controlId, JsonNode control) {
        StateField.fromWire(controlId).ifPresent(field -> store(field, control));
        publish();
    }

    /**
     * Applies a component snapshot.
     *
     * @param component the component with its controls
     */
    public void applyComponent(ComponentRecord component) {
        applyControls(component.controls());
        publish();
    }

    /**
     * Applies every component of a controller snapshot as one update.
     *
     * @param components components in discovery order
     */
    public void applyComponents(List<ComponentRecord> components) {
        for (ComponentRecord component : components) {
            applyControls(component.controls());
        }
        publish();
    }

    public StateSnapshot snapshot() {
        return current;
    }

    public long timestamp() {
        return current.timestamp();
    }

    /**
     * Returns whether the cache is older than its TTL.
     *
     * @return true if never updated or last updated more than TTL ago
     */
    public boolean isStale() {
        return clock.getAsLong() - current.timestamp() > ttlMillis;
    }

    public long ttlMillis() {
        return ttlMillis;
    }

    public void addListener(Consumer<StateSnapshot> listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public boolean removeListener(Consumer<StateSnapshot> listener) {
        return listeners.remove(listener);
    }

    private void applyControls(Map<String, JsonNode> controls) {
        for (Map.Entry<String, JsonNode> entry : controls.entrySet()) {
            StateField.fromWire(entry.getKey()).ifPresent(field -> store(field, entry.getValue()));
        }
    }

    private void store(StateField field, JsonNode control) {
        if (field == StateField.CONNECTED_SOURCES) {
            JsonNode sources = parseSources(control);
            if (sources != null) {
                values.put(field, sources);
            }
        } else {
            JsonNode value = control == null ? null : control.get("value");
            values.put(field, value != null ? value : NullNode.getInstance());
        }
    }

    private void publish() {
        StateSnapshot snapshot = new StateSnapshot(values, clock.getAsLong());
        current = snapshot;
        for (Consumer<StateSnapshot> listener : listeners) {
            try {
                listener.accept(snapshot);
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "State listener threw", e);
            }
        }
    }

    /** Returns the {@code sources} member of the embedded document, or null if unusable. */
    static JsonNode parseSources(JsonNode control) {
        if (control == null) {
            return null;
        }
        String document = Json.text(control, "string");
        if (document == null || document.isEmpty()) {
            JsonNode value = control.get("value");
            if (value != null && value.isObject()) {
                return value.path("sources").isMissingNode()
                        ? NullNode.getInstance()
                        : value.get("sources");
            }
            document = Json.text(control, "value");
        }
        if (document == null) {
            return null;
        }
        try {
            JsonNode parsed = Json.MAPPER.readTree(document);
            JsonNode sources = parsed == null ? null : parsed.get("sources");
            return sources != null ? sources : NullNode.getInstance();
        } catch (JsonProcessingException e) {
            String finalDocument = document;
            LOGGER.fine(() -> "Ignoring malformed ConnectedSources document: " + finalDocument);
            return null;
        }
    }
}
