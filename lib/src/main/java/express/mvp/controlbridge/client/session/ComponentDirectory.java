package express.mvp.controlbridge.client.session;

import com.fasterxml.jackson.databind.JsonNode;
import express.mvp.controlbridge.client.BridgeException;
import express.mvp.controlbridge.client.protocol.ComponentRecord;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.logging.Logger;

/**
 * Components discovered on the controller, role assignments, and subscriptions.
 *
 * <h2>Discovery</h2>
 *
 * <p>{@link #replaceAll} swaps in a new snapshot wholesale and re-resolves roles. Discovery
 * order is kept: when several components match a role or a name, the first one listed by the
 * controller wins. Two components whose names both contain a pattern are therefore not
 * distinguishable by role.
 *
 * <h2>Subscriptions</h2>
 *
 * <p>A subscription is pending until the bridge delivers the subscribed state, then recorded.
 * Callers asking for a key that is recorded get the record back; callers asking for a key that is
 * pending share the pending future. {@link #clearSubscriptions} forgets both.
 *
 * <p>Confined to the connection's event loop.
 */
public final class ComponentDirectory {

    private static final Logger LOGGER = Logger.getLogger(ComponentDirectory.class.getName());

    private final List<RolePattern> rolePatterns;
    private volatile List<ComponentRecord> components = List.of();
    private volatile Map<String, String> roles = Map.of();
    private final Map<String, SubscriptionRecord> subscriptions = new HashMap<>();
    private final Map<String, CompletableFuture<SubscriptionRecord>> pending = new HashMap<>();

    public ComponentDirectory(List<RolePattern> rolePatterns) {
        this.rolePatterns = List.copyOf(rolePatterns);
    }

    /**
     * Replaces the directory contents and re-resolves every role.
     *
     * @param records components in discovery order
     * @return role to component id for the roles that resolved
     */
    public Map<String, String> replaceAll(List<ComponentRecord> records) {
        this.components = List.copyOf(records);
        Map<String, String> resolved = new LinkedHashMap<>();
        for (RolePattern pattern : rolePatterns) {
            for (ComponentRecord record : records) {
                if (pattern.matches(record.displayName())) {
                    resolved.put(pattern.role(), record.id());
                    LOGGER.info(
                            () ->
                                    "Role "
                                            + pattern.role()
                                            + " -> "
                                            + record.id()
                                            + " ("
                                            + record.displayName()
                                            + ")");
                    break;
                }
            }
        }
        this.roles = Collections.unmodifiableMap(resolved);
        return roles;
    }

    /**
     * Finds the first component whose name contains the given text, ignoring case.
     *
     * @param name text to look for
     * @return the component, or empty
     */
    public Optional<ComponentRecord> findComponent(String name) {
        String needle = name.toLowerCase(Locale.ROOT);
        for (ComponentRecord record : components) {
            if (record.displayName().toLowerCase(Locale.ROOT).contains(needle)) {
                return Optional.of(record);
            }
        }
        return Optional.empty();
    }

    /**
     * Finds the component holding a role.
     *
     * @param role role alias
     * @return the component, or empty if the role did not resolve
     */
    public Optional<ComponentRecord> findByRole(String role) {
        String id = roles.get(role);
        return id == null ? Optional.empty() : findById(id);
    }

    public Optional<ComponentRecord> findById(String componentId) {
        for (ComponentRecord record : components) {
            if (record.id().equals(componentId)) {
                return Optional.of(record);
            }
        }
        return Optional.empty();
    }

    /**
     * Resolves a command target to a component id. Targets containing {@code '-'} are taken as
     * ids already; anything else is looked up as a role.
     *
     * @param target component id or role alias
     * @return the component id, or empty
     */
    public Optional<String> resolveTarget(String target) {
        if (target == null || target.isEmpty()) {
            return Optional.empty();
        }
        if (target.indexOf('-') >= 0) {
            return Optional.of(target);
        }
        return Optional.ofNullable(roles.get(target));
    }

    public Map<String, String> roles() {
        return roles;
    }

    public List<ComponentRecord> components() {
        return components;
    }

    public int size() {
        return components.size();
    }

    public boolean isEmpty() {
        return components.isEmpty();
    }

    /**
     * Returns the recorded subscription for a key.
     *
     * @param key subscription key
     * @return the record, or empty
     */
    public Optional<SubscriptionRecord> subscription(String key) {
        return Optional.ofNullable(subscriptions.get(key));
    }

    /**
     * Returns the in-flight request for a key.
     *
     * @param key subscription key
     * @return the shared future, or empty if none is pending
     */
    public Optional<CompletableFuture<SubscriptionRecord>> pendingSubscription(String key) {
        return Optional.ofNullable(pending.get(key));
    }

    /**
     * Marks a key as requested.
     *
     * @param key subscription key
     * @return the future every caller for this key shares
     * @throws IllegalStateException if the key is already recorded or pending
     */
    public CompletableFuture<SubscriptionRecord> beginSubscription(String key) {
        if (subscriptions.containsKey(key) || pending.containsKey(key)) {
            throw new IllegalStateException("Subscription already known: " + key);
        }
        CompletableFuture<SubscriptionRecord> future = new CompletableFuture<>();
        pending.put(key, future);
        return future;
    }

    /**
     * Records a subscription confirmed by delivered state. Later deliveries for a confirmed key
     * refresh its last delivered state.
     *
     * @param componentId component id
     * @param controlId control id, or null
     * @param delivered the state that arrived
     * @param now epoch millis
     * @return the newly confirmed record, or empty if the key was not pending
     */
    public Optional<SubscriptionRecord> confirmSubscription(
            String componentId, String controlId, JsonNode delivered, long now) {
        String key = SubscriptionRecord.key(componentId, controlId);
        CompletableFuture<SubscriptionRecord> future = pending.remove(key);
        if (future == null) {
            subscriptions.computeIfPresent(key, (k, known) -> known.withLastDelivered(delivered));
            return Optional.empty();
        }
        SubscriptionRecord record =
                new SubscriptionRecord(key, componentId, controlId, now, delivered);
        subscriptions.put(key, record);
        LOGGER.info(() -> "Subscribed to " + key);
        future.complete(record);
        return Optional.of(record);
    }

    /**
     * Fails a pending subscription, leaving the key free for a later attempt.
     *
     * @param key subscription key
     * @param error failure
     * @return false if the key was not pending
     */
    public boolean failSubscription(String key, BridgeException error) {
        CompletableFuture<SubscriptionRecord> future = pending.remove(key);
        if (future == null) {
            return false;
        }
        future.completeExceptionally(error);
        return true;
    }

    /**
     * Forgets every subscription. Pending ones fail with the given error.
     *
     * @param error failure for pending subscriptions
     */
    public void clearSubscriptions(BridgeException error) {
        List<CompletableFuture<SubscriptionRecord>> drained = new ArrayList<>(pending.values());
        pending.clear();
        subscriptions.clear();
        for (CompletableFuture<SubscriptionRecord> future : drained) {
            future.completeExceptionally(error);
        }
    }

    public int subscriptionCount() {
        return subscriptions.size();
    }

    public int pendingSubscriptionCount() {
        return pending.size();
    }

    @Override
    public String toString() {
        return "ComponentDirectory{components="
                + components.size()
                + ", roles="
                + roles
                + ", subscriptions="
                + subscriptions.size()
                + '}';
    }
}
