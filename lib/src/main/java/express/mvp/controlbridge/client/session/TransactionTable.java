package express.mvp.controlbridge.client.session;

import express.mvp.controlbridge.client.BridgeError;
import express.mvp.controlbridge.client.BridgeException;
import express.mvp.controlbridge.client.channel.EventLoop;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * Outstanding {@code control:set} commands keyed by transaction id.
 *
 * <p>Each command is resolved by exactly one of success, error, timeout or {@link #failAll}.
 * Whichever path gets there first removes the entry and cancels its timer; the others find
 * nothing and return false. Confined to the connection's {@link EventLoop}.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * String txId = table.nextTransactionId();
 * CompletableFuture<CommandResult> result =
 *     table.register(txId, componentId, controlId, commandTimeoutMillis);
 * channel.emit(new OutboundEvent.ControlSet(controllerId, componentId, controlId, value, txId));
 * // later, from the inbound dispatcher:
 * table.resolveSuccess(txId);
 * }</pre>
 */
public final class TransactionTable {

    private static final Logger LOGGER = Logger.getLogger(TransactionTable.class.getName());

    private final EventLoop loop;
    private final String prefix;
    private final AtomicLong sequence = new AtomicLong();
    private final Map<String, PendingCommand> pending = new HashMap<>();

    /**
     * Creates a table.
     *
     * @param loop loop used for timeouts and timestamps
     * @param prefix first segment of generated transaction ids
     */
    public TransactionTable(EventLoop loop, String prefix) {
        this.loop = Objects.requireNonNull(loop, "loop");
        this.prefix = Objects.requireNonNull(prefix, "prefix");
    }

    /**
     * Generates a fresh transaction id of the form {@code prefix-epochMillis-seq-uuid8}.
     *
     * @return the id, never reused by this table
     */
    public String nextTransactionId() {
        return prefix
                + "-"
                + loop.now()
                + "-"
                + sequence.incrementAndGet()
                + "-"
                + UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Registers a command and arms its timeout.
     *
     * @param transactionId id carried by the outbound command
     * @param componentId target component
     * @param controlId target control
     * @param timeoutMillis time to wait for the acknowledgement
     * @return future completed with the result, or exceptionally with {@link
     *     BridgeError#COMMAND_REJECTED} or {@link BridgeError#COMMAND_TIMEOUT}
     * @throws IllegalStateException if the id is already pending
     */
    public CompletableFuture<CommandResult> register(
            String transactionId, String componentId, String controlId, long timeoutMillis) {
        if (pending.containsKey(transactionId)) {
            throw new IllegalStateException("Transaction already pending: " + transactionId);
        }
        CompletableFuture<CommandResult> future = new CompletableFuture<>();
        EventLoop.Scheduled timeout =
                loop.schedule(() -> expire(transactionId, timeoutMillis), timeoutMillis);
        pending.put(
                transactionId,
                new PendingCommand(
                        transactionId, componentId, controlId, loop.now(), future, timeout));
        return future;
    }

    /**
     * Resolves a command as acknowledged.
     *
     * @param transactionId the id from {@code control:set:success}
     * @return false if no such command is pending (late or unknown)
     */
    public boolean resolveSuccess(String transactionId) {
        PendingCommand command = take(transactionId);
        if (command == null) {
            LOGGER.fine(() -> "Late or unknown success for " + transactionId);
            return false;
        }
        command.future()
                .complete(
                        new CommandResult(
                                true,
                                transactionId,
                                command.componentId(),
                                command.controlId(),
                                loop.now() - command.createdAt()));
        return true;
    }

    /**
     * Resolves a command as rejected by the bridge.
     *
     * @param transactionId the id from {@code control:set:error}
     * @param message the remote message
     * @return false if no such command is pending (late or unknown)
     */
    public boolean resolveError(String transactionId, String message) {
        PendingCommand command = take(transactionId);
        if (command == null) {
            LOGGER.fine(() -> "Late or unknown error for " + transactionId);
            return false;
        }
        command.future()
                .completeExceptionally(new BridgeException(BridgeError.COMMAND_REJECTED, message));
        return true;
    }

    /**
     * Fails a single pending command, for example when its request could not be sent.
     *
     * @param transactionId the command
     * @param error the failure
     * @return false if no such command is pending
     */
    public boolean fail(String transactionId, BridgeException error) {
        PendingCommand command = take(transactionId);
        if (command == null) {
            return false;
        }
        command.future().completeExceptionally(error);
        return true;
    }

    /**
     * Fails every pending command.
     *
     * @param error the failure to complete them with
     * @return how many commands were failed
     */
    public int failAll(BridgeException error) {
        List<PendingCommand> drained = new ArrayList<>(pending.values());
        pending.clear();
        for (PendingCommand command : drained) {
            command.timeout().cancel();
            command.future().completeExceptionally(error);
        }
        return drained.size();
    }

    public int pendingCount() {
        return pending.size();
    }

    public boolean isPending(String transactionId) {
        return pending.containsKey(transactionId);
    }

    private void expire(String transactionId, long timeoutMillis) {
        PendingCommand command = pending.remove(transactionId);
        if (command == null) {
            return;
        }
        LOGGER.warning("Command " + transactionId + " timed out after " + timeoutMillis + "ms");
        command.future()
                .completeExceptionally(
                        new BridgeException(
                                BridgeError.COMMAND_TIMEOUT,
                                "No acknowledgement for "
                                        + command.componentId()
                                        + "/"
                                        + command.controlId()
                                        + " within "
                                        + timeoutMillis
                                        + "ms"));
    }

    private PendingCommand take(String transactionId) {
        PendingCommand command = pending.remove(transactionId);
        if (command != null) {
            command.timeout().cancel();
        }
        return command;
    }

    private record PendingCommand(
            String transactionId,
            String componentId,
            String controlId,
            long createdAt,
            CompletableFuture<CommandResult> future,
            EventLoop.Scheduled timeout) {}
}
