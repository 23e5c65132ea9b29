package express.mvp.controlbridge.client.error;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Attempt bookkeeping for one retry sequence: how many attempts have started, what the last
 * failure was and how long the sequence has been waiting.
 *
 * <p>Time is read from the supplied clock so a sequence driven from an event loop measures
 * elapsed time on that loop's clock. Confined to the thread that drives the retries.
 *
 * @see RetryPolicy
 */
public final class RetryContext {

    private final String operation;
    private final int maxAttempts;
    private final LongSupplier clock;
    private long startedAt;

    private int attempts;
    private Throwable lastError;
    private ErrorCategory lastCategory;
    private long waitedMillis;
    private long nextDelayMillis;

    /**
     * Creates a context measured on the given clock.
     *
     * @param operation what is being retried, for log lines
     * @param maxAttempts attempt budget, {@link Integer#MAX_VALUE} for unbounded
     * @param clock epoch-millis clock
     */
    public RetryContext(String operation, int maxAttempts, LongSupplier clock) {
        this.operation = Objects.requireNonNull(operation, "operation");
        this.maxAttempts = maxAttempts;
        this.clock = Objects.requireNonNull(clock, "clock");
        this.startedAt = clock.getAsLong();
    }

    /** Creates a context measured on the system clock. */
    public RetryContext(String operation, int maxAttempts) {
        this(operation, maxAttempts, System::currentTimeMillis);
    }

    public RetryContext(int maxAttempts) {
        this("connect", maxAttempts);
    }

    public String getOperation() {
        return operation;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Returns the number of attempts started so far, 0 before the first.
     *
     * @return attempts started
     */
    public int getAttemptCount() {
        return attempts;
    }

    public boolean hasAttemptsRemaining() {
        return attempts < maxAttempts;
    }

    /** True once the attempt in progress is the last the budget allows. */
    public boolean isLastAttempt() {
        return attempts >= maxAttempts;
    }

    /**
     * Marks the start of an attempt.
     *
     * @return the attempt number, starting at 1
     */
    public int startAttempt() {
        attempts++;
        return attempts;
    }

    /**
     * Records why the current attempt failed. The category decides whether the policy retries.
     *
     * @param error the failure
     */
    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP2",
            justification = "The failure is kept as-is for the final error report.")
    public void recordFailure(Throwable error) {
        lastError = error;
        lastCategory = ErrorClassifier.classify(error);
    }

    @SuppressFBWarnings(
            value = "EI_EXPOSE_REP",
            justification = "The failure is handed back as-is for the final error report.")
    public Throwable getLastError() {
        return lastError;
    }

    /** Category of the last failure, null before any. */
    public ErrorCategory getLastErrorCategory() {
        return lastCategory;
    }

    public long getElapsedMillis() {
        return clock.getAsLong() - startedAt;
    }

    void setNextDelay(long delayMillis) {
        nextDelayMillis = delayMillis;
    }

    /** Delay most recently computed by {@link RetryPolicy#calculateDelay(RetryContext)}. */
    public long getNextDelayMillis() {
        return nextDelayMillis;
    }

    /**
     * Adds a backoff wait to the running total.
     *
     * @param delayMillis the wait applied before the next attempt
     */
    public void recordDelay(long delayMillis) {
        waitedMillis += delayMillis;
    }

    public long getTotalDelayMillis() {
        return waitedMillis;
    }

    /** Starts a fresh sequence, as after a successful attempt. */
    public void reset() {
        attempts = 0;
        lastError = null;
        lastCategory = null;
        waitedMillis = 0;
        nextDelayMillis = 0;
        startedAt = clock.getAsLong();
    }

    @Override
    public String toString() {
        String budget =
                maxAttempts == Integer.MAX_VALUE ? "unbounded" : String.valueOf(maxAttempts);
        return operation
                + " attempt "
                + attempts
                + "/"
                + budget
                + " after "
                + getElapsedMillis()
                + "ms"
                + (lastCategory == null ? "" : ", last failure " + lastCategory);
    }
}
