package express.mvp.controlbridge.client.error;

import java.time.Duration;
import java.util.Objects;

/**
 * Retry behavior for connecting to the bridge.
 *
 * <p>A policy decides whether another attempt should be made (attempt budget, total duration,
 * error category) and how long to wait before it (a {@link Backoff}). It is handed to the
 * component that drives retries rather than being baked into the connection manager, so the
 * same manager can be driven by an aggressive policy at startup and a lazy one afterwards.
 *
 * <h2>Usage Example</h2>
 *
 * <pre>{@code
 * RetryPolicy policy = RetryPolicy.exponentialBackoffWithJitter(
 *     10,                      // max 10 attempts
 *     Duration.ofSeconds(1),   // base delay
 *     Duration.ofSeconds(30),  // cap
 *     0.25                     // up to +25% jitter
 * );
 *
 * RetryContext context = new RetryContext("connect", policy.getMaxAttempts());
 * while (true) {
 *     context.startAttempt();
 *     try {
 *         manager.connect().join();
 *         break;
 *     } catch (CompletionException e) {
 *         context.recordFailure(e.getCause());
 *         if (!policy.shouldRetry(context)) {
 *             throw e;
 *         }
 *         Thread.sleep(policy.calculateDelay(context));
 *     }
 * }
 * }</pre>
 *
 * @see RetryContext
 * @see ErrorCategory
 */
public final class RetryPolicy {

    /** Maximum number of attempts; {@link Integer#MAX_VALUE} means unbounded. */
    private final int maxAttempts;

    private final Backoff backoff;

    /** Maximum total duration for all retries (0 = no limit). */
    private final long maxTotalDurationMillis;

    private final boolean retryTransient;
    private final boolean retryNetwork;
    private final boolean retryUnknown;

    private RetryPolicy(Builder builder) {
        this.maxAttempts = builder.maxAttempts;
        this.backoff =
                Backoff.of(
                        Duration.ofMillis(builder.initialDelayMillis),
                        Duration.ofMillis(builder.maxDelayMillis),
                        builder.jitterFactor);
        this.maxTotalDurationMillis = builder.maxTotalDurationMillis;
        this.retryTransient = builder.retryTransient;
        this.retryNetwork = builder.retryNetwork;
        this.retryUnknown = builder.retryUnknown;
    }

    /**
     * Returns the maximum number of attempts.
     *
     * @return max attempts, {@link Integer#MAX_VALUE} when unbounded
     */
    public int getMaxAttempts() {
        return maxAttempts;
    }

    /**
     * Returns the backoff used to space attempts.
     *
     * @return the backoff
     */
    public Backoff getBackoff() {
        return backoff;
    }

    /**
     * Determines if another attempt should be made.
     *
     * @param context the retry context
     * @return true if a retry should be attempted
     */
    public boolean shouldRetry(RetryContext context) {
        if (!context.hasAttemptsRemaining()) {
            return false;
        }

        if (maxTotalDurationMillis > 0 && context.getElapsedMillis() >= maxTotalDurationMillis) {
            return false;
        }

        ErrorCategory category = context.getLastErrorCategory();
        if (category == null) {
            return true;
        }

        return switch (category) {
            case TRANSIENT -> retryTransient;
            case NETWORK -> retryNetwork;
            case UNKNOWN -> retryUnknown;
            case PROTOCOL, FATAL -> false;
        };
    }

    /**
     * Calculates the delay before the next attempt and stores it in the context.
     *
     * @param context the retry context
     * @return delay in milliseconds
     */
    public long calculateDelay(RetryContext context) {
        long delay = backoff.delayMillis(context.getAttemptCount());
        context.setNextDelay(delay);
        return delay;
    }

    /**
     * Returns a policy that never retries.
     *
     * @return no-retry policy
     */
    public static RetryPolicy noRetry() {
        return new Builder().maxAttempts(1).build();
    }

    /**
     * Returns a policy with a fixed delay between attempts.
     *
     * @param maxAttempts maximum attempts
     * @param delay delay between attempts
     * @return fixed delay policy
     */
    public static RetryPolicy fixedDelay(int maxAttempts, Duration delay) {
        return new Builder()
                .maxAttempts(maxAttempts)
                .initialDelay(delay)
                .maxDelay(delay)
                .build();
    }

    /**
     * Returns a policy with exponential backoff and upward jitter.
     *
     * @param maxAttempts maximum attempts
     * @param initialDelay base delay
     * @param maxDelay delay cap before jitter
     * @param jitterFactor jitter fraction (0.0-1.0, e.g. 0.25 for up to +25%)
     * @return exponential backoff policy
     */
    public static RetryPolicy exponentialBackoffWithJitter(
            int maxAttempts, Duration initialDelay, Duration maxDelay, double jitterFactor) {
        return new Builder()
                .maxAttempts(maxAttempts)
                .initialDelay(initialDelay)
                .maxDelay(maxDelay)
                .jitterFactor(jitterFactor)
                .build();
    }

    /**
     * Returns a builder for custom policy configuration.
     *
     * @return new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    @Override
    public String toString() {
        return "RetryPolicy[maxAttempts=" + maxAttempts + ", " + backoff + "]";
    }

    /** Builder for {@link RetryPolicy}. */
    public static final class Builder {
        private int maxAttempts = 3;
        private long initialDelayMillis = 1_000;
        private long maxDelayMillis = 30_000;
        private double jitterFactor = Backoff.DEFAULT_JITTER;
        private long maxTotalDurationMillis = 0;
        private boolean retryTransient = true;
        private boolean retryNetwork = true;
        private boolean retryUnknown = true;

        /**
         * Sets the maximum number of attempts.
         *
         * @param maxAttempts max attempts; zero or negative means unbounded
         * @return this builder
         */
        public Builder maxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts <= 0 ? Integer.MAX_VALUE : maxAttempts;
            return this;
        }

        /**
         * Sets the base delay.
         *
         * @param delay base delay
         * @return this builder
         */
        public Builder initialDelay(Duration delay) {
            Objects.requireNonNull(delay, "delay");
            this.initialDelayMillis = delay.toMillis();
            return this;
        }

        /**
         * Sets the delay cap.
         *
         * @param maxDelay maximum delay before jitter
         * @return this builder
         */
        public Builder maxDelay(Duration maxDelay) {
            Objects.requireNonNull(maxDelay, "maxDelay");
            this.maxDelayMillis = maxDelay.toMillis();
            return this;
        }

        /**
         * Sets the jitter fraction.
         *
         * @param jitter jitter fraction (0.0-1.0)
         * @return this builder
         */
        public Builder jitterFactor(double jitter) {
            if (jitter < 0 || jitter > 1.0) {
                throw new IllegalArgumentException("jitterFactor must be 0.0-1.0");
            }
            this.jitterFactor = jitter;
            return this;
        }

        /**
         * Sets the maximum total duration for all attempts.
         *
         * @param duration maximum duration (0 = no limit)
         * @return this builder
         */
        public Builder maxTotalDuration(Duration duration) {
            Objects.requireNonNull(duration, "duration");
            this.maxTotalDurationMillis = duration.toMillis();
            return this;
        }

        public Builder retryTransient(boolean retry) {
            this.retryTransient = retry;
            return this;
        }

        public Builder retryNetwork(boolean retry) {
            this.retryNetwork = retry;
            return this;
        }

        public Builder retryUnknown(boolean retry) {
            this.retryUnknown = retry;
            return this;
        }

        /**
         * Builds the retry policy.
         *
         * @return new policy
         */
        public RetryPolicy build() {
            if (initialDelayMillis > maxDelayMillis) {
                throw new IllegalArgumentException("initialDelay must not exceed maxDelay");
            }
            return new RetryPolicy(this);
        }
    }
}
