package express.mvp.controlbridge.client.error;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.DoubleSupplier;

/**
 * Jittered exponential backoff.
 *
 * <p>{@code delay(attempt) = min(base * 2^attempt, cap) * (1 + jitter)} with {@code jitter}
 * drawn uniformly from {@code [0, jitterFraction)}. The jitter only ever lengthens the delay, so
 * the upper bound for any attempt is {@code cap * (1 + jitterFraction)}.
 *
 * <pre>{@code
 * Backoff backoff = Backoff.of(Duration.ofSeconds(1), Duration.ofSeconds(30));
 * long waitMillis = backoff.delayMillis(attempt);
 * }</pre>
 *
 * <p>Instances are immutable and thread-safe; the random source is only read.
 */
public final class Backoff {

    /** Jitter fraction used when none is given. */
    public static final double DEFAULT_JITTER = 0.25;

    private final long baseMillis;
    private final long capMillis;
    private final double jitterFraction;
    private final DoubleSupplier random;

    private Backoff(long baseMillis, long capMillis, double jitterFraction, DoubleSupplier random) {
        if (baseMillis < 0 || capMillis < 0) {
            throw new IllegalArgumentException("base and cap must be >= 0");
        }
        if (jitterFraction < 0 || jitterFraction > 1.0) {
            throw new IllegalArgumentException("jitterFraction must be 0.0-1.0");
        }
        this.baseMillis = baseMillis;
        this.capMillis = capMillis;
        this.jitterFraction = jitterFraction;
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * Creates a backoff with the default 25% jitter.
     *
     * @param base delay for attempt 0
     * @param cap maximum delay before jitter
     * @return the backoff
     */
    public static Backoff of(Duration base, Duration cap) {
        return of(base, cap, DEFAULT_JITTER);
    }

    /**
     * Creates a backoff with an explicit jitter fraction.
     *
     * @param base delay for attempt 0
     * @param cap maximum delay before jitter
     * @param jitterFraction upper bound of the jitter, 0.0-1.0
     * @return the backoff
     */
    public static Backoff of(Duration base, Duration cap, double jitterFraction) {
        return new Backoff(
                base.toMillis(),
                cap.toMillis(),
                jitterFraction,
                () -> ThreadLocalRandom.current().nextDouble());
    }

    /**
     * Returns a copy drawing jitter from the given source of values in {@code [0, 1)}.
     *
     * @param random uniform source
     * @return a new backoff
     */
    public Backoff withRandom(DoubleSupplier random) {
        return new Backoff(baseMillis, capMillis, jitterFraction, random);
    }

    /**
     * Computes the delay for an attempt.
     *
     * @param attempt zero-based attempt number; negative values are treated as 0
     * @return delay in milliseconds
     */
    public long delayMillis(int attempt) {
        double jitter = jitterFraction == 0 ? 0 : random.getAsDouble() * jitterFraction;
        return (long) (cappedMillis(attempt) * (1 + jitter));
    }

    /**
     * Computes the delay for an attempt without jitter.
     *
     * @param attempt zero-based attempt number
     * @return the capped exponential delay in milliseconds
     */
    public long cappedMillis(int attempt) {
        int exponent = Math.max(0, Math.min(attempt, 62));
        double raw = baseMillis * Math.pow(2, exponent);
        return (long) Math.min(raw, capMillis);
    }

    /**
     * Returns the largest delay this backoff can produce.
     *
     * @return {@code cap * (1 + jitterFraction)} in milliseconds
     */
    public long maxDelayMillis() {
        return (long) (capMillis * (1 + jitterFraction));
    }

    public long baseMillis() {
        return baseMillis;
    }

    public long capMillis() {
        return capMillis;
    }

    public double jitterFraction() {
        return jitterFraction;
    }

    @Override
    public String toString() {
        return "Backoff[base="
                + baseMillis
                + "ms, cap="
                + capMillis
                + "ms, jitter="
                + jitterFraction
                + "]";
    }
}
