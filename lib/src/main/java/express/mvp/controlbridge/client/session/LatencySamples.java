package express.mvp.controlbridge.client.session;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;

/** Bounded window of latency samples; the oldest is evicted once full. */
public final class LatencySamples {

    public static final int DEFAULT_CAPACITY = 10;

    private final int capacity;
    private final Deque<Long> samples = new ArrayDeque<>();
    private long current;

    public LatencySamples() {
        this(DEFAULT_CAPACITY);
    }

    public LatencySamples(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
    }

    public synchronized void add(long latencyMillis) {
        current = latencyMillis;
        samples.addLast(latencyMillis);
        while (samples.size() > capacity) {
            samples.removeFirst();
        }
    }

    public synchronized long current() {
        return current;
    }

    /**
     * Returns the rounded mean.
     *
     * @return mean of retained samples, 0 when empty
     */
    public synchronized long average() {
        if (samples.isEmpty()) {
            return 0;
        }
        long sum = 0;
        for (long sample : samples) {
            sum += sample;
        }
        return Math.round((double) sum / samples.size());
    }

    public synchronized int size() {
        return samples.size();
    }

    public synchronized Latency snapshot() {
        return new Latency(current, average(), new ArrayList<>(samples));
    }
}
