package express.mvp.controlbridge.client.session;

import java.util.List;

/**
 * Round-trip latency of heartbeats.
 *
 * @param currentMillis most recent sample, 0 before the first pong
 * @param averageMillis rounded mean of the retained samples
 * @param samples retained samples, oldest first
 */
public record Latency(long currentMillis, long averageMillis, List<Long> samples) {

    public Latency {
        samples = List.copyOf(samples);
    }
}
