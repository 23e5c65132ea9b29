package express.mvp.controlbridge.client.channel;

/**
 * The single execution context of a bridge connection.
 *
 * <p>Every inbound event and every timer callback of a connection runs here, one at a time, so
 * connection state needs no locking as long as it is only touched from inside the loop.
 */
public interface EventLoop {

    /**
     * Runs a task on the loop as soon as possible.
     *
     * @param task the task
     */
    void execute(Runnable task);

    /**
     * Runs a task once after a delay.
     *
     * @param task the task
     * @param delayMillis delay in milliseconds
     * @return handle that cancels the task
     */
    Scheduled schedule(Runnable task, long delayMillis);

    /**
     * Runs a task repeatedly.
     *
     * @param task the task
     * @param initialDelayMillis delay before the first run
     * @param periodMillis period between runs
     * @return handle that stops the repetition
     */
    Scheduled scheduleAtFixedRate(Runnable task, long initialDelayMillis, long periodMillis);

    /**
     * Returns the loop's clock.
     *
     * @return epoch milliseconds
     */
    long now();

    /**
     * Returns whether the calling thread is the loop thread.
     *
     * @return true inside the loop
     */
    boolean inEventLoop();

    /** Stops the loop. Pending timers are discarded. */
    void shutdown();

    /** Handle to a scheduled task. */
    interface Scheduled {

        /** Cancels the task. Cancelling twice, or after a one-shot task ran, is a no-op. */
        void cancel();

        boolean isCancelled();
    }
}
