package express.mvp.controlbridge.client.channel;

import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link EventLoop} backed by a one-thread {@link ScheduledThreadPoolExecutor}.
 *
 * <p>Tasks that throw are logged and do not cancel periodic schedules. The thread is a daemon
 * named {@code controlbridge-loop-N}.
 */
public final class SingleThreadEventLoop implements EventLoop {

    private static final Logger LOGGER = Logger.getLogger(SingleThreadEventLoop.class.getName());

    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    private final ScheduledThreadPoolExecutor executor;
    private volatile Thread loopThread;

    public SingleThreadEventLoop() {
        this("controlbridge-loop-" + THREAD_COUNTER.incrementAndGet());
    }

    /**
     * Creates a loop whose thread has the given name.
     *
     * @param threadName thread name
     */
    public SingleThreadEventLoop(String threadName) {
        ThreadFactory factory =
                runnable -> {
                    Thread thread = new Thread(runnable, threadName);
                    thread.setDaemon(true);
                    loopThread = thread;
                    return thread;
                };
        this.executor = new ScheduledThreadPoolExecutor(1, factory);
        this.executor.setRemoveOnCancelPolicy(true);
        this.executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    }

    @Override
    public void execute(Runnable task) {
        executor.execute(guarded(task));
    }

    @Override
    public Scheduled schedule(Runnable task, long delayMillis) {
        return new FutureHandle(
                executor.schedule(guarded(task), Math.max(0, delayMillis), TimeUnit.MILLISECONDS));
    }

    @Override
    public Scheduled scheduleAtFixedRate(
            Runnable task, long initialDelayMillis, long periodMillis) {
        return new FutureHandle(
                executor.scheduleAtFixedRate(
                        guarded(task),
                        Math.max(0, initialDelayMillis),
                        periodMillis,
                        TimeUnit.MILLISECONDS));
    }

    @Override
    public long now() {
        return System.currentTimeMillis();
    }

    @Override
    public boolean inEventLoop() {
        return Thread.currentThread() == loopThread;
    }

    @Override
    public void shutdown() {
        executor.shutdownNow();
    }

    /**
     * Waits for the loop thread to exit after {@link #shutdown()}.
     *
     * @param timeoutMillis maximum wait
     * @return true if the loop terminated
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitTermination(long timeoutMillis) throws InterruptedException {
        return executor.awaitTermination(timeoutMillis, TimeUnit.MILLISECONDS);
    }

    private static Runnable guarded(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "Event loop task failed", e);
            }
        };
    }

    private static final class FutureHandle implements Scheduled {
        private final ScheduledFuture<?> future;

        FutureHandle(ScheduledFuture<?> future) {
            this.future = future;
        }

        @Override
        public void cancel() {
            future.cancel(false);
        }

        @Override
        public boolean isCancelled() {
            return future.isCancelled();
        }
    }
}
