package common;

import exceptions.EngineIOException;

import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Exposes static methods that are used to execute background jobs and scheduled jobs.
 * This class delegates the given jobs to two underlying {@link ExecutorService}s.
 * One is a cached {@link ExecutorService} that is meant for the long running background jobs,
 *  like the frame reading loop of each connection and reconnect dials, which may block on I/O.
 * Other is a single threaded {@link ScheduledExecutorService} that is meant to execute
 *  short scheduled jobs like ping timeouts, forced closes and connection retries.
 */
public class Worker {

    private static final AtomicInteger threadCount = new AtomicInteger();
    private static ExecutorService executor;
    private static ScheduledExecutorService scheduler;

    /*
        Init executor if necessary.
        This method will be called right before the executor is needed.
        This helps to avoid having an executor that is open even when it's not needed yet.
     */
    private static synchronized ExecutorService executor() {
        if(executor == null || executor.isShutdown())
            executor = Executors.newCachedThreadPool(r -> new Thread(r, "Worker-Executor-" + threadCount.incrementAndGet()));
        return executor;
    }

    /*
        Init scheduler if necessary.
        This method will be called right before the scheduler is needed.
        This helps to avoid having a scheduler that is open even when it's not needed yet.
     */
    private static synchronized ScheduledExecutorService scheduler() {
        if(scheduler == null || scheduler.isShutdown()) {
            ScheduledThreadPoolExecutor pool = new ScheduledThreadPoolExecutor(1, r -> new Thread(r, "Worker-Scheduler"));
            // Timers are rearmed on every received frame, don't keep the cancelled ones around.
            pool.setRemoveOnCancelPolicy(true);
            scheduler = pool;
        }
        return scheduler;
    }

    /**
     * Submit a {@link Runnable} to be executed on a background thread. The job may block.
     */
    public static void execute(Runnable runnable) {
        executor().execute(runnable);
    }

    /**
     * Schedule a Runnable that will be run after {@code delay} milliseconds.
     * The job is run on the scheduler thread, so it must not block.
     *
     * @param runnable The Runnable to run after delay.
     * @param delay Amount of time, in milliseconds, to wait before executing the Runnable.
     * @return ScheduledFuture instance that can be used to cancel the job.
     */
    public static ScheduledFuture<?> schedule(Runnable runnable, long delay) {
        return scheduler().schedule(runnable, delay, TimeUnit.MILLISECONDS);
    }

    /**
     *  Shuts down the executor and scheduler threads, and waits 1 second for them to terminate.
     *  <p>
     *  <b>Note:</b> Call this method only when you are completely done with the Engine.IO Client API as a way to clean up
     *               any worker threads that might keep the JVM from shutting down.
     */
    public static void shutdown() {
       shutdown(1000);
    }

    /**
     *  Shuts down the executor and scheduler threads, and waits for the given amount in millis for them to terminate.
     */
    public static synchronized void shutdown(int timeOutInMillis) {
        try {
            if(scheduler != null) {
                scheduler.shutdownNow();
                scheduler.awaitTermination(timeOutInMillis, TimeUnit.MILLISECONDS);
            }

            if(executor != null) {
                executor.shutdown();
                executor.awaitTermination(timeOutInMillis, TimeUnit.MILLISECONDS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EngineIOException("Interrupted while closing worker threads.", e);
        }
    }
}
