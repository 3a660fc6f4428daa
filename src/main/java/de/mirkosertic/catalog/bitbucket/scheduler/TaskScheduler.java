package de.mirkosertic.catalog.bitbucket.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Creates {@link ScheduledTaskRunner}s that share one trigger thread and one worker pool.
 */
public class TaskScheduler {

    private static final Logger logger = LoggerFactory.getLogger(TaskScheduler.class);

    private final ScheduledExecutorService triggerExecutor;
    private final ExecutorService workerExecutor;

    public TaskScheduler() {
        this.triggerExecutor = Executors.newSingleThreadScheduledExecutor(daemonThreads("task-trigger"));
        this.workerExecutor = Executors.newCachedThreadPool(daemonThreads("task-worker"));
    }

    public TaskRunner createScheduledTaskRunner(final TaskScheduleDefinition schedule) {
        return new ScheduledTaskRunner(schedule, triggerExecutor, workerExecutor);
    }

    /**
     * Stops all scheduled tasks. Running tasks are interrupted after a grace period.
     */
    public void shutdown() {
        logger.info("Shutting down TaskScheduler");
        triggerExecutor.shutdownNow();
        workerExecutor.shutdown();
        try {
            if (!workerExecutor.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.warn("Scheduled tasks did not terminate in time, forcing shutdown");
                workerExecutor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            logger.error("Interrupted while waiting for scheduled tasks to terminate", e);
            workerExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory daemonThreads(final String prefix) {
        final AtomicInteger threadCounter = new AtomicInteger(0);
        return r -> {
            final Thread thread = new Thread(r, prefix + "-" + threadCounter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };
    }
}
