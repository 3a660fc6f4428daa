package de.mirkosertic.catalog.bitbucket.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs tasks repeatedly with a fixed delay between runs.
 * <p>
 * The trigger thread only starts runs; the work itself happens on the worker pool so that
 * the timeout can be enforced. A task id that is still running when its next trigger fires
 * is skipped for that tick.
 */
public class ScheduledTaskRunner implements TaskRunner {

    private static final Logger logger = LoggerFactory.getLogger(ScheduledTaskRunner.class);

    private final TaskScheduleDefinition schedule;
    private final ScheduledExecutorService triggerExecutor;
    private final ExecutorService workerExecutor;
    private final Set<String> runningTaskIds = ConcurrentHashMap.newKeySet();

    ScheduledTaskRunner(final TaskScheduleDefinition schedule,
                        final ScheduledExecutorService triggerExecutor,
                        final ExecutorService workerExecutor) {
        this.schedule = schedule;
        this.triggerExecutor = triggerExecutor;
        this.workerExecutor = workerExecutor;
    }

    @Override
    public void run(final TaskInvocationDefinition task) {
        logger.info("Scheduling task {} every {} (timeout {}, initial delay {})",
                task.id(), schedule.frequency(), schedule.timeout(), schedule.initialDelay());

        triggerExecutor.schedule(() -> trigger(task), schedule.initialDelay().toMillis(), TimeUnit.MILLISECONDS);
    }

    private void trigger(final TaskInvocationDefinition task) {
        if (!runningTaskIds.add(task.id())) {
            logger.warn("Task {} is still running, skipping this run", task.id());
            scheduleNext(task);
            return;
        }

        final Future<?> future;
        try {
            future = workerExecutor.submit(() -> {
                try {
                    task.fn().run();
                } catch (final InterruptedException e) {
                    Thread.currentThread().interrupt();
                    logger.warn("Task {} was interrupted", task.id());
                } catch (final Exception e) {
                    logger.error("Task {} failed", task.id(), e);
                }
            });
        } catch (final RuntimeException e) {
            runningTaskIds.remove(task.id());
            logger.error("Could not start task {}", task.id(), e);
            return;
        }

        // Wait for the run off the trigger thread, then schedule the next one
        workerExecutor.execute(() -> awaitCompletion(task, future));
    }

    private void awaitCompletion(final TaskInvocationDefinition task, final Future<?> future) {
        try {
            future.get(schedule.timeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (final TimeoutException e) {
            logger.error("Task {} exceeded its timeout of {}, interrupting", task.id(), schedule.timeout());
            future.cancel(true);
        } catch (final ExecutionException e) {
            logger.error("Task {} failed", task.id(), e.getCause());
        } catch (final InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return;
        } finally {
            runningTaskIds.remove(task.id());
        }
        scheduleNext(task);
    }

    private void scheduleNext(final TaskInvocationDefinition task) {
        if (triggerExecutor.isShutdown()) {
            return;
        }
        triggerExecutor.schedule(() -> trigger(task), schedule.frequency().toMillis(), TimeUnit.MILLISECONDS);
    }
}
