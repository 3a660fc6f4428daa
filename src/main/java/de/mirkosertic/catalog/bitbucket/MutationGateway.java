package de.mirkosertic.catalog.bitbucket;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded executor for catalog calls issued by a delta refresh.
 * <p>
 * A fixed pool drains one FIFO queue, so at most {@code maxConcurrency} calls are in flight.
 * A batch is submitted as a whole and then awaited as a whole: a failing call never cancels
 * its siblings.
 */
public class MutationGateway {

    private static final Logger logger = LoggerFactory.getLogger(MutationGateway.class);

    public static final int DEFAULT_MAX_CONCURRENCY = 10;

    private final ThreadPoolExecutor executor;

    public MutationGateway(final String name) {
        this(name, DEFAULT_MAX_CONCURRENCY);
    }

    public MutationGateway(final String name, final int maxConcurrency) {
        final AtomicInteger threadCounter = new AtomicInteger(0);
        final ThreadFactory threadFactory = r -> {
            final Thread thread = new Thread(r, name + "-mutation-" + threadCounter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };

        this.executor = new ThreadPoolExecutor(
                maxConcurrency,
                maxConcurrency,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(),
                threadFactory
        );

        logger.debug("MutationGateway {} initialized with {} threads", name, maxConcurrency);
    }

    /**
     * Run all tasks and wait for every one of them.
     *
     * @throws MutationFailedException if at least one task failed, with the first failure
     *                                 (in submission order) as cause
     * @throws InterruptedException    if the caller is interrupted while waiting
     */
    public void invokeAll(final List<? extends Callable<?>> tasks) throws InterruptedException {
        final List<Future<?>> futures = new ArrayList<>(tasks.size());
        for (final Callable<?> task : tasks) {
            futures.add(executor.submit(task));
        }

        Throwable firstFailure = null;
        int failedCount = 0;
        for (final Future<?> future : futures) {
            try {
                future.get();
            } catch (final ExecutionException e) {
                failedCount++;
                if (firstFailure == null) {
                    firstFailure = e.getCause();
                } else {
                    logger.debug("Additional catalog call failure", e.getCause());
                }
            }
        }

        if (firstFailure != null) {
            throw new MutationFailedException(failedCount + " of " + tasks.size() + " catalog calls failed",
                    firstFailure, failedCount);
        }
    }

    /**
     * Shutdown the executor. Should be called when the provider is discarded.
     */
    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.warn("MutationGateway did not terminate in time, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            logger.error("Interrupted while waiting for MutationGateway to terminate", e);
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
