package de.mirkosertic.corpuscoverage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Manages the thread pool that counts token partitions in parallel.
 */
public class AnalysisExecutorService implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(AnalysisExecutorService.class);

    private final ThreadPoolExecutor executor;

    public AnalysisExecutorService(final int threadPoolSize) {
        final AtomicInteger threadCounter = new AtomicInteger(0);
        final ThreadFactory threadFactory = r -> {
            final Thread thread = new Thread(r, "counter-" + threadCounter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        };

        this.executor = new ThreadPoolExecutor(
                threadPoolSize,
                threadPoolSize,
                0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(1000),
                threadFactory,
                new ThreadPoolExecutor.CallerRunsPolicy()
        );

        logger.info("AnalysisExecutorService initialized with {} threads", threadPoolSize);
    }

    public <T> Future<T> submit(final Callable<T> task) {
        return executor.submit(task);
    }

    /**
     * Shutdown the executor service. Should be called once the analysis is complete.
     */
    public void shutdown() {
        logger.info("Shutting down AnalysisExecutorService");
        executor.shutdown();
        try {
            if (!executor.awaitTermination(10, TimeUnit.SECONDS)) {
                logger.warn("AnalysisExecutorService did not terminate in time, forcing shutdown");
                executor.shutdownNow();
            }
        } catch (final InterruptedException e) {
            logger.error("Interrupted while waiting for AnalysisExecutorService to terminate", e);
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        shutdown();
    }
}
