package fun.fengwk.msh.core.service.scrape.impl;

import fun.fengwk.msh.core.service.scrape.ScrapeException;
import fun.fengwk.msh.core.service.scrape.model.ScrapeResult;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Fixed size worker pool running one batch of url scrapes.
 *
 * <p>A new instance is created for every batch. {@link #execute} starts {@code poolSize} worker
 * loops that pull urls from a shared queue, so at most {@code poolSize} scrapes are in flight, and
 * always shuts the pool down and joins every worker before it returns. After each completed scrape
 * a worker pauses for the configured delay when more urls are waiting.
 *
 * @author fengwk
 */
@Slf4j
public class BatchScrapeExecutor {

    static final String INTERRUPTED_MESSAGE = "batch interrupted";

    private final int poolSize;
    private final long delayMillis;
    private final String threadPrefix;

    public BatchScrapeExecutor(int poolSize, double delaySeconds, String threadPrefix) {
        if (poolSize < 1) {
            throw new IllegalArgumentException("poolSize must be positive");
        }
        this.poolSize = poolSize;
        this.delayMillis = delaySeconds > 0 ? Math.round(delaySeconds * 1000) : 0L;
        this.threadPrefix = threadPrefix;
    }

    /**
     * Runs {@code task} for every url and returns exactly one result per url, in completion order.
     */
    public List<ScrapeResult> execute(List<String> urls, Function<String, ScrapeResult> task) {
        Queue<String> pending = new ConcurrentLinkedQueue<>(urls);
        Queue<ScrapeResult> results = new ConcurrentLinkedQueue<>();
        AtomicBoolean stopped = new AtomicBoolean(false);
        boolean interrupted = false;

        int workers = Math.min(poolSize, Math.max(urls.size(), 1));
        ExecutorService pool = Executors.newFixedThreadPool(workers, new WorkerThreadFactory(threadPrefix));
        try {
            List<Future<?>> futures = new ArrayList<>(workers);
            for (int i = 0; i < workers; i++) {
                futures.add(pool.submit(new Worker(pending, results, stopped, task)));
            }
            for (Future<?> future : futures) {
                try {
                    future.get();
                } catch (ExecutionException ex) {
                    log.error("batch worker terminated unexpectedly", ex.getCause());
                }
            }
        } catch (InterruptedException ex) {
            interrupted = true;
            stopped.set(true);
            log.warn("batch interrupted, pendingUrls={}", pending.size());
        } finally {
            if (interrupted) {
                pool.shutdownNow();
            } else {
                pool.shutdown();
            }
            interrupted |= awaitTermination(pool);
        }

        String url;
        while ((url = pending.poll()) != null) {
            ScrapeException failure = ScrapeException.browser(INTERRUPTED_MESSAGE, url, INTERRUPTED_MESSAGE);
            results.add(ScrapeResult.failure(url, failure, null));
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
        return new ArrayList<>(results);
    }

    private boolean awaitTermination(ExecutorService pool) {
        boolean interrupted = false;
        while (true) {
            try {
                if (pool.awaitTermination(1, TimeUnit.SECONDS)) {
                    return interrupted;
                }
            } catch (InterruptedException ex) {
                // Keep joining, in-flight renders still own their browser.
                interrupted = true;
                pool.shutdownNow();
            }
        }
    }

    private class Worker implements Runnable {

        private final Queue<String> pending;
        private final Queue<ScrapeResult> results;
        private final AtomicBoolean stopped;
        private final Function<String, ScrapeResult> task;

        private Worker(
            Queue<String> pending,
            Queue<ScrapeResult> results,
            AtomicBoolean stopped,
            Function<String, ScrapeResult> task
        ) {
            this.pending = pending;
            this.results = results;
            this.stopped = stopped;
            this.task = task;
        }

        @Override
        public void run() {
            String url;
            while (!stopped.get() && (url = pending.poll()) != null) {
                results.add(scrape(url));
                if (delayMillis > 0 && !pending.isEmpty() && !pause()) {
                    return;
                }
            }
        }

        private ScrapeResult scrape(String url) {
            long startNanos = System.nanoTime();
            try {
                ScrapeResult result = task.apply(url);
                if (result == null) {
                    throw new IllegalStateException("scrape task returned no result");
                }
                return result;
            } catch (ScrapeException ex) {
                return ScrapeResult.failure(url, ex.withUrl(url), elapsedSeconds(startNanos));
            } catch (Throwable ex) {
                // Any throwable still yields a result, the url is already taken off the queue.
                log.error("scrape task failed unexpectedly, url={}", url, ex);
                ScrapeException failure = ScrapeException.browser(
                    "Unexpected error scraping " + url + ": " + ex.getMessage(), url, ex.getMessage());
                return ScrapeResult.failure(url, failure, elapsedSeconds(startNanos));
            }
        }

        private boolean pause() {
            try {
                Thread.sleep(delayMillis);
                return true;
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                stopped.set(true);
                return false;
            }
        }

    }

    private static double elapsedSeconds(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000_000D;
    }

    private static class WorkerThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger(1);
        private final String prefix;

        private WorkerThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable);
            thread.setName(prefix + counter.getAndIncrement());
            thread.setDaemon(true);
            return thread;
        }

    }

}
