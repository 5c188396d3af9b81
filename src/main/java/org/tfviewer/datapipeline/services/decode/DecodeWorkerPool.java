package org.tfviewer.datapipeline.services.decode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Bounded pool of daemon threads that runs {@link ImageDataFuture}s for one ingestion engine.
 * <p>
 * The pool keeps track of every submitted future until it reports done, so {@link #stop()} can
 * cancel whatever is still queued and wait for the tasks already running.
 */
public class DecodeWorkerPool {

    private static final Logger log = LoggerFactory.getLogger(DecodeWorkerPool.class);

    private final ThreadPoolExecutor executor;
    private final Set<ImageDataFuture> pending = ConcurrentHashMap.newKeySet();
    private final Duration stopTimeout;
    private volatile boolean stopped = false;

    /**
     * @param name        Prefix for the worker thread names.
     * @param threads     Maximum number of concurrent decodes.
     * @param stopTimeout How long {@link #stop()} waits for running tasks.
     */
    public DecodeWorkerPool(String name, int threads, Duration stopTimeout) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be >= 1, got " + threads);
        }
        this.stopTimeout = stopTimeout;
        this.executor = new ThreadPoolExecutor(threads, threads, 0L, TimeUnit.MILLISECONDS,
            new LinkedBlockingQueue<>(), new WorkerThreadFactory(name));
    }

    /**
     * Queues a future for execution. Once the pool is stopped, the future is cancelled instead.
     */
    void submit(ImageDataFuture future) {
        if (stopped) {
            log.debug("Decode pool is stopped, cancelling {}", future);
            future.cancel();
            return;
        }
        pending.add(future);
        try {
            executor.execute(future);
        } catch (RejectedExecutionException e) {
            pending.remove(future);
            future.cancel();
        }
    }

    /**
     * Removes a future from the queue if it has not started yet.
     *
     * @return true if the future was still queued.
     */
    boolean cancel(ImageDataFuture future) {
        return executor.remove(future);
    }

    /**
     * Called by a future once it delivered its terminal notification.
     */
    void taskFinished(ImageDataFuture future) {
        pending.remove(future);
    }

    public int pendingCount() {
        return pending.size();
    }

    public boolean isStopped() {
        return stopped;
    }

    /**
     * Cancels all queued futures and waits for running ones to finish. Idempotent.
     */
    public void stop() {
        stopped = true;
        List<ImageDataFuture> snapshot = new ArrayList<>(pending);
        for (ImageDataFuture future : snapshot) {
            future.cancel();
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(stopTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.warn("Decode workers did not finish within {} ms", stopTimeout.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while waiting for decode workers to finish");
        }
        if (!pending.isEmpty()) {
            log.warn("{} decode task(s) still pending after stop", pending.size());
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        WorkerThreadFactory(String prefix) {
            this.prefix = prefix;
        }

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, prefix + "-decode-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
