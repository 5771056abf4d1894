package com.dataplatform.acquisition.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Refresh-ahead worker pool. At most one task is pending per key; the mark is cleared when
 * the task finishes, whatever its outcome. A full queue drops the task.
 *
 * <p>Workers block on the refresh {@link Mono}, so the pool size is also the bound on
 * concurrent refresh fetches.
 */
public class BackgroundRefresher {

    private static final Logger log = LoggerFactory.getLogger(BackgroundRefresher.class);

    private final ThreadPoolExecutor pool;
    private final Set<String> pending = ConcurrentHashMap.newKeySet();
    private final Duration taskTimeout;
    private final Duration shutdownGrace;

    public BackgroundRefresher(int workers, int queueCapacity, Duration taskTimeout, Duration shutdownGrace) {
        this.taskTimeout = taskTimeout;
        this.shutdownGrace = shutdownGrace;
        this.pool = new ThreadPoolExecutor(workers, workers, 60, TimeUnit.SECONDS,
                                           new ArrayBlockingQueue<>(queueCapacity), daemonThreads(),
                                           new ThreadPoolExecutor.AbortPolicy());
        this.pool.allowCoreThreadTimeOut(true);
    }

    /**
     * @return {@code true} if a task was enqueued; {@code false} if one is already pending for
     *         the key, the queue is full or the pool is shutting down
     */
    public boolean schedule(String key, Supplier<? extends Mono<?>> refreshFn) {
        if (!pending.add(key)) {
            log.debug("REFRESH_ALREADY_PENDING key={}", key);
            return false;
        }
        try {
            pool.execute(() -> run(key, refreshFn));
            log.info("REFRESH_SCHEDULED key={} queued={}", key, pool.getQueue().size());
            return true;
        } catch (RejectedExecutionException e) {
            pending.remove(key);
            log.warn("REFRESH_DROPPED key={} reason={}", key,
                     pool.isShutdown() ? "shutting down" : "queue full");
            return false;
        }
    }

    private void run(String key, Supplier<? extends Mono<?>> refreshFn) {
        try {
            refreshFn.get().block(taskTimeout);
            log.info("REFRESH_COMPLETED key={}", key);
        } catch (RuntimeException e) {
            log.warn("REFRESH_FAILED key={} error={}", key, e.getMessage());
        } finally {
            pending.remove(key);
        }
    }

    public boolean isPending(String key) {
        return pending.contains(key);
    }

    public int pendingCount() {
        return pending.size();
    }

    /** Stops accepting work, waits up to the grace period, then interrupts what is left. */
    public void shutdown() {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(shutdownGrace.toMillis(), TimeUnit.MILLISECONDS)) {
                List<Runnable> dropped = pool.shutdownNow();
                log.warn("REFRESH_POOL_FORCED_SHUTDOWN droppedTasks={}", dropped.size());
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
        pending.clear();
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "cache-refresh-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
