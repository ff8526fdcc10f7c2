package com.presence.core.memory;

import com.presence.core.events.EventBus;
import com.presence.core.events.PresenceEvent;
import com.presence.core.metrics.PresenceMetrics;
import com.presence.core.pattern.TrackingProperties;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fire-and-forget writes to the {@link MemoryStore}.
 * <p>
 * Each write runs on a dedicated daemon pool and is bounded by {@code presence.tracking.store-timeout-ms};
 * a write that times out is cancelled so a hung store call gives its thread back. Pending writes are
 * capped, and a write arriving at a full queue is dropped as a failure.
 * Failures, timeouts and drops are logged, counted and published as events; they never reach the caller.
 * The returned future always completes normally ({@code true} on success) and may be ignored or cancelled.
 */
@Service
public class MemoryStoreWriter {

    private static final Logger log = LoggerFactory.getLogger(MemoryStoreWriter.class);

    static final int POOL_SIZE = 2;
    static final int QUEUE_CAPACITY = 256;

    private final MemoryStore store;
    private final PresenceMetrics metrics;
    private final EventBus eventBus;
    private final long timeoutMs;
    private final AtomicLong failures = new AtomicLong();
    private final ExecutorService executor;

    @Autowired
    public MemoryStoreWriter(MemoryStore store, PresenceMetrics metrics, EventBus eventBus,
                             TrackingProperties properties) {
        this(store, metrics, eventBus, properties.getStoreTimeoutMs(), QUEUE_CAPACITY);
    }

    MemoryStoreWriter(MemoryStore store, PresenceMetrics metrics, EventBus eventBus, long timeoutMs,
                      int queueCapacity) {
        this.store = store;
        this.metrics = metrics;
        this.eventBus = eventBus;
        this.timeoutMs = timeoutMs;
        var threadCount = new AtomicInteger();
        this.executor = new ThreadPoolExecutor(POOL_SIZE, POOL_SIZE, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(queueCapacity), r -> {
                    Thread t = new Thread(r, "memory-store-" + threadCount.incrementAndGet());
                    t.setDaemon(true);
                    return t;
                });
    }

    public CompletableFuture<Boolean> write(String userId, String kind, Map<String, Object> payload) {
        var written = new CompletableFuture<Void>();
        Future<?> task;
        try {
            task = executor.submit(() -> {
                try {
                    store.store(userId, kind, payload);
                    written.complete(null);
                } catch (RuntimeException e) {
                    written.completeExceptionally(e);
                }
            });
        } catch (RejectedExecutionException e) {
            recordFailure(userId, kind, new RejectedExecutionException("write queue full, dropped"));
            return CompletableFuture.completedFuture(false);
        }
        return written
                .orTimeout(timeoutMs, TimeUnit.MILLISECONDS)
                .handle((ignored, error) -> {
                    if (error == null) {
                        return true;
                    }
                    task.cancel(true);
                    recordFailure(userId, kind, error);
                    return false;
                });
    }

    /** Failed or timed-out writes since startup. */
    public long failureCount() {
        return failures.get();
    }

    private void recordFailure(String userId, String kind, Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null
                ? error.getCause()
                : error;
        failures.incrementAndGet();
        metrics.incrementStoreFailures(kind);
        String reason = cause instanceof TimeoutException
                ? "timed out after " + timeoutMs + "ms"
                : cause.getMessage();
        log.warn("Memory store write '{}' for user {} failed: {}", kind, userId, reason);
        eventBus.publish(PresenceEvent.of(PresenceEvent.STORE_WRITE_FAILED, userId, null,
                Map.of("kind", kind, "reason", reason != null ? reason : cause.getClass().getSimpleName())));
    }

    @PreDestroy
    void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Memory store writer stopped");
    }
}
