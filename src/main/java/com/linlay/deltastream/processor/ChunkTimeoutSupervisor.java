package com.linlay.deltastream.processor;

import com.linlay.deltastream.metrics.StreamMetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.scheduler.Scheduler;

import java.util.Objects;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Single per-chunk timer. Every arm or disarm starts a new generation and a
 * firing only counts while its generation is still current, so a timer that
 * fires concurrently with a disarm is dropped.
 * <p>
 * A firing never touches processor state directly: it increments the timeout
 * counter and leaves a pending timeout that the processor collects on its next
 * call.
 */
final class ChunkTimeoutSupervisor {

    static final String CHUNK_TIMEOUT = "chunk_timeout";

    private static final Logger log = LoggerFactory.getLogger(ChunkTimeoutSupervisor.class);

    private final Scheduler scheduler;
    private final long timeoutMs;
    private final StreamMetricsCollector metrics;
    private final AtomicLong generation = new AtomicLong();
    private final AtomicInteger pendingTimeouts = new AtomicInteger();

    // written by the processor thread only; a firing leaves it to disarm()
    private volatile Disposable task;
    private volatile long armedGeneration = -1;

    ChunkTimeoutSupervisor(Scheduler scheduler, long timeoutMs, StreamMetricsCollector metrics) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.timeoutMs = timeoutMs;
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    boolean isEnabled() {
        return timeoutMs > 0;
    }

    boolean isArmed() {
        return task != null && generation.get() == armedGeneration;
    }

    void arm() {
        if (!isEnabled()) {
            return;
        }
        disarm();
        long armed = generation.incrementAndGet();
        armedGeneration = armed;
        task = scheduler.schedule(() -> fire(armed), timeoutMs, TimeUnit.MILLISECONDS);
    }

    void disarm() {
        generation.incrementAndGet();
        Disposable current = task;
        task = null;
        if (current != null) {
            current.dispose();
        }
    }

    int takePendingTimeouts() {
        return pendingTimeouts.getAndSet(0);
    }

    String timeoutMessage() {
        return "No chunk received within " + timeoutMs + "ms";
    }

    void reset() {
        disarm();
        pendingTimeouts.set(0);
    }

    private void fire(long armed) {
        if (!generation.compareAndSet(armed, armed + 1)) {
            return;
        }
        metrics.recordChunkTimeout();
        pendingTimeouts.incrementAndGet();
        log.warn("Chunk timeout: no delta received within {}ms", timeoutMs);
    }
}
