package com.linlay.deltastream.metrics;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.LongSupplier;

/**
 * Rolling latency samples and cumulative counters for one processor.
 * <p>
 * Percentiles and jitter are computed on demand from the bounded windows only,
 * never from the full history. Everything except {@link #recordChunkTimeout()}
 * is expected to be called from the processor's owning thread; the timeout
 * counter is atomic because the timer fires on a scheduler thread.
 */
public class StreamMetricsCollector {

    private static final double NANOS_PER_MILLI = 1_000_000.0;

    private final LongSupplier nanoClock;
    private final RollingWindow processingTimes;
    private final RollingWindow interChunkTimes;
    private final AtomicLong chunkTimeouts = new AtomicLong();

    private long totalChunks;
    private long totalBytes;
    private long batchFlushes;
    private long backpressureEvents;
    private double minProcessingTimeMs = Double.NaN;
    private double maxProcessingTimeMs = Double.NaN;

    private long startNanos = -1;
    private long firstChunkNanos = -1;
    private long endNanos = -1;

    public StreamMetricsCollector(int windowSize, LongSupplier nanoClock) {
        if (windowSize <= 0) {
            throw new IllegalArgumentException("windowSize must be positive");
        }
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock must not be null");
        this.processingTimes = new RollingWindow(windowSize);
        this.interChunkTimes = new RollingWindow(windowSize);
    }

    public void markStart(long nanos) {
        if (startNanos < 0) {
            startNanos = nanos;
        }
    }

    public boolean isStarted() {
        return startNanos >= 0;
    }

    public void markFirstChunk(long nanos) {
        if (firstChunkNanos < 0) {
            firstChunkNanos = nanos;
        }
    }

    public void markEnd(long nanos) {
        endNanos = nanos;
    }

    // elapsed time runs against the clock again until the next markEnd
    public void clearEnd() {
        endNanos = -1;
    }

    public void recordChunk(long bytes) {
        totalChunks++;
        totalBytes += bytes;
    }

    public void recordProcessingTime(double millis) {
        processingTimes.add(millis);
        if (Double.isNaN(minProcessingTimeMs) || millis < minProcessingTimeMs) {
            minProcessingTimeMs = millis;
        }
        if (Double.isNaN(maxProcessingTimeMs) || millis > maxProcessingTimeMs) {
            maxProcessingTimeMs = millis;
        }
    }

    public void recordInterChunkTime(double millis) {
        interChunkTimes.add(millis);
    }

    public void recordBatchFlush() {
        batchFlushes++;
    }

    public void recordBackpressureEvent() {
        backpressureEvents++;
    }

    public void recordChunkTimeout() {
        chunkTimeouts.incrementAndGet();
    }

    public long chunkTimeouts() {
        return chunkTimeouts.get();
    }

    public void reset() {
        processingTimes.clear();
        interChunkTimes.clear();
        chunkTimeouts.set(0);
        totalChunks = 0;
        totalBytes = 0;
        batchFlushes = 0;
        backpressureEvents = 0;
        minProcessingTimeMs = Double.NaN;
        maxProcessingTimeMs = Double.NaN;
        startNanos = -1;
        firstChunkNanos = -1;
        endNanos = -1;
    }

    public StreamMetrics snapshot() {
        double totalTimeMs = 0;
        if (startNanos >= 0) {
            long end = endNanos >= startNanos ? endNanos : nanoClock.getAsLong();
            totalTimeMs = Math.max(0, (end - startNanos) / NANOS_PER_MILLI);
        }
        double timeToFirstChunkMs = startNanos >= 0 && firstChunkNanos >= 0
                ? Math.max(0, (firstChunkNanos - startNanos) / NANOS_PER_MILLI)
                : 0;
        double seconds = totalTimeMs / 1000.0;

        double[] sorted = processingTimes.sortedCopy();
        return new StreamMetrics(
                totalChunks,
                totalBytes,
                processingTimes.average(),
                Double.isNaN(minProcessingTimeMs) ? 0 : minProcessingTimeMs,
                Double.isNaN(maxProcessingTimeMs) ? 0 : maxProcessingTimeMs,
                timeToFirstChunkMs,
                totalTimeMs,
                seconds > 0 ? totalChunks / seconds : 0,
                seconds > 0 ? totalBytes / seconds : 0,
                batchFlushes,
                backpressureEvents,
                chunkTimeouts.get(),
                percentile(sorted, 50),
                percentile(sorted, 95),
                percentile(sorted, 99),
                standardDeviation(sorted),
                interChunkTimes.average()
        );
    }

    // nearest rank over an ascending array
    static double percentile(double[] sorted, double p) {
        if (sorted.length == 0) {
            return 0;
        }
        int rank = (int) Math.ceil(p * sorted.length / 100.0) - 1;
        int index = Math.min(sorted.length - 1, Math.max(0, rank));
        return sorted[index];
    }

    // population standard deviation
    static double standardDeviation(double[] values) {
        if (values.length == 0) {
            return 0;
        }
        double mean = 0;
        for (double value : values) {
            mean += value;
        }
        mean /= values.length;
        double squared = 0;
        for (double value : values) {
            double diff = value - mean;
            squared += diff * diff;
        }
        return Math.sqrt(squared / values.length);
    }
}
