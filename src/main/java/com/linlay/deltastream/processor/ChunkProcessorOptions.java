package com.linlay.deltastream.processor;

public record ChunkProcessorOptions(
        boolean sanitize,
        boolean extractCommentaryTools,
        boolean enableBatching,
        int batchSizeThreshold,
        long batchTimeThresholdMs,
        boolean enableBackpressure,
        int maxPendingEvents,
        long renderThrottleMs,
        boolean adaptiveThrottle,
        long minRenderThrottleMs,
        long maxRenderThrottleMs,
        long chunkTimeoutMs,
        int metricsWindowSize,
        int renderSampleWindowSize
) {

    public static final int DEFAULT_BATCH_SIZE_THRESHOLD = 64;
    public static final long DEFAULT_BATCH_TIME_THRESHOLD_MS = 16;
    public static final int DEFAULT_MAX_PENDING_EVENTS = 100;
    public static final long DEFAULT_RENDER_THROTTLE_MS = 16;
    public static final long DEFAULT_MIN_RENDER_THROTTLE_MS = 8;
    public static final long DEFAULT_MAX_RENDER_THROTTLE_MS = 50;
    public static final long DEFAULT_CHUNK_TIMEOUT_MS = 5000;
    public static final int DEFAULT_METRICS_WINDOW_SIZE = 100;
    public static final int DEFAULT_RENDER_SAMPLE_WINDOW_SIZE = 20;

    public ChunkProcessorOptions {
        requireNonNegative(batchSizeThreshold, "batchSizeThreshold");
        requireNonNegative(batchTimeThresholdMs, "batchTimeThresholdMs");
        requireNonNegative(renderThrottleMs, "renderThrottleMs");
        requireNonNegative(minRenderThrottleMs, "minRenderThrottleMs");
        requireNonNegative(maxRenderThrottleMs, "maxRenderThrottleMs");
        requireNonNegative(chunkTimeoutMs, "chunkTimeoutMs");
        if (maxPendingEvents <= 0) {
            throw new IllegalArgumentException("maxPendingEvents must be positive");
        }
        if (minRenderThrottleMs > maxRenderThrottleMs) {
            throw new IllegalArgumentException("minRenderThrottleMs must not exceed maxRenderThrottleMs");
        }
        if (metricsWindowSize <= 0) {
            throw new IllegalArgumentException("metricsWindowSize must be positive");
        }
        if (renderSampleWindowSize <= 0) {
            throw new IllegalArgumentException("renderSampleWindowSize must be positive");
        }
    }

    public static ChunkProcessorOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .sanitize(sanitize)
                .extractCommentaryTools(extractCommentaryTools)
                .enableBatching(enableBatching)
                .batchSizeThreshold(batchSizeThreshold)
                .batchTimeThresholdMs(batchTimeThresholdMs)
                .enableBackpressure(enableBackpressure)
                .maxPendingEvents(maxPendingEvents)
                .renderThrottleMs(renderThrottleMs)
                .adaptiveThrottle(adaptiveThrottle)
                .minRenderThrottleMs(minRenderThrottleMs)
                .maxRenderThrottleMs(maxRenderThrottleMs)
                .chunkTimeoutMs(chunkTimeoutMs)
                .metricsWindowSize(metricsWindowSize)
                .renderSampleWindowSize(renderSampleWindowSize);
    }

    private static void requireNonNegative(long value, String name) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " must not be negative");
        }
    }

    public static final class Builder {

        private boolean sanitize = true;
        private boolean extractCommentaryTools = true;
        private boolean enableBatching = true;
        private int batchSizeThreshold = DEFAULT_BATCH_SIZE_THRESHOLD;
        private long batchTimeThresholdMs = DEFAULT_BATCH_TIME_THRESHOLD_MS;
        private boolean enableBackpressure = true;
        private int maxPendingEvents = DEFAULT_MAX_PENDING_EVENTS;
        private long renderThrottleMs = DEFAULT_RENDER_THROTTLE_MS;
        private boolean adaptiveThrottle = true;
        private long minRenderThrottleMs = DEFAULT_MIN_RENDER_THROTTLE_MS;
        private long maxRenderThrottleMs = DEFAULT_MAX_RENDER_THROTTLE_MS;
        private long chunkTimeoutMs = DEFAULT_CHUNK_TIMEOUT_MS;
        private int metricsWindowSize = DEFAULT_METRICS_WINDOW_SIZE;
        private int renderSampleWindowSize = DEFAULT_RENDER_SAMPLE_WINDOW_SIZE;

        private Builder() {
        }

        public Builder sanitize(boolean sanitize) {
            this.sanitize = sanitize;
            return this;
        }

        public Builder extractCommentaryTools(boolean extractCommentaryTools) {
            this.extractCommentaryTools = extractCommentaryTools;
            return this;
        }

        public Builder enableBatching(boolean enableBatching) {
            this.enableBatching = enableBatching;
            return this;
        }

        public Builder batchSizeThreshold(int batchSizeThreshold) {
            this.batchSizeThreshold = batchSizeThreshold;
            return this;
        }

        public Builder batchTimeThresholdMs(long batchTimeThresholdMs) {
            this.batchTimeThresholdMs = batchTimeThresholdMs;
            return this;
        }

        public Builder enableBackpressure(boolean enableBackpressure) {
            this.enableBackpressure = enableBackpressure;
            return this;
        }

        public Builder maxPendingEvents(int maxPendingEvents) {
            this.maxPendingEvents = maxPendingEvents;
            return this;
        }

        public Builder renderThrottleMs(long renderThrottleMs) {
            this.renderThrottleMs = renderThrottleMs;
            return this;
        }

        public Builder adaptiveThrottle(boolean adaptiveThrottle) {
            this.adaptiveThrottle = adaptiveThrottle;
            return this;
        }

        public Builder minRenderThrottleMs(long minRenderThrottleMs) {
            this.minRenderThrottleMs = minRenderThrottleMs;
            return this;
        }

        public Builder maxRenderThrottleMs(long maxRenderThrottleMs) {
            this.maxRenderThrottleMs = maxRenderThrottleMs;
            return this;
        }

        public Builder chunkTimeoutMs(long chunkTimeoutMs) {
            this.chunkTimeoutMs = chunkTimeoutMs;
            return this;
        }

        public Builder metricsWindowSize(int metricsWindowSize) {
            this.metricsWindowSize = metricsWindowSize;
            return this;
        }

        public Builder renderSampleWindowSize(int renderSampleWindowSize) {
            this.renderSampleWindowSize = renderSampleWindowSize;
            return this;
        }

        public ChunkProcessorOptions build() {
            return new ChunkProcessorOptions(
                    sanitize,
                    extractCommentaryTools,
                    enableBatching,
                    batchSizeThreshold,
                    batchTimeThresholdMs,
                    enableBackpressure,
                    maxPendingEvents,
                    renderThrottleMs,
                    adaptiveThrottle,
                    minRenderThrottleMs,
                    maxRenderThrottleMs,
                    chunkTimeoutMs,
                    metricsWindowSize,
                    renderSampleWindowSize
            );
        }
    }
}
