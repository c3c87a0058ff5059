package com.linlay.deltastream.config;

import com.linlay.deltastream.processor.ChunkProcessorOptions;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "delta-stream.processor")
public record DeltaStreamProperties(
        Boolean sanitize,
        Boolean extractCommentaryTools,
        Batching batching,
        Backpressure backpressure,
        Render render,
        Duration chunkTimeout,
        Integer metricsWindowSize,
        Duration pollInterval
) {

    public DeltaStreamProperties {
        if (sanitize == null) {
            sanitize = Boolean.TRUE;
        }
        if (extractCommentaryTools == null) {
            extractCommentaryTools = Boolean.TRUE;
        }
        if (batching == null) {
            batching = new Batching(null, null, null);
        }
        if (backpressure == null) {
            backpressure = new Backpressure(null, null);
        }
        if (render == null) {
            render = new Render(null, null, null, null, null);
        }
        if (chunkTimeout == null) {
            chunkTimeout = Duration.ofMillis(ChunkProcessorOptions.DEFAULT_CHUNK_TIMEOUT_MS);
        }
        if (metricsWindowSize == null) {
            metricsWindowSize = ChunkProcessorOptions.DEFAULT_METRICS_WINDOW_SIZE;
        }
        if (pollInterval == null) {
            pollInterval = Duration.ofMillis(100);
        }
    }

    public ChunkProcessorOptions toOptions() {
        return ChunkProcessorOptions.builder()
                .sanitize(sanitize)
                .extractCommentaryTools(extractCommentaryTools)
                .enableBatching(batching.enabled())
                .batchSizeThreshold(batching.sizeThreshold())
                .batchTimeThresholdMs(batching.timeThreshold().toMillis())
                .enableBackpressure(backpressure.enabled())
                .maxPendingEvents(backpressure.maxPendingEvents())
                .renderThrottleMs(render.throttle().toMillis())
                .adaptiveThrottle(render.adaptive())
                .minRenderThrottleMs(render.minThrottle().toMillis())
                .maxRenderThrottleMs(render.maxThrottle().toMillis())
                .renderSampleWindowSize(render.sampleWindowSize())
                .chunkTimeoutMs(chunkTimeout.toMillis())
                .metricsWindowSize(metricsWindowSize)
                .build();
    }

    public record Batching(Boolean enabled, Integer sizeThreshold, Duration timeThreshold) {
        public Batching {
            if (enabled == null) {
                enabled = Boolean.TRUE;
            }
            if (sizeThreshold == null) {
                sizeThreshold = ChunkProcessorOptions.DEFAULT_BATCH_SIZE_THRESHOLD;
            }
            if (timeThreshold == null) {
                timeThreshold = Duration.ofMillis(ChunkProcessorOptions.DEFAULT_BATCH_TIME_THRESHOLD_MS);
            }
        }
    }

    public record Backpressure(Boolean enabled, Integer maxPendingEvents) {
        public Backpressure {
            if (enabled == null) {
                enabled = Boolean.TRUE;
            }
            if (maxPendingEvents == null) {
                maxPendingEvents = ChunkProcessorOptions.DEFAULT_MAX_PENDING_EVENTS;
            }
        }
    }

    public record Render(
            Duration throttle,
            Boolean adaptive,
            Duration minThrottle,
            Duration maxThrottle,
            Integer sampleWindowSize
    ) {
        public Render {
            if (throttle == null) {
                throttle = Duration.ofMillis(ChunkProcessorOptions.DEFAULT_RENDER_THROTTLE_MS);
            }
            if (adaptive == null) {
                adaptive = Boolean.TRUE;
            }
            if (minThrottle == null) {
                minThrottle = Duration.ofMillis(ChunkProcessorOptions.DEFAULT_MIN_RENDER_THROTTLE_MS);
            }
            if (maxThrottle == null) {
                maxThrottle = Duration.ofMillis(ChunkProcessorOptions.DEFAULT_MAX_RENDER_THROTTLE_MS);
            }
            if (sampleWindowSize == null) {
                sampleWindowSize = ChunkProcessorOptions.DEFAULT_RENDER_SAMPLE_WINDOW_SIZE;
            }
        }
    }
}
