package com.linlay.deltastream.metrics;

import java.util.LinkedHashMap;
import java.util.Map;

public record StreamMetrics(
        long totalChunks,
        long totalBytes,
        double avgProcessingTimeMs,
        double minProcessingTimeMs,
        double maxProcessingTimeMs,
        double timeToFirstChunkMs,
        double totalTimeMs,
        double chunksPerSecond,
        double bytesPerSecond,
        long batchFlushes,
        long backpressureEvents,
        long chunkTimeouts,
        double p50ProcessingTimeMs,
        double p95ProcessingTimeMs,
        double p99ProcessingTimeMs,
        double jitterMs,
        double avgInterChunkTimeMs
) {

    public static StreamMetrics empty() {
        return new StreamMetrics(0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0);
    }

    public Map<String, Object> toData() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("totalChunks", totalChunks);
        data.put("totalBytes", totalBytes);
        data.put("avgProcessingTimeMs", avgProcessingTimeMs);
        data.put("minProcessingTimeMs", minProcessingTimeMs);
        data.put("maxProcessingTimeMs", maxProcessingTimeMs);
        data.put("timeToFirstChunkMs", timeToFirstChunkMs);
        data.put("totalTimeMs", totalTimeMs);
        data.put("chunksPerSecond", chunksPerSecond);
        data.put("bytesPerSecond", bytesPerSecond);
        data.put("batchFlushes", batchFlushes);
        data.put("backpressureEvents", backpressureEvents);
        data.put("chunkTimeouts", chunkTimeouts);
        data.put("p50ProcessingTimeMs", p50ProcessingTimeMs);
        data.put("p95ProcessingTimeMs", p95ProcessingTimeMs);
        data.put("p99ProcessingTimeMs", p99ProcessingTimeMs);
        data.put("jitterMs", jitterMs);
        data.put("avgInterChunkTimeMs", avgInterChunkTimeMs);
        return data;
    }
}
