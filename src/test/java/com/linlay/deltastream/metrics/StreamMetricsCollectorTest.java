package com.linlay.deltastream.metrics;

import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class StreamMetricsCollectorTest {

    private static final long MILLIS = 1_000_000L;

    private final AtomicLong clock = new AtomicLong();

    @Test
    void shouldComputeNearestRankPercentiles() {
        StreamMetricsCollector collector = new StreamMetricsCollector(100, clock::get);
        for (int i = 1; i <= 10; i++) {
            collector.recordProcessingTime(i);
        }

        StreamMetrics metrics = collector.snapshot();

        assertThat(metrics.p50ProcessingTimeMs()).isEqualTo(5.0);
        assertThat(metrics.p95ProcessingTimeMs()).isEqualTo(10.0);
        assertThat(metrics.p99ProcessingTimeMs()).isEqualTo(10.0);
        assertThat(metrics.avgProcessingTimeMs()).isEqualTo(5.5);
        assertThat(metrics.minProcessingTimeMs()).isEqualTo(1.0);
        assertThat(metrics.maxProcessingTimeMs()).isEqualTo(10.0);
    }

    @Test
    void percentileShouldHandleSmallSamples() {
        assertThat(StreamMetricsCollector.percentile(new double[]{7.0}, 50)).isEqualTo(7.0);
        assertThat(StreamMetricsCollector.percentile(new double[]{7.0}, 1)).isEqualTo(7.0);
        assertThat(StreamMetricsCollector.percentile(new double[]{1.0, 2.0}, 50)).isEqualTo(1.0);
        assertThat(StreamMetricsCollector.percentile(new double[0], 95)).isZero();
    }

    @Test
    void jitterShouldBePopulationStandardDeviation() {
        StreamMetricsCollector collector = new StreamMetricsCollector(100, clock::get);
        for (double sample : new double[]{2, 4, 4, 4, 5, 5, 7, 9}) {
            collector.recordProcessingTime(sample);
        }

        assertThat(collector.snapshot().jitterMs()).isCloseTo(2.0, within(1e-9));
    }

    @Test
    void shouldReportZerosWithoutSamples() {
        StreamMetricsCollector collector = new StreamMetricsCollector(100, clock::get);

        assertThat(collector.snapshot()).isEqualTo(StreamMetrics.empty());
    }

    @Test
    void throughputShouldBeZeroWhenNoTimeElapsed() {
        StreamMetricsCollector collector = new StreamMetricsCollector(100, clock::get);
        collector.markStart(0);
        collector.recordChunk(100);
        collector.markEnd(0);

        StreamMetrics metrics = collector.snapshot();

        assertThat(metrics.totalChunks()).isEqualTo(1);
        assertThat(metrics.chunksPerSecond()).isZero();
        assertThat(metrics.bytesPerSecond()).isZero();
    }

    @Test
    void shouldComputeThroughputAgainstElapsedTime() {
        StreamMetricsCollector collector = new StreamMetricsCollector(100, clock::get);
        collector.markStart(0);
        for (int i = 0; i < 4; i++) {
            collector.recordChunk(250);
        }
        clock.set(500 * MILLIS);

        StreamMetrics metrics = collector.snapshot();

        assertThat(metrics.totalTimeMs()).isEqualTo(500.0);
        assertThat(metrics.chunksPerSecond()).isCloseTo(8.0, within(1e-9));
        assertThat(metrics.bytesPerSecond()).isCloseTo(2000.0, within(1e-9));
    }

    @Test
    void percentilesShouldOnlySeeTheRollingWindow() {
        StreamMetricsCollector collector = new StreamMetricsCollector(5, clock::get);
        for (int i = 0; i < 5; i++) {
            collector.recordProcessingTime(1000);
        }
        for (int i = 1; i <= 5; i++) {
            collector.recordProcessingTime(i);
        }

        StreamMetrics metrics = collector.snapshot();

        assertThat(metrics.p99ProcessingTimeMs()).isEqualTo(5.0);
        assertThat(metrics.avgProcessingTimeMs()).isEqualTo(3.0);
        // min and max span the full history
        assertThat(metrics.maxProcessingTimeMs()).isEqualTo(1000.0);
    }

    @Test
    void firstChunkAndStartShouldBeSticky() {
        StreamMetricsCollector collector = new StreamMetricsCollector(10, clock::get);
        collector.markStart(10 * MILLIS);
        collector.markStart(20 * MILLIS);
        collector.markFirstChunk(30 * MILLIS);
        collector.markFirstChunk(90 * MILLIS);

        assertThat(collector.snapshot().timeToFirstChunkMs()).isEqualTo(20.0);
    }

    @Test
    void resetShouldClearCounters() {
        StreamMetricsCollector collector = new StreamMetricsCollector(10, clock::get);
        collector.markStart(0);
        collector.recordChunk(5);
        collector.recordBatchFlush();
        collector.recordBackpressureEvent();
        collector.recordChunkTimeout();
        collector.recordProcessingTime(3);
        collector.recordInterChunkTime(4);

        collector.reset();

        assertThat(collector.isStarted()).isFalse();
        assertThat(collector.snapshot()).isEqualTo(StreamMetrics.empty());
    }

    @Test
    void shouldRejectNonPositiveWindow() {
        assertThatThrownBy(() -> new StreamMetricsCollector(0, clock::get))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
