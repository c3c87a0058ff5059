package com.linlay.deltastream.processor;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChunkProcessorOptionsTest {

    @Test
    void defaultsShouldMatchDocumentedValues() {
        ChunkProcessorOptions options = ChunkProcessorOptions.defaults();

        assertThat(options.sanitize()).isTrue();
        assertThat(options.extractCommentaryTools()).isTrue();
        assertThat(options.enableBatching()).isTrue();
        assertThat(options.batchSizeThreshold()).isEqualTo(64);
        assertThat(options.batchTimeThresholdMs()).isEqualTo(16);
        assertThat(options.enableBackpressure()).isTrue();
        assertThat(options.maxPendingEvents()).isEqualTo(100);
        assertThat(options.renderThrottleMs()).isEqualTo(16);
        assertThat(options.adaptiveThrottle()).isTrue();
        assertThat(options.minRenderThrottleMs()).isEqualTo(8);
        assertThat(options.maxRenderThrottleMs()).isEqualTo(50);
        assertThat(options.chunkTimeoutMs()).isEqualTo(5000);
    }

    @Test
    void toBuilderShouldKeepUnchangedValues() {
        ChunkProcessorOptions options = ChunkProcessorOptions.builder().maxPendingEvents(7).build();

        ChunkProcessorOptions copy = options.toBuilder().chunkTimeoutMs(0).build();

        assertThat(copy.maxPendingEvents()).isEqualTo(7);
        assertThat(copy.chunkTimeoutMs()).isZero();
    }

    @Test
    void shouldRejectInvalidValues() {
        assertThatThrownBy(() -> ChunkProcessorOptions.builder().batchSizeThreshold(-1).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ChunkProcessorOptions.builder().maxPendingEvents(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ChunkProcessorOptions.builder().minRenderThrottleMs(60).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("minRenderThrottleMs");
        assertThatThrownBy(() -> ChunkProcessorOptions.builder().chunkTimeoutMs(-5).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ChunkProcessorOptions.builder().metricsWindowSize(0).build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
