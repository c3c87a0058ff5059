package com.linlay.deltastream.processor;

import com.linlay.deltastream.model.LlmDelta;
import com.linlay.deltastream.model.StreamEvent;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ContentBatchingTest {

    private VirtualTimeScheduler scheduler;
    private ChunkProcessor processor;

    @BeforeEach
    void setUp() {
        scheduler = VirtualTimeScheduler.create();
        processor = TestProcessors.create(
                ChunkProcessorOptions.builder()
                        .batchSizeThreshold(10)
                        .batchTimeThresholdMs(16)
                        .chunkTimeoutMs(0)
                        .build(),
                scheduler
        );
    }

    @AfterEach
    void tearDown() {
        scheduler.dispose();
    }

    @Test
    void shouldFlushExactlyWhenPendingSizeReachesThreshold() {
        assertThat(processor.processDelta(new LlmDelta("abc"))).containsExactly(StreamEvent.content("abc"));

        assertThat(processor.processDelta(new LlmDelta("def"))).isEmpty();
        assertThat(processor.processDelta(new LlmDelta("ghi"))).isEmpty();
        assertThat(processor.processDelta(new LlmDelta("jkl"))).isEmpty();
        assertThat(processor.getMetrics().batchFlushes()).isZero();

        List<StreamEvent> flushed = processor.processDelta(new LlmDelta("mno"));

        assertThat(flushed).containsExactly(StreamEvent.content("defghijklmno"));
        assertThat(processor.getMetrics().batchFlushes()).isEqualTo(1);
        assertThat(processor.getAccumulatedContent()).isEqualTo("abcdefghijklmno");
    }

    @Test
    void shouldNeverBatchTheOpeningFragment() {
        assertThat(processor.processDelta(new LlmDelta("a"))).containsExactly(StreamEvent.content("a"));
    }

    @Test
    void shouldEmitLargeFragmentImmediatelyAfterFlushingOpenBatch() {
        processor.processDelta(new LlmDelta("a"));
        processor.processDelta(new LlmDelta("b"));

        List<StreamEvent> events = processor.processDelta(new LlmDelta("0123456789"));

        assertThat(events).containsExactly(StreamEvent.content("b"), StreamEvent.content("0123456789"));
    }

    @Test
    void shouldEmitIsolatedFragmentImmediately() {
        processor.processDelta(new LlmDelta("a"));
        processor.processDelta(new LlmDelta("b"));

        scheduler.advanceTimeBy(Duration.ofMillis(40));
        List<StreamEvent> events = processor.processDelta(new LlmDelta("c"));

        assertThat(events).containsExactly(StreamEvent.content("b"), StreamEvent.content("c"));
    }

    @Test
    void shouldFlushWhenBatchAgeReachesTimeThreshold() {
        processor.processDelta(new LlmDelta("a"));
        processor.processDelta(new LlmDelta("b"));

        scheduler.advanceTimeBy(Duration.ofMillis(20));
        List<StreamEvent> events = processor.processDelta(new LlmDelta("c"));

        assertThat(events).containsExactly(StreamEvent.content("bc"));
    }

    @Test
    void pollShouldFlushOverdueBatch() {
        processor.processDelta(new LlmDelta("a"));
        processor.processDelta(new LlmDelta("b"));
        assertThat(processor.pollPendingEvents()).isEmpty();

        scheduler.advanceTimeBy(Duration.ofMillis(16));

        assertThat(processor.pollPendingEvents()).containsExactly(StreamEvent.content("b"));
    }

    @Test
    void explicitFlushShouldReleaseBatchedContentAtStreamEnd() {
        processor.processDelta(new LlmDelta("a"));
        processor.processDelta(new LlmDelta("b"));
        assertThat(processor.getAccumulatedContent()).isEqualTo("a");

        assertThat(processor.flushPendingBatch()).containsExactly(StreamEvent.content("b"));
        assertThat(processor.flushPendingBatch()).isEmpty();
        assertThat(processor.getAccumulatedContent()).isEqualTo("ab");
    }

    @Test
    void shouldMeasureBatchSizeInUtf8Bytes() {
        processor.processDelta(new LlmDelta("a"));
        assertThat(processor.processDelta(new LlmDelta("切换"))).isEmpty();

        assertThat(processor.processDelta(new LlmDelta("主题"))).containsExactly(StreamEvent.content("切换主题"));
        assertThat(processor.getMetrics().totalBytes()).isEqualTo(13);
    }

    @Test
    void shouldNotBatchWhenDisabled() {
        ChunkProcessor unbatched = TestProcessors.create(
                ChunkProcessorOptions.builder().enableBatching(false).chunkTimeoutMs(0).build(),
                scheduler
        );

        for (String fragment : List.of("a", "b", "c")) {
            assertThat(unbatched.processDelta(new LlmDelta(fragment))).containsExactly(StreamEvent.content(fragment));
        }
        assertThat(unbatched.getMetrics().batchFlushes()).isZero();
    }
}
