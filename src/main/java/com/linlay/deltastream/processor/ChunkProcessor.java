package com.linlay.deltastream.processor;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.deltastream.metrics.StreamMetrics;
import com.linlay.deltastream.metrics.StreamMetricsCollector;
import com.linlay.deltastream.model.LlmDelta;
import com.linlay.deltastream.model.StreamEvent;
import com.linlay.deltastream.model.ToolCallDelta;
import com.linlay.deltastream.model.ToolCallSnapshot;
import com.linlay.deltastream.sanitize.CommentaryToolCallExtractor;
import com.linlay.deltastream.sanitize.ContentSanitizer;
import com.linlay.deltastream.sanitize.LlmOutputSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Turns the model's delta stream into renderable {@link StreamEvent}s.
 * <p>
 * One instance handles one response at a time and is fed one delta per call by
 * a caller pumping the upstream stream. Calls must be serialized: the processor
 * holds no locks. The chunk timer is the only thing that runs on another thread
 * and it communicates through atomics only.
 * <p>
 * Failures of the injected {@link ContentSanitizer} propagate out of
 * {@link #processDelta(LlmDelta)}, {@link #flushPendingBatch()},
 * {@link #pollPendingEvents()} and {@link #complete()} unchanged.
 */
public class ChunkProcessor {

    private static final Logger log = LoggerFactory.getLogger(ChunkProcessor.class);

    private static final double NANOS_PER_MILLI = 1_000_000.0;
    private static final String COMMENTARY_ID_PREFIX = "commentary_";

    private final ChunkProcessorOptions options;
    private final ContentSanitizer sanitizer;
    private final CommentaryToolCallExtractor commentaryExtractor;
    private final LongSupplier nanoClock;

    private final ContentAccumulator content = new ContentAccumulator();
    private final ToolCallAccumulator toolCalls = new ToolCallAccumulator();
    private final ContentBatcher batcher;
    private final BackpressureQueue queue;
    private final AdaptiveRenderThrottle renderThrottle;
    private final StreamMetricsCollector metrics;
    private final ChunkTimeoutSupervisor timeoutSupervisor;

    private long lastArrivalNanos = -1;
    private String finishReason;
    private boolean completed;

    private List<ToolCallSnapshot> commentaryToolCalls;
    private long commentaryVersion = -1;

    public ChunkProcessor() {
        this(ChunkProcessorOptions.defaults());
    }

    public ChunkProcessor(ChunkProcessorOptions options) {
        this(options, new LlmOutputSanitizer());
    }

    public ChunkProcessor(ChunkProcessorOptions options, ContentSanitizer sanitizer) {
        this(
                options,
                sanitizer,
                new CommentaryToolCallExtractor(new ObjectMapper()),
                Schedulers.parallel(),
                System::nanoTime
        );
    }

    public ChunkProcessor(
            ChunkProcessorOptions options,
            ContentSanitizer sanitizer,
            CommentaryToolCallExtractor commentaryExtractor,
            Scheduler scheduler,
            LongSupplier nanoClock
    ) {
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.sanitizer = Objects.requireNonNull(sanitizer, "sanitizer must not be null");
        this.commentaryExtractor = Objects.requireNonNull(commentaryExtractor, "commentaryExtractor must not be null");
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock must not be null");
        this.batcher = new ContentBatcher(options.batchSizeThreshold(), options.batchTimeThresholdMs());
        this.queue = new BackpressureQueue(options.enableBackpressure(), options.maxPendingEvents());
        this.renderThrottle = new AdaptiveRenderThrottle(
                options.renderThrottleMs(),
                options.minRenderThrottleMs(),
                options.maxRenderThrottleMs(),
                options.adaptiveThrottle(),
                options.renderSampleWindowSize(),
                nanoClock
        );
        this.metrics = new StreamMetricsCollector(options.metricsWindowSize(), nanoClock);
        this.timeoutSupervisor = new ChunkTimeoutSupervisor(scheduler, options.chunkTimeoutMs(), metrics);
    }

    /**
     * Ingests one delta.
     *
     * @return events the caller may render now; empty while backpressure holds
     * them back or while content is being batched
     */
    public List<StreamEvent> processDelta(LlmDelta delta) {
        if (completed) {
            log.warn("processDelta() called after the round was completed; delta ignored");
            return List.of();
        }
        // disarm before anything else, re-arm last
        timeoutSupervisor.disarm();
        try {
            long startedAt = nanoClock.getAsLong();
            collectTimeouts();
            LlmDelta effective = delta == null ? LlmDelta.empty() : delta;
            trackArrival(startedAt, effective.hasContent() || effective.hasToolCalls());

            List<StreamEvent> produced = new ArrayList<>(2);
            int bytes = 0;
            if (effective.hasContent()) {
                bytes = ContentBatcher.utf8Length(effective.content());
                processContent(effective.content(), bytes, startedAt, produced);
            }
            if (effective.hasToolCalls()) {
                processToolCalls(effective.toolCalls(), produced);
            }
            if (effective.finishReason() != null && !effective.finishReason().isBlank()) {
                finishReason = effective.finishReason();
            }

            List<StreamEvent> events = deliver(produced);
            metrics.recordChunk(bytes);
            metrics.recordProcessingTime((nanoClock.getAsLong() - startedAt) / NANOS_PER_MILLI);
            return events;
        } finally {
            timeoutSupervisor.arm();
        }
    }

    /**
     * Flushes the open content batch. Must be called when the upstream ends so
     * that no batched content is lost; {@link #complete()} does it as well.
     */
    public List<StreamEvent> flushPendingBatch() {
        if (!batcher.hasPending()) {
            return List.of();
        }
        List<StreamEvent> produced = new ArrayList<>(1);
        flushBatch(produced);
        return deliver(produced);
    }

    /**
     * Surfaces fired chunk timeouts and flushes a batch whose time threshold
     * has elapsed. Queued events are returned only while not backpressured.
     */
    public List<StreamEvent> pollPendingEvents() {
        collectTimeouts();
        List<StreamEvent> produced = new ArrayList<>(1);
        if (options.enableBatching() && batcher.shouldFlush(nanoClock.getAsLong())) {
            flushBatch(produced);
        }
        return deliver(produced);
    }

    public List<StreamEvent> drainPendingEvents() {
        return drainPendingEvents(Integer.MAX_VALUE);
    }

    public List<StreamEvent> drainPendingEvents(int maxEvents) {
        collectTimeouts();
        boolean wasBackpressured = queue.isBackpressured();
        List<StreamEvent> drained = queue.drain(maxEvents);
        trackBackpressureTransition(wasBackpressured);
        return drained;
    }

    /**
     * Ends the current round: stops chunk supervision, flushes the open batch,
     * reports commentary-style tool calls when no structured call arrived and
     * appends a {@code done} event. Everything still queued is delivered
     * regardless of backpressure. Subsequent calls return an empty list until
     * the next reset.
     */
    public List<StreamEvent> complete() {
        if (completed) {
            return List.of();
        }
        timeoutSupervisor.disarm();
        collectTimeouts();
        completed = true;

        List<StreamEvent> events = new ArrayList<>(queue.drainAll());
        if (batcher.hasPending()) {
            flushBatch(events);
        }
        if (toolCalls.isEmpty()) {
            for (ToolCallSnapshot toolCall : getToolCalls()) {
                events.add(StreamEvent.toolCall(toolCall));
            }
        }
        events.add(StreamEvent.done(finishReason));
        queue.clear();
        metrics.markEnd(nanoClock.getAsLong());
        return events;
    }

    public void markRequestStart() {
        metrics.markStart(nanoClock.getAsLong());
    }

    public boolean isUnderBackpressure() {
        return queue.isBackpressured();
    }

    public int getPendingEventCount() {
        return queue.size();
    }

    public FlowHint getFlowHint() {
        return new FlowHint(
                queue.isBackpressured(),
                queue.size(),
                queue.maxPending(),
                renderThrottle.currentThrottleMs()
        );
    }

    public boolean shouldRender() {
        return renderThrottle.shouldRender();
    }

    public void reportRenderDuration(double durationMs) {
        renderThrottle.reportRenderDuration(durationMs);
    }

    public double getRenderThrottleMs() {
        return renderThrottle.currentThrottleMs();
    }

    public String getAccumulatedContent() {
        return content.sanitized();
    }

    public String getRawContent() {
        return content.raw();
    }

    /**
     * Structured tool calls ordered by index. When none arrived, calls written
     * in commentary style into the raw content are extracted instead; the
     * extraction is cached until the raw content changes.
     */
    public List<ToolCallSnapshot> getToolCalls() {
        if (!toolCalls.isEmpty()) {
            return toolCalls.snapshots();
        }
        if (!options.extractCommentaryTools() || !content.hasRaw()) {
            return List.of();
        }
        if (commentaryToolCalls == null || commentaryVersion != content.rawVersion()) {
            commentaryToolCalls = extractCommentaryToolCalls();
            commentaryVersion = content.rawVersion();
        }
        return commentaryToolCalls;
    }

    public String getFinishReason() {
        return finishReason;
    }

    public boolean isCompleted() {
        return completed;
    }

    public StreamMetrics getMetrics() {
        return metrics.snapshot();
    }

    public ChunkProcessorOptions getOptions() {
        return options;
    }

    public void reset() {
        clearRound();
        metrics.reset();
        renderThrottle.reset();
    }

    /**
     * Starts the next turn of a session: round state is discarded, metrics and
     * the render throttle carry over.
     */
    public void softReset() {
        clearRound();
        metrics.clearEnd();
    }

    /**
     * Stops chunk supervision after the upstream failed. Accumulated content,
     * tool calls and queued events stay readable.
     */
    public void abort() {
        timeoutSupervisor.disarm();
        metrics.markEnd(nanoClock.getAsLong());
    }

    private void clearRound() {
        timeoutSupervisor.reset();
        content.clear();
        toolCalls.clear();
        batcher.reset();
        queue.clear();
        lastArrivalNanos = -1;
        finishReason = null;
        completed = false;
        commentaryToolCalls = null;
        commentaryVersion = -1;
    }

    private void trackArrival(long now, boolean hasData) {
        metrics.markStart(now);
        if (lastArrivalNanos >= 0) {
            metrics.recordInterChunkTime((now - lastArrivalNanos) / NANOS_PER_MILLI);
        }
        lastArrivalNanos = now;
        if (hasData) {
            metrics.markFirstChunk(now);
        }
    }

    private void processContent(String fragment, int bytes, long now, List<StreamEvent> sink) {
        content.appendRaw(fragment);
        boolean batch = options.enableBatching() && batcher.shouldBatch(bytes, now);
        batcher.markArrival(now);
        if (batch) {
            batcher.add(fragment, bytes, now);
            if (batcher.shouldFlush(now)) {
                flushBatch(sink);
            }
            return;
        }
        if (batcher.hasPending()) {
            flushBatch(sink);
        }
        emitContent(fragment, sink);
    }

    private void flushBatch(List<StreamEvent> sink) {
        int fragments = batcher.pendingFragments();
        int bytes = batcher.pendingBytes();
        String joined = batcher.flush();
        metrics.recordBatchFlush();
        log.debug("Flushed content batch: fragments={}, bytes={}", fragments, bytes);
        emitContent(joined, sink);
    }

    private void emitContent(String fragment, List<StreamEvent> sink) {
        String visible = options.sanitize() ? sanitizer.sanitize(fragment) : fragment;
        if (visible == null || visible.isEmpty()) {
            return;
        }
        content.appendSanitized(visible);
        sink.add(StreamEvent.content(visible));
    }

    private void processToolCalls(List<ToolCallDelta> fragments, List<StreamEvent> sink) {
        for (int i = 0; i < fragments.size(); i++) {
            ToolCallDelta fragment = fragments.get(i);
            if (fragment == null) {
                continue;
            }
            ToolCallSnapshot snapshot = toolCalls.merge(fragment, i);
            if (snapshot != null) {
                sink.add(StreamEvent.toolCall(snapshot));
            }
        }
    }

    private List<StreamEvent> deliver(List<StreamEvent> produced) {
        boolean wasBackpressured = queue.isBackpressured();
        List<StreamEvent> events = queue.offer(produced);
        trackBackpressureTransition(wasBackpressured);
        return events;
    }

    private void collectTimeouts() {
        int fired = timeoutSupervisor.takePendingTimeouts();
        if (fired == 0) {
            return;
        }
        boolean wasBackpressured = queue.isBackpressured();
        for (int i = 0; i < fired; i++) {
            queue.enqueue(StreamEvent.error(ChunkTimeoutSupervisor.CHUNK_TIMEOUT, timeoutSupervisor.timeoutMessage()));
        }
        trackBackpressureTransition(wasBackpressured);
    }

    private void trackBackpressureTransition(boolean wasBackpressured) {
        boolean backpressured = queue.isBackpressured();
        if (!wasBackpressured && backpressured) {
            metrics.recordBackpressureEvent();
            log.debug("Backpressure engaged: pending={}, max={}", queue.size(), queue.maxPending());
        } else if (wasBackpressured && !backpressured) {
            log.debug("Backpressure released: pending={}", queue.size());
        }
    }

    private List<ToolCallSnapshot> extractCommentaryToolCalls() {
        CommentaryToolCallExtractor.Extraction extraction = commentaryExtractor.extract(content.raw());
        if (extraction.toolCalls().isEmpty()) {
            return List.of();
        }
        long now = System.currentTimeMillis();
        List<ToolCallSnapshot> extracted = new ArrayList<>(extraction.toolCalls().size());
        for (int i = 0; i < extraction.toolCalls().size(); i++) {
            CommentaryToolCallExtractor.ExtractedToolCall call = extraction.toolCalls().get(i);
            extracted.add(new ToolCallSnapshot(
                    i,
                    COMMENTARY_ID_PREFIX + now + "_" + i,
                    "function",
                    call.name(),
                    call.argumentsJson()
            ));
        }
        log.debug("Extracted {} commentary-style tool call(s)", extracted.size());
        return List.copyOf(extracted);
    }
}
