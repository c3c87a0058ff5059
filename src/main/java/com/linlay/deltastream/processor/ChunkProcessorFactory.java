package com.linlay.deltastream.processor;

import com.linlay.deltastream.sanitize.CommentaryToolCallExtractor;
import com.linlay.deltastream.sanitize.ContentSanitizer;
import reactor.core.scheduler.Scheduler;

import java.util.Objects;
import java.util.function.LongSupplier;

public class ChunkProcessorFactory {

    private final ChunkProcessorOptions options;
    private final ContentSanitizer sanitizer;
    private final CommentaryToolCallExtractor commentaryExtractor;
    private final Scheduler scheduler;
    private final LongSupplier nanoClock;

    public ChunkProcessorFactory(
            ChunkProcessorOptions options,
            ContentSanitizer sanitizer,
            CommentaryToolCallExtractor commentaryExtractor,
            Scheduler scheduler
    ) {
        this(options, sanitizer, commentaryExtractor, scheduler, System::nanoTime);
    }

    public ChunkProcessorFactory(
            ChunkProcessorOptions options,
            ContentSanitizer sanitizer,
            CommentaryToolCallExtractor commentaryExtractor,
            Scheduler scheduler,
            LongSupplier nanoClock
    ) {
        this.options = Objects.requireNonNull(options, "options must not be null");
        this.sanitizer = Objects.requireNonNull(sanitizer, "sanitizer must not be null");
        this.commentaryExtractor = Objects.requireNonNull(commentaryExtractor, "commentaryExtractor must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock must not be null");
    }

    public ChunkProcessor create() {
        return create(options);
    }

    public ChunkProcessor create(ChunkProcessorOptions overrides) {
        return new ChunkProcessor(overrides, sanitizer, commentaryExtractor, scheduler, nanoClock);
    }

    public ChunkProcessorOptions options() {
        return options;
    }
}
