package com.linlay.deltastream.stream;

import com.linlay.deltastream.model.LlmDelta;
import com.linlay.deltastream.model.StreamEvent;
import com.linlay.deltastream.processor.ChunkProcessor;
import com.linlay.deltastream.processor.ChunkProcessorFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.SignalType;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Pumps a reactive delta stream through a {@link ChunkProcessor}.
 * <p>
 * Deltas, poll ticks and the end-of-stream marker are merged into one serial
 * signal sequence, so the processor is never called concurrently. Queued
 * events are drained after every signal: reactive demand, not the processor's
 * advisory backpressure, governs delivery here. Poll ticks surface chunk
 * timeouts and overdue batches while the upstream is idle.
 */
public class DeltaStreamPump {

    private static final Logger log = LoggerFactory.getLogger(DeltaStreamPump.class);

    private final ChunkProcessorFactory processorFactory;
    private final Duration pollInterval;
    private final Scheduler scheduler;

    public DeltaStreamPump(ChunkProcessorFactory processorFactory, Duration pollInterval, Scheduler scheduler) {
        this.processorFactory = Objects.requireNonNull(processorFactory, "processorFactory must not be null");
        this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval must not be null");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler must not be null");
        if (pollInterval.isZero() || pollInterval.isNegative()) {
            throw new IllegalArgumentException("pollInterval must be positive");
        }
    }

    public Flux<StreamEvent> stream(Flux<LlmDelta> deltas) {
        return Flux.defer(() -> stream(deltas, processorFactory.create()));
    }

    /**
     * Streams through a caller-owned processor, e.g. one reused across the
     * turns of a session. Cancelling the returned flux soft-resets it.
     */
    public Flux<StreamEvent> stream(Flux<LlmDelta> deltas, ChunkProcessor processor) {
        Objects.requireNonNull(deltas, "deltas must not be null");
        Objects.requireNonNull(processor, "processor must not be null");

        Flux<PumpSignal> input = deltas
                .map(PumpSignal::delta)
                .onErrorResume(ex -> Mono.just(PumpSignal.failure(ex)))
                .concatWith(Mono.just(PumpSignal.END));
        Flux<PumpSignal> ticks = Flux.interval(pollInterval, pollInterval, scheduler)
                .onBackpressureDrop()
                .map(tick -> PumpSignal.TICK);

        return Flux.merge(input, ticks)
                .takeUntil(PumpSignal::terminal)
                .concatMap(signal -> handle(processor, signal))
                .doFinally(signalType -> {
                    if (signalType == SignalType.CANCEL) {
                        log.debug("Delta stream cancelled; discarding in-flight processor state");
                        processor.softReset();
                    } else if (signalType == SignalType.ON_ERROR) {
                        processor.abort();
                    }
                });
    }

    private Flux<StreamEvent> handle(ChunkProcessor processor, PumpSignal signal) {
        switch (signal.kind()) {
            case DELTA:
                return Flux.fromIterable(withDrained(processor, processor.processDelta(signal.delta())));
            case TICK:
                return Flux.fromIterable(withDrained(processor, processor.pollPendingEvents()));
            case END:
                return Flux.fromIterable(processor.complete());
            default:
                log.warn("Upstream delta stream failed; flushing buffered content before propagating", signal.error());
                processor.abort();
                List<StreamEvent> flushed = withDrained(processor, processor.flushPendingBatch());
                return Flux.fromIterable(flushed).concatWith(Flux.error(signal.error()));
        }
    }

    private List<StreamEvent> withDrained(ChunkProcessor processor, List<StreamEvent> events) {
        if (processor.getPendingEventCount() == 0) {
            return events;
        }
        List<StreamEvent> all = new ArrayList<>(events);
        all.addAll(processor.drainPendingEvents());
        return all;
    }

    private record PumpSignal(Kind kind, LlmDelta delta, Throwable error) {

        static final PumpSignal TICK = new PumpSignal(Kind.TICK, null, null);
        static final PumpSignal END = new PumpSignal(Kind.END, null, null);

        static PumpSignal delta(LlmDelta delta) {
            return new PumpSignal(Kind.DELTA, delta, null);
        }

        static PumpSignal failure(Throwable error) {
            return new PumpSignal(Kind.FAILURE, null, error);
        }

        boolean terminal() {
            return kind == Kind.END || kind == Kind.FAILURE;
        }
    }

    private enum Kind {
        DELTA,
        TICK,
        END,
        FAILURE
    }
}
