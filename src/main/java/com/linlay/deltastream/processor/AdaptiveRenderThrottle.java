package com.linlay.deltastream.processor;

import com.linlay.deltastream.metrics.RollingWindow;

import java.util.Objects;
import java.util.function.LongSupplier;

public final class AdaptiveRenderThrottle {

    static final int MIN_SAMPLES = 3;
    static final double SLOW_RATIO = 0.8;
    static final double FAST_RATIO = 0.3;
    static final double STEP = 0.2;

    private static final double NANOS_PER_MILLI = 1_000_000.0;

    private final double initialThrottleMs;
    private final double minThrottleMs;
    private final double maxThrottleMs;
    private final boolean adaptive;
    private final RollingWindow renderDurations;
    private final LongSupplier nanoClock;

    private double throttleMs;
    private long lastRenderNanos;
    private boolean rendered;

    public AdaptiveRenderThrottle(
            long throttleMs,
            long minThrottleMs,
            long maxThrottleMs,
            boolean adaptive,
            int sampleWindowSize,
            LongSupplier nanoClock
    ) {
        if (minThrottleMs > maxThrottleMs) {
            throw new IllegalArgumentException("minThrottleMs must not exceed maxThrottleMs");
        }
        this.minThrottleMs = minThrottleMs;
        this.maxThrottleMs = maxThrottleMs;
        this.initialThrottleMs = clamp(throttleMs);
        this.adaptive = adaptive;
        this.renderDurations = new RollingWindow(sampleWindowSize);
        this.nanoClock = Objects.requireNonNull(nanoClock, "nanoClock must not be null");
        this.throttleMs = initialThrottleMs;
    }

    public boolean shouldRender() {
        long now = nanoClock.getAsLong();
        if (!rendered || (now - lastRenderNanos) / NANOS_PER_MILLI >= throttleMs) {
            rendered = true;
            lastRenderNanos = now;
            return true;
        }
        return false;
    }

    public void reportRenderDuration(double durationMs) {
        if (Double.isNaN(durationMs) || durationMs < 0) {
            throw new IllegalArgumentException("durationMs must be a non-negative number");
        }
        renderDurations.add(durationMs);
        if (!adaptive || renderDurations.size() < MIN_SAMPLES) {
            return;
        }
        double average = renderDurations.average();
        if (average > throttleMs * SLOW_RATIO) {
            throttleMs = Math.min(maxThrottleMs, throttleMs * (1 + STEP));
        } else if (average < throttleMs * FAST_RATIO) {
            throttleMs = Math.max(minThrottleMs, throttleMs * (1 - STEP));
        }
    }

    public double currentThrottleMs() {
        return throttleMs;
    }

    public int sampleCount() {
        return renderDurations.size();
    }

    public void reset() {
        renderDurations.clear();
        throttleMs = initialThrottleMs;
        rendered = false;
        lastRenderNanos = 0;
    }

    private double clamp(double value) {
        return Math.max(minThrottleMs, Math.min(maxThrottleMs, value));
    }
}
