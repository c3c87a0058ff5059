package com.linlay.deltastream.processor;

import java.util.ArrayList;
import java.util.List;

final class ContentBatcher {

    static final int ISOLATION_FACTOR = 2;

    private static final long NANOS_PER_MILLI = 1_000_000L;

    private final int sizeThreshold;
    private final long timeThresholdNanos;
    private final List<String> fragments = new ArrayList<>();

    private int pendingBytes;
    private long openedAtNanos;
    private long lastFragmentNanos;
    private long fragmentsSeen;

    ContentBatcher(int sizeThreshold, long timeThresholdMs) {
        this.sizeThreshold = sizeThreshold;
        this.timeThresholdNanos = timeThresholdMs * NANOS_PER_MILLI;
    }

    boolean shouldBatch(int bytes, long nowNanos) {
        if (bytes >= sizeThreshold) {
            return false;
        }
        if (fragmentsSeen == 0) {
            return false;
        }
        // an isolated fragment renders immediately, even with a batch open
        return nowNanos - lastFragmentNanos < ISOLATION_FACTOR * timeThresholdNanos;
    }

    void markArrival(long nowNanos) {
        lastFragmentNanos = nowNanos;
        fragmentsSeen++;
    }

    void add(String fragment, int bytes, long nowNanos) {
        if (fragments.isEmpty()) {
            openedAtNanos = nowNanos;
        }
        fragments.add(fragment);
        pendingBytes += bytes;
    }

    boolean shouldFlush(long nowNanos) {
        if (fragments.isEmpty()) {
            return false;
        }
        return pendingBytes >= sizeThreshold || nowNanos - openedAtNanos >= timeThresholdNanos;
    }

    boolean hasPending() {
        return !fragments.isEmpty();
    }

    int pendingBytes() {
        return pendingBytes;
    }

    int pendingFragments() {
        return fragments.size();
    }

    String flush() {
        String joined;
        if (fragments.size() == 1) {
            joined = fragments.get(0);
        } else {
            StringBuilder builder = new StringBuilder(pendingBytes);
            for (String fragment : fragments) {
                builder.append(fragment);
            }
            joined = builder.toString();
        }
        fragments.clear();
        pendingBytes = 0;
        openedAtNanos = 0;
        return joined;
    }

    void reset() {
        fragments.clear();
        pendingBytes = 0;
        openedAtNanos = 0;
        lastFragmentNanos = 0;
        fragmentsSeen = 0;
    }

    static int utf8Length(CharSequence text) {
        int bytes = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c < 0x80) {
                bytes++;
            } else if (c < 0x800) {
                bytes += 2;
            } else if (Character.isHighSurrogate(c) && i + 1 < text.length()
                    && Character.isLowSurrogate(text.charAt(i + 1))) {
                bytes += 4;
                i++;
            } else {
                bytes += 3;
            }
        }
        return bytes;
    }
}
