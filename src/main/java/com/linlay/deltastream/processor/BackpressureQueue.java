package com.linlay.deltastream.processor;

import com.linlay.deltastream.model.StreamEvent;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

final class BackpressureQueue {

    private final boolean enabled;
    private final int maxPending;
    private final Deque<StreamEvent> pending = new ArrayDeque<>();

    private boolean backpressured;

    BackpressureQueue(boolean enabled, int maxPending) {
        this.enabled = enabled;
        this.maxPending = maxPending;
    }

    List<StreamEvent> offer(List<StreamEvent> produced) {
        if (enabled && (backpressured || pending.size() + produced.size() > maxPending)) {
            backpressured = true;
            pending.addAll(produced);
            releaseIfDrained();
            return List.of();
        }
        if (pending.isEmpty()) {
            return produced;
        }
        List<StreamEvent> events = new ArrayList<>(pending.size() + produced.size());
        events.addAll(pending);
        events.addAll(produced);
        pending.clear();
        return events;
    }

    void enqueue(StreamEvent event) {
        pending.addLast(event);
        if (enabled && pending.size() > maxPending) {
            backpressured = true;
        }
    }

    List<StreamEvent> drain(int maxEvents) {
        int count = Math.min(Math.max(0, maxEvents), pending.size());
        List<StreamEvent> events = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            events.add(pending.pollFirst());
        }
        releaseIfDrained();
        return events;
    }

    List<StreamEvent> drainAll() {
        return drain(pending.size());
    }

    boolean isBackpressured() {
        return backpressured;
    }

    int size() {
        return pending.size();
    }

    int maxPending() {
        return maxPending;
    }

    void clear() {
        pending.clear();
        backpressured = false;
    }

    private void releaseIfDrained() {
        if (backpressured && pending.size() < maxPending / 2.0) {
            backpressured = false;
        }
    }
}
