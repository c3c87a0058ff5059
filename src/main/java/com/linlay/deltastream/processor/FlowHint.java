package com.linlay.deltastream.processor;

public record FlowHint(
        boolean backpressured,
        int pendingEvents,
        int maxPendingEvents,
        double recommendedRenderIntervalMs
) {

    public boolean shouldPauseUpstream() {
        return backpressured;
    }
}
