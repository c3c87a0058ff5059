package com.linlay.deltastream.model;

import java.util.List;

public record LlmDelta(
        String content,
        List<ToolCallDelta> toolCalls,
        String finishReason
) {

    public LlmDelta {
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }

    public LlmDelta(String content) {
        this(content, null, null);
    }

    public LlmDelta(String content, List<ToolCallDelta> toolCalls) {
        this(content, toolCalls, null);
    }

    public static LlmDelta empty() {
        return new LlmDelta(null, null, null);
    }

    public static LlmDelta toolCalls(ToolCallDelta... toolCalls) {
        return new LlmDelta(null, List.of(toolCalls), null);
    }

    public static LlmDelta finish(String finishReason) {
        return new LlmDelta(null, null, finishReason);
    }

    public boolean hasContent() {
        return content != null && !content.isEmpty();
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }
}
