package com.linlay.deltastream.model;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Renderable output of the chunk processor. Events are transient values: the
 * processor keeps no reference to an event once it was returned or drained.
 */
public sealed interface StreamEvent permits
        StreamEvent.Content,
        StreamEvent.ToolCall,
        StreamEvent.StreamError,
        StreamEvent.Done {

    StreamEventType type();

    Map<String, Object> toData();

    static Content content(String content) {
        return new Content(content);
    }

    static ToolCall toolCall(ToolCallSnapshot toolCall) {
        return new ToolCall(toolCall);
    }

    static StreamError error(String code, String message) {
        return new StreamError(code, message);
    }

    static Done done(String finishReason) {
        return new Done(finishReason);
    }

    record Content(String content) implements StreamEvent {
        public Content {
            Objects.requireNonNull(content, "content must not be null");
        }

        @Override
        public StreamEventType type() {
            return StreamEventType.CONTENT;
        }

        @Override
        public Map<String, Object> toData() {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("type", type().wireName());
            data.put("content", content);
            return data;
        }
    }

    record ToolCall(ToolCallSnapshot toolCall) implements StreamEvent {
        public ToolCall {
            Objects.requireNonNull(toolCall, "toolCall must not be null");
        }

        @Override
        public StreamEventType type() {
            return StreamEventType.TOOL_CALL;
        }

        @Override
        public Map<String, Object> toData() {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("type", type().wireName());
            data.put("toolCall", toolCall.toData());
            return data;
        }
    }

    record StreamError(String code, String message) implements StreamEvent {
        public StreamError {
            if (code == null || code.isBlank()) {
                throw new IllegalArgumentException("code must not be null or blank");
            }
            message = message == null ? "" : message;
        }

        @Override
        public StreamEventType type() {
            return StreamEventType.ERROR;
        }

        @Override
        public Map<String, Object> toData() {
            Map<String, Object> error = new LinkedHashMap<>();
            error.put("code", code);
            error.put("message", message);

            Map<String, Object> data = new LinkedHashMap<>();
            data.put("type", type().wireName());
            data.put("error", error);
            return data;
        }
    }

    record Done(String finishReason) implements StreamEvent {
        @Override
        public StreamEventType type() {
            return StreamEventType.DONE;
        }

        @Override
        public Map<String, Object> toData() {
            Map<String, Object> data = new LinkedHashMap<>();
            data.put("type", type().wireName());
            if (finishReason != null) {
                data.put("finishReason", finishReason);
            }
            return data;
        }
    }
}
