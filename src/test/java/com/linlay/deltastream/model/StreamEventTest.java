package com.linlay.deltastream.model;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StreamEventTest {

    @Test
    void contentShouldMapToFlatData() {
        assertThat(StreamEvent.content("hi").toData())
                .containsExactly(Map.entry("type", "content"), Map.entry("content", "hi"));
    }

    @Test
    void toolCallShouldNestFunctionPayload() {
        ToolCallSnapshot snapshot = new ToolCallSnapshot(0, "call_1", null, "bash", "{\"command\":\"ls\"}");

        Map<String, Object> data = StreamEvent.toolCall(snapshot).toData();

        assertThat(data).containsEntry("type", "tool_call");
        assertThat(data.get("toolCall")).isEqualTo(Map.of(
                "index", 0,
                "id", "call_1",
                "type", "function",
                "function", Map.of("name", "bash", "arguments", "{\"command\":\"ls\"}")
        ));
    }

    @Test
    void snapshotShouldOmitMissingId() {
        assertThat(new ToolCallSnapshot(1, null, "function", "read", null).toData())
                .doesNotContainKey("id")
                .containsEntry("function", Map.of("name", "read", "arguments", ""));
    }

    @Test
    void errorShouldRequireCode() {
        assertThat(StreamEvent.error("chunk_timeout", null).toData())
                .containsEntry("error", Map.of("code", "chunk_timeout", "message", ""));
        assertThatThrownBy(() -> StreamEvent.error(" ", "boom"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void doneShouldCarryFinishReasonWhenKnown() {
        assertThat(StreamEvent.done("stop").toData()).containsEntry("finishReason", "stop");
        assertThat(StreamEvent.done(null).toData()).containsOnlyKeys("type");
        assertThat(StreamEvent.done(null).type()).isEqualTo(StreamEventType.DONE);
    }
}
