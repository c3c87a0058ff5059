package com.linlay.deltastream.model;

public record ToolCallDelta(
        Integer index,
        String id,
        String type,
        String name,
        String arguments
) {

    public ToolCallDelta {
        if (type == null || type.isBlank()) {
            type = "function";
        }
    }

    public ToolCallDelta(Integer index, String id, String name, String arguments) {
        this(index, id, null, name, arguments);
    }

    public static ToolCallDelta arguments(int index, String arguments) {
        return new ToolCallDelta(index, null, null, null, arguments);
    }
}
