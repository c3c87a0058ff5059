package com.linlay.deltastream.model;

import java.util.LinkedHashMap;
import java.util.Map;

public record ToolCallSnapshot(
        int index,
        String id,
        String type,
        String name,
        String arguments
) {

    public ToolCallSnapshot {
        if (type == null || type.isBlank()) {
            type = "function";
        }
        name = name == null ? "" : name;
        arguments = arguments == null ? "" : arguments;
    }

    public Map<String, Object> toData() {
        Map<String, Object> function = new LinkedHashMap<>();
        function.put("name", name);
        function.put("arguments", arguments);

        Map<String, Object> data = new LinkedHashMap<>();
        data.put("index", index);
        if (id != null) {
            data.put("id", id);
        }
        data.put("type", type);
        data.put("function", function);
        return data;
    }
}
