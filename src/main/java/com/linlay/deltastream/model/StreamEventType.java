package com.linlay.deltastream.model;

public enum StreamEventType {

    CONTENT("content"),
    TOOL_CALL("tool_call"),
    ERROR("error"),
    DONE("done");

    private final String wireName;

    StreamEventType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
