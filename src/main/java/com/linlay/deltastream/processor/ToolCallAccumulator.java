package com.linlay.deltastream.processor;

import com.linlay.deltastream.model.ToolCallDelta;
import com.linlay.deltastream.model.ToolCallSnapshot;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

final class ToolCallAccumulator {

    private final Map<Integer, Record> records = new TreeMap<>();

    ToolCallSnapshot merge(ToolCallDelta fragment, int fallbackIndex) {
        int index = fragment.index() != null ? fragment.index() : fallbackIndex;
        Record record = records.computeIfAbsent(index, Record::new);
        if (record.id == null && hasText(fragment.id())) {
            record.id = fragment.id();
        }
        if (record.type == null && hasText(fragment.type())) {
            record.type = fragment.type();
        }
        if (fragment.name() != null) {
            record.name.append(fragment.name());
        }
        if (fragment.arguments() != null) {
            record.arguments.append(fragment.arguments());
        }
        return record.name.length() == 0 ? null : record.snapshot();
    }

    boolean isEmpty() {
        return records.isEmpty();
    }

    int size() {
        return records.size();
    }

    List<ToolCallSnapshot> snapshots() {
        List<ToolCallSnapshot> snapshots = new ArrayList<>(records.size());
        for (Record record : records.values()) {
            snapshots.add(record.snapshot());
        }
        return snapshots;
    }

    void clear() {
        records.clear();
    }

    private static boolean hasText(String value) {
        return value != null && !value.isEmpty();
    }

    private static final class Record {

        private final int index;
        private final StringBuilder name = new StringBuilder();
        private final StringBuilder arguments = new StringBuilder();
        private String id;
        private String type;

        private Record(int index) {
            this.index = index;
        }

        private ToolCallSnapshot snapshot() {
            return new ToolCallSnapshot(index, id, type, name.toString(), arguments.toString());
        }
    }
}
