package com.linlay.deltastream.processor;

import java.util.ArrayList;
import java.util.List;

final class ContentAccumulator {

    private final Buffer raw = new Buffer();
    private final Buffer sanitized = new Buffer();

    void appendRaw(String fragment) {
        raw.append(fragment);
    }

    void appendSanitized(String fragment) {
        sanitized.append(fragment);
    }

    String raw() {
        return raw.joined();
    }

    String sanitized() {
        return sanitized.joined();
    }

    boolean hasRaw() {
        return raw.length > 0;
    }

    long rawVersion() {
        return raw.version;
    }

    void clear() {
        raw.clear();
        sanitized.clear();
    }

    private static final class Buffer {

        private final List<String> fragments = new ArrayList<>();
        private String cached = "";
        private boolean dirty;
        private int length;
        private long version;

        void append(String fragment) {
            if (fragment == null || fragment.isEmpty()) {
                return;
            }
            fragments.add(fragment);
            length += fragment.length();
            version++;
            dirty = true;
        }

        String joined() {
            if (dirty) {
                StringBuilder builder = new StringBuilder(length);
                for (String fragment : fragments) {
                    builder.append(fragment);
                }
                cached = builder.toString();
                fragments.clear();
                if (!cached.isEmpty()) {
                    fragments.add(cached);
                }
                dirty = false;
            }
            return cached;
        }

        void clear() {
            fragments.clear();
            cached = "";
            dirty = false;
            length = 0;
            version++;
        }
    }
}
