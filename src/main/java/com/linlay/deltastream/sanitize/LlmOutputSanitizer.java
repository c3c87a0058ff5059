package com.linlay.deltastream.sanitize;

import java.util.regex.Pattern;

public final class LlmOutputSanitizer implements ContentSanitizer {

    private static final Pattern CONTROL_TOKEN_PATTERN = Pattern.compile("<\\|[A-Za-z0-9_\\-]{1,32}\\|>");

    @Override
    public String sanitize(String content) {
        if (content == null || content.isEmpty()) {
            return "";
        }
        if (content.indexOf("<|") < 0) {
            return content;
        }
        return CONTROL_TOKEN_PATTERN.matcher(content).replaceAll("");
    }
}
