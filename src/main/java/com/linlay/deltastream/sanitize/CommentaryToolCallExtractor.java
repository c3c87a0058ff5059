package com.linlay.deltastream.sanitize;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Recovers tool invocations that a model without native tool-call support
 * wrote into its text output, e.g.
 * {@code commentary to=functions.bash <|constrain|>json<|message|>{"command":"ls"}}.
 */
public class CommentaryToolCallExtractor {

    private static final Logger log = LoggerFactory.getLogger(CommentaryToolCallExtractor.class);

    private static final Pattern INVOCATION_PATTERN = Pattern.compile(
            "commentary\\s+to=(?:functions\\.)?([A-Za-z_][A-Za-z0-9_.\\-]*)"
    );
    private static final int MAX_PREAMBLE_LENGTH = 64;
    private static final TypeReference<LinkedHashMap<String, Object>> ARGUMENTS_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    public CommentaryToolCallExtractor(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
    }

    public Extraction extract(String content) {
        if (content == null || content.isBlank()) {
            return new Extraction(List.of(), content == null ? "" : content);
        }
        List<ExtractedToolCall> toolCalls = new ArrayList<>();
        StringBuilder remaining = new StringBuilder(content.length());
        int copyFrom = 0;

        Matcher matcher = INVOCATION_PATTERN.matcher(content);
        int searchFrom = 0;
        while (searchFrom < content.length() && matcher.find(searchFrom)) {
            int objectStart = findObjectStart(content, matcher.end());
            int objectEnd = objectStart < 0 ? -1 : findObjectEnd(content, objectStart);
            if (objectEnd < 0) {
                searchFrom = matcher.end();
                continue;
            }
            String json = content.substring(objectStart, objectEnd);
            ExtractedToolCall toolCall = parse(matcher.group(1), json);
            if (toolCall != null) {
                toolCalls.add(toolCall);
                remaining.append(content, copyFrom, matcher.start());
                copyFrom = objectEnd;
            }
            searchFrom = objectEnd;
        }
        remaining.append(content, copyFrom, content.length());
        return new Extraction(List.copyOf(toolCalls), remaining.toString().trim());
    }

    private ExtractedToolCall parse(String name, String json) {
        try {
            JsonNode node = objectMapper.readTree(json);
            if (node == null || !node.isObject()) {
                return null;
            }
            Map<String, Object> arguments = objectMapper.convertValue(node, ARGUMENTS_TYPE);
            return new ExtractedToolCall(name, arguments, node.toString());
        } catch (JsonProcessingException ex) {
            log.debug("Skip commentary tool call '{}' with unparsable arguments: {}", name, json, ex);
            return null;
        }
    }

    private int findObjectStart(String content, int from) {
        int limit = Math.min(content.length(), from + MAX_PREAMBLE_LENGTH);
        for (int i = from; i < limit; i++) {
            if (content.charAt(i) == '{') {
                return i;
            }
        }
        return -1;
    }

    // index just past the matching closing brace, or -1 when unbalanced
    private int findObjectEnd(String content, int start) {
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < content.length(); i++) {
            char c = content.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) {
                    return i + 1;
                }
            }
        }
        return -1;
    }

    public record ExtractedToolCall(String name, Map<String, Object> arguments, String argumentsJson) {
        public ExtractedToolCall {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("name must not be null or blank");
            }
            arguments = arguments == null ? Map.of() : arguments;
            argumentsJson = argumentsJson == null ? "{}" : argumentsJson;
        }
    }

    public record Extraction(List<ExtractedToolCall> toolCalls, String remainingContent) {
        public Extraction {
            toolCalls = toolCalls == null ? List.of() : toolCalls;
            remainingContent = remainingContent == null ? "" : remainingContent;
        }
    }
}
