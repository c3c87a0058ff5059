package com.linlay.deltastream.sanitize;

/**
 * Filters one content fragment before it is emitted to the renderer.
 * <p>
 * Implementations may throw; the chunk processor does not catch sanitizer
 * failures and lets them propagate to its caller unchanged.
 */
@FunctionalInterface
public interface ContentSanitizer {

    String sanitize(String content);

    static ContentSanitizer identity() {
        return content -> content;
    }
}
