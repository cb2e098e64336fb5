package com.phillippitts.council.service.tools;

import java.util.Objects;

/**
 * Successful tool output.
 *
 * @param content text merged into the augmentation block
 * @param cost    cost reported by the tool; zero for non-priced tools
 */
public record ToolResult(String content, double cost) {

    public ToolResult {
        Objects.requireNonNull(content, "content");
        if (cost < 0.0) {
            throw new IllegalArgumentException("cost must not be negative");
        }
    }

    public static ToolResult of(String content) {
        return new ToolResult(content, 0.0);
    }
}
