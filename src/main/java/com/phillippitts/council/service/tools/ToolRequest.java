package com.phillippitts.council.service.tools;

import java.util.Map;
import java.util.Objects;

/**
 * One requested tool call.
 */
public record ToolRequest(String toolId, Map<String, Object> params) {

    public ToolRequest {
        Objects.requireNonNull(toolId, "toolId");
        params = params == null ? Map.of() : Map.copyOf(params);
    }
}
