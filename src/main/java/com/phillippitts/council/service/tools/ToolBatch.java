package com.phillippitts.council.service.tools;

import com.phillippitts.council.domain.ToolInvocation;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * All tool invocations of one query, in catalog-priority order.
 */
public record ToolBatch(List<ToolInvocation> invocations) {

    private static final ToolBatch EMPTY = new ToolBatch(List.of());

    public ToolBatch {
        invocations = List.copyOf(invocations);
    }

    public static ToolBatch empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return invocations.isEmpty();
    }

    /**
     * Invocations keyed by tool id, iteration in catalog-priority order.
     */
    public Map<String, ToolInvocation> asMap() {
        Map<String, ToolInvocation> map = new LinkedHashMap<>();
        invocations.forEach(i -> map.put(i.toolId(), i));
        return map;
    }

    public List<ToolInvocation> successes() {
        return invocations.stream().filter(ToolInvocation::success).toList();
    }

    public List<ToolInvocation> failures() {
        return invocations.stream().filter(i -> !i.success()).toList();
    }
}
