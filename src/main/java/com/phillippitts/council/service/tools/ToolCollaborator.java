package com.phillippitts.council.service.tools;

import java.time.Duration;
import java.util.Map;

/**
 * An external tool the coordinator can run before Stage1 (search, calculator, sandboxed code,
 * sports data, workspace RAG).
 *
 * <p>Implementations are Spring beans; the coordinator discovers them by {@link #toolId()}.
 * They must be thread-safe and should honour the timeout themselves; the coordinator abandons
 * calls that overrun it.
 */
public interface ToolCollaborator {

    /** Catalog id, e.g. "web_search". */
    String toolId();

    /**
     * @param params  parameters prepared by {@link ToolParameterResolver}
     * @param timeout time budget for this call
     * @return the tool's textual result
     * @throws ToolFailureException on any failure
     */
    ToolResult invoke(Map<String, Object> params, Duration timeout);
}
