package com.phillippitts.council.service.tools;

import com.phillippitts.council.domain.ToolFailureKind;
import com.phillippitts.council.exception.CouncilException;

/**
 * Thrown by a {@link ToolCollaborator} when it cannot produce a result.
 */
public class ToolFailureException extends CouncilException {

    private final String toolId;
    private final ToolFailureKind kind;

    public ToolFailureException(String toolId, ToolFailureKind kind, String message) {
        super(message + " (tool: " + toolId + ")");
        this.toolId = toolId;
        this.kind = kind;
    }

    public ToolFailureException(String toolId, ToolFailureKind kind, String message, Throwable cause) {
        super(message + " (tool: " + toolId + ")", cause);
        this.toolId = toolId;
        this.kind = kind;
    }

    public String getToolId() {
        return toolId;
    }

    public ToolFailureKind getKind() {
        return kind;
    }
}
