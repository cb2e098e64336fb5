package com.phillippitts.council.domain;

/**
 * Typed failure of a single tool invocation.
 */
public enum ToolFailureKind {
    TIMEOUT,
    ERROR,
    /** No collaborator is registered for the tool id, or its backing service is down. */
    UNAVAILABLE,
    INVALID_PARAMS,
    /** The tool executor was saturated and refused the task. */
    REJECTED
}
