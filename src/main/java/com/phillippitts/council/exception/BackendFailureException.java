package com.phillippitts.council.exception;

import com.phillippitts.council.domain.FailureKind;

/**
 * Thrown when a single backend call fails (timeout, provider error, malformed payload).
 */
public class BackendFailureException extends CouncilException {

    private final String backendId;
    private final FailureKind kind;

    public BackendFailureException(String message, String backendId, FailureKind kind) {
        super(message + " (backend: " + backendId + ")");
        this.backendId = backendId;
        this.kind = kind == null ? FailureKind.UNKNOWN : kind;
    }

    public BackendFailureException(String message, String backendId, FailureKind kind, Throwable cause) {
        super(message + " (backend: " + backendId + ")", cause);
        this.backendId = backendId;
        this.kind = kind == null ? FailureKind.UNKNOWN : kind;
    }

    public String getBackendId() {
        return backendId;
    }

    public FailureKind getKind() {
        return kind;
    }
}
