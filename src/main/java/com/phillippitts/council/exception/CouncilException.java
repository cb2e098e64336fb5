package com.phillippitts.council.exception;

/**
 * Base exception for all council errors.
 * All domain exceptions extend this class to enable centralized error handling.
 */
public class CouncilException extends RuntimeException {

    public CouncilException(String message) {
        super(message);
    }

    public CouncilException(String message, Throwable cause) {
        super(message, cause);
    }
}
