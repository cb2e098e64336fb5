package com.phillippitts.council.exception;

/**
 * Thrown by output parsers when a model reply lacks the expected structure.
 * Callers discard the output; this never escapes a pipeline stage.
 */
public class ParseFailureException extends CouncilException {

    private final String what;

    public ParseFailureException(String what, String message) {
        super(what + ": " + message);
        this.what = what;
    }

    public ParseFailureException(String what, String message, Throwable cause) {
        super(what + ": " + message, cause);
        this.what = what;
    }

    /** Kind of output that failed to parse, e.g. "classification" or "verdict". */
    public String getWhat() {
        return what;
    }
}
