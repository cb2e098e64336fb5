package com.phillippitts.council.exception;

import java.util.List;

/**
 * Thrown when Stage1 yields no successful response. Reports which backends were attempted.
 */
public class PipelineFailureException extends CouncilException {

    private final String queryId;
    private final List<String> attemptedBackends;

    public PipelineFailureException(String queryId, List<String> attemptedBackends) {
        super("All " + attemptedBackends.size() + " backends failed in Stage1: " + attemptedBackends);
        this.queryId = queryId;
        this.attemptedBackends = List.copyOf(attemptedBackends);
    }

    public String getQueryId() {
        return queryId;
    }

    public List<String> getAttemptedBackends() {
        return attemptedBackends;
    }

    public int getAttemptedCount() {
        return attemptedBackends.size();
    }
}
