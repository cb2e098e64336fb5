package com.phillippitts.council.domain;

import java.util.List;
import java.util.Objects;

/**
 * One rater's ordering of the anonymized Stage1 responses.
 *
 * @param raterBackendId backend that produced the ranking
 * @param labels         anonymized labels best-first; empty when the reply was unparseable
 * @param rawText        full reply, kept as ranking rationale
 */
public record PeerRanking(String raterBackendId, List<String> labels, String rawText) {

    public PeerRanking {
        Objects.requireNonNull(raterBackendId, "raterBackendId");
        labels = labels == null ? List.of() : List.copyOf(labels);
        rawText = rawText == null ? "" : rawText;
    }

    public boolean parseable() {
        return !labels.isEmpty();
    }
}
