package com.phillippitts.council.domain;

import java.util.Objects;

/**
 * Aggregated standing of one anonymized label across all parseable peer rankings.
 *
 * @param label        anonymized label, e.g. "Response A"
 * @param meanRank     mean 1-based position across rankings that include the label
 * @param voteCount    number of parseable rankings that include the label
 * @param missingVotes number of parseable rankings that omit the label
 */
public record AggregateRanking(String label, double meanRank, int voteCount, int missingVotes) {

    public AggregateRanking {
        Objects.requireNonNull(label, "label");
        if (voteCount < 1) {
            throw new IllegalArgumentException("Aggregate requires at least one vote for " + label);
        }
        if (missingVotes < 0) {
            throw new IllegalArgumentException("missingVotes must not be negative");
        }
    }
}
