package com.phillippitts.council.domain;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * A user question submitted to the council.
 *
 * @param id          unique query id, also the ledger's per-query budget key
 * @param text        the question text (must not be blank)
 * @param workspace   workspace namespace for cost, documents and style
 * @param submittedAt submission time
 * @param history     prior conversation turns, oldest first (may be empty)
 */
public record Query(
        String id,
        String text,
        String workspace,
        Instant submittedAt,
        List<String> history
) {

    public static final String DEFAULT_WORKSPACE = "General";

    public Query {
        Objects.requireNonNull(id, "id must not be null");
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Query text must not be blank");
        }
        workspace = (workspace == null || workspace.isBlank()) ? DEFAULT_WORKSPACE : workspace;
        Objects.requireNonNull(submittedAt, "submittedAt must not be null");
        history = history == null ? List.of() : List.copyOf(history);
    }

    public static Query of(String text, String workspace) {
        return new Query(UUID.randomUUID().toString(), text, workspace, Instant.now(), List.of());
    }

    public static Query of(String text, String workspace, List<String> history) {
        return new Query(UUID.randomUUID().toString(), text, workspace, Instant.now(), history);
    }
}
