package com.phillippitts.council.service.workspace;

import java.util.Objects;

/**
 * One retrieved passage.
 */
public record RagPassage(String text, double score, String source) {

    public RagPassage {
        Objects.requireNonNull(text, "text");
        source = source == null ? "unknown" : source;
    }
}
