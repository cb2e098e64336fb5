package com.phillippitts.council.service.classifier;

import com.phillippitts.council.domain.Complexity;

import java.util.List;

/**
 * Parsed reply of the classifier backend.
 */
public record ModelClassification(Complexity complexity, String reasoning, List<String> tools, double confidence) {

    public ModelClassification {
        tools = tools == null ? List.of() : List.copyOf(tools);
        reasoning = reasoning == null ? "" : reasoning;
    }
}
