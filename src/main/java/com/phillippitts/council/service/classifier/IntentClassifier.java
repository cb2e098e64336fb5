package com.phillippitts.council.service.classifier;

import com.phillippitts.council.domain.IntentDecision;
import com.phillippitts.council.domain.Query;

/**
 * Decides complexity, workflow, backends and tools for a query.
 *
 * <p>Never fails: when every tier fails, implementations return a default decision.
 */
public interface IntentClassifier {

    IntentDecision classify(Query query);
}
