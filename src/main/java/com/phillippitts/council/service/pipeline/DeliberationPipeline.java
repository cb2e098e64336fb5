package com.phillippitts.council.service.pipeline;

import com.phillippitts.council.domain.DeliberationResult;
import com.phillippitts.council.domain.Query;
import com.phillippitts.council.service.events.LifecycleListener;

/**
 * Runs one query through classification, tools and the deliberation stages.
 *
 * <p>Blocking: returns when the run is finished. Lifecycle checkpoints are pushed to the
 * listener as they happen.
 */
public interface DeliberationPipeline {

    /**
     * @throws com.phillippitts.council.exception.PipelineFailureException if no backend answered in Stage1
     * @throws com.phillippitts.council.exception.AdmissionDeniedException  if the budget is exhausted
     * @throws com.phillippitts.council.exception.ConfigurationException   on invalid configuration
     */
    DeliberationResult deliberate(Query query, LifecycleListener listener);

    default DeliberationResult deliberate(Query query) {
        return deliberate(query, LifecycleListener.NOOP);
    }
}
