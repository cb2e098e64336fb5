package com.phillippitts.council.service.pipeline;

import com.phillippitts.council.domain.IntentDecision;
import com.phillippitts.council.domain.Query;
import com.phillippitts.council.service.events.LifecycleEmitter;
import com.phillippitts.council.service.workspace.WorkspaceConfig;

/**
 * State shared by the stages of one run.
 */
record RunContext(Query query, IntentDecision decision, WorkspaceConfig workspace, LifecycleEmitter emitter) {

    String queryId() {
        return query.id();
    }
}
