package com.phillippitts.council.service.events;

/**
 * Pipeline checkpoints, in emission order. Skipped stages omit their events.
 */
public enum LifecycleEventType {
    INTENT_DECIDED,
    TOOLS_COMPLETED,
    STAGE1_RESPONSE,
    STAGE1_COMPLETE,
    STAGE2_RANKING,
    STAGE2_COMPLETE,
    STAGE3_COMPLETE,
    STAGE4_COMPLETE,
    COST_SUMMARY,
    COMPLETED,
    FAILED;

    public boolean terminal() {
        return this == COMPLETED || this == FAILED;
    }
}
