package com.phillippitts.council.domain;

/**
 * States of the deliberation pipeline. Runs move forward only; {@link #FAILED} is reachable
 * from any state.
 */
public enum PipelineState {
    INIT,
    TOOLS,
    STAGE1,
    STAGE2,
    STAGE3,
    STAGE4,
    DONE,
    FAILED
}
