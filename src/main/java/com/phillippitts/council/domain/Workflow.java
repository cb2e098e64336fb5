package com.phillippitts.council.domain;

/**
 * Deliberation workflow selected for a query. Determines which pipeline stages run.
 */
public enum Workflow {
    /** Stage1 only. */
    QUICK(false, false),
    /** Stage1 then synthesis, no peer review. */
    DUAL_CHECK(false, true),
    DELIBERATION(true, true),
    EXPERT_PANEL(true, true);

    private final boolean peerReview;
    private final boolean synthesis;

    Workflow(boolean peerReview, boolean synthesis) {
        this.peerReview = peerReview;
        this.synthesis = synthesis;
    }

    public boolean peerReview() {
        return peerReview;
    }

    public boolean synthesis() {
        return synthesis;
    }

    /**
     * Maps a complexity and the number of routed backends to a workflow.
     *
     * <p>Moderate queries routed to exactly two backends use {@link #DUAL_CHECK}; any other
     * moderate fan-out width is deliberated.
     */
    public static Workflow forDecision(Complexity complexity, int backendCount) {
        return switch (complexity) {
            case SIMPLE -> QUICK;
            case MODERATE -> backendCount == 2 ? DUAL_CHECK : DELIBERATION;
            case COMPLEX -> DELIBERATION;
            case EXPERT -> EXPERT_PANEL;
        };
    }
}
