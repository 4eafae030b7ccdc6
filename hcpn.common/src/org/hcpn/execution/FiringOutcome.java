package org.hcpn.execution;

public enum FiringOutcome {
    /** The transition fired; for a substitution transition the child returned its tokens. */
    FIRED,
    /** No binding enables the transition (or, for a step, no transition could fire). */
    NOT_ENABLED,
    /**
     * SubstitutionStall: the child module went quiescent before its exit
     * ports were filled. The firing was rolled back and counts as not fired.
     */
    STALLED
}
