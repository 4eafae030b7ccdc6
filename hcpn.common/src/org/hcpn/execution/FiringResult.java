package org.hcpn.execution;

/**
 * Outcome of one firing attempt.
 */
public class FiringResult {
    private final FiringOutcome outcome;
    private final String module;
    private final String transition;
    private final String childModule;
    private final int childSteps;
    private final String reason;
    
    private FiringResult(FiringOutcome outcome, String module, String transition, 
                         String childModule, int childSteps, String reason) {
        this.outcome = outcome;
        this.module = module;
        this.transition = transition;
        this.childModule = childModule;
        this.childSteps = childSteps;
        this.reason = reason;
    }
    
    static FiringResult fired(String module, String transition) {
        return new FiringResult(FiringOutcome.FIRED, module, transition, null, 0, null);
    }
    
    static FiringResult firedSubstitution(String module, String transition, String childModule, int childSteps) {
        return new FiringResult(FiringOutcome.FIRED, module, transition, childModule, childSteps, null);
    }
    
    static FiringResult notEnabled(String module, String transition) {
        return new FiringResult(FiringOutcome.NOT_ENABLED, module, transition, null, 0, "not enabled");
    }
    
    static FiringResult quiescent(String module) {
        return new FiringResult(FiringOutcome.NOT_ENABLED, module, null, null, 0, "no transition can fire");
    }
    
    static FiringResult stalled(String module, String transition, String childModule, int childSteps, String reason) {
        return new FiringResult(FiringOutcome.STALLED, module, transition, childModule, childSteps, reason);
    }
    
    public FiringOutcome getOutcome() {
        return outcome;
    }
    
    public boolean isFired() {
        return outcome == FiringOutcome.FIRED;
    }
    
    public boolean isStalled() {
        return outcome == FiringOutcome.STALLED;
    }
    
    public String getModule() {
        return module;
    }
    
    /**
     * Transition attempted; null when a step found nothing to fire.
     */
    public String getTransition() {
        return transition;
    }
    
    /**
     * Child module descended into; null for ordinary transitions.
     */
    public String getChildModule() {
        return childModule;
    }
    
    /**
     * Firings performed inside the child during the descent.
     */
    public int getChildSteps() {
        return childSteps;
    }
    
    public String getReason() {
        return reason;
    }
    
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("FiringResult{").append(outcome).append(' ')
            .append(module).append('.').append(transition);
        if (childModule != null) {
            sb.append(" via ").append(childModule).append(" (").append(childSteps).append(" steps)");
        }
        if (reason != null) {
            sb.append(", ").append(reason);
        }
        return sb.append('}').toString();
    }
}
