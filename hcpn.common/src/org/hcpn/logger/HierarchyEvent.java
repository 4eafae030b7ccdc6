package org.hcpn.logger;

import java.util.Objects;

/**
 * One recorded step of hierarchical execution.
 */
public class HierarchyEvent {
    
    public enum Type {
        FIRED,
        NOT_ENABLED,
        DESCEND,
        RETURN,
        STALL,
        ROLLBACK
    }
    
    private final Type type;
    private final String module;
    private final String transition;
    private final int depth;
    private final String message;
    
    public HierarchyEvent(Type type, String module, String transition, int depth, String message) {
        this.type = Objects.requireNonNull(type, "type cannot be null");
        this.module = module;
        this.transition = transition;
        this.depth = depth;
        this.message = message;
    }
    
    public Type getType() {
        return type;
    }
    
    public String getModule() {
        return module;
    }
    
    public String getTransition() {
        return transition;
    }
    
    public int getDepth() {
        return depth;
    }
    
    public String getMessage() {
        return message;
    }
    
    @Override
    public String toString() {
        return "HierarchyEvent{" + type + " " + module + "." + transition + " depth=" + depth + "}";
    }
}
