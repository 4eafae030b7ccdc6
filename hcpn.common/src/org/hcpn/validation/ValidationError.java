package org.hcpn.validation;

import java.util.Objects;

public class ValidationError {
    public final ErrorType type;
    public final String message;
    public final String nodeId;
    public final String context;
    
    public ValidationError(ErrorType type, String message, String nodeId, String context) {
        this.type = Objects.requireNonNull(type, "type cannot be null");
        this.message = Objects.requireNonNull(message, "message cannot be null");
        this.nodeId = nodeId; // Can be null
        this.context = context; // Can be null
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ValidationError that = (ValidationError) o;
        return type == that.type && message.equals(that.message) 
                && Objects.equals(nodeId, that.nodeId) && Objects.equals(context, that.context);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(type, message, nodeId, context);
    }
    
    @Override
    public String toString() {
        return String.format("[Node %s] %s: %s (Context: %s)", 
                           nodeId != null ? nodeId : "UNKNOWN", type, message, 
                           context != null ? context : "N/A");
    }
}
