package org.hcpn.validation;

import java.util.*;
import org.apache.log4j.Logger;

/**
 * Ordered list of violations found by one validation pass. Empty means the
 * hierarchy is well-formed.
 */
public class ValidationResult {
    private static final Logger logger = Logger.getLogger(ValidationResult.class);
    
    private final List<ValidationError> errors = new ArrayList<>();
    
    public void addError(ErrorType type, String message, String nodeId, String context) {
        errors.add(new ValidationError(type, message, nodeId, context));
    }
    
    public boolean isValid() {
        return errors.isEmpty();
    }
    
    public boolean hasErrors() {
        return !errors.isEmpty();
    }
    
    public int getErrorCount() {
        return errors.size();
    }
    
    public List<ValidationError> getErrors() {
        return Collections.unmodifiableList(errors);
    }
    
    public List<ValidationError> getErrors(ErrorType type) {
        List<ValidationError> matching = new ArrayList<>();
        for (ValidationError error : errors) {
            if (error.type == type) {
                matching.add(error);
            }
        }
        return matching;
    }
    
    public void reportErrors() {
        if (errors.isEmpty()) {
            return;
        }
        
        logger.error("=== HIERARCHY VALIDATION ERRORS ===");
        logger.error("Found " + errors.size() + " validation errors:");
        
        // Group errors by type
        Map<ErrorType, List<ValidationError>> errorsByType = new LinkedHashMap<>();
        for (ValidationError error : errors) {
            errorsByType.computeIfAbsent(error.type, k -> new ArrayList<>()).add(error);
        }
        
        // Report each type
        for (Map.Entry<ErrorType, List<ValidationError>> entry : errorsByType.entrySet()) {
            ErrorType errorType = entry.getKey();
            List<ValidationError> typeErrors = entry.getValue();
            
            logger.error("--- " + errorType + " (" + typeErrors.size() + " errors) ---");
            for (ValidationError error : typeErrors) {
                logger.error("  " + error.toString());
            }
        }
        
        logger.error("=== END HIERARCHY VALIDATION ERRORS ===");
    }
    
    @Override
    public String toString() {
        return errors.isEmpty() ? "valid" : errors.size() + " errors: " + errors;
    }
}
