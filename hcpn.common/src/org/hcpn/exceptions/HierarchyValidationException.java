package org.hcpn.exceptions;

import org.hcpn.validation.ValidationResult;

/**
 * Raised when a hierarchy that failed validation is handed to an operation
 * that requires a well-formed one.
 */
public class HierarchyValidationException extends HierarchyException {
    
    private final ValidationResult result;
    
    public HierarchyValidationException(ValidationResult result) {
        super("Hierarchy is not well-formed: " + result.getErrorCount() + " validation errors", 
              null, null, "INVALID_HIERARCHY");
        this.result = result;
    }
    
    public ValidationResult getResult() {
        return result;
    }
}
