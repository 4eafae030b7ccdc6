package org.hcpn.exceptions;

/**
 * The transition already substitutes into a child module.
 */
public class DuplicateSubstitutionException extends HierarchyException {
    
    private final String existingChild;
    
    public DuplicateSubstitutionException(String parentModule, String transition, String existingChild) {
        super("Transition '" + transition + "' of module '" + parentModule 
                + "' is already substituted by module '" + existingChild + "'",
              parentModule, transition, "DUPLICATE_SUBSTITUTION");
        this.existingChild = existingChild;
    }
    
    public String getExistingChild() {
        return existingChild;
    }
}
