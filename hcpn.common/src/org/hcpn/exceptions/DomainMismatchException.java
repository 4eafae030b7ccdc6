package org.hcpn.exceptions;

/**
 * Places offered for fusion accept incompatible token domains.
 */
public class DomainMismatchException extends HierarchyException {
    
    private final String expectedDomain;
    private final String receivedDomain;
    
    public DomainMismatchException(String moduleName, String placeName, String expectedDomain, String receivedDomain) {
        super("Place '" + placeName + "' of module '" + moduleName + "' has domain " + receivedDomain
                + ", incompatible with " + expectedDomain,
              moduleName, placeName, "DOMAIN_MISMATCH");
        this.expectedDomain = expectedDomain;
        this.receivedDomain = receivedDomain;
    }
    
    public String getExpectedDomain() { 
        return expectedDomain; 
    }
    
    public String getReceivedDomain() { 
        return receivedDomain; 
    }
}
