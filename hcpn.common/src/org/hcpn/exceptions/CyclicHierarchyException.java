package org.hcpn.exceptions;

import java.util.Collections;
import java.util.List;

/**
 * Adding the substitution would let a module substitute (directly or
 * transitively) into itself.
 */
public class CyclicHierarchyException extends HierarchyException {
    
    private final List<String> cycle;
    
    public CyclicHierarchyException(String parentModule, String transition, List<String> cycle) {
        super("Substituting '" + parentModule + "." + transition + "' would close the cycle " 
                + String.join(" -> ", cycle),
              parentModule, transition, "CYCLIC_HIERARCHY");
        this.cycle = Collections.unmodifiableList(cycle);
    }
    
    /**
     * Module path of the rejected cycle, first and last element equal.
     */
    public List<String> getCycle() {
        return cycle;
    }
}
