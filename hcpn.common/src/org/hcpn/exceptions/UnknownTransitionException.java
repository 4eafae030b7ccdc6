package org.hcpn.exceptions;

public class UnknownTransitionException extends HierarchyException {
    
    public UnknownTransitionException(String moduleName, String transitionName) {
        super("Transition '" + transitionName + "' not found in module '" + moduleName + "'",
              moduleName, transitionName, "UNKNOWN_TRANSITION");
    }
}
