package org.hcpn.exceptions;

public class UnknownModuleException extends HierarchyException {
    
    public UnknownModuleException(String moduleName) {
        super("Module '" + moduleName + "' not found", moduleName, null, "UNKNOWN_MODULE");
    }
}
