package org.hcpn.exceptions;

/**
 * A module name is already taken in the registry.
 */
public class DuplicateNameException extends HierarchyException {
    
    public DuplicateNameException(String moduleName) {
        super("Module with name '" + moduleName + "' already exists", moduleName, null, "DUPLICATE_NAME");
    }
}
