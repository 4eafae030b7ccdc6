package org.hcpn.exceptions;

public class UnknownPlaceException extends HierarchyException {
    
    public UnknownPlaceException(String moduleName, String placeName) {
        super("Place '" + placeName + "' not found in module '" + moduleName + "'",
              moduleName, placeName, "UNKNOWN_PLACE");
    }
    
    public UnknownPlaceException(String moduleName, String placeName, String detail) {
        super("Place '" + placeName + "' of module '" + moduleName + "' " + detail,
              moduleName, placeName, "UNKNOWN_PLACE");
    }
}
