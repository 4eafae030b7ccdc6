package org.hcpn.exceptions;

/**
 * A place was offered to a fusion class while it already belongs to one.
 */
public class PlaceAlreadyFusedException extends HierarchyException {
    
    public PlaceAlreadyFusedException(String moduleName, String placeName) {
        super("Place '" + placeName + "' of module '" + moduleName + "' already belongs to a fusion class",
              moduleName, placeName, "PLACE_ALREADY_FUSED");
    }
}
