package org.hcpn.hierarchy;

import java.util.Objects;

/**
 * Reference to one place of one module.
 */
public final class PlaceRef {
    public final String module;
    public final String place;
    
    public PlaceRef(String module, String place) {
        this.module = Objects.requireNonNull(module, "module cannot be null");
        this.place = Objects.requireNonNull(place, "place cannot be null");
    }
    
    public static PlaceRef of(String module, String place) {
        return new PlaceRef(module, place);
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PlaceRef that = (PlaceRef) o;
        return module.equals(that.module) && place.equals(that.place);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(module, place);
    }
    
    @Override
    public String toString() {
        return module + "." + place;
    }
}
