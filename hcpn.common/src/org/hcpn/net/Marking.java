package org.hcpn.net;

import java.util.*;

/**
 * Marking of one module: place name to the multiset of tokens it holds.
 * 
 * A place normally owns its multiset. {@link #attach(String, Multiset)} turns
 * the place into a view on a multiset owned elsewhere (a fusion class); reads
 * and writes through this marking then go to the shared instance.
 */
public class Marking {
    
    private final Map<String, Multiset> places = new LinkedHashMap<>();
    private final Set<String> attachedPlaces = new HashSet<>();
    
    /**
     * Live multiset of a place, created empty on first access.
     */
    public Multiset getTokens(String placeName) {
        return places.computeIfAbsent(placeName, k -> new Multiset());
    }
    
    public void setTokens(String placeName, Collection<?> values) {
        getTokens(placeName).replaceWith(values);
    }
    
    public void addTokens(String placeName, Collection<?> values) {
        getTokens(placeName).addAll(values);
    }
    
    public void removeTokens(String placeName, Collection<?> values) {
        getTokens(placeName).removeAll(values);
    }
    
    /**
     * Redirect a place to a multiset owned by someone else.
     */
    public void attach(String placeName, Multiset shared) {
        places.put(placeName, Objects.requireNonNull(shared, "shared multiset cannot be null"));
        attachedPlaces.add(placeName);
    }
    
    public boolean isAttached(String placeName) {
        return attachedPlaces.contains(placeName);
    }
    
    public Set<String> getPlaceNames() {
        return Collections.unmodifiableSet(places.keySet());
    }
    
    public boolean isEmpty() {
        for (Multiset ms : places.values()) {
            if (!ms.isEmpty()) {
                return false;
            }
        }
        return true;
    }
    
    /**
     * Independent copy: no place of the snapshot is attached to anything.
     */
    public Marking snapshot() {
        Marking copy = new Marking();
        for (Map.Entry<String, Multiset> entry : places.entrySet()) {
            copy.places.put(entry.getKey(), entry.getValue().copy());
        }
        return copy;
    }
    
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("Marking:");
        if (places.isEmpty()) {
            sb.append("\n  (empty)");
        }
        for (Map.Entry<String, Multiset> entry : places.entrySet()) {
            sb.append("\n  ").append(entry.getKey()).append(": ").append(entry.getValue());
        }
        return sb.toString();
    }
}
