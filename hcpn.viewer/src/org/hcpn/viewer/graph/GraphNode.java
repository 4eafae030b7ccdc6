package org.hcpn.viewer.graph;

import java.util.*;

/**
 * Place or transition node of a module cluster.
 */
public class GraphNode {
    
    public enum Kind {
        PLACE,
        TRANSITION
    }
    
    public final String id;
    public final String label;
    public final Kind kind;
    public final Map<String, String> attributes;
    
    public GraphNode(String id, String label, Kind kind, Map<String, String> attributes) {
        this.id = Objects.requireNonNull(id, "id cannot be null");
        this.label = Objects.requireNonNull(label, "label cannot be null");
        this.kind = Objects.requireNonNull(kind, "kind cannot be null");
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes != null ? attributes : new LinkedHashMap<>()));
    }
    
    public String getAttribute(String key) {
        return attributes.get(key);
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GraphNode that = (GraphNode) o;
        return id.equals(that.id) && label.equals(that.label) && kind == that.kind 
                && attributes.equals(that.attributes);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(id, label, kind, attributes);
    }
    
    @Override
    public String toString() {
        return String.format("GraphNode{id=%s, kind=%s, label=%s}", id, kind, label);
    }
}
