package org.hcpn.viewer.graph;

import java.util.*;

/**
 * Directed (or, for fusion annotations, undirected) edge of the diagram.
 * 
 * An edge ends either at a node ({@link #target}) or, when a child module
 * has no single representative node, at a whole cluster
 * ({@link #targetCluster}); exactly one of the two is set.
 */
public class GraphEdge {
    
    public enum Kind {
        /** Arc inside one module. */
        ARC,
        /** Substitution transition to its child module. */
        SUBSTITUTION,
        /** Shared identity of fused places. */
        FUSION
    }
    
    public final String source;
    public final String target;
    public final String targetCluster;
    public final Kind kind;
    public final String label;
    public final Map<String, String> attributes;
    
    private GraphEdge(String source, String target, String targetCluster, Kind kind, String label,
                      Map<String, String> attributes) {
        this.source = Objects.requireNonNull(source, "source cannot be null");
        this.target = target;
        this.targetCluster = targetCluster;
        this.kind = Objects.requireNonNull(kind, "kind cannot be null");
        this.label = label != null ? label : "";
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes != null ? attributes : new LinkedHashMap<>()));
    }
    
    public static GraphEdge toNode(String source, String target, Kind kind, String label, Map<String, String> attributes) {
        return new GraphEdge(source, Objects.requireNonNull(target, "target cannot be null"), null, kind, label, attributes);
    }
    
    public static GraphEdge toCluster(String source, String cluster, Kind kind, String label, Map<String, String> attributes) {
        return new GraphEdge(source, null, Objects.requireNonNull(cluster, "cluster cannot be null"), kind, label, attributes);
    }
    
    public boolean targetsCluster() {
        return targetCluster != null;
    }
    
    public String getAttribute(String key) {
        return attributes.get(key);
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        GraphEdge that = (GraphEdge) o;
        return source.equals(that.source) && Objects.equals(target, that.target) 
                && Objects.equals(targetCluster, that.targetCluster) && kind == that.kind 
                && label.equals(that.label) && attributes.equals(that.attributes);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(source, target, targetCluster, kind, label, attributes);
    }
    
    @Override
    public String toString() {
        return String.format("GraphEdge{%s -> %s, kind=%s, label=%s}", 
                source, targetsCluster() ? "cluster " + targetCluster : target, kind, label);
    }
}
