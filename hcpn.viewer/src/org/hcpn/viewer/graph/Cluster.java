package org.hcpn.viewer.graph;

import java.util.*;

/**
 * One module of the hierarchy: its place and transition nodes and its arcs.
 */
public class Cluster {
    public final String id;
    public final String label;
    public final List<GraphNode> nodes;
    public final List<GraphEdge> edges;
    
    public Cluster(String id, String label, List<GraphNode> nodes, List<GraphEdge> edges) {
        this.id = Objects.requireNonNull(id, "id cannot be null");
        this.label = Objects.requireNonNull(label, "label cannot be null");
        this.nodes = Collections.unmodifiableList(new ArrayList<>(nodes));
        this.edges = Collections.unmodifiableList(new ArrayList<>(edges));
    }
    
    public Optional<GraphNode> findNode(String nodeId) {
        for (GraphNode node : nodes) {
            if (node.id.equals(nodeId)) {
                return Optional.of(node);
            }
        }
        return Optional.empty();
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Cluster that = (Cluster) o;
        return id.equals(that.id) && label.equals(that.label) && nodes.equals(that.nodes) && edges.equals(that.edges);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(id, label, nodes, edges);
    }
    
    @Override
    public String toString() {
        return String.format("Cluster{id=%s, nodes=%d, edges=%d}", id, nodes.size(), edges.size());
    }
}
