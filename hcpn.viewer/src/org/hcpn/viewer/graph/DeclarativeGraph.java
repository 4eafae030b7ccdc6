package org.hcpn.viewer.graph;

import java.util.*;

/**
 * Declarative description of a hierarchical net diagram: clusters, nodes,
 * edges and style attributes, without layout coordinates. A rendering
 * backend decides the geometry.
 */
public class DeclarativeGraph {
    public final String name;
    public final Map<String, String> attributes;
    public final List<Cluster> clusters;
    /** Edges between clusters: substitution links and fusion annotations. */
    public final List<GraphEdge> crossEdges;
    
    public DeclarativeGraph(String name, Map<String, String> attributes, List<Cluster> clusters, 
                            List<GraphEdge> crossEdges) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.clusters = Collections.unmodifiableList(new ArrayList<>(clusters));
        this.crossEdges = Collections.unmodifiableList(new ArrayList<>(crossEdges));
    }
    
    public Optional<Cluster> findCluster(String clusterId) {
        for (Cluster cluster : clusters) {
            if (cluster.id.equals(clusterId)) {
                return Optional.of(cluster);
            }
        }
        return Optional.empty();
    }
    
    public Optional<GraphNode> findNode(String nodeId) {
        for (Cluster cluster : clusters) {
            Optional<GraphNode> node = cluster.findNode(nodeId);
            if (node.isPresent()) {
                return node;
            }
        }
        return Optional.empty();
    }
    
    public List<GraphEdge> getCrossEdges(GraphEdge.Kind kind) {
        List<GraphEdge> matching = new ArrayList<>();
        for (GraphEdge edge : crossEdges) {
            if (edge.kind == kind) {
                matching.add(edge);
            }
        }
        return matching;
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DeclarativeGraph that = (DeclarativeGraph) o;
        return name.equals(that.name) && attributes.equals(that.attributes) 
                && clusters.equals(that.clusters) && crossEdges.equals(that.crossEdges);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(name, attributes, clusters, crossEdges);
    }
    
    @Override
    public String toString() {
        return String.format("DeclarativeGraph{name=%s, clusters=%d, crossEdges=%d}", 
                name, clusters.size(), crossEdges.size());
    }
}
