package org.hcpn.viewer.export;

import java.util.*;

import org.hcpn.viewer.graph.Cluster;
import org.hcpn.viewer.graph.DeclarativeGraph;
import org.hcpn.viewer.graph.GraphEdge;
import org.hcpn.viewer.graph.GraphNode;

/**
 * Writes a declarative graph as Graphviz DOT text: one
 * {@code subgraph cluster_<module>} per module, cross-cluster edges last.
 * Edges that end at a cluster are drawn to the cluster's first node and
 * clipped at its border with {@code lhead}; an empty cluster gets an
 * invisible anchor node for that purpose.
 */
public class DotGraphWriter {
    
    public String write(DeclarativeGraph graph) {
        StringBuilder dot = new StringBuilder();
        dot.append("digraph ").append(quote(graph.name)).append(" {\n");
        for (Map.Entry<String, String> attribute : graph.attributes.entrySet()) {
            dot.append("    ").append(attribute.getKey()).append("=").append(quote(attribute.getValue())).append(";\n");
        }
        
        boolean compound = false;
        for (GraphEdge edge : graph.crossEdges) {
            compound |= edge.targetsCluster();
        }
        if (compound) {
            dot.append("    compound=true;\n");
        }
        String fontname = graph.attributes.get("fontname");
        if (fontname != null) {
            dot.append("    node [fontname=").append(quote(fontname)).append("];\n");
        }
        
        for (Cluster cluster : graph.clusters) {
            dot.append("\n    // --- Module ").append(cluster.label).append(" ---\n");
            dot.append("    subgraph ").append(quote(clusterName(cluster))).append(" {\n");
            dot.append("        label=").append(quote(cluster.label)).append(";\n");
            if (cluster.nodes.isEmpty()) {
                dot.append("        ").append(quote(anchorId(cluster))).append(" [shape=point, style=invis];\n");
            }
            for (GraphNode node : cluster.nodes) {
                dot.append("        ").append(quote(node.id))
                   .append(" [").append(attributes(node.label, node.attributes)).append("];\n");
            }
            for (GraphEdge edge : cluster.edges) {
                dot.append("        ").append(quote(edge.source)).append(" -> ").append(quote(edge.target))
                   .append(" [").append(attributes(edge.label, edge.attributes)).append("];\n");
            }
            dot.append("    }\n");
        }
        
        if (!graph.crossEdges.isEmpty()) {
            dot.append("\n    // --- Substitution and fusion links ---\n");
        }
        for (GraphEdge edge : graph.crossEdges) {
            Map<String, String> attributes = new LinkedHashMap<>(edge.attributes);
            String target = edge.target;
            if (edge.targetsCluster()) {
                Cluster cluster = graph.findCluster(edge.targetCluster)
                    .orElseThrow(() -> new IllegalArgumentException("Edge to unknown cluster " + edge.targetCluster));
                target = cluster.nodes.isEmpty() ? anchorId(cluster) : cluster.nodes.get(0).id;
                attributes.put("lhead", clusterName(cluster));
            }
            dot.append("    ").append(quote(edge.source)).append(" -> ").append(quote(target))
               .append(" [").append(attributes(edge.label, attributes)).append("];\n");
        }
        
        dot.append("}\n");
        return dot.toString();
    }
    
    private static String clusterName(Cluster cluster) {
        return "cluster_" + cluster.id;
    }
    
    private static String anchorId(Cluster cluster) {
        return cluster.id + "/anchor";
    }
    
    private static String attributes(String label, Map<String, String> attributes) {
        List<String> parts = new ArrayList<>();
        parts.add("label=" + quote(label));
        for (Map.Entry<String, String> attribute : attributes.entrySet()) {
            parts.add(attribute.getKey() + "=" + quote(attribute.getValue()));
        }
        return String.join(", ", parts);
    }
    
    static String quote(String value) {
        StringBuilder sb = new StringBuilder("\"");
        for (char c : value.toCharArray()) {
            switch (c) {
                case '"':
                    sb.append("\\\"");
                    break;
                case '\\':
                    sb.append("\\\\");
                    break;
                case '\n':
                    sb.append("\\n");
                    break;
                default:
                    sb.append(c);
            }
        }
        return sb.append('"').toString();
    }
}
