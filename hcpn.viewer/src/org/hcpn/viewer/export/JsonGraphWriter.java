package org.hcpn.viewer.export;

import java.util.Map;

import org.hcpn.viewer.graph.Cluster;
import org.hcpn.viewer.graph.DeclarativeGraph;
import org.hcpn.viewer.graph.GraphEdge;
import org.hcpn.viewer.graph.GraphNode;
import org.json.simple.JSONArray;
import org.json.simple.JSONObject;

/**
 * JSON form of a declarative graph, for backends that do not read DOT.
 * 
 * Format:
 * <pre>
 * {
 *   "name": "HCPN",
 *   "attributes": { "rankdir": "LR" },
 *   "clusters": [
 *     { "id": "A", "label": "A",
 *       "nodes": [ { "id": "A/p/P1", "kind": "PLACE", "label": "P1", "attributes": {...} } ],
 *       "edges": [ { "source": "...", "target": "...", "kind": "ARC", "label": "x" } ] }
 *   ],
 *   "crossEdges": [ { "source": "A/t/T", "targetCluster": "B", "kind": "SUBSTITUTION" } ]
 * }
 * </pre>
 */
public class JsonGraphWriter {
    
    public String write(DeclarativeGraph graph) {
        return toJson(graph).toJSONString();
    }
    
    @SuppressWarnings("unchecked")
    public JSONObject toJson(DeclarativeGraph graph) {
        JSONObject json = new JSONObject();
        json.put("name", graph.name);
        json.put("attributes", attributes(graph.attributes));
        
        JSONArray clusters = new JSONArray();
        for (Cluster cluster : graph.clusters) {
            JSONObject clusterJson = new JSONObject();
            clusterJson.put("id", cluster.id);
            clusterJson.put("label", cluster.label);
            
            JSONArray nodes = new JSONArray();
            for (GraphNode node : cluster.nodes) {
                JSONObject nodeJson = new JSONObject();
                nodeJson.put("id", node.id);
                nodeJson.put("kind", node.kind.name());
                nodeJson.put("label", node.label);
                nodeJson.put("attributes", attributes(node.attributes));
                nodes.add(nodeJson);
            }
            clusterJson.put("nodes", nodes);
            
            JSONArray edges = new JSONArray();
            for (GraphEdge edge : cluster.edges) {
                edges.add(edge(edge));
            }
            clusterJson.put("edges", edges);
            clusters.add(clusterJson);
        }
        json.put("clusters", clusters);
        
        JSONArray crossEdges = new JSONArray();
        for (GraphEdge edge : graph.crossEdges) {
            crossEdges.add(edge(edge));
        }
        json.put("crossEdges", crossEdges);
        return json;
    }
    
    @SuppressWarnings("unchecked")
    private static JSONObject edge(GraphEdge edge) {
        JSONObject json = new JSONObject();
        json.put("source", edge.source);
        if (edge.targetsCluster()) {
            json.put("targetCluster", edge.targetCluster);
        } else {
            json.put("target", edge.target);
        }
        json.put("kind", edge.kind.name());
        json.put("label", edge.label);
        json.put("attributes", attributes(edge.attributes));
        return json;
    }
    
    @SuppressWarnings("unchecked")
    private static JSONObject attributes(Map<String, String> attributes) {
        JSONObject json = new JSONObject();
        json.putAll(attributes);
        return json;
    }
}
