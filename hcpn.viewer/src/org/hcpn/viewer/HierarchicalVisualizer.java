package org.hcpn.viewer;

import java.util.*;

import org.apache.log4j.Logger;
import org.hcpn.hierarchy.FusionClass;
import org.hcpn.hierarchy.HierarchicalModel;
import org.hcpn.hierarchy.PlaceRef;
import org.hcpn.hierarchy.SubstitutionLink;
import org.hcpn.net.Arc;
import org.hcpn.net.Marking;
import org.hcpn.net.Multiset;
import org.hcpn.net.NetModule;
import org.hcpn.viewer.graph.Cluster;
import org.hcpn.viewer.graph.DeclarativeGraph;
import org.hcpn.viewer.graph.GraphEdge;
import org.hcpn.viewer.graph.GraphNode;

/**
 * Hierarchical Visualizer
 *
 * Turns a hierarchy plus one marking per module into a declarative graph:
 *
 * 1. one cluster per module, in registry order, holding a node per place
 *    (name and tokens in multiset notation), a node per transition
 *    (substitution transitions in the substitution colour) and an edge per
 *    arc labelled with its inscription
 * 2. one substitution edge per link, from the transition node to each entry
 *    port of the child, or to the child cluster when there is none
 * 3. optionally, fusion edges chaining the places of each fusion class,
 *    which also share one fill colour
 *
 * Rendering is a pure function of its inputs. A module missing from the
 * markings map is drawn with an empty marking.
 */
public class HierarchicalVisualizer {
    private static final Logger logger = Logger.getLogger(HierarchicalVisualizer.class);

    public static final String GRAPH_NAME = "HCPN";

    private final RenderStyle style;

    public HierarchicalVisualizer() {
        this(RenderStyle.defaults());
    }

    public HierarchicalVisualizer(RenderStyle style) {
        this.style = Objects.requireNonNull(style, "style cannot be null");
    }

    // ========== Node identities ==========

    public static String placeNodeId(String module, String place) {
        return module + "/p/" + place;
    }

    public static String transitionNodeId(String module, String transition) {
        return module + "/t/" + transition;
    }

    // ========== Rendering ==========

    public DeclarativeGraph render(HierarchicalModel model) {
        return render(model, model.currentMarkings());
    }

    public DeclarativeGraph render(HierarchicalModel model, Map<String, Marking> markingsByModule) {
        Objects.requireNonNull(model, "model cannot be null");
        Map<String, Marking> markings = markingsByModule != null ? markingsByModule : Collections.emptyMap();

        Map<PlaceRef, String> fusedPlaces = new HashMap<>();
        for (FusionClass fusionClass : model.getFusions().getFusionClasses()) {
            for (PlaceRef ref : fusionClass.getMembers()) {
                fusedPlaces.put(ref, fusionClass.id);
            }
        }

        List<Cluster> clusters = new ArrayList<>();
        for (String moduleName : model.getRegistry().listModules()) {
            NetModule module = model.getModule(moduleName).get();
            clusters.add(renderModule(model, moduleName, module, markings.get(moduleName), fusedPlaces));
        }

        List<GraphEdge> crossEdges = new ArrayList<>();
        for (SubstitutionLink link : model.getSubstitutions().getLinks()) {
            crossEdges.addAll(renderSubstitution(model, link));
        }
        if (style.isShowFusionLinks()) {
            for (FusionClass fusionClass : model.getFusions().getFusionClasses()) {
                crossEdges.addAll(renderFusion(fusionClass));
            }
        }

        Map<String, String> graphAttributes = new LinkedHashMap<>();
        graphAttributes.put("rankdir", style.getRankdir());
        graphAttributes.put("fontname", style.getFontname());

        DeclarativeGraph graph = new DeclarativeGraph(GRAPH_NAME, graphAttributes, clusters, crossEdges);
        logger.debug("Rendered " + graph);
        return graph;
    }

    private Cluster renderModule(HierarchicalModel model, String moduleName, NetModule module,
                                 Marking marking, Map<PlaceRef, String> fusedPlaces) {
        List<GraphNode> nodes = new ArrayList<>();

        for (String place : module.getPlaceNames()) {
            Map<String, String> attributes = new LinkedHashMap<>();
            attributes.put("shape", "circle");
            attributes.put("style", "filled");
            String fusionId = fusedPlaces.get(new PlaceRef(moduleName, place));
            attributes.put("fillcolor", fusionId != null ? style.getFusionColor() : style.getPlaceColor());
            if (fusionId != null) {
                attributes.put("fusion", fusionId);
            }
            attributes.put("domain", module.getDomain(place).getName());

            String label = place;
            if (marking != null && marking.getPlaceNames().contains(place)) {
                Multiset tokens = marking.getTokens(place);
                if (!tokens.isEmpty()) {
                    label = place + "\n" + tokens.toNotation();
                }
            }
            nodes.add(new GraphNode(placeNodeId(moduleName, place), label, GraphNode.Kind.PLACE, attributes));
        }

        for (String transition : module.getTransitionNames()) {
            Map<String, String> attributes = new LinkedHashMap<>();
            attributes.put("shape", "box");
            attributes.put("style", "filled");
            Optional<String> child = model.getSubstitutions().resolve(moduleName, transition);
            if (child.isPresent()) {
                attributes.put("fillcolor", style.getSubstitutionColor());
                attributes.put("substitutes", child.get());
            } else {
                attributes.put("fillcolor", style.getTransitionColor());
            }
            nodes.add(new GraphNode(transitionNodeId(moduleName, transition), transition,
                    GraphNode.Kind.TRANSITION, attributes));
        }

        List<GraphEdge> edges = new ArrayList<>();
        for (Arc arc : module.getArcs()) {
            String placeId = placeNodeId(moduleName, arc.place);
            String transitionId = transitionNodeId(moduleName, arc.transition);
            edges.add(arc.isInput()
                    ? GraphEdge.toNode(placeId, transitionId, GraphEdge.Kind.ARC, arc.expression, null)
                    : GraphEdge.toNode(transitionId, placeId, GraphEdge.Kind.ARC, arc.expression, null));
        }

        return new Cluster(moduleName, moduleName, nodes, edges);
    }

    private List<GraphEdge> renderSubstitution(HierarchicalModel model, SubstitutionLink link) {
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("style", style.getSubstitutionEdgeStyle());
        attributes.put("color", style.getSubstitutionColor());

        String source = transitionNodeId(link.parentModule, link.parentTransition);
        NetModule parent = model.getModule(link.parentModule).orElse(null);
        NetModule child = model.getModule(link.childModule).orElse(null);

        Set<String> entryPorts = new LinkedHashSet<>();
        if (parent != null && child != null) {
            for (Arc arc : parent.getInputArcs(link.parentTransition)) {
                String port = link.getEntryPort(arc.place);
                if (child.hasPlace(port)) {
                    entryPorts.add(port);
                }
            }
        }

        List<GraphEdge> edges = new ArrayList<>();
        if (entryPorts.isEmpty()) {
            edges.add(GraphEdge.toCluster(source, link.childModule, GraphEdge.Kind.SUBSTITUTION, "", attributes));
        } else {
            for (String port : entryPorts) {
                edges.add(GraphEdge.toNode(source, placeNodeId(link.childModule, port),
                        GraphEdge.Kind.SUBSTITUTION, "", attributes));
            }
        }
        return edges;
    }

    private List<GraphEdge> renderFusion(FusionClass fusionClass) {
        Map<String, String> attributes = new LinkedHashMap<>();
        attributes.put("style", style.getFusionEdgeStyle());
        attributes.put("color", style.getFusionColor());
        attributes.put("dir", "none");

        List<GraphEdge> edges = new ArrayList<>();
        List<PlaceRef> members = fusionClass.getMembers();
        for (int i = 1; i < members.size(); i++) {
            PlaceRef from = members.get(i - 1);
            PlaceRef to = members.get(i);
            edges.add(GraphEdge.toNode(placeNodeId(from.module, from.place), placeNodeId(to.module, to.place),
                    GraphEdge.Kind.FUSION, fusionClass.id, attributes));
        }
        return edges;
    }
}
