package org.hcpn.viewer.export;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.hcpn.hierarchy.HierarchicalModel;
import org.hcpn.net.ColouredNet;
import org.hcpn.viewer.Fixtures;
import org.hcpn.viewer.HierarchicalVisualizer;
import org.hcpn.viewer.graph.DeclarativeGraph;
import org.junit.Before;
import org.junit.Test;

/**
 * JUnit test for DOT export.
 */
public class DotGraphWriterTest {

    private HierarchicalVisualizer visualizer;
    private DotGraphWriter writer;

    @Before
    public void setUp() {
        visualizer = new HierarchicalVisualizer();
        writer = new DotGraphWriter();
    }

    @Test
    public void testClustersAndSubstitutionEdges() throws Exception {
        String dot = writer.write(visualizer.render(Fixtures.chain()));

        assertTrue(dot.startsWith("digraph \"HCPN\" {\n"));
        assertTrue(dot.contains("rankdir=\"LR\";"));
        for (String module : new String[] {"A", "B", "C", "D"}) {
            assertTrue(dot.contains("subgraph \"cluster_" + module + "\" {"));
        }
        assertTrue(dot.contains("\"A/t/T\" -> \"B/p/in\" [label=\"\", style=\"dashed\", color=\"orange\"];"));
        assertTrue(dot.contains("\"A/p/in\" -> \"A/t/T\" [label=\"x\"];"));
        assertFalse(dot.contains("compound=true"));
        assertTrue(dot.endsWith("}\n"));
    }

    @Test
    public void testEdgeToEmptyClusterUsesAnchor() throws Exception {
        HierarchicalModel model = new HierarchicalModel();
        model.addModule("Main", Fixtures.pipe());
        model.addModule("Empty", new ColouredNet());
        model.addSubstitution("Main", "T", "Empty");

        String dot = writer.write(visualizer.render(model));
        assertTrue(dot.contains("compound=true;"));
        assertTrue(dot.contains("\"Empty/anchor\" [shape=point, style=invis];"));
        assertTrue(dot.contains("\"Main/t/T\" -> \"Empty/anchor\" [label=\"\", style=\"dashed\", color=\"orange\", "
                + "lhead=\"cluster_Empty\"];"));
    }

    @Test
    public void testLabelsAreEscaped() throws Exception {
        HierarchicalModel model = Fixtures.chain();
        ((ColouredNet) model.getModule("A").get()).addTokens("in", 5);

        DeclarativeGraph graph = visualizer.render(model);
        assertTrue(writer.write(graph).contains("\"A/p/in\" [label=\"in\\n1`5\""));
        assertEquals("\"say \\\"hi\\\"\"", DotGraphWriter.quote("say \"hi\""));
    }

    @Test
    public void testSameGraphSameText() throws Exception {
        HierarchicalModel model = Fixtures.chain();
        assertEquals(writer.write(visualizer.render(model)), writer.write(visualizer.render(model)));
    }
}
