package org.hcpn.viewer;

import org.hcpn.hierarchy.HierarchicalModel;
import org.hcpn.net.ColouredNet;
import org.hcpn.net.ValueDomain;

/**
 * Models shared by the viewer tests.
 */
public final class Fixtures {

    private Fixtures() {
    }

    public static ColouredNet pipe() {
        return new ColouredNet()
            .addPlace("in", ValueDomain.INT)
            .addPlace("out", ValueDomain.INT)
            .addTransition("T")
            .addArc("in", "T", "x")
            .addArc("T", "out", "x");
    }

    /**
     * A.T -> B, B.T -> C, C.T -> D, every module a pipe.
     */
    public static HierarchicalModel chain() throws Exception {
        HierarchicalModel model = new HierarchicalModel();
        for (String name : new String[] {"A", "B", "C", "D"}) {
            model.addModule(name, pipe());
        }
        model.addSubstitution("A", "T", "B");
        model.addSubstitution("B", "T", "C");
        model.addSubstitution("C", "T", "D");
        return model;
    }
}
