package org.hcpn.execution;

import java.util.*;

import org.hcpn.hierarchy.HierarchicalModel;
import org.hcpn.net.Marking;
import org.hcpn.net.Multiset;
import org.hcpn.net.NetModule;

/**
 * Copy of every multiset of a model, keyed by multiset identity so a fused
 * multiset is captured once and restored in place (its member views stay
 * attached).
 */
class MarkingSnapshot {
    
    private final Map<Multiset, List<Object>> contents = new IdentityHashMap<>();
    
    static MarkingSnapshot capture(HierarchicalModel model) {
        MarkingSnapshot snapshot = new MarkingSnapshot();
        for (String name : model.getRegistry().listModules()) {
            NetModule module = model.getModule(name).get();
            Marking marking = module.getMarking();
            Set<String> placeNames = new LinkedHashSet<>(module.getPlaceNames());
            placeNames.addAll(marking.getPlaceNames());
            for (String place : placeNames) {
                Multiset tokens = marking.getTokens(place);
                snapshot.contents.putIfAbsent(tokens, tokens.getTokens());
            }
        }
        return snapshot;
    }
    
    void restore() {
        for (Map.Entry<Multiset, List<Object>> entry : contents.entrySet()) {
            entry.getKey().replaceWith(entry.getValue());
        }
    }
}
