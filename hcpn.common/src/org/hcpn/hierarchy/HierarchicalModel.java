package org.hcpn.hierarchy;

import java.util.*;

import org.hcpn.exceptions.HierarchyException;
import org.hcpn.net.Marking;
import org.hcpn.net.NetModule;

/**
 * Hierarchical Coloured Petri Net: the module registry, the substitution
 * table and the fusion classes, handed as one unit to the validator, the
 * executor and the visualizer.
 * 
 * Structure only grows; there is no removal. Build a new model when the
 * structure has to change. Every successful registration bumps
 * {@link #getStructureVersion()} so users can tell whether an earlier
 * validation still applies.
 */
public class HierarchicalModel {
    
    private final ModuleRegistry registry = new ModuleRegistry();
    private final SubstitutionTable substitutions = new SubstitutionTable(registry);
    private final FusionSetManager fusions = new FusionSetManager(registry);
    private long structureVersion = 0;
    
    // ========== Registration ==========
    
    public void addModule(String name, NetModule module) throws HierarchyException {
        registry.register(name, module);
        structureVersion++;
    }
    
    public SubstitutionLink addSubstitution(String parentModule, String transition, String childModule) 
            throws HierarchyException {
        SubstitutionLink link = substitutions.link(parentModule, transition, childModule);
        structureVersion++;
        return link;
    }
    
    public SubstitutionLink addSubstitution(String parentModule, String transition, String childModule,
                                            PortBinding... ports) throws HierarchyException {
        SubstitutionLink link = substitutions.link(parentModule, transition, childModule, Arrays.asList(ports));
        structureVersion++;
        return link;
    }
    
    public FusionClass fuse(PlaceRef... places) throws HierarchyException {
        FusionClass fusionClass = fusions.fuse(Arrays.asList(places));
        structureVersion++;
        return fusionClass;
    }
    
    // ========== Access ==========
    
    public ModuleRegistry getRegistry() {
        return registry;
    }
    
    public SubstitutionTable getSubstitutions() {
        return substitutions;
    }
    
    public FusionSetManager getFusions() {
        return fusions;
    }
    
    public Optional<NetModule> getModule(String name) {
        return registry.find(name);
    }
    
    public Optional<String> getSubstitutionTarget(String parentModule, String transition) {
        return substitutions.resolve(parentModule, transition);
    }
    
    public long getStructureVersion() {
        return structureVersion;
    }
    
    /**
     * Snapshot of every module's marking, keyed by module name in registry
     * order.
     */
    public Map<String, Marking> currentMarkings() {
        Map<String, Marking> markings = new LinkedHashMap<>();
        for (String name : registry.listModules()) {
            markings.put(name, registry.find(name).get().getMarking().snapshot());
        }
        return markings;
    }
    
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("HCPN:");
        for (String name : registry.listModules()) {
            NetModule module = registry.find(name).get();
            sb.append("\n  Module '").append(name).append("': ")
              .append(module.getPlaceNames().size()).append(" places, ")
              .append(module.getTransitionNames().size()).append(" transitions");
        }
        sb.append("\nSubstitutions:");
        for (SubstitutionLink link : substitutions.getLinks()) {
            sb.append("\n  ").append(link);
        }
        if (!fusions.getFusionClasses().isEmpty()) {
            sb.append("\nFusion sets:");
            for (FusionClass fusionClass : fusions.getFusionClasses()) {
                sb.append("\n  ").append(fusionClass.id).append(": ").append(fusionClass.getMembers());
            }
        }
        return sb.toString();
    }
}
