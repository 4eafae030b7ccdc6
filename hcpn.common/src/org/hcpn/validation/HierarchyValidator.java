package org.hcpn.validation;

import java.util.*;

import org.apache.log4j.Logger;
import org.hcpn.exceptions.HierarchyValidationException;
import org.hcpn.hierarchy.FusionClass;
import org.hcpn.hierarchy.HierarchicalModel;
import org.hcpn.hierarchy.ModuleRegistry;
import org.hcpn.hierarchy.PlaceRef;
import org.hcpn.hierarchy.SubstitutionLink;
import org.hcpn.net.Arc;
import org.hcpn.net.NetModule;
import org.hcpn.net.TokenDomain;

/**
 * Hierarchy Validator
 * 
 * Checks a hierarchical model as a whole and reports every violation it
 * finds, in a stable order:
 * 
 * 1. referential integrity of each substitution link (modules, transition,
 *    explicit and conventional port bindings)
 * 2. acyclicity of the module-substitution graph
 * 3. fusion classes: valid references, disjointness, domain consistency
 * 
 * Registration already enforces most of this eagerly. The full pass exists
 * because modules are opaque handles whose structure can change after
 * registration, and because a batch of links can be checked here before it
 * is applied.
 * 
 * The validator keeps no state; the same input always yields the same result.
 */
public class HierarchyValidator {
    private static final Logger logger = Logger.getLogger(HierarchyValidator.class);
    
    public ValidationResult validate(HierarchicalModel model) {
        ValidationResult result = new ValidationResult();
        ModuleRegistry registry = model.getRegistry();
        List<SubstitutionLink> links = model.getSubstitutions().getLinks();
        
        checkLinks(registry, links, result);
        checkAcyclic(registry, links, result);
        checkFusions(registry, model.getFusions().getFusionClasses(), result);
        
        logger.debug("Validated hierarchy: " + result);
        return result;
    }
    
    public void validateOrThrow(HierarchicalModel model) throws HierarchyValidationException {
        ValidationResult result = validate(model);
        if (result.hasErrors()) {
            result.reportErrors();
            throw new HierarchyValidationException(result);
        }
    }
    
    /**
     * Check a proposed set of links against a registry without applying them.
     */
    public ValidationResult validateLinks(ModuleRegistry registry, List<SubstitutionLink> links) {
        ValidationResult result = new ValidationResult();
        checkLinks(registry, links, result);
        checkAcyclic(registry, links, result);
        return result;
    }
    
    /**
     * Check fusion classes against a registry without building a model.
     */
    public ValidationResult validateFusions(ModuleRegistry registry, List<FusionClass> fusionClasses) {
        ValidationResult result = new ValidationResult();
        checkFusions(registry, fusionClasses, result);
        return result;
    }
    
    // ========== Substitution links ==========
    
    private void checkLinks(ModuleRegistry registry, List<SubstitutionLink> links, ValidationResult result) {
        Map<String, SubstitutionLink> seen = new HashMap<>();
        
        for (SubstitutionLink link : links) {
            String nodeId = link.parentModule + "." + link.parentTransition;
            String context = link.toString();
            
            SubstitutionLink previous = seen.putIfAbsent(nodeId, link);
            if (previous != null) {
                result.addError(ErrorType.DUPLICATE_SUBSTITUTION, 
                        "Transition already substituted by " + previous.childModule, nodeId, context);
            }
            
            NetModule parent = registry.find(link.parentModule).orElse(null);
            NetModule child = registry.find(link.childModule).orElse(null);
            if (parent == null) {
                result.addError(ErrorType.UNKNOWN_MODULE, 
                        "Parent module '" + link.parentModule + "' not registered", link.parentModule, context);
            }
            if (child == null) {
                result.addError(ErrorType.UNKNOWN_MODULE, 
                        "Child module '" + link.childModule + "' not registered", link.childModule, context);
            }
            if (parent == null) {
                continue;
            }
            if (!parent.hasTransition(link.parentTransition)) {
                result.addError(ErrorType.UNKNOWN_TRANSITION, 
                        "Transition not found in module '" + link.parentModule + "'", nodeId, context);
                continue;
            }
            checkPorts(link, parent, child, result);
        }
    }
    
    private void checkPorts(SubstitutionLink link, NetModule parent, NetModule child, ValidationResult result) {
        String context = link.toString();
        
        Set<String> inputSockets = new LinkedHashSet<>();
        for (Arc arc : parent.getInputArcs(link.parentTransition)) {
            inputSockets.add(arc.place);
        }
        Set<String> outputSockets = new LinkedHashSet<>();
        for (Arc arc : parent.getOutputArcs(link.parentTransition)) {
            outputSockets.add(arc.place);
        }
        
        for (String socket : link.getExplicitEntryPorts().keySet()) {
            if (!inputSockets.contains(socket)) {
                result.addError(ErrorType.UNKNOWN_PLACE, "Place is not an input socket of " 
                        + link.parentTransition, link.parentModule + "." + socket, context);
            }
        }
        for (String socket : link.getExplicitExitPorts().keySet()) {
            if (!outputSockets.contains(socket)) {
                result.addError(ErrorType.UNKNOWN_PLACE, "Place is not an output socket of " 
                        + link.parentTransition, link.parentModule + "." + socket, context);
            }
        }
        
        if (child == null) {
            return;
        }
        for (String socket : inputSockets) {
            String port = link.getEntryPort(socket);
            if (!child.hasPlace(port)) {
                result.addError(ErrorType.UNKNOWN_PLACE, "Entry port for socket '" + socket 
                        + "' not found in module '" + link.childModule + "'", link.childModule + "." + port, context);
            }
        }
        for (String socket : outputSockets) {
            String port = link.getExitPort(socket);
            if (!child.hasPlace(port)) {
                result.addError(ErrorType.UNKNOWN_PLACE, "Exit port for socket '" + socket 
                        + "' not found in module '" + link.childModule + "'", link.childModule + "." + port, context);
            }
        }
    }
    
    // ========== Acyclicity ==========
    
    private void checkAcyclic(ModuleRegistry registry, List<SubstitutionLink> links, ValidationResult result) {
        Map<String, List<String>> adjacency = new LinkedHashMap<>();
        for (String module : registry.listModules()) {
            adjacency.put(module, new ArrayList<>());
        }
        for (SubstitutionLink link : links) {
            adjacency.computeIfAbsent(link.parentModule, k -> new ArrayList<>()).add(link.childModule);
            adjacency.computeIfAbsent(link.childModule, k -> new ArrayList<>());
        }
        
        Map<String, Integer> state = new HashMap<>(); // 1 = on stack, 2 = done
        Set<String> reported = new HashSet<>();
        Deque<String> stack = new ArrayDeque<>();
        for (String module : adjacency.keySet()) {
            if (!state.containsKey(module)) {
                findCycles(module, adjacency, state, stack, reported, result);
            }
        }
    }
    
    private void findCycles(String module, Map<String, List<String>> adjacency, Map<String, Integer> state,
                            Deque<String> stack, Set<String> reported, ValidationResult result) {
        state.put(module, 1);
        stack.addLast(module);
        
        for (String child : adjacency.get(module)) {
            Integer childState = state.get(child);
            if (childState == null) {
                findCycles(child, adjacency, state, stack, reported, result);
            } else if (childState == 1) {
                List<String> cycle = new ArrayList<>();
                boolean inCycle = false;
                for (String onStack : stack) {
                    if (onStack.equals(child)) {
                        inCycle = true;
                    }
                    if (inCycle) {
                        cycle.add(onStack);
                    }
                }
                if (reported.add(canonical(cycle))) {
                    cycle.add(child);
                    result.addError(ErrorType.CYCLIC_HIERARCHY, 
                            "Substitution cycle " + String.join(" -> ", cycle), child, null);
                }
            }
        }
        
        stack.removeLast();
        state.put(module, 2);
    }
    
    private static String canonical(List<String> cycle) {
        int start = 0;
        for (int i = 1; i < cycle.size(); i++) {
            if (cycle.get(i).compareTo(cycle.get(start)) < 0) {
                start = i;
            }
        }
        List<String> rotated = new ArrayList<>(cycle.subList(start, cycle.size()));
        rotated.addAll(cycle.subList(0, start));
        return String.join("\u0000", rotated);
    }
    
    // ========== Fusion classes ==========
    
    private void checkFusions(ModuleRegistry registry, List<FusionClass> fusionClasses, ValidationResult result) {
        Map<PlaceRef, String> owner = new HashMap<>();
        
        for (FusionClass fusionClass : fusionClasses) {
            String context = fusionClass.toString();
            if (new HashSet<>(fusionClass.getMembers()).size() < 2) {
                result.addError(ErrorType.UNDERSIZED_FUSION, 
                        "Fusion class needs at least two distinct places", fusionClass.id, context);
            }
            
            TokenDomain domain = fusionClass.getDomain();
            for (PlaceRef ref : fusionClass.getMembers()) {
                String previous = owner.putIfAbsent(ref, fusionClass.id);
                if (previous != null) {
                    result.addError(ErrorType.PLACE_ALREADY_FUSED, 
                            "Place also belongs to fusion class " + previous, ref.toString(), context);
                }
                
                NetModule module = registry.find(ref.module).orElse(null);
                if (module == null) {
                    result.addError(ErrorType.UNKNOWN_MODULE, 
                            "Module '" + ref.module + "' not registered", ref.module, context);
                    continue;
                }
                if (!module.hasPlace(ref.place)) {
                    result.addError(ErrorType.UNKNOWN_PLACE, 
                            "Place not found in module '" + ref.module + "'", ref.toString(), context);
                    continue;
                }
                TokenDomain placeDomain = module.getDomain(ref.place);
                if (domain != null && !(domain.isCompatibleWith(placeDomain) && placeDomain.isCompatibleWith(domain))) {
                    result.addError(ErrorType.DOMAIN_MISMATCH, "Domain " + placeDomain 
                            + " incompatible with " + domain, ref.toString(), context);
                }
            }
        }
    }
}
