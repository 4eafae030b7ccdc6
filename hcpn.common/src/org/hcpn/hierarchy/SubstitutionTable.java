package org.hcpn.hierarchy;

import java.util.*;

import org.apache.log4j.Logger;
import org.hcpn.exceptions.CyclicHierarchyException;
import org.hcpn.exceptions.DuplicateSubstitutionException;
import org.hcpn.exceptions.HierarchyException;
import org.hcpn.exceptions.UnknownModuleException;
import org.hcpn.exceptions.UnknownPlaceException;
import org.hcpn.exceptions.UnknownTransitionException;
import org.hcpn.net.Arc;
import org.hcpn.net.NetModule;

/**
 * Substitution Table
 * 
 * Maps (parent module, substitution transition) to the child module that
 * realises the transition. Every link is checked when it is added:
 * 
 * - both modules registered, the transition exists in the parent
 * - at most one child per (parent, transition)
 * - explicit port bindings name real sockets and ports
 * - the module-substitution graph stays acyclic (reachability from the
 *   child back to the parent through the links already present)
 * 
 * A rejected link leaves the table untouched.
 */
public class SubstitutionTable {
    private static final Logger logger = Logger.getLogger(SubstitutionTable.class);
    
    private final ModuleRegistry registry;
    private final Map<Key, SubstitutionLink> links = new LinkedHashMap<>();
    
    private static final class Key {
        final String module;
        final String transition;
        
        Key(String module, String transition) {
            this.module = module;
            this.transition = transition;
        }
        
        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Key)) return false;
            Key that = (Key) o;
            return module.equals(that.module) && transition.equals(that.transition);
        }
        
        @Override
        public int hashCode() {
            return Objects.hash(module, transition);
        }
    }
    
    public SubstitutionTable(ModuleRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry cannot be null");
    }
    
    // ========== Registration ==========
    
    public SubstitutionLink link(String parentModule, String parentTransition, String childModule) 
            throws HierarchyException {
        return link(parentModule, parentTransition, childModule, Collections.emptyList());
    }
    
    public SubstitutionLink link(String parentModule, String parentTransition, String childModule,
                                 Collection<PortBinding> portBindings) throws HierarchyException {
        Objects.requireNonNull(parentTransition, "parentTransition cannot be null");
        NetModule parent = registry.lookup(parentModule);
        NetModule child = registry.lookup(childModule);
        
        if (!parent.hasTransition(parentTransition)) {
            throw new UnknownTransitionException(parentModule, parentTransition);
        }
        
        Key key = new Key(parentModule, parentTransition);
        SubstitutionLink existing = links.get(key);
        if (existing != null) {
            throw new DuplicateSubstitutionException(parentModule, parentTransition, existing.childModule);
        }
        
        checkPortBindings(parentModule, parent, parentTransition, childModule, child, portBindings);
        
        List<String> path = findSubstitutionPath(childModule, parentModule);
        if (path != null) {
            List<String> cycle = new ArrayList<>();
            cycle.add(parentModule);
            cycle.addAll(path);
            logger.warn("Rejected cyclic substitution " + parentModule + "." + parentTransition 
                    + " -> " + childModule);
            throw new CyclicHierarchyException(parentModule, parentTransition, cycle);
        }
        
        SubstitutionLink link = new SubstitutionLink(parentModule, parentTransition, childModule, portBindings);
        links.put(key, link);
        logger.info("Substitution " + link + " registered");
        return link;
    }
    
    private void checkPortBindings(String parentModule, NetModule parent, String transition,
                                   String childModule, NetModule child,
                                   Collection<PortBinding> portBindings) throws UnknownPlaceException {
        for (PortBinding binding : portBindings) {
            if (!parent.hasPlace(binding.socketPlace)) {
                throw new UnknownPlaceException(parentModule, binding.socketPlace);
            }
            if (!isSocket(parent, transition, binding)) {
                throw new UnknownPlaceException(parentModule, binding.socketPlace,
                        "is not an " + binding.kind.name().toLowerCase() + " socket of " + transition);
            }
            if (!child.hasPlace(binding.portPlace)) {
                throw new UnknownPlaceException(childModule, binding.portPlace);
            }
        }
    }
    
    static boolean isSocket(NetModule parent, String transition, PortBinding binding) {
        List<Arc> arcs = binding.kind == PortBinding.Kind.INPUT 
                ? parent.getInputArcs(transition) 
                : parent.getOutputArcs(transition);
        for (Arc arc : arcs) {
            if (arc.place.equals(binding.socketPlace)) {
                return true;
            }
        }
        return false;
    }
    
    /**
     * Module path from {@code from} to {@code to} following substitution
     * links (parent to child), or null when {@code to} is unreachable. A
     * module reaches itself with the path {@code [from]}.
     */
    List<String> findSubstitutionPath(String from, String to) {
        Deque<String> path = new ArrayDeque<>();
        if (search(from, to, new HashSet<>(), path)) {
            return new ArrayList<>(path);
        }
        return null;
    }
    
    private boolean search(String current, String target, Set<String> visited, Deque<String> path) {
        path.addLast(current);
        if (current.equals(target)) {
            return true;
        }
        if (visited.add(current)) {
            for (String child : childrenOf(current)) {
                if (search(child, target, visited, path)) {
                    return true;
                }
            }
        }
        path.removeLast();
        return false;
    }
    
    // ========== Queries ==========
    
    /**
     * Child module of a substitution transition; empty for an ordinary one.
     */
    public Optional<String> resolve(String parentModule, String parentTransition) {
        SubstitutionLink link = links.get(new Key(parentModule, parentTransition));
        return link != null ? Optional.of(link.childModule) : Optional.empty();
    }
    
    public boolean isSubstitution(String parentModule, String transition) {
        return links.containsKey(new Key(parentModule, transition));
    }
    
    public Optional<SubstitutionLink> getLink(String parentModule, String parentTransition) {
        return Optional.ofNullable(links.get(new Key(parentModule, parentTransition)));
    }
    
    /**
     * All links in registration order.
     */
    public List<SubstitutionLink> getLinks() {
        return Collections.unmodifiableList(new ArrayList<>(links.values()));
    }
    
    /**
     * Direct children of a module, in link order, without duplicates.
     */
    public List<String> childrenOf(String module) {
        Set<String> children = new LinkedHashSet<>();
        for (SubstitutionLink link : links.values()) {
            if (link.parentModule.equals(module)) {
                children.add(link.childModule);
            }
        }
        return new ArrayList<>(children);
    }
    
    public int size() {
        return links.size();
    }
}
