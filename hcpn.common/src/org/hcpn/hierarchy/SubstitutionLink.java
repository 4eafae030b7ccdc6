package org.hcpn.hierarchy;

import java.util.*;

/**
 * Substitution of {@code parentTransition} in {@code parentModule} by the
 * child net {@code childModule}.
 * 
 * Sockets without an explicit port binding map to the child place of the
 * same name.
 */
public class SubstitutionLink {
    public final String parentModule;
    public final String parentTransition;
    public final String childModule;
    private final Map<String, String> entryPorts;
    private final Map<String, String> exitPorts;
    
    public SubstitutionLink(String parentModule, String parentTransition, String childModule,
                            Collection<PortBinding> portBindings) {
        this.parentModule = Objects.requireNonNull(parentModule, "parentModule cannot be null");
        this.parentTransition = Objects.requireNonNull(parentTransition, "parentTransition cannot be null");
        this.childModule = Objects.requireNonNull(childModule, "childModule cannot be null");
        
        Map<String, String> in = new LinkedHashMap<>();
        Map<String, String> out = new LinkedHashMap<>();
        for (PortBinding binding : portBindings) {
            Map<String, String> target = binding.kind == PortBinding.Kind.INPUT ? in : out;
            String previous = target.put(binding.socketPlace, binding.portPlace);
            if (previous != null && !previous.equals(binding.portPlace)) {
                throw new IllegalArgumentException("Socket " + binding.socketPlace 
                        + " bound twice: " + previous + " and " + binding.portPlace);
            }
        }
        this.entryPorts = Collections.unmodifiableMap(in);
        this.exitPorts = Collections.unmodifiableMap(out);
    }
    
    public String getEntryPort(String socketPlace) {
        return entryPorts.getOrDefault(socketPlace, socketPlace);
    }
    
    public String getExitPort(String socketPlace) {
        return exitPorts.getOrDefault(socketPlace, socketPlace);
    }
    
    public Map<String, String> getExplicitEntryPorts() {
        return entryPorts;
    }
    
    public Map<String, String> getExplicitExitPorts() {
        return exitPorts;
    }
    
    @Override
    public String toString() {
        return parentModule + "." + parentTransition + " -> " + childModule;
    }
}
