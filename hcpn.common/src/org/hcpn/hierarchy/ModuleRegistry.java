package org.hcpn.hierarchy;

import java.util.*;

import org.apache.log4j.Logger;
import org.hcpn.exceptions.DuplicateNameException;
import org.hcpn.exceptions.UnknownModuleException;
import org.hcpn.net.NetModule;

/**
 * Named modules of a hierarchy, in registration order.
 */
public class ModuleRegistry {
    private static final Logger logger = Logger.getLogger(ModuleRegistry.class);
    
    private final Map<String, NetModule> modules = new LinkedHashMap<>();
    
    /**
     * @throws DuplicateNameException if the name is taken; the registry is unchanged
     */
    public void register(String name, NetModule module) throws DuplicateNameException {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(module, "module cannot be null");
        if (name.trim().isEmpty()) {
            throw new IllegalArgumentException("Module name cannot be empty");
        }
        if (modules.containsKey(name)) {
            logger.warn("Rejected duplicate module name: " + name);
            throw new DuplicateNameException(name);
        }
        modules.put(name, module);
        logger.info("Registered module " + name + " (" + module.getPlaceNames().size() + " places, " 
                + module.getTransitionNames().size() + " transitions)");
    }
    
    public NetModule lookup(String name) throws UnknownModuleException {
        NetModule module = modules.get(name);
        if (module == null) {
            throw new UnknownModuleException(name);
        }
        return module;
    }
    
    public Optional<NetModule> find(String name) {
        return Optional.ofNullable(modules.get(name));
    }
    
    public boolean contains(String name) {
        return modules.containsKey(name);
    }
    
    /**
     * Registered names in insertion order.
     */
    public List<String> listModules() {
        return Collections.unmodifiableList(new ArrayList<>(modules.keySet()));
    }
    
    public int size() {
        return modules.size();
    }
}
