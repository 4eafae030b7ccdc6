package org.hcpn.net;

import java.util.*;

/**
 * Enabling binding of a transition: variable values plus the tokens the
 * firing consumes from each input place.
 */
public class Binding {
    
    private final Map<String, Object> variables;
    private final Map<String, List<Object>> consumed;
    
    public Binding(Map<String, Object> variables, Map<String, List<Object>> consumed) {
        this.variables = Collections.unmodifiableMap(new LinkedHashMap<>(variables));
        Map<String, List<Object>> copy = new LinkedHashMap<>();
        for (Map.Entry<String, List<Object>> entry : consumed.entrySet()) {
            copy.put(entry.getKey(), Collections.unmodifiableList(new ArrayList<>(entry.getValue())));
        }
        this.consumed = Collections.unmodifiableMap(copy);
    }
    
    public Map<String, Object> getVariables() {
        return variables;
    }
    
    /**
     * Input place name to the token values removed from it, in arc order.
     */
    public Map<String, List<Object>> getConsumed() {
        return consumed;
    }
    
    @Override
    public String toString() {
        return "Binding{vars=" + variables + ", consumed=" + consumed + "}";
    }
}
