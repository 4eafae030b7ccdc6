package org.hcpn.net;

import java.util.*;
import java.util.function.Predicate;

/**
 * Transition of a {@link ColouredNet}. The guard is a predicate over the
 * variable binding; a transition without guard is always allowed to fire
 * once its input tokens are present.
 */
public class Transition {
    public final String name;
    public final Predicate<Map<String, Object>> guard;
    public final String guardText;
    
    public Transition(String name) {
        this(name, null, null);
    }
    
    public Transition(String name, Predicate<Map<String, Object>> guard, String guardText) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.guard = guard;
        this.guardText = guardText;
    }
    
    public boolean evaluateGuard(Map<String, Object> binding) {
        return guard == null || guard.test(Collections.unmodifiableMap(binding));
    }
    
    @Override
    public String toString() {
        return String.format("Transition{name=%s, guard=%s}", name, guardText != null ? guardText : "None");
    }
}
