package org.hcpn.net;

import java.util.*;

/**
 * Contract between the hierarchy and a single-level net engine.
 * 
 * The hierarchy only needs the place and transition names, the arcs, the
 * token domain of each place, the live marking and the firing rule. Guards,
 * arc inscriptions and colour sets stay the engine's business.
 */
public interface NetModule {
    
    /** Place names in declaration order. */
    List<String> getPlaceNames();
    
    /** Transition names in declaration order. */
    List<String> getTransitionNames();
    
    List<Arc> getArcs();
    
    TokenDomain getDomain(String placeName);
    
    /**
     * Live marking; mutations are visible to the engine immediately.
     */
    Marking getMarking();
    
    /**
     * Find a binding under which the transition is enabled in the current
     * marking, or empty when it is not enabled.
     */
    Optional<Binding> findBinding(String transitionName);
    
    /**
     * Fire the transition with a binding previously returned by
     * {@link #findBinding(String)}.
     * 
     * @throws IllegalStateException if the binding no longer enables it
     */
    void fire(String transitionName, Binding binding);
    
    default boolean hasPlace(String placeName) {
        return getPlaceNames().contains(placeName);
    }
    
    default boolean hasTransition(String transitionName) {
        return getTransitionNames().contains(transitionName);
    }
    
    default List<Arc> getInputArcs(String transitionName) {
        List<Arc> result = new ArrayList<>();
        for (Arc arc : getArcs()) {
            if (arc.isInput() && arc.transition.equals(transitionName)) {
                result.add(arc);
            }
        }
        return result;
    }
    
    default List<Arc> getOutputArcs(String transitionName) {
        List<Arc> result = new ArrayList<>();
        for (Arc arc : getArcs()) {
            if (!arc.isInput() && arc.transition.equals(transitionName)) {
                result.add(arc);
            }
        }
        return result;
    }
    
    default boolean isEnabled(String transitionName) {
        return findBinding(transitionName).isPresent();
    }
    
    /**
     * Enabled transitions in declaration order.
     */
    default List<String> enabledTransitions() {
        List<String> enabled = new ArrayList<>();
        for (String transition : getTransitionNames()) {
            if (isEnabled(transition)) {
                enabled.add(transition);
            }
        }
        return enabled;
    }
}
