package org.hcpn.net;

import java.util.*;
import java.util.function.Predicate;

import org.apache.log4j.Logger;

/**
 * ColouredNet - reference single-level engine
 * 
 * A small coloured Petri net implementation of {@link NetModule}, enough to
 * drive a hierarchy end to end:
 * 
 * - places carry a {@link TokenDomain} and a multiset of token values
 * - transitions carry an optional guard predicate over the binding
 * - arcs carry an {@link ArcInscription} (variables and constants)
 * 
 * Enabling is decided by a backtracking search over the tokens of the input
 * places, trying values in arrival order, so the first binding found is
 * reproducible. Time is not modelled.
 */
public class ColouredNet implements NetModule {
    private static final Logger logger = Logger.getLogger(ColouredNet.class);
    
    private final Map<String, Place> places = new LinkedHashMap<>();
    private final Map<String, Transition> transitions = new LinkedHashMap<>();
    private final List<Arc> arcs = new ArrayList<>();
    private final Map<Arc, ArcInscription> inscriptions = new HashMap<>();
    private final Marking marking = new Marking();
    
    // ========== Structure ==========
    
    public ColouredNet addPlace(String name, TokenDomain domain) {
        if (places.containsKey(name) || transitions.containsKey(name)) {
            throw new IllegalArgumentException("Duplicate node name: " + name);
        }
        places.put(name, new Place(name, domain));
        marking.getTokens(name);
        return this;
    }
    
    public ColouredNet addTransition(String name) {
        return addTransition(new Transition(name));
    }
    
    public ColouredNet addTransition(String name, Predicate<Map<String, Object>> guard, String guardText) {
        return addTransition(new Transition(name, guard, guardText));
    }
    
    public ColouredNet addTransition(Transition transition) {
        if (places.containsKey(transition.name) || transitions.containsKey(transition.name)) {
            throw new IllegalArgumentException("Duplicate node name: " + transition.name);
        }
        transitions.put(transition.name, transition);
        return this;
    }
    
    /**
     * Add an arc; direction follows from which end is a place.
     */
    public ColouredNet addArc(String source, String target, String expression) {
        Arc arc;
        if (places.containsKey(source) && transitions.containsKey(target)) {
            arc = new Arc(source, target, expression, Arc.Direction.PLACE_TO_TRANSITION);
        } else if (transitions.containsKey(source) && places.containsKey(target)) {
            arc = new Arc(target, source, expression, Arc.Direction.TRANSITION_TO_PLACE);
        } else {
            throw new IllegalArgumentException("Arc must connect a place and a transition: " 
                    + source + " -> " + target);
        }
        inscriptions.put(arc, ArcInscription.parse(arc.expression));
        arcs.add(arc);
        return this;
    }
    
    public ColouredNet addTokens(String placeName, Object... values) {
        Place place = requirePlace(placeName);
        for (Object value : values) {
            if (!place.domain.accepts(value)) {
                throw new IllegalArgumentException("Value " + value + " not in colour set " + place.domain);
            }
        }
        marking.addTokens(placeName, Arrays.asList(values));
        return this;
    }
    
    public Place getPlace(String name) {
        return places.get(name);
    }
    
    public Transition getTransition(String name) {
        return transitions.get(name);
    }
    
    // ========== NetModule ==========
    
    @Override
    public List<String> getPlaceNames() {
        return Collections.unmodifiableList(new ArrayList<>(places.keySet()));
    }
    
    @Override
    public List<String> getTransitionNames() {
        return Collections.unmodifiableList(new ArrayList<>(transitions.keySet()));
    }
    
    @Override
    public List<Arc> getArcs() {
        return Collections.unmodifiableList(arcs);
    }
    
    @Override
    public TokenDomain getDomain(String placeName) {
        return requirePlace(placeName).domain;
    }
    
    @Override
    public Marking getMarking() {
        return marking;
    }
    
    @Override
    public Optional<Binding> findBinding(String transitionName) {
        Transition transition = requireTransition(transitionName);
        
        List<String> termPlaces = new ArrayList<>();
        List<ArcInscription.Term> terms = new ArrayList<>();
        Map<String, Multiset> working = new LinkedHashMap<>();
        for (Arc arc : getInputArcs(transitionName)) {
            for (ArcInscription.Term term : inscriptions.get(arc).getTerms()) {
                termPlaces.add(arc.place);
                terms.add(term);
            }
            working.computeIfAbsent(arc.place, p -> marking.getTokens(p).copy());
        }
        
        Map<String, List<Object>> consumed = new LinkedHashMap<>();
        Binding binding = search(transition, termPlaces, terms, 0, new LinkedHashMap<>(), working, consumed);
        if (binding != null) {
            logger.debug("Transition " + transitionName + " enabled with " + binding);
        }
        return Optional.ofNullable(binding);
    }
    
    private Binding search(Transition transition, List<String> termPlaces, List<ArcInscription.Term> terms,
                           int index, Map<String, Object> vars, Map<String, Multiset> working,
                           Map<String, List<Object>> consumed) {
        if (index == terms.size()) {
            if (transition.evaluateGuard(vars)) {
                return new Binding(vars, consumed);
            }
            return null;
        }
        
        String placeName = termPlaces.get(index);
        ArcInscription.Term term = terms.get(index);
        Multiset available = working.get(placeName);
        
        List<Object> candidates;
        boolean binds = term.isVariable() && !vars.containsKey(term.variable);
        if (binds) {
            candidates = available.distinctValues();
        } else {
            Object required = term.evaluate(vars);
            candidates = available.contains(required) ? List.of(required) : List.of();
        }
        
        for (Object value : candidates) {
            available.remove(value);
            consumed.computeIfAbsent(placeName, p -> new ArrayList<>()).add(value);
            if (binds) {
                vars.put(term.variable, value);
            }
            
            Binding found = search(transition, termPlaces, terms, index + 1, vars, working, consumed);
            
            if (binds) {
                vars.remove(term.variable);
            }
            List<Object> taken = consumed.get(placeName);
            taken.remove(taken.size() - 1);
            if (taken.isEmpty()) {
                consumed.remove(placeName);
            }
            available.add(value);
            
            if (found != null) {
                return found;
            }
        }
        return null;
    }
    
    @Override
    public void fire(String transitionName, Binding binding) {
        Transition transition = requireTransition(transitionName);
        if (!transition.evaluateGuard(binding.getVariables())) {
            throw new IllegalStateException("Guard of " + transitionName + " rejects " + binding.getVariables());
        }
        for (Map.Entry<String, List<Object>> entry : binding.getConsumed().entrySet()) {
            if (!marking.getTokens(entry.getKey()).containsAll(entry.getValue())) {
                throw new IllegalStateException("Transition " + transitionName 
                        + " is not enabled under " + binding);
            }
        }
        
        // Produced tokens are checked before the marking changes
        Map<String, List<Object>> produced = new LinkedHashMap<>();
        for (Arc arc : getOutputArcs(transitionName)) {
            List<Object> values = inscriptions.get(arc).evaluate(binding.getVariables());
            Place target = places.get(arc.place);
            for (Object value : values) {
                if (!target.domain.accepts(value)) {
                    throw new IllegalStateException("Value " + value + " produced by " + transitionName
                            + " is not in colour set " + target.domain + " of " + target.name);
                }
            }
            produced.computeIfAbsent(arc.place, p -> new ArrayList<>()).addAll(values);
        }

        // Remove tokens
        for (Map.Entry<String, List<Object>> entry : binding.getConsumed().entrySet()) {
            marking.removeTokens(entry.getKey(), entry.getValue());
        }

        // Produce tokens
        for (Map.Entry<String, List<Object>> entry : produced.entrySet()) {
            marking.addTokens(entry.getKey(), entry.getValue());
        }
        logger.debug("Fired " + transitionName + " with " + binding.getVariables());
    }
    
    // ========== Helpers ==========
    
    private Place requirePlace(String name) {
        Place place = places.get(name);
        if (place == null) {
            throw new IllegalArgumentException("Unknown place: " + name);
        }
        return place;
    }
    
    private Transition requireTransition(String name) {
        Transition transition = transitions.get(name);
        if (transition == null) {
            throw new IllegalArgumentException("Unknown transition: " + name);
        }
        return transition;
    }
    
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("ColouredNet(\n  Places:");
        for (Place place : places.values()) {
            sb.append("\n    ").append(place);
        }
        sb.append("\n  Transitions:");
        for (Transition transition : transitions.values()) {
            sb.append("\n    ").append(transition);
        }
        sb.append("\n  Arcs:");
        for (Arc arc : arcs) {
            sb.append("\n    ").append(arc);
        }
        return sb.append("\n)").toString();
    }
}
