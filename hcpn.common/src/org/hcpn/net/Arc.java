package org.hcpn.net;

import java.util.*;

/**
 * Arc between a place and a transition. The inscription is carried as text;
 * only the engine interprets it.
 */
public class Arc {
    
    public enum Direction {
        PLACE_TO_TRANSITION,
        TRANSITION_TO_PLACE
    }
    
    public final String place;
    public final String transition;
    public final String expression;
    public final Direction direction;
    
    public Arc(String place, String transition, String expression, Direction direction) {
        this.place = Objects.requireNonNull(place, "place cannot be null");
        this.transition = Objects.requireNonNull(transition, "transition cannot be null");
        this.expression = expression != null ? expression : "";
        this.direction = Objects.requireNonNull(direction, "direction cannot be null");
    }
    
    public boolean isInput() {
        return direction == Direction.PLACE_TO_TRANSITION;
    }
    
    public String getSource() {
        return isInput() ? place : transition;
    }
    
    public String getTarget() {
        return isInput() ? transition : place;
    }
    
    @Override
    public String toString() {
        return String.format("Arc{%s -> %s, expr=%s}", getSource(), getTarget(), expression);
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Arc that = (Arc) o;
        return place.equals(that.place) && transition.equals(that.transition) 
                && expression.equals(that.expression) && direction == that.direction;
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(place, transition, expression, direction);
    }
}
