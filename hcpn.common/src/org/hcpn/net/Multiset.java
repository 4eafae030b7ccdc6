package org.hcpn.net;

import java.util.*;

/**
 * Multiset of token values held by one place.
 * 
 * Tokens are kept in arrival order so that withdrawal (oldest first) and
 * rendering are deterministic. A multiset may be shared by several places
 * (fused places); it is then owned by the fusion class and every member place
 * reads and writes this one instance.
 */
public class Multiset {
    
    private final List<Object> tokens = new ArrayList<>();
    
    public Multiset() {
    }
    
    public Multiset(Collection<?> initial) {
        tokens.addAll(initial);
    }
    
    // ========== Mutation ==========
    
    public void add(Object value) {
        tokens.add(Objects.requireNonNull(value, "token value cannot be null"));
    }
    
    public void add(Object value, int count) {
        for (int i = 0; i < count; i++) {
            add(value);
        }
    }
    
    public void addAll(Collection<?> values) {
        for (Object value : values) {
            add(value);
        }
    }
    
    /**
     * Remove one occurrence of {@code value}.
     * 
     * @throws IllegalStateException if the value is not present
     */
    public void remove(Object value) {
        if (!tokens.remove(value)) {
            throw new IllegalStateException("Not enough tokens to remove: " + value + " not in " + this);
        }
    }
    
    public void removeAll(Collection<?> values) {
        if (!containsAll(values)) {
            throw new IllegalStateException("Not enough tokens to remove: " + values + " not in " + this);
        }
        for (Object value : values) {
            tokens.remove(value);
        }
    }
    
    /**
     * Withdraw the oldest token.
     * 
     * @throws NoSuchElementException if empty
     */
    public Object removeFirst() {
        if (tokens.isEmpty()) {
            throw new NoSuchElementException("Multiset is empty");
        }
        return tokens.remove(0);
    }
    
    /**
     * Replace the whole content, keeping this instance (and every view on it).
     */
    public void replaceWith(Collection<?> values) {
        tokens.clear();
        addAll(values);
    }
    
    public void clear() {
        tokens.clear();
    }
    
    // ========== Queries ==========
    
    public int size() {
        return tokens.size();
    }
    
    public boolean isEmpty() {
        return tokens.isEmpty();
    }
    
    public int count(Object value) {
        int n = 0;
        for (Object token : tokens) {
            if (token.equals(value)) {
                n++;
            }
        }
        return n;
    }
    
    public boolean contains(Object value) {
        return tokens.contains(value);
    }
    
    /**
     * Multiset inclusion: every value of {@code values} is present at least
     * as often as it occurs there.
     */
    public boolean containsAll(Collection<?> values) {
        Map<Object, Integer> needed = new LinkedHashMap<>();
        for (Object value : values) {
            needed.merge(value, 1, Integer::sum);
        }
        for (Map.Entry<Object, Integer> entry : needed.entrySet()) {
            if (count(entry.getKey()) < entry.getValue()) {
                return false;
            }
        }
        return true;
    }
    
    /**
     * Distinct values in order of first arrival.
     */
    public List<Object> distinctValues() {
        return new ArrayList<>(new LinkedHashSet<>(tokens));
    }
    
    public List<Object> getTokens() {
        return Collections.unmodifiableList(new ArrayList<>(tokens));
    }
    
    public Multiset copy() {
        return new Multiset(tokens);
    }
    
    /**
     * CPN multiset notation, e.g. {@code 2`5 ++ 1`7}; empty multisets render as
     * {@code empty}.
     */
    public String toNotation() {
        if (tokens.isEmpty()) {
            return "empty";
        }
        StringBuilder sb = new StringBuilder();
        for (Object value : distinctValues()) {
            if (sb.length() > 0) {
                sb.append(" ++ ");
            }
            sb.append(count(value)).append('`').append(formatValue(value));
        }
        return sb.toString();
    }
    
    private static String formatValue(Object value) {
        if (value instanceof String) {
            return "\"" + value + "\"";
        }
        return String.valueOf(value);
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Multiset)) return false;
        Multiset that = (Multiset) o;
        return tokens.size() == that.tokens.size() && containsAll(that.tokens);
    }
    
    @Override
    public int hashCode() {
        int h = 0;
        for (Object token : tokens) {
            h += token.hashCode();
        }
        return h;
    }
    
    @Override
    public String toString() {
        return tokens.toString().replace('[', '{').replace(']', '}');
    }
}
