package org.hcpn.net;

import java.util.*;

/**
 * Token domain backed by a Java value type, optionally restricted to an
 * enumerated set of values.
 * 
 * Two value domains are compatible when they carry the same Java type and the
 * same enumeration (or both none). The display name is not part of the
 * comparison, so {@code colset A = int} and {@code colset B = int} fuse.
 */
public final class ValueDomain implements TokenDomain {
    
    public static final ValueDomain INT = new ValueDomain("INT", Integer.class, null);
    public static final ValueDomain STRING = new ValueDomain("STRING", String.class, null);
    public static final ValueDomain BOOL = new ValueDomain("BOOL", Boolean.class, null);
    public static final ValueDomain UNIT = new ValueDomain("UNIT", Unit.class, null);
    public static final ValueDomain ANY = new ValueDomain("ANY", Object.class, null);
    
    /** The single value of the UNIT domain. */
    public enum Unit { UNIT }
    
    private final String name;
    private final Class<?> valueType;
    private final Set<Object> values; // null when not enumerated
    
    private ValueDomain(String name, Class<?> valueType, Set<Object> values) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.valueType = Objects.requireNonNull(valueType, "valueType cannot be null");
        this.values = values;
    }
    
    public static ValueDomain of(String name, Class<?> valueType) {
        return new ValueDomain(name, valueType, null);
    }
    
    public static ValueDomain enumerated(String name, String... values) {
        if (values.length == 0) {
            throw new IllegalArgumentException("Enumerated domain " + name + " needs at least one value");
        }
        return new ValueDomain(name, String.class, 
                Collections.unmodifiableSet(new LinkedHashSet<>(Arrays.asList(values))));
    }
    
    @Override
    public String getName() {
        return name;
    }
    
    public Class<?> getValueType() {
        return valueType;
    }
    
    @Override
    public boolean accepts(Object value) {
        if (value == null || !valueType.isInstance(value)) {
            return false;
        }
        return values == null || values.contains(value);
    }
    
    @Override
    public boolean isCompatibleWith(TokenDomain other) {
        if (!(other instanceof ValueDomain)) {
            return false;
        }
        ValueDomain that = (ValueDomain) other;
        return valueType.equals(that.valueType) && Objects.equals(values, that.values);
    }
    
    @Override
    public String toString() {
        if (values != null) {
            return name + " = {" + String.join(", ", values.stream().map(String::valueOf).toArray(String[]::new)) + "}";
        }
        return name + " = " + valueType.getSimpleName();
    }
}
