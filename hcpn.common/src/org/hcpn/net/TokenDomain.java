package org.hcpn.net;

/**
 * Colour set of a place: the domain its token values are drawn from.
 * 
 * The hierarchy never looks inside a token value. It only asks a domain
 * whether it accepts a value and whether two places may share one marking.
 */
public interface TokenDomain {
    
    String getName();
    
    boolean accepts(Object value);
    
    /**
     * Domain-equality check used when fusing places across modules.
     */
    boolean isCompatibleWith(TokenDomain other);
}
