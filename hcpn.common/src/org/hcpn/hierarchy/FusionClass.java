package org.hcpn.hierarchy;

import java.util.*;

import org.hcpn.net.Multiset;
import org.hcpn.net.TokenDomain;

/**
 * Places of one or more modules that denote one logical place.
 * 
 * The class owns the single authoritative multiset; each member place's
 * marking is attached to it, so a token added through any member is seen by
 * all of them.
 */
public class FusionClass {
    public final String id;
    private final List<PlaceRef> members;
    private final TokenDomain domain;
    private final Multiset sharedTokens;
    
    FusionClass(String id, List<PlaceRef> members, TokenDomain domain, Multiset sharedTokens) {
        this.id = Objects.requireNonNull(id, "id cannot be null");
        this.members = Collections.unmodifiableList(new ArrayList<>(members));
        this.domain = domain;
        this.sharedTokens = sharedTokens;
    }
    
    public List<PlaceRef> getMembers() {
        return members;
    }
    
    public boolean contains(PlaceRef ref) {
        return members.contains(ref);
    }
    
    public TokenDomain getDomain() {
        return domain;
    }
    
    Multiset getSharedTokens() {
        return sharedTokens;
    }
    
    @Override
    public String toString() {
        return "FusionClass{" + id + ": " + members + "}";
    }
}
