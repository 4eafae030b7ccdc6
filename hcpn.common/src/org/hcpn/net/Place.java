package org.hcpn.net;

import java.util.Objects;

public class Place {
    public final String name;
    public final TokenDomain domain;
    
    public Place(String name, TokenDomain domain) {
        this.name = Objects.requireNonNull(name, "name cannot be null");
        this.domain = Objects.requireNonNull(domain, "domain cannot be null");
    }
    
    @Override
    public String toString() {
        return String.format("Place{name=%s, domain=%s}", name, domain.getName());
    }
}
