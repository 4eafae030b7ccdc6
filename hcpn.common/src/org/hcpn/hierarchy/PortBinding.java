package org.hcpn.hierarchy;

import java.util.Objects;

/**
 * Binds a socket place of the parent (connected to the substitution
 * transition) to a port place of the child module.
 */
public final class PortBinding {
    
    public enum Kind {
        /** Parent input socket to child entry port. */
        INPUT,
        /** Child exit port to parent output socket. */
        OUTPUT
    }
    
    public final Kind kind;
    public final String socketPlace;
    public final String portPlace;
    
    private PortBinding(Kind kind, String socketPlace, String portPlace) {
        this.kind = Objects.requireNonNull(kind, "kind cannot be null");
        this.socketPlace = Objects.requireNonNull(socketPlace, "socketPlace cannot be null");
        this.portPlace = Objects.requireNonNull(portPlace, "portPlace cannot be null");
    }
    
    public static PortBinding input(String socketPlace, String entryPort) {
        return new PortBinding(Kind.INPUT, socketPlace, entryPort);
    }
    
    public static PortBinding output(String socketPlace, String exitPort) {
        return new PortBinding(Kind.OUTPUT, socketPlace, exitPort);
    }
    
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        PortBinding that = (PortBinding) o;
        return kind == that.kind && socketPlace.equals(that.socketPlace) && portPlace.equals(that.portPlace);
    }
    
    @Override
    public int hashCode() {
        return Objects.hash(kind, socketPlace, portPlace);
    }
    
    @Override
    public String toString() {
        return kind == Kind.INPUT 
                ? "PortBinding{" + socketPlace + " => " + portPlace + "}"
                : "PortBinding{" + portPlace + " => " + socketPlace + "}";
    }
}
