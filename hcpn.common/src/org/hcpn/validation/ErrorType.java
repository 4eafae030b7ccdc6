package org.hcpn.validation;

public enum ErrorType {
    UNKNOWN_MODULE,
    UNKNOWN_TRANSITION,
    UNKNOWN_PLACE,
    DUPLICATE_SUBSTITUTION,
    CYCLIC_HIERARCHY,
    PLACE_ALREADY_FUSED,
    DOMAIN_MISMATCH,
    UNDERSIZED_FUSION
}
