package io.github.nabilcarel.oapivalidator.model;

public enum ErrorKind {
    ROUTE_NOT_FOUND,
    SECURITY_REQUIREMENT_FAILED,
    REQUEST_CONFORMANCE_FAILED,
    VALIDATION_FAILED
}
