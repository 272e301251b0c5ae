package com.abhinavmehta.sgraph.sdk.exception;

import java.util.Map;

/** Scope path does not resolve. Distinct from a scope that resolved but matched nothing. */
public class ScopeNotFoundException extends SGraphException {
    public ScopeNotFoundException(String scopePath) {
        super(ErrorKind.NOT_FOUND, "Scope path not found: " + scopePath, Map.of("scopePath", String.valueOf(scopePath)));
    }
}
