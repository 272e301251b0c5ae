package com.abhinavmehta.sgraph.sdk.exception;

/**
 * Stable, machine-checkable error kinds reported by the SDK.
 * User-input kinds are returned to callers as-is; {@link #INTERNAL_ERROR} marks a defect.
 */
public enum ErrorKind {
    LOAD_ERROR,
    NOT_LOADED,
    ELEMENT_NOT_FOUND,
    NOT_FOUND,
    INVALID_PATTERN,
    INVALID_DIRECTION,
    INVALID_ARGUMENT,
    QUERY_TIMEOUT,
    INTERNAL_ERROR;

    public boolean isDefect() {
        return this == INTERNAL_ERROR;
    }
}
