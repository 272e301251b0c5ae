package com.abhinavmehta.sgraph.sdk.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Base runtime exception of the SDK. Carries a stable {@link ErrorKind}, a human readable
 * message and an optional, unmodifiable context map.
 */
public class SGraphException extends RuntimeException {
    private final ErrorKind kind;
    private final Map<String, Object> context;

    public SGraphException(ErrorKind kind, String message) {
        this(kind, message, Collections.emptyMap(), null);
    }

    public SGraphException(ErrorKind kind, String message, Throwable cause) {
        this(kind, message, Collections.emptyMap(), cause);
    }

    public SGraphException(ErrorKind kind, String message, Map<String, ?> context) {
        this(kind, message, context, null);
    }

    public SGraphException(ErrorKind kind, String message, Map<String, ?> context, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
        this.context = copy(context);
    }

    public ErrorKind getKind() {
        return kind;
    }

    public Map<String, Object> getContext() {
        return context;
    }

    private static Map<String, Object> copy(Map<String, ?> input) {
        if (input == null || input.isEmpty()) return Collections.emptyMap();
        Map<String, Object> m = new LinkedHashMap<>();
        input.forEach(m::put);
        return Collections.unmodifiableMap(m);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName()
                + "{kind=" + kind
                + ", message=" + getMessage()
                + (context.isEmpty() ? "" : ", context=" + context)
                + (getCause() == null ? "" : ", cause=" + getCause().getClass().getSimpleName())
                + '}';
    }
}
