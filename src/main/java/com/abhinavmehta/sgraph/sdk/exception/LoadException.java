package com.abhinavmehta.sgraph.sdk.exception;

import java.util.Map;

/** Source unreadable, malformed, or load timeout exceeded. The cache is left unchanged. */
public class LoadException extends SGraphException {
    public LoadException(String message) {
        super(ErrorKind.LOAD_ERROR, message);
    }

    public LoadException(String message, Throwable cause) {
        super(ErrorKind.LOAD_ERROR, message, cause);
    }

    public LoadException(String message, Map<String, ?> context, Throwable cause) {
        super(ErrorKind.LOAD_ERROR, message, context, cause);
    }
}
