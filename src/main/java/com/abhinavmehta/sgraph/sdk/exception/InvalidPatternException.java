package com.abhinavmehta.sgraph.sdk.exception;

import java.util.Map;

/** Search pattern failed to compile as the declared pattern kind. */
public class InvalidPatternException extends SGraphException {
    public InvalidPatternException(String pattern, String reason) {
        super(ErrorKind.INVALID_PATTERN, "Invalid pattern '" + pattern + "': " + reason,
                Map.of("pattern", String.valueOf(pattern)));
    }

    public InvalidPatternException(String pattern, String reason, Throwable cause) {
        super(ErrorKind.INVALID_PATTERN, "Invalid pattern '" + pattern + "': " + reason,
                Map.of("pattern", String.valueOf(pattern)), cause);
    }
}
