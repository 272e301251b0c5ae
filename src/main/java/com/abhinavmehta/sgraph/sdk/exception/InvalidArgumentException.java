package com.abhinavmehta.sgraph.sdk.exception;

/** Malformed query parameter. */
public class InvalidArgumentException extends SGraphException {
    public InvalidArgumentException(String message) {
        super(ErrorKind.INVALID_ARGUMENT, message);
    }

    protected InvalidArgumentException(ErrorKind kind, String message) {
        super(kind, message);
    }

    public static InvalidArgumentException invalidDirection(String direction) {
        return new InvalidArgumentException(ErrorKind.INVALID_DIRECTION,
                "Invalid direction '" + direction + "'. Must be one of: incoming, outgoing");
    }
}
