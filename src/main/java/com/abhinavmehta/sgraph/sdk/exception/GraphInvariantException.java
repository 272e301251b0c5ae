package com.abhinavmehta.sgraph.sdk.exception;

import java.util.Map;

/**
 * A loaded graph was found to break an invariant that load-time validation guarantees.
 * This is a defect in the SDK, not a caller error.
 */
public class GraphInvariantException extends SGraphException {
    public GraphInvariantException(String message, Map<String, ?> context) {
        super(ErrorKind.INTERNAL_ERROR, message, context);
    }
}
