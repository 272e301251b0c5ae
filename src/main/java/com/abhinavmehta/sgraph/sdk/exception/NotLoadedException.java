package com.abhinavmehta.sgraph.sdk.exception;

import java.util.Map;

/** Unknown or evicted model identifier. */
public class NotLoadedException extends SGraphException {
    public NotLoadedException(String modelId) {
        super(ErrorKind.NOT_LOADED, "Model not loaded: " + modelId, Map.of("modelId", String.valueOf(modelId)));
    }
}
