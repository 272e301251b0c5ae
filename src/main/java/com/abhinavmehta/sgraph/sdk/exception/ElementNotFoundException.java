package com.abhinavmehta.sgraph.sdk.exception;

import java.util.Map;

/** Path does not resolve within a loaded graph. */
public class ElementNotFoundException extends SGraphException {
    public ElementNotFoundException(String path) {
        super(ErrorKind.ELEMENT_NOT_FOUND, "Element not found: " + path, Map.of("path", String.valueOf(path)));
    }
}
