package com.abhinavmehta.sgraph.sdk.loader;

import java.io.IOException;

/**
 * Produces a raw model from a source reference (a file or an archive).
 * Implementations only parse; validation and indexing happen in the cache.
 */
public interface ModelLoader {
    ModelDefinition load(String sourceRef) throws IOException;
}
