package com.abhinavmehta.sgraph.sdk.store;

import com.abhinavmehta.sgraph.sdk.dto.ModelInfo;
import com.abhinavmehta.sgraph.sdk.model.Graph;

import java.util.List;
import java.util.Optional;

public interface ModelCache {
    String load(String sourceRef); // returns the new model identifier
    Graph get(String modelId); // throws NotLoadedException
    Optional<Graph> find(String modelId);
    Optional<ModelInfo> getInfo(String modelId);
    boolean evict(String modelId); // idempotent, false if nothing was cached under the id
    List<ModelInfo> list();
    int clear();
    int size();
}
