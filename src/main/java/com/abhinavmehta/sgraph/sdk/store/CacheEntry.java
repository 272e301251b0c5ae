package com.abhinavmehta.sgraph.sdk.store;

import com.abhinavmehta.sgraph.sdk.dto.ModelInfo;
import com.abhinavmehta.sgraph.sdk.model.Graph;
import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class CacheEntry {
    private final String modelId;
    private final Graph graph;
    private final ModelInfo info;
}
