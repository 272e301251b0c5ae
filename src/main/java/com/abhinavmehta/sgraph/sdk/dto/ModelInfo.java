package com.abhinavmehta.sgraph.sdk.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Load metadata of a cached model.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class ModelInfo {
    private String modelId;
    private String sourceRef;
    private String loadedAt; // ISO-8601 instant
    private long loadDurationMs;
    private int elementCount;
    private int associationCount;
    private String rootName;
    private int rootChildCount;
}
