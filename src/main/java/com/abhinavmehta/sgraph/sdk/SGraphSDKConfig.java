package com.abhinavmehta.sgraph.sdk;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;

import java.util.concurrent.ExecutorService;

@Getter
@Builder
public class SGraphSDKConfig {
    @Builder.Default
    private long loadTimeoutSeconds = 60; // Upper bound for parsing + validating one model
    @Builder.Default
    private long queryTimeoutMillis = 0; // Per-query budget, 0 disables it
    @NonNull
    @Builder.Default
    private String externalSegmentName = "External"; // Path segment marking external-dependency subtrees
    @Builder.Default
    private int defaultOverviewDepth = 3;
    @Builder.Default
    private int loaderThreads = 2; // Size of the internal loader pool

    // Custom executor for model loading. If null, the SDK creates (and shuts down) its own.
    private ExecutorService executorService;

    public static SGraphSDKConfig defaults() {
        return SGraphSDKConfig.builder().build();
    }
}
