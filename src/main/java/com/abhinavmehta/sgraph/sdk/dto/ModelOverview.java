package com.abhinavmehta.sgraph.sdk.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelOverview {
    private String rootPath;
    private int maxDepth;
    private boolean includeCounts;
    private OverviewNode tree;
    private int totalVisited;
    private Map<Integer, Integer> depthCounts;
    private Map<String, Integer> typeDistribution;
}
