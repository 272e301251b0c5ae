package com.abhinavmehta.sgraph.sdk.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * One element of a model overview. Count fields are only set when counts were requested.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OverviewNode {
    private String name;
    private String path;
    private String type;
    private int depth;
    private int childCount;
    private boolean truncated; // has children beyond the depth bound
    private Integer descendantCount;
    private Map<String, Integer> descendantTypeCounts;
    private Integer incomingCount;
    private Integer outgoingCount;
    @Builder.Default
    private List<OverviewNode> children = new ArrayList<>();
}
