package com.abhinavmehta.sgraph.sdk.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Associations touching a subtree, partitioned into internal, incoming and outgoing.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubtreeDependencies {
    private String rootPath;
    private boolean includeExternal;
    private Integer maxDepth;
    private List<ElementView> subtreeElements;
    private List<DependencyView> internalDependencies;
    private List<DependencyView> incomingDependencies;
    private List<DependencyView> outgoingDependencies;
    private int internalCount;
    private int incomingCount;
    private int outgoingCount;
}
