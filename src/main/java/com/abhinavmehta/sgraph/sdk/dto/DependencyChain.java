package com.abhinavmehta.sgraph.sdk.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Breadth-first expansion of associations from a start element.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DependencyChain {
    private String rootElement;
    private Direction direction;
    private Integer maxDepth;
    private List<ChainLevel> levels;
    /** Every association followed from an expanded element, in expansion order. */
    private List<AssociationView> associations;
    private int visitedCount;
    private boolean depthLimitReached;
}
