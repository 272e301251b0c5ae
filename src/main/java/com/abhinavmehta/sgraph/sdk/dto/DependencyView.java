package com.abhinavmehta.sgraph.sdk.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Association reported by subtree analysis. {@code attributedFrom}/{@code attributedTo} are the
 * endpoints after depth-bounded attribution: an inside endpoint deeper than the analysis depth is
 * replaced by its nearest analyzed ancestor, an outside endpoint is reported as-is.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DependencyView {
    private String from;
    private String to;
    private String type;
    private Map<String, Object> attributes;
    private String attributedFrom;
    private String attributedTo;
}
