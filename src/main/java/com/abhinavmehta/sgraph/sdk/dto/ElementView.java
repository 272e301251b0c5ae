package com.abhinavmehta.sgraph.sdk.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Element as exposed to callers. Field names are a compatibility contract.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ElementView {
    private String path;
    private String name;
    private String type;
    private Map<String, Object> attributes;
    private List<String> childPaths;
    private String parentPath; // null for the root
    private boolean external;
}
