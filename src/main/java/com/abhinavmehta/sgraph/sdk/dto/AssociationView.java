package com.abhinavmehta.sgraph.sdk.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Association as exposed to callers. Field names are a compatibility contract.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AssociationView {
    private String from;
    private String to;
    private String type;
    private Map<String, Object> attributes;
}
