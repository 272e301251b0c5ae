package com.abhinavmehta.sgraph.sdk.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Element newly reached at some depth of a chain, with the association that reached it.
 * Both {@code via} and {@code reachedFrom} are null for the start element.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChainStep {
    private ElementView element;
    private AssociationView via;
    private String reachedFrom;
}
