package com.abhinavmehta.sgraph.sdk.dto;

import com.abhinavmehta.sgraph.sdk.exception.ErrorKind;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome for one path of a batch retrieval: either the element or a not-found marker.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ElementLookup {
    private String path;
    private boolean found;
    private ElementView element;
    private ErrorKind errorKind;
    private String message;
}
