package com.abhinavmehta.sgraph.sdk.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SearchResult {
    private List<ElementView> elements;
    private int count;
    private boolean truncated; // maxResults cut the result short
    private String scopePath;
    private String query;
}
