package com.abhinavmehta.sgraph.sdk.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ElementLookupResult {
    private int requestedCount;
    private int foundCount;
    private Map<String, ElementLookup> elements; // request order
    private List<String> notFound;
}
