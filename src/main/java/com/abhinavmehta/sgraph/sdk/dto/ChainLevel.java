package com.abhinavmehta.sgraph.sdk.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChainLevel {
    private int depth;
    private List<ChainStep> steps; // ordered by element path
}
