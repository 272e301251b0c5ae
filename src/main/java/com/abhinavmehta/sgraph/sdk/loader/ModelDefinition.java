package com.abhinavmehta.sgraph.sdk.loader;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Raw model as produced by a {@link ModelLoader}, before validation and indexing.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ModelDefinition {
    private ElementDefinition root;
    @Builder.Default
    private List<AssociationDefinition> associations = new ArrayList<>();
}
