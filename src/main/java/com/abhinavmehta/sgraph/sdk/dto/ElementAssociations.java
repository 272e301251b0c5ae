package com.abhinavmehta.sgraph.sdk.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Direct associations of a single element; its children's associations are not included.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ElementAssociations {
    private String elementPath;
    private Direction direction;
    private List<AssociationView> associations;
    private int count;
}
