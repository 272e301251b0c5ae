package com.abhinavmehta.sgraph.sdk.loader;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.Singular;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AssociationDefinition {
    private String from;
    private String to;
    private String type;
    @Singular
    private Map<String, Object> attributes;
}
