package com.abhinavmehta.sgraph.sdk.dto;

/**
 * Defines the data type of an element or association attribute value.
 */
public enum AttributeType {
    STRING,
    NUMBER,
    BOOLEAN
}
