package com.abhinavmehta.sgraph.sdk.dto;

import com.abhinavmehta.sgraph.sdk.exception.InvalidArgumentException;

import java.util.Locale;

/**
 * How a name search pattern is interpreted.
 */
public enum PatternKind {
    /** java.util.regex, matched anywhere in the name. */
    REGEX,
    /** '*' and '?' wildcards, matched against the whole name. */
    GLOB;

    public static PatternKind fromString(String value) {
        if (value == null || value.isBlank()) {
            return REGEX;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new InvalidArgumentException("Invalid pattern kind '" + value + "'. Must be one of: regex, glob");
        }
    }
}
