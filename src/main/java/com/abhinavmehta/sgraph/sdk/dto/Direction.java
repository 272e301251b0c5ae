package com.abhinavmehta.sgraph.sdk.dto;

import com.abhinavmehta.sgraph.sdk.exception.InvalidArgumentException;

import java.util.Locale;

/**
 * Direction of a dependency chain walk.
 */
public enum Direction {
    /** Follow associations from -> to. */
    OUTGOING,
    /** Follow associations to -> from. */
    INCOMING;

    public static Direction fromString(String value) {
        if (value == null) {
            throw InvalidArgumentException.invalidDirection(null);
        }
        switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "outgoing":
                return OUTGOING;
            case "incoming":
                return INCOMING;
            default:
                throw InvalidArgumentException.invalidDirection(value);
        }
    }
}
