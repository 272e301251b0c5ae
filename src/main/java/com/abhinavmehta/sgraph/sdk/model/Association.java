package com.abhinavmehta.sgraph.sdk.model;

import java.util.Collections;
import java.util.Map;

/** Directed, typed edge between two elements of the same graph. */
public final class Association {
    private final Element from;
    private final Element to;
    private final String type;
    private final Map<String, AttributeValue> attributes;

    Association(Element from, Element to, String type, Map<String, AttributeValue> attributes) {
        this.from = from;
        this.to = to;
        this.type = type;
        this.attributes = Collections.unmodifiableMap(attributes);
    }

    public Element getFrom() {
        return from;
    }

    public Element getTo() {
        return to;
    }

    public String getFromPath() {
        return from.getPath();
    }

    public String getToPath() {
        return to.getPath();
    }

    public String getType() {
        return type;
    }

    public Map<String, AttributeValue> getAttributes() {
        return attributes;
    }

    public boolean isSelfLoop() {
        return from == to;
    }

    @Override
    public String toString() {
        return from.getPath() + " -[" + type + "]-> " + to.getPath();
    }
}
