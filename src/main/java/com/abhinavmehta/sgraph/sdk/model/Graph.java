package com.abhinavmehta.sgraph.sdk.model;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Fully built, immutable model: root element, its descendants, the associations among them
 * and the path index.
 */
public final class Graph {
    private final Element root;
    private final List<Association> associations;
    private final PathIndex index;

    Graph(Element root, List<Association> associations, PathIndex index) {
        this.root = root;
        this.associations = Collections.unmodifiableList(associations);
        this.index = index;
    }

    public Element getRoot() {
        return root;
    }

    public List<Association> getAssociations() {
        return associations;
    }

    public PathIndex getIndex() {
        return index;
    }

    public Element resolve(String path) {
        return index.resolve(path);
    }

    public Optional<Element> find(String path) {
        return index.find(path);
    }

    public int getElementCount() {
        return index.size();
    }

    public int getAssociationCount() {
        return associations.size();
    }
}
