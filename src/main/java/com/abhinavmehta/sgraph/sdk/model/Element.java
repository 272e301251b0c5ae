package com.abhinavmehta.sgraph.sdk.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Node of a loaded model, addressed by its unique slash-delimited path.
 * <p>
 * Instances are created and wired by {@link GraphBuilder}; once the owning {@link Graph} is
 * built they are never modified. The parent reference is a back-reference only.
 */
public final class Element {
    private final String path;
    private final String name;
    private final String type;
    private final Map<String, AttributeValue> attributes;
    private final Element parent;
    private final int depth;
    private final boolean external;

    private final List<Element> children = new ArrayList<>();
    private final List<Association> outgoing = new ArrayList<>();
    private final List<Association> incoming = new ArrayList<>();

    // pre-order position and subtree size, assigned by PathIndex
    private int preorderIndex = -1;
    private int subtreeSize = 1;

    Element(String path, String name, String type, Map<String, AttributeValue> attributes,
            Element parent, boolean external) {
        this.path = path;
        this.name = name;
        this.type = type;
        this.attributes = Collections.unmodifiableMap(attributes);
        this.parent = parent;
        this.depth = parent == null ? 0 : parent.depth + 1;
        this.external = external;
    }

    void addChild(Element child) {
        children.add(child);
    }

    void addOutgoing(Association association) {
        outgoing.add(association);
    }

    void addIncoming(Association association) {
        incoming.add(association);
    }

    void setPreorderIndex(int preorderIndex) {
        this.preorderIndex = preorderIndex;
    }

    void setSubtreeSize(int subtreeSize) {
        this.subtreeSize = subtreeSize;
    }

    public String getPath() {
        return path;
    }

    public String getName() {
        return name;
    }

    public String getType() {
        return type;
    }

    public Map<String, AttributeValue> getAttributes() {
        return attributes;
    }

    public Element getParent() {
        return parent;
    }

    public boolean isRoot() {
        return parent == null;
    }

    /** Hierarchy depth, the root being 0. */
    public int getDepth() {
        return depth;
    }

    /** True when the element lies in (or is) an external-dependency subtree. */
    public boolean isExternal() {
        return external;
    }

    public List<Element> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public List<Association> getOutgoing() {
        return Collections.unmodifiableList(outgoing);
    }

    public List<Association> getIncoming() {
        return Collections.unmodifiableList(incoming);
    }

    public int getPreorderIndex() {
        return preorderIndex;
    }

    /** Number of elements in the subtree rooted here, this element included. */
    public int getSubtreeSize() {
        return subtreeSize;
    }

    @Override
    public String toString() {
        return "Element{" + path + ", type=" + type + '}';
    }
}
