package com.abhinavmehta.sgraph.sdk.model;

import com.abhinavmehta.sgraph.sdk.exception.LoadException;
import com.abhinavmehta.sgraph.sdk.loader.AssociationDefinition;
import com.abhinavmehta.sgraph.sdk.loader.ElementDefinition;
import com.abhinavmehta.sgraph.sdk.loader.ModelDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Validates a {@link ModelDefinition} and turns it into an immutable, indexed {@link Graph}.
 * <p>
 * Any violation (missing root, blank, padded or slash-containing names, duplicate paths, a definition
 * node reached twice, unsupported attribute values, dangling association endpoints) fails the
 * whole build with a {@link LoadException}; no partially valid graph is ever returned.
 */
public class GraphBuilder {
    private static final Logger log = LoggerFactory.getLogger(GraphBuilder.class);

    private final String externalSegmentName;

    public GraphBuilder(String externalSegmentName) {
        this.externalSegmentName = externalSegmentName;
    }

    public Graph build(ModelDefinition definition) {
        if (definition == null || definition.getRoot() == null) {
            throw new LoadException("Model has no root element");
        }
        Element root = buildHierarchy(definition.getRoot());
        PathIndex index = new PathIndex(root);
        List<Association> associations = buildAssociations(definition.getAssociations(), index);
        log.debug("Built graph rooted at '{}': {} elements, {} associations",
                root.getPath(), index.size(), associations.size());
        return new Graph(root, associations, index);
    }

    private Element buildHierarchy(ElementDefinition rootDefinition) {
        Map<ElementDefinition, Boolean> seen = new IdentityHashMap<>();
        seen.put(rootDefinition, Boolean.TRUE);

        String rootName = rootDefinition.getName() == null ? "" : rootDefinition.getName();
        if (rootName.contains("/")) {
            throw new LoadException("Root element name must not contain '/': " + rootName);
        }
        if (!rootName.equals(rootName.strip())) {
            throw new LoadException("Root element name must not start or end with whitespace: '" + rootName + "'");
        }
        Element root = new Element(rootName.isEmpty() ? "" : "/" + rootName, rootName,
                typeOf(rootDefinition), attributesOf(rootDefinition.getAttributes(), rootName),
                null, isExternalSegment(rootName));

        Deque<Pending> stack = new ArrayDeque<>();
        pushChildren(stack, rootDefinition, root, seen);
        while (!stack.isEmpty()) {
            if (Thread.currentThread().isInterrupted()) {
                throw new LoadException("Model build interrupted under '" + stack.peek().parent.getPath() + "'");
            }
            Pending pending = stack.pop();
            ElementDefinition definition = pending.definition;
            Element parent = pending.parent;

            String name = definition.getName();
            if (name == null || name.isBlank()) {
                throw new LoadException("Element under '" + parent.getPath() + "' has no name");
            }
            if (name.contains("/")) {
                throw new LoadException("Element name must not contain '/': " + parent.getPath() + "/" + name);
            }
            if (!name.equals(name.strip())) {
                throw new LoadException("Element name must not start or end with whitespace: '"
                        + parent.getPath() + "/" + name + "'");
            }
            String path = parent.getPath() + "/" + name;
            if (!pending.siblingNames.add(name)) {
                throw new LoadException("Duplicate element path: " + path);
            }

            Element element = new Element(path, name, typeOf(definition),
                    attributesOf(definition.getAttributes(), path), parent,
                    parent.isExternal() || isExternalSegment(name));
            parent.addChild(element);
            pushChildren(stack, definition, element, seen);
        }
        return root;
    }

    private void pushChildren(Deque<Pending> stack, ElementDefinition definition, Element element,
                              Map<ElementDefinition, Boolean> seen) {
        List<ElementDefinition> children = definition.getChildren();
        if (children == null || children.isEmpty()) {
            return;
        }
        Set<String> siblingNames = new HashSet<>();
        // reversed so that children are popped, and attached, in declared order
        for (int i = children.size() - 1; i >= 0; i--) {
            ElementDefinition child = children.get(i);
            if (child == null) {
                throw new LoadException("Null child definition under '" + element.getPath() + "'");
            }
            if (seen.put(child, Boolean.TRUE) != null) {
                throw new LoadException("Cycle or shared node in element hierarchy under '" + element.getPath() + "'");
            }
            stack.push(new Pending(child, element, siblingNames));
        }
    }

    private List<Association> buildAssociations(List<AssociationDefinition> definitions, PathIndex index) {
        if (definitions == null || definitions.isEmpty()) {
            return new ArrayList<>();
        }
        List<Association> associations = new ArrayList<>(definitions.size());
        for (AssociationDefinition definition : definitions) {
            if (definition == null) {
                throw new LoadException("Null association definition");
            }
            Element from = endpoint(definition.getFrom(), "from", index);
            Element to = endpoint(definition.getTo(), "to", index);
            String type = definition.getType() == null ? "" : definition.getType();
            Association association = new Association(from, to, type,
                    attributesOf(definition.getAttributes(), from.getPath() + " -> " + to.getPath()));
            from.addOutgoing(association);
            to.addIncoming(association);
            associations.add(association);
        }
        return associations;
    }

    private Element endpoint(String path, String role, PathIndex index) {
        if (path == null || path.isBlank()) {
            throw new LoadException("Association has no '" + role + "' endpoint");
        }
        return index.find(path)
                .orElseThrow(() -> new LoadException("Association '" + role + "' endpoint does not exist: " + path));
    }

    private Map<String, AttributeValue> attributesOf(Map<String, Object> raw, String owner) {
        if (raw == null || raw.isEmpty()) {
            return Collections.emptyMap();
        }
        Map<String, AttributeValue> attributes = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : raw.entrySet()) {
            try {
                attributes.put(entry.getKey(), AttributeValue.of(entry.getValue()));
            } catch (IllegalArgumentException e) {
                throw new LoadException("Attribute '" + entry.getKey() + "' of '" + owner + "' is invalid: "
                        + e.getMessage(), e);
            }
        }
        return attributes;
    }

    private static String typeOf(ElementDefinition definition) {
        return definition.getType() == null ? "" : definition.getType();
    }

    private boolean isExternalSegment(String name) {
        return externalSegmentName != null && externalSegmentName.equals(name);
    }

    private static final class Pending {
        final ElementDefinition definition;
        final Element parent;
        final Set<String> siblingNames;

        Pending(ElementDefinition definition, Element parent, Set<String> siblingNames) {
            this.definition = definition;
            this.parent = parent;
            this.siblingNames = siblingNames;
        }
    }
}
