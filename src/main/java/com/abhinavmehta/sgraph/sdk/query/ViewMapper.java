package com.abhinavmehta.sgraph.sdk.query;

import com.abhinavmehta.sgraph.sdk.dto.AssociationView;
import com.abhinavmehta.sgraph.sdk.dto.DependencyView;
import com.abhinavmehta.sgraph.sdk.dto.ElementView;
import com.abhinavmehta.sgraph.sdk.model.Association;
import com.abhinavmehta.sgraph.sdk.model.AttributeValue;
import com.abhinavmehta.sgraph.sdk.model.Element;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts model objects to the views exposed across the SDK boundary.
 */
public final class ViewMapper {

    private ViewMapper() {
    }

    public static ElementView toView(Element element) {
        List<String> childPaths = new ArrayList<>(element.getChildren().size());
        for (Element child : element.getChildren()) {
            childPaths.add(child.getPath());
        }
        return ElementView.builder()
                .path(element.getPath())
                .name(element.getName())
                .type(element.getType())
                .attributes(toJava(element.getAttributes()))
                .childPaths(childPaths)
                .parentPath(element.getParent() == null ? null : element.getParent().getPath())
                .external(element.isExternal())
                .build();
    }

    public static List<ElementView> toViews(List<Element> elements) {
        List<ElementView> views = new ArrayList<>(elements.size());
        for (Element element : elements) {
            views.add(toView(element));
        }
        return views;
    }

    public static AssociationView toView(Association association) {
        return AssociationView.builder()
                .from(association.getFromPath())
                .to(association.getToPath())
                .type(association.getType())
                .attributes(toJava(association.getAttributes()))
                .build();
    }

    public static List<AssociationView> toAssociationViews(List<Association> associations) {
        List<AssociationView> views = new ArrayList<>(associations.size());
        for (Association association : associations) {
            views.add(toView(association));
        }
        return views;
    }

    static DependencyView toDependencyView(Association association, Element attributedFrom, Element attributedTo) {
        return DependencyView.builder()
                .from(association.getFromPath())
                .to(association.getToPath())
                .type(association.getType())
                .attributes(toJava(association.getAttributes()))
                .attributedFrom(attributedFrom.getPath())
                .attributedTo(attributedTo.getPath())
                .build();
    }

    private static Map<String, Object> toJava(Map<String, AttributeValue> attributes) {
        Map<String, Object> values = new LinkedHashMap<>();
        attributes.forEach((name, value) -> values.put(name, value.toJavaValue()));
        return values;
    }
}
