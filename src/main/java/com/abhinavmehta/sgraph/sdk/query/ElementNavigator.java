package com.abhinavmehta.sgraph.sdk.query;

import com.abhinavmehta.sgraph.sdk.dto.Direction;
import com.abhinavmehta.sgraph.sdk.dto.ElementAssociations;
import com.abhinavmehta.sgraph.sdk.dto.ElementLookup;
import com.abhinavmehta.sgraph.sdk.dto.ElementLookupResult;
import com.abhinavmehta.sgraph.sdk.dto.ElementView;
import com.abhinavmehta.sgraph.sdk.exception.ErrorKind;
import com.abhinavmehta.sgraph.sdk.exception.InvalidArgumentException;
import com.abhinavmehta.sgraph.sdk.model.Association;
import com.abhinavmehta.sgraph.sdk.model.Element;
import com.abhinavmehta.sgraph.sdk.model.Graph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Direct element access: single and batch lookups, root, and an element's own associations.
 */
public class ElementNavigator {
    private static final Logger log = LoggerFactory.getLogger(ElementNavigator.class);

    public ElementView getRootElement(Graph graph) {
        return ViewMapper.toView(graph.getRoot());
    }

    public ElementView getElement(Graph graph, String path) {
        return ViewMapper.toView(graph.resolve(path));
    }

    /**
     * Resolves every path independently. Unknown paths are reported inline as NOT_FOUND entries;
     * the batch itself never fails on them. A path repeated in the request is reported once, so
     * {@code foundCount + notFound.size()} equals the number of distinct paths.
     */
    public ElementLookupResult getElements(Graph graph, List<String> paths) {
        if (paths == null) {
            throw new InvalidArgumentException("Element paths must not be null");
        }
        log.debug("Getting multiple elements: {} paths", paths.size());
        Map<String, ElementLookup> lookups = new LinkedHashMap<>();
        List<String> notFound = new ArrayList<>();
        int found = 0;
        for (String path : paths) {
            if (lookups.containsKey(path)) {
                continue;
            }
            Optional<Element> element = graph.find(path);
            if (element.isPresent()) {
                lookups.put(path, ElementLookup.builder()
                        .path(path)
                        .found(true)
                        .element(ViewMapper.toView(element.get()))
                        .build());
                found++;
            } else {
                lookups.put(path, ElementLookup.builder()
                        .path(path)
                        .found(false)
                        .errorKind(ErrorKind.NOT_FOUND)
                        .message("Element not found: " + path)
                        .build());
                notFound.add(path);
            }
        }
        log.debug("Multiple elements retrieved: {}/{} found", found, paths.size());
        return ElementLookupResult.builder()
                .requestedCount(paths.size())
                .foundCount(found)
                .elements(lookups)
                .notFound(notFound)
                .build();
    }

    public ElementAssociations getAssociations(Graph graph, String path, Direction direction) {
        Element element = graph.resolve(path);
        List<Association> associations =
                direction == Direction.INCOMING ? element.getIncoming() : element.getOutgoing();
        return ElementAssociations.builder()
                .elementPath(element.getPath())
                .direction(direction)
                .associations(ViewMapper.toAssociationViews(associations))
                .count(associations.size())
                .build();
    }
}
