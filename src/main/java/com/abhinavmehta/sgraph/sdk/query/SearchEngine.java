package com.abhinavmehta.sgraph.sdk.query;

import com.abhinavmehta.sgraph.sdk.dto.PatternKind;
import com.abhinavmehta.sgraph.sdk.dto.SearchResult;
import com.abhinavmehta.sgraph.sdk.exception.InvalidArgumentException;
import com.abhinavmehta.sgraph.sdk.exception.InvalidPatternException;
import com.abhinavmehta.sgraph.sdk.model.AttributeValue;
import com.abhinavmehta.sgraph.sdk.model.Element;
import com.abhinavmehta.sgraph.sdk.model.Graph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Name, type and attribute search over a graph or a scoped subtree.
 * <p>
 * Arguments are validated (pattern compiled, scope resolved) before any element is examined.
 * Candidates come from the pre-order slice of the path index, so results are in pre-order.
 * External elements are never filtered out implicitly.
 */
public class SearchEngine {
    private static final Logger log = LoggerFactory.getLogger(SearchEngine.class);

    public SearchResult searchByName(Graph graph, String pattern, PatternKind kind, String type,
                                     String scopePath, Integer maxResults, QueryDeadline deadline) {
        log.debug("Searching elements by name: pattern='{}', kind={}, type='{}', scope='{}'",
                pattern, kind, type, scopePath);
        Pattern compiled = compile(pattern, kind == null ? PatternKind.REGEX : kind);
        Predicate<String> nameMatches = kind == PatternKind.GLOB
                ? name -> compiled.matcher(name).matches()
                : name -> compiled.matcher(name).find();
        Element scope = graph.getIndex().resolveScope(scopePath);

        Predicate<Element> predicate = element -> nameMatches.test(element.getName())
                && (type == null || type.equals(element.getType()));
        SearchResult result = collect(graph.getIndex().elementsUnderScope(scope), predicate, maxResults, deadline);
        result.setScopePath(scope.getPath());
        result.setQuery(pattern);
        log.debug("Found {} elements matching pattern '{}'", result.getCount(), pattern);
        return result;
    }

    public SearchResult searchByType(Graph graph, String type, String scopePath,
                                     Integer maxResults, QueryDeadline deadline) {
        log.debug("Getting elements by type: type='{}', scope='{}'", type, scopePath);
        if (type == null || type.isBlank()) {
            throw new InvalidArgumentException("Element type must not be blank");
        }
        Element scope = graph.getIndex().resolveScope(scopePath);

        List<Element> matches = graph.getIndex().elementsOfType(type, scope);
        SearchResult result = collect(matches, element -> true, maxResults, deadline);
        result.setScopePath(scope.getPath());
        result.setQuery(type);
        log.debug("Found {} elements of type '{}'", result.getCount(), type);
        return result;
    }

    /**
     * Elements carrying every given attribute with an equal value. An empty filter matches every
     * element in scope.
     */
    public SearchResult searchByAttributes(Graph graph, Map<String, AttributeValue> filters, String scopePath,
                                           Integer maxResults, QueryDeadline deadline) {
        log.debug("Searching elements by attributes: filters={}, scope='{}'", filters, scopePath);
        if (filters == null) {
            throw new InvalidArgumentException("Attribute filters must not be null");
        }
        Element scope = graph.getIndex().resolveScope(scopePath);

        Predicate<Element> predicate = element -> {
            Map<String, AttributeValue> attributes = element.getAttributes();
            for (Map.Entry<String, AttributeValue> filter : filters.entrySet()) {
                AttributeValue actual = attributes.get(filter.getKey());
                if (actual == null || !actual.equals(filter.getValue())) {
                    return false;
                }
            }
            return true;
        };
        SearchResult result = collect(graph.getIndex().elementsUnderScope(scope), predicate, maxResults, deadline);
        result.setScopePath(scope.getPath());
        result.setQuery(filters.toString());
        log.debug("Found {} elements matching attributes", result.getCount());
        return result;
    }

    static Pattern compile(String pattern, PatternKind kind) {
        if (pattern == null || pattern.isEmpty()) {
            throw new InvalidPatternException(String.valueOf(pattern), "pattern cannot be empty");
        }
        String regex = kind == PatternKind.GLOB ? globToRegex(pattern) : pattern;
        try {
            return Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            log.warn("Rejecting invalid {} pattern '{}': {}", kind, pattern, e.getDescription());
            throw new InvalidPatternException(pattern, e.getDescription(), e);
        }
    }

    /** '*' matches any run of characters, '?' exactly one; everything else is literal. */
    static String globToRegex(String glob) {
        StringBuilder regex = new StringBuilder(glob.length() + 8);
        StringBuilder literal = new StringBuilder();
        for (char c : glob.toCharArray()) {
            if (c == '*' || c == '?') {
                if (literal.length() > 0) {
                    regex.append(Pattern.quote(literal.toString()));
                    literal.setLength(0);
                }
                regex.append(c == '*' ? ".*" : ".");
            } else {
                literal.append(c);
            }
        }
        if (literal.length() > 0) {
            regex.append(Pattern.quote(literal.toString()));
        }
        return regex.toString();
    }

    private SearchResult collect(List<Element> candidates, Predicate<Element> predicate,
                                 Integer maxResults, QueryDeadline deadline) {
        int limit = maxResults == null || maxResults <= 0 ? Integer.MAX_VALUE : maxResults;
        List<Element> matches = new ArrayList<>();
        boolean truncated = false;
        for (Element candidate : candidates) {
            deadline.check();
            if (predicate.test(candidate)) {
                if (matches.size() == limit) {
                    truncated = true;
                    break;
                }
                matches.add(candidate);
            }
        }
        return SearchResult.builder()
                .elements(ViewMapper.toViews(matches))
                .count(matches.size())
                .truncated(truncated)
                .build();
    }
}
