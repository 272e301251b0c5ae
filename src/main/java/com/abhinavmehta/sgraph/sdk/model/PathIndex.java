package com.abhinavmehta.sgraph.sdk.model;

import com.abhinavmehta.sgraph.sdk.exception.ElementNotFoundException;
import com.abhinavmehta.sgraph.sdk.exception.ScopeNotFoundException;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Path lookup and scope enumeration over one graph.
 * <p>
 * Built once by an iterative pre-order walk. Every element records its pre-order position and
 * subtree size, so the elements under a scope are a contiguous slice of the pre-order array.
 * A per-type array of sorted pre-order positions answers scoped type queries and per-type
 * counts by binary search, without visiting the subtree.
 */
public final class PathIndex {
    private static final int[] NO_POSITIONS = new int[0];

    private final Element root;
    private final Map<String, Element> byPath;
    private final List<Element> preorder;
    private final Map<String, int[]> typePositions;

    PathIndex(Element root) {
        this.root = root;
        List<Element> order = new ArrayList<>();
        Map<String, Element> paths = new HashMap<>();
        Map<String, List<Integer>> positions = new HashMap<>();

        Deque<Element> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Element element = stack.pop();
            element.setPreorderIndex(order.size());
            order.add(element);
            paths.put(element.getPath(), element);
            positions.computeIfAbsent(element.getType(), k -> new ArrayList<>()).add(element.getPreorderIndex());
            List<Element> children = element.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }

        // children follow their parent in pre-order, so a reverse sweep sees every child first
        for (int i = order.size() - 1; i >= 0; i--) {
            Element element = order.get(i);
            int size = 1;
            for (Element child : element.getChildren()) {
                size += child.getSubtreeSize();
            }
            element.setSubtreeSize(size);
        }

        Map<String, int[]> typeIndex = new HashMap<>();
        positions.forEach((type, list) -> typeIndex.put(type, list.stream().mapToInt(Integer::intValue).toArray()));

        this.byPath = Collections.unmodifiableMap(paths);
        this.preorder = Collections.unmodifiableList(Arrays.asList(order.toArray(new Element[0])));
        this.typePositions = Collections.unmodifiableMap(typeIndex);
    }

    /**
     * Canonical form of a caller-supplied path: trimmed, without trailing slash, with leading slash.
     */
    public static String normalize(String path) {
        if (path == null) {
            return null;
        }
        String p = path.trim();
        while (p.length() > 1 && p.endsWith("/")) {
            p = p.substring(0, p.length() - 1);
        }
        if (p.equals("/")) {
            return "";
        }
        if (!p.isEmpty() && !p.startsWith("/")) {
            p = "/" + p;
        }
        return p;
    }

    public Optional<Element> find(String path) {
        String normalized = normalize(path);
        if (normalized == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(byPath.get(normalized));
    }

    public Element resolve(String path) {
        return find(path).orElseThrow(() -> new ElementNotFoundException(path));
    }

    /**
     * Resolves a scope argument. A null or blank scope means the whole graph.
     *
     * @throws ScopeNotFoundException if the scope does not name an element
     */
    public Element resolveScope(String scopePath) {
        if (scopePath == null || scopePath.isBlank()) {
            return root;
        }
        return find(scopePath).orElseThrow(() -> new ScopeNotFoundException(scopePath));
    }

    /** Scope element followed by all its descendants, in pre-order. */
    public List<Element> elementsUnderScope(String scopePath) {
        return elementsUnderScope(resolveScope(scopePath));
    }

    public List<Element> elementsUnderScope(Element scope) {
        int start = scope.getPreorderIndex();
        return preorder.subList(start, start + scope.getSubtreeSize());
    }

    /** True when {@code element} is {@code scope} or one of its descendants. */
    public boolean contains(Element scope, Element element) {
        int start = scope.getPreorderIndex();
        int position = element.getPreorderIndex();
        return position >= start && position < start + scope.getSubtreeSize();
    }

    /** Elements of exactly {@code type} under {@code scope}, in pre-order. */
    public List<Element> elementsOfType(String type, Element scope) {
        int[] positions = typePositions.getOrDefault(type, NO_POSITIONS);
        int start = scope.getPreorderIndex();
        int from = lowerBound(positions, start);
        int to = lowerBound(positions, start + scope.getSubtreeSize());
        List<Element> result = new ArrayList<>(to - from);
        for (int i = from; i < to; i++) {
            result.add(preorder.get(positions[i]));
        }
        return result;
    }

    /**
     * Element count per type in the subtree rooted at {@code scope}, sorted by type.
     * Only the index is consulted; no element of the subtree is visited.
     */
    public Map<String, Integer> countByType(Element scope, boolean includeScope) {
        int start = scope.getPreorderIndex() + (includeScope ? 0 : 1);
        int end = scope.getPreorderIndex() + scope.getSubtreeSize();
        Map<String, Integer> counts = new TreeMap<>();
        if (start >= end) {
            return counts;
        }
        for (Map.Entry<String, int[]> entry : typePositions.entrySet()) {
            int[] positions = entry.getValue();
            int count = lowerBound(positions, end) - lowerBound(positions, start);
            if (count > 0) {
                counts.put(entry.getKey(), count);
            }
        }
        return counts;
    }

    public Set<String> types() {
        return typePositions.keySet();
    }

    public List<Element> preorder() {
        return preorder;
    }

    public int size() {
        return preorder.size();
    }

    private static int lowerBound(int[] sorted, int key) {
        int lo = 0;
        int hi = sorted.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (sorted[mid] < key) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }
}
