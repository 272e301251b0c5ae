package com.abhinavmehta.sgraph.sdk.query;

import com.abhinavmehta.sgraph.sdk.dto.AssociationView;
import com.abhinavmehta.sgraph.sdk.dto.ChainLevel;
import com.abhinavmehta.sgraph.sdk.dto.ChainStep;
import com.abhinavmehta.sgraph.sdk.dto.DependencyChain;
import com.abhinavmehta.sgraph.sdk.dto.DependencyView;
import com.abhinavmehta.sgraph.sdk.dto.Direction;
import com.abhinavmehta.sgraph.sdk.dto.SubtreeDependencies;
import com.abhinavmehta.sgraph.sdk.exception.GraphInvariantException;
import com.abhinavmehta.sgraph.sdk.model.Association;
import com.abhinavmehta.sgraph.sdk.model.Element;
import com.abhinavmehta.sgraph.sdk.model.Graph;
import com.abhinavmehta.sgraph.sdk.model.PathIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Dependency analysis over associations: subtree classification and breadth-first chains.
 * Both walks are iterative and depth-bounded; chains keep a visited set keyed by path because
 * association graphs may contain cycles.
 */
public class DependencyAnalyzer {
    private static final Logger log = LoggerFactory.getLogger(DependencyAnalyzer.class);

    /**
     * Partitions every association touching the subtree at {@code rootPath} into internal,
     * incoming and outgoing. Each association is reported exactly once.
     *
     * @param includeExternal when false, associations whose outside endpoint is external are dropped
     * @param maxDepth        levels below the root that are analyzed; null means unbounded,
     *                        negative is treated as 0
     */
    public SubtreeDependencies analyzeSubtree(Graph graph, String rootPath, boolean includeExternal,
                                              Integer maxDepth, QueryDeadline deadline) {
        log.debug("Analyzing subtree dependencies: root='{}', external={}, depth={}",
                rootPath, includeExternal, maxDepth);
        PathIndex index = graph.getIndex();
        Element scope = graph.resolve(rootPath);
        int limit = boundOf(maxDepth);

        List<Element> members = index.elementsUnderScope(scope);
        List<Element> analyzed = new ArrayList<>();
        List<DependencyView> internal = new ArrayList<>();
        List<DependencyView> incoming = new ArrayList<>();
        List<DependencyView> outgoing = new ArrayList<>();

        for (Element element : members) {
            deadline.check();
            if (element.getDepth() - scope.getDepth() <= limit) {
                analyzed.add(element);
            }
            Element attributed = attribute(element, scope, limit);

            for (Association association : element.getOutgoing()) {
                Element target = checkedEndpoint(graph, association, association.getTo());
                if (index.contains(scope, target)) {
                    internal.add(ViewMapper.toDependencyView(association, attributed, attribute(target, scope, limit)));
                } else if (includeExternal || !target.isExternal()) {
                    outgoing.add(ViewMapper.toDependencyView(association, attributed, target));
                }
            }
            for (Association association : element.getIncoming()) {
                Element source = checkedEndpoint(graph, association, association.getFrom());
                if (index.contains(scope, source)) {
                    continue; // already reported as internal from the source side
                }
                if (includeExternal || !source.isExternal()) {
                    incoming.add(ViewMapper.toDependencyView(association, source, attributed));
                }
            }
        }

        log.debug("Subtree analysis complete: {} elements, {} internal deps, {} incoming deps, {} outgoing deps",
                analyzed.size(), internal.size(), incoming.size(), outgoing.size());
        return SubtreeDependencies.builder()
                .rootPath(scope.getPath())
                .includeExternal(includeExternal)
                .maxDepth(maxDepth)
                .subtreeElements(ViewMapper.toViews(analyzed))
                .internalDependencies(internal)
                .incomingDependencies(incoming)
                .outgoingDependencies(outgoing)
                .internalCount(internal.size())
                .incomingCount(incoming.size())
                .outgoingCount(outgoing.size())
                .build();
    }

    /**
     * Breadth-first expansion from {@code elementPath}. Level 0 holds only the start element;
     * every later level lists the newly reached elements ordered by path, each with the association
     * that first reached it. The frontier is expanded in path order, associations in declaration order.
     *
     * @param maxDepth hop bound; null means unbounded, zero or negative returns the start element only
     */
    public DependencyChain dependencyChain(Graph graph, String elementPath, String direction,
                                           Integer maxDepth, QueryDeadline deadline) {
        log.debug("Analyzing dependency chain: element='{}', direction='{}', depth={}",
                elementPath, direction, maxDepth);
        Direction dir = Direction.fromString(direction);
        Element start = graph.resolve(elementPath);
        int limit = boundOf(maxDepth);

        Set<String> visited = new HashSet<>();
        visited.add(start.getPath());
        List<ChainLevel> levels = new ArrayList<>();
        List<AssociationView> followed = new ArrayList<>();
        levels.add(ChainLevel.builder()
                .depth(0)
                .steps(List.of(ChainStep.builder().element(ViewMapper.toView(start)).build()))
                .build());

        List<Element> frontier = List.of(start);
        int depth = 0;
        while (!frontier.isEmpty() && depth < limit) {
            List<Discovery> discovered = new ArrayList<>();
            for (Element current : frontier) {
                for (Association association : associationsOf(current, dir)) {
                    deadline.check();
                    Element next = checkedEndpoint(graph, association, neighbour(association, dir));
                    followed.add(ViewMapper.toView(association));
                    if (visited.add(next.getPath())) {
                        discovered.add(new Discovery(next, association, current));
                    }
                }
            }
            if (discovered.isEmpty()) {
                break;
            }
            depth++;
            discovered.sort(Comparator.comparing(d -> d.element.getPath()));
            List<ChainStep> steps = new ArrayList<>(discovered.size());
            List<Element> nextFrontier = new ArrayList<>(discovered.size());
            for (Discovery discovery : discovered) {
                steps.add(ChainStep.builder()
                        .element(ViewMapper.toView(discovery.element))
                        .via(ViewMapper.toView(discovery.association))
                        .reachedFrom(discovery.reachedFrom.getPath())
                        .build());
                nextFrontier.add(discovery.element);
            }
            levels.add(ChainLevel.builder().depth(depth).steps(steps).build());
            frontier = nextFrontier;
        }

        boolean limitReached = depth >= limit && hasUnvisitedNeighbour(frontier, dir, visited);
        log.debug("Dependency chain analysis complete: {} levels, {} elements, {} associations followed",
                levels.size(), visited.size(), followed.size());
        return DependencyChain.builder()
                .rootElement(start.getPath())
                .direction(dir)
                .maxDepth(maxDepth)
                .levels(levels)
                .associations(followed)
                .visitedCount(visited.size())
                .depthLimitReached(limitReached)
                .build();
    }

    private static boolean hasUnvisitedNeighbour(List<Element> frontier, Direction dir, Set<String> visited) {
        for (Element element : frontier) {
            for (Association association : associationsOf(element, dir)) {
                if (!visited.contains(neighbour(association, dir).getPath())) {
                    return true;
                }
            }
        }
        return false;
    }

    private static List<Association> associationsOf(Element element, Direction dir) {
        return dir == Direction.OUTGOING ? element.getOutgoing() : element.getIncoming();
    }

    private static Element neighbour(Association association, Direction dir) {
        return dir == Direction.OUTGOING ? association.getTo() : association.getFrom();
    }

    /** Nearest ancestor-or-self of {@code element} within {@code limit} levels below {@code scope}. */
    private static Element attribute(Element element, Element scope, int limit) {
        Element current = element;
        while (current.getDepth() - scope.getDepth() > limit) {
            current = current.getParent();
        }
        return current;
    }

    private static int boundOf(Integer maxDepth) {
        if (maxDepth == null) {
            return Integer.MAX_VALUE;
        }
        return Math.max(0, maxDepth);
    }

    /**
     * Load-time validation guarantees every endpoint belongs to the graph; anything else is a defect.
     */
    private static Element checkedEndpoint(Graph graph, Association association, Element endpoint) {
        if (endpoint == null || graph.find(endpoint.getPath()).orElse(null) != endpoint) {
            log.error("Association {} has an endpoint outside its graph", association);
            throw new GraphInvariantException("Dangling association endpoint in loaded graph",
                    Map.of("association", association.toString()));
        }
        return endpoint;
    }

    private static final class Discovery {
        final Element element;
        final Association association;
        final Element reachedFrom;

        Discovery(Element element, Association association, Element reachedFrom) {
            this.element = element;
            this.association = association;
            this.reachedFrom = reachedFrom;
        }
    }
}
