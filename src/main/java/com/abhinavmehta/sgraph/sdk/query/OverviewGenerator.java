package com.abhinavmehta.sgraph.sdk.query;

import com.abhinavmehta.sgraph.sdk.dto.ModelOverview;
import com.abhinavmehta.sgraph.sdk.dto.OverviewNode;
import com.abhinavmehta.sgraph.sdk.model.Element;
import com.abhinavmehta.sgraph.sdk.model.Graph;
import com.abhinavmehta.sgraph.sdk.model.PathIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Depth-bounded hierarchical summary of a model or subtree.
 * <p>
 * Elements below the depth bound are never visited: descendant counts come from the type
 * index of {@link PathIndex}, so a boundary node summarizes its unexpanded subtree as one
 * aggregate.
 */
public class OverviewGenerator {
    private static final Logger log = LoggerFactory.getLogger(OverviewGenerator.class);

    public ModelOverview overview(Graph graph, String scopePath, int maxDepth, boolean includeCounts,
                                  QueryDeadline deadline) {
        log.debug("Generating model overview: scope='{}', depth={}, counts={}", scopePath, maxDepth, includeCounts);
        PathIndex index = graph.getIndex();
        Element start = index.resolveScope(scopePath);
        int limit = Math.max(0, maxDepth);

        Map<Integer, Integer> depthCounts = new TreeMap<>();
        Map<String, Integer> typeDistribution = new TreeMap<>();
        OverviewNode tree = null;
        int visited = 0;

        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(new Frame(start, null));
        while (!stack.isEmpty()) {
            deadline.check();
            Frame frame = stack.pop();
            Element element = frame.element;
            int depth = element.getDepth() - start.getDepth();
            List<Element> children = element.getChildren();

            OverviewNode node = OverviewNode.builder()
                    .name(element.getName())
                    .path(element.getPath())
                    .type(element.getType())
                    .depth(depth)
                    .childCount(children.size())
                    .truncated(depth >= limit && !children.isEmpty())
                    .build();
            if (includeCounts) {
                node.setDescendantCount(element.getSubtreeSize() - 1);
                node.setDescendantTypeCounts(index.countByType(element, false));
                node.setIncomingCount(element.getIncoming().size());
                node.setOutgoingCount(element.getOutgoing().size());
            }
            if (frame.parent == null) {
                tree = node;
            } else {
                // pre-order pop order attaches siblings in declared order
                frame.parent.getChildren().add(node);
            }

            visited++;
            depthCounts.merge(depth, 1, Integer::sum);
            typeDistribution.merge(element.getType(), 1, Integer::sum);

            if (depth < limit) {
                for (int i = children.size() - 1; i >= 0; i--) {
                    stack.push(new Frame(children.get(i), node));
                }
            }
        }

        log.debug("Model overview complete: {} elements across {} depth levels", visited, depthCounts.size());
        return ModelOverview.builder()
                .rootPath(start.getPath())
                .maxDepth(limit)
                .includeCounts(includeCounts)
                .tree(tree)
                .totalVisited(visited)
                .depthCounts(depthCounts)
                .typeDistribution(typeDistribution)
                .build();
    }

    private static final class Frame {
        final Element element;
        final OverviewNode parent;

        Frame(Element element, OverviewNode parent) {
            this.element = element;
            this.parent = parent;
        }
    }
}
