package com.abhinavmehta.sgraph.sdk.query;

import com.abhinavmehta.sgraph.sdk.SampleModels;
import com.abhinavmehta.sgraph.sdk.dto.ModelOverview;
import com.abhinavmehta.sgraph.sdk.dto.OverviewNode;
import com.abhinavmehta.sgraph.sdk.exception.ScopeNotFoundException;
import com.abhinavmehta.sgraph.sdk.model.Graph;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OverviewGeneratorTest {

    private final Graph graph = SampleModels.sample();
    private final OverviewGenerator generator = new OverviewGenerator();

    @Test
    void stopsAtDepthBoundAndMarksTruncatedNodes() {
        ModelOverview overview = generator.overview(graph, null, 1, false, QueryDeadline.none());

        OverviewNode root = overview.getTree();
        assertThat(root.getPath()).isEqualTo("/P");
        assertThat(root.isTruncated()).isFalse();
        assertThat(root.getChildren()).extracting(OverviewNode::getName).containsExactly("a", "b", "External");
        assertThat(root.getChildren()).allSatisfy(child -> {
            assertThat(child.isTruncated()).isTrue();
            assertThat(child.getChildren()).isEmpty();
            assertThat(child.getDescendantCount()).isNull();
        });
        assertThat(overview.getTotalVisited()).isEqualTo(4);
        assertThat(overview.getDepthCounts()).containsExactly(Map.entry(0, 1), Map.entry(1, 3));
        assertThat(overview.getTypeDistribution()).containsExactly(Map.entry("dir", 2), Map.entry("file", 2));
    }

    @Test
    void boundaryNodesSummarizeTheirUnexpandedSubtree() {
        ModelOverview overview = generator.overview(graph, null, 1, true, QueryDeadline.none());

        OverviewNode root = overview.getTree();
        assertThat(root.getDescendantCount()).isEqualTo(9);
        OverviewNode a = root.getChildren().get(0);
        assertThat(a.getChildCount()).isEqualTo(1);
        assertThat(a.getDescendantCount()).isEqualTo(2);
        assertThat(a.getDescendantTypeCounts()).containsExactly(Map.entry("class", 1), Map.entry("method", 1));
        assertThat(a.getIncomingCount()).isZero();
        assertThat(a.getOutgoingCount()).isZero();
    }

    @Test
    void zeroDepthReturnsOnlyTheScopeElement() {
        ModelOverview overview = generator.overview(graph, "/P/b", 0, true, QueryDeadline.none());

        assertThat(overview.getRootPath()).isEqualTo("/P/b");
        assertThat(overview.getTree().getChildren()).isEmpty();
        assertThat(overview.getTree().isTruncated()).isTrue();
        assertThat(overview.getTree().getDescendantTypeCounts()).containsExactly(Map.entry("class", 2));
        assertThat(overview.getTotalVisited()).isEqualTo(1);
    }

    @Test
    void depthIsRelativeToScope() {
        ModelOverview overview = generator.overview(graph, "/P/a", 5, true, QueryDeadline.none());

        OverviewNode foo = overview.getTree().getChildren().get(0);
        assertThat(foo.getDepth()).isEqualTo(1);
        assertThat(foo.getChildren()).singleElement().satisfies(run -> {
            assertThat(run.getDepth()).isEqualTo(2);
            assertThat(run.isTruncated()).isFalse();
            assertThat(run.getOutgoingCount()).isEqualTo(2);
        });
        assertThat(foo.getIncomingCount()).isEqualTo(2);
        assertThat(overview.getTotalVisited()).isEqualTo(3);
    }

    @Test
    void unknownScopeRaisesNotFound() {
        assertThatThrownBy(() -> generator.overview(graph, "/P/zzz", 2, false, QueryDeadline.none()))
                .isInstanceOf(ScopeNotFoundException.class);
    }
}
