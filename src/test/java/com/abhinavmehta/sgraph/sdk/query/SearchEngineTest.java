package com.abhinavmehta.sgraph.sdk.query;

import com.abhinavmehta.sgraph.sdk.SampleModels;
import com.abhinavmehta.sgraph.sdk.dto.ElementView;
import com.abhinavmehta.sgraph.sdk.dto.PatternKind;
import com.abhinavmehta.sgraph.sdk.dto.SearchResult;
import com.abhinavmehta.sgraph.sdk.exception.ErrorKind;
import com.abhinavmehta.sgraph.sdk.exception.InvalidArgumentException;
import com.abhinavmehta.sgraph.sdk.exception.InvalidPatternException;
import com.abhinavmehta.sgraph.sdk.exception.ScopeNotFoundException;
import com.abhinavmehta.sgraph.sdk.model.AttributeValue;
import com.abhinavmehta.sgraph.sdk.model.Element;
import com.abhinavmehta.sgraph.sdk.model.Graph;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SearchEngineTest {

    private final Graph graph = SampleModels.sample();
    private final SearchEngine searchEngine = new SearchEngine();

    @Test
    void regexMatchesAnywhereInName() {
        SearchResult result = searchEngine.searchByName(graph, "Ba", PatternKind.REGEX, null, null, null,
                QueryDeadline.none());

        assertThat(result.getElements()).extracting(ElementView::getPath).containsExactly("/P/b/Bar", "/P/b/Baz");
        assertThat(result.getCount()).isEqualTo(2);
        assertThat(result.isTruncated()).isFalse();
        assertThat(result.getScopePath()).isEqualTo("/P");
    }

    @Test
    void globMatchesWholeName() {
        assertThat(paths(searchEngine.searchByName(graph, "Ba?", PatternKind.GLOB, null, null, null,
                QueryDeadline.none()))).containsExactly("/P/b/Bar", "/P/b/Baz");
        assertThat(paths(searchEngine.searchByName(graph, "a", PatternKind.GLOB, null, null, null,
                QueryDeadline.none()))).containsExactly("/P/a");
        assertThat(paths(searchEngine.searchByName(graph, "*.*", PatternKind.GLOB, null, null, null,
                QueryDeadline.none()))).isEmpty();
    }

    @Test
    void alwaysMatchingPatternReturnsWholeScopeInPreorder() {
        for (String scope : new String[]{null, "/P/a", "/P/b", "/P/External"}) {
            SearchResult result = searchEngine.searchByName(graph, ".*", PatternKind.REGEX, null, scope, null,
                    QueryDeadline.none());

            assertThat(paths(result)).containsExactlyElementsOf(
                    graph.getIndex().elementsUnderScope(scope).stream().map(Element::getPath).collect(Collectors.toList()));
        }
    }

    @Test
    void nameSearchCanFilterByType() {
        SearchResult result = searchEngine.searchByName(graph, ".", PatternKind.REGEX, "class", null, null,
                QueryDeadline.none());

        assertThat(paths(result)).containsExactly("/P/a/Foo", "/P/b/Bar", "/P/b/Baz", "/P/External/lib/Util");
    }

    @Test
    void externalElementsAreNotFilteredOut() {
        SearchResult result = searchEngine.searchByName(graph, "Util", PatternKind.REGEX, null, null, null,
                QueryDeadline.none());

        assertThat(result.getElements()).singleElement()
                .satisfies(view -> assertThat(view.isExternal()).isTrue());
    }

    @Test
    void invalidPatternIsRejectedBeforeScopeResolution() {
        assertThatThrownBy(() -> searchEngine.searchByName(graph, "[unclosed", PatternKind.REGEX, null,
                "/P/does-not-exist", null, QueryDeadline.none()))
                .isInstanceOf(InvalidPatternException.class)
                .satisfies(e -> assertThat(((InvalidPatternException) e).getKind())
                        .isEqualTo(ErrorKind.INVALID_PATTERN));
        assertThatThrownBy(() -> searchEngine.searchByName(graph, "", PatternKind.REGEX, null, null, null,
                QueryDeadline.none())).isInstanceOf(InvalidPatternException.class);
    }

    @Test
    void unknownScopeRaisesNotFound() {
        assertThatThrownBy(() -> searchEngine.searchByName(graph, "Foo", PatternKind.REGEX, null, "/P/zzz", null,
                QueryDeadline.none()))
                .isInstanceOf(ScopeNotFoundException.class)
                .satisfies(e -> assertThat(((ScopeNotFoundException) e).getKind()).isEqualTo(ErrorKind.NOT_FOUND));
    }

    @Test
    void typeSearchIsExactAndScoped() {
        assertThat(paths(searchEngine.searchByType(graph, "class", "/P/b", null, QueryDeadline.none())))
                .containsExactly("/P/b/Bar", "/P/b/Baz");
        assertThat(paths(searchEngine.searchByType(graph, "Class", null, null, QueryDeadline.none()))).isEmpty();
        assertThatThrownBy(() -> searchEngine.searchByType(graph, " ", null, null, QueryDeadline.none()))
                .isInstanceOf(InvalidArgumentException.class);
    }

    @Test
    void maxResultsTruncatesInPreorder() {
        SearchResult result = searchEngine.searchByType(graph, "class", null, 2, QueryDeadline.none());

        assertThat(paths(result)).containsExactly("/P/a/Foo", "/P/b/Bar");
        assertThat(result.isTruncated()).isTrue();

        SearchResult exact = searchEngine.searchByType(graph, "class", null, 4, QueryDeadline.none());
        assertThat(exact.isTruncated()).isFalse();
    }

    @Test
    void attributeEqualityIsTypeSensitive() {
        assertThat(paths(searchEngine.searchByAttributes(graph, Map.of("loc", AttributeValue.of(120)), null, null,
                QueryDeadline.none()))).containsExactly("/P/a");
        assertThat(paths(searchEngine.searchByAttributes(graph, Map.of("loc", AttributeValue.of("120")), null, null,
                QueryDeadline.none()))).containsExactly("/P/b");
    }

    @Test
    void attributeFiltersMustAllMatch() {
        Map<String, AttributeValue> filters = Map.of(
                "language", AttributeValue.of("java"),
                "loc", AttributeValue.of(120));

        assertThat(paths(searchEngine.searchByAttributes(graph, filters, null, null, QueryDeadline.none())))
                .containsExactly("/P/a");
        assertThat(paths(searchEngine.searchByAttributes(graph, Map.of("deprecated", AttributeValue.of(true)),
                null, null, QueryDeadline.none()))).containsExactly("/P/b/Baz");
    }

    @Test
    void emptyAttributeFilterMatchesEveryElementInScope() {
        assertThat(searchEngine.searchByAttributes(graph, Map.of(), "/P/b", null, QueryDeadline.none()).getCount())
                .isEqualTo(3);
        assertThatThrownBy(() -> searchEngine.searchByAttributes(graph, null, null, null, QueryDeadline.none()))
                .isInstanceOf(InvalidArgumentException.class);
    }

    @Test
    void globToRegexQuotesLiterals() {
        assertThat("Foo.java").matches(SearchEngine.globToRegex("*.java"));
        assertThat("Fooxjava").doesNotMatch(SearchEngine.globToRegex("*.java"));
        assertThat("a+b").matches(SearchEngine.globToRegex("a+?"));
    }

    private static List<String> paths(SearchResult result) {
        return result.getElements().stream().map(ElementView::getPath).collect(Collectors.toList());
    }
}
