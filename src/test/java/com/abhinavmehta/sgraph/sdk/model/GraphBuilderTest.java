package com.abhinavmehta.sgraph.sdk.model;

import com.abhinavmehta.sgraph.sdk.SampleModels;
import com.abhinavmehta.sgraph.sdk.exception.ErrorKind;
import com.abhinavmehta.sgraph.sdk.exception.LoadException;
import com.abhinavmehta.sgraph.sdk.loader.AssociationDefinition;
import com.abhinavmehta.sgraph.sdk.loader.ElementDefinition;
import com.abhinavmehta.sgraph.sdk.loader.ModelDefinition;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class GraphBuilderTest {

    private final GraphBuilder builder = new GraphBuilder("External");

    @Test
    void buildsPathsFromParentPathAndName() {
        Graph graph = SampleModels.sample();

        assertThat(graph.getRoot().getPath()).isEqualTo("/P");
        assertThat(graph.getElementCount()).isEqualTo(10);
        assertThat(graph.getAssociationCount()).isEqualTo(6);
        for (Element element : graph.getIndex().preorder()) {
            if (!element.isRoot()) {
                assertThat(element.getPath()).isEqualTo(element.getParent().getPath() + "/" + element.getName());
                assertThat(element.getDepth()).isEqualTo(element.getParent().getDepth() + 1);
            }
        }
    }

    @Test
    void preservesDeclaredChildOrder() {
        Graph graph = SampleModels.sample();

        assertThat(graph.getRoot().getChildren()).extracting(Element::getName)
                .containsExactly("a", "b", "External");
        assertThat(graph.resolve("/P/b").getChildren()).extracting(Element::getName)
                .containsExactly("Bar", "Baz");
    }

    @Test
    void marksElementsUnderExternalSegmentAsExternal() {
        Graph graph = SampleModels.sample();

        assertThat(graph.resolve("/P/External").isExternal()).isTrue();
        assertThat(graph.resolve("/P/External/lib/Util").isExternal()).isTrue();
        assertThat(graph.resolve("/P/a/Foo").isExternal()).isFalse();
    }

    @Test
    void wiresAssociationsIntoBothEndpoints() {
        Graph graph = SampleModels.sample();
        Element foo = graph.resolve("/P/a/Foo");

        assertThat(foo.getOutgoing()).extracting(Association::getToPath).containsExactly("/P/b/Bar");
        assertThat(foo.getIncoming()).extracting(Association::getFromPath)
                .containsExactly("/P/b/Baz", "/P/a/Foo/run");
        assertThat(foo.getOutgoing().get(0).getAttributes().get("count")).isEqualTo(AttributeValue.of(3));
    }

    @Test
    void unnamedRootHasEmptyPath() {
        Graph graph = SampleModels.graph(SampleModels.UNNAMED_ROOT);

        assertThat(graph.getRoot().getPath()).isEmpty();
        assertThat(graph.resolve("/src/Main.java").getParent().getPath()).isEqualTo("/src");
        assertThat(graph.resolve("/External/junit").isExternal()).isTrue();
    }

    @Test
    void rejectsDuplicateSiblingNames() {
        ModelDefinition definition = ModelDefinition.builder()
                .root(ElementDefinition.builder().name("P")
                        .child(ElementDefinition.builder().name("a").build())
                        .child(ElementDefinition.builder().name("a").build())
                        .build())
                .build();

        assertThatThrownBy(() -> builder.build(definition))
                .isInstanceOf(LoadException.class)
                .hasMessageContaining("Duplicate element path: /P/a");
    }

    @Test
    void rejectsNamesContainingSlash() {
        ModelDefinition definition = ModelDefinition.builder()
                .root(ElementDefinition.builder().name("P")
                        .child(ElementDefinition.builder().name("a/b").build())
                        .build())
                .build();

        assertThatThrownBy(() -> builder.build(definition)).isInstanceOf(LoadException.class);
    }

    @Test
    void rejectsNamesWithSurroundingWhitespace() {
        ModelDefinition padded = ModelDefinition.builder()
                .root(ElementDefinition.builder().name("P")
                        .child(ElementDefinition.builder().name("a ").build())
                        .build())
                .build();
        ModelDefinition paddedRoot = ModelDefinition.builder()
                .root(ElementDefinition.builder().name(" P").build())
                .build();

        assertThatThrownBy(() -> builder.build(padded))
                .isInstanceOf(LoadException.class)
                .hasMessageContaining("whitespace");
        assertThatThrownBy(() -> builder.build(paddedRoot)).isInstanceOf(LoadException.class);
    }

    @Test
    void innerWhitespaceIsKeptAndResolvable() {
        ModelDefinition definition = ModelDefinition.builder()
                .root(ElementDefinition.builder().name("P")
                        .child(ElementDefinition.builder().name("My Docs").build())
                        .build())
                .build();

        Graph graph = builder.build(definition);

        assertThat(graph.find("/P/My Docs")).isPresent();
    }

    @Test
    void interruptedBuildIsAbandoned() {
        ModelDefinition definition = ModelDefinition.builder()
                .root(ElementDefinition.builder().name("P")
                        .child(ElementDefinition.builder().name("a").build())
                        .build())
                .build();

        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(() -> builder.build(definition))
                    .isInstanceOf(LoadException.class)
                    .hasMessageContaining("interrupted");
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void rejectsDanglingAssociationEndpoint() {
        assertThatThrownBy(() -> SampleModels.graph(SampleModels.DANGLING))
                .isInstanceOf(LoadException.class)
                .hasMessageContaining("/P/missing")
                .satisfies(e -> assertThat(((LoadException) e).getKind()).isEqualTo(ErrorKind.LOAD_ERROR));
    }

    @Test
    void rejectsSharedNodeInHierarchy() {
        ElementDefinition shared = ElementDefinition.builder().name("x").build();
        List<ElementDefinition> children = new ArrayList<>();
        children.add(ElementDefinition.builder().name("a").child(shared).build());
        children.add(ElementDefinition.builder().name("b").child(shared).build());
        ModelDefinition definition = ModelDefinition.builder()
                .root(ElementDefinition.builder().name("P").children(children).build())
                .build();

        assertThatThrownBy(() -> builder.build(definition))
                .isInstanceOf(LoadException.class)
                .hasMessageContaining("shared node");
    }

    @Test
    void rejectsUnsupportedAttributeValue() {
        ModelDefinition definition = ModelDefinition.builder()
                .root(ElementDefinition.builder().name("P").attribute("tags", List.of("x")).build())
                .build();

        assertThatThrownBy(() -> builder.build(definition))
                .isInstanceOf(LoadException.class)
                .hasMessageContaining("tags");
    }

    @Test
    void rejectsMissingRoot() {
        assertThatThrownBy(() -> builder.build(new ModelDefinition()))
                .isInstanceOf(LoadException.class);
    }

    @Test
    void selfLoopIsKeptAsSingleAssociation() {
        ModelDefinition definition = ModelDefinition.builder()
                .root(ElementDefinition.builder().name("P")
                        .child(ElementDefinition.builder().name("a").build())
                        .build())
                .associations(new ArrayList<>(List.of(AssociationDefinition.builder()
                        .from("/P/a").to("/P/a").type("call").build())))
                .build();

        Graph graph = builder.build(definition);

        assertThat(graph.getAssociations()).singleElement().satisfies(a -> assertThat(a.isSelfLoop()).isTrue());
    }

    @Test
    void nullTypeBecomesEmptyString() {
        ModelDefinition definition = ModelDefinition.builder()
                .root(ElementDefinition.builder().name("P").build())
                .build();

        assertThat(builder.build(definition).getRoot().getType()).isEmpty();
    }
}
