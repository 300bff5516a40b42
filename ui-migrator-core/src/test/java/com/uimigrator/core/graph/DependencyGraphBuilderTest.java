package com.uimigrator.core.graph;

import com.uimigrator.core.model.ComponentMetadata;
import com.uimigrator.core.model.ComponentType;
import com.uimigrator.core.store.ComponentStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link DependencyGraphBuilder}.
 */
class DependencyGraphBuilderTest {

    private ComponentStore store;
    private DependencyGraphBuilder builder;

    @BeforeEach
    void setUp() {
        store = new ComponentStore();
        builder = new DependencyGraphBuilder();
    }

    @Test
    void build_resolvesHintsToEdges() throws Exception {
        add("card", "UserCard", ComponentType.REACT, "src", "Avatar", "Button");
        add("avatar", "Avatar", ComponentType.REACT, "src");
        add("button", "Button", ComponentType.REACT, "src");

        GraphBuildResult result = builder.build(store);

        assertThat(result.edgeCount()).isEqualTo(2);
        assertThat(result.unresolvedHints()).isZero();
        assertThat(store.require("card").dependencies()).containsExactly("avatar", "button");
        assertThat(store.require("avatar").dependents()).containsExactly("card");
        assertThat(store.require("button").dependents()).containsExactly("card");
    }

    @Test
    void build_matchesAcrossNamingStyles() throws Exception {
        add("card", "UserCard", ComponentType.VUE, "src", "user-avatar");
        add("avatar", "UserAvatar", ComponentType.VUE, "src");

        builder.build(store);

        assertThat(store.require("card").dependencies()).containsExactly("avatar");
    }

    @Test
    void build_keepsEdgesSymmetric() {
        add("a", "A", ComponentType.REACT, "src", "B", "C");
        add("b", "B", ComponentType.REACT, "src", "C");
        add("c", "C", ComponentType.REACT, "src", "A");

        builder.build(store);

        for (ComponentMetadata component : store.getAll()) {
            for (String dependency : component.dependencies()) {
                assertThat(store.get(dependency).orElseThrow().dependents()).contains(component.id());
            }
            for (String dependent : component.dependents()) {
                assertThat(store.get(dependent).orElseThrow().dependencies()).contains(component.id());
            }
        }
    }

    @Test
    void build_twice_doesNotAccumulateEdges() throws Exception {
        add("card", "UserCard", ComponentType.REACT, "src", "Avatar");
        add("avatar", "Avatar", ComponentType.REACT, "src");

        builder.build(store);
        List<ComponentMetadata> first = List.copyOf(store.getAll());
        GraphBuildResult second = builder.build(store);

        assertThat(second.edgeCount()).isEqualTo(1);
        assertThat(store.getAll()).containsExactlyElementsOf(first);
    }

    @Test
    void rebuild_afterHintChange_replacesOldEdges() throws Exception {
        add("card", "UserCard", ComponentType.REACT, "src", "Avatar");
        add("avatar", "Avatar", ComponentType.REACT, "src");
        add("badge", "Badge", ComponentType.REACT, "src");
        builder.build(store);

        store.updateDependencyHints("card", List.of("Badge"));
        builder.rebuild(store, List.of("card"));

        assertThat(store.require("card").dependencies()).containsExactly("badge");
        assertThat(store.require("avatar").dependents()).isEmpty();
        assertThat(store.require("badge").dependents()).containsExactly("card");
    }

    @Test
    void build_ignoresSelfReferencesAndCountsUnresolved() throws Exception {
        add("tree", "Tree", ComponentType.REACT, "src", "Tree", "Missing");

        GraphBuildResult result = builder.build(store);

        assertThat(store.require("tree").dependencies()).isEmpty();
        assertThat(result.unresolvedHints()).isEqualTo(2);
    }

    @Test
    void build_prefersSameTypeThenSameRoot() throws Exception {
        add("card", "Card", ComponentType.REACT, "web", "Button");
        add("vue-button", "Button", ComponentType.VUE, "web");
        add("react-button-other", "Button", ComponentType.REACT, "legacy");
        add("react-button", "Button", ComponentType.REACT, "web");

        builder.build(store);

        assertThat(store.require("card").dependencies()).containsExactly("react-button");
    }

    @Test
    void build_fallsBackToOtherTypes() throws Exception {
        add("card", "Card", ComponentType.REACT, "web", "Button");
        add("vue-button", "Button", ComponentType.VUE, "web");

        builder.build(store);

        assertThat(store.require("card").dependencies()).containsExactly("vue-button");
    }

    @Test
    void build_reportsCycles() {
        add("a", "A", ComponentType.REACT, "src", "B");
        add("b", "B", ComponentType.REACT, "src", "A");
        add("c", "C", ComponentType.REACT, "src", "A");

        GraphBuildResult result = builder.build(store);

        assertThat(result.hasCycles()).isTrue();
        assertThat(result.cycles()).containsExactly(List.of("a", "b"));
    }

    private void add(String id, String name, ComponentType type, String root, String... hints) {
        store.add(ComponentMetadata.discovered(id, name, root + "/" + name, root, type, 10, List.of(hints)));
    }
}
