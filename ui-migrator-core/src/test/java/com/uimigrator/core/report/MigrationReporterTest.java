package com.uimigrator.core.report;

import com.uimigrator.core.graph.DependencyGraphBuilder;
import com.uimigrator.core.model.ComponentMetadata;
import com.uimigrator.core.model.ComponentType;
import com.uimigrator.core.model.MigrationStats;
import com.uimigrator.core.model.MigrationStatus;
import com.uimigrator.core.store.ComponentStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link MigrationReporter} and {@link MarkdownReportGenerator}.
 */
class MigrationReporterTest {

    private ComponentStore store;

    @BeforeEach
    void setUp() throws Exception {
        store = new ComponentStore();
        store.add(ComponentMetadata.discovered("c1", "UserCard", "src/UserCard.jsx", "src",
            ComponentType.REACT, 10, List.of("Avatar")));
        store.add(ComponentMetadata.discovered("a1", "Avatar", "src/Avatar.jsx", "src",
            ComponentType.REACT, 5, List.of()));
        store.add(ComponentMetadata.discovered("m1", "Menu", "app/Menu.vue", "app",
            ComponentType.VUE, 20, List.of()));
        store.add(ComponentMetadata.discovered("t1", "Toolbar", "app/Toolbar.vue", "app",
            ComponentType.VUE, 20, List.of()));
        new DependencyGraphBuilder().build(store);

        store.updateStatus("a1", MigrationStatus.completed());
        store.updateMigratedPath("a1", "generated/leptos/components/react/avatar.rs");
        store.updateStatus("m1", MigrationStatus.failed("template | parse error"));
        store.updateStatus("t1", MigrationStatus.skipped("Unsupported component type: Vue"));
    }

    @Test
    void report_summarizesStore() {
        MigrationReport report = new MigrationReporter().report(store);

        assertThat(report.stats().totalComponents()).isEqualTo(4);
        assertThat(report.types()).containsExactly(
            new MigrationReport.TypeSummary("React", 2, 1),
            new MigrationReport.TypeSummary("Vue", 2, 0));
        assertThat(report.completed()).singleElement()
            .satisfies(row -> assertThat(row.migratedPath()).endsWith("avatar.rs"));
        assertThat(report.failed()).extracting(MigrationReport.ProblemRow::name).containsExactly("Menu");
        assertThat(report.skipped()).extracting(MigrationReport.ProblemRow::reason)
            .containsExactly("Unsupported component type: Vue");
        assertThat(report.edges()).containsExactly(new MigrationReport.Edge("c1", "UserCard", "a1", "Avatar"));
    }

    @Test
    void report_doesNotModifyStore() {
        List<ComponentMetadata> before = List.copyOf(store.getAll());

        new MigrationReporter().report(store);

        assertThat(store.getAll()).containsExactlyElementsOf(before);
    }

    @Test
    void generate_rendersAllSections() {
        String markdown = new MarkdownReportGenerator().generate(new MigrationReporter().report(store));

        assertThat(markdown)
            .startsWith("# Migration Report")
            .contains("## Progress Summary")
            .contains("Migration Progress: 25.0% (1/4 components)")
            .contains("| Type | Total | Completed |")
            .contains("| React | 2 | 1 |")
            .contains("| Avatar | React | src/Avatar.jsx | generated/leptos/components/react/avatar.rs |")
            .contains("| Menu | Vue | template \\| parse error |")
            .contains("| Toolbar | Vue | Unsupported component type: Vue |")
            .contains("```mermaid\ngraph TD;\n")
            .contains("    c1[\"UserCard\"] --> a1[\"Avatar\"];");
    }

    @Test
    void generate_withBracketsAndQuotesInNames_emitsQuotedMermaidLabels() {
        MigrationReport report = new MigrationReport(Instant.now(), MigrationStats.empty(), List.of(), List.of(),
            List.of(), List.of(), List.of(new MigrationReport.Edge("p-1", "Grid[Row]", "c-2", "Say \"Hi\"")));

        String markdown = new MarkdownReportGenerator().generate(report);

        assertThat(markdown).contains("    p_1[\"Grid[Row]\"] --> c_2[\"Say #quot;Hi#quot;\"];");
    }

    @Test
    void generate_withEmptyStore_usesPlaceholders() {
        String markdown = new MarkdownReportGenerator().generate(new MigrationReporter().report(new ComponentStore()));

        assertThat(markdown)
            .contains("No components have been discovered yet.")
            .contains("No components have been completed yet.")
            .contains("No components have failed migration.")
            .contains("No components have been skipped.")
            .contains("No dependencies detected.")
            .doesNotContain("```mermaid");
    }
}
