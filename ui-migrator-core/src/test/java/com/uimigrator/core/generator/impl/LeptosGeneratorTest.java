package com.uimigrator.core.generator.impl;

import com.uimigrator.core.exceptions.GenerationException;
import com.uimigrator.core.model.ComponentType;
import com.uimigrator.core.model.ParsedComponent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for the Leptos generators.
 */
class LeptosGeneratorTest {

    @TempDir
    Path tempDir;

    @Nested
    @DisplayName("render")
    class Render {

        @Test
        void render_withPropsAndState_emitsComponentFunction() {
            ParsedComponent component = new ParsedComponent(
                "UserCard",
                Path.of("src/components/UserCard.jsx"),
                ComponentType.REACT,
                "",
                Set.of("Avatar"),
                List.of("user", "onSelect", "children"),
                List.of("expanded"),
                List.of("handleClick"),
                List.of("Avatar"));

            String rust = new LeptosReactGenerator().render(component);

            assertThat(rust)
                .startsWith("// Generated by ui-migrator from React component UserCard\n")
                .contains("// Source: src/components/UserCard.jsx")
                .contains("use leptos::*;")
                .contains("#[component]\npub fn UserCard(\n")
                .contains("#[prop(into)] user: String,")
                .contains("#[prop(optional)] on_select: Option<Callback<()>>,")
                .contains("children: Children,")
                .contains("let (expanded, set_expanded) = create_signal(String::new());")
                .contains("let handle_click = move |_| {")
                .contains("<div class=\"user-card\">")
                .contains("<Avatar/>")
                .contains("{children()}")
                .endsWith("}\n");
        }

        @Test
        void render_withoutProps_emitsEmptyParameterList() {
            ParsedComponent component = parsed("StatusPill", ComponentType.EMBER, List.of(), List.of());

            String rust = new LeptosEmberGenerator().render(component);

            assertThat(rust).contains("pub fn StatusPill() -> impl IntoView {");
            assertThat(rust).doesNotContain("{children()}");
        }

        @Test
        void render_withLifecycleHooks_emitsEffects() {
            ParsedComponent vue = parsed("Clock", ComponentType.VUE, List.of(), List.of("mounted", "tick"));
            ParsedComponent angular = parsed("ClockComponent", ComponentType.ANGULAR, List.of(),
                List.of("ngOnInit", "ngAfterViewInit", "refresh"));

            String vueRust = new LeptosVueGenerator().render(vue);
            String angularRust = new LeptosAngularGenerator().render(angular);

            assertThat(vueRust)
                .contains("// ported from lifecycle hook mounted")
                .contains("let tick = move |_| {");
            assertThat(angularRust)
                .contains("// ported from lifecycle hook ngOnInit")
                .contains("// ported from lifecycle hook ngAfterViewInit")
                .contains("let refresh = move |_| {");
        }

        @Test
        void render_withRustKeywordProp_escapesIdentifier() {
            ParsedComponent component = parsed("Field", ComponentType.REACT, List.of("type"), List.of());

            assertThat(new LeptosReactGenerator().render(component)).contains("#[prop(into)] r#type: String,");
        }
    }

    @Test
    void generate_writesSnakeCaseFile() throws GenerationException {
        Path outputDir = tempDir.resolve("out/components/react");

        Path written = new LeptosReactGenerator().generate(
            parsed("UserCard", ComponentType.REACT, List.of("user"), List.of()), outputDir);

        assertThat(written).isEqualTo(outputDir.resolve("user_card.rs"));
        assertThat(written).exists();
    }

    @Test
    void generate_withSameNamedComponents_keepsBothFiles() throws Exception {
        // Given: two Button components from different directories
        Path outputDir = tempDir.resolve("out/components/react");
        LeptosReactGenerator generator = new LeptosReactGenerator();
        ParsedComponent admin = button(Path.of("src/admin/Button.jsx"));
        ParsedComponent shop = button(Path.of("src/shop/Button.jsx"));

        // When
        Path adminFile = generator.generate(admin, outputDir);
        Path shopFile = generator.generate(shop, outputDir);

        // Then
        assertThat(adminFile).isEqualTo(outputDir.resolve("button.rs"));
        assertThat(shopFile).isNotEqualTo(adminFile);
        assertThat(shopFile.getFileName().toString()).matches("button_[0-9a-f]{8}\\.rs");
        assertThat(Files.readString(adminFile)).contains("// Source: src/admin/Button.jsx");
        assertThat(Files.readString(shopFile)).contains("// Source: src/shop/Button.jsx");
    }

    @Test
    void generate_withSameComponentTwice_reusesItsFile() throws Exception {
        Path outputDir = tempDir.resolve("out/components/react");
        LeptosReactGenerator generator = new LeptosReactGenerator();
        ParsedComponent shop = button(Path.of("src/shop/Button.jsx"));
        generator.generate(button(Path.of("src/admin/Button.jsx")), outputDir);

        Path first = generator.generate(shop, outputDir);
        Path second = generator.generate(shop, outputDir);

        assertThat(second).isEqualTo(first);
        try (Stream<Path> files = Files.list(outputDir)) {
            assertThat(files).hasSize(2);
        }
    }

    @Test
    void generate_whenOutputIsAFile_throwsGenerationException() throws Exception {
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "not a directory");

        assertThatThrownBy(() -> new LeptosVueGenerator().generate(
                parsed("Clock", ComponentType.VUE, List.of(), List.of()), blocker.resolve("nested")))
            .isInstanceOf(GenerationException.class)
            .hasMessageContaining("Failed to write");
    }

    @Test
    void generators_reportMatchingTypes() {
        assertThat(new LeptosReactGenerator().getComponentType()).isEqualTo(ComponentType.REACT);
        assertThat(new LeptosVueGenerator().getComponentType()).isEqualTo(ComponentType.VUE);
        assertThat(new LeptosAngularGenerator().getComponentType()).isEqualTo(ComponentType.ANGULAR);
        assertThat(new LeptosEmberGenerator().getComponentType()).isEqualTo(ComponentType.EMBER);
        assertThat(new LeptosEmberGenerator().getFileExtension()).isEqualTo("rs");
    }

    private static ParsedComponent button(Path source) {
        return new ParsedComponent("Button", source, ComponentType.REACT, "", Set.of(), List.of("label"), List.of(),
            List.of(), List.of());
    }

    private static ParsedComponent parsed(String name, ComponentType type, List<String> props, List<String> methods) {
        return new ParsedComponent(name, Path.of(name + ".src"), type, "", Set.of(), props, List.of(), methods,
            List.of());
    }
}
