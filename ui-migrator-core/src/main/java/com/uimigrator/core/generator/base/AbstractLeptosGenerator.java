package com.uimigrator.core.generator.base;

import com.uimigrator.core.exceptions.GenerationException;
import com.uimigrator.core.generator.ComponentGenerator;
import com.uimigrator.core.model.ParsedComponent;
import com.uimigrator.core.util.IdGenerator;
import com.uimigrator.core.util.NameUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Base class for generators that emit Leptos (Rust) component skeletons.
 *
 * <p>The generated file contains:
 * <ul>
 *   <li>a {@code #[component]} function named after the source component</li>
 *   <li>one prop per source prop; {@code onX} props become optional callbacks</li>
 *   <li>one {@code create_signal} per state field</li>
 *   <li>one closure per handler, lifecycle hooks as {@code create_effect} blocks</li>
 *   <li>a {@code view!} rendering every child component</li>
 * </ul>
 * Bodies are left as porting notes; the skeleton is a starting point for a developer, not a
 * finished translation.
 *
 * <p>Subclasses name the framework and tell lifecycle hooks apart from handlers.
 */
public abstract class AbstractLeptosGenerator implements ComponentGenerator {

    private static final String FILE_EXTENSION = "rs";
    private static final String INDENT = "    ";
    private static final String SOURCE_PREFIX = "// Source: ";
    private static final int HEADER_LINES = 2;
    private static final int NAME_SUFFIX_LENGTH = 8;
    private static final Set<String> RUST_KEYWORDS = Set.of(
        "as", "async", "await", "box", "break", "const", "continue", "crate", "dyn", "else", "enum",
        "extern", "fn", "for", "if", "impl", "in", "let", "loop", "match", "mod", "move", "mut", "pub",
        "ref", "return", "self", "static", "struct", "super", "trait", "type", "unsafe", "use", "where",
        "while", "yield"
    );

    protected final Logger log = LoggerFactory.getLogger(getClass());

    @Override
    public String getFileExtension() {
        return FILE_EXTENSION;
    }

    /**
     * Writes the skeleton to {@code <outputDir>/<snake_case_name>.rs}.
     *
     * <p>When that file was generated from another source file, a short hash of this
     * component's source path is appended to the name, so same-named components never
     * overwrite each other. Regenerating the same component reuses its file.
     */
    @Override
    public Path generate(ParsedComponent component, Path outputDir) throws GenerationException {
        String fileName = NameUtils.toSnakeCase(component.name());
        if (fileName.isEmpty()) {
            throw new GenerationException("Cannot derive a file name from component name: " + component.name());
        }
        String sourcePath = sourcePath(component);
        Path target = outputDir.resolve(fileName + "." + getFileExtension());
        String source = render(component);
        try {
            if (Files.exists(target) && !generatedFrom(target, sourcePath)) {
                String suffix = IdGenerator.generateFromString(sourcePath).substring(0, NAME_SUFFIX_LENGTH);
                target = outputDir.resolve(fileName + "_" + suffix + "." + getFileExtension());
                log.debug("{} is taken by another component, writing {}", fileName, target.getFileName());
            }
            Files.createDirectories(outputDir);
            Files.writeString(target, source);
        } catch (IOException e) {
            throw new GenerationException("Failed to write " + target + ": " + e.getMessage(), e);
        }
        log.debug("Generated {} from {}", target, component.filePath());
        return target;
    }

    private static boolean generatedFrom(Path existing, String sourcePath) throws IOException {
        String header = SOURCE_PREFIX + sourcePath;
        try (Stream<String> lines = Files.lines(existing)) {
            return lines.limit(HEADER_LINES).anyMatch(header::equals);
        }
    }

    private static String sourcePath(ParsedComponent component) {
        return component.filePath().toString().replace('\\', '/');
    }

    /**
     * Renders the Rust source for a component.
     *
     * @param component parsed component
     * @return Rust source text
     */
    public String render(ParsedComponent component) {
        String functionName = NameUtils.toPascalCase(component.name());
        StringBuilder out = new StringBuilder();
        out.append("// Generated by ui-migrator from ").append(frameworkName())
            .append(" component ").append(component.name()).append('\n');
        out.append(SOURCE_PREFIX).append(sourcePath(component)).append('\n');
        for (String note : portingNotes()) {
            out.append("// ").append(note).append('\n');
        }
        out.append("use leptos::*;\n\n");

        out.append("#[component]\n");
        out.append("pub fn ").append(functionName).append('(');
        List<String> props = component.props();
        if (props.isEmpty()) {
            out.append(") -> impl IntoView {\n");
        } else {
            out.append('\n');
            for (String prop : props) {
                out.append(INDENT).append(propDeclaration(prop)).append(",\n");
            }
            out.append(") -> impl IntoView {\n");
        }

        for (String field : component.stateFields()) {
            String name = rustIdentifier(field);
            out.append(INDENT).append("let (").append(name).append(", set_").append(NameUtils.toSnakeCase(field))
                .append(") = create_signal(String::new());\n");
        }
        if (!component.stateFields().isEmpty()) {
            out.append('\n');
        }

        for (String method : component.methods()) {
            if (isLifecycleMethod(method)) {
                out.append(INDENT).append("create_effect(move |_| {\n");
                out.append(INDENT).append(INDENT).append("// ported from lifecycle hook ").append(method).append('\n');
                out.append(INDENT).append("});\n\n");
            } else {
                out.append(INDENT).append("let ").append(rustIdentifier(method)).append(" = move |_| {\n");
                out.append(INDENT).append(INDENT).append("// ported from ").append(method).append('\n');
                out.append(INDENT).append("};\n\n");
            }
        }

        out.append(INDENT).append("view! {\n");
        out.append(INDENT).append(INDENT).append("<div class=\"")
            .append(NameUtils.toSnakeCase(component.name()).replace('_', '-')).append("\">\n");
        for (String child : component.childComponents()) {
            out.append(INDENT).append(INDENT).append(INDENT)
                .append('<').append(NameUtils.toPascalCase(child)).append("/>\n");
        }
        if (props.contains("children")) {
            out.append(INDENT).append(INDENT).append(INDENT).append("{children()}\n");
        }
        out.append(INDENT).append(INDENT).append("</div>\n");
        out.append(INDENT).append("}\n");
        out.append("}\n");
        return out.toString();
    }

    /**
     * Returns the source framework name used in the generated header.
     *
     * @return framework name
     */
    protected abstract String frameworkName();

    /**
     * Decides whether a method is a framework lifecycle hook rather than a handler.
     *
     * @param method source method name
     * @return true for lifecycle hooks
     */
    protected abstract boolean isLifecycleMethod(String method);

    /**
     * Framework-specific porting notes emitted as header comments.
     *
     * @return note lines, may be empty
     */
    protected List<String> portingNotes() {
        return List.of();
    }

    protected String propDeclaration(String prop) {
        if ("children".equals(prop)) {
            return "children: Children";
        }
        String name = rustIdentifier(prop);
        if (prop.length() > 2 && prop.startsWith("on") && Character.isUpperCase(prop.charAt(2))) {
            return "#[prop(optional)] " + name + ": Option<Callback<()>>";
        }
        return "#[prop(into)] " + name + ": String";
    }

    /**
     * Converts a source identifier to a snake_case Rust identifier, escaping keywords.
     *
     * @param name source identifier
     * @return Rust identifier
     */
    protected static String rustIdentifier(String name) {
        String snake = NameUtils.toSnakeCase(name);
        if (snake.isEmpty()) {
            return "_unnamed";
        }
        if (Character.isDigit(snake.charAt(0))) {
            snake = "_" + snake;
        }
        return RUST_KEYWORDS.contains(snake) ? "r#" + snake : snake;
    }
}
