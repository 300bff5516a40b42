package com.uimigrator.core.analyzer.impl;

import com.uimigrator.core.analyzer.base.AbstractRegexAnalyzer;
import com.uimigrator.core.model.ComponentType;
import com.uimigrator.core.model.ParsedComponent;
import com.uimigrator.core.util.NameUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Analyzer for Ember classic and Glimmer components under {@code components/}.
 *
 * <p>A component is a {@code .js} class with an optional co-located {@code .hbs} template of the
 * same name. The template is folded into the class; a template without a class is a
 * template-only component on its own.
 *
 * <p><b>Dependency hints:</b>
 * <ul>
 *   <li>{@code import UserCard from 'app/components/user-card'}</li>
 *   <li>{@code {{user-card}}} and {@code {{#user-card}}} curly invocations</li>
 *   <li>{@code <UserCard />} and {@code <Ui::UserCard />} angle-bracket invocations</li>
 *   <li>{@code {{component 'user-card'}}}</li>
 * </ul>
 */
public class EmberAnalyzer extends AbstractRegexAnalyzer {

    private static final String ANALYZER_ID = "ember";
    private static final String ANALYZER_DISPLAY_NAME = "Ember Component Analyzer";
    private static final Set<String> SUPPORTED_FILE_PATTERNS = Set.of(
        "components/**.js", "**/components/**.js", "components/**.hbs", "**/components/**.hbs"
    );
    private static final Set<String> CURLY_HELPERS = Set.of("if", "each", "unless", "let", "with", "yield", "component");

    private static final Pattern EMBER_COMPONENT = Pattern.compile(
        "(?:from\\s+['\"]@(?:ember|glimmer)/component['\"]|Component\\.extend\\s*\\()");

    private static final Pattern COMPONENT_IMPORT = Pattern.compile(
        "import\\s+([A-Z][\\w$]*)\\s+from\\s+['\"][^'\"]*components/[^'\"]*['\"]");
    private static final Pattern CURLY_INVOCATION = Pattern.compile("\\{\\{#?([a-z][\\w]*(?:-[\\w]+)+)");
    private static final Pattern ANGLE_INVOCATION = Pattern.compile("<((?:[A-Z][\\w]*::)*[A-Z][\\w]*)[\\s/>]");
    private static final Pattern DYNAMIC_COMPONENT = Pattern.compile("\\{\\{#?component\\s+['\"]([\\w/-]+)['\"]");

    private static final Pattern ARGS_ACCESS = Pattern.compile("this\\.args\\.([A-Za-z_$][\\w$]*)");
    private static final Pattern TEMPLATE_ARG = Pattern.compile("@([A-Za-z_$][\\w$]*)");
    private static final Pattern TRACKED = Pattern.compile("@tracked\\s+([A-Za-z_$][\\w$]*)");
    private static final Pattern ACTION = Pattern.compile("@action\\s+(?:async\\s+)?([A-Za-z_$][\\w$]*)");
    private static final Pattern ACTIONS_BLOCK = Pattern.compile("actions\\s*:\\s*\\{((?:[^{}]|\\{(?:[^{}]|\\{[^{}]*\\})*\\})*)\\}");
    private static final Pattern ACTION_DECLARATION = Pattern.compile(
        "(?:^|[,{\\s])([A-Za-z_$][\\w$]*)\\s*(?::\\s*function\\s*)?\\([^)]*\\)\\s*\\{");

    @Override
    public String getId() {
        return ANALYZER_ID;
    }

    @Override
    public String getDisplayName() {
        return ANALYZER_DISPLAY_NAME;
    }

    @Override
    public ComponentType getComponentType() {
        return ComponentType.EMBER;
    }

    @Override
    public Set<String> getSupportedFilePatterns() {
        return SUPPORTED_FILE_PATTERNS;
    }

    @Override
    protected boolean isComponent(Path file, String content) {
        if (isTestFile(file)) {
            return false;
        }
        if (isTemplate(file)) {
            // folded into the class when one exists
            return !Files.isRegularFile(sibling(file, ".js"));
        }
        return matches(EMBER_COMPONENT, content);
    }

    @Override
    protected ParsedComponent parse(Path file, String content) throws IOException {
        String script = isTemplate(file) ? "" : content;
        String template = isTemplate(file) ? content : companionTemplate(file);
        String name = nameFromFile(file);

        Set<String> children = new LinkedHashSet<>();
        for (String curly : collect(CURLY_INVOCATION, template)) {
            addChild(children, NameUtils.toPascalCase(curly), name);
        }
        for (String angle : collect(ANGLE_INVOCATION, template)) {
            int namespace = angle.lastIndexOf("::");
            addChild(children, namespace >= 0 ? angle.substring(namespace + 2) : angle, name);
        }
        for (String dynamic : collect(DYNAMIC_COMPONENT, template)) {
            String last = dynamic.substring(dynamic.lastIndexOf('/') + 1);
            addChild(children, NameUtils.toPascalCase(last), name);
        }

        Set<String> hints = new LinkedHashSet<>();
        for (String imported : collect(COMPONENT_IMPORT, script)) {
            if (!imported.equals(name)) {
                hints.add(imported);
            }
        }
        hints.addAll(children);

        Set<String> props = new LinkedHashSet<>(collect(ARGS_ACCESS, script));
        props.addAll(collect(TEMPLATE_ARG, template));

        Set<String> methods = new LinkedHashSet<>(collect(ACTION, script));
        String actions = findFirst(ACTIONS_BLOCK, script);
        if (actions != null) {
            methods.addAll(withoutKeywords(collect(ACTION_DECLARATION, actions)));
        }

        return new ParsedComponent(
            name,
            file,
            getComponentType(),
            template.isEmpty() ? script : script + "\n" + template,
            hints,
            new ArrayList<>(props),
            new ArrayList<>(collect(TRACKED, script)),
            new ArrayList<>(methods),
            new ArrayList<>(children)
        );
    }

    private String companionTemplate(Path file) throws IOException {
        Path template = sibling(file, ".hbs");
        return Files.isRegularFile(template) ? readFileContent(template) : "";
    }

    private static boolean isTemplate(Path file) {
        return file.getFileName().toString().endsWith(".hbs");
    }

    private static Path sibling(Path file, String extension) {
        String base = NameUtils.baseName(file.getFileName().toString());
        return file.resolveSibling(base + extension);
    }

    private static void addChild(Set<String> children, String child, String self) {
        if (!child.equals(self) && !CURLY_HELPERS.contains(child.toLowerCase())) {
            children.add(child);
        }
    }
}
