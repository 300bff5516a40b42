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
 * Analyzer for Angular components declared with {@code @Component} in {@code *.component.ts}
 * files.
 *
 * <p>An external {@code templateUrl} next to the component is read as well, so selector tags
 * in the template become dependency hints.
 *
 * <p>Selector tags are converted to class names by dropping the prefix segment and appending
 * {@code Component}: {@code <app-user-card>} becomes {@code UserCardComponent}.
 */
public class AngularAnalyzer extends AbstractRegexAnalyzer {

    private static final String ANALYZER_ID = "angular";
    private static final String ANALYZER_DISPLAY_NAME = "Angular Component Analyzer";
    private static final Set<String> SUPPORTED_FILE_PATTERNS = Set.of("**/*.component.ts");

    private static final Pattern COMPONENT_DECORATOR = Pattern.compile("@Component\\s*\\(");
    private static final Pattern CLASS_NAME = Pattern.compile("export\\s+class\\s+([A-Z][\\w$]*)");
    private static final Pattern SELECTOR = Pattern.compile("selector\\s*:\\s*['\"]([\\w-]+)['\"]");
    private static final Pattern TEMPLATE_URL = Pattern.compile("templateUrl\\s*:\\s*['\"]([^'\"]+)['\"]");
    private static final Pattern INLINE_TEMPLATE = Pattern.compile("template\\s*:\\s*`([^`]*)`");

    private static final Pattern RELATIVE_IMPORT = Pattern.compile("import\\s*\\{([^}]*)\\}\\s*from\\s*['\"]\\.");
    private static final Pattern ELEMENT_TAG = Pattern.compile("<([a-z][a-z0-9]*(?:-[a-z0-9]+)+)[\\s/>]");

    private static final Pattern INPUT = Pattern.compile("@Input\\s*\\([^)]*\\)\\s*(?:set\\s+)?([A-Za-z_$][\\w$]*)");
    private static final Pattern OUTPUT = Pattern.compile("@Output\\s*\\([^)]*\\)\\s*([A-Za-z_$][\\w$]*)");
    private static final Pattern FIELD = Pattern.compile(
        "^\\s+(?:(?:public|private|protected|readonly)\\s+)*([A-Za-z_$][\\w$]*)\\s*(?::\\s*[^=;\\n(]+)?=",
        Pattern.MULTILINE);
    private static final Pattern METHOD = Pattern.compile(
        "^\\s+(?:(?:public|private|protected|async)\\s+)*([A-Za-z_$][\\w$]*)\\s*\\([^)]*\\)\\s*(?::\\s*[^{;]+)?\\{",
        Pattern.MULTILINE);

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
        return ComponentType.ANGULAR;
    }

    @Override
    public Set<String> getSupportedFilePatterns() {
        return SUPPORTED_FILE_PATTERNS;
    }

    @Override
    protected boolean isComponent(Path file, String content) {
        return !isTestFile(file) && matches(COMPONENT_DECORATOR, content);
    }

    @Override
    protected ParsedComponent parse(Path file, String content) throws IOException {
        String className = findFirst(CLASS_NAME, content);
        String name = className != null ? className : nameFromFile(file) + "Component";
        String template = template(file, content);
        String ownSelector = findFirst(SELECTOR, content);

        Set<String> children = new LinkedHashSet<>();
        for (String tag : collect(ELEMENT_TAG, template)) {
            if (!tag.equals(ownSelector)) {
                children.add(selectorToClassName(tag));
            }
        }

        Set<String> hints = new LinkedHashSet<>();
        for (String list : collect(RELATIVE_IMPORT, content)) {
            for (String imported : splitIdentifiers(list)) {
                if (imported.endsWith("Component") && !imported.equals(name)) {
                    hints.add(imported);
                }
            }
        }
        hints.addAll(children);

        Set<String> inputs = collect(INPUT, content);
        Set<String> outputs = collect(OUTPUT, content);
        Set<String> state = new LinkedHashSet<>();
        for (String field : collect(FIELD, content)) {
            if (!inputs.contains(field) && !outputs.contains(field)) {
                state.add(field);
            }
        }
        Set<String> methods = new LinkedHashSet<>(withoutKeywords(collect(METHOD, content)));
        methods.addAll(outputs);

        return new ParsedComponent(
            name,
            file,
            getComponentType(),
            content + "\n" + template,
            hints,
            new ArrayList<>(inputs),
            new ArrayList<>(state),
            new ArrayList<>(methods),
            new ArrayList<>(children)
        );
    }

    /**
     * Converts {@code app-user-card} to {@code UserCardComponent}.
     *
     * @param selector element selector
     * @return conventional class name
     */
    static String selectorToClassName(String selector) {
        int dash = selector.indexOf('-');
        String withoutPrefix = dash > 0 ? selector.substring(dash + 1) : selector;
        return NameUtils.toPascalCase(withoutPrefix) + "Component";
    }

    private String template(Path file, String content) throws IOException {
        String inline = findFirst(INLINE_TEMPLATE, content);
        if (inline != null) {
            return inline;
        }
        String templateUrl = findFirst(TEMPLATE_URL, content);
        if (templateUrl == null || file.getParent() == null) {
            return "";
        }
        Path templateFile = file.getParent().resolve(templateUrl).normalize();
        if (!Files.isRegularFile(templateFile)) {
            log.debug("Template {} of {} not found", templateUrl, file);
            return "";
        }
        return readFileContent(templateFile);
    }
}
