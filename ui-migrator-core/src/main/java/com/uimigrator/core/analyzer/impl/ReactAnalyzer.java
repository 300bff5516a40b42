package com.uimigrator.core.analyzer.impl;

import com.uimigrator.core.analyzer.base.AbstractRegexAnalyzer;
import com.uimigrator.core.model.ComponentType;
import com.uimigrator.core.model.ParsedComponent;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Analyzer for React function and class components.
 *
 * <p>A file is a component when it imports React or returns JSX. Test, story and declaration
 * files are ignored.
 *
 * <p><b>Dependency hints:</b>
 * <ul>
 *   <li>{@code import UserCard from './UserCard'}</li>
 *   <li>{@code import { Button, Modal as Dialog } from './ui'}</li>
 *   <li>{@code <UserCard />} JSX tags</li>
 * </ul>
 * Only PascalCase names are kept; React itself and fragments are ignored.
 *
 * @see com.uimigrator.core.generator.impl.LeptosReactGenerator
 */
public class ReactAnalyzer extends AbstractRegexAnalyzer {

    private static final String ANALYZER_ID = "react";
    private static final String ANALYZER_DISPLAY_NAME = "React Component Analyzer";
    private static final Set<String> SUPPORTED_FILE_PATTERNS = Set.of("**/*.jsx", "**/*.tsx", "**/*.js", "**/*.ts");
    private static final Set<String> IGNORED_NAMES = Set.of("React", "Fragment", "StrictMode", "Suspense");

    private static final Pattern REACT_IMPORT = Pattern.compile(
        "(?:from\\s+['\"]react['\"]|require\\(\\s*['\"]react['\"]\\s*\\))");
    private static final Pattern JSX_RETURN = Pattern.compile("return\\s*\\(?\\s*<[A-Za-z>]");

    private static final Pattern DEFAULT_EXPORT_FUNCTION = Pattern.compile(
        "export\\s+default\\s+function\\s+([A-Z][\\w$]*)");
    private static final Pattern FUNCTION_COMPONENT = Pattern.compile(
        "(?:^|\\s)function\\s+([A-Z][\\w$]*)\\s*\\(", Pattern.MULTILINE);
    private static final Pattern ARROW_COMPONENT = Pattern.compile(
        "(?:const|let)\\s+([A-Z][\\w$]*)\\s*(?::[^=]+)?=\\s*(?:React\\.memo\\()?\\s*(?:\\([^)]*\\)|[\\w$]+)\\s*=>");
    private static final Pattern CLASS_COMPONENT = Pattern.compile(
        "class\\s+([A-Z][\\w$]*)\\s+extends\\s+(?:React\\.)?(?:Pure)?Component");

    private static final Pattern DEFAULT_IMPORT = Pattern.compile(
        "import\\s+([A-Za-z_$][\\w$]*)\\s*(?:,\\s*\\{[^}]*\\})?\\s+from\\s+['\"]");
    private static final Pattern NAMED_IMPORT = Pattern.compile(
        "import\\s+(?:[\\w$]+\\s*,\\s*)?\\{([^}]*)\\}\\s*from\\s+['\"]");
    private static final Pattern JSX_TAG = Pattern.compile("<([A-Z][\\w$]*)(?:\\.[\\w$]+)?[\\s/>]");

    private static final Pattern DESTRUCTURED_PROPS = Pattern.compile(
        "(?:function\\s+[A-Z][\\w$]*|=)\\s*\\(\\s*\\{([^}]*)\\}");
    private static final Pattern PROPS_ACCESS = Pattern.compile("props\\.([A-Za-z_$][\\w$]*)");
    private static final Pattern USE_STATE = Pattern.compile(
        "\\[\\s*([A-Za-z_$][\\w$]*)\\s*,\\s*set[\\w$]*\\s*\\]\\s*=\\s*(?:React\\.)?use(?:State|Reducer)");
    private static final Pattern ARROW_HANDLER = Pattern.compile(
        "(?:const|let)\\s+([a-z][\\w$]*)\\s*=\\s*(?:async\\s*)?(?:useCallback\\(\\s*)?(?:async\\s*)?\\([^)]*\\)\\s*=>");
    private static final Pattern FUNCTION_HANDLER = Pattern.compile("function\\s+([a-z][\\w$]*)\\s*\\(");

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
        return ComponentType.REACT;
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
        return matches(REACT_IMPORT, content) || matches(JSX_RETURN, content);
    }

    @Override
    protected ParsedComponent parse(Path file, String content) {
        String name = componentName(file, content);

        Set<String> children = new LinkedHashSet<>();
        for (String tag : collect(JSX_TAG, content)) {
            if (!IGNORED_NAMES.contains(tag) && !tag.equals(name)) {
                children.add(tag);
            }
        }

        Set<String> hints = new LinkedHashSet<>();
        for (String imported : collect(DEFAULT_IMPORT, content)) {
            addHint(hints, imported, name);
        }
        for (String list : collect(NAMED_IMPORT, content)) {
            for (String imported : splitIdentifiers(list)) {
                addHint(hints, imported, name);
            }
        }
        hints.addAll(children);

        List<String> props = new ArrayList<>();
        Matcher destructured = DESTRUCTURED_PROPS.matcher(content);
        if (destructured.find()) {
            props.addAll(splitIdentifiers(destructured.group(1)));
        }
        for (String access : collect(PROPS_ACCESS, content)) {
            if (!props.contains(access)) {
                props.add(access);
            }
        }

        Set<String> methods = new LinkedHashSet<>(collect(ARROW_HANDLER, content));
        methods.addAll(collect(FUNCTION_HANDLER, content));

        return new ParsedComponent(
            name,
            file,
            getComponentType(),
            content,
            hints,
            props,
            new ArrayList<>(collect(USE_STATE, content)),
            withoutKeywords(methods),
            new ArrayList<>(children)
        );
    }

    private String componentName(Path file, String content) {
        for (Pattern pattern : List.of(DEFAULT_EXPORT_FUNCTION, CLASS_COMPONENT, FUNCTION_COMPONENT, ARROW_COMPONENT)) {
            String found = findFirst(pattern, content);
            if (found != null) {
                return found;
            }
        }
        return nameFromFile(file);
    }

    private static void addHint(Set<String> hints, String imported, String self) {
        if (isPascalCase(imported) && !IGNORED_NAMES.contains(imported) && !imported.equals(self)) {
            hints.add(imported);
        }
    }
}
