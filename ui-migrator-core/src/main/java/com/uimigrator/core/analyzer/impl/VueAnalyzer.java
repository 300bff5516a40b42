package com.uimigrator.core.analyzer.impl;

import com.uimigrator.core.analyzer.base.AbstractRegexAnalyzer;
import com.uimigrator.core.model.ComponentType;
import com.uimigrator.core.model.ParsedComponent;
import com.uimigrator.core.util.NameUtils;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Analyzer for Vue single-file components and {@code Vue.component} / {@code defineComponent}
 * registrations in plain JavaScript.
 *
 * <p><b>Dependency hints:</b>
 * <ul>
 *   <li>{@code import UserCard from './UserCard.vue'}</li>
 *   <li>entries of the {@code components: { ... }} option</li>
 *   <li>PascalCase ({@code <UserCard>}) and kebab-case ({@code <user-card>}) template tags</li>
 * </ul>
 */
public class VueAnalyzer extends AbstractRegexAnalyzer {

    private static final String ANALYZER_ID = "vue";
    private static final String ANALYZER_DISPLAY_NAME = "Vue Component Analyzer";
    private static final Set<String> SUPPORTED_FILE_PATTERNS = Set.of("**/*.vue", "**/*.js");

    /** Kebab-case tags that are standard HTML or Vue built-ins, never components. */
    private static final Set<String> BUILT_IN_TAGS = Set.of(
        "router-view", "router-link", "keep-alive", "transition-group", "font-face"
    );

    private static final Pattern JS_REGISTRATION = Pattern.compile("(?:Vue\\.component\\s*\\(|defineComponent\\s*\\()");
    private static final Pattern REGISTERED_NAME = Pattern.compile("Vue\\.component\\s*\\(\\s*['\"]([\\w-]+)['\"]");
    private static final Pattern NAME_OPTION = Pattern.compile("\\bname\\s*:\\s*['\"]([\\w-]+)['\"]");

    private static final Pattern TEMPLATE_BLOCK = Pattern.compile("<template[^>]*>([\\s\\S]*)</template>");
    private static final Pattern DEFAULT_IMPORT = Pattern.compile("import\\s+([A-Z][\\w$]*)\\s+from\\s+['\"]");
    private static final Pattern COMPONENTS_OPTION = Pattern.compile("components\\s*:\\s*\\{([^}]*)\\}");
    private static final Pattern PASCAL_TAG = Pattern.compile("<([A-Z][\\w]*)[\\s/>]");
    private static final Pattern KEBAB_TAG = Pattern.compile("<([a-z][a-z0-9]*(?:-[a-z0-9]+)+)[\\s/>]");

    private static final Pattern PROPS_ARRAY = Pattern.compile("props\\s*:\\s*\\[([^\\]]*)\\]");
    private static final Pattern PROPS_OBJECT = Pattern.compile("props\\s*:\\s*\\{((?:[^{}]|\\{[^{}]*\\})*)\\}");
    private static final Pattern DEFINE_PROPS = Pattern.compile("defineProps\\s*\\(\\s*\\[([^\\]]*)\\]");
    private static final Pattern TOP_LEVEL_KEY = Pattern.compile("(?:^|,)\\s*['\"]?([A-Za-z_$][\\w$]*)['\"]?\\s*:");
    private static final Pattern QUOTED = Pattern.compile("['\"]([\\w-]+)['\"]");

    private static final Pattern DATA_RETURN = Pattern.compile("data\\s*(?:\\(\\s*\\)|:\\s*function\\s*\\(\\s*\\))\\s*\\{\\s*return\\s*\\{([^}]*)\\}");
    private static final Pattern REF_STATE = Pattern.compile("(?:const|let)\\s+([A-Za-z_$][\\w$]*)\\s*=\\s*(?:ref|reactive)\\s*\\(");
    private static final Pattern METHODS_BLOCK = Pattern.compile("methods\\s*:\\s*\\{((?:[^{}]|\\{(?:[^{}]|\\{[^{}]*\\})*\\})*)\\}");
    private static final Pattern METHOD_DECLARATION = Pattern.compile(
        "(?:^|[,{\\s])(?:async\\s+)?([A-Za-z_$][\\w$]*)\\s*(?::\\s*(?:async\\s+)?function\\s*)?\\([^)]*\\)\\s*\\{");

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
        return ComponentType.VUE;
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
        if (file.getFileName().toString().endsWith(".vue")) {
            return true;
        }
        return matches(JS_REGISTRATION, content);
    }

    @Override
    protected ParsedComponent parse(Path file, String content) {
        String name = componentName(file, content);
        String template = findFirst(TEMPLATE_BLOCK, content);
        String markup = template == null ? content : template;

        Set<String> children = new LinkedHashSet<>();
        for (String tag : collect(PASCAL_TAG, markup)) {
            addChild(children, tag, name);
        }
        for (String tag : collect(KEBAB_TAG, markup)) {
            if (!BUILT_IN_TAGS.contains(tag)) {
                addChild(children, NameUtils.toPascalCase(tag), name);
            }
        }

        Set<String> hints = new LinkedHashSet<>();
        for (String imported : collect(DEFAULT_IMPORT, content)) {
            if (!imported.equals("Vue") && !imported.equals(name)) {
                hints.add(imported);
            }
        }
        for (String registered : collect(COMPONENTS_OPTION, content)) {
            for (String entry : splitIdentifiers(registered)) {
                if (!entry.equals(name)) {
                    hints.add(entry);
                }
            }
        }
        hints.addAll(children);

        Set<String> state = new LinkedHashSet<>();
        String data = findFirst(DATA_RETURN, content);
        if (data != null) {
            state.addAll(collect(TOP_LEVEL_KEY, data));
        }
        state.addAll(collect(REF_STATE, content));

        List<String> methods = new ArrayList<>();
        String methodsBlock = findFirst(METHODS_BLOCK, content);
        if (methodsBlock != null) {
            methods.addAll(withoutKeywords(collect(METHOD_DECLARATION, methodsBlock)));
        }

        return new ParsedComponent(
            name,
            file,
            getComponentType(),
            content,
            hints,
            props(content),
            new ArrayList<>(state),
            methods,
            new ArrayList<>(children)
        );
    }

    private List<String> props(String content) {
        String array = findFirst(PROPS_ARRAY, content);
        if (array == null) {
            array = findFirst(DEFINE_PROPS, content);
        }
        if (array != null) {
            return new ArrayList<>(collect(QUOTED, array));
        }
        String object = findFirst(PROPS_OBJECT, content);
        if (object != null) {
            // drop nested option objects so only top-level keys remain
            String flattened = object.replaceAll("\\{[^{}]*\\}", "");
            return new ArrayList<>(collect(TOP_LEVEL_KEY, flattened));
        }
        return List.of();
    }

    private String componentName(Path file, String content) {
        String registered = findFirst(REGISTERED_NAME, content);
        if (registered != null) {
            return NameUtils.toPascalCase(registered);
        }
        String option = findFirst(NAME_OPTION, content);
        if (option != null) {
            return NameUtils.toPascalCase(option);
        }
        return nameFromFile(file);
    }

    private static void addChild(Set<String> children, String tag, String self) {
        if (!tag.equals(self)) {
            children.add(tag);
        }
    }
}
