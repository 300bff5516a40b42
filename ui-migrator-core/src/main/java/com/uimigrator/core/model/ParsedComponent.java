package com.uimigrator.core.model;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Structural summary of one component source file, produced by an analyzer.
 *
 * <p>Carries everything a generator needs to emit the target component and everything the
 * discovery step needs to track it.
 *
 * @param name component name, usually PascalCase
 * @param filePath source file
 * @param type source technology
 * @param sourceText full source text, used for complexity scoring
 * @param dependencyHints raw names of referenced components, unresolved
 * @param props input properties
 * @param stateFields local state fields
 * @param methods handlers and other methods
 * @param childComponents components rendered by this one
 */
public record ParsedComponent(
    String name,
    Path filePath,
    ComponentType type,
    String sourceText,
    Set<String> dependencyHints,
    List<String> props,
    List<String> stateFields,
    List<String> methods,
    List<String> childComponents
) {
    /**
     * Compact constructor with validation.
     */
    public ParsedComponent {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(filePath, "filePath must not be null");
        Objects.requireNonNull(type, "type must not be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        if (sourceText == null) {
            sourceText = "";
        }
        dependencyHints = dependencyHints == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(dependencyHints));
        props = props == null ? List.of() : List.copyOf(props);
        stateFields = stateFields == null ? List.of() : List.copyOf(stateFields);
        methods = methods == null ? List.of() : List.copyOf(methods);
        childComponents = childComponents == null ? List.of() : List.copyOf(childComponents);
    }
}
