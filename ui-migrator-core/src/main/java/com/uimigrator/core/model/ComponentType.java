package com.uimigrator.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Objects;

/**
 * Source technology a component was written in.
 *
 * <p>A closed set of known frameworks plus an {@code Other(name)} escape hatch for anything
 * else. The type is assigned at discovery time and never changes afterwards.
 *
 * <p>Serialized as its label: {@code "React"}, {@code "Vue"}, {@code "Other(svelte)"}.
 *
 * @param kind framework tag
 * @param name display name ({@code "React"}) or the free-form name for {@link Kind#OTHER}
 */
public record ComponentType(Kind kind, String name) {

    /** Known source frameworks. */
    public enum Kind {
        REACT,
        EMBER,
        VUE,
        ANGULAR,
        RUBY,
        OTHER
    }

    public static final ComponentType REACT = new ComponentType(Kind.REACT, "React");
    public static final ComponentType EMBER = new ComponentType(Kind.EMBER, "Ember");
    public static final ComponentType VUE = new ComponentType(Kind.VUE, "Vue");
    public static final ComponentType ANGULAR = new ComponentType(Kind.ANGULAR, "Angular");
    public static final ComponentType RUBY = new ComponentType(Kind.RUBY, "Ruby");

    private static final String OTHER_PREFIX = "Other(";

    /**
     * Compact constructor with validation.
     */
    public ComponentType {
        Objects.requireNonNull(kind, "kind must not be null");
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        name = name.trim();
    }

    /**
     * Creates a type outside the known set.
     *
     * @param name technology name (e.g. "svelte")
     * @return other component type
     */
    public static ComponentType other(String name) {
        return new ComponentType(Kind.OTHER, name);
    }

    /**
     * Returns the stable label used in the store file and in IDs.
     *
     * @return label such as {@code "React"} or {@code "Other(svelte)"}
     */
    @JsonValue
    public String label() {
        return kind == Kind.OTHER ? OTHER_PREFIX + name + ")" : name;
    }

    /**
     * Parses a label produced by {@link #label()}.
     *
     * <p>Known names match case-insensitively; {@code Other(x)} and any unknown name map to
     * {@link Kind#OTHER}.
     *
     * @param label serialized label
     * @return component type
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static ComponentType fromLabel(String label) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("label must not be null or blank");
        }
        String trimmed = label.trim();
        if (trimmed.startsWith(OTHER_PREFIX) && trimmed.endsWith(")")) {
            return other(trimmed.substring(OTHER_PREFIX.length(), trimmed.length() - 1));
        }
        return switch (trimmed.toLowerCase(Locale.ROOT)) {
            case "react" -> REACT;
            case "ember" -> EMBER;
            case "vue" -> VUE;
            case "angular" -> ANGULAR;
            case "ruby" -> RUBY;
            default -> other(trimmed);
        };
    }

    /**
     * Directory name used under the output root for migrated files of this type.
     *
     * @return lower-case directory name
     */
    public String directoryName() {
        return name.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_-]", "_");
    }

    @Override
    public String toString() {
        return label();
    }
}
