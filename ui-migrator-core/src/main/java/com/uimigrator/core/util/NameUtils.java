package com.uimigrator.core.util;

import java.util.Locale;

/**
 * Conversions between the naming styles used by source frameworks and generated code.
 */
public final class NameUtils {

    private NameUtils() {
        // Utility class
    }

    /**
     * Normalizes a component name for matching: lower case with {@code -}, {@code _}, {@code .}
     * and whitespace removed. {@code user-card}, {@code UserCard} and {@code user_card} all map
     * to {@code usercard}.
     *
     * @param name raw name
     * @return match key, empty for null input
     */
    public static String matchKey(String name) {
        if (name == null) {
            return "";
        }
        return name.replaceAll("[-_.\\s]", "").toLowerCase(Locale.ROOT);
    }

    /**
     * Converts {@code UserCard}, {@code user-card} or {@code userCard} to {@code user_card}.
     *
     * @param name raw name
     * @return snake_case name
     */
    public static String toSnakeCase(String name) {
        if (name == null || name.isBlank()) {
            return "";
        }
        String snake = name.trim()
            .replaceAll("([a-z0-9])([A-Z])", "$1_$2")
            .replaceAll("([A-Z]+)([A-Z][a-z])", "$1_$2")
            .replaceAll("[^A-Za-z0-9]+", "_")
            .toLowerCase(Locale.ROOT);
        return snake.replaceAll("^_+|_+$", "");
    }

    /**
     * Converts {@code user-card} or {@code user_card} to {@code UserCard}.
     *
     * @param name raw name
     * @return PascalCase name
     */
    public static String toPascalCase(String name) {
        if (name == null || name.isBlank()) {
            return "";
        }
        StringBuilder result = new StringBuilder();
        for (String part : name.trim().split("[^A-Za-z0-9]+")) {
            if (part.isEmpty()) {
                continue;
            }
            result.append(Character.toUpperCase(part.charAt(0)));
            result.append(part.substring(1));
        }
        return result.toString();
    }

    /**
     * Strips every extension from a file name: {@code user-card.component.ts} becomes
     * {@code user-card}.
     *
     * @param fileName file name without directories
     * @return base name
     */
    public static String baseName(String fileName) {
        int dot = fileName.indexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }
}
