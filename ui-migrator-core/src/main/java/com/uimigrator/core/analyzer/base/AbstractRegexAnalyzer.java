package com.uimigrator.core.analyzer.base;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Abstract base class for analyzers that read component source with regular expressions.
 *
 * <p>Source frameworks have no Java parser worth depending on, and the migration only needs a
 * structural outline: names, references, props, state and handlers. Regex matching is
 * best-effort; a missed reference only means a missing graph edge.
 *
 * @see AbstractAnalyzer
 */
public abstract class AbstractRegexAnalyzer extends AbstractAnalyzer {

    /** Identifier inside a brace-delimited list, with an optional {@code as} alias. */
    private static final Pattern LIST_ENTRY = Pattern.compile("([A-Za-z_$][\\w$]*)(?:\\s+as\\s+[\\w$]+)?");

    private static final Set<String> KEYWORDS = Set.of(
        "if", "for", "while", "switch", "catch", "function", "return", "constructor", "else", "do"
    );

    protected AbstractRegexAnalyzer() {
        super();
    }

    // ==================== Pattern Matching Utilities ====================

    /**
     * Collects one capture group of every match, in order of first appearance, without duplicates.
     *
     * @param pattern compiled regex pattern
     * @param text text to search
     * @param group group index
     * @return distinct captured values
     */
    protected Set<String> collect(Pattern pattern, String text, int group) {
        Set<String> values = new LinkedHashSet<>();
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            String value = matcher.group(group);
            if (value != null && !value.isBlank()) {
                values.add(value.trim());
            }
        }
        return values;
    }

    protected Set<String> collect(Pattern pattern, String text) {
        return collect(pattern, text, 1);
    }

    /**
     * Returns group 1 of the first match.
     *
     * @param pattern compiled regex pattern
     * @param text text to search
     * @return captured text, or null if the pattern does not match
     */
    protected String findFirst(Pattern pattern, String text) {
        Matcher matcher = pattern.matcher(text);
        return matcher.find() ? matcher.group(1) : null;
    }

    protected boolean matches(Pattern pattern, String text) {
        return pattern.matcher(text).find();
    }

    /**
     * Splits a comma separated identifier list such as the inside of
     * {@code import { A, B as C } from}.
     *
     * @param list raw list text
     * @return identifiers, aliases dropped
     */
    protected List<String> splitIdentifiers(String list) {
        List<String> names = new ArrayList<>();
        if (list == null) {
            return names;
        }
        for (String entry : list.split(",")) {
            Matcher matcher = LIST_ENTRY.matcher(entry.trim());
            if (matcher.lookingAt()) {
                names.add(matcher.group(1));
            }
        }
        return names;
    }

    /**
     * Removes control-flow keywords picked up by loose method patterns.
     *
     * @param names candidate method names
     * @return names that are not keywords
     */
    protected List<String> withoutKeywords(Set<String> names) {
        return names.stream()
            .filter(name -> !KEYWORDS.contains(name))
            .toList();
    }

    protected static boolean isPascalCase(String name) {
        return name != null && !name.isEmpty() && Character.isUpperCase(name.charAt(0));
    }
}
