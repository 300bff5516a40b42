package com.uimigrator.core.complexity;

import com.uimigrator.core.model.ComponentMetadata;
import com.uimigrator.core.model.ComponentType;

/**
 * Heuristic migration complexity of a component source text.
 *
 * <p>The score is
 * <pre>
 * 1 + size / 1000 + lines / 50 + methodLike + stateLike + conditionals / 5
 * </pre>
 * capped at {@value ComponentMetadata#MAX_COMPLEXITY}. Every term counts non-overlapping
 * occurrences of fixed markers, so appending text to a source never lowers its score.
 *
 * <p>Stateless and thread-safe.
 */
public class ComplexityScorer {

    /**
     * Scores a component source.
     *
     * @param sourceText component source, null is treated as empty
     * @param type component type selecting the method and state markers
     * @return score in [1, 100]
     */
    public int score(String sourceText, ComponentType type) {
        if (sourceText == null || sourceText.isEmpty()) {
            return ComponentMetadata.MIN_COMPLEXITY;
        }
        long score = 1;
        score += sourceText.length() / 1000;
        score += sourceText.lines().count() / 50;
        score += methodLike(sourceText, type);
        score += stateLike(sourceText, type);
        score += conditionals(sourceText) / 5;
        return (int) Math.min(ComponentMetadata.MAX_COMPLEXITY, score);
    }

    private static long methodLike(String text, ComponentType type) {
        return switch (type.kind()) {
            case REACT -> count(text, "function") + count(text, "=>");
            case EMBER -> count(text, "actions:") * 3 + count(text, "function");
            case VUE -> count(text, "methods:") * 3 + count(text, "function");
            case ANGULAR -> count(text, "ngOn") * 2 + count(text, "function");
            case RUBY, OTHER -> count(text, "function");
        };
    }

    private static long stateLike(String text, ComponentType type) {
        return switch (type.kind()) {
            case REACT -> count(text, "useState") * 2 + count(text, "useReducer") * 3;
            case EMBER -> count(text, "tracked") * 2;
            case VUE -> (count(text, "data:") + count(text, "data()")) * 2 + count(text, "computed:") * 2;
            case ANGULAR -> count(text, "@Input") + count(text, "@Output");
            case RUBY, OTHER -> 0;
        };
    }

    // "if" also covers v-if, *ngIf and {{#if
    private static long conditionals(String text) {
        return count(text, "if") + count(text, "switch") + count(text, "? :") * 2;
    }

    /**
     * Counts non-overlapping occurrences of a literal marker.
     *
     * @param text text to search
     * @param marker literal marker
     * @return occurrence count
     */
    static long count(String text, String marker) {
        long count = 0;
        int from = 0;
        while (true) {
            int index = text.indexOf(marker, from);
            if (index < 0) {
                return count;
            }
            count++;
            from = index + marker.length();
        }
    }
}
