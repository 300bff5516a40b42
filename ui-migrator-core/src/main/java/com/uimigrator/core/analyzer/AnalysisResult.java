package com.uimigrator.core.analyzer;

import com.uimigrator.core.model.ParsedComponent;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of analyzing one source root.
 *
 * @param analyzerId analyzer that produced the result
 * @param success false if the root could not be analyzed at all
 * @param components parsed components
 * @param filesScanned number of candidate files inspected
 * @param warnings non-fatal problems, such as a file that failed to parse
 * @param errors fatal problems, only present when {@code success} is false
 */
public record AnalysisResult(
    String analyzerId,
    boolean success,
    List<ParsedComponent> components,
    int filesScanned,
    List<String> warnings,
    List<String> errors
) {
    /**
     * Compact constructor with validation.
     */
    public AnalysisResult {
        Objects.requireNonNull(analyzerId, "analyzerId must not be null");
        components = components == null ? List.of() : List.copyOf(components);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    /**
     * Creates a successful result with no findings.
     *
     * @param analyzerId analyzer ID
     * @return empty successful result
     */
    public static AnalysisResult empty(String analyzerId) {
        return new AnalysisResult(analyzerId, true, List.of(), 0, List.of(), List.of());
    }

    /**
     * Creates a failed result.
     *
     * @param analyzerId analyzer ID
     * @param errors error messages
     * @return failed result
     */
    public static AnalysisResult failed(String analyzerId, List<String> errors) {
        return new AnalysisResult(analyzerId, false, List.of(), 0, List.of(), errors);
    }
}
