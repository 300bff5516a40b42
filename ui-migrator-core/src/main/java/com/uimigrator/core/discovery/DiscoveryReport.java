package com.uimigrator.core.discovery;

import java.util.List;

/**
 * Summary of one discovery pass.
 *
 * @param rootsScanned source roots that existed and were analyzed
 * @param discovered components found by all analyzers
 * @param added components newly added to the store
 * @param alreadyTracked components that were already tracked; only their hints were refreshed
 * @param warnings non-fatal problems (unparsable files)
 * @param errors missing roots and failed analyzers
 */
public record DiscoveryReport(
    int rootsScanned,
    int discovered,
    int added,
    int alreadyTracked,
    List<String> warnings,
    List<String> errors
) {
    public DiscoveryReport {
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
