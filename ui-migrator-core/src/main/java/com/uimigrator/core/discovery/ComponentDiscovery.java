package com.uimigrator.core.discovery;

import com.uimigrator.core.analyzer.AnalysisResult;
import com.uimigrator.core.analyzer.ComponentAnalyzer;
import com.uimigrator.core.complexity.ComplexityScorer;
import com.uimigrator.core.migration.MigrationRegistry;
import com.uimigrator.core.model.ComponentMetadata;
import com.uimigrator.core.model.ParsedComponent;
import com.uimigrator.core.store.ComponentStore;
import com.uimigrator.core.util.FileUtils;
import com.uimigrator.core.util.IdGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Runs every registered analyzer over the source roots and merges the findings into a store.
 *
 * <p>Discovery is idempotent: component IDs are derived from name, normalized path and type, so
 * running it again finds the same IDs. Known components keep their status, migrated path and
 * notes; only their dependency hints are refreshed from the current source.
 */
public class ComponentDiscovery {

    private static final Logger log = LoggerFactory.getLogger(ComponentDiscovery.class);

    private final MigrationRegistry registry;
    private final ComplexityScorer scorer;

    public ComponentDiscovery(MigrationRegistry registry, ComplexityScorer scorer) {
        this.registry = registry;
        this.scorer = scorer;
    }

    /**
     * Discovers components under the given roots.
     *
     * <p>A missing root or a failing analyzer is recorded in the report and skipped; the other
     * roots and analyzers still run.
     *
     * @param store store to merge into
     * @param sourceRoots directories to analyze
     * @return discovery summary
     */
    public DiscoveryReport discover(ComponentStore store, List<Path> sourceRoots) {
        List<String> warnings = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        int rootsScanned = 0;
        int discovered = 0;
        int added = 0;
        int alreadyTracked = 0;

        for (Path root : sourceRoots) {
            if (!Files.isDirectory(root)) {
                log.warn("Source root not found, skipping: {}", root);
                errors.add("Source root not found: " + root);
                continue;
            }
            rootsScanned++;

            for (ComponentAnalyzer analyzer : registry.analyzers()) {
                AnalysisResult result;
                try {
                    result = analyzer.analyze(root);
                } catch (RuntimeException e) {
                    log.error("Analyzer {} failed on {}: {}", analyzer.getId(), root, e.getMessage());
                    errors.add(analyzer.getDisplayName() + " failed on " + root + ": " + e.getMessage());
                    continue;
                }
                warnings.addAll(result.warnings());
                if (!result.success()) {
                    log.warn("Analyzer {} reported errors on {}: {}", analyzer.getId(), root, result.errors());
                    errors.addAll(result.errors());
                    continue;
                }

                for (ParsedComponent parsed : result.components()) {
                    discovered++;
                    String id = componentId(root, parsed);
                    Optional<ComponentMetadata> existing = store.get(id);
                    if (existing.isPresent()) {
                        store.replace(existing.get().withDependencyHints(parsed.dependencyHints()));
                        alreadyTracked++;
                    } else {
                        store.add(ComponentMetadata.discovered(
                            id,
                            parsed.name(),
                            parsed.filePath().toString(),
                            root.toString(),
                            parsed.type(),
                            scorer.score(parsed.sourceText(), parsed.type()),
                            parsed.dependencyHints()
                        ));
                        added++;
                    }
                }
            }
        }

        log.info("Discovered {} components in {} source roots ({} new, {} already tracked)",
            discovered, rootsScanned, added, alreadyTracked);
        return new DiscoveryReport(rootsScanned, discovered, added, alreadyTracked, warnings, errors);
    }

    /**
     * Derives the stable ID of a parsed component.
     *
     * @param root source root the component was found under
     * @param parsed parsed component
     * @return component ID
     */
    public static String componentId(Path root, ParsedComponent parsed) {
        String normalizedPath = FileUtils.normalizedPath(root, parsed.filePath());
        return IdGenerator.generate(parsed.name(), normalizedPath, parsed.type().label());
    }
}
