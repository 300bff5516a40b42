package com.uimigrator.core.analyzer;

import com.uimigrator.core.model.ComponentType;
import com.uimigrator.core.model.ParsedComponent;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;
import java.util.Set;

/**
 * Service Provider Interface for component analyzers.
 *
 * <p>An analyzer finds and parses the components of one source technology. Implementations
 * are discovered via {@link java.util.ServiceLoader} from
 * {@code META-INF/services/com.uimigrator.core.analyzer.ComponentAnalyzer}.
 *
 * <p><b>Lifecycle:</b>
 * <ol>
 *   <li>Discovery calls {@link #analyze(Path)} for every configured source root</li>
 *   <li>The migration step calls {@link #analyzeFile(Path)} again for the one component being
 *       migrated, so generation always sees the current source</li>
 * </ol>
 *
 * <p><b>Implementation Requirements:</b>
 * <ul>
 *   <li>Must have a public no-arg constructor for ServiceLoader</li>
 *   <li>Must be stateless; the same instance analyzes every root</li>
 *   <li>{@link #analyze(Path)} must not throw for a single unreadable or unparsable file;
 *       such files are reported as warnings</li>
 * </ul>
 *
 * @see AnalysisResult
 * @see com.uimigrator.core.generator.ComponentGenerator
 */
public interface ComponentAnalyzer {

    /**
     * Returns a unique identifier for this analyzer, e.g. {@code "react"}.
     *
     * @return analyzer ID, never null
     */
    String getId();

    /**
     * Returns a human-readable name, e.g. {@code "React Component Analyzer"}.
     *
     * @return display name, never null
     */
    String getDisplayName();

    /**
     * Returns the component type this analyzer recognizes.
     *
     * @return component type, never null
     */
    ComponentType getComponentType();

    /**
     * Returns the glob patterns of candidate files, relative to a source root.
     *
     * @return set of glob patterns, never null
     */
    Set<String> getSupportedFilePatterns();

    /**
     * Finds and parses every component under a source root.
     *
     * @param root source root directory
     * @return analysis result, never null
     */
    AnalysisResult analyze(Path root);

    /**
     * Parses a single file.
     *
     * @param file component source file
     * @return parsed component, or empty if the file is not a component of this type
     * @throws IOException if the file cannot be read
     */
    Optional<ParsedComponent> analyzeFile(Path file) throws IOException;
}
