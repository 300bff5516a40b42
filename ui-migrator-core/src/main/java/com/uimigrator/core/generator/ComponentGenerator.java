package com.uimigrator.core.generator;

import com.uimigrator.core.exceptions.GenerationException;
import com.uimigrator.core.model.ComponentType;
import com.uimigrator.core.model.ParsedComponent;

import java.nio.file.Path;

/**
 * Service Provider Interface for target code generators.
 *
 * <p>A generator turns a {@link ParsedComponent} of one source type into a target component
 * file. Implementations are discovered via {@link java.util.ServiceLoader} from
 * {@code META-INF/services/com.uimigrator.core.generator.ComponentGenerator}.
 *
 * <p><b>Implementation Requirements:</b>
 * <ul>
 *   <li>Must have a public no-arg constructor for ServiceLoader</li>
 *   <li>Output must be deterministic: the same input yields the same file content</li>
 *   <li>The output file name is derived from the component name in snake_case</li>
 * </ul>
 *
 * @see com.uimigrator.core.analyzer.ComponentAnalyzer
 * @see com.uimigrator.core.migration.MigrationRegistry
 */
public interface ComponentGenerator {

    /**
     * Returns a unique identifier for this generator, e.g. {@code "leptos-react"}.
     *
     * @return generator ID
     */
    String getId();

    /**
     * Returns a human-readable name used in CLI output and logs.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns the source component type this generator accepts.
     *
     * @return component type
     */
    ComponentType getComponentType();

    /**
     * Returns the extension of generated files, without leading dot.
     *
     * @return file extension, e.g. {@code "rs"}
     */
    String getFileExtension();

    /**
     * Generates the target component into a directory.
     *
     * @param component parsed source component
     * @param outputDir directory to write into, created if missing
     * @return path of the written file
     * @throws GenerationException if the component cannot be translated or written
     */
    Path generate(ParsedComponent component, Path outputDir) throws GenerationException;
}
