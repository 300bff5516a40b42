package com.uimigrator.core.analyzer;

import com.uimigrator.core.model.ParsedComponent;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Base class for analyzer functional tests.
 *
 * <p>Provides a temporary source root and helpers for writing component fixtures into it.
 */
public abstract class AnalyzerTestBase {

    @TempDir
    protected Path tempDir;

    /**
     * Creates a file in the temp directory with the given content.
     *
     * @param relativePath path relative to tempDir (e.g., "components/UserCard.jsx")
     * @param content file content
     * @return the created file path
     * @throws IOException if file cannot be created
     */
    protected Path createFile(String relativePath, String content) throws IOException {
        Path filePath = tempDir.resolve(relativePath);
        Files.createDirectories(filePath.getParent());
        Files.writeString(filePath, content);
        return filePath;
    }

    /**
     * Finds the single component with the given name in a result.
     *
     * @param result analysis result
     * @param name component name
     * @return parsed component
     */
    protected static ParsedComponent component(AnalysisResult result, String name) {
        assertThat(result.components()).extracting(ParsedComponent::name).contains(name);
        return result.components().stream()
            .filter(component -> component.name().equals(name))
            .findFirst()
            .orElseThrow();
    }
}
