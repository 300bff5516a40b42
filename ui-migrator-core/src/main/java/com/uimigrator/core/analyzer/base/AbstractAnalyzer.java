package com.uimigrator.core.analyzer.base;

import com.uimigrator.core.analyzer.AnalysisResult;
import com.uimigrator.core.analyzer.ComponentAnalyzer;
import com.uimigrator.core.model.ParsedComponent;
import com.uimigrator.core.util.FileUtils;
import com.uimigrator.core.util.NameUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Abstract base class for analyzer implementations providing common functionality.
 *
 * <p>This class reduces code duplication across analyzer implementations by providing:
 * <ul>
 *   <li>Logger initialization (one logger per analyzer class)</li>
 *   <li>The {@link #analyze(Path)} loop: file discovery, per-file error isolation, result assembly</li>
 *   <li>File reading and naming helpers</li>
 * </ul>
 *
 * <p>Concrete analyzers decide which files are components ({@link #isComponent(Path, String)})
 * and how to parse them ({@link #parse(Path, String)}).
 *
 * @see ComponentAnalyzer
 * @see AnalysisResult
 */
public abstract class AbstractAnalyzer implements ComponentAnalyzer {

    /**
     * Logger instance for this analyzer.
     * Automatically initialized with the concrete analyzer class name.
     */
    protected final Logger log;

    protected AbstractAnalyzer() {
        this.log = LoggerFactory.getLogger(getClass());
    }

    @Override
    public AnalysisResult analyze(Path root) {
        if (!Files.isDirectory(root)) {
            return failedResult(List.of("Source root is not a directory: " + root));
        }
        log.info("Analyzing {} components in: {}", getComponentType(), root);

        SortedSet<Path> candidates = new TreeSet<>();
        for (String pattern : getSupportedFilePatterns()) {
            try {
                candidates.addAll(FileUtils.findFiles(root, pattern));
            } catch (IOException e) {
                log.warn("Failed to list files matching {} in {}: {}", pattern, root, e.getMessage());
                return failedResult(List.of("Failed to list files in " + root + ": " + e.getMessage()));
            }
        }

        if (candidates.isEmpty()) {
            log.debug("No {} candidate files found in {}", getComponentType(), root);
            return emptyResult();
        }

        List<ParsedComponent> components = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        for (Path file : candidates) {
            try {
                Optional<ParsedComponent> parsed = analyzeFile(file);
                parsed.ifPresent(component -> {
                    components.add(component);
                    log.debug("Found {} component {} in {}", getComponentType(), component.name(), file);
                });
            } catch (IOException | RuntimeException e) {
                log.warn("Failed to parse file: {} - {}", file, e.getMessage());
                warnings.add("Failed to parse " + file + ": " + e.getMessage());
            }
        }

        log.info("Found {} {} components across {} files", components.size(), getComponentType(), candidates.size());
        return new AnalysisResult(getId(), true, components, candidates.size(), warnings, List.of());
    }

    @Override
    public Optional<ParsedComponent> analyzeFile(Path file) throws IOException {
        String content = readFileContent(file);
        if (!isComponent(file, content)) {
            return Optional.empty();
        }
        return Optional.of(parse(file, content));
    }

    /**
     * Decides whether a candidate file holds a component of this analyzer's type.
     *
     * @param file candidate file
     * @param content file content
     * @return true if the file should be parsed
     */
    protected abstract boolean isComponent(Path file, String content);

    /**
     * Parses a file already accepted by {@link #isComponent(Path, String)}.
     *
     * @param file component file
     * @param content file content
     * @return parsed component
     * @throws IOException if a companion file (template, style) cannot be read
     */
    protected abstract ParsedComponent parse(Path file, String content) throws IOException;

    // ==================== File Utilities ====================

    protected String readFileContent(Path file) throws IOException {
        return Files.readString(file);
    }

    /**
     * Derives a PascalCase component name from a file name.
     *
     * <p>{@code index.*} files take the name of their directory.
     *
     * @param file component file
     * @return component name
     */
    protected String nameFromFile(Path file) {
        String base = NameUtils.baseName(file.getFileName().toString());
        if ("index".equals(base) && file.getParent() != null && file.getParent().getFileName() != null) {
            base = file.getParent().getFileName().toString();
        }
        return NameUtils.toPascalCase(base);
    }

    protected static boolean isTestFile(Path file) {
        String fileName = file.getFileName().toString();
        return fileName.contains(".test.") || fileName.contains(".spec.") || fileName.contains(".stories.")
            || fileName.endsWith(".d.ts");
    }

    // ==================== AnalysisResult Creation Helpers ====================

    protected AnalysisResult emptyResult() {
        return AnalysisResult.empty(getId());
    }

    protected AnalysisResult failedResult(List<String> errors) {
        return AnalysisResult.failed(getId(), errors);
    }
}
