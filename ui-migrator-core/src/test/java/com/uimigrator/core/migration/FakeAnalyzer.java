package com.uimigrator.core.migration;

import com.uimigrator.core.analyzer.AnalysisResult;
import com.uimigrator.core.analyzer.ComponentAnalyzer;
import com.uimigrator.core.model.ComponentType;
import com.uimigrator.core.model.ParsedComponent;
import com.uimigrator.core.util.FileUtils;
import com.uimigrator.core.util.NameUtils;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Analyzer over a toy component format: one file per component, named after it, where each
 * {@code uses X} line is a dependency on component {@code X}.
 */
public class FakeAnalyzer implements ComponentAnalyzer {

    private final ComponentType type;
    private final String extension;

    public FakeAnalyzer(ComponentType type, String extension) {
        this.type = type;
        this.extension = extension;
    }

    @Override
    public String getId() {
        return "fake-" + extension;
    }

    @Override
    public String getDisplayName() {
        return "Fake " + type + " Analyzer";
    }

    @Override
    public ComponentType getComponentType() {
        return type;
    }

    @Override
    public Set<String> getSupportedFilePatterns() {
        return Set.of("**/*." + extension);
    }

    @Override
    public AnalysisResult analyze(Path root) {
        try {
            List<Path> files = FileUtils.findFiles(root, "**/*." + extension);
            List<ParsedComponent> components = new ArrayList<>();
            for (Path file : files) {
                analyzeFile(file).ifPresent(components::add);
            }
            return new AnalysisResult(getId(), true, components, files.size(), List.of(), List.of());
        } catch (IOException e) {
            return AnalysisResult.failed(getId(), List.of(e.getMessage()));
        }
    }

    @Override
    public Optional<ParsedComponent> analyzeFile(Path file) throws IOException {
        String content = Files.readString(file);
        if (content.contains("not a component")) {
            return Optional.empty();
        }
        Set<String> hints = new LinkedHashSet<>();
        content.lines()
            .filter(line -> line.startsWith("uses "))
            .forEach(line -> hints.add(line.substring("uses ".length()).trim()));
        String name = NameUtils.baseName(file.getFileName().toString());
        return Optional.of(new ParsedComponent(name, file, type, content, hints, List.of(), List.of(), List.of(),
            new ArrayList<>(hints)));
    }
}
