package com.uimigrator.cli;

import com.uimigrator.core.analyzer.ComponentAnalyzer;
import com.uimigrator.core.generator.ComponentGenerator;
import com.uimigrator.core.model.ComponentMetadata;
import com.uimigrator.core.model.MigrationState;
import com.uimigrator.core.store.ComponentStore;
import com.uimigrator.core.store.StoreFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.List;
import java.util.Locale;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Command to list tracked components, or the analyzers and generators on the classpath.
 *
 * <p>Analyzers and generators are discovered via Java Service Provider Interface (SPI).
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # All tracked components
 * ui-migrator list components
 *
 * # Only failed ones
 * ui-migrator list components --status failed
 *
 * # Installed analyzers and generators
 * ui-migrator list analyzers
 * ui-migrator list generators
 * }</pre>
 */
@Command(
    name = "list",
    description = "List tracked components, analyzers, or generators",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Spec
    private CommandSpec spec;

    @Mixin
    private ConfigOptions configOptions;

    @Parameters(
        index = "0",
        description = "Type to list: components, analyzers, or generators"
    )
    private String type;

    @Option(
        names = {"--status"},
        description = "Only components in this state: ${COMPLETION-CANDIDATES}"
    )
    private MigrationState status;

    @Override
    public Integer call() {
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "components", "component" -> listComponents();
            case "analyzers", "analyzer" -> listAnalyzers();
            case "generators", "generator" -> listGenerators();
            default -> {
                log.error("Unknown type: {}. Use: components, analyzers, or generators", type);
                spec.commandLine().getErr().println("✗ Unknown type: " + type);
                yield 1;
            }
        };
    }

    private int listComponents() {
        PrintWriter out = spec.commandLine().getOut();
        ComponentStore store = StoreFile.load(configOptions.load().storeFile());
        List<ComponentMetadata> components = status == null
            ? List.copyOf(store.getAll())
            : store.getByStatus(status);

        if (components.isEmpty()) {
            out.println("  No components found.");
            return 0;
        }
        for (ComponentMetadata component : components) {
            out.printf("  %s  %-30s %-10s %s%n",
                component.id(), component.name(), component.componentType(), component.status());
        }
        out.println();
        out.println(components.size() + " components");
        return 0;
    }

    private int listAnalyzers() {
        PrintWriter out = spec.commandLine().getOut();
        out.println("Available Analyzers:");
        out.println();

        boolean found = false;
        for (ComponentAnalyzer analyzer : ServiceLoader.load(ComponentAnalyzer.class)) {
            found = true;
            out.printf("  • %s (ID: %s)%n", analyzer.getDisplayName(), analyzer.getId());
            out.printf("    Component Type: %s%n", analyzer.getComponentType());
            out.printf("    File Patterns: %s%n", analyzer.getSupportedFilePatterns());
            out.println();
        }
        if (!found) {
            out.println("  No analyzers found.");
        }
        return 0;
    }

    private int listGenerators() {
        PrintWriter out = spec.commandLine().getOut();
        out.println("Available Generators:");
        out.println();

        boolean found = false;
        for (ComponentGenerator generator : ServiceLoader.load(ComponentGenerator.class)) {
            found = true;
            out.printf("  • %s (ID: %s)%n", generator.getDisplayName(), generator.getId());
            out.printf("    Component Type: %s%n", generator.getComponentType());
            out.printf("    File Extension: .%s%n", generator.getFileExtension());
            out.println();
        }
        if (!found) {
            out.println("  No generators found.");
        }
        return 0;
    }
}
