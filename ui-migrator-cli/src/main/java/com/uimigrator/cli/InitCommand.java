package com.uimigrator.cli;

import com.uimigrator.core.config.MigrationConfig;
import com.uimigrator.core.discovery.DiscoveryReport;
import com.uimigrator.core.graph.GraphBuildResult;
import com.uimigrator.core.migration.InitializationResult;
import com.uimigrator.core.migration.MigrationManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to discover components and build the dependency graph.
 *
 * <p>Safe to run repeatedly: known components keep their status, new ones are added.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Use the source roots from ui-migrator.yaml
 * ui-migrator init
 *
 * # Discover in explicit roots
 * ui-migrator init ./frontend/src ./legacy/app
 * }</pre>
 */
@Command(
    name = "init",
    description = "Discover components and build the dependency graph",
    mixinStandardHelpOptions = true
)
public class InitCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(InitCommand.class);

    @Spec
    private CommandSpec spec;

    @Mixin
    private ConfigOptions configOptions;

    @Parameters(description = "Source roots (override config)", arity = "0..*")
    private List<Path> sourceRoots;

    @Option(names = {"--no-dependencies"}, description = "Skip dependency detection")
    private boolean noDependencies;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            MigrationConfig config = configOptions.load();
            if (sourceRoots != null && !sourceRoots.isEmpty()) {
                config = config.withSourceRoots(sourceRoots.stream().map(Path::toString).toList());
            }
            if (noDependencies) {
                config = config.withAutoDetectDependencies(false);
            }
            if (config.sourceRoots().isEmpty()) {
                err.println("✗ No source roots given. Pass them as arguments or set sourceRoots in "
                    + configOptions.configPath);
                return 1;
            }

            MigrationManager manager = MigrationManager.create(config);
            InitializationResult result = manager.initialize();
            DiscoveryReport discovery = result.discovery();

            if (result.reconciled() > 0) {
                out.println("✓ Reset " + result.reconciled() + " components left in progress by an interrupted run");
            }
            out.println("✓ Discovered " + discovery.discovered() + " components in "
                + discovery.rootsScanned() + " source roots");
            out.println("  New: " + discovery.added() + ", already tracked: " + discovery.alreadyTracked());
            for (String error : discovery.errors()) {
                out.println("  ⚠ " + error);
            }
            if (!discovery.warnings().isEmpty()) {
                out.println("  " + discovery.warnings().size() + " files could not be parsed (see log)");
            }

            result.graphIfBuilt().ifPresent(graph -> printGraph(out, graph));

            out.println("✓ Store saved to " + config.storePath());
            out.println();
            out.print(manager.store().progressSummary());
            return 0;
        } catch (Exception e) {
            log.error("Initialization failed", e);
            err.println("✗ Initialization failed: " + e.getMessage());
            return 1;
        }
    }

    private static void printGraph(PrintWriter out, GraphBuildResult graph) {
        out.println("✓ Resolved " + graph.edgeCount() + " dependencies ("
            + graph.unresolvedHints() + " references unresolved)");
        for (List<String> cycle : graph.cycles()) {
            out.println("  ⚠ Dependency cycle: " + String.join(" -> ", cycle));
        }
    }
}
