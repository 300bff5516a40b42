package com.uimigrator.cli;

import com.uimigrator.core.config.MigrationConfig;
import com.uimigrator.core.migration.BatchResult;
import com.uimigrator.core.migration.MigrationManager;
import com.uimigrator.core.model.MigrationStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.ArgGroup;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Command to migrate components.
 *
 * <p>Without options, migrates the next batch of the plan.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Next batch
 * ui-migrator migrate
 *
 * # Everything, stopping at the first failure
 * ui-migrator migrate --all --fail-fast
 *
 * # One component
 * ui-migrator migrate --id 3f2a9c0d41b7e6a8
 * }</pre>
 */
@Command(
    name = "migrate",
    description = "Migrate the next batch, a single component, or everything",
    mixinStandardHelpOptions = true
)
public class MigrateCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(MigrateCommand.class);

    @Spec
    private CommandSpec spec;

    @Mixin
    private ConfigOptions configOptions;

    @ArgGroup(exclusive = true)
    private Scope scope;

    @Option(names = {"--fail-fast"}, description = "Mark failures Failed and stop instead of skipping them")
    private boolean failFast;

    @Option(names = {"-b", "--batch-size"}, description = "Components per batch (overrides config)")
    private Integer batchSize;

    static class Scope {
        @Option(names = {"--all"}, required = true, description = "Run batches until the plan is empty")
        boolean all;

        @Option(names = {"--id"}, required = true, description = "Migrate a single component")
        String id;
    }

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        try {
            MigrationConfig config = configOptions.load();
            if (failFast) {
                config = config.withSkipOnError(false);
            }
            if (batchSize != null) {
                config = config.withBatchSize(batchSize);
            }
            MigrationManager manager = MigrationManager.create(config);

            if (scope != null && scope.id != null) {
                Path migrated = manager.migrateComponent(scope.id);
                out.println("✓ Migrated " + scope.id + " to " + migrated);
            } else if (scope != null && scope.all) {
                MigrationStats stats = manager.runMigration();
                out.println("✓ Migration run finished");
                out.println();
                out.print(stats.progressSummary());
                return stats.failed() > 0 ? 1 : 0;
            } else {
                manager.reconcileInterrupted();
                BatchResult batch = manager.migrateBatch();
                printBatch(out, batch);
            }
            out.println();
            out.print(manager.store().progressSummary());
            return 0;
        } catch (Exception e) {
            log.error("Migration failed", e);
            spec.commandLine().getErr().println("✗ Migration failed: " + e.getMessage());
            return 1;
        }
    }

    private static void printBatch(PrintWriter out, BatchResult batch) {
        if (batch.isEmpty()) {
            out.println("✓ Nothing left to migrate");
            return;
        }
        out.println("✓ Migrated " + batch.completed().size() + " of " + batch.attempted().size() + " components");
        for (Map.Entry<String, String> skipped : batch.skipped().entrySet()) {
            out.println("  ⚠ Skipped " + skipped.getKey() + ": " + skipped.getValue());
        }
    }
}
