package com.uimigrator.cli;

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
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Command to put failed or skipped components back into the plan.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ui-migrator requeue 3f2a9c0d41b7e6a8
 * ui-migrator requeue --failed
 * }</pre>
 */
@Command(
    name = "requeue",
    description = "Reset failed, skipped or stuck components to Not Started",
    mixinStandardHelpOptions = true
)
public class RequeueCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RequeueCommand.class);

    @Spec
    private CommandSpec spec;

    @Mixin
    private ConfigOptions configOptions;

    @Parameters(description = "Component IDs", arity = "0..*")
    private List<String> ids;

    @Option(names = {"--failed"}, description = "Re-queue every failed and skipped component")
    private boolean allFailed;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        if (!allFailed && (ids == null || ids.isEmpty())) {
            err.println("✗ Give component IDs or --failed");
            return 1;
        }
        try {
            MigrationManager manager = MigrationManager.create(configOptions.load());
            if (allFailed) {
                int count = manager.requeueFailed();
                out.println("✓ Re-queued " + count + " components");
                return 0;
            }
            for (String id : ids) {
                if (manager.requeue(id)) {
                    out.println("✓ Re-queued " + id);
                } else {
                    out.println("  " + id + " is already waiting");
                }
            }
            return 0;
        } catch (Exception e) {
            log.error("Re-queue failed", e);
            err.println("✗ Re-queue failed: " + e.getMessage());
            return 1;
        }
    }
}
