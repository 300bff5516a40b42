package com.uimigrator;

import ch.qos.logback.classic.Level;
import com.uimigrator.cli.InitCommand;
import com.uimigrator.cli.ListCommand;
import com.uimigrator.cli.MigrateCommand;
import com.uimigrator.cli.PlanCommand;
import com.uimigrator.cli.ReportCommand;
import com.uimigrator.cli.RequeueCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;

/**
 * Main CLI entry point for the UI migrator.
 *
 * <p>Discovers UI components across source roots, orders them by their dependencies and
 * migrates them in resumable batches.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code init} - Discover components and build the dependency graph</li>
 *   <li>{@code plan} - Show the migration order</li>
 *   <li>{@code migrate} - Migrate the next batch, one component, or everything</li>
 *   <li>{@code report} - Write the Markdown migration report</li>
 *   <li>{@code requeue} - Put failed or skipped components back into the plan</li>
 *   <li>{@code list} - List tracked components or installed analyzers and generators</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * ui-migrator init ./frontend/src
 * ui-migrator plan --limit 20
 * ui-migrator migrate --all
 * ui-migrator report --file MIGRATION_REPORT.md
 * }</pre>
 */
@Command(
    name = "ui-migrator",
    mixinStandardHelpOptions = true,
    version = "UI Migrator 1.0.0-SNAPSHOT",
    description = "Incremental, dependency-aware UI component migration",
    subcommands = {
        InitCommand.class,
        PlanCommand.class,
        MigrateCommand.class,
        ReportCommand.class,
        RequeueCommand.class,
        ListCommand.class
    }
)
public class UiMigratorCLI implements Runnable {

    @Spec
    private CommandSpec spec;

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }
        PrintWriter out = spec.commandLine().getOut();
        out.println("UI Migrator - Incremental UI Component Migration");
        out.println("Version: 1.0.0-SNAPSHOT");
        out.println();
        out.println("Use 'ui-migrator --help' to see available commands");
        out.println("Use 'ui-migrator <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
    }

    /**
     * Creates the command line with logging configured before any subcommand runs.
     *
     * @return command line ready to execute
     */
    public static CommandLine commandLine() {
        UiMigratorCLI cli = new UiMigratorCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
