package com.uimigrator.cli;

import com.uimigrator.core.report.MarkdownReportGenerator;
import com.uimigrator.core.report.MigrationReport;
import com.uimigrator.core.report.MigrationReporter;
import com.uimigrator.core.store.ComponentStore;
import com.uimigrator.core.store.StoreFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command to write the Markdown migration report.
 *
 * <p>Reads the store only; never changes it.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ui-migrator report
 * ui-migrator report --file MIGRATION_REPORT.md
 * }</pre>
 */
@Command(
    name = "report",
    description = "Write the Markdown migration report",
    mixinStandardHelpOptions = true
)
public class ReportCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ReportCommand.class);

    @Spec
    private CommandSpec spec;

    @Mixin
    private ConfigOptions configOptions;

    @Option(names = {"-f", "--file"}, description = "Write the report to this file instead of standard output")
    private Path reportFile;

    @Override
    public Integer call() {
        try {
            ComponentStore store = StoreFile.load(configOptions.load().storeFile());
            MigrationReport report = new MigrationReporter().report(store);
            String markdown = new MarkdownReportGenerator().generate(report);

            if (reportFile == null) {
                spec.commandLine().getOut().print(markdown);
            } else {
                Path parent = reportFile.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                Files.writeString(reportFile, markdown);
                spec.commandLine().getOut().println("✓ Report written to " + reportFile);
            }
            return 0;
        } catch (Exception e) {
            log.error("Report failed", e);
            spec.commandLine().getErr().println("✗ Report failed: " + e.getMessage());
            return 1;
        }
    }
}
