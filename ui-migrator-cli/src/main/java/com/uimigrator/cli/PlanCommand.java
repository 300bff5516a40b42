package com.uimigrator.cli;

import com.uimigrator.core.migration.MigrationManager;
import com.uimigrator.core.model.ComponentMetadata;
import com.uimigrator.core.plan.PrioritizedComponent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Command to print the migration plan.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ui-migrator plan
 * ui-migrator plan --limit 20 --scores
 * }</pre>
 */
@Command(
    name = "plan",
    description = "Show the order in which components will be migrated",
    mixinStandardHelpOptions = true
)
public class PlanCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(PlanCommand.class);

    @Spec
    private CommandSpec spec;

    @Mixin
    private ConfigOptions configOptions;

    @Option(names = {"-n", "--limit"}, description = "Show at most this many entries (default: all)")
    private Integer limit;

    @Option(names = {"--scores"}, description = "Show priority scores")
    private boolean showScores;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        try {
            MigrationManager manager = MigrationManager.create(configOptions.load());
            List<ComponentMetadata> plan = manager.plan();
            if (plan.isEmpty()) {
                out.println("✓ Nothing left to migrate");
                return 0;
            }

            Map<String, PrioritizedComponent> scores = manager.prioritize().stream()
                .collect(Collectors.toMap(PrioritizedComponent::id, Function.identity()));
            int shown = limit == null ? plan.size() : Math.min(limit, plan.size());
            out.println("Migration plan (" + plan.size() + " components):");
            for (int i = 0; i < shown; i++) {
                ComponentMetadata component = plan.get(i);
                StringBuilder line = new StringBuilder()
                    .append(String.format(Locale.ROOT, "%4d. %-30s %-10s complexity %3d",
                        i + 1, component.name(), component.componentType(), component.complexity()));
                PrioritizedComponent scored = scores.get(component.id());
                if (showScores && scored != null) {
                    line.append(String.format(Locale.ROOT, "  score %.3f", scored.score()));
                }
                if (scored != null && scored.outstandingDependencies() > 0) {
                    line.append("  (").append(scored.outstandingDependencies()).append(" unmet dependencies)");
                }
                out.println(line);
            }
            if (shown < plan.size()) {
                out.println("  ... " + (plan.size() - shown) + " more");
            }
            return 0;
        } catch (Exception e) {
            log.error("Planning failed", e);
            spec.commandLine().getErr().println("✗ Planning failed: " + e.getMessage());
            return 1;
        }
    }
}
