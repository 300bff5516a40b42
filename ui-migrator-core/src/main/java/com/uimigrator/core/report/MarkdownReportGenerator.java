package com.uimigrator.core.report;

import java.util.List;

/**
 * Renders a {@link MigrationReport} as Markdown with a Mermaid dependency graph.
 *
 * <p>Sections: progress summary, components by type, completed, failed and skipped components,
 * and the dependency graph. Empty sections carry a one-line placeholder instead of a table.
 */
public class MarkdownReportGenerator {

    private static final String NEWLINE = "\n";
    private static final String DOUBLE_NEWLINE = "\n\n";

    private static final String TITLE = "# Migration Report";
    private static final String GENERATED_LABEL = "Generated: ";
    private static final String PROGRESS_HEADER = "## Progress Summary";
    private static final String TYPES_HEADER = "## Components by Type";
    private static final String COMPLETED_HEADER = "## Completed Components";
    private static final String FAILED_HEADER = "## Failed Components";
    private static final String SKIPPED_HEADER = "## Skipped Components";
    private static final String GRAPH_HEADER = "## Dependency Graph";

    private static final String TYPES_TABLE = "| Type | Total | Completed |\n|------|-------|-----------|\n";
    private static final String COMPLETED_TABLE =
        "| Component | Type | Original Path | Migrated Path |\n|-----------|------|---------------|---------------|\n";
    private static final String FAILED_TABLE = "| Component | Type | Error |\n|-----------|------|-------|\n";
    private static final String SKIPPED_TABLE = "| Component | Type | Reason |\n|-----------|------|--------|\n";

    private static final String NO_COMPONENTS = "No components have been discovered yet.";
    private static final String NO_COMPLETED = "No components have been completed yet.";
    private static final String NO_FAILED = "No components have failed migration.";
    private static final String NO_SKIPPED = "No components have been skipped.";
    private static final String NO_DEPENDENCIES = "No dependencies detected.";

    private static final String CODE_BLOCK_START = "```mermaid\n";
    private static final String CODE_BLOCK_END = "```\n";
    private static final String GRAPH_TD = "graph TD;\n";
    private static final String ID_SANITIZATION_PATTERN = "[^a-zA-Z0-9_]";

    public String generate(MigrationReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append(TITLE).append(DOUBLE_NEWLINE);
        sb.append(GENERATED_LABEL).append(report.generatedAt()).append(DOUBLE_NEWLINE);

        sb.append(PROGRESS_HEADER).append(DOUBLE_NEWLINE);
        sb.append(report.stats().progressSummary()).append(NEWLINE);

        sb.append(TYPES_HEADER).append(DOUBLE_NEWLINE);
        if (report.types().isEmpty()) {
            sb.append(NO_COMPONENTS).append(DOUBLE_NEWLINE);
        } else {
            sb.append(TYPES_TABLE);
            for (MigrationReport.TypeSummary type : report.types()) {
                row(sb, type.type(), String.valueOf(type.total()), String.valueOf(type.completed()));
            }
            sb.append(NEWLINE);
        }

        sb.append(COMPLETED_HEADER).append(DOUBLE_NEWLINE);
        if (report.completed().isEmpty()) {
            sb.append(NO_COMPLETED).append(DOUBLE_NEWLINE);
        } else {
            sb.append(COMPLETED_TABLE);
            for (MigrationReport.CompletedRow completed : report.completed()) {
                row(sb, completed.name(), completed.type(), completed.sourcePath(), completed.migratedPath());
            }
            sb.append(NEWLINE);
        }

        sb.append(FAILED_HEADER).append(DOUBLE_NEWLINE);
        problems(sb, report.failed(), FAILED_TABLE, NO_FAILED);

        sb.append(SKIPPED_HEADER).append(DOUBLE_NEWLINE);
        problems(sb, report.skipped(), SKIPPED_TABLE, NO_SKIPPED);

        sb.append(GRAPH_HEADER).append(DOUBLE_NEWLINE);
        if (report.edges().isEmpty()) {
            sb.append(NO_DEPENDENCIES).append(NEWLINE);
        } else {
            sb.append(CODE_BLOCK_START).append(GRAPH_TD);
            for (MigrationReport.Edge edge : report.edges()) {
                sb.append("    ")
                    .append(sanitizeId(edge.sourceId())).append("[\"").append(escape(edge.sourceName())).append("\"]")
                    .append(" --> ")
                    .append(sanitizeId(edge.targetId())).append("[\"").append(escape(edge.targetName())).append("\"]")
                    .append(";\n");
            }
            sb.append(CODE_BLOCK_END);
        }
        return sb.toString();
    }

    private void problems(StringBuilder sb, List<MigrationReport.ProblemRow> rows, String table, String empty) {
        if (rows.isEmpty()) {
            sb.append(empty).append(DOUBLE_NEWLINE);
            return;
        }
        sb.append(table);
        for (MigrationReport.ProblemRow problem : rows) {
            row(sb, problem.name(), problem.type(), problem.reason());
        }
        sb.append(NEWLINE);
    }

    private void row(StringBuilder sb, String... cells) {
        sb.append('|');
        for (String cell : cells) {
            sb.append(' ').append(escapeMarkdown(cell)).append(" |");
        }
        sb.append(NEWLINE);
    }

    /**
     * Escapes markdown special characters.
     */
    private String escapeMarkdown(String text) {
        if (text == null) {
            return "-";
        }
        return text.replace("|", "\\|").replace("\n", " ");
    }

    private String sanitizeId(String id) {
        if (id == null) {
            return "unknown";
        }
        return id.replaceAll(ID_SANITIZATION_PATTERN, "_");
    }

    /**
     * Escapes a node label for use inside double quotes.
     */
    private String escape(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("\"", "#quot;").replace("\n", " ");
    }
}
