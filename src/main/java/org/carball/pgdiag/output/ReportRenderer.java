package org.carball.pgdiag.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.pgdiag.model.finding.Finding;
import org.carball.pgdiag.model.health.HealthMetric;
import org.carball.pgdiag.model.health.HealthReport;
import org.carball.pgdiag.model.health.TableSize;
import org.carball.pgdiag.model.plan.PlanAnalysis;
import org.carball.pgdiag.model.plan.TimingSummary;
import org.carball.pgdiag.model.statement.StatementFinding;
import org.carball.pgdiag.model.statement.StatementStat;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders a {@link DiagnosticsReport} as indented JSON or as plain text for a terminal.
 */
@Slf4j
public class ReportRenderer {

    private static final int QUERY_PREVIEW_LENGTH = 120;

    private final ObjectMapper objectMapper;

    public ReportRenderer() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public String toJson(DiagnosticsReport report) {
        try {
            return objectMapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            log.error("Error generating JSON report", e);
            throw new IllegalStateException("Failed to generate JSON report", e);
        }
    }

    public String toText(DiagnosticsReport report) {
        StringBuilder text = new StringBuilder();
        text.append("PostgreSQL Diagnostics Report\n");
        text.append("=============================\n\n");
        if (report.thresholdsSummary() != null) {
            text.append("Thresholds: ").append(report.thresholdsSummary()).append("\n\n");
        }

        if (report.plan() != null) {
            heading(text, ReportSection.PLAN);
            appendPlan(text, report.plan());
        }
        if (report.statements() != null) {
            heading(text, ReportSection.STATEMENTS);
            appendStatements(text, report.statements());
        }
        if (report.health() != null) {
            heading(text, ReportSection.HEALTH);
            appendHealth(text, report.health());
        }

        if (!report.failedSections().isEmpty()) {
            text.append("Failed Sections\n");
            text.append("---------------\n");
            for (Map.Entry<ReportSection, String> failure : report.failedSections().entrySet()) {
                text.append("  ").append(failure.getKey().getTitle()).append(": ")
                        .append(failure.getValue()).append("\n");
            }
            text.append("\n");
        }
        return text.toString();
    }

    private void appendPlan(StringBuilder text, PlanAnalysis plan) {
        TimingSummary timing = plan.timing();
        if (timing != null) {
            text.append(String.format(Locale.ROOT, "Planning: %.3f ms, Execution: %.3f ms, Total: %.3f ms\n",
                    timing.planningMs(), timing.executionMs(), timing.totalMs()));
        }
        text.append("Nodes analysed: ").append(plan.nodeCount()).append("\n");
        appendFindings(text, plan.findings(), "  ");
        text.append("\n");
    }

    private void appendStatements(StringBuilder text, List<StatementFinding> statements) {
        if (statements.isEmpty()) {
            text.append("No statements above the minimum mean time.\n\n");
            return;
        }
        for (StatementFinding entry : statements) {
            StatementStat stat = entry.statement();
            text.append(String.format(Locale.ROOT, "#%d  calls=%,d  mean=%.2f ms  total=%.2f ms  cache=%.1f%%\n",
                    entry.rank(), stat.calls(), stat.meanTimeMs(), stat.totalTimeMs(), stat.cacheHitRatio() * 100));
            text.append("    ").append(preview(stat.query())).append("\n");
            appendFindings(text, entry.findings(), "    ");
            text.append("\n");
        }
    }

    private void appendHealth(StringBuilder text, HealthReport health) {
        text.append("Score: ").append(health.score()).append("/100 (")
                .append(health.band().getDisplayName()).append(")\n\n");

        for (HealthMetric metric : health.metrics()) {
            text.append(String.format(Locale.ROOT, "  %-22s %5.1f/%-3d %s%s\n",
                    metric.domain().getDisplayName(), metric.achievedWeight(), metric.weight(),
                    metric.observed(), metric.applicable() ? "" : " (n/a)"));
        }
        text.append("\n");

        if (health.issues().isEmpty()) {
            text.append("No issues found.\n");
        } else {
            text.append("Issues:\n");
            appendFindings(text, health.issues(), "  ");
        }

        if (!health.largestTables().isEmpty()) {
            text.append("\nLargest tables:\n");
            for (TableSize table : health.largestTables()) {
                text.append("  ").append(table.table()).append("  ")
                        .append(formatBytes(table.sizeBytes())).append("\n");
            }
        }
        text.append("\n");
    }

    private static void appendFindings(StringBuilder text, List<Finding> findings, String indent) {
        for (Finding finding : findings) {
            text.append(indent).append("[").append(finding.severity()).append("] ")
                    .append(finding.message()).append("\n");
            if (finding.hasRemediation()) {
                text.append(indent).append("    -> ").append(finding.remediation()).append("\n");
            }
        }
    }

    private static void heading(StringBuilder text, ReportSection section) {
        text.append(section.getTitle()).append("\n");
        text.append("-".repeat(section.getTitle().length())).append("\n");
    }

    private static String preview(String query) {
        if (query == null) {
            return "";
        }
        String singleLine = query.replaceAll("\\s+", " ").trim();
        return singleLine.length() > QUERY_PREVIEW_LENGTH
                ? singleLine.substring(0, QUERY_PREVIEW_LENGTH) + "..."
                : singleLine;
    }

    static String formatBytes(long bytes) {
        if (bytes < 1024) {
            return bytes + " B";
        }
        String[] units = {"kB", "MB", "GB", "TB"};
        double value = bytes;
        int unit = -1;
        while (value >= 1024 && unit < units.length - 1) {
            value /= 1024;
            unit++;
        }
        return String.format(Locale.ROOT, "%.1f %s", value, units[unit]);
    }
}
