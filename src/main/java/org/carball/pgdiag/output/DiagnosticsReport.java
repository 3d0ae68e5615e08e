package org.carball.pgdiag.output;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.carball.pgdiag.model.health.HealthReport;
import org.carball.pgdiag.model.plan.PlanAnalysis;
import org.carball.pgdiag.model.statement.StatementFinding;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Result of one diagnostics run. A section is null when it was not requested or when it failed;
 * failures are listed in {@code failedSections} with the error message.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DiagnosticsReport(
        PlanAnalysis plan,
        List<StatementFinding> statements,
        HealthReport health,
        Map<ReportSection, String> failedSections,
        String thresholdsSummary
) {

    public DiagnosticsReport {
        statements = statements != null ? List.copyOf(statements) : null;
        failedSections = failedSections == null || failedSections.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(failedSections));
    }

    @JsonIgnore
    public boolean isComplete() {
        return failedSections.isEmpty();
    }

    public boolean hasFailed(ReportSection section) {
        return failedSections.containsKey(section);
    }
}
