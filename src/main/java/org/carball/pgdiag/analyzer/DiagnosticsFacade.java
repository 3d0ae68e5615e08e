package org.carball.pgdiag.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.pgdiag.config.Thresholds;
import org.carball.pgdiag.exception.DiagnosticsException;
import org.carball.pgdiag.exception.ThresholdConfigException;
import org.carball.pgdiag.model.health.HealthReport;
import org.carball.pgdiag.model.plan.PlanAnalysis;
import org.carball.pgdiag.model.statement.StatementFinding;
import org.carball.pgdiag.output.DiagnosticsReport;
import org.carball.pgdiag.output.ReportSection;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Runs the plan, statement and health analyzers over one request and assembles the report.
 *
 * <p>Thresholds are validated before anything runs. After that a failure in one section is
 * recorded in the report and never stops the other sections.
 */
@Slf4j
public class DiagnosticsFacade {

    private final PlanAnalyzer planAnalyzer;
    private final StatementPatternDetector statementDetector;
    private final HealthScorer healthScorer;

    public DiagnosticsFacade() {
        this(new PlanAnalyzer(), new StatementPatternDetector(), new HealthScorer());
    }

    public DiagnosticsFacade(PlanAnalyzer planAnalyzer,
                             StatementPatternDetector statementDetector,
                             HealthScorer healthScorer) {
        this.planAnalyzer = planAnalyzer;
        this.statementDetector = statementDetector;
        this.healthScorer = healthScorer;
    }

    /**
     * @throws ThresholdConfigException when the thresholds are invalid; no section is analysed then
     */
    public DiagnosticsReport diagnose(DiagnosticsRequest request, Thresholds thresholds) {
        thresholds.validate();
        log.info("Starting diagnostics run with thresholds profile '{}'", thresholds.getProfileName());

        Map<ReportSection, String> failures = new EnumMap<>(ReportSection.class);

        PlanAnalysis plan = request.plan() == null ? null
                : runSection(ReportSection.PLAN, failures,
                        () -> planAnalyzer.analyze(request.plan(), thresholds));

        List<StatementFinding> statements = request.statements() == null ? null
                : runSection(ReportSection.STATEMENTS, failures,
                        () -> statementDetector.detect(request.statements(), thresholds));

        HealthReport health = request.health() == null ? null
                : runSection(ReportSection.HEALTH, failures,
                        () -> healthScorer.score(request.health(), thresholds));

        if (failures.isEmpty()) {
            log.info("Diagnostics run complete");
        } else {
            log.warn("Diagnostics run complete with failed sections: {}", failures.keySet());
        }
        return new DiagnosticsReport(plan, statements, health, failures, thresholds.getConfigurationSummary());
    }

    private static <T> T runSection(ReportSection section, Map<ReportSection, String> failures, Supplier<T> analysis) {
        try {
            return analysis.get();
        } catch (DiagnosticsException e) {
            log.warn("{} section failed: {}", section.getTitle(), e.getMessage());
            failures.put(section, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected error in {} section", section.getTitle(), e);
            failures.put(section, "Unexpected error: " + e);
        }
        return null;
    }
}
