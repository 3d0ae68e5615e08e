package org.carball.pgdiag.model.health;

import org.carball.pgdiag.model.finding.Finding;

import java.util.List;

/**
 * Overall server health: weighted score, its band, per-metric detail and the issues sorted Critical first.
 */
public record HealthReport(
        int score,
        HealthBand band,
        List<HealthMetric> metrics,
        List<Finding> issues,
        List<TableSize> largestTables
) {

    public HealthReport {
        metrics = List.copyOf(metrics);
        issues = List.copyOf(issues);
        largestTables = largestTables != null ? List.copyOf(largestTables) : List.of();
    }
}
