package org.carball.pgdiag.model.health;

import org.carball.pgdiag.model.finding.Finding;

import java.util.List;

/**
 * One scored health dimension.
 *
 * @param observed       human readable summary of the raw reading
 * @param subScore       achieved share of the weight, 0 to 100
 * @param achievedWeight points contributed to the overall score
 * @param applicable     false when the source data was unavailable and the metric was scored at full weight
 */
public record HealthMetric(
        HealthDomain domain,
        String observed,
        double subScore,
        int weight,
        double achievedWeight,
        boolean applicable,
        List<Finding> findings
) {

    public HealthMetric {
        findings = List.copyOf(findings);
    }
}
