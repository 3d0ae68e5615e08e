package org.carball.pgdiag.model.plan;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.carball.pgdiag.model.finding.Finding;

import java.util.List;

/**
 * Result of analysing one plan. Timing is null when the plan carried no execution time.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PlanAnalysis(
        TimingSummary timing,
        List<Finding> findings,
        int nodeCount
) {

    public PlanAnalysis {
        findings = List.copyOf(findings);
    }
}
