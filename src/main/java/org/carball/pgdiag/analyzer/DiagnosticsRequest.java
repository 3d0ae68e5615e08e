package org.carball.pgdiag.analyzer;

import lombok.Builder;
import org.carball.pgdiag.model.health.HealthSnapshot;
import org.carball.pgdiag.model.plan.PlanSource;
import org.carball.pgdiag.model.statement.StatementStat;

import java.util.List;

/**
 * Inputs for one diagnostics run. Any section left null is skipped.
 */
@Builder
public record DiagnosticsRequest(
        PlanSource plan,
        List<StatementStat> statements,
        HealthSnapshot health
) {

    public DiagnosticsRequest {
        statements = statements != null ? List.copyOf(statements) : null;
    }
}
