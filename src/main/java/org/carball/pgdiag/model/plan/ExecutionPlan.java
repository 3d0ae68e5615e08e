package org.carball.pgdiag.model.plan;

import org.carball.pgdiag.exception.PlanParseException;

import java.util.Objects;

/**
 * A parsed plan tree plus the plan-level timings PostgreSQL reports after the tree.
 */
public record ExecutionPlan(
        PlanNode root,
        Double planningTimeMs,
        Double executionTimeMs,
        PlanFormat sourceFormat,
        int rawLength
) {

    public ExecutionPlan {
        Objects.requireNonNull(root, "root");
        if (executionTimeMs != null && !root.hasActual()) {
            throw new PlanParseException("Execution time is present but the root node carries no actual statistics");
        }
    }

    public static ExecutionPlan of(PlanNode root) {
        return new ExecutionPlan(root, null, null, PlanFormat.TREE, 0);
    }

    public boolean hasExecutionTime() {
        return executionTimeMs != null;
    }
}
