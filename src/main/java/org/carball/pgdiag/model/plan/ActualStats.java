package org.carball.pgdiag.model.plan;

/**
 * Execution statistics attached to a node by EXPLAIN ANALYZE.
 * Times are null when the plan was produced with TIMING OFF or the node never executed.
 */
public record ActualStats(
        Double startupTimeMs,
        Double totalTimeMs,
        long rows,
        long loops
) {

    public static ActualStats neverExecuted() {
        return new ActualStats(null, null, 0, 0);
    }

    public boolean hasTiming() {
        return totalTimeMs != null;
    }

    public boolean wasExecuted() {
        return loops > 0;
    }
}
