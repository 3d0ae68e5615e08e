package org.carball.pgdiag.model.plan;

/**
 * Raw EXPLAIN payload as delivered by the data access layer: either the printed output in one of
 * PostgreSQL's formats, or a tree that has already been built. Explicit timings override whatever
 * the payload itself reports.
 */
public record PlanSource(
        String payload,
        PlanNode tree,
        PlanFormat format,
        Double planningTimeMs,
        Double executionTimeMs
) {

    public static PlanSource ofText(String text) {
        return new PlanSource(text, null, PlanFormat.TEXT, null, null);
    }

    public static PlanSource ofJson(String json) {
        return new PlanSource(json, null, PlanFormat.JSON, null, null);
    }

    public static PlanSource of(String payload, PlanFormat format) {
        return new PlanSource(payload, null, format, null, null);
    }

    public static PlanSource ofTree(PlanNode root, Double planningTimeMs, Double executionTimeMs) {
        return new PlanSource(null, root, PlanFormat.TREE, planningTimeMs, executionTimeMs);
    }

    public PlanSource withTimings(Double planningTimeMs, Double executionTimeMs) {
        return new PlanSource(payload, tree, format, planningTimeMs, executionTimeMs);
    }

    public int rawLength() {
        return payload != null ? payload.length() : 0;
    }
}
