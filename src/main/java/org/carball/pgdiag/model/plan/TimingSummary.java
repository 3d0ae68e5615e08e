package org.carball.pgdiag.model.plan;

public record TimingSummary(
        double planningMs,
        double executionMs,
        double totalMs
) {

    public static TimingSummary of(Double planningMs, double executionMs) {
        double planning = planningMs != null ? planningMs : 0.0;
        return new TimingSummary(planning, executionMs, planning + executionMs);
    }
}
