package org.carball.pgdiag.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * Thresholds as written in a YAML thresholds file. Absent keys leave the underlying value untouched.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class ThresholdFileConfig {

    @JsonProperty("profile")
    private String profile;

    @JsonProperty("seq_scan_row_threshold")
    private Long seqScanRowThreshold;

    @JsonProperty("nested_loop_threshold")
    private Long nestedLoopThreshold;

    @JsonProperty("filter_rows_removed_threshold")
    private Long filterRowsRemovedThreshold;

    @JsonProperty("slow_execution_ms")
    private Double slowExecutionMs;

    @JsonProperty("high_planning_ms")
    private Double highPlanningMs;

    @JsonProperty("max_plan_depth")
    private Integer maxPlanDepth;

    @JsonProperty("min_duration_ms")
    private Double minDurationMs;

    @JsonProperty("limit")
    private Integer limit;

    @JsonProperty("high_call_threshold")
    private Long highCallThreshold;

    @JsonProperty("cache_hit_min")
    private Double cacheHitMin;

    @JsonProperty("multi_or_predicates")
    private Integer multiOrPredicates;

    @JsonProperty("long_running_seconds")
    private Long longRunningSeconds;

    @JsonProperty("bloat_threshold")
    private Double bloatThreshold;

    @JsonProperty("idle_in_transaction_threshold")
    private Integer idleInTransactionThreshold;

    public void applyTo(Thresholds.ThresholdsBuilder builder) {
        if (seqScanRowThreshold != null) builder.seqScanRowThreshold(seqScanRowThreshold);
        if (nestedLoopThreshold != null) builder.nestedLoopThreshold(nestedLoopThreshold);
        if (filterRowsRemovedThreshold != null) builder.filterRowsRemovedThreshold(filterRowsRemovedThreshold);
        if (slowExecutionMs != null) builder.slowExecutionMs(slowExecutionMs);
        if (highPlanningMs != null) builder.highPlanningMs(highPlanningMs);
        if (maxPlanDepth != null) builder.maxPlanDepth(maxPlanDepth);
        if (minDurationMs != null) builder.minDurationMs(minDurationMs);
        if (limit != null) builder.limit(limit);
        if (highCallThreshold != null) builder.highCallThreshold(highCallThreshold);
        if (cacheHitMin != null) builder.cacheHitMin(cacheHitMin);
        if (multiOrPredicates != null) builder.multiOrPredicates(multiOrPredicates);
        if (longRunningSeconds != null) builder.longRunningSeconds(longRunningSeconds);
        if (bloatThreshold != null) builder.bloatThreshold(bloatThreshold);
        if (idleInTransactionThreshold != null) builder.idleInTransactionThreshold(idleInTransactionThreshold);
    }
}
