package org.carball.pgdiag.model.statement;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

/**
 * One aggregated row of pg_stat_statements. Property names follow the view's columns
 * (PostgreSQL 13+); the pre-13 "*_time" names are accepted as aliases.
 */
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public record StatementStat(
        @JsonProperty("query") String query,
        @JsonProperty("calls") long calls,
        @JsonProperty("total_exec_time") @JsonAlias("total_time") double totalTimeMs,
        @JsonProperty("mean_exec_time") @JsonAlias("mean_time") double meanTimeMs,
        @JsonProperty("min_exec_time") @JsonAlias("min_time") double minTimeMs,
        @JsonProperty("max_exec_time") @JsonAlias("max_time") double maxTimeMs,
        @JsonProperty("stddev_exec_time") @JsonAlias("stddev_time") double stddevTimeMs,
        @JsonProperty("rows") long rows,
        @JsonProperty("shared_blks_hit") long sharedBlocksHit,
        @JsonProperty("shared_blks_read") long sharedBlocksRead
) {

    /**
     * Fraction of shared block accesses served from the buffer cache; 1.0 when nothing was read.
     */
    @JsonIgnore
    public double cacheHitRatio() {
        long accessed = sharedBlocksHit + sharedBlocksRead;
        if (accessed == 0) {
            return 1.0;
        }
        return (double) sharedBlocksHit / accessed;
    }

    @JsonIgnore
    public double rowsPerCall() {
        return calls == 0 ? 0.0 : (double) rows / calls;
    }
}
