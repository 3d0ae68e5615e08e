package org.carball.pgdiag.model.health;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Backend counts from pg_stat_activity, excluding the session that collected them.
 */
public record ConnectionStats(
        @JsonProperty("active") int active,
        @JsonProperty("idle") int idle,
        @JsonProperty("idle_in_transaction") int idleInTransaction,
        @JsonProperty("waiting") int waiting,
        @JsonProperty("total") int total,
        @JsonProperty("max_connections") int maxConnections
) {

    @JsonIgnore
    public double utilization() {
        return maxConnections <= 0 ? 0.0 : (double) total / maxConnections;
    }
}
