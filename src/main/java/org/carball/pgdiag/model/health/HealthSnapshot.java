package org.carball.pgdiag.model.health;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.util.List;

/**
 * Read-only server health readings collected by the data access layer.
 * A null component means the source was unavailable; an empty list means it was read and had no rows.
 *
 * @param cacheHitRatio    database-wide buffer cache hit ratio in [0, 1]
 * @param expectedReplicas number of standbys that should be attached, null when unknown
 */
@Builder(toBuilder = true)
@JsonIgnoreProperties(ignoreUnknown = true)
public record HealthSnapshot(
        @JsonProperty("connections") ConnectionStats connections,
        @JsonProperty("database_size_bytes") Long databaseSizeBytes,
        @JsonProperty("largest_tables") List<TableSize> largestTables,
        @JsonProperty("cache_hit_ratio") Double cacheHitRatio,
        @JsonProperty("dead_tuples") List<TableDeadTuples> deadTuples,
        @JsonProperty("replicas") List<ReplicaStatus> replicas,
        @JsonProperty("expected_replicas") Integer expectedReplicas,
        @JsonProperty("long_running_queries") List<LongRunningQuery> longRunningQueries,
        @JsonProperty("table_bloat") List<TableBloat> tableBloat
) {

    public HealthSnapshot {
        largestTables = largestTables != null ? List.copyOf(largestTables) : null;
        deadTuples = deadTuples != null ? List.copyOf(deadTuples) : null;
        replicas = replicas != null ? List.copyOf(replicas) : null;
        longRunningQueries = longRunningQueries != null ? List.copyOf(longRunningQueries) : null;
        tableBloat = tableBloat != null ? List.copyOf(tableBloat) : null;
    }
}
