package org.carball.pgdiag.model.finding;

import lombok.Getter;

@Getter
public enum FindingCategory {
    // Execution plan
    SEQ_SCAN("Sequential scan"),
    NESTED_LOOP("Nested loop"),
    EXTERNAL_SORT("External sort"),
    IN_MEMORY_SORT("In-memory sort"),
    HASH_BATCHES("Hash batches"),
    INDEX_USAGE_GOOD("Index usage"),
    FILTER_ROWS_REMOVED("Rows removed by filter"),
    SLOW_EXECUTION("Slow execution"),
    HIGH_PLANNING_TIME("High planning time"),

    // Statement statistics
    CACHE_POOR("Poor cache hit ratio"),
    WILDCARD_LIKE("Leading wildcard LIKE"),
    NOT_IN_EXISTS("NOT IN / NOT EXISTS"),
    MULTI_OR("Multiple OR predicates"),
    UNINDEXED_DISTINCT("DISTINCT"),
    HIGH_CALL_COUNT("High call count"),
    HIGH_VARIANCE("High variance"),
    LARGE_RESULT_SET("Large result set"),

    // Server health
    CONNECTIONS("Connections"),
    CACHE_HIT_RATIO("Cache hit ratio"),
    VACUUM("Vacuum"),
    REPLICATION("Replication"),
    LONG_RUNNING("Long-running queries"),
    BLOAT("Bloat");

    private final String displayName;

    FindingCategory(String displayName) {
        this.displayName = displayName;
    }
}
