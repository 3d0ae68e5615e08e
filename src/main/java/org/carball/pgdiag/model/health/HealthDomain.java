package org.carball.pgdiag.model.health;

import lombok.Getter;
import org.carball.pgdiag.model.finding.FindingCategory;

/**
 * Scored health metrics and their weights. Weights sum to 100.
 */
@Getter
public enum HealthDomain {
    CONNECTIONS("Connections", 15, FindingCategory.CONNECTIONS),
    CACHE_HIT_RATIO("Cache hit ratio", 20, FindingCategory.CACHE_HIT_RATIO),
    VACUUM("Dead tuples", 15, FindingCategory.VACUUM),
    REPLICATION("Replication", 15, FindingCategory.REPLICATION),
    LONG_RUNNING("Long-running queries", 20, FindingCategory.LONG_RUNNING),
    BLOAT("Bloat", 15, FindingCategory.BLOAT);

    private final String displayName;
    private final int weight;
    private final FindingCategory category;

    HealthDomain(String displayName, int weight, FindingCategory category) {
        this.displayName = displayName;
        this.weight = weight;
        this.category = category;
    }
}
