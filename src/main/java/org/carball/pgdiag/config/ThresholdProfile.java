package org.carball.pgdiag.config;

import lombok.Getter;

/**
 * Preset threshold sets. The sensitivity multiplier scales every row, call and time threshold;
 * ratio thresholds are set per profile.
 */
@Getter
public enum ThresholdProfile {

    DEFAULT("default", "Balanced thresholds suitable for most databases",
            1.0, 0.90, 0.20, 300),

    STRICT("strict", "Flags problems early - for latency sensitive OLTP systems",
            0.5, 0.95, 0.10, 120),

    RELAXED("relaxed", "Only flags pronounced problems - for reporting and batch workloads",
            2.0, 0.85, 0.30, 900) {
        @Override
        public Thresholds buildThresholds() {
            return super.buildThresholds().toBuilder()
                    .multiOrPredicates(5) // reporting queries legitimately chain ORs
                    .build();
        }
    };

    private final String name;
    private final String description;
    private final double sensitivityMultiplier;
    private final double cacheHitMin;
    private final double bloatThreshold;
    private final long longRunningSeconds;

    ThresholdProfile(String name, String description, double sensitivityMultiplier,
                     double cacheHitMin, double bloatThreshold, long longRunningSeconds) {
        this.name = name;
        this.description = description;
        this.sensitivityMultiplier = sensitivityMultiplier;
        this.cacheHitMin = cacheHitMin;
        this.bloatThreshold = bloatThreshold;
        this.longRunningSeconds = longRunningSeconds;
    }

    public Thresholds buildThresholds() {
        Thresholds base = Thresholds.defaults();

        return base.toBuilder()
                .profileName(name)
                .seqScanRowThreshold(scale(base.getSeqScanRowThreshold()))
                .nestedLoopThreshold(scale(base.getNestedLoopThreshold()))
                .filterRowsRemovedThreshold(scale(base.getFilterRowsRemovedThreshold()))
                .slowExecutionMs(base.getSlowExecutionMs() * sensitivityMultiplier)
                .highPlanningMs(base.getHighPlanningMs() * sensitivityMultiplier)
                .minDurationMs(base.getMinDurationMs() * sensitivityMultiplier)
                .highCallThreshold(scale(base.getHighCallThreshold()))
                .rowsPerCallThreshold(base.getRowsPerCallThreshold() * sensitivityMultiplier)
                .cacheHitMin(cacheHitMin)
                .bloatThreshold(bloatThreshold)
                .longRunningSeconds(longRunningSeconds)
                .build();
    }

    private long scale(long value) {
        return (long) (value * sensitivityMultiplier);
    }

    /**
     * Finds profile by name (case-insensitive).
     */
    public static ThresholdProfile fromName(String name) {
        for (ThresholdProfile profile : values()) {
            if (profile.getName().equalsIgnoreCase(name)) {
                return profile;
            }
        }
        throw new IllegalArgumentException("Unknown threshold profile: " + name
                + ". Available profiles: " + getAvailableProfiles());
    }

    public static String getAvailableProfiles() {
        StringBuilder sb = new StringBuilder();
        for (ThresholdProfile profile : values()) {
            if (!sb.isEmpty()) sb.append(", ");
            sb.append(profile.getName());
        }
        return sb.toString();
    }
}
