package org.carball.pgdiag.model.health;

import lombok.Getter;

@Getter
public enum HealthBand {
    EXCELLENT("Excellent", 90),
    GOOD("Good", 70),
    POOR("Poor", 0);

    private final String displayName;
    private final int minScore;

    HealthBand(String displayName, int minScore) {
        this.displayName = displayName;
        this.minScore = minScore;
    }

    public static HealthBand fromScore(double score) {
        if (score >= EXCELLENT.minScore) {
            return EXCELLENT;
        } else if (score >= GOOD.minScore) {
            return GOOD;
        } else {
            return POOR;
        }
    }
}
