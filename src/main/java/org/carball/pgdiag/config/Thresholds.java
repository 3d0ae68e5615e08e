package org.carball.pgdiag.config;

import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.carball.pgdiag.exception.ThresholdConfigException;

import java.util.Locale;

/**
 * Immutable set of thresholds passed explicitly into every analyzer call.
 */
@Value
@Builder(toBuilder = true)
@Slf4j
public class Thresholds {

    // Execution plan
    @Builder.Default
    long seqScanRowThreshold = 1000;

    @Builder.Default
    long nestedLoopThreshold = 10_000;

    @Builder.Default
    long filterRowsRemovedThreshold = 1000;

    @Builder.Default
    double slowExecutionMs = 1000.0;

    @Builder.Default
    double highPlanningMs = 100.0;

    @Builder.Default
    int maxPlanDepth = 1000;

    // Statement statistics
    @Builder.Default
    double minDurationMs = 1000.0;

    @Builder.Default
    int limit = 20;

    @Builder.Default
    long highCallThreshold = 1000;

    @Builder.Default
    double cacheHitMin = 0.90;

    @Builder.Default
    int multiOrPredicates = 3;

    @Builder.Default
    double highVarianceRatio = 0.5;

    @Builder.Default
    double rowsPerCallThreshold = 1000.0;

    // Server health
    @Builder.Default
    long longRunningSeconds = 300;

    @Builder.Default
    double bloatThreshold = 0.20;

    @Builder.Default
    int idleInTransactionThreshold = 5;

    // Profile information
    @Builder.Default
    String profileName = "default";

    public static Thresholds defaults() {
        return Thresholds.builder().build();
    }

    /**
     * Rejects values no analysis can run with and warns about combinations that are legal but suspicious.
     *
     * @throws ThresholdConfigException on the first invalid value
     */
    public void validate() {
        if (limit <= 0) {
            throw new ThresholdConfigException("limit must be positive, got " + limit);
        }
        requireNonNegative("seqScanRowThreshold", seqScanRowThreshold);
        requireNonNegative("nestedLoopThreshold", nestedLoopThreshold);
        requireNonNegative("filterRowsRemovedThreshold", filterRowsRemovedThreshold);
        requireNonNegative("slowExecutionMs", slowExecutionMs);
        requireNonNegative("highPlanningMs", highPlanningMs);
        requireNonNegative("minDurationMs", minDurationMs);
        requireNonNegative("highCallThreshold", highCallThreshold);
        requireNonNegative("highVarianceRatio", highVarianceRatio);
        requireNonNegative("rowsPerCallThreshold", rowsPerCallThreshold);
        requireNonNegative("longRunningSeconds", longRunningSeconds);
        requireNonNegative("idleInTransactionThreshold", idleInTransactionThreshold);
        requireFraction("cacheHitMin", cacheHitMin);
        requireFraction("bloatThreshold", bloatThreshold);
        if (maxPlanDepth <= 0) {
            throw new ThresholdConfigException("maxPlanDepth must be positive, got " + maxPlanDepth);
        }
        if (multiOrPredicates < 2) {
            throw new ThresholdConfigException("multiOrPredicates must be at least 2, got " + multiOrPredicates);
        }

        if (highPlanningMs > slowExecutionMs) {
            log.warn("High planning threshold ({} ms) is above the slow execution threshold ({} ms)",
                    highPlanningMs, slowExecutionMs);
        }
        if (cacheHitMin < 0.5) {
            log.warn("Cache hit minimum ({}) is unusually low; most statements will pass it", cacheHitMin);
        }

        log.debug("Using thresholds - {}", getConfigurationSummary());
    }

    private static void requireNonNegative(String name, double value) {
        if (value < 0) {
            throw new ThresholdConfigException(name + " must not be negative, got " + value);
        }
    }

    private static void requireFraction(String name, double value) {
        if (value < 0.0 || value > 1.0) {
            throw new ThresholdConfigException(name + " must be between 0 and 1, got " + value);
        }
    }

    public String getConfigurationSummary() {
        return String.format(Locale.ROOT,
                "Profile: %s | Seq scan rows: %d | Nested loop: %d | Min duration: %.0f ms | Limit: %d | "
                        + "Cache hit min: %.2f | Long running: %d s | Bloat: %.2f",
                profileName, seqScanRowThreshold, nestedLoopThreshold, minDurationMs, limit,
                cacheHitMin, longRunningSeconds, bloatThreshold);
    }
}
