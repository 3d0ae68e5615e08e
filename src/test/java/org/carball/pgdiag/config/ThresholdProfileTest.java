package org.carball.pgdiag.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ThresholdProfileTest {

    @Test
    void defaultProfileShouldMatchBuiltInDefaults() {
        // When
        Thresholds thresholds = ThresholdProfile.DEFAULT.buildThresholds();

        // Then
        assertThat(thresholds).isEqualTo(Thresholds.defaults());
    }

    @Test
    void strictProfileShouldHalveCountAndTimeThresholds() {
        // When
        Thresholds thresholds = ThresholdProfile.STRICT.buildThresholds();

        // Then
        assertThat(thresholds.getProfileName()).isEqualTo("strict");
        assertThat(thresholds.getSeqScanRowThreshold()).isEqualTo(500);
        assertThat(thresholds.getNestedLoopThreshold()).isEqualTo(5000);
        assertThat(thresholds.getMinDurationMs()).isEqualTo(500.0);
        assertThat(thresholds.getHighCallThreshold()).isEqualTo(500);
        assertThat(thresholds.getCacheHitMin()).isEqualTo(0.95);
        assertThat(thresholds.getBloatThreshold()).isEqualTo(0.10);
        assertThat(thresholds.getLongRunningSeconds()).isEqualTo(120);
        assertThat(thresholds.getLimit()).isEqualTo(20);
    }

    @Test
    void relaxedProfileShouldDoubleThresholdsAndAllowMoreOrPredicates() {
        // When
        Thresholds thresholds = ThresholdProfile.RELAXED.buildThresholds();

        // Then
        assertThat(thresholds.getProfileName()).isEqualTo("relaxed");
        assertThat(thresholds.getSeqScanRowThreshold()).isEqualTo(2000);
        assertThat(thresholds.getSlowExecutionMs()).isEqualTo(2000.0);
        assertThat(thresholds.getMultiOrPredicates()).isEqualTo(5);
        assertThat(thresholds.getLongRunningSeconds()).isEqualTo(900);
    }

    @Test
    void everyProfileShouldProduceValidThresholds() {
        for (ThresholdProfile profile : ThresholdProfile.values()) {
            profile.buildThresholds().validate();
        }
    }

    @Test
    void shouldFindProfileByNameIgnoringCase() {
        assertThat(ThresholdProfile.fromName("Strict")).isEqualTo(ThresholdProfile.STRICT);
        assertThat(ThresholdProfile.fromName("relaxed")).isEqualTo(ThresholdProfile.RELAXED);
    }

    @Test
    void shouldRejectUnknownProfile() {
        assertThatThrownBy(() -> ThresholdProfile.fromName("aggressive"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unknown threshold profile: aggressive. Available profiles: default, strict, relaxed");
    }
}
