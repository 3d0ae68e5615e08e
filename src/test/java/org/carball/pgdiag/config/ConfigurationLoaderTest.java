package org.carball.pgdiag.config;

import org.carball.pgdiag.exception.ThresholdConfigException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ConfigurationLoaderTest {

    @TempDir
    Path tempDir;

    private final ConfigurationLoader loader = new ConfigurationLoader(Map.of());

    @Test
    void shouldLoadDefaultsWithoutArguments() {
        // When
        Thresholds thresholds = loader.loadConfiguration(new String[0]);

        // Then
        assertThat(thresholds).isEqualTo(Thresholds.defaults());
    }

    @Test
    void shouldApplyCliArguments() {
        // Given
        String[] args = {
                "--thresholds.seq-scan-rows", "250",
                "--thresholds.limit", "5",
                "--thresholds.cache-hit-min", "0.95",
                "--thresholds.or-predicates", "4"
        };

        // When
        Thresholds thresholds = loader.loadConfiguration(args);

        // Then
        assertThat(thresholds.getSeqScanRowThreshold()).isEqualTo(250);
        assertThat(thresholds.getLimit()).isEqualTo(5);
        assertThat(thresholds.getCacheHitMin()).isEqualTo(0.95);
        assertThat(thresholds.getMultiOrPredicates()).isEqualTo(4);
    }

    @Test
    void shouldIgnoreInvalidNumericArguments() {
        // Given
        String[] args = {"--thresholds.limit", "many", "--thresholds.bloat", "0.3"};

        // When
        Thresholds thresholds = loader.loadConfiguration(args);

        // Then
        assertThat(thresholds.getLimit()).isEqualTo(20);
        assertThat(thresholds.getBloatThreshold()).isEqualTo(0.3);
    }

    @Test
    void shouldApplyEnvironmentVariables() {
        // Given
        ConfigurationLoader envLoader = new ConfigurationLoader(Map.of(
                "PGDIAG_LIMIT", "7",
                "PGDIAG_LONG_RUNNING_SECONDS", "60",
                "PGDIAG_MIN_DURATION_MS", "not-a-number"));

        // When
        Thresholds thresholds = envLoader.loadConfiguration(new String[0]);

        // Then
        assertThat(thresholds.getLimit()).isEqualTo(7);
        assertThat(thresholds.getLongRunningSeconds()).isEqualTo(60);
        assertThat(thresholds.getMinDurationMs()).isEqualTo(1000.0);
    }

    @Test
    void cliArgumentsShouldOverrideEnvironment() {
        // Given
        ConfigurationLoader envLoader = new ConfigurationLoader(Map.of("PGDIAG_LIMIT", "7"));

        // When
        Thresholds thresholds = envLoader.loadConfiguration(new String[]{"--thresholds.limit", "3"});

        // Then
        assertThat(thresholds.getLimit()).isEqualTo(3);
    }

    @Test
    void shouldOverlayArgumentsOnProfile() {
        // When
        Thresholds thresholds = loader.loadConfigurationWithProfile("strict",
                new String[]{"--thresholds.seq-scan-rows", "100"});

        // Then
        assertThat(thresholds.getProfileName()).isEqualTo("strict");
        assertThat(thresholds.getSeqScanRowThreshold()).isEqualTo(100);
        assertThat(thresholds.getCacheHitMin()).isEqualTo(0.95);
    }

    @Test
    void shouldRejectUnknownProfile() {
        assertThatThrownBy(() -> loader.loadProfile("unknown"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown threshold profile: unknown");
    }

    @Test
    void shouldRejectInvalidLimitFromArguments() {
        assertThatThrownBy(() -> loader.loadConfiguration(new String[]{"--thresholds.limit", "-1"}))
                .isInstanceOf(ThresholdConfigException.class)
                .hasMessageContaining("limit must be positive");
    }

    @Test
    void shouldLoadYamlThresholdsFile() throws IOException {
        // Given
        Path file = tempDir.resolve("thresholds.yaml");
        Files.writeString(file, """
                profile: relaxed
                seq_scan_row_threshold: 5000
                bloat_threshold: 0.25
                unknown_key: ignored
                """);
        ConfigurationLoader envLoader = new ConfigurationLoader(Map.of("PGDIAG_BLOAT_THRESHOLD", "0.4"));

        // When
        Thresholds thresholds = envLoader.loadConfigurationFromFile(file, new String[]{"--thresholds.limit", "8"});

        // Then
        assertThat(thresholds.getProfileName()).isEqualTo("relaxed");
        assertThat(thresholds.getSeqScanRowThreshold()).isEqualTo(5000);
        assertThat(thresholds.getMultiOrPredicates()).isEqualTo(5);
        assertThat(thresholds.getBloatThreshold()).isEqualTo(0.4);
        assertThat(thresholds.getLimit()).isEqualTo(8);
    }

    @Test
    void shouldFailForMissingThresholdsFile() {
        Path missing = tempDir.resolve("missing.yaml");

        assertThatThrownBy(() -> loader.loadConfigurationFromFile(missing, new String[0]))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("Thresholds file not found");
    }

    @Test
    void shouldDescribeConfigurationOptions() {
        String help = ConfigurationLoader.getThresholdHelp();

        assertThat(help).contains("Threshold Configuration Options:");
        assertThat(help).contains("--thresholds.seq-scan-rows");
        assertThat(help).contains("PGDIAG_LIMIT");
        assertThat(help).contains("Priority Order");
    }
}
