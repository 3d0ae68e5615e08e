package org.carball.pgdiag.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.Consumer;

@Slf4j
public class ConfigurationLoader {

    private static final String ENV_PREFIX = "PGDIAG_";

    private final Map<String, String> environment;
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    public ConfigurationLoader() {
        this(System.getenv());
    }

    public ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    /**
     * Loads configuration using the hierarchy: CLI args > env vars > defaults
     */
    public Thresholds loadConfiguration(String[] args) {
        log.debug("Loading configuration");

        Thresholds.ThresholdsBuilder builder = Thresholds.builder();
        applyEnvironmentVariables(builder);
        applyCLIArguments(builder, args);

        Thresholds thresholds = builder.build();
        thresholds.validate();

        log.info("Configuration loaded: {}", thresholds.getConfigurationSummary());
        return thresholds;
    }

    public Thresholds loadProfile(String profileName) {
        try {
            ThresholdProfile profile = ThresholdProfile.fromName(profileName);
            Thresholds thresholds = profile.buildThresholds();
            log.info("Loaded profile '{}': {}", profileName, thresholds.getConfigurationSummary());
            return thresholds;
        } catch (IllegalArgumentException e) {
            log.error("Unknown profile: {}. {}", profileName, e.getMessage());
            throw e;
        }
    }

    /**
     * Loads and applies profile, then overlays with environment and CLI sources.
     */
    public Thresholds loadConfigurationWithProfile(String profileName, String[] args) {
        Thresholds.ThresholdsBuilder builder = loadProfile(profileName).toBuilder();

        applyEnvironmentVariables(builder);
        applyCLIArguments(builder, args);

        Thresholds thresholds = builder.build();
        thresholds.validate();

        log.info("Configuration loaded with profile '{}': {}", profileName, thresholds.getConfigurationSummary());
        return thresholds;
    }

    /**
     * Loads a YAML thresholds file. The file may name a profile as its base; its own keys are applied on top,
     * then environment variables and CLI arguments.
     */
    public Thresholds loadConfigurationFromFile(Path thresholdsFile, String[] args) throws IOException {
        if (!Files.exists(thresholdsFile)) {
            throw new IOException("Thresholds file not found: " + thresholdsFile);
        }
        ThresholdFileConfig fileConfig = yamlMapper.readValue(thresholdsFile.toFile(), ThresholdFileConfig.class);
        log.debug("Read thresholds file {}: {}", thresholdsFile, fileConfig);

        Thresholds.ThresholdsBuilder builder = fileConfig.getProfile() != null
                ? loadProfile(fileConfig.getProfile()).toBuilder()
                : Thresholds.builder();
        fileConfig.applyTo(builder);
        applyEnvironmentVariables(builder);
        applyCLIArguments(builder, args);

        Thresholds thresholds = builder.build();
        thresholds.validate();

        log.info("Configuration loaded from {}: {}", thresholdsFile, thresholds.getConfigurationSummary());
        return thresholds;
    }

    private void applyEnvironmentVariables(Thresholds.ThresholdsBuilder builder) {
        applyEnv("SEQ_SCAN_ROW_THRESHOLD", v -> builder.seqScanRowThreshold(Long.parseLong(v)));
        applyEnv("NESTED_LOOP_THRESHOLD", v -> builder.nestedLoopThreshold(Long.parseLong(v)));
        applyEnv("MIN_DURATION_MS", v -> builder.minDurationMs(Double.parseDouble(v)));
        applyEnv("LIMIT", v -> builder.limit(Integer.parseInt(v)));
        applyEnv("HIGH_CALL_THRESHOLD", v -> builder.highCallThreshold(Long.parseLong(v)));
        applyEnv("CACHE_HIT_MIN", v -> builder.cacheHitMin(Double.parseDouble(v)));
        applyEnv("LONG_RUNNING_SECONDS", v -> builder.longRunningSeconds(Long.parseLong(v)));
        applyEnv("BLOAT_THRESHOLD", v -> builder.bloatThreshold(Double.parseDouble(v)));
        applyEnv("MAX_PLAN_DEPTH", v -> builder.maxPlanDepth(Integer.parseInt(v)));
    }

    private void applyEnv(String suffix, Consumer<String> setter) {
        String name = ENV_PREFIX + suffix;
        String value = environment.get(name);
        if (value == null) {
            return;
        }
        try {
            setter.accept(value.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid numeric value for {}: {}", name, value);
        }
    }

    private void applyCLIArguments(Thresholds.ThresholdsBuilder builder, String[] args) {
        for (int i = 0; i < args.length - 1; i++) {
            String arg = args[i];
            String value = args[i + 1];

            try {
                switch (arg) {
                    case "--thresholds.seq-scan-rows":
                        builder.seqScanRowThreshold(Long.parseLong(value));
                        break;
                    case "--thresholds.nested-loop":
                        builder.nestedLoopThreshold(Long.parseLong(value));
                        break;
                    case "--thresholds.filter-rows-removed":
                        builder.filterRowsRemovedThreshold(Long.parseLong(value));
                        break;
                    case "--thresholds.slow-execution-ms":
                        builder.slowExecutionMs(Double.parseDouble(value));
                        break;
                    case "--thresholds.high-planning-ms":
                        builder.highPlanningMs(Double.parseDouble(value));
                        break;
                    case "--thresholds.max-plan-depth":
                        builder.maxPlanDepth(Integer.parseInt(value));
                        break;
                    case "--thresholds.min-duration-ms":
                        builder.minDurationMs(Double.parseDouble(value));
                        break;
                    case "--thresholds.limit":
                        builder.limit(Integer.parseInt(value));
                        break;
                    case "--thresholds.high-calls":
                        builder.highCallThreshold(Long.parseLong(value));
                        break;
                    case "--thresholds.cache-hit-min":
                        builder.cacheHitMin(Double.parseDouble(value));
                        break;
                    case "--thresholds.or-predicates":
                        builder.multiOrPredicates(Integer.parseInt(value));
                        break;
                    case "--thresholds.long-running-seconds":
                        builder.longRunningSeconds(Long.parseLong(value));
                        break;
                    case "--thresholds.bloat":
                        builder.bloatThreshold(Double.parseDouble(value));
                        break;
                }
            } catch (NumberFormatException e) {
                log.warn("Invalid numeric value for {}: {}", arg, value);
            }
        }
    }

    /**
     * Returns help text for threshold configuration options.
     */
    public static String getThresholdHelp() {
        return """
            Threshold Configuration Options:

            CLI Arguments:
              --thresholds.seq-scan-rows <num>        Estimated rows above which a sequential scan is flagged
              --thresholds.nested-loop <num>          Outer x inner row product above which a nested loop is flagged
              --thresholds.filter-rows-removed <num>  Rows discarded by filters above which the plan is flagged
              --thresholds.slow-execution-ms <num>    Execution time above which a plan is slow
              --thresholds.high-planning-ms <num>     Planning time above which planning is flagged
              --thresholds.max-plan-depth <num>       Deepest plan tree that will be analysed
              --thresholds.min-duration-ms <num>      Mean time below which statements are ignored
              --thresholds.limit <num>                Maximum number of statements reported
              --thresholds.high-calls <num>           Call count above which caching is suggested
              --thresholds.cache-hit-min <0..1>       Minimum acceptable per-statement cache hit ratio
              --thresholds.or-predicates <num>        OR-joined predicates that trigger an advisory
              --thresholds.long-running-seconds <num> Age at which an active query counts as long running
              --thresholds.bloat <0..1>               Bloat ratio above which a table is flagged

            Environment Variables:
              PGDIAG_SEQ_SCAN_ROW_THRESHOLD   Same as --thresholds.seq-scan-rows
              PGDIAG_NESTED_LOOP_THRESHOLD    Same as --thresholds.nested-loop
              PGDIAG_MIN_DURATION_MS          Same as --thresholds.min-duration-ms
              PGDIAG_LIMIT                    Same as --thresholds.limit
              PGDIAG_HIGH_CALL_THRESHOLD      Same as --thresholds.high-calls
              PGDIAG_CACHE_HIT_MIN            Same as --thresholds.cache-hit-min
              PGDIAG_LONG_RUNNING_SECONDS     Same as --thresholds.long-running-seconds
              PGDIAG_BLOAT_THRESHOLD          Same as --thresholds.bloat
              PGDIAG_MAX_PLAN_DEPTH           Same as --thresholds.max-plan-depth

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. Thresholds file
              4. Profile defaults or built-in defaults
            """;
    }
}
