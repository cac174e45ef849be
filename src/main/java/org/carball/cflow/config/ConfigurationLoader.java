package org.carball.cflow.config;

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

    static final String ENV_PREFIX = "CFLOW_";

    private final Map<String, String> environment;
    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    public ConfigurationLoader() {
        this(System.getenv());
    }

    public ConfigurationLoader(Map<String, String> environment) {
        this.environment = environment;
    }

    public ComplexityThresholds loadProfile(String profileName) {
        try {
            AnalysisProfile profile = AnalysisProfile.fromName(profileName);
            ComplexityThresholds thresholds = profile.buildThresholds();
            log.info("Loaded profile '{}': {}", profileName, thresholds.getConfigurationSummary());
            return thresholds;
        } catch (IllegalArgumentException e) {
            log.error("Unknown profile: {}. {}", profileName, e.getMessage());
            throw e;
        }
    }

    /**
     * Loads configuration using the full hierarchy:
     * CLI args > env vars > config file > profile > defaults.
     * The profile is taken from the argument, else from the config file, else from
     * {@code CFLOW_PROFILE}, else the default profile is used.
     *
     * @param profileName profile requested on the command line, may be null
     * @param configFile  YAML configuration file, may be null
     */
    public ComplexityThresholds loadConfiguration(String profileName, Path configFile, String[] args) throws IOException {
        ThresholdConfig fileConfig = configFile != null ? readConfigFile(configFile) : null;

        String effectiveProfile = profileName;
        if (effectiveProfile == null && fileConfig != null) {
            effectiveProfile = fileConfig.getProfile();
        }
        if (effectiveProfile == null) {
            effectiveProfile = environment.getOrDefault(ENV_PREFIX + "PROFILE", AnalysisProfile.DEFAULT.getName());
        }

        ComplexityThresholds.ComplexityThresholdsBuilder builder = loadProfile(effectiveProfile).toBuilder();
        if (fileConfig != null) {
            fileConfig.applyTo(builder);
        }
        applyEnvironmentVariables(builder);
        applyCLIArguments(builder, args);

        ComplexityThresholds thresholds = builder.build();
        thresholds.validate();

        log.info("Configuration loaded with profile '{}': {}", effectiveProfile, thresholds.getConfigurationSummary());
        return thresholds;
    }

    public ThresholdConfig readConfigFile(Path configFile) throws IOException {
        if (!Files.exists(configFile)) {
            throw new IllegalArgumentException("Configuration file not found: " + configFile);
        }
        String content = Files.readString(configFile);
        ThresholdConfig config = content.isBlank() ? null : yamlMapper.readValue(content, ThresholdConfig.class);
        if (config == null) {
            log.warn("Configuration file {} is empty, using profile values", configFile);
            return new ThresholdConfig();
        }
        log.info("Loaded configuration file: {}", configFile);
        return config;
    }

    private void applyEnvironmentVariables(ComplexityThresholds.ComplexityThresholdsBuilder builder) {
        String countBooleans = environment.get(ENV_PREFIX + "COUNT_BOOLEAN_OPERATORS");
        if (countBooleans != null) {
            builder.countBooleanOperators(Boolean.parseBoolean(countBooleans.trim()));
        }
        applyIntegerVariable("MAX_NESTING", builder::maxNesting);
        applyIntegerVariable("PARALLELISM", builder::parallelism);
        applyIntegerVariable("LOW_RISK_LIMIT", builder::lowRiskLimit);
        applyIntegerVariable("MODERATE_RISK_LIMIT", builder::moderateRiskLimit);
        applyIntegerVariable("HIGH_RISK_LIMIT", builder::highRiskLimit);
    }

    private void applyIntegerVariable(String suffix, Consumer<Integer> setter) {
        String name = ENV_PREFIX + suffix;
        String value = environment.get(name);
        if (value == null) {
            return;
        }
        try {
            setter.accept(Integer.parseInt(value.trim()));
        } catch (NumberFormatException e) {
            log.warn("Ignoring invalid numeric value for {}: {}", name, value);
        }
    }

    private void applyCLIArguments(ComplexityThresholds.ComplexityThresholdsBuilder builder, String[] args) {
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ("--count-boolean-operators".equals(arg)) {
                builder.countBooleanOperators(true);
                continue;
            }
            if (i + 1 >= args.length) {
                continue;
            }
            String value = args[i + 1];
            switch (arg) {
                case "--max-nesting":
                    builder.maxNesting(parseInt(arg, value));
                    break;
                case "--parallelism":
                    builder.parallelism(parseInt(arg, value));
                    break;
                case "--thresholds.low":
                    builder.lowRiskLimit(parseInt(arg, value));
                    break;
                case "--thresholds.moderate":
                    builder.moderateRiskLimit(parseInt(arg, value));
                    break;
                case "--thresholds.high":
                    builder.highRiskLimit(parseInt(arg, value));
                    break;
                default:
                    break;
            }
        }
    }

    private static int parseInt(String option, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid numeric value for " + option + ": " + value);
        }
    }

    public static String getThresholdHelp() {
        return """
            Threshold Configuration Options:

            CLI Arguments:
              --count-boolean-operators          Count each && and || as a decision point
              --max-nesting <num>                Deepest nesting accepted before a function is rejected
              --parallelism <num>                Worker threads per file (1 = sequential)
              --thresholds.low <num>             Highest complexity rated LOW
              --thresholds.moderate <num>        Highest complexity rated MODERATE
              --thresholds.high <num>            Highest complexity rated HIGH

            Environment Variables:
              CFLOW_PROFILE                      Profile used when none is given
              CFLOW_COUNT_BOOLEAN_OPERATORS      Same as --count-boolean-operators (true/false)
              CFLOW_MAX_NESTING                  Same as --max-nesting
              CFLOW_PARALLELISM                  Same as --parallelism
              CFLOW_LOW_RISK_LIMIT               Same as --thresholds.low
              CFLOW_MODERATE_RISK_LIMIT          Same as --thresholds.moderate
              CFLOW_HIGH_RISK_LIMIT              Same as --thresholds.high

            Priority Order (highest to lowest):
              1. CLI arguments
              2. Environment variables
              3. Configuration file (--config)
              4. Profile defaults or built-in defaults
            """;
    }
}
