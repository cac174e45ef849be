package org.carball.cflow.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ConfigurationLoaderTest {

    @TempDir
    Path tempDir;

    private ConfigurationLoader loader;

    @BeforeEach
    void setUp() {
        loader = new ConfigurationLoader(Map.of());
    }

    @Test
    void shouldLoadDefaultConfiguration() throws IOException {
        // When
        ComplexityThresholds thresholds = loader.loadConfiguration(null, null, new String[0]);

        // Then
        assertThat(thresholds.isCountBooleanOperators()).isFalse();
        assertThat(thresholds.getMaxNesting()).isEqualTo(256);
        assertThat(thresholds.getLowRiskLimit()).isEqualTo(10);
        assertThat(thresholds.getModerateRiskLimit()).isEqualTo(20);
        assertThat(thresholds.getHighRiskLimit()).isEqualTo(50);
        assertThat(thresholds.getParallelism()).isEqualTo(1);
        assertThat(thresholds.getProfileName()).isEqualTo("default");
    }

    @Test
    void shouldLoadSpecificProfile() {
        // When
        ComplexityThresholds thresholds = loader.loadProfile("STRICT");

        // Then
        assertThat(thresholds.isCountBooleanOperators()).isTrue();
        assertThat(thresholds.getLowRiskLimit()).isEqualTo(5);
        assertThat(thresholds.getProfileName()).isEqualTo("strict");
    }

    @Test
    void shouldThrowExceptionForUnknownProfile() {
        assertThatThrownBy(() -> loader.loadProfile("nonexistent"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown analysis profile: nonexistent")
                .hasMessageContaining("default, strict, lenient");
    }

    @Test
    void shouldParseCLIArguments() throws IOException {
        // Given
        String[] args = {
                "src", "--count-boolean-operators",
                "--max-nesting", "32",
                "--parallelism", "3",
                "--thresholds.low", "4",
                "--thresholds.moderate", "8",
                "--thresholds.high", "16"
        };

        // When
        ComplexityThresholds thresholds = loader.loadConfiguration(null, null, args);

        // Then
        assertThat(thresholds.isCountBooleanOperators()).isTrue();
        assertThat(thresholds.getMaxNesting()).isEqualTo(32);
        assertThat(thresholds.getParallelism()).isEqualTo(3);
        assertThat(thresholds.getLowRiskLimit()).isEqualTo(4);
        assertThat(thresholds.getModerateRiskLimit()).isEqualTo(8);
        assertThat(thresholds.getHighRiskLimit()).isEqualTo(16);
    }

    @Test
    void shouldRejectInvalidNumericArgument() {
        assertThatThrownBy(() -> loader.loadConfiguration(null, null, new String[]{"--parallelism", "many"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("--parallelism");
    }

    @Test
    void shouldRejectUnusableValues() {
        assertThatThrownBy(() -> loader.loadConfiguration(null, null, new String[]{"--parallelism", "0"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("parallelism must be positive");
    }

    @Test
    void shouldApplyEnvironmentVariablesAndIgnoreInvalidOnes() throws IOException {
        // Given
        ConfigurationLoader withEnv = new ConfigurationLoader(Map.of(
                "CFLOW_COUNT_BOOLEAN_OPERATORS", "true",
                "CFLOW_HIGH_RISK_LIMIT", "40",
                "CFLOW_MAX_NESTING", "not-a-number"));

        // When
        ComplexityThresholds thresholds = withEnv.loadConfiguration(null, null, new String[0]);

        // Then
        assertThat(thresholds.isCountBooleanOperators()).isTrue();
        assertThat(thresholds.getHighRiskLimit()).isEqualTo(40);
        assertThat(thresholds.getMaxNesting()).isEqualTo(256);
    }

    @Test
    void shouldApplyFullHierarchy() throws IOException {
        // Given
        Path configFile = Paths.get("src/test/resources/strict-config.yml");
        ConfigurationLoader withEnv = new ConfigurationLoader(Map.of(
                "CFLOW_HIGH_RISK_LIMIT", "30",
                "CFLOW_MODERATE_RISK_LIMIT", "12"));
        String[] args = {"--thresholds.moderate", "15"};

        // When
        ComplexityThresholds thresholds = withEnv.loadConfiguration(null, configFile, args);

        // Then - CLI > env vars > config file > profile > defaults
        assertThat(thresholds.getModerateRiskLimit()).isEqualTo(15); // CLI override
        assertThat(thresholds.getHighRiskLimit()).isEqualTo(30); // env over file
        assertThat(thresholds.getMaxNesting()).isEqualTo(64); // from file
        assertThat(thresholds.getLowRiskLimit()).isEqualTo(5); // from strict profile
        assertThat(thresholds.isCountBooleanOperators()).isTrue(); // from strict profile
        assertThat(thresholds.getFileExtensions()).containsExactly(".c", ".cpp");
        assertThat(thresholds.getProfileName()).isEqualTo("strict");
    }

    @Test
    void shouldPreferProfileArgumentOverFileProfile() throws IOException {
        ComplexityThresholds thresholds = loader.loadConfiguration(
                "lenient", Paths.get("src/test/resources/strict-config.yml"), new String[0]);

        assertThat(thresholds.getProfileName()).isEqualTo("lenient");
        assertThat(thresholds.getLowRiskLimit()).isEqualTo(15);
        assertThat(thresholds.getHighRiskLimit()).isEqualTo(25);
    }

    @Test
    void shouldUseProfileFromEnvironmentWhenNoneGiven() throws IOException {
        ConfigurationLoader withEnv = new ConfigurationLoader(Map.of("CFLOW_PROFILE", "lenient"));

        ComplexityThresholds thresholds = withEnv.loadConfiguration(null, null, new String[0]);

        assertThat(thresholds.getProfileName()).isEqualTo("lenient");
    }

    @Test
    void shouldIgnoreUnknownKeysAndToleratePartialFile() throws IOException {
        // Given
        Path configFile = tempDir.resolve("partial.yml");
        Files.writeString(configFile, """
            count_boolean_operators: true
            reporting_colour: blue
            """);

        // When
        ComplexityThresholds thresholds = loader.loadConfiguration(null, configFile, new String[0]);

        // Then
        assertThat(thresholds.isCountBooleanOperators()).isTrue();
        assertThat(thresholds.getProfileName()).isEqualTo("default");
        assertThat(thresholds.getHighRiskLimit()).isEqualTo(50);
    }

    @Test
    void shouldTreatEmptyFileAsNoOverrides() throws IOException {
        Path configFile = tempDir.resolve("empty.yml");
        Files.writeString(configFile, "");

        ComplexityThresholds thresholds = loader.loadConfiguration(null, configFile, new String[0]);

        assertThat(thresholds.getProfileName()).isEqualTo("default");
        assertThat(thresholds.getMaxNesting()).isEqualTo(256);
        assertThat(thresholds.getFileExtensions()).isEqualTo(ComplexityThresholds.DEFAULT_EXTENSIONS);
    }

    @Test
    void shouldRejectMissingConfigFile() {
        assertThatThrownBy(() -> loader.loadConfiguration(null, tempDir.resolve("nope.yml"), new String[0]))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Configuration file not found");
    }

    @Test
    void shouldDescribeEveryOptionInHelp() {
        assertThat(ConfigurationLoader.getThresholdHelp())
                .contains("--count-boolean-operators")
                .contains("CFLOW_HIGH_RISK_LIMIT")
                .contains("Priority Order");
    }
}
