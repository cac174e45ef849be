package org.carball.cflow.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.carball.cflow.config.AnalyzerConfig;
import org.carball.cflow.config.ConfigurationLoader;
import org.carball.cflow.config.OutputFormat;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class CfgMetricsCLITest {

    @TempDir
    Path tempDir;

    private ConfigurationLoader loader;
    private Path source;

    @BeforeEach
    void setUp() throws IOException {
        loader = new ConfigurationLoader(Map.of());
        source = tempDir.resolve("branches.c");
        Files.writeString(source, """
            int sign(int x) {
                if (x > 0) {
                    return 1;
                } else if (x < 0) {
                    return -1;
                }
                return 0;
            }

            int identity(int x) {
                return x;
            }
            """);
    }

    private String[] args(String... rest) {
        String[] all = new String[rest.length + 1];
        all[0] = source.toString();
        System.arraycopy(rest, 0, all, 1, rest.length);
        return all;
    }

    @Test
    void shouldParseArgumentsWithDefaults() throws IOException {
        // When
        AnalyzerConfig config = CfgMetricsCLI.parseArgs(args(), loader);

        // Then
        assertThat(config.getInputs()).containsExactly(source);
        assertThat(config.getOutputFile()).isEqualTo("complexity-report.json");
        assertThat(config.getOutputFormat()).isEqualTo(OutputFormat.JSON);
        assertThat(config.isIncludeMermaid()).isFalse();
        assertThat(config.getFailOver()).isNull();
        assertThat(config.getThresholds().getProfileName()).isEqualTo("default");
    }

    @Test
    void shouldParseAllOptions() throws IOException {
        // Given
        String output = tempDir.resolve("report.json").toString();

        // When
        AnalyzerConfig config = CfgMetricsCLI.parseArgs(args(
                "-o", output, "-f", "markdown", "--profile", "strict", "--mermaid",
                "--fail-over", "12", "--parallelism", "2", "--thresholds.high", "30"), loader);

        // Then
        assertThat(config.getOutputFile()).isEqualTo(tempDir.resolve("report.md").toString());
        assertThat(config.getOutputFormat()).isEqualTo(OutputFormat.MARKDOWN);
        assertThat(config.isIncludeMermaid()).isTrue();
        assertThat(config.getFailOver()).isEqualTo(12);
        assertThat(config.getThresholds().getProfileName()).isEqualTo("strict");
        assertThat(config.getThresholds().getParallelism()).isEqualTo(2);
        assertThat(config.getThresholds().getHighRiskLimit()).isEqualTo(30);
    }

    @Test
    void shouldRejectBadArguments() {
        assertThatThrownBy(() -> CfgMetricsCLI.parseArgs(args("--format", "xml"), loader))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid output format");
        assertThatThrownBy(() -> CfgMetricsCLI.parseArgs(args("--bogus"), loader))
                .hasMessage("Unknown option: --bogus");
        assertThatThrownBy(() -> CfgMetricsCLI.parseArgs(args("--output"), loader))
                .hasMessage("Missing value for --output");
        assertThatThrownBy(() -> CfgMetricsCLI.parseArgs(args("--fail-over", "0"), loader))
                .hasMessageContaining("must be a positive number");
        assertThatThrownBy(() -> CfgMetricsCLI.parseArgs(new String[]{"-f", "json"}, loader))
                .hasMessage("No input files or directories given");
        assertThatThrownBy(() -> CfgMetricsCLI.parseArgs(new String[]{tempDir.resolve("gone.c").toString()}, loader))
                .hasMessageContaining("Input not found");
        assertThatThrownBy(() -> CfgMetricsCLI.parseArgs(
                args("-o", tempDir.resolve("missing/out.json").toString()), loader))
                .hasMessageContaining("Output directory does not exist");
    }

    @Test
    void shouldAdjustOutputExtensionToFormat() {
        assertThat(CfgMetricsCLI.withFormatExtension("out.json", OutputFormat.MARKDOWN)).isEqualTo("out.md");
        assertThat(CfgMetricsCLI.withFormatExtension("out", OutputFormat.JSONL)).isEqualTo("out.jsonl");
        assertThat(CfgMetricsCLI.withFormatExtension("reports/out.md", OutputFormat.BOTH)).isEqualTo("reports/out.json");
        assertThat(CfgMetricsCLI.removeFileExtension("dir.v2/report")).isEqualTo("dir.v2/report");
        assertThat(CfgMetricsCLI.removeFileExtension(".hidden")).isEqualTo(".hidden");
    }

    @Test
    void shouldWriteJsonReportAndExitCleanly() throws IOException {
        // Given
        Path output = tempDir.resolve("report.json");

        // When
        int exitCode = CfgMetricsCLI.run(args("-o", output.toString()), loader);

        // Then
        assertThat(exitCode).isEqualTo(CfgMetricsCLI.EXIT_OK);
        JsonNode root = new ObjectMapper().readTree(output.toFile());
        assertThat(root.get("metadata").get("functions_found").asInt()).isEqualTo(2);
        assertThat(root.get("files").get(0).get("functions").get(0).get("cyclomatic_complexity").asInt()).isEqualTo(3);
    }

    @Test
    void shouldWriteBothReports() throws IOException {
        // Given
        Path output = tempDir.resolve("report.json");

        // When
        int exitCode = CfgMetricsCLI.run(args("-o", output.toString(), "-f", "both", "--mermaid"), loader);

        // Then
        assertThat(exitCode).isEqualTo(CfgMetricsCLI.EXIT_OK);
        assertThat(tempDir.resolve("report.json")).exists();
        assertThat(Files.readString(tempDir.resolve("report.md"))).contains("```mermaid");
    }

    @Test
    void shouldExitWithThresholdCodeWhenComplexityExceeded() {
        int exitCode = CfgMetricsCLI.run(
                args("-o", tempDir.resolve("r.json").toString(), "--fail-over", "2"), loader);

        assertThat(exitCode).isEqualTo(CfgMetricsCLI.EXIT_THRESHOLD_EXCEEDED);
    }

    @Test
    void shouldPassWhenComplexityWithinLimit() {
        int exitCode = CfgMetricsCLI.run(
                args("-o", tempDir.resolve("r.json").toString(), "--fail-over", "3"), loader);

        assertThat(exitCode).isEqualTo(CfgMetricsCLI.EXIT_OK);
    }

    @Test
    void shouldReturnErrorCodeForConfigurationProblems() {
        assertThat(CfgMetricsCLI.run(new String[0], loader)).isEqualTo(CfgMetricsCLI.EXIT_ERROR);
        assertThat(CfgMetricsCLI.run(args("--profile", "nonexistent"), loader)).isEqualTo(CfgMetricsCLI.EXIT_ERROR);
        assertThat(CfgMetricsCLI.run(new String[]{"--help"}, loader)).isEqualTo(CfgMetricsCLI.EXIT_OK);
    }
}
